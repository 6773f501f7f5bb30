package com.meditwin.ingestion.extraction;

import java.awt.image.BufferedImage;

/**
 * Optical character recognition over a rasterized page.
 */
public interface OcrEngine {

    /**
     * @return recognized text, possibly empty, never null
     */
    String recognize(BufferedImage image) throws OcrException;

    String getEngineName();
}
