package com.meditwin.ingestion.extraction;

import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

import java.awt.image.BufferedImage;

/**
 * Tesseract-backed OCR through Tess4J. A fresh {@link Tesseract} handle is created per page because the
 * native API is not thread-safe.
 */
@Slf4j
public class TesseractOcrEngine implements OcrEngine {

    // Assume a single uniform block of text
    static final int PAGE_SEG_MODE_SINGLE_BLOCK = 6;

    private final String dataPath;
    private final String language;

    public TesseractOcrEngine(String dataPath, String language) {
        this.dataPath = dataPath;
        this.language = language;
    }

    @Override
    public String recognize(BufferedImage image) throws OcrException {
        ITesseract tesseract = new Tesseract();
        if (dataPath != null && !dataPath.isBlank()) {
            tesseract.setDatapath(dataPath);
        }
        tesseract.setLanguage(language);
        tesseract.setPageSegMode(PAGE_SEG_MODE_SINGLE_BLOCK);
        try {
            String text = tesseract.doOCR(image);
            return text == null ? "" : text;
        } catch (TesseractException e) {
            throw new OcrException("Tesseract failed to recognize page", e);
        }
    }

    @Override
    public String getEngineName() {
        return "Tesseract (" + language + ")";
    }
}
