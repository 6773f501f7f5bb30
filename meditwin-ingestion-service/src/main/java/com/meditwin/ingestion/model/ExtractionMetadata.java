package com.meditwin.ingestion.model;

/**
 * @param method "native" when every page with text used the text layer, "ocr" when every page with
 *               text needed recognition, "mixed" otherwise and "none" when nothing was found
 */
public record ExtractionMetadata(int pageCount, boolean hasNativeText, String method) {
}
