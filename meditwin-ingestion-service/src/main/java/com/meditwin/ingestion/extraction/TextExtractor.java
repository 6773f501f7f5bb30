package com.meditwin.ingestion.extraction;

import com.meditwin.ingestion.model.ExtractedText;
import com.meditwin.ingestion.model.ExtractionMetadata;
import com.meditwin.ingestion.model.ExtractionMethod;
import com.meditwin.ingestion.model.PageText;
import com.meditwin.ingestion.model.StageResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads a PDF page by page. Pages without a text layer are rasterized and passed through OCR, so a page
 * with recognizable text always contributes it to the full text.
 */
@Slf4j
@Component
public class TextExtractor {

    static final String PAGE_MARKER = "\n--- Page %d ---\n";
    static final String OCR_PAGE_MARKER = "\n--- Page %d (OCR) ---\n";

    private final OcrEngine ocrEngine;
    private final ExecutorService ocrExecutor;
    private final float renderDpi;
    private final long ocrTimeoutSeconds;

    public TextExtractor(OcrEngine ocrEngine,
            @Qualifier("ocrExecutor") ExecutorService ocrExecutor,
            @Value("${meditwin.ocr.render-dpi:144}") float renderDpi,
            @Value("${meditwin.timeouts.ocr-seconds:60}") long ocrTimeoutSeconds) {
        this.ocrEngine = ocrEngine;
        this.ocrExecutor = ocrExecutor;
        this.renderDpi = renderDpi;
        this.ocrTimeoutSeconds = ocrTimeoutSeconds;
    }

    /**
     * Fails only when the file cannot be opened or read. A document without any text is a successful,
     * empty extraction.
     */
    public StageResult<ExtractedText> extract(Path filePath) {
        try {
            List<PageText> pages = readPages(filePath);
            ExtractedText extracted = assemble(pages);

            log.info("   Extracted {} chars from {} page(s) via {}",
                    extracted.fullText().length(), pages.size(), extracted.metadata().method());

            return StageResult.success(extracted, Map.of(
                    "pageCount", extracted.metadata().pageCount(),
                    "textLength", extracted.fullText().length(),
                    "method", extracted.metadata().method()));

        } catch (ExtractionException e) {
            log.error("Text extraction failed: {}", e.getMessage());
            return StageResult.failed(e.getMessage());
        }
    }

    private List<PageText> readPages(Path filePath) throws ExtractionException {
        try (PDDocument document = PDDocument.load(filePath.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            PDFRenderer renderer = new PDFRenderer(document);
            int pageCount = document.getNumberOfPages();

            List<PageText> pages = new ArrayList<>(pageCount);
            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                String nativeText = stripper.getText(document);

                if (nativeText != null && !nativeText.isBlank()) {
                    pages.add(new PageText(pageNumber, nativeText.trim(), ExtractionMethod.NATIVE));
                    continue;
                }

                String ocrText = recognizePage(renderer, pageNumber);
                if (!ocrText.isBlank()) {
                    pages.add(new PageText(pageNumber, ocrText.trim(), ExtractionMethod.OCR));
                } else {
                    pages.add(new PageText(pageNumber, "", ExtractionMethod.NONE));
                }
            }
            return pages;

        } catch (IOException e) {
            throw new ExtractionException("Unable to read document " + filePath.getFileName(), e);
        }
    }

    /**
     * Rasterize one page and run OCR under the per-call timeout. A page OCR cannot read yields "".
     */
    private String recognizePage(PDFRenderer renderer, int pageNumber) throws IOException {
        BufferedImage image = renderer.renderImageWithDPI(pageNumber - 1, renderDpi, ImageType.RGB);
        Future<String> recognition = ocrExecutor.submit(() -> ocrEngine.recognize(image));
        try {
            String text = recognition.get(ocrTimeoutSeconds, TimeUnit.SECONDS);
            return text == null ? "" : text;
        } catch (TimeoutException e) {
            recognition.cancel(true);
            log.warn("   OCR timed out on page {} after {}s", pageNumber, ocrTimeoutSeconds);
            return "";
        } catch (ExecutionException e) {
            log.warn("   OCR failed on page {}: {}", pageNumber, e.getCause().getMessage());
            return "";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recognition.cancel(true);
            log.warn("   OCR interrupted on page {}", pageNumber);
            return "";
        }
    }

    private ExtractedText assemble(List<PageText> pages) {
        StringBuilder fullText = new StringBuilder();
        int nativePages = 0;
        int ocrPages = 0;

        for (PageText page : pages) {
            if (!page.hasText()) {
                continue;
            }
            if (page.method() == ExtractionMethod.NATIVE) {
                nativePages++;
                fullText.append(String.format(PAGE_MARKER, page.pageNumber()));
            } else {
                ocrPages++;
                fullText.append(String.format(OCR_PAGE_MARKER, page.pageNumber()));
            }
            fullText.append(page.text());
        }

        String method;
        if (nativePages == 0 && ocrPages == 0) {
            method = "none";
        } else if (ocrPages == 0) {
            method = "native";
        } else if (nativePages == 0) {
            method = "ocr";
        } else {
            method = "mixed";
        }

        ExtractionMetadata metadata = new ExtractionMetadata(pages.size(), nativePages > 0, method);
        return new ExtractedText(fullText.toString().trim(), pages, Map.of(), metadata);
    }
}
