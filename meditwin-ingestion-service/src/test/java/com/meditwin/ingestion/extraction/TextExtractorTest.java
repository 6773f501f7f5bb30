package com.meditwin.ingestion.extraction;

import com.meditwin.ingestion.model.ExtractedText;
import com.meditwin.ingestion.model.ExtractionMethod;
import com.meditwin.ingestion.model.StageResult;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TextExtractor using PDFs generated on the fly and a mocked OCR engine.
 */
@ExtendWith(MockitoExtension.class)
class TextExtractorTest {

    @Mock
    private OcrEngine ocrEngine;

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private TextExtractor extractor;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        extractor = new TextExtractor(ocrEngine, executor, 36f, 5);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Native Text
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should read the text layer without calling OCR")
    void extract_shouldUseNativeText() throws Exception {
        Path pdf = writePdf("native.pdf", "Subjective: knee pain after a fall");

        StageResult<ExtractedText> result = extractor.extract(pdf);

        assertTrue(result.isSuccess());
        ExtractedText extracted = result.getPayload();
        assertTrue(extracted.fullText().startsWith("--- Page 1 ---"));
        assertTrue(extracted.fullText().contains("Subjective: knee pain after a fall"));
        assertEquals(ExtractionMethod.NATIVE, extracted.pages().get(0).method());
        assertEquals("native", extracted.metadata().method());
        assertTrue(extracted.metadata().hasNativeText());
        verifyNoInteractions(ocrEngine);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // OCR Fallback
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should substitute OCR output for a page without a text layer")
    void extract_shouldFallBackToOcr() throws Exception {
        Path pdf = writePdf("scanned.pdf", null);
        when(ocrEngine.recognize(any(BufferedImage.class))).thenReturn("Scanned progress note");

        StageResult<ExtractedText> result = extractor.extract(pdf);

        assertTrue(result.isSuccess());
        ExtractedText extracted = result.getPayload();
        assertEquals("--- Page 1 (OCR) ---\nScanned progress note", extracted.fullText());
        assertEquals(ExtractionMethod.OCR, extracted.pages().get(0).method());
        assertEquals("ocr", extracted.metadata().method());
        assertFalse(extracted.metadata().hasNativeText());
    }

    @Test
    @DisplayName("Should return an empty but successful extraction when OCR finds nothing")
    void extract_shouldReturnEmptyTextForBlankPage() throws Exception {
        Path pdf = writePdf("blank.pdf", null);
        when(ocrEngine.recognize(any(BufferedImage.class))).thenReturn("");

        StageResult<ExtractedText> result = extractor.extract(pdf);

        assertTrue(result.isSuccess());
        assertTrue(result.getPayload().isEmpty());
        assertEquals(ExtractionMethod.NONE, result.getPayload().pages().get(0).method());
        assertEquals("none", result.getPayload().metadata().method());
        assertEquals(0, result.getDetails().get("textLength"));
    }

    @Test
    @DisplayName("Should treat an OCR engine failure as an empty page")
    void extract_shouldSurviveOcrFailure() throws Exception {
        Path pdf = writePdf("broken-ocr.pdf", null);
        when(ocrEngine.recognize(any(BufferedImage.class)))
                .thenThrow(new OcrException("engine crashed", new IllegalStateException()));

        StageResult<ExtractedText> result = extractor.extract(pdf);

        assertTrue(result.isSuccess());
        assertTrue(result.getPayload().isEmpty());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Unreadable Files
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should fail when the file is not a readable PDF")
    void extract_shouldFailForUnreadableFile() throws IOException {
        Path notAPdf = Files.writeString(tempDir.resolve("garbage.pdf"), "definitely not a pdf");

        StageResult<ExtractedText> result = extractor.extract(notAPdf);

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("garbage.pdf"));
        assertNull(result.getPayload());
    }

    @Test
    @DisplayName("Should fail when the file does not exist")
    void extract_shouldFailForMissingFile() {
        StageResult<ExtractedText> result = extractor.extract(tempDir.resolve("missing.pdf"));

        assertFalse(result.isSuccess());
    }

    private Path writePdf(String name, String text) throws IOException {
        Path path = tempDir.resolve(name);
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            if (text != null) {
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(PDType1Font.HELVETICA, 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(text);
                    content.endText();
                }
            }
            document.save(path.toFile());
        }
        return path;
    }
}
