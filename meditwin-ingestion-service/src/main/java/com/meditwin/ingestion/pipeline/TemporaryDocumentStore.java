package com.meditwin.ingestion.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Working copies of uploads, one file per document at {tempDir}/{documentId}.pdf.
 */
@Slf4j
@Component
public class TemporaryDocumentStore {

    private final Path tempDir;

    public TemporaryDocumentStore(@Value("${meditwin.ingestion.temp-dir:${java.io.tmpdir}/meditwin}") String tempDir) {
        this.tempDir = Paths.get(tempDir);
    }

    public Path save(String documentId, MultipartFile file) {
        try (InputStream input = file.getInputStream()) {
            Files.createDirectories(tempDir);
            Path target = pathFor(documentId);
            Files.copy(input, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Saved upload for {} ({} bytes)", documentId, file.getSize());
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store uploaded document " + documentId, e);
        }
    }

    public Path pathFor(String documentId) {
        return tempDir.resolve(documentId + ".pdf");
    }

    /**
     * @return true when a file was removed
     */
    public boolean delete(Path path) {
        if (path == null) {
            return false;
        }
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", path.getFileName(), e.getMessage());
            return false;
        }
    }
}
