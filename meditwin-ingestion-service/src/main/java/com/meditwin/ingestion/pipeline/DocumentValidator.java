package com.meditwin.ingestion.pipeline;

import com.meditwin.common.entity.ProcessingJob.ProcessingMode;
import com.meditwin.common.exception.DocumentValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Upload checks applied before a document is accepted: supported extension, non-empty, and below the
 * size ceiling of the processing mode.
 */
@Component
public class DocumentValidator {

    private final List<String> supportedExtensions;
    private final DataSize maxSyncFileSize;
    private final DataSize maxBackgroundFileSize;

    public DocumentValidator(
            @Value("${meditwin.ingestion.supported-extensions:.pdf}") String supportedExtensions,
            @Value("${meditwin.ingestion.max-sync-file-size:10MB}") DataSize maxSyncFileSize,
            @Value("${meditwin.ingestion.max-background-file-size:50MB}") DataSize maxBackgroundFileSize) {
        this.supportedExtensions = Arrays.stream(supportedExtensions.split(","))
                .map(extension -> extension.trim().toLowerCase(Locale.ROOT))
                .filter(extension -> !extension.isEmpty())
                .toList();
        this.maxSyncFileSize = maxSyncFileSize;
        this.maxBackgroundFileSize = maxBackgroundFileSize;
    }

    public void validate(MultipartFile file, ProcessingMode mode) {
        if (file == null || file.isEmpty()) {
            throw new DocumentValidationException("File is empty");
        }
        validate(file.getOriginalFilename(), file.getSize(), mode);
    }

    public void validate(String filename, long size, ProcessingMode mode) {
        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        if (supportedExtensions.stream().noneMatch(name::endsWith)) {
            throw new DocumentValidationException(
                    "Unsupported file type. Supported: " + String.join(", ", supportedExtensions));
        }
        if (size <= 0) {
            throw new DocumentValidationException("File is empty");
        }
        DataSize ceiling = ceilingFor(mode);
        if (size > ceiling.toBytes()) {
            throw new DocumentValidationException(
                    "File exceeds the " + ceiling.toMegabytes() + " MB limit for " + describe(mode) + " processing");
        }
    }

    public DataSize ceilingFor(ProcessingMode mode) {
        return mode == ProcessingMode.BACKGROUND ? maxBackgroundFileSize : maxSyncFileSize;
    }

    private static String describe(ProcessingMode mode) {
        return mode == ProcessingMode.BACKGROUND ? "background" : "synchronous";
    }
}
