package com.meditwin.ingestion.config;

import com.meditwin.ingestion.clinical.AnatomyVocabulary;
import com.meditwin.ingestion.extraction.OcrEngine;
import com.meditwin.ingestion.extraction.TesseractOcrEngine;
import com.meditwin.ingestion.storage.BackendType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared pipeline infrastructure: the worker pools for OCR pages and backend writes, the OCR engine and
 * the anatomical vocabulary.
 *
 * OCR and storage get separate pools so a hung OCR call can never hold up backend writes. Both are
 * sized from the number of documents in flight: the background workers plus one synchronous request.
 */
@Slf4j
@Configuration
public class PipelineConfig {

    @Bean(name = "ocrExecutor", destroyMethod = "shutdownNow")
    public ExecutorService ocrExecutor(
            @Value("${meditwin.ingestion.max-concurrent-documents:3}") int maxConcurrentDocuments) {
        int threads = maxConcurrentDocuments + 1;
        log.info("OCR pool: {} threads", threads);
        return Executors.newFixedThreadPool(threads, namedDaemonThreads("ocr-"));
    }

    @Bean(name = "storageExecutor", destroyMethod = "shutdownNow")
    public ExecutorService storageExecutor(
            @Value("${meditwin.ingestion.max-concurrent-documents:3}") int maxConcurrentDocuments) {
        int threads = (maxConcurrentDocuments + 1) * BackendType.values().length;
        log.info("Storage pool: {} threads", threads);
        return Executors.newFixedThreadPool(threads, namedDaemonThreads("storage-"));
    }

    @Bean
    public OcrEngine ocrEngine(
            @Value("${meditwin.ocr.tessdata-path:}") String tessdataPath,
            @Value("${meditwin.ocr.language:eng}") String language) {
        OcrEngine engine = new TesseractOcrEngine(tessdataPath, language);
        log.info("OCR engine: {} ({})", engine.getEngineName(), language);
        return engine;
    }

    /**
     * Regions come from 'meditwin.anatomy.regions' (comma separated) when set, else the built-in list.
     */
    @Bean
    public AnatomyVocabulary anatomyVocabulary(@Value("${meditwin.anatomy.regions:}") String regions) {
        if (regions == null || regions.isBlank()) {
            return AnatomyVocabulary.defaults();
        }
        List<String> configured = Arrays.stream(regions.split(","))
                .map(String::trim)
                .filter(region -> !region.isEmpty())
                .toList();
        log.info("Anatomy vocabulary: {} configured regions", configured.size());
        return new AnatomyVocabulary(configured);
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
