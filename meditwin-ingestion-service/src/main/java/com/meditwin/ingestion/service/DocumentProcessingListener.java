package com.meditwin.ingestion.service;

import com.meditwin.common.config.RabbitMQConfig;
import com.meditwin.common.entity.ProcessingJob;
import com.meditwin.common.message.DocumentProcessingMessage;
import com.meditwin.ingestion.model.ProcessingResult;
import com.meditwin.ingestion.model.RawDocument;
import com.meditwin.ingestion.pipeline.DocumentProcessingWorker;
import com.meditwin.ingestion.pipeline.TemporaryDocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Background worker pool. The listener concurrency bounds how many documents are in flight at once.
 */
@Slf4j
@Service
public class DocumentProcessingListener {

    private final DocumentIngestionService ingestionService;
    private final DocumentProcessingWorker worker;
    private final TemporaryDocumentStore temporaryStore;

    public DocumentProcessingListener(DocumentIngestionService ingestionService,
            DocumentProcessingWorker worker,
            TemporaryDocumentStore temporaryStore) {
        this.ingestionService = ingestionService;
        this.worker = worker;
        this.temporaryStore = temporaryStore;
    }

    @RabbitListener(queues = RabbitMQConfig.DOCUMENT_INGESTION_QUEUE,
            concurrency = "${meditwin.ingestion.max-concurrent-documents:3}")
    public void processDocument(DocumentProcessingMessage message) {
        log.info("Received document {} ({})", message.documentId(), message.originalFilename());
        Path tempPath = Path.of(message.tempPath());

        Optional<ProcessingJob> claimed = ingestionService.claim(message.documentId());
        if (claimed.isEmpty()) {
            log.info("Skipping {}: cancelled or already started", message.documentId());
            temporaryStore.delete(tempPath);
            return;
        }

        ProcessingResult result = worker.run(
                RawDocument.forPatient(tempPath, message.documentId(), message.patientId(), message.metadata()));
        ingestionService.recordResult(claimed.get(), result);
        log.info("Document {} finished: {}", message.documentId(), result.finalState());
    }
}
