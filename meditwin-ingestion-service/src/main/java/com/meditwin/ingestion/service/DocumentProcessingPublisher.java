package com.meditwin.ingestion.service;

import com.meditwin.common.config.RabbitMQConfig;
import com.meditwin.common.entity.ProcessingJob;
import com.meditwin.common.message.DocumentProcessingMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Service;

import java.util.Map;

@Slf4j
@Service
public class DocumentProcessingPublisher {

    private final RabbitTemplate rabbitTemplate;

    public DocumentProcessingPublisher(RabbitTemplate rabbitTemplate) {
        this.rabbitTemplate = rabbitTemplate;
    }

    /**
     * Queue document for background processing
     */
    public void queueForProcessing(ProcessingJob job, Map<String, String> metadata) {
        DocumentProcessingMessage message = DocumentProcessingMessage.from(job, metadata);

        rabbitTemplate.convertAndSend(
                RabbitMQConfig.MEDITWIN_EXCHANGE,
                RabbitMQConfig.DOCUMENT_INGEST_KEY,
                message
        );

        log.info("Queued document for processing: {}", job.getDocumentId());
    }
}
