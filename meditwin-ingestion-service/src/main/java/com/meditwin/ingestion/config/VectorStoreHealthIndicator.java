package com.meditwin.ingestion.config;

import com.meditwin.ingestion.storage.vector.PineconeVectorStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator HealthIndicator for vector store connectivity.
 * Included in GET /actuator/health as "vectorStore".
 */
@Slf4j
@Component("vectorStore")
public class VectorStoreHealthIndicator implements HealthIndicator {

    private final PineconeVectorStore vectorStore;

    public VectorStoreHealthIndicator(PineconeVectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    @Override
    public Health health() {
        try {
            if (vectorStore.testConnection()) {
                return Health.up()
                        .withDetails(vectorStore.getStats())
                        .build();
            }
            return Health.down()
                    .withDetail("error", "Unable to connect to Pinecone")
                    .build();
        } catch (Exception e) {
            log.error("Vector store health check failed: {}", e.getMessage());
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .build();
        }
    }
}
