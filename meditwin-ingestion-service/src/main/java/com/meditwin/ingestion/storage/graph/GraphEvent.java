package com.meditwin.ingestion.storage.graph;

import com.meditwin.ingestion.model.SeverityLevel;

/**
 * A medical event node about to be written, with the region it affects.
 */
record GraphEvent(
        String eventId,
        Kind kind,
        String description,
        String region,
        SeverityLevel severity,
        String eventDate
) {

    /** Event kinds and the relationship type linking each to its region */
    enum Kind {
        INJURY("INJURES", 0.9),
        DIAGNOSIS("DIAGNOSED_IN", 0.95),
        PROCEDURE("PERFORMED_ON", 0.9);

        private final String relationship;
        private final double confidence;

        Kind(String relationship, double confidence) {
            this.relationship = relationship;
            this.confidence = confidence;
        }

        String relationship() {
            return relationship;
        }

        double confidence() {
            return confidence;
        }
    }
}
