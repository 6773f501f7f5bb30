package com.meditwin.ingestion.storage.graph;

import com.meditwin.ingestion.model.SeverityLevel;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Derives the current severity of an anatomical region from the recent events linked to it.
 *
 * Each event contributes its severity weight scaled by its confidence (floored at 0.5). Rules, first
 * match wins: any critical event or average >= 8 is critical; any severe event or average >= 6 is
 * severe; more than one moderate event or average >= 4 is moderate; more than three events or
 * average >= 2 is mild; any event at all is normal; no events is NA.
 */
@Component
public class SeverityCalculator {

    static final double MIN_CONFIDENCE = 0.5;

    public record EventSeverity(SeverityLevel severity, double confidence) {
    }

    public SeverityLevel calculate(List<EventSeverity> events) {
        if (events == null || events.isEmpty()) {
            return SeverityLevel.NA;
        }

        double total = 0;
        int moderateCount = 0;
        boolean anyCritical = false;
        boolean anySevere = false;
        for (EventSeverity event : events) {
            total += event.severity().weight() * Math.max(MIN_CONFIDENCE, event.confidence());
            anyCritical |= event.severity() == SeverityLevel.CRITICAL;
            anySevere |= event.severity() == SeverityLevel.SEVERE;
            if (event.severity() == SeverityLevel.MODERATE) {
                moderateCount++;
            }
        }
        double average = total / events.size();

        if (anyCritical || average >= 8) {
            return SeverityLevel.CRITICAL;
        }
        if (anySevere || average >= 6) {
            return SeverityLevel.SEVERE;
        }
        if (moderateCount > 1 || average >= 4) {
            return SeverityLevel.MODERATE;
        }
        if (events.size() > 3 || average >= 2) {
            return SeverityLevel.MILD;
        }
        return SeverityLevel.NORMAL;
    }
}
