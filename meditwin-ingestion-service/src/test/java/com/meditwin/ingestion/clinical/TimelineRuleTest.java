package com.meditwin.ingestion.clinical;

import com.meditwin.ingestion.model.TimelineEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimelineRuleTest {

    private final TimelineRule rule = new TimelineRule();

    @Test
    @DisplayName("Should describe each date with the sentence containing it")
    void extract_shouldUseSentence() {
        List<TimelineEvent> events = rule.extract(
                "Patient fell on 03/15/2024 while hiking. Seen again on 04/01/2024 for follow-up.");

        assertEquals(2, events.size());
        assertEquals("03/15/2024", events.get(0).date());
        assertEquals("Patient fell on 03/15/2024 while hiking", events.get(0).event());
        assertEquals("Seen again on 04/01/2024 for follow-up", events.get(1).event());
    }

    @Test
    @DisplayName("Should order by the literal date string rather than the calendar")
    void extract_shouldSortLexically() {
        List<TimelineEvent> events = rule.extract("Surgery on 9/15/2023 went well. Review on 10/01/2023 was normal.");

        assertEquals(List.of("10/01/2023", "9/15/2023"), events.stream().map(TimelineEvent::date).toList());
    }

    @Test
    @DisplayName("Should cap at 10 events")
    void extract_shouldCap() {
        StringBuilder text = new StringBuilder();
        for (int day = 12; day >= 1; day--) {
            text.append(String.format("Therapy session held on 01/%02d/2024.%n", day));
        }

        List<TimelineEvent> events = rule.extract(text.toString());

        assertEquals(TimelineRule.MAX_ENTRIES, events.size());
        assertEquals("01/01/2024", events.get(0).date());
    }
}
