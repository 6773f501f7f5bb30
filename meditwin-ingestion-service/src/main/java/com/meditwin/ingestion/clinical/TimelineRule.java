package com.meditwin.ingestion.clinical;

import com.meditwin.ingestion.model.TimelineEvent;
import com.meditwin.ingestion.model.SourceRef;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Timeline: every numeric date token with the sentence around it. Entries are ordered by the literal
 * date string (so 10/01/2023 sorts before 9/15/2023), which is the established behavior.
 */
@Component
public class TimelineRule implements ClinicalFactRule<TimelineEvent> {

    static final int MAX_ENTRIES = 10;
    static final int CONTEXT_BEFORE = 100;
    static final int CONTEXT_AFTER = 200;
    static final int MIN_EVENT_LENGTH = 10;

    @Override
    public List<TimelineEvent> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<TimelineEvent> events = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Matcher matcher = ClinicalPatterns.DATE_TOKEN.matcher(text);
        while (matcher.find()) {
            String date = matcher.group();
            SourceRef source = SourceRef.of(text, matcher.start(), matcher.end(), CONTEXT_BEFORE, CONTEXT_AFTER);
            String event = sentenceAround(text, matcher.start(), matcher.end());
            if (event.length() <= MIN_EVENT_LENGTH) {
                event = ClinicalPatterns.collapseWhitespace(source.context());
            }
            if (seen.add(date + "|" + event)) {
                events.add(new TimelineEvent(date, event, source));
            }
        }

        events.sort(Comparator.comparing(TimelineEvent::date));
        return events.size() > MAX_ENTRIES ? List.copyOf(events.subList(0, MAX_ENTRIES)) : events;
    }

    /** Sentence containing [start, end), bounded by . ! ? or a line break and by the context window */
    private static String sentenceAround(String text, int start, int end) {
        int windowStart = Math.max(0, start - CONTEXT_BEFORE);
        int windowEnd = Math.min(text.length(), end + CONTEXT_AFTER);

        int sentenceStart = windowStart;
        for (int i = start - 1; i >= windowStart; i--) {
            if (isBoundary(text.charAt(i))) {
                sentenceStart = i + 1;
                break;
            }
        }
        int sentenceEnd = windowEnd;
        for (int i = end; i < windowEnd; i++) {
            if (isBoundary(text.charAt(i))) {
                sentenceEnd = i;
                break;
            }
        }
        return ClinicalPatterns.collapseWhitespace(text.substring(sentenceStart, sentenceEnd));
    }

    private static boolean isBoundary(char c) {
        return c == '.' || c == '!' || c == '?' || c == '\n';
    }

    @Override
    public String category() {
        return "timeline";
    }
}
