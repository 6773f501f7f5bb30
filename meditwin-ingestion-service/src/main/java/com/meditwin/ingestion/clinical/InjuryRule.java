package com.meditwin.ingestion.clinical;

import com.meditwin.ingestion.model.InjuryEvent;
import com.meditwin.ingestion.model.SeverityLevel;
import com.meditwin.ingestion.model.SourceRef;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Injuries: a region name and an injury keyword on the same line, within a short distance, in either
 * order. Severity comes from wording around the match. One entry is kept per (region, severity).
 */
@Component
public class InjuryRule implements ClinicalFactRule<InjuryEvent> {

    static final int MAX_ENTRIES = 10;
    static final int MAX_GAP = 80;
    static final int CONTEXT_BEFORE = 50;
    static final int CONTEXT_AFTER = 100;

    // Stems, so that "bruising", "injured" and "fractured" also match
    static final List<String> INJURY_KEYWORDS = List.of(
            "strain", "sprain", "tear", "fractur", "injur", "trauma", "pain", "swell", "inflam",
            "bruis", "contusion", "dislocat", "sublux", "lacerat", "abrasion");

    private static final List<String> SEVERE_WORDS = List.of("severe", "critical", "major");
    private static final List<String> MILD_WORDS = List.of("mild", "minor", "slight");

    private final AnatomyVocabulary vocabulary;
    private final List<RegionPattern> regionPatterns;

    public InjuryRule(AnatomyVocabulary vocabulary) {
        this.vocabulary = vocabulary;
        this.regionPatterns = compile(vocabulary);
    }

    @Override
    public List<InjuryEvent> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<Candidate> candidates = new ArrayList<>();
        for (RegionPattern regionPattern : regionPatterns) {
            Matcher matcher = regionPattern.pattern().matcher(text);
            while (matcher.find()) {
                candidates.add(new Candidate(regionPattern.region(), matcher.start(), matcher.end()));
            }
        }
        candidates.sort(Comparator.comparingInt(Candidate::start));

        List<InjuryEvent> injuries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Candidate candidate : candidates) {
            SourceRef source = SourceRef.of(text, candidate.start(), candidate.end(), CONTEXT_BEFORE, CONTEXT_AFTER);
            SeverityLevel severity = classifySeverity(source.context());
            if (!seen.add(candidate.region() + "|" + severity)) {
                continue;
            }
            String description = ClinicalPatterns.collapseWhitespace(
                    text.substring(candidate.start(), candidate.end()));
            injuries.add(new InjuryEvent(description, candidate.region(),
                    ClinicalPatterns.firstDateToken(source.context()), severity, source));
            if (injuries.size() == MAX_ENTRIES) {
                break;
            }
        }
        return injuries;
    }

    static SeverityLevel classifySeverity(String context) {
        String lower = context.toLowerCase(Locale.ROOT);
        if (SEVERE_WORDS.stream().anyMatch(lower::contains)) {
            return SeverityLevel.SEVERE;
        }
        if (MILD_WORDS.stream().anyMatch(lower::contains)) {
            return SeverityLevel.MILD;
        }
        return SeverityLevel.MODERATE;
    }

    @Override
    public String category() {
        return "injuries";
    }

    public AnatomyVocabulary getVocabulary() {
        return vocabulary;
    }

    private static List<RegionPattern> compile(AnatomyVocabulary vocabulary) {
        String keywords = "(?:" + String.join("|", INJURY_KEYWORDS) + ")\\w*";
        List<RegionPattern> patterns = new ArrayList<>();
        for (String region : vocabulary.regions()) {
            String part = "\\b" + Pattern.quote(region.toLowerCase(Locale.ROOT)) + "\\b";
            String gap = "[^\\n]{0," + MAX_GAP + "}?";
            String regex = part + gap + "\\b" + keywords + "|\\b" + keywords + gap + part;
            patterns.add(new RegionPattern(region, Pattern.compile(regex, Pattern.CASE_INSENSITIVE)));
        }
        return patterns;
    }

    private record RegionPattern(String region, Pattern pattern) {
    }

    private record Candidate(String region, int start, int end) {
    }
}
