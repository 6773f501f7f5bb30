package com.meditwin.ingestion.clinical;

import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.Diagnosis;
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
 * Diagnoses from labelled lines ("Diagnosis:", "Impression:", "Assessment:", "ICD-10:"). A numeric code
 * of the form 123 or 123.4 is split off; what is left, minus digits and punctuation, is the name.
 */
@Component
public class DiagnosisRule implements ClinicalFactRule<Diagnosis> {

    static final int MAX_ENTRIES = 5;
    static final String DEFAULT_STATUS = "active";

    private static final List<Pattern> LINE_PATTERNS = List.of(
            Pattern.compile("\\bdiagnosis\\s*:\\s*([^\\n\\r]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bimpression\\s*:\\s*([^\\n\\r]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bassessment\\s*:\\s*([^\\n\\r]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bicd[^\\s:]*\\s*:\\s*([^\\n\\r]+)", Pattern.CASE_INSENSITIVE));

    private static final Pattern CODE = Pattern.compile("\\b\\d{3}(?:\\.\\d+)?\\b");
    private static final Pattern NON_NAME = Pattern.compile("[\\d\\p{Punct}]+");

    @Override
    public List<Diagnosis> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<Match> matches = new ArrayList<>();
        for (Pattern pattern : LINE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                matches.add(new Match(matcher.start(), matcher.end(), matcher.group(1)));
            }
        }
        matches.sort(Comparator.comparingInt(Match::start));

        List<Diagnosis> diagnoses = new ArrayList<>();
        Set<String> seenNames = new HashSet<>();
        for (Match match : matches) {
            Diagnosis diagnosis = toDiagnosis(text, match);
            if (diagnosis == null || !seenNames.add(diagnosis.name().toLowerCase(Locale.ROOT))) {
                continue;
            }
            diagnoses.add(diagnosis);
            if (diagnoses.size() == MAX_ENTRIES) {
                break;
            }
        }
        return diagnoses;
    }

    private Diagnosis toDiagnosis(String text, Match match) {
        String line = match.value();
        Matcher codeMatcher = CODE.matcher(line);
        String code = ClinicalRecord.NOT_AVAILABLE;
        String remainder = line;
        if (codeMatcher.find()) {
            code = codeMatcher.group();
            remainder = line.substring(0, codeMatcher.start()) + " " + line.substring(codeMatcher.end());
        }

        String name = ClinicalPatterns.collapseWhitespace(NON_NAME.matcher(remainder).replaceAll(" "));
        if (name.length() <= 3) {
            return null;
        }
        SourceRef source = new SourceRef(match.start(), match.end(), ClinicalPatterns.collapseWhitespace(line));
        return new Diagnosis(name, code, ClinicalRecord.NOT_AVAILABLE, DEFAULT_STATUS, source);
    }

    @Override
    public String category() {
        return "diagnoses";
    }

    private record Match(int start, int end, String value) {
    }
}
