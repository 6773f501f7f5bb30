package com.meditwin.ingestion.clinical;

import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.Procedure;
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
 * Procedures: a procedure keyword followed by free text on the same line.
 */
@Component
public class ProcedureRule implements ClinicalFactRule<Procedure> {

    static final int MAX_ENTRIES = 5;

    static final List<String> PROCEDURE_KEYWORDS = List.of(
            "surgery", "procedure", "treatment", "therapy", "injection", "examination", "test",
            "scan", "x-ray", "mri", "ct", "ultrasound");

    private static final Pattern PROCEDURE_LINE = Pattern.compile(
            "\\b(" + String.join("|", PROCEDURE_KEYWORDS.stream().map(Pattern::quote).toList())
                    + ")\\b\\s*:?\\s*([^\\n\\r]+)",
            Pattern.CASE_INSENSITIVE);

    @Override
    public List<Procedure> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<Procedure> procedures = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Matcher matcher = PROCEDURE_LINE.matcher(text);
        while (matcher.find() && procedures.size() < MAX_ENTRIES) {
            String detail = ClinicalPatterns.collapseWhitespace(matcher.group(2));
            if (detail.length() < 3) {
                continue;
            }
            String keyword = matcher.group(1).toLowerCase(Locale.ROOT);
            String name = displayKeyword(keyword) + ": " + detail;
            if (!seen.add(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            SourceRef source = new SourceRef(matcher.start(), matcher.end(), detail);
            procedures.add(new Procedure(name, ClinicalPatterns.firstDateToken(detail),
                    ClinicalRecord.NOT_AVAILABLE, source));
        }
        procedures.sort(Comparator.comparingInt(procedure -> procedure.source().start()));
        return procedures;
    }

    private static String displayKeyword(String keyword) {
        return switch (keyword) {
            case "mri", "ct" -> keyword.toUpperCase(Locale.ROOT);
            case "x-ray" -> "X-Ray";
            default -> ClinicalPatterns.capitalize(keyword);
        };
    }

    @Override
    public String category() {
        return "procedures";
    }
}
