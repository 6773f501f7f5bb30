package com.meditwin.ingestion.clinical;

import com.meditwin.ingestion.model.MedicalCode;
import com.meditwin.ingestion.model.SourceRef;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ICD codes (123 or 123.4 after an "ICD..." label) and five-digit CPT codes.
 */
@Component
public class MedicalCodeRule implements ClinicalFactRule<MedicalCode> {

    private static final Pattern ICD = Pattern.compile(
            "\\b(icd[^\\s:]*)\\s*:?\\s*(\\d{3}(?:\\.\\d+)?)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern CPT = Pattern.compile(
            "\\b(cpt)(?:\\s+code)?\\s*:?\\s*(\\d{5})\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public List<MedicalCode> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<MedicalCode> codes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        collect(text, ICD, MedicalCode.CodeSystem.ICD, "ICD Code: ", codes, seen);
        collect(text, CPT, MedicalCode.CodeSystem.CPT, "CPT Code: ", codes, seen);
        codes.sort(Comparator.comparingInt(code -> code.source().start()));
        return codes;
    }

    private static void collect(String text, Pattern pattern, MedicalCode.CodeSystem system, String label,
            List<MedicalCode> codes, Set<String> seen) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String code = matcher.group(2);
            if (seen.add(system + ":" + code)) {
                SourceRef source = new SourceRef(matcher.start(), matcher.end(), matcher.group());
                codes.add(new MedicalCode(system, code, label + code, source));
            }
        }
    }

    @Override
    public String category() {
        return "medical_codes";
    }
}
