package com.meditwin.ingestion.clinical;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The fixed set of anatomical regions facts can be attached to. "General" is not part of the
 * vocabulary; it is the fallback region for events without a recognizable location.
 */
public class AnatomyVocabulary {

    public static final String GENERAL_REGION = "General";

    public static final List<String> DEFAULT_REGIONS = List.of(
            "Head", "Brain", "Left Eye", "Right Eye", "Left Ear", "Right Ear", "Nose", "Mouth", "Neck",
            "Heart", "Left Lung", "Right Lung", "Liver", "Stomach", "Pancreas", "Spleen",
            "Left Kidney", "Right Kidney", "Spine", "Left Shoulder", "Right Shoulder",
            "Left Arm", "Right Arm", "Left Hand", "Right Hand", "Pelvis", "Left Hip", "Right Hip",
            "Left Leg", "Right Leg", "Left Knee", "Right Knee", "Left Foot", "Right Foot",
            "Left Ankle", "Right Ankle", "Skin");

    private final List<String> regions;

    public AnatomyVocabulary(List<String> regions) {
        if (regions == null || regions.isEmpty()) {
            throw new IllegalArgumentException("Anatomy vocabulary must not be empty");
        }
        this.regions = List.copyOf(regions);
    }

    public static AnatomyVocabulary defaults() {
        return new AnatomyVocabulary(DEFAULT_REGIONS);
    }

    public List<String> regions() {
        return regions;
    }

    /** First vocabulary region named in the text, matched on whole words */
    public Optional<String> findRegion(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return regions.stream()
                .filter(region -> wordPattern(region).matcher(text).find())
                .findFirst();
    }

    public String regionOrGeneral(String text) {
        return findRegion(text).orElse(GENERAL_REGION);
    }

    static Pattern wordPattern(String region) {
        return Pattern.compile("\\b" + Pattern.quote(region.toLowerCase(Locale.ROOT)) + "\\b",
                Pattern.CASE_INSENSITIVE);
    }
}
