package com.meditwin.ingestion.clinical;

import java.util.List;

/**
 * One rule-based extractor for a single fact category. Rules are pure: no match yields an empty list,
 * never an error.
 *
 * @param <T> the fact type produced
 */
public interface ClinicalFactRule<T> {

    List<T> extract(String text);

    /** Category key used in stage details and summaries */
    String category();
}
