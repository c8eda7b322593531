package com.rankfusion.query.index;

import com.rankfusion.ranking.model.Candidate;

import java.util.List;
import java.util.Optional;

/**
 * Read side of a record index. Only dense search is mandatory; stores without full-text or
 * native hybrid support keep the defaults, which report the capability as absent.
 */
public interface SearchIndex {

    /**
     * Nearest records to {@code vector}, closest first, each with its distance set.
     */
    List<Candidate> vectorSearch(float[] vector, int limit);

    default Optional<List<Candidate>> lexicalSearch(String text, List<String> fields, int limit) {
        return Optional.empty();
    }

    default Optional<List<Candidate>> hybridSearch(String text, List<String> ftsColumns, int limit) {
        return Optional.empty();
    }
}
