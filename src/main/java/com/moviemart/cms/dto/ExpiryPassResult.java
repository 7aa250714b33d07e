package com.moviemart.cms.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.moviemart.cms.model.ContentFamily;
import lombok.Getter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one expiry pass. Counts are serialized under each family's result key
 * ({@code videos}, {@code events}, {@code movies}); episode transitions are counted under {@code videos}.
 */
public class ExpiryPassResult {

    private final Map<ContentFamily, TransitionCounts> counts = new EnumMap<>(ContentFamily.class);

    @Getter
    private final List<String> errors = new ArrayList<>();

    public ExpiryPassResult() {
        for (ContentFamily family : ContentFamily.values()) {
            counts.put(family, new TransitionCounts());
        }
    }

    public TransitionCounts countsFor(ContentFamily family) {
        return counts.get(family);
    }

    @JsonAnyGetter
    public Map<String, TransitionCounts> getFamilyCounts() {
        Map<String, TransitionCounts> byKey = new LinkedHashMap<>();
        counts.forEach((family, familyCounts) -> byKey.put(family.getResultKey(), familyCounts));
        return byKey;
    }

    public void addError(String error) {
        errors.add(error);
    }

    public int totalTransitions() {
        return counts.values().stream()
                .mapToInt(familyCounts -> familyCounts.getHidden() + familyCounts.getDeleted())
                .sum();
    }

    @Override
    public String toString() {
        return "ExpiryPassResult(" + getFamilyCounts() + ", errors=" + errors + ")";
    }
}
