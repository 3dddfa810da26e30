/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.taxonomy;

import com.acme.evidence.model.CategoryAssignment;
import com.acme.evidence.util.TextUtil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyword-membership classifier over a {@link TaxonomyTable}. First match wins.
 */
public final class TaxonomyClassifier {
    private TaxonomyClassifier() {}

    public static <C> Optional<CategoryAssignment<C>> classify(String label, TaxonomyTable<C> table) {
        if (TextUtil.isBlank(label)) return Optional.empty();
        String text = TextUtil.lower(label);
        for (TaxonomyTable.Entry<C> e : table.entries()) {
            for (String keyword : e.keywords()) {
                if (text.contains(keyword)) {
                    return Optional.of(new CategoryAssignment<>(label, e.category(), keyword));
                }
            }
        }
        return Optional.empty();
    }

    /** Classifies each label and groups the labels that matched by category, in table order. */
    public static <C> Map<C, List<CategoryAssignment<C>>> groupByCategory(List<String> labels, TaxonomyTable<C> table) {
        Map<C, List<CategoryAssignment<C>>> grouped = new LinkedHashMap<>();
        for (C c : table.categories()) grouped.put(c, new ArrayList<>());
        for (String label : labels) {
            classify(label, table).ifPresent(a -> grouped.get(a.category()).add(a));
        }
        grouped.values().removeIf(List::isEmpty);
        return grouped;
    }
}
