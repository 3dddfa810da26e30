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

import com.acme.evidence.util.TextUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Ordered list of (category, keywords) entries. Order is part of the contract:
 * classification returns the first entry with a matching keyword, so specific
 * categories must come before catch-alls.
 */
public final class TaxonomyTable<C> {

    public record Entry<C>(C category, List<String> keywords) {
        public Entry {
            keywords = List.copyOf(keywords);
        }
    }

    private final String name;
    private final List<Entry<C>> entries;

    private TaxonomyTable(String name, List<Entry<C>> entries) {
        this.name = name;
        this.entries = List.copyOf(entries);
    }

    public String name() { return name; }
    public List<Entry<C>> entries() { return entries; }
    public int size() { return entries.size(); }

    public List<C> categories() {
        List<C> out = new ArrayList<>(entries.size());
        for (Entry<C> e : entries) out.add(e.category());
        return out;
    }

    public static <C> Builder<C> builder(String name) { return new Builder<>(name); }

    public static final class Builder<C> {
        private final String name;
        private final List<Entry<C>> entries = new ArrayList<>();

        private Builder(String name) { this.name = name; }

        public Builder<C> entry(C category, String... keywords) {
            List<String> kws = new ArrayList<>(keywords.length);
            for (String k : Arrays.asList(keywords)) kws.add(TextUtil.lower(k));
            entries.add(new Entry<>(category, kws));
            return this;
        }

        public TaxonomyTable<C> build() { return new TaxonomyTable<>(name, entries); }
    }
}
