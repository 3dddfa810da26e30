/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.lookup;

import com.acme.evidence.model.CategoryAssignment;
import com.acme.evidence.taxonomy.Taxonomies;
import com.acme.evidence.taxonomy.TaxonomyClassifier;
import com.acme.evidence.taxonomy.TaxonomyTable;
import com.acme.evidence.util.TextUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Hardcoded validated instruments for the diseases seen most often, plus the generic
 * instrument-quality taxonomy. This is the first tier of {@link InstrumentLookupStore}.
 */
public final class StaticInstrumentTable {

    /** One disease's instruments. Aliases and instrument names are compared in normalised form. */
    public record DiseaseInstruments(String key, List<String> aliases, Map<String, Double> instruments) {
        public DiseaseInstruments {
            aliases = List.copyOf(aliases);
            instruments = Collections.unmodifiableMap(new LinkedHashMap<>(instruments));
        }

        boolean matches(String normalizedDisease) {
            String padded = " " + normalizedDisease + " ";
            if (padded.contains(" " + TextUtil.normalizeKey(key) + " ")) return true;
            for (String a : aliases) {
                if (padded.contains(" " + TextUtil.normalizeKey(a) + " ")) return true;
            }
            return false;
        }
    }

    private final List<DiseaseInstruments> diseases;
    private final TaxonomyTable<Integer> generic;

    public StaticInstrumentTable(List<DiseaseInstruments> diseases, TaxonomyTable<Integer> generic) {
        this.diseases = List.copyOf(diseases);
        this.generic = generic;
    }

    public static StaticInstrumentTable defaults() {
        return new StaticInstrumentTable(DEFAULT_DISEASES, Taxonomies.INSTRUMENT_QUALITY);
    }

    public List<DiseaseInstruments> diseases() { return diseases; }

    /** Disease entry whose key or alias occurs as whole words in the disease name. Table order decides ties. */
    public Optional<DiseaseInstruments> forDisease(String disease) {
        String normalized = TextUtil.normalizeKey(disease);
        if (normalized.isEmpty()) return Optional.empty();
        for (DiseaseInstruments d : diseases) {
            if (d.matches(normalized)) return Optional.of(d);
        }
        return Optional.empty();
    }

    /**
     * Instruments named by the endpoint labels: disease-specific matches first (whole-word),
     * then the generic taxonomy keyword for labels still unmatched.
     */
    public Map<String, Double> match(String disease, Collection<String> endpointLabels) {
        Map<String, Double> out = new LinkedHashMap<>();
        List<String> unmatched = new ArrayList<>();
        Optional<DiseaseInstruments> entry = forDisease(disease);
        for (String label : endpointLabels) {
            if (TextUtil.isBlank(label)) continue;
            boolean hit = false;
            if (entry.isPresent()) {
                String padded = " " + TextUtil.normalizeKey(label) + " ";
                for (Map.Entry<String, Double> i : entry.get().instruments().entrySet()) {
                    if (padded.contains(" " + TextUtil.normalizeKey(i.getKey()) + " ")) {
                        out.putIfAbsent(i.getKey(), i.getValue());
                        hit = true;
                    }
                }
            }
            if (!hit) unmatched.add(label);
        }
        for (String label : unmatched) {
            Optional<CategoryAssignment<Integer>> a = TaxonomyClassifier.classify(label, generic);
            a.ifPresent(x -> out.putIfAbsent(x.matchedKeyword(), x.category().doubleValue()));
        }
        return out;
    }

    private static DiseaseInstruments disease(String key, String aliases, Object... pairs) {
        Map<String, Double> m = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            m.put((String) pairs[i], ((Number) pairs[i + 1]).doubleValue());
        }
        List<String> al = aliases.isEmpty() ? List.of() : Arrays.asList(aliases.split("\\|"));
        return new DiseaseInstruments(key, al, m);
    }

    // lupus nephritis precedes SLE and psoriatic arthritis precedes psoriasis: their aliases overlap
    static final List<DiseaseInstruments> DEFAULT_DISEASES = List.of(
            disease("lupus nephritis", "LN",
                    "Complete Renal Response", 10, "CRR", 10, "Partial Renal Response", 10, "PRR", 10,
                    "Overall Renal Response", 10, "Proteinuria", 9, "UPCR", 9, "eGFR", 9,
                    "Serum creatinine", 8, "Renal flare", 8),
            disease("systemic lupus erythematosus", "SLE|lupus",
                    "SLEDAI", 10, "SLEDAI-2K", 10, "SELENA-SLEDAI", 10, "BILAG", 10, "SRI-4", 10, "SRI-5", 9,
                    "BICLA", 10, "LLDAS", 9, "DORIS remission", 9, "SLICC/ACR Damage Index", 10, "CLASI", 9,
                    "CLASI-A", 9, "LupusQoL", 8, "PGA", 8, "SF-36", 8, "FACIT-Fatigue", 8),
            disease("psoriatic arthritis", "PsA",
                    "ACR20", 10, "ACR50", 10, "ACR70", 10, "PASI", 10, "PASI75", 10, "PASI90", 10, "MDA", 10,
                    "Minimal Disease Activity", 10, "DAPSA", 9, "PASDAS", 9, "HAQ-DI", 9, "LEI", 8,
                    "Dactylitis count", 8, "NAPSI", 8),
            disease("rheumatoid arthritis", "RA|rheumatoid",
                    "ACR20", 10, "ACR50", 10, "ACR70", 10, "DAS28-CRP", 10, "DAS28-ESR", 10, "DAS28", 10,
                    "CDAI", 9, "SDAI", 9, "Boolean remission", 9, "HAQ-DI", 10, "HAQ", 10, "mHAQ", 8,
                    "RAPID3", 8, "Sharp score", 9, "SJC28", 9, "TJC28", 9, "Patient Global", 8,
                    "Physician Global", 8, "EULAR response", 9, "ACR/EULAR remission", 10),
            disease("psoriasis", "plaque psoriasis",
                    "PASI", 10, "PASI75", 10, "PASI90", 10, "PASI100", 10, "IGA", 10, "IGA 0/1", 10, "sPGA", 10,
                    "BSA", 9, "DLQI", 9, "NAPSI", 8, "PSSI", 8, "Pruritus NRS", 8),
            disease("atopic dermatitis", "AD|eczema",
                    "EASI", 10, "EASI-50", 10, "EASI-75", 10, "EASI-90", 10, "IGA", 10, "vIGA-AD", 10,
                    "IGA 0/1", 10, "SCORAD", 9, "BSA", 9, "Peak Pruritus NRS", 10, "PP-NRS", 10, "DLQI", 9,
                    "POEM", 9),
            disease("alopecia areata", "AA|alopecia",
                    "SALT", 10, "SALT30", 10, "SALT50", 10, "SALT75", 10, "SALT90", 10, "Regrowth", 8,
                    "ClinRO", 9, "AA-IGA", 9),
            disease("ulcerative colitis", "UC",
                    "Mayo Score", 10, "Total Mayo", 10, "Partial Mayo", 9, "Endoscopic Mayo", 10,
                    "Clinical remission", 10, "Endoscopic remission", 10, "Mucosal healing", 10, "UCEIS", 9,
                    "Fecal calprotectin", 8, "IBDQ", 8),
            disease("crohns disease", "crohn|crohn s disease|CD",
                    "CDAI", 10, "CDAI-70", 10, "CDAI-100", 10, "CDAI remission", 10, "Harvey-Bradshaw Index", 9,
                    "HBI", 9, "SES-CD", 10, "Endoscopic remission", 10, "Mucosal healing", 10,
                    "Fistula closure", 9, "Fecal calprotectin", 8),
            disease("multiple sclerosis", "MS|RRMS",
                    "EDSS", 10, "ARR", 10, "Annualized Relapse Rate", 10, "NEDA", 10, "NEDA-3", 10,
                    "T2 lesion", 9, "Gd-enhancing lesion", 9, "Brain volume", 9, "MSFC", 9, "T25FW", 9,
                    "9HPT", 9, "SDMT", 8, "CDP", 9)
    );
}
