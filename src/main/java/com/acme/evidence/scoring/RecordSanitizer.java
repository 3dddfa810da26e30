/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.scoring;

import com.acme.evidence.model.EfficacyEndpoint;
import com.acme.evidence.model.EvidenceRecord;
import com.acme.evidence.model.Finding;
import com.acme.evidence.model.SafetyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Clamps implausible numbers on an incoming record: percentages to [0,100], negative
 * counts to 0, non-finite values to missing. Every change is reported as a WARN finding.
 */
final class RecordSanitizer {
    private static final Logger log = LoggerFactory.getLogger(RecordSanitizer.class);
    static final String CATEGORY = "input";

    private RecordSanitizer() {}

    static EvidenceRecord sanitize(EvidenceRecord r, List<Finding> findings) {
        String src = r.sourceId();
        Integer n = count(r.sampleSize(), "sample_size", src, findings);
        Double pct = percent(r.responderPercent(), "responder_percent", src, findings);

        List<EfficacyEndpoint> endpoints = new ArrayList<>(r.endpoints().size());
        for (EfficacyEndpoint ep : r.endpoints()) {
            String field = "endpoint[" + ep.name() + "]";
            endpoints.add(new EfficacyEndpoint(ep.name(), ep.category(),
                    count(ep.respondersCount(), field + ".responders_count", src, findings),
                    percent(ep.responderPercent(), field + ".responder_percent", src, findings),
                    ep.statisticallySignificant(), ep.pValue(),
                    finite(ep.percentChange(), field + ".percent_change", src, findings),
                    finite(ep.absoluteChange(), field + ".absolute_change", src, findings),
                    finite(ep.baselineValue(), field + ".baseline_value", src, findings),
                    ep.timepoint()));
        }

        List<SafetyEvent> events = new ArrayList<>(r.safetyEvents().size());
        for (SafetyEvent e : r.safetyEvents()) {
            events.add(new SafetyEvent(e.name(), e.serious(), e.grade(), e.relatedness(),
                    count(e.patientsAffected(), "safety[" + e.name() + "].patients_affected", src, findings)));
        }

        return new EvidenceRecord(r.sourceId(), r.drugName(), r.disease(), r.mechanismClass(), r.pathway(),
                n, pct, r.efficacySummary(), endpoints, events, r.publication());
    }

    private static Integer count(Integer v, String field, String src, List<Finding> findings) {
        if (v == null || v >= 0) return v;
        report(findings, src, field, v, 0, "negative count clamped to 0");
        return 0;
    }

    private static Double percent(Double v, String field, String src, List<Finding> findings) {
        if (v == null) return null;
        if (!Double.isFinite(v)) {
            report(findings, src, field, v, null, "non-finite percentage treated as missing");
            return null;
        }
        if (v < 0) {
            report(findings, src, field, v, 0.0, "percentage clamped to 0");
            return 0.0;
        }
        if (v > 100) {
            report(findings, src, field, v, 100.0, "percentage clamped to 100");
            return 100.0;
        }
        return v;
    }

    private static Double finite(Double v, String field, String src, List<Finding> findings) {
        if (v == null || Double.isFinite(v)) return v;
        report(findings, src, field, v, null, "non-finite value treated as missing");
        return null;
    }

    private static void report(List<Finding> findings, String src, String field, Object from, Object to, String what) {
        log.warn("Record {}: {} {} (was {})", src, field, what, from);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", field);
        details.put("original", String.valueOf(from));
        details.put("clamped", to);
        findings.add(Finding.warn(CATEGORY, field + ": " + what, details));
    }
}
