/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: Evidence Priority Engine
 */

package com.acme.evidence.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TextUtil {
    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");
    private static final Pattern YEARS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:years?|yrs?)");
    private static final Pattern MONTHS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:months?|mos?)\\b");
    private static final Pattern WEEKS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:weeks?|wks?)");
    private static final Pattern DAYS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*days?");

    private TextUtil() {}

    public static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }

    public static boolean isBlank(String s) { return s == null || s.isBlank(); }

    /** Cache key form of a disease name: lower case, punctuation folded to single spaces. */
    public static String normalizeKey(String s) {
        if (s == null) return "";
        return NON_WORD.matcher(lower(s)).replaceAll(" ").trim();
    }

    /**
     * Longest duration mentioned in free text, in months; {@code null} when nothing parses.
     * "18 months", "2 years", "52 weeks" and "90 days" are understood.
     */
    public static Double parseMonths(String text) {
        if (isBlank(text)) return null;
        String t = lower(text);
        Double best = null;
        best = max(best, largestNumber(YEARS.matcher(t)), 12.0);
        best = max(best, largestNumber(MONTHS.matcher(t)), 1.0);
        best = max(best, largestNumber(WEEKS.matcher(t)), 1.0 / 4.33);
        best = max(best, largestNumber(DAYS.matcher(t)), 1.0 / 30.4);
        return best;
    }

    private static Double largestNumber(Matcher m) {
        Double max = null;
        while (m.find()) {
            double v = Double.parseDouble(m.group(1));
            if (max == null || v > max) max = v;
        }
        return max;
    }

    private static Double max(Double current, Double candidate, double factor) {
        if (candidate == null) return current;
        double months = candidate * factor;
        return current == null ? months : Math.max(current, months);
    }
}
