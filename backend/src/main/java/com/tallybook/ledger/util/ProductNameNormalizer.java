package com.tallybook.ledger.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a free-text product label into the key used for catalog lookups.
 * The result is stable under re-normalization.
 */
public class ProductNameNormalizer {

    private static final Pattern BRACKETED = Pattern.compile("[(（].*?[)）]", Pattern.DOTALL);

    // weight and packaging units, matched only as standalone words
    private static final Pattern UNITS = Pattern.compile(
            "(?<!\\w)(?:千克|公斤|kg|g|斤|箱|袋|包|克)(?!\\w)", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern PUNCTUATION = Pattern.compile(
            "[^\\w\\s()（）\\p{IsHan}]", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private ProductNameNormalizer() {}

    public static String normalize(String name) {
        if (name == null || name.isEmpty()) return "";
        String s = name.trim().toLowerCase(Locale.ROOT);
        s = BRACKETED.matcher(s).replaceAll("");
        s = UNITS.matcher(s).replaceAll("");
        s = PUNCTUATION.matcher(s).replaceAll(" ");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }
}
