package com.listings.scraper.service.core;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text normalisation shared by query building and fuzzy matching.
 */
public final class TextCleaner {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TextCleaner() {
    }

    /**
     * Lower-cases, turns punctuation into spaces and collapses whitespace.
     *
     * @param text raw text, may be {@code null}
     * @return cleaned text, never {@code null}
     */
    public static String clean(final String text) {
        if (StringUtils.isBlank(text)) {
            return "";
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        return StringUtils.normalizeSpace(NON_ALPHANUMERIC.matcher(lowered).replaceAll(" "));
    }
}
