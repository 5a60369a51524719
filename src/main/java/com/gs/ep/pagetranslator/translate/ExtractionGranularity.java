package com.gs.ep.pagetranslator.translate;

import java.util.Locale;

/**
 * Size of the text units a page is cut into before translation.
 */
public enum ExtractionGranularity {
    /**
     * One unit per visual paragraph block.
     */
    BLOCK,
    /**
     * One unit per run of uniform styling within a line.
     */
    SPAN,
    /**
     * One unit per visual line.
     */
    LINE;

    public static ExtractionGranularity fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown extraction granularity: " + value, e);
        }
    }
}
