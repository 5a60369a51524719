package com.gs.ep.pagetranslator.model;

/**
 * The four faces of the single typeface family used to redraw translated text.
 */
public enum FontVariant {
    REGULAR,
    BOLD,
    ITALIC,
    BOLD_ITALIC;

    public static FontVariant of(boolean bold, boolean italic) {
        if (bold && italic) {
            return BOLD_ITALIC;
        }
        if (bold) {
            return BOLD;
        }
        return italic ? ITALIC : REGULAR;
    }
}
