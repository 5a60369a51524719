package com.gs.ep.pagetranslator.model;

/**
 * Processing state of one page. {@link #SKIPPED}, {@link #DONE} and {@link #FAILED} are
 * terminal; the state of one page never influences another.
 */
public enum PageState {

    /**
     * Text units have been read from the page.
     */
    EXTRACTED("extracted", false),

    /**
     * The page is left unmodified: it has no extractable text (image-only) or it is displayed
     * rotated.
     */
    SKIPPED("skipped", true),

    /**
     * Units are being translated by the worker pool.
     */
    TRANSLATING("translating", false),

    /**
     * Original glyphs are being erased and translated text drawn.
     */
    COMPOSITING("compositing", false),

    DONE("done", true),

    /**
     * Page-level I/O or parse problem; the rest of the document is still processed.
     */
    FAILED("failed", true);

    private final String displayName;
    private final boolean terminal;

    PageState(String displayName, boolean terminal) {
        this.displayName = displayName;
        this.terminal = terminal;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return terminal;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
