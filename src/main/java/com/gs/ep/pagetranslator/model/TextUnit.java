package com.gs.ep.pagetranslator.model;

import java.util.Objects;

/**
 * One positioned, styled piece of translatable text extracted from a page.
 * Immutable once extracted.
 */
public final class TextUnit {
    public static final int BLACK = 0x000000;

    private final int pageIndex;
    private final BoundingBox boundingBox;
    private final String text;
    private final float fontSizeHint;
    private final int color;
    private final boolean bold;
    private final boolean italic;

    public TextUnit(int pageIndex, BoundingBox boundingBox, String text, float fontSizeHint, int color,
            boolean bold, boolean italic) {
        Objects.requireNonNull(boundingBox, "boundingBox");
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("Text unit on page " + pageIndex + " has no text");
        }
        if (boundingBox.isDegenerate()) {
            throw new IllegalArgumentException("Text unit on page " + pageIndex + " has a degenerate box " + boundingBox);
        }
        this.pageIndex = pageIndex;
        this.boundingBox = boundingBox;
        this.text = text;
        this.fontSizeHint = fontSizeHint;
        this.color = color & 0xFFFFFF;
        this.bold = bold;
        this.italic = italic;
    }

    public int getPageIndex() {
        return pageIndex;
    }

    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    public String getText() {
        return text;
    }

    /**
     * Font size of the source text in points, or {@code 0} when unknown.
     */
    public float getFontSizeHint() {
        return fontSizeHint;
    }

    /** Colour as {@code 0xRRGGBB}. */
    public int getColor() {
        return color;
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isItalic() {
        return italic;
    }

    public FontVariant fontVariant() {
        return FontVariant.of(bold, italic);
    }

    @Override
    public String toString() {
        String preview = text.length() > 30 ? text.substring(0, 30) + "..." : text;
        return "TextUnit{page=" + pageIndex + ", box=" + boundingBox + ", size=" + fontSizeHint
                + ", text='" + preview.replace("\n", " ") + "'}";
    }
}
