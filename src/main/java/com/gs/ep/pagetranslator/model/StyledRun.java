package com.gs.ep.pagetranslator.model;

/**
 * Raw run of uniformly styled text as reported by the document library. Runs carry the
 * number of the visual block and line they were found in so that the extractor can regroup
 * them at the granularity it is configured for.
 */
public final class StyledRun {
    private final int blockNumber;
    private final int lineNumber;
    private final String text;
    private final BoundingBox boundingBox;
    private final float fontSize;
    private final int color;
    private final String fontName;
    private final boolean bold;
    private final boolean italic;

    public StyledRun(int blockNumber, int lineNumber, String text, BoundingBox boundingBox, float fontSize,
            int color, String fontName, boolean bold, boolean italic) {
        this.blockNumber = blockNumber;
        this.lineNumber = lineNumber;
        this.text = text == null ? "" : text;
        this.boundingBox = boundingBox;
        this.fontSize = fontSize;
        this.color = color;
        this.fontName = fontName == null ? "" : fontName;
        this.bold = bold;
        this.italic = italic;
    }

    public int getBlockNumber() {
        return blockNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getText() {
        return text;
    }

    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    public float getFontSize() {
        return fontSize;
    }

    public int getColor() {
        return color;
    }

    public String getFontName() {
        return fontName;
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isItalic() {
        return italic;
    }

    public boolean sameStyleAs(StyledRun other) {
        return Math.abs(fontSize - other.fontSize) < 0.5f
                && color == other.color
                && bold == other.bold
                && italic == other.italic;
    }

    @Override
    public String toString() {
        return "StyledRun{block=" + blockNumber + ", line=" + lineNumber + ", text='" + text + "', box="
                + boundingBox + ", size=" + fontSize + ", font=" + fontName + "}";
    }
}
