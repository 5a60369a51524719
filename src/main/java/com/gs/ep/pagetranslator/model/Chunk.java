package com.gs.ep.pagetranslator.model;

/**
 * A provider-sized piece of a text unit. {@code joiner} is the separator that preceded the
 * chunk in the source text and is put back in front of its translation on reassembly.
 */
public final class Chunk {
    public static final String PARAGRAPH_JOINER = "\n\n";
    public static final String SENTENCE_JOINER = ". ";
    public static final String LINE_JOINER = "\n";

    private final int sourceUnitIndex;
    private final int ordinal;
    private final String text;
    private final String joiner;

    public Chunk(int sourceUnitIndex, int ordinal, String text, String joiner) {
        this.sourceUnitIndex = sourceUnitIndex;
        this.ordinal = ordinal;
        this.text = text;
        this.joiner = joiner == null ? "" : joiner;
    }

    public int getSourceUnitIndex() {
        return sourceUnitIndex;
    }

    public int getOrdinal() {
        return ordinal;
    }

    public String getText() {
        return text;
    }

    public String getJoiner() {
        return joiner;
    }

    @Override
    public String toString() {
        return "Chunk{unit=" + sourceUnitIndex + ", ordinal=" + ordinal + ", length=" + text.length() + "}";
    }
}
