package com.gs.ep.pagetranslator.translate;

import com.gs.ep.pagetranslator.model.Chunk;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

/**
 * Splits text into chunks of at most {@code maxChars} characters on paragraph, then sentence
 * boundaries. A single sentence longer than the limit is emitted whole.
 */
public final class Chunker {

    public static final int DEFAULT_MAX_CHARS = 4500;

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile(Pattern.quote(Chunk.PARAGRAPH_JOINER));
    private static final Pattern SENTENCE_BREAK = Pattern.compile(Pattern.quote(Chunk.SENTENCE_JOINER));

    private Chunker() {
    }

    public static Iterator<String> chunk(String text, int maxChars) {
        Iterator<Chunk> chunks = chunks(0, text, maxChars);
        return new Iterator<String>() {
            @Override
            public boolean hasNext() {
                return chunks.hasNext();
            }

            @Override
            public String next() {
                return chunks.next().getText();
            }
        };
    }

    /**
     * Lazily chunks {@code text}; the iterator can be consumed once.
     */
    public static Iterator<Chunk> chunks(int unitIndex, String text, int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive, got " + maxChars);
        }
        return new ChunkIterator(unitIndex, text == null ? "" : text, maxChars);
    }

    /**
     * Joins translated chunk texts back together with the separators their source chunks had.
     */
    public static String reassemble(List<Chunk> chunks, List<String> texts) {
        if (chunks.size() != texts.size()) {
            throw new IllegalArgumentException("Got " + texts.size() + " texts for " + chunks.size() + " chunks");
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            sb.append(chunks.get(i).getJoiner()).append(texts.get(i));
        }
        return sb.toString();
    }

    private static final class Piece {
        final String joiner;
        final String text;

        Piece(String joiner, String text) {
            this.joiner = joiner;
            this.text = text;
        }
    }

    private static final class ChunkIterator implements Iterator<Chunk> {
        private final int unitIndex;
        private final int maxChars;
        private final String[] paragraphs;
        private int paragraphIndex;
        private String[] sentences;
        private int sentenceIndex;
        private boolean sentenceEmitted;
        private Piece pending;
        private int ordinal;

        ChunkIterator(int unitIndex, String text, int maxChars) {
            this.unitIndex = unitIndex;
            this.maxChars = maxChars;
            this.paragraphs = PARAGRAPH_BREAK.split(text, -1);
        }

        @Override
        public boolean hasNext() {
            if (pending == null) {
                pending = nextPiece();
            }
            return pending != null;
        }

        @Override
        public Chunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String joiner = ordinal == 0 ? "" : pending.joiner;
            StringBuilder buffer = new StringBuilder(pending.text);
            pending = null;
            Piece piece;
            while ((piece = nextPiece()) != null) {
                if (buffer.length() + piece.joiner.length() + piece.text.length() > maxChars) {
                    pending = piece;
                    break;
                }
                buffer.append(piece.joiner).append(piece.text);
            }
            return new Chunk(unitIndex, ordinal++, buffer.toString(), joiner);
        }

        /**
         * Next non-blank paragraph, or sentence of an oversized paragraph, with the separator
         * that preceded it.
         */
        private Piece nextPiece() {
            while (true) {
                if (sentences != null) {
                    while (sentenceIndex < sentences.length) {
                        String sentence = sentences[sentenceIndex++];
                        if (!sentence.trim().isEmpty()) {
                            String joiner = sentenceEmitted ? Chunk.SENTENCE_JOINER : Chunk.PARAGRAPH_JOINER;
                            sentenceEmitted = true;
                            return new Piece(joiner, sentence);
                        }
                    }
                    sentences = null;
                }
                if (paragraphIndex >= paragraphs.length) {
                    return null;
                }
                String paragraph = paragraphs[paragraphIndex++];
                if (paragraph.trim().isEmpty()) {
                    continue;
                }
                if (paragraph.length() <= maxChars) {
                    return new Piece(Chunk.PARAGRAPH_JOINER, paragraph);
                }
                sentences = SENTENCE_BREAK.split(paragraph, -1);
                sentenceIndex = 0;
                sentenceEmitted = false;
            }
        }
    }
}
