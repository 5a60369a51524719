package com.gs.ep.pagetranslator.translate;

import com.gs.ep.pagetranslator.model.Chunk;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class ChunkerTest {

    private static MutableList<Chunk> chunksOf(String text, int maxChars) {
        MutableList<Chunk> chunks = Lists.mutable.empty();
        Chunker.chunks(3, text, maxChars).forEachRemaining(chunks::add);
        return chunks;
    }

    private static String repeat(char c, int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            sb.append(c);
        }
        return sb.toString();
    }

    @Test
    void chunk_shortText_shouldYieldSingleChunk() {
        Iterator<String> chunks = Chunker.chunk("Hello world.\n\nSecond paragraph.", 4500);
        assertTrue(chunks.hasNext());
        assertEquals("Hello world.\n\nSecond paragraph.", chunks.next());
        assertFalse(chunks.hasNext());
        assertThrows(NoSuchElementException.class, chunks::next);
    }

    @Test
    void chunk_blankText_shouldYieldNothing() {
        assertFalse(Chunker.chunk("", 10).hasNext());
        assertFalse(Chunker.chunk(" \n\n  \n\n", 10).hasNext());
        assertFalse(Chunker.chunk(null, 10).hasNext());
    }

    @Test
    void chunks_paragraphsOverLimit_shouldSplitOnParagraphBoundaries() {
        String a = repeat('a', 30);
        String b = repeat('b', 30);
        String c = repeat('c', 30);
        MutableList<Chunk> chunks = chunksOf(a + "\n\n" + b + "\n\n" + c, 65);

        assertEquals(2, chunks.size());
        assertEquals(a + "\n\n" + b, chunks.get(0).getText());
        assertEquals("", chunks.get(0).getJoiner());
        assertEquals(c, chunks.get(1).getText());
        assertEquals(Chunk.PARAGRAPH_JOINER, chunks.get(1).getJoiner());
        assertEquals(0, chunks.get(0).getOrdinal());
        assertEquals(1, chunks.get(1).getOrdinal());
        assertTrue(chunks.allSatisfy(chunk -> chunk.getSourceUnitIndex() == 3));
    }

    @Test
    void chunks_longParagraph_shouldSplitOnSentencesWithSentenceJoiners() {
        String paragraph = repeat('x', 20) + ". " + repeat('y', 20) + ". " + repeat('z', 20);
        MutableList<Chunk> chunks = chunksOf(paragraph, 25);

        assertEquals(3, chunks.size());
        assertEquals(repeat('x', 20), chunks.get(0).getText());
        assertEquals(repeat('y', 20), chunks.get(1).getText());
        assertEquals(Chunk.SENTENCE_JOINER, chunks.get(1).getJoiner());
        assertEquals(repeat('z', 20), chunks.get(2).getText());
    }

    @Test
    void chunks_anyText_shouldRespectLimitUnlessSingleSentenceIsLonger() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 40; i++) {
            text.append("Sentence number ").append(i).append(" is here");
            text.append(i % 7 == 6 ? "\n\n" : ". ");
        }
        MutableList<Chunk> chunks = chunksOf(text.toString(), 60);
        assertTrue(chunks.size() > 1);
        for (Chunk chunk : chunks) {
            assertTrue(chunk.getText().length() <= 60, chunk.getText());
        }
    }

    @Test
    void chunks_oversizedSentence_shouldBeEmittedWhole() {
        String huge = repeat('w', 120);
        MutableList<Chunk> chunks = chunksOf("short. " + huge + ". tail", 50);

        assertEquals(Lists.mutable.with("short", huge, "tail"), chunks.collect(Chunk::getText));
    }

    @Test
    void reassemble_withSourceTexts_shouldRoundTripOriginal() {
        String text = "First paragraph is here.\n\n" + repeat('s', 40) + ". " + repeat('t', 40) + ". end\n\nLast one";
        MutableList<Chunk> chunks = chunksOf(text, 45);

        assertEquals(text, Chunker.reassemble(chunks, chunks.collect(Chunk::getText)));
    }

    @Test
    void reassemble_withTranslations_shouldReuseJoiners() {
        MutableList<Chunk> chunks = chunksOf(repeat('a', 10) + "\n\n" + repeat('b', 10), 12);

        assertEquals("A\n\nB", Chunker.reassemble(chunks, Lists.mutable.with("A", "B")));
    }

    @Test
    void reassemble_sizeMismatch_shouldThrow() {
        MutableList<Chunk> chunks = chunksOf("one", 10);
        assertThrows(IllegalArgumentException.class, () -> Chunker.reassemble(chunks, Lists.mutable.empty()));
    }

    @Test
    void chunks_nonPositiveLimit_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> Chunker.chunks(0, "text", 0));
    }
}
