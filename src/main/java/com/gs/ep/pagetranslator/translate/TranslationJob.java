package com.gs.ep.pagetranslator.translate;

import com.gs.ep.pagetranslator.model.Chunk;
import com.gs.ep.pagetranslator.model.translation.ProviderError;
import com.gs.ep.pagetranslator.model.translation.TranslationException;
import com.gs.ep.pagetranslator.model.translation.TranslationService;

/**
 * Translation of one chunk. Executed once, on a single worker thread.
 */
public class TranslationJob {

    public enum State {
        PENDING,
        SUCCEEDED,
        FAILED
    }

    private final int id;
    private final Chunk chunk;
    private int attemptsMade;
    private State state = State.PENDING;
    private String result;
    private ProviderError lastError;

    public TranslationJob(int id, Chunk chunk) {
        this.id = id;
        this.chunk = chunk;
    }

    /**
     * @return {@code true} if the chunk was translated
     */
    boolean execute(TranslationService translationService) {
        if (state != State.PENDING) {
            throw new IllegalStateException("Job " + id + " already ran: " + state);
        }
        try {
            result = translationService.translate(chunk.getText(), providerResult -> attemptsMade++);
            state = State.SUCCEEDED;
        } catch (TranslationException e) {
            lastError = e.getLastError();
            state = State.FAILED;
        }
        return state == State.SUCCEEDED;
    }

    public int getId() {
        return id;
    }

    public Chunk getChunk() {
        return chunk;
    }

    public int getAttemptsMade() {
        return attemptsMade;
    }

    public State getState() {
        return state;
    }

    /**
     * Translated text; only set once {@link State#SUCCEEDED}.
     */
    public String getResult() {
        return result;
    }

    public ProviderError getLastError() {
        return lastError;
    }

    @Override
    public String toString() {
        return "TranslationJob{id=" + id + ", unit=" + chunk.getSourceUnitIndex() + ", ordinal=" + chunk.getOrdinal()
                + ", state=" + state + ", attempts=" + attemptsMade + '}';
    }
}
