package com.gs.ep.pagetranslator.translate;

import com.gs.ep.pagetranslator.model.Chunk;
import com.gs.ep.pagetranslator.model.TextUnit;
import com.gs.ep.pagetranslator.model.translation.ProviderResult;
import com.gs.ep.pagetranslator.model.translation.TranslationService;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Translates the text units of a page on a bounded worker pool. The i-th translation always
 * belongs to the i-th unit, whatever order the workers finish in. Chunks whose translation
 * fails are retried line by line; anything still untranslated keeps its source text, so no
 * translation error reaches the caller.
 */
public class PipelineScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineScheduler.class);
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final TranslationService translationService;
    private final int maxChars;
    private final long timeoutSeconds;

    public PipelineScheduler(TranslationService translationService) {
        this(translationService, Chunker.DEFAULT_MAX_CHARS, 0);
    }

    /**
     * @param timeoutSeconds deadline for one call of {@link #translateUnits}; 0 waits indefinitely
     */
    public PipelineScheduler(TranslationService translationService, int maxChars, long timeoutSeconds) {
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("timeoutSeconds must not be negative, got " + timeoutSeconds);
        }
        this.translationService = translationService;
        this.maxChars = maxChars;
        this.timeoutSeconds = timeoutSeconds;
    }

    public List<String> translateUnits(List<TextUnit> units, int concurrency) {
        return run(units, concurrency).getTranslations();
    }

    /**
     * Same as {@link #translateUnits} with per-job detail.
     */
    public Outcome run(List<TextUnit> units, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        MutableList<MutableList<Chunk>> chunksByUnit = Lists.mutable.empty();
        MutableList<TranslationJob> jobs = Lists.mutable.empty();
        for (int unitIndex = 0; unitIndex < units.size(); unitIndex++) {
            MutableList<Chunk> unitChunks = Lists.mutable.empty();
            Iterator<Chunk> chunks = Chunker.chunks(unitIndex, units.get(unitIndex).getText(), maxChars);
            while (chunks.hasNext()) {
                Chunk chunk = chunks.next();
                unitChunks.add(chunk);
                jobs.add(new TranslationJob(jobs.size(), chunk));
            }
            chunksByUnit.add(unitChunks);
        }

        AtomicReferenceArray<String> slots = new AtomicReferenceArray<>(jobs.size());
        AtomicInteger fallbackJobs = new AtomicInteger();
        MutableList<Callable<Void>> tasks = Lists.mutable.empty();
        for (TranslationJob job : jobs) {
            tasks.add(() -> {
                if (job.execute(translationService)) {
                    slots.set(job.getId(), job.getResult());
                } else {
                    LOGGER.warn("Chunk {} of unit {} failed after {} attempts ({}), falling back to line-level translation",
                            job.getChunk().getOrdinal(), job.getChunk().getSourceUnitIndex(), job.getAttemptsMade(),
                            job.getLastError());
                    fallbackJobs.incrementAndGet();
                    slots.set(job.getId(), translateLineByLine(job.getChunk().getText()));
                }
                return null;
            });
        }

        int timedOut = 0;
        boolean[] completed = new boolean[jobs.size()];
        if (!tasks.isEmpty()) {
            ExecutorService executor = Executors.newFixedThreadPool(Math.min(concurrency, tasks.size()),
                    workerThreadFactory());
            try {
                List<Future<Void>> futures = timeoutSeconds > 0
                        ? executor.invokeAll(tasks, timeoutSeconds, TimeUnit.SECONDS)
                        : executor.invokeAll(tasks);
                for (int i = 0; i < futures.size(); i++) {
                    completed[i] = awaitSlot(futures.get(i), jobs.get(i));
                    timedOut += futures.get(i).isCancelled() ? 1 : 0;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Interrupted while waiting for translations; untranslated chunks keep their source text");
            } finally {
                executor.shutdownNow();
            }
        }

        // cancelled workers may still write their slot; only completed jobs are read
        String[] results = new String[jobs.size()];
        boolean[] fellBack = new boolean[jobs.size()];
        for (int i = 0; i < jobs.size(); i++) {
            TranslationJob job = jobs.get(i);
            String result = completed[i] ? slots.get(i) : null;
            if (result == null) {
                results[i] = job.getChunk().getText();
                fellBack[i] = true;
            } else {
                results[i] = result;
                fellBack[i] = job.getState() != TranslationJob.State.SUCCEEDED;
            }
        }

        MutableList<String> translations = Lists.mutable.empty();
        int fallbackUnits = 0;
        int offset = 0;
        for (MutableList<Chunk> unitChunks : chunksByUnit) {
            MutableList<String> texts = Lists.mutable.empty();
            boolean unitFellBack = false;
            for (int i = 0; i < unitChunks.size(); i++) {
                texts.add(results[offset + i]);
                unitFellBack |= fellBack[offset + i];
            }
            translations.add(Chunker.reassemble(unitChunks, texts));
            fallbackUnits += unitFellBack ? 1 : 0;
            offset += unitChunks.size();
        }

        LOGGER.info("Translated {} units in {} chunks: {} fell back to line-level translation, {} timed out",
                units.size(), jobs.size(), fallbackJobs.get(), timedOut);
        return new Outcome(translations.toImmutable(), jobs.toImmutable(), fallbackUnits);
    }

    /**
     * @return {@code true} if the job ran to the end and its slot can be read
     */
    private static boolean awaitSlot(Future<Void> future, TranslationJob job) throws InterruptedException {
        try {
            future.get();
            return true;
        } catch (CancellationException e) {
            LOGGER.warn("Chunk {} of unit {} timed out; keeping its source text",
                    job.getChunk().getOrdinal(), job.getChunk().getSourceUnitIndex());
            return false;
        } catch (ExecutionException e) {
            LOGGER.error("Chunk {} of unit {} failed unexpectedly; keeping its source text",
                    job.getChunk().getOrdinal(), job.getChunk().getSourceUnitIndex(), e.getCause());
            return false;
        }
    }

    /**
     * One sweep per non-blank line; a line no provider translates keeps its source text.
     */
    String translateLineByLine(String text) {
        MutableList<String> lines = Lists.mutable.empty();
        for (String line : text.split(Chunk.LINE_JOINER)) {
            if (line.trim().isEmpty()) {
                continue;
            }
            ProviderResult result = translationService.sweep(line);
            lines.add(result.isSuccess() ? result.getText() : line);
        }
        String merged = lines.makeString(Chunk.LINE_JOINER);
        return merged.trim().isEmpty() ? text : merged;
    }

    private static ThreadFactory workerThreadFactory() {
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadNumber = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "translate-" + pool + "-worker-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static final class Outcome {
        private final ImmutableList<String> translations;
        private final ImmutableList<TranslationJob> jobs;
        private final int fallbackUnitCount;

        Outcome(ImmutableList<String> translations, ImmutableList<TranslationJob> jobs, int fallbackUnitCount) {
            this.translations = translations;
            this.jobs = jobs;
            this.fallbackUnitCount = fallbackUnitCount;
        }

        public List<String> getTranslations() {
            return translations.castToList();
        }

        public ListIterable<TranslationJob> getJobs() {
            return jobs;
        }

        /**
         * Units with at least one chunk that was not translated as a whole.
         */
        public int getFallbackUnitCount() {
            return fallbackUnitCount;
        }
    }
}
