package com.gs.ep.pagetranslator.translate;

import com.gs.ep.pagetranslator.model.DocumentReport;
import com.gs.ep.pagetranslator.model.PageRenderPlan;
import com.gs.ep.pagetranslator.model.PageState;
import com.gs.ep.pagetranslator.model.TextUnit;
import com.gs.ep.pagetranslator.model.document.DocumentOpener;
import com.gs.ep.pagetranslator.model.document.LayoutDocument;
import com.gs.ep.pagetranslator.model.document.LayoutPage;
import com.gs.ep.pagetranslator.model.renderer.PdfBoxDocument;
import com.gs.ep.pagetranslator.model.translation.TranslationService;
import org.eclipse.collections.api.list.ListIterable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Translates PDF documents page by page while preserving their layout: every text unit is
 * erased and redrawn, translated, inside its original region.
 */
public class PdfTranslator {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfTranslator.class);

    private final DocumentOpener opener;
    private final LayoutExtractor extractor;
    private final PipelineScheduler scheduler;
    private final RegionCompositor compositor;
    private final int concurrency;

    public PdfTranslator(DocumentOpener opener, LayoutExtractor extractor, PipelineScheduler scheduler,
                         RegionCompositor compositor, int concurrency) {
        this.opener = opener;
        this.extractor = extractor;
        this.scheduler = scheduler;
        this.compositor = compositor;
        this.concurrency = concurrency;
    }

    public static PdfTranslator create(TranslationConfig config) {
        return create(config, ProviderChainFactory.createService(config));
    }

    public static PdfTranslator create(TranslationConfig config, TranslationService translationService) {
        return new PdfTranslator(
                PdfBoxDocument.opener(config.getFontDirectory()),
                new LayoutExtractor(config.getGranularity(), config.getExtractionPadding()),
                new PipelineScheduler(translationService, config.getChunkMaxChars(), config.getPipelineTimeoutSeconds()),
                new RegionCompositor(config.getDefaultFontSize(), config.getMinFontSize()),
                config.getConcurrency());
    }

    /**
     * Translates {@code input} into {@code output}. Pages that fail are left untouched and
     * reported as {@link PageState#FAILED}.
     *
     * @throws IOException if the input cannot be opened or parsed, or the output cannot be saved
     */
    public DocumentReport translate(Path input, Path output) throws IOException {
        DocumentReport report = new DocumentReport();
        try (LayoutDocument document = opener.open(input)) {
            List<? extends LayoutPage> pages = document.pages();
            LOGGER.info("Translating {} ({} pages)", input, pages.size());
            for (LayoutPage page : pages) {
                report.recordPage(page.getPageIndex(), translatePage(page, report));
            }
            saveAtomically(document, output);
        }
        LOGGER.info("Wrote {}: {}", output, report);
        return report;
    }

    PageState translatePage(LayoutPage page, DocumentReport report) {
        int pageNumber = page.getPageIndex() + 1;
        if (page.getRotation() != 0) {
            LOGGER.warn("Page {}: rotated by {} degrees, left untranslated", pageNumber, page.getRotation());
            return PageState.SKIPPED;
        }
        PageState state = PageState.EXTRACTED;
        try {
            List<TextUnit> units = extractor.extract(page);
            if (units.isEmpty()) {
                LOGGER.info("Page {}: no text units, skipped", pageNumber);
                return PageState.SKIPPED;
            }
            LOGGER.info("Page {}: translating {} units", pageNumber, units.size());

            state = PageState.TRANSLATING;
            PipelineScheduler.Outcome outcome = scheduler.run(units, concurrency);

            state = PageState.COMPOSITING;
            PageRenderPlan plan = PageRenderPlan.of(page.getPageIndex(), units, outcome.getTranslations());
            ListIterable<RegionCompositor.Placement> placements = compositor.composite(page, plan);

            report.addUnits(units.size(), outcome.getFallbackUnitCount());
            LOGGER.info("Page {}: done, {} units, {} with fallback, {} shrunk, {} truncated, {} blank",
                    pageNumber, units.size(), outcome.getFallbackUnitCount(),
                    placements.count(RegionCompositor.Placement.SHRUNK::equals),
                    placements.count(RegionCompositor.Placement.TRUNCATED::equals),
                    placements.count(RegionCompositor.Placement.BLANK::equals));
            return PageState.DONE;
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Page {} failed while {}", pageNumber, state.getDisplayName(), e);
            return PageState.FAILED;
        }
    }

    /**
     * Saves next to {@code output} first, then renames over it, so a crash never leaves a
     * partially written file behind.
     */
    static void saveAtomically(LayoutDocument document, Path output) throws IOException {
        Path target = output.toAbsolutePath();
        Path directory = target.getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
        try {
            document.save(temp);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOGGER.debug("Atomic move not supported in {}, replacing {}", directory, target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
