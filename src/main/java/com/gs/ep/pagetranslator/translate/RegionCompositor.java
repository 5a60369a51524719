package com.gs.ep.pagetranslator.translate;

import com.gs.ep.pagetranslator.model.BoundingBox;
import com.gs.ep.pagetranslator.model.PageRenderPlan;
import com.gs.ep.pagetranslator.model.TextUnit;
import com.gs.ep.pagetranslator.model.document.LayoutPage;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.tuple.Pair;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Replaces the text of a unit's region by its translation: erases the original glyphs, then
 * draws the translation wrapped into the same region, shrinking and finally truncating it
 * until it fits.
 */
public class RegionCompositor {

    private static final Logger LOGGER = LoggerFactory.getLogger(RegionCompositor.class);

    public static final float DEFAULT_FONT_SIZE = 12f;
    public static final float MIN_FONT_SIZE = 6f;
    static final String TRUNCATION_MARK = " …";
    static final int MIN_TRUNCATED_CHARS = 50;

    /**
     * How a translation ended up on the page.
     */
    public enum Placement {
        /** Blank translation; the original text was left alone. */
        SKIPPED,
        /** Drawn at the automatic size. */
        FITTED,
        /** Drawn at a size from the shrink ladder. */
        SHRUNK,
        /** Drawn shortened, at the minimum size. */
        TRUNCATED,
        /** Erased, but nothing could be drawn. */
        BLANK
    }

    private final float defaultFontSize;
    private final float minFontSize;

    public RegionCompositor() {
        this(DEFAULT_FONT_SIZE, MIN_FONT_SIZE);
    }

    public RegionCompositor(float defaultFontSize, float minFontSize) {
        if (minFontSize <= 0 || minFontSize > defaultFontSize) {
            throw new IllegalArgumentException("Invalid font size range " + minFontSize + ".." + defaultFontSize);
        }
        this.defaultFontSize = defaultFontSize;
        this.minFontSize = minFontSize;
    }

    public Placement composite(LayoutPage page, TextUnit unit, String translatedText) throws IOException {
        if (isBlank(translatedText)) {
            LOGGER.debug("Skipping unit with empty translation: {}", unit);
            return Placement.SKIPPED;
        }
        page.redact(unit.getBoundingBox());
        page.applyRedactions();
        return draw(page, unit, translatedText.trim());
    }

    /**
     * Composites a whole page with a single redaction pass.
     *
     * @return placement of each plan entry, in plan order
     */
    public ListIterable<Placement> composite(LayoutPage page, PageRenderPlan plan) throws IOException {
        ListIterable<Pair<TextUnit, String>> entries = plan.getEntries();
        boolean anyRedacted = false;
        for (Pair<TextUnit, String> entry : entries) {
            if (!isBlank(entry.getTwo())) {
                page.redact(entry.getOne().getBoundingBox());
                anyRedacted = true;
            }
        }
        if (anyRedacted) {
            page.applyRedactions();
        }
        MutableList<Placement> placements = Lists.mutable.empty();
        for (Pair<TextUnit, String> entry : entries) {
            placements.add(isBlank(entry.getTwo())
                    ? Placement.SKIPPED
                    : draw(page, entry.getOne(), entry.getTwo().trim()));
        }
        return placements;
    }

    private Placement draw(LayoutPage page, TextUnit unit, String text) throws IOException {
        BoundingBox box = unit.getBoundingBox();
        if (!page.drawFittedText(box, text, LayoutPage.AUTO_FONT_SIZE, unit.fontVariant(), unit.getColor())) {
            return Placement.FITTED;
        }
        float start = unit.getFontSizeHint() > 0 ? unit.getFontSizeHint() : defaultFontSize;
        for (float size = start; size > minFontSize; size -= 1f) {
            if (!page.drawFittedText(box, text, size, unit.fontVariant(), unit.getColor())) {
                return Placement.SHRUNK;
            }
        }
        if (!page.drawFittedText(box, text, minFontSize, unit.fontVariant(), unit.getColor())) {
            return Placement.SHRUNK;
        }

        int keep = Math.min(text.length(), Math.max(MIN_TRUNCATED_CHARS, text.length() / 4));
        while (keep > 0) {
            String truncated = truncate(text, keep);
            if (!truncated.trim().isEmpty()
                    && !page.drawFittedText(box, truncated, minFontSize, unit.fontVariant(), unit.getColor())) {
                LOGGER.warn("Truncated translation to {} of {} characters to fit {}", keep, text.length(), box);
                return Placement.TRUNCATED;
            }
            keep /= 2;
        }
        LOGGER.warn("Translation does not fit {} even truncated; region left blank", box);
        return Placement.BLANK;
    }

    static String truncate(String text, int keep) {
        int end = Math.min(keep, text.length());
        if (end > 0 && end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end).trim() + TRUNCATION_MARK;
    }

    private static boolean isBlank(String text) {
        return text == null || text.trim().isEmpty();
    }
}
