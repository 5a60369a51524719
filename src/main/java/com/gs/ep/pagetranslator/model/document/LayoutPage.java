package com.gs.ep.pagetranslator.model.document;

import com.gs.ep.pagetranslator.model.BoundingBox;
import com.gs.ep.pagetranslator.model.FontVariant;
import com.gs.ep.pagetranslator.model.StyledRun;

import java.io.IOException;
import java.util.List;

/**
 * One page of a document as seen by the translation pipeline.
 */
public interface LayoutPage {

    /**
     * Font size value asking {@link #drawFittedText} to pick the size itself.
     */
    float AUTO_FONT_SIZE = 0f;

    int getPageIndex();

    double getWidth();

    double getHeight();

    /**
     * Clockwise display rotation in degrees: 0, 90, 180 or 270.
     */
    int getRotation();

    /**
     * Styled text runs in paint order.
     */
    List<StyledRun> styledRuns() throws IOException;

    /**
     * Marks the glyphs inside {@code region} for erasure. Nothing changes until
     * {@link #applyRedactions()}; no fill is painted, so content under the glyphs survives.
     */
    void redact(BoundingBox region);

    void applyRedactions() throws IOException;

    /**
     * Draws {@code text} wrapped inside {@code region}. Nothing is drawn when the text does
     * not fit.
     *
     * @param fontSize point size, or {@link #AUTO_FONT_SIZE}
     * @param color    {@code 0xRRGGBB}
     * @return {@code true} if the text overflowed the region
     */
    boolean drawFittedText(BoundingBox region, String text, float fontSize, FontVariant variant, int color)
            throws IOException;
}
