package com.gs.ep.pagetranslator.model.renderer;

import com.gs.ep.pagetranslator.model.BoundingBox;
import com.gs.ep.pagetranslator.model.FontVariant;
import com.gs.ep.pagetranslator.model.StyledRun;
import com.gs.ep.pagetranslator.model.document.LayoutPage;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link LayoutPage} backed by a PDFBox page.
 */
public class PdfBoxPage implements LayoutPage {
    private static final Logger LOGGER = LoggerFactory.getLogger(PdfBoxPage.class);

    private final PDDocument document;
    private final PDPage page;
    private final int pageIndex;
    private final FittedTextWriter textWriter;
    private final List<BoundingBox> pendingRedactions = new ArrayList<>();

    PdfBoxPage(PDDocument document, PDPage page, int pageIndex, FittedTextWriter textWriter) {
        this.document = document;
        this.page = page;
        this.pageIndex = pageIndex;
        this.textWriter = textWriter;
    }

    @Override
    public int getPageIndex() {
        return pageIndex;
    }

    @Override
    public double getWidth() {
        return page.getCropBox().getWidth();
    }

    @Override
    public double getHeight() {
        return page.getCropBox().getHeight();
    }

    @Override
    public int getRotation() {
        return Math.floorMod(page.getRotation(), 360);
    }

    @Override
    public List<StyledRun> styledRuns() throws IOException {
        return new StyledRunCollector().collect(document, pageIndex);
    }

    @Override
    public void redact(BoundingBox region) {
        pendingRedactions.add(region);
    }

    @Override
    public void applyRedactions() throws IOException {
        if (pendingRedactions.isEmpty()) {
            return;
        }
        int removed = new GlyphRedactor().redact(document, page, pendingRedactions);
        LOGGER.debug("Page {}: {} regions redacted, {} text operators removed", pageIndex + 1,
                pendingRedactions.size(), removed);
        pendingRedactions.clear();
    }

    @Override
    public boolean drawFittedText(BoundingBox region, String text, float fontSize, FontVariant variant, int color)
            throws IOException {
        return textWriter.draw(document, page, region, text, fontSize, variant, color);
    }
}
