package com.gs.ep.pagetranslator.translate;

import com.gs.ep.pagetranslator.model.BoundingBox;
import com.gs.ep.pagetranslator.model.StyledRun;
import com.gs.ep.pagetranslator.model.TextUnit;
import com.gs.ep.pagetranslator.model.document.LayoutPage;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Turns a page's styled runs into translatable {@link TextUnit}s, in paint order.
 */
public class LayoutExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(LayoutExtractor.class);

    public static final float DEFAULT_PADDING = 2f;

    private final ExtractionGranularity granularity;
    private final float padding;

    public LayoutExtractor() {
        this(ExtractionGranularity.LINE, DEFAULT_PADDING);
    }

    /**
     * @param padding horizontal inset applied to line boxes, in points
     */
    public LayoutExtractor(ExtractionGranularity granularity, float padding) {
        this.granularity = granularity;
        this.padding = padding;
    }

    public ExtractionGranularity getGranularity() {
        return granularity;
    }

    /**
     * @return units in paint order; empty for a page without text
     */
    public List<TextUnit> extract(LayoutPage page) throws IOException {
        List<StyledRun> runs = page.styledRuns();
        MutableList<TextUnit> units = Lists.mutable.empty();
        switch (granularity) {
            case SPAN:
                for (StyledRun run : runs) {
                    addUnit(units, page.getPageIndex(), run.getText(), run.getBoundingBox(), Lists.immutable.with(run));
                }
                break;
            case LINE:
                for (ListIterable<StyledRun> line : groupConsecutive(runs, false)) {
                    String text = line.collect(StyledRun::getText).makeString(" ");
                    BoundingBox box = union(line).inset(padding, 0);
                    addUnit(units, page.getPageIndex(), text, box, line);
                }
                break;
            case BLOCK:
                for (ListIterable<StyledRun> block : groupConsecutive(runs, true)) {
                    String text = groupConsecutive(block, false)
                            .collect(line -> line.collect(StyledRun::getText).makeString(" "))
                            .makeString("\n");
                    addUnit(units, page.getPageIndex(), text, union(block), block);
                }
                break;
            default:
                throw new IllegalStateException("Unhandled granularity " + granularity);
        }
        LOGGER.debug("Page {}: {} runs -> {} {} units", page.getPageIndex(), runs.size(), units.size(), granularity);
        return units;
    }

    /**
     * Plain text of the page's units, one unit per line.
     */
    public String extractText(LayoutPage page) throws IOException {
        return Lists.mutable.withAll(extract(page)).collect(TextUnit::getText).makeString("\n");
    }

    private static void addUnit(MutableList<TextUnit> units, int pageIndex, String text, BoundingBox box,
                                ListIterable<StyledRun> runs) {
        if (text == null || text.trim().isEmpty() || box.isDegenerate()) {
            return;
        }
        StyledRun first = runs.getFirst();
        float fontSize = (float) runs.collectDouble(StyledRun::getFontSize).max();
        units.add(new TextUnit(pageIndex, box, text, fontSize, first.getColor(), first.isBold(), first.isItalic()));
    }

    private static BoundingBox union(ListIterable<StyledRun> runs) {
        return runs.collect(StyledRun::getBoundingBox).reduce(BoundingBox::union).get();
    }

    /**
     * Splits runs into maximal consecutive groups sharing a block number (and a line number
     * unless {@code byBlock}).
     */
    private static MutableList<ListIterable<StyledRun>> groupConsecutive(Iterable<StyledRun> runs, boolean byBlock) {
        MutableList<ListIterable<StyledRun>> groups = Lists.mutable.empty();
        MutableList<StyledRun> current = Lists.mutable.empty();
        StyledRun previous = null;
        for (StyledRun run : runs) {
            boolean sameGroup = previous != null
                    && previous.getBlockNumber() == run.getBlockNumber()
                    && (byBlock || previous.getLineNumber() == run.getLineNumber());
            if (!sameGroup && current.notEmpty()) {
                groups.add(current);
                current = Lists.mutable.empty();
            }
            current.add(run);
            previous = run;
        }
        if (current.notEmpty()) {
            groups.add(current);
        }
        return groups;
    }
}
