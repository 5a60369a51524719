package com.gs.ep.pagetranslator.model.renderer;

import com.gs.ep.pagetranslator.model.BoundingBox;
import com.gs.ep.pagetranslator.model.StyledRun;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingColor;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingColorN;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingColorSpace;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingDeviceCMYKColor;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingDeviceGrayColor;
import org.apache.pdfbox.contentstream.operator.color.SetNonStrokingDeviceRGBColor;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.pdmodel.graphics.color.PDColor;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Text stripper that reports a page as styled runs. Words come from the stripper's own line
 * and paragraph detection, in content-stream order; consecutive words of one line with the
 * same size, colour, weight and slant form a run. Glyphs not written left to right on the
 * page (rotated text) are not reported, so they are never redacted or redrawn.
 */
public class StyledRunCollector extends PDFTextStripper {
    private static final Logger LOGGER = LoggerFactory.getLogger(StyledRunCollector.class);
    private static final float ASCENT = 0.8f;
    private static final float DESCENT = 0.2f;

    private final Map<TextPosition, Integer> colors = new IdentityHashMap<>();
    private final MutableList<StyledRun> runs = Lists.mutable.empty();
    private final MutableList<Word> currentLine = Lists.mutable.empty();
    private int blockNumber;
    private int lineNumber;
    private boolean blockHasLines;
    private int rotatedGlyphs;

    public StyledRunCollector() throws IOException {
        addOperator(new SetNonStrokingColorSpace());
        addOperator(new SetNonStrokingColor());
        addOperator(new SetNonStrokingColorN());
        addOperator(new SetNonStrokingDeviceRGBColor());
        addOperator(new SetNonStrokingDeviceGrayColor());
        addOperator(new SetNonStrokingDeviceCMYKColor());
        setSortByPosition(false);
    }

    /**
     * Styled runs of the zero-based page {@code pageIndex}, in paint order.
     */
    public List<StyledRun> collect(PDDocument document, int pageIndex) throws IOException {
        colors.clear();
        runs.clear();
        currentLine.clear();
        blockNumber = 0;
        lineNumber = 0;
        blockHasLines = false;
        rotatedGlyphs = 0;
        setStartPage(pageIndex + 1);
        setEndPage(pageIndex + 1);
        writeText(document, new StringWriter());
        closeLine();
        if (rotatedGlyphs > 0) {
            LOGGER.warn("Page {}: {} glyphs of rotated text left untranslated", pageIndex + 1, rotatedGlyphs);
        }
        return runs.toImmutable().castToList();
    }

    @Override
    protected void processTextPosition(TextPosition text) {
        if (text.getDir() != 0) {
            rotatedGlyphs++;
            return;
        }
        int rgb;
        try {
            PDColor color = getGraphicsState().getNonStrokingColor();
            rgb = color.toRGB();
        } catch (IOException | UnsupportedOperationException e) {
            // pattern spaces have no RGB equivalent
            rgb = 0;
        }
        colors.put(text, rgb);
        super.processTextPosition(text);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (text == null || text.trim().isEmpty() || textPositions.isEmpty()) {
            return;
        }
        currentLine.add(new Word(text.trim(), textPositions));
    }

    @Override
    protected void writeLineSeparator() throws IOException {
        closeLine();
        super.writeLineSeparator();
    }

    @Override
    protected void writeParagraphEnd() throws IOException {
        closeLine();
        closeBlock();
        super.writeParagraphEnd();
    }

    @Override
    protected void writePageEnd() throws IOException {
        closeLine();
        closeBlock();
        super.writePageEnd();
    }

    private void closeBlock() {
        if (blockHasLines) {
            blockNumber++;
            blockHasLines = false;
        }
    }

    private void closeLine() {
        if (currentLine.isEmpty()) {
            return;
        }
        RunBuilder builder = null;
        for (Word word : currentLine) {
            StyledRun style = styleOf(word.positions.get(0));
            if (builder != null && builder.style.sameStyleAs(style)) {
                builder.add(word);
            } else {
                if (builder != null) {
                    runs.add(builder.build());
                }
                builder = new RunBuilder(style, word);
            }
        }
        runs.add(builder.build());
        currentLine.clear();
        lineNumber++;
        blockHasLines = true;
    }

    private StyledRun styleOf(TextPosition position) {
        PDFont font = position.getFont();
        String fontName = font == null || font.getName() == null ? "" : font.getName();
        String lower = fontName.toLowerCase(Locale.ROOT);
        boolean bold = lower.contains("bold") || lower.contains("black") || lower.contains("heavy");
        boolean italic = lower.contains("italic") || lower.contains("oblique");
        PDFontDescriptor descriptor = font == null ? null : font.getFontDescriptor();
        if (descriptor != null) {
            bold |= descriptor.isForceBold() || descriptor.getFontWeight() >= 600;
            italic |= descriptor.isItalic() || descriptor.getItalicAngle() != 0;
        }
        Integer rgb = colors.get(position);
        return new StyledRun(blockNumber, lineNumber, "", boxOf(position), fontSize(position),
                rgb == null ? 0 : rgb, fontName, bold, italic);
    }

    private static float fontSize(TextPosition position) {
        float size = position.getFontSizeInPt();
        if (size <= 0) {
            size = position.getHeightDir() / ASCENT;
        }
        return size;
    }

    private static BoundingBox boxOf(TextPosition position) {
        float size = fontSize(position);
        float x = position.getXDirAdj();
        float baseline = position.getYDirAdj();
        return new BoundingBox(x, baseline - size * ASCENT, x + position.getWidthDirAdj(), baseline + size * DESCENT);
    }

    private static final class Word {
        private final String text;
        private final List<TextPosition> positions;

        private Word(String text, List<TextPosition> positions) {
            this.text = text;
            this.positions = positions;
        }
    }

    private static final class RunBuilder {
        private final StyledRun style;
        private final StringBuilder text = new StringBuilder();
        private BoundingBox box;
        private float maxSize;

        private RunBuilder(StyledRun style, Word first) {
            this.style = style;
            add(first);
        }

        private void add(Word word) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(word.text);
            for (TextPosition position : word.positions) {
                BoundingBox glyph = boxOf(position);
                box = box == null ? glyph : box.union(glyph);
                maxSize = Math.max(maxSize, fontSize(position));
            }
        }

        private StyledRun build() {
            return new StyledRun(style.getBlockNumber(), style.getLineNumber(), text.toString(), box, maxSize,
                    style.getColor(), style.getFontName(), style.isBold(), style.isItalic());
        }
    }
}
