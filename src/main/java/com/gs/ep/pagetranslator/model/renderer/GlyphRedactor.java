package com.gs.ep.pagetranslator.model.renderer;

import com.gs.ep.pagetranslator.model.BoundingBox;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.state.Concatenate;
import org.apache.pdfbox.contentstream.operator.state.Restore;
import org.apache.pdfbox.contentstream.operator.state.Save;
import org.apache.pdfbox.contentstream.operator.state.SetGraphicsStateParameters;
import org.apache.pdfbox.contentstream.operator.state.SetMatrix;
import org.apache.pdfbox.contentstream.operator.text.BeginText;
import org.apache.pdfbox.contentstream.operator.text.EndText;
import org.apache.pdfbox.contentstream.operator.text.MoveText;
import org.apache.pdfbox.contentstream.operator.text.MoveTextSetLeading;
import org.apache.pdfbox.contentstream.operator.text.NextLine;
import org.apache.pdfbox.contentstream.operator.text.SetCharSpacing;
import org.apache.pdfbox.contentstream.operator.text.SetFontAndSize;
import org.apache.pdfbox.contentstream.operator.text.SetTextHorizontalScaling;
import org.apache.pdfbox.contentstream.operator.text.SetTextLeading;
import org.apache.pdfbox.contentstream.operator.text.SetTextRenderingMode;
import org.apache.pdfbox.contentstream.operator.text.SetTextRise;
import org.apache.pdfbox.contentstream.operator.text.SetWordSpacing;
import org.apache.pdfbox.contentstream.operator.text.ShowText;
import org.apache.pdfbox.contentstream.operator.text.ShowTextAdjusted;
import org.apache.pdfbox.contentstream.operator.text.ShowTextLine;
import org.apache.pdfbox.contentstream.operator.text.ShowTextLineAndSpace;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSFloat;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.io.IOUtils;
import org.apache.pdfbox.pdfparser.PDFStreamParser;
import org.apache.pdfbox.pdfwriter.ContentStreamWriter;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.common.PDStream;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.util.Matrix;
import org.apache.pdfbox.util.Vector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Erases the glyphs painted inside a set of regions by rewriting the page content stream.
 * <p>
 * A text-showing operator is removed when at least half of its glyphs fall inside one of the
 * regions. The removed operator is replaced by a pure positioning {@code TJ} of the same
 * advance so that text painted later on the same line keeps its place. Nothing is painted
 * over the regions, so shapes and images under the text are preserved. Text inside form
 * XObjects and annotations is out of reach and left as is.
 */
public class GlyphRedactor extends PDFStreamEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(GlyphRedactor.class);

    private final List<BoundingBox> regions = new ArrayList<>();
    private final Map<Integer, int[]> glyphCounts = new HashMap<>();
    private final Map<Integer, Float> advances = new HashMap<>();
    private PDRectangle cropBox;
    private int operatorOrdinal;
    private int currentShowOrdinal = -1;

    public GlyphRedactor() {
        addOperator(new BeginText());
        addOperator(new EndText());
        addOperator(new Concatenate());
        addOperator(new Save());
        addOperator(new Restore());
        addOperator(new SetGraphicsStateParameters());
        addOperator(new SetMatrix());
        addOperator(new MoveText());
        addOperator(new MoveTextSetLeading());
        addOperator(new NextLine());
        addOperator(new SetCharSpacing());
        addOperator(new SetFontAndSize());
        addOperator(new SetTextHorizontalScaling());
        addOperator(new SetTextLeading());
        addOperator(new SetTextRenderingMode());
        addOperator(new SetTextRise());
        addOperator(new SetWordSpacing());
        addOperator(new ShowText());
        addOperator(new ShowTextAdjusted());
        addOperator(new ShowTextLine());
        addOperator(new ShowTextLineAndSpace());
    }

    /**
     * Removes the glyphs inside {@code redactions} from {@code page}.
     *
     * @return number of text-showing operators removed
     */
    public int redact(PDDocument document, PDPage page, List<BoundingBox> redactions) throws IOException {
        if (redactions.isEmpty() || !page.hasContents()) {
            return 0;
        }
        regions.clear();
        regions.addAll(redactions);
        glyphCounts.clear();
        advances.clear();
        operatorOrdinal = 0;
        cropBox = page.getCropBox();

        processPage(page);

        List<Object> tokens = parseTokens(page);
        int parsedOperators = 0;
        for (Object token : tokens) {
            if (token instanceof Operator) {
                parsedOperators++;
            }
        }
        if (parsedOperators != operatorOrdinal) {
            LOGGER.warn("Content stream of page has {} operators but {} were processed; leaving page text as is",
                    parsedOperators, operatorOrdinal);
            return 0;
        }

        List<Object> rewritten = new ArrayList<>(tokens.size());
        List<Object> operands = new ArrayList<>();
        int ordinal = 0;
        int removed = 0;
        for (Object token : tokens) {
            if (!(token instanceof Operator)) {
                operands.add(token);
                continue;
            }
            Operator operator = (Operator) token;
            if (isRedacted(ordinal)) {
                replaceShowOperator(operator, operands, advances.get(ordinal), rewritten);
                removed++;
            } else {
                rewritten.addAll(operands);
                rewritten.add(operator);
            }
            operands.clear();
            ordinal++;
        }
        rewritten.addAll(operands);

        if (removed > 0) {
            PDStream contents = new PDStream(document);
            try (OutputStream out = contents.createOutputStream(COSName.FLATE_DECODE)) {
                new ContentStreamWriter(out).writeTokens(rewritten);
            }
            page.setContents(contents);
        }
        LOGGER.debug("Removed {} text operators for {} regions", removed, redactions.size());
        return removed;
    }

    private boolean isRedacted(int ordinal) {
        int[] counts = glyphCounts.get(ordinal);
        return counts != null && counts[0] > 0 && counts[0] * 2 >= counts[1];
    }

    /**
     * Emits the line movement of {@code '} and {@code "} and a positioning-only {@code TJ}
     * instead of the removed text.
     */
    private static void replaceShowOperator(Operator operator, List<Object> operands, Float advance,
            List<Object> out) {
        String name = operator.getName();
        if ("\"".equals(name) && operands.size() >= 3) {
            out.add(operands.get(0));
            out.add(Operator.getOperator("Tw"));
            out.add(operands.get(1));
            out.add(Operator.getOperator("Tc"));
            out.add(Operator.getOperator("T*"));
        } else if ("'".equals(name)) {
            out.add(Operator.getOperator("T*"));
        }
        if (advance != null && advance != 0f && !Float.isNaN(advance) && !Float.isInfinite(advance)) {
            COSArray shift = new COSArray();
            shift.add(new COSFloat(advance));
            out.add(shift);
            out.add(Operator.getOperator("TJ"));
        }
    }

    private static List<Object> parseTokens(PDPage page) throws IOException {
        byte[] bytes;
        try (InputStream in = page.getContents()) {
            bytes = IOUtils.toByteArray(in);
        }
        PDFStreamParser parser = new PDFStreamParser(bytes);
        parser.parse();
        return parser.getTokens();
    }

    @Override
    protected void processOperator(Operator operator, List<COSBase> operands) throws IOException {
        int ordinal = operatorOrdinal++;
        String name = operator.getName();
        boolean shows = "Tj".equals(name) || "TJ".equals(name) || "'".equals(name) || "\"".equals(name);
        if (!shows) {
            super.processOperator(operator, operands);
            return;
        }
        currentShowOrdinal = ordinal;
        boolean movesLine = "'".equals(name) || "\"".equals(name);
        Matrix before = getTextMatrix() == null ? null : getTextMatrix().clone();
        super.processOperator(operator, operands);
        currentShowOrdinal = -1;
        Matrix after = getTextMatrix();
        Matrix start = movesLine ? getTextLineMatrix() : before;
        if (start != null && after != null) {
            advances.put(ordinal, textSpaceShift(start, after));
        }
    }

    /**
     * {@code TJ} number that moves the text position from {@code start} to {@code end}.
     */
    private float textSpaceShift(Matrix start, Matrix end) {
        float fontSize = getGraphicsState().getTextState().getFontSize();
        float horizontalScaling = getGraphicsState().getTextState().getHorizontalScaling() / 100f;
        float scale = start.getScalingFactorX();
        if (fontSize == 0 || horizontalScaling == 0 || scale == 0) {
            return 0f;
        }
        double dx = end.getTranslateX() - start.getTranslateX();
        double dy = end.getTranslateY() - start.getTranslateY();
        double distance = Math.signum(dx == 0 ? dy : dx) * Math.hypot(dx, dy) / scale;
        return (float) (-distance * 1000 / (fontSize * horizontalScaling));
    }

    @Override
    protected void showGlyph(Matrix textRenderingMatrix, PDFont font, int code, String unicode, Vector displacement)
            throws IOException {
        if (currentShowOrdinal < 0) {
            return;
        }
        float width = displacement.getX() * textRenderingMatrix.getScalingFactorX();
        float height = textRenderingMatrix.getScalingFactorY();
        double left = textRenderingMatrix.getTranslateX() - cropBox.getLowerLeftX();
        double centerY = cropBox.getUpperRightY() - (textRenderingMatrix.getTranslateY() + height * 0.3);
        int[] counts = glyphCounts.computeIfAbsent(currentShowOrdinal, k -> new int[2]);
        counts[1]++;
        for (BoundingBox region : regions) {
            if (insideRegion(region, left, left + width, centerY)) {
                counts[0]++;
                break;
            }
        }
    }

    private static boolean insideRegion(BoundingBox region, double left, double right, double centerY) {
        if (centerY < region.getY0() || centerY > region.getY1()) {
            return false;
        }
        if (right <= left) {
            return left >= region.getX0() && left <= region.getX1();
        }
        return left < region.getX1() && right > region.getX0();
    }
}
