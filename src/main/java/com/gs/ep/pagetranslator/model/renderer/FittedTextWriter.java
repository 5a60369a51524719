package com.gs.ep.pagetranslator.model.renderer;

import com.gs.ep.pagetranslator.model.BoundingBox;
import com.gs.ep.pagetranslator.model.FontVariant;
import com.gs.ep.pagetranslator.model.document.LayoutPage;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

import java.awt.Color;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Wraps text into a fixed region and draws it left aligned from the top of the region.
 * Text that does not fit is not drawn at all.
 */
public class FittedTextWriter {
    static final float LINE_SPACING = 1.15f;
    private static final float ASCENT = 0.8f;
    private static final float MAX_AUTO_FONT_SIZE = 12f;
    private static final float MIN_AUTO_FONT_SIZE = 1f;
    private static final float TOLERANCE = 0.01f;

    private final FontSet fonts;

    public FittedTextWriter(FontSet fonts) {
        this.fonts = fonts;
    }

    /**
     * Size chosen for {@link LayoutPage#AUTO_FONT_SIZE}: one line filling the region height,
     * capped at 12pt.
     */
    static float autoFontSize(BoundingBox region) {
        return (float) Math.max(MIN_AUTO_FONT_SIZE, Math.min(MAX_AUTO_FONT_SIZE, region.height()));
    }

    /**
     * Breaks {@code text} into lines no wider than {@code region}, or returns {@code null} when
     * the lines do not fit the region at {@code fontSize}.
     */
    List<String> layout(BoundingBox region, String text, float fontSize, FontVariant variant) throws IOException {
        List<String> lines = wrap(text, fontSize, variant, (float) region.width());
        if (lines == null || lines.isEmpty()) {
            return null;
        }
        float required = fontSize + (lines.size() - 1) * fontSize * LINE_SPACING;
        return required <= region.height() + TOLERANCE ? lines : null;
    }

    /**
     * @return {@code true} if the text overflowed and nothing was drawn
     */
    public boolean draw(PDDocument document, PDPage page, BoundingBox region, String text, float fontSize,
            FontVariant variant, int color) throws IOException {
        float size = fontSize <= LayoutPage.AUTO_FONT_SIZE ? autoFontSize(region) : fontSize;
        String printable = fonts.sanitize(text, variant);
        List<String> lines = layout(region, printable, size, variant);
        if (lines == null) {
            return true;
        }
        PDRectangle cropBox = page.getCropBox();
        try (PDPageContentStream contentStream = new PDPageContentStream(document, page,
                PDPageContentStream.AppendMode.APPEND, true, true)) {
            contentStream.setNonStrokingColor(new Color(color));
            float x = (float) (cropBox.getLowerLeftX() + region.getX0());
            float firstBaseline = (float) (region.getY0() + size * ASCENT);
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line.isEmpty()) {
                    continue;
                }
                float y = cropBox.getUpperRightY() - (firstBaseline + i * size * LINE_SPACING);
                contentStream.beginText();
                contentStream.setFont(fonts.get(variant), size);
                contentStream.newLineAtOffset(x, y);
                contentStream.showText(line);
                contentStream.endText();
            }
        }
        return false;
    }

    /**
     * Word wrap; words wider than the region are broken between characters. Returns
     * {@code null} when a single character is wider than the region.
     */
    private List<String> wrap(String text, float fontSize, FontVariant variant, float maxWidth) throws IOException {
        List<String> lines = new ArrayList<>();
        for (String paragraph : text.split("\n", -1)) {
            String[] words = paragraph.trim().split("\\s+");
            StringBuilder current = new StringBuilder();
            for (String word : words) {
                if (word.isEmpty()) {
                    continue;
                }
                String candidate = current.length() == 0 ? word : current + " " + word;
                if (fonts.width(candidate, variant, fontSize) <= maxWidth + TOLERANCE) {
                    current.setLength(0);
                    current.append(candidate);
                    continue;
                }
                if (current.length() > 0) {
                    lines.add(current.toString());
                    current.setLength(0);
                }
                if (fonts.width(word, variant, fontSize) <= maxWidth + TOLERANCE) {
                    current.append(word);
                    continue;
                }
                for (int i = 0; i < word.length(); i++) {
                    String ch = String.valueOf(word.charAt(i));
                    if (fonts.width(current + ch, variant, fontSize) > maxWidth + TOLERANCE) {
                        if (current.length() == 0) {
                            return null;
                        }
                        lines.add(current.toString());
                        current.setLength(0);
                    }
                    current.append(ch);
                }
            }
            lines.add(current.toString());
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
