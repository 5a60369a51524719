package com.gs.ep.pagetranslator.model.renderer;

import com.gs.ep.pagetranslator.model.FontVariant;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType0Font;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;

/**
 * The four faces used to redraw translated text. Uses a TrueType family from the configured
 * font directory when one is present ({@code <Family>-Regular.ttf}, {@code -Bold.ttf},
 * {@code -Italic.ttf}, {@code -BoldItalic.ttf}), otherwise the Helvetica family of the
 * standard 14 fonts.
 */
public class FontSet {
    private static final Logger LOGGER = LoggerFactory.getLogger(FontSet.class);
    private static final String REGULAR_SUFFIX = "-Regular.ttf";

    private final Map<FontVariant, PDFont> fonts = new EnumMap<>(FontVariant.class);
    private final boolean embedded;

    private FontSet(boolean embedded) {
        this.embedded = embedded;
    }

    public static FontSet standard() {
        FontSet set = new FontSet(false);
        set.fonts.put(FontVariant.REGULAR, PDType1Font.HELVETICA);
        set.fonts.put(FontVariant.BOLD, PDType1Font.HELVETICA_BOLD);
        set.fonts.put(FontVariant.ITALIC, PDType1Font.HELVETICA_OBLIQUE);
        set.fonts.put(FontVariant.BOLD_ITALIC, PDType1Font.HELVETICA_BOLD_OBLIQUE);
        return set;
    }

    /**
     * Loads the family found in {@code fontsDir} into {@code document}, falling back to
     * {@link #standard()} when the directory is blank, missing or has no regular face.
     */
    public static FontSet load(PDDocument document, String fontsDir) {
        if (fontsDir == null || fontsDir.trim().isEmpty()) {
            return standard();
        }
        File dir = new File(fontsDir);
        File[] regulars = dir.listFiles((d, name) -> name.endsWith(REGULAR_SUFFIX));
        if (regulars == null || regulars.length == 0) {
            LOGGER.warn("No *{} font found in {}; using Helvetica", REGULAR_SUFFIX, fontsDir);
            return standard();
        }
        File regularFile = regulars[0];
        String family = regularFile.getName().substring(0, regularFile.getName().length() - REGULAR_SUFFIX.length());
        try {
            FontSet set = new FontSet(true);
            PDFont regular = PDType0Font.load(document, regularFile);
            set.fonts.put(FontVariant.REGULAR, regular);
            set.fonts.put(FontVariant.BOLD, loadOrDefault(document, new File(dir, family + "-Bold.ttf"), regular));
            set.fonts.put(FontVariant.ITALIC, loadOrDefault(document, new File(dir, family + "-Italic.ttf"), regular));
            set.fonts.put(FontVariant.BOLD_ITALIC,
                    loadOrDefault(document, new File(dir, family + "-BoldItalic.ttf"), set.fonts.get(FontVariant.BOLD)));
            LOGGER.info("Using font family {} from {}", family, fontsDir);
            return set;
        } catch (IOException e) {
            LOGGER.warn("Failed to load font family {} from {}; using Helvetica", family, fontsDir, e);
            return standard();
        }
    }

    private static PDFont loadOrDefault(PDDocument document, File file, PDFont fallback) throws IOException {
        return file.exists() ? PDType0Font.load(document, file) : fallback;
    }

    public PDFont get(FontVariant variant) {
        return fonts.get(variant);
    }

    public boolean isEmbedded() {
        return embedded;
    }

    /**
     * Replaces characters the font cannot encode with {@code '?'}. Line breaks are kept.
     */
    public String sanitize(String text, FontVariant variant) {
        PDFont font = get(variant);
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            String ch = new String(Character.toChars(codePoint));
            if (codePoint == '\n') {
                sb.append('\n');
            } else if (codePoint == '\t' || codePoint == '\r') {
                sb.append(' ');
            } else if (canEncode(font, ch)) {
                sb.append(ch);
            } else {
                sb.append('?');
            }
            i += Character.charCount(codePoint);
        }
        return sb.toString();
    }

    private static boolean canEncode(PDFont font, String ch) {
        try {
            font.encode(ch);
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }

    /**
     * Width of {@code text} in points at {@code fontSize}.
     */
    public float width(String text, FontVariant variant, float fontSize) throws IOException {
        return get(variant).getStringWidth(text) / 1000f * fontSize;
    }
}
