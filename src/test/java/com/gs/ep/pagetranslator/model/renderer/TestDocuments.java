package com.gs.ep.pagetranslator.model.renderer;

import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.io.IOUtils;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.util.Matrix;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * PDF fixtures built with PDFBox.
 */
public final class TestDocuments {

    public static final String FIRST_LINE = "Hello world";
    public static final String SECOND_LINE = "Second line here";

    private TestDocuments() {
    }

    /**
     * Page 1: two lines of 12pt Helvetica at y=700 and y=680 plus an image to the right of them.
     * Page 2: the same image only.
     */
    public static Path writeTwoLinesAndImage(Path file) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDImageXObject image = LosslessFactory.createFromImage(document, gradient(40, 30));

            PDPage textPage = new PDPage(PDRectangle.LETTER);
            document.addPage(textPage);
            try (PDPageContentStream contentStream = new PDPageContentStream(document, textPage)) {
                contentStream.drawImage(image, 300, 600, 80, 60);
                showLine(contentStream, FIRST_LINE, 72, 700);
                showLine(contentStream, SECOND_LINE, 72, 680);
            }

            PDPage imagePage = new PDPage(PDRectangle.LETTER);
            document.addPage(imagePage);
            try (PDPageContentStream contentStream = new PDPageContentStream(document, imagePage)) {
                contentStream.drawImage(image, 100, 100, 200, 150);
            }
            document.save(file.toFile());
        }
        return file;
    }

    /**
     * One page: {@link #FIRST_LINE} rotated a quarter turn around (300, 200), and
     * {@link #SECOND_LINE} written normally at (72, 680).
     */
    public static Path writeRotatedAndPlainText(Path file) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                contentStream.beginText();
                contentStream.setFont(PDType1Font.HELVETICA, 12);
                contentStream.setTextMatrix(Matrix.getRotateInstance(Math.PI / 2, 300, 200));
                contentStream.showText(FIRST_LINE);
                contentStream.endText();
                showLine(contentStream, SECOND_LINE, 72, 680);
            }
            document.save(file.toFile());
        }
        return file;
    }

    /**
     * One page with {@code /Rotate 90} showing {@link #FIRST_LINE} at (72, 700).
     */
    public static Path writeRotatedPage(Path file) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            page.setRotation(90);
            document.addPage(page);
            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                showLine(contentStream, FIRST_LINE, 72, 700);
            }
            document.save(file.toFile());
        }
        return file;
    }

    private static void showLine(PDPageContentStream contentStream, String text, float x, float y) throws IOException {
        contentStream.beginText();
        contentStream.setFont(PDType1Font.HELVETICA, 12);
        contentStream.newLineAtOffset(x, y);
        contentStream.showText(text);
        contentStream.endText();
    }

    private static BufferedImage gradient(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                image.setRGB(x, y, (x * 6) << 16 | (y * 8) << 8 | 0x40);
            }
        }
        return image;
    }

    /**
     * Raw (still encoded) bytes of the first image XObject on {@code page}.
     */
    public static byte[] firstImageBytes(PDPage page) throws IOException {
        PDResources resources = page.getResources();
        for (COSName name : resources.getXObjectNames()) {
            if (resources.isImageXObject(name)) {
                PDImageXObject image = (PDImageXObject) resources.getXObject(name);
                try (InputStream in = image.getCOSObject().createRawInputStream()) {
                    return IOUtils.toByteArray(in);
                }
            }
        }
        throw new IllegalStateException("No image on page");
    }
}
