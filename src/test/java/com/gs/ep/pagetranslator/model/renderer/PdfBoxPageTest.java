package com.gs.ep.pagetranslator.model.renderer;

import com.gs.ep.pagetranslator.model.BoundingBox;
import com.gs.ep.pagetranslator.model.FontVariant;
import com.gs.ep.pagetranslator.model.StyledRun;
import com.gs.ep.pagetranslator.model.document.LayoutDocument;
import com.gs.ep.pagetranslator.model.document.LayoutPage;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PdfBoxPageTest {

    @TempDir
    Path tempDir;

    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        input = TestDocuments.writeTwoLinesAndImage(tempDir.resolve("sample.pdf"));
    }

    private static String textOf(Path file) throws IOException {
        try (PDDocument document = PDDocument.load(file.toFile())) {
            return new PDFTextStripper().getText(document);
        }
    }

    @Test
    void styledRuns_shouldFindBothLinesWithStyleAndTopLeftBoxes() throws IOException {
        try (LayoutDocument document = PdfBoxDocument.opener("").open(input)) {
            LayoutPage page = document.pages().get(0);
            List<StyledRun> runs = page.styledRuns();

            assertEquals(2, runs.size());
            StyledRun first = runs.get(0);
            assertEquals(TestDocuments.FIRST_LINE, first.getText());
            assertEquals(TestDocuments.SECOND_LINE, runs.get(1).getText());
            assertEquals(12f, first.getFontSize(), 0.01f);
            assertFalse(first.isBold());
            assertEquals(0, first.getColor());
            assertEquals(72, first.getBoundingBox().getX0(), 0.5);
            // baseline at 700 on a 792pt page
            assertTrue(first.getBoundingBox().getY0() < 92 && first.getBoundingBox().getY1() > 92);
            assertTrue(first.getBoundingBox().getY1() <= runs.get(1).getBoundingBox().getY0());
            assertNotEquals(first.getLineNumber(), runs.get(1).getLineNumber());
        }
    }

    @Test
    void styledRuns_imageOnlyPage_shouldBeEmpty() throws IOException {
        try (LayoutDocument document = PdfBoxDocument.opener("").open(input)) {
            assertTrue(document.pages().get(1).styledRuns().isEmpty());
            assertEquals(612, document.pages().get(1).getWidth(), 0.01);
            assertEquals(792, document.pages().get(1).getHeight(), 0.01);
        }
    }

    @Test
    void styledRuns_rotatedText_shouldBeLeftOut() throws IOException {
        Path rotated = TestDocuments.writeRotatedAndPlainText(tempDir.resolve("rotated-text.pdf"));
        try (LayoutDocument document = PdfBoxDocument.opener("").open(rotated)) {
            List<StyledRun> runs = document.pages().get(0).styledRuns();

            assertEquals(1, runs.size());
            assertEquals(TestDocuments.SECOND_LINE, runs.get(0).getText());
            assertEquals(0, document.pages().get(0).getRotation());
        }
    }

    @Test
    void getRotation_rotatedPage_shouldReportDegrees() throws IOException {
        Path rotated = TestDocuments.writeRotatedPage(tempDir.resolve("rotated-page.pdf"));
        try (LayoutDocument document = PdfBoxDocument.opener("").open(rotated)) {
            assertEquals(90, document.pages().get(0).getRotation());
        }
    }

    @Test
    void applyRedactions_shouldRemoveOnlyGlyphsInsideRegion() throws IOException {
        Path output = tempDir.resolve("redacted.pdf");
        try (LayoutDocument document = PdfBoxDocument.opener("").open(input)) {
            LayoutPage page = document.pages().get(0);
            page.redact(page.styledRuns().get(0).getBoundingBox());
            page.applyRedactions();
            document.save(output);
        }

        String text = textOf(output);
        assertFalse(text.contains(TestDocuments.FIRST_LINE), text);
        assertTrue(text.contains(TestDocuments.SECOND_LINE), text);
    }

    @Test
    void applyRedactions_shouldKeepImagesUnderRedactedRegion() throws IOException {
        byte[] before;
        try (PDDocument original = PDDocument.load(input.toFile())) {
            before = TestDocuments.firstImageBytes(original.getPage(0));
        }
        Path output = tempDir.resolve("redacted.pdf");
        try (LayoutDocument document = PdfBoxDocument.opener("").open(input)) {
            LayoutPage page = document.pages().get(0);
            page.redact(new BoundingBox(0, 0, 612, 792));
            page.applyRedactions();
            document.save(output);
        }

        try (PDDocument redacted = PDDocument.load(output.toFile())) {
            assertArrayEquals(before, TestDocuments.firstImageBytes(redacted.getPage(0)));
            assertTrue(new PDFTextStripper().getText(redacted).trim().isEmpty());
        }
    }

    @Test
    void drawFittedText_shouldWriteExtractableTextInsideRegion() throws IOException {
        Path output = tempDir.resolve("drawn.pdf");
        try (LayoutDocument document = PdfBoxDocument.opener("").open(input)) {
            LayoutPage page = document.pages().get(1);
            boolean overflow = page.drawFittedText(new BoundingBox(72, 72, 400, 90), "Habari dunia",
                    LayoutPage.AUTO_FONT_SIZE, FontVariant.BOLD, 0x202020);
            assertFalse(overflow);
            document.save(output);
        }

        try (LayoutDocument reopened = PdfBoxDocument.opener("").open(output)) {
            List<StyledRun> runs = reopened.pages().get(1).styledRuns();
            assertEquals("Habari dunia", runs.get(0).getText());
            assertTrue(runs.get(0).isBold());
            assertEquals(0x202020, runs.get(0).getColor());
            assertEquals(72, runs.get(0).getBoundingBox().getX0(), 0.5);
        }
    }

    @Test
    void drawFittedText_regionTooSmall_shouldReportOverflowAndDrawNothing() throws IOException {
        Path output = tempDir.resolve("overflow.pdf");
        try (LayoutDocument document = PdfBoxDocument.opener("").open(input)) {
            LayoutPage page = document.pages().get(1);
            assertTrue(page.drawFittedText(new BoundingBox(100, 100, 101, 120), "Habari", 12f,
                    FontVariant.REGULAR, 0));
            assertTrue(page.drawFittedText(new BoundingBox(100, 100, 400, 105), "Habari", 12f,
                    FontVariant.REGULAR, 0));
            document.save(output);
        }

        try (PDDocument saved = PDDocument.load(output.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(2);
            stripper.setEndPage(2);
            assertTrue(stripper.getText(saved).trim().isEmpty());
        }
    }

    @Test
    void autoFontSize_shouldFollowRegionHeightBetweenOneAndTwelve() {
        assertEquals(12f, FittedTextWriter.autoFontSize(new BoundingBox(0, 0, 100, 40)));
        assertEquals(9f, FittedTextWriter.autoFontSize(new BoundingBox(0, 0, 100, 9)));
        assertEquals(1f, FittedTextWriter.autoFontSize(new BoundingBox(0, 0, 100, 0.5)));
    }

    @Test
    void sanitize_shouldReplaceCharactersOutsideTheFont() {
        FontSet fonts = FontSet.standard();

        assertEquals("Jambo ?\nrafiki", fonts.sanitize("Jambo 中\nrafiki", FontVariant.REGULAR));
        assertEquals("a b", fonts.sanitize("a\tb", FontVariant.REGULAR));
        assertFalse(fonts.isEmbedded());
    }

    @Test
    void load_missingFontDirectory_shouldFallBackToHelvetica() throws IOException {
        try (PDDocument document = new PDDocument()) {
            FontSet fonts = FontSet.load(document, tempDir.resolve("no-fonts").toString());
            assertFalse(fonts.isEmbedded());
            assertEquals("Helvetica-Bold", fonts.get(FontVariant.BOLD).getName());
        }
    }

    @Test
    void opener_missingFile_shouldThrow() {
        IOException e = assertThrows(IOException.class,
                () -> PdfBoxDocument.opener("").open(tempDir.resolve("absent.pdf")));
        assertTrue(e.getMessage().startsWith("PDF not found"));
    }
}
