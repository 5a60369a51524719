package com.gs.ep.pagetranslator.model.renderer;

import com.gs.ep.pagetranslator.model.document.DocumentOpener;
import com.gs.ep.pagetranslator.model.document.LayoutDocument;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link LayoutDocument} over a PDFBox {@link PDDocument}.
 */
public class PdfBoxDocument implements LayoutDocument {
    private static final Logger LOGGER = LoggerFactory.getLogger(PdfBoxDocument.class);

    private final PDDocument document;
    private final List<PdfBoxPage> pages;

    public PdfBoxDocument(PDDocument document, String fontsDir) {
        this.document = document;
        FittedTextWriter textWriter = new FittedTextWriter(FontSet.load(document, fontsDir));
        List<PdfBoxPage> list = new ArrayList<>();
        int index = 0;
        for (PDPage page : document.getPages()) {
            list.add(new PdfBoxPage(document, page, index++, textWriter));
        }
        this.pages = Collections.unmodifiableList(list);
    }

    /**
     * Opener loading PDF files with PDFBox; drawn text uses the font family in {@code fontsDir}
     * when there is one.
     */
    public static DocumentOpener opener(String fontsDir) {
        return path -> {
            if (!Files.isRegularFile(path)) {
                throw new IOException("PDF not found: " + path);
            }
            PDDocument document = PDDocument.load(path.toFile());
            if (document.isEncrypted()) {
                LOGGER.info("{} is encrypted; security settings are removed on save", path);
                document.setAllSecurityToBeRemoved(true);
            }
            return new PdfBoxDocument(document, fontsDir);
        };
    }

    @Override
    public List<PdfBoxPage> pages() {
        return pages;
    }

    @Override
    public void save(Path target) throws IOException {
        document.save(target.toFile());
    }

    @Override
    public void close() throws IOException {
        document.close();
    }
}
