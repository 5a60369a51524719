package com.gs.ep.pagetranslator.app;

import com.gs.ep.pagetranslator.model.DocumentReport;
import com.gs.ep.pagetranslator.model.PageState;
import com.gs.ep.pagetranslator.model.document.LayoutDocument;
import com.gs.ep.pagetranslator.model.document.LayoutPage;
import com.gs.ep.pagetranslator.model.TextUnit;
import com.gs.ep.pagetranslator.model.renderer.PdfBoxDocument;
import com.gs.ep.pagetranslator.model.translation.TranslationService;
import com.gs.ep.pagetranslator.translate.LayoutExtractor;
import com.gs.ep.pagetranslator.translate.PdfTranslator;
import com.gs.ep.pagetranslator.translate.PipelineScheduler;
import com.gs.ep.pagetranslator.translate.ProviderChainFactory;
import com.gs.ep.pagetranslator.translate.TranslationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.Function;

/**
 * Command line entry point.
 * <pre>
 *   extract   &lt;input.pdf&gt;
 *   translate &lt;input.pdf&gt; [config.properties]
 *   preserve  &lt;input.pdf&gt; [output.pdf] [config.properties]
 * </pre>
 */
public class PdfTranslatorApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfTranslatorApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage:\n"
            + "  PdfTranslatorApp extract <input.pdf>\n"
            + "  PdfTranslatorApp translate <input.pdf> [config.properties]\n"
            + "  PdfTranslatorApp preserve <input.pdf> [output.pdf] [config.properties]";

    private final PrintStream out;
    private final PrintStream err;
    private final Function<TranslationConfig, TranslationService> serviceFactory;

    PdfTranslatorApp(PrintStream out, PrintStream err) {
        this(out, err, ProviderChainFactory::createService);
    }

    PdfTranslatorApp(PrintStream out, PrintStream err, Function<TranslationConfig, TranslationService> serviceFactory) {
        this.out = out;
        this.err = err;
        this.serviceFactory = serviceFactory;
    }

    public static void main(String[] args) {
        System.exit(new PdfTranslatorApp(System.out, System.err).run(args));
    }

    int run(String[] args) {
        if (args.length < 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String command = args[0];
        Path input = Paths.get(args[1]);
        try {
            switch (command) {
                case "extract":
                    if (args.length != 2) {
                        break;
                    }
                    return extract(input);
                case "translate":
                    if (args.length > 3) {
                        break;
                    }
                    return translate(input, args.length == 3
                            ? new TranslationConfig(Paths.get(args[2]))
                            : new TranslationConfig());
                case "preserve":
                    if (args.length > 4) {
                        break;
                    }
                    TranslationConfig config = args.length == 4
                            ? new TranslationConfig(Paths.get(args[3]))
                            : new TranslationConfig();
                    Path output = args.length >= 3 ? Paths.get(args[2]) : defaultOutput(input, config.getTargetCode());
                    return preserve(input, output, config);
                default:
                    break;
            }
        } catch (IOException e) {
            LOGGER.error("Failed to process {}", input, e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOGGER.error("Invalid configuration", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private int extract(Path input) throws IOException {
        TranslationConfig config = new TranslationConfig();
        LayoutExtractor extractor = new LayoutExtractor(config.getGranularity(), config.getExtractionPadding());
        try (LayoutDocument document = PdfBoxDocument.opener(config.getFontDirectory()).open(input)) {
            for (LayoutPage page : document.pages()) {
                out.println("===== Page " + (page.getPageIndex() + 1) + " =====");
                out.println(extractor.extractText(page));
            }
        }
        return EXIT_OK;
    }

    /**
     * Prints the translated text of every page without touching the document.
     */
    private int translate(Path input, TranslationConfig config) throws IOException {
        PipelineScheduler scheduler = new PipelineScheduler(serviceFactory.apply(config), config.getChunkMaxChars(),
                config.getPipelineTimeoutSeconds());
        LayoutExtractor extractor = new LayoutExtractor(config.getGranularity(), config.getExtractionPadding());
        try (LayoutDocument document = PdfBoxDocument.opener(config.getFontDirectory()).open(input)) {
            for (LayoutPage page : document.pages()) {
                List<TextUnit> units = extractor.extract(page);
                out.println("===== Page " + (page.getPageIndex() + 1) + " =====");
                out.println(String.join("\n", scheduler.translateUnits(units, config.getConcurrency())));
            }
        }
        return EXIT_OK;
    }

    private int preserve(Path input, Path output, TranslationConfig config) throws IOException {
        LOGGER.info("Translating {} into {} ({})", input, config.getTargetLanguage(), output);
        DocumentReport report = PdfTranslator.create(config, serviceFactory.apply(config)).translate(input, output);
        out.println("Saved " + output + " (" + report + ")");
        return report.count(PageState.FAILED) == report.getPageCount() && report.getPageCount() > 0
                ? EXIT_ERROR
                : EXIT_OK;
    }

    /**
     * {@code dir/report.pdf} becomes {@code dir/report_sw_preserve.pdf}.
     */
    static Path defaultOutput(Path input, String targetCode) {
        String fileName = input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String root = dot > 0 ? fileName.substring(0, dot) : fileName;
        return input.resolveSibling(root + "_" + targetCode + "_preserve.pdf");
    }
}
