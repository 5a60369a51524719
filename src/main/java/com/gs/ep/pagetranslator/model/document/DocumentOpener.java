package com.gs.ep.pagetranslator.model.document;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface DocumentOpener {

    /**
     * @throws IOException if the file is missing or cannot be parsed
     */
    LayoutDocument open(Path path) throws IOException;
}
