package com.gs.ep.pagetranslator.model.document;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * An opened document whose pages can be rewritten in place and saved as a whole.
 */
public interface LayoutDocument extends Closeable {

    List<? extends LayoutPage> pages();

    void save(Path target) throws IOException;
}
