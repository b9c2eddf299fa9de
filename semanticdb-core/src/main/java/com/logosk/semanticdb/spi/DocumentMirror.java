package com.logosk.semanticdb.spi;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Mirrors export documents to human readable files and back.
 */
public interface DocumentMirror {

    void write(ExportDocument document, Path path) throws IOException;

    ExportDocument read(Path path) throws IOException;
}
