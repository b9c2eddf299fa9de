package com.logosk.semanticdb.storage;

import com.logosk.semanticdb.spi.DocumentMirror;
import com.logosk.semanticdb.spi.ExportDocument;
import com.logosk.semanticdb.util.JsonUtils;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes export documents as YAML files and reads them back. Parent directories are
 * created on write.
 */
public class YamlDocumentMirror implements DocumentMirror {

    private static final Logger LOG = Logger.getLogger(YamlDocumentMirror.class);

    @Override
    public void write(ExportDocument document, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            JsonUtils.instance().yaml().writeValue(out, document);
        }
        LOG.infof("Mirrored export document to %s", path);
    }

    @Override
    public ExportDocument read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            ExportDocument document = JsonUtils.instance().yaml().readValue(in, ExportDocument.class);
            if (document == null) {
                throw new IOException("Empty export document: " + path);
            }
            LOG.debugf("Read export document from %s", path);
            return document;
        }
    }
}
