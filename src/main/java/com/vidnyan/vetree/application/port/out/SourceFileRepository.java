package com.vidnyan.vetree.application.port.out;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port for finding and reading hardware-description sources.
 * Implemented by adapters (e.g., the local filesystem).
 */
public interface SourceFileRepository {

    /**
     * Source files under a root, in a stable order. That order is the processing order of
     * a scan, so earlier files' {@code `define}s are visible to later ones.
     */
    List<Path> discover(Path root) throws IOException;

    /**
     * Read one file's text.
     */
    String read(Path file) throws IOException;
}
