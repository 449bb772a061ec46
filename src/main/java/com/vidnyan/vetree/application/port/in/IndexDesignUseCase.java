package com.vidnyan.vetree.application.port.in;

import com.vidnyan.vetree.domain.model.DesignIndex;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Primary use case: scan a source tree and publish a fresh design index.
 */
public interface IndexDesignUseCase {

    /**
     * Scan the configured root.
     */
    ScanSummary refresh();

    /**
     * Scan a directory. The new index replaces the previous one in a single step.
     */
    ScanSummary refresh(Path root);

    /**
     * The last published index, empty before the first scan.
     */
    Optional<DesignIndex> currentIndex();

    Optional<ScanSummary> lastSummary();

    /**
     * Scan statistics.
     */
    record ScanSummary(
        String root,
        int filesDiscovered,
        int filesParsed,
        int filesFailed,
        int moduleCount,
        int instanceCount,
        List<String> duplicateNames,
        long durationMs
    ) {
        /**
         * Summary reported before the first scan.
         */
        public static ScanSummary empty() {
            return new ScanSummary("", 0, 0, 0, 0, 0, List.of(), 0);
        }

        public int duplicateNameCount() {
            return duplicateNames.size();
        }
    }
}
