package com.vidnyan.vetree.application.service;

import com.vidnyan.vetree.IndexProperties;
import com.vidnyan.vetree.application.port.in.IndexDesignUseCase;
import com.vidnyan.vetree.application.port.out.SourceFileRepository;
import com.vidnyan.vetree.domain.extract.DesignParser;
import com.vidnyan.vetree.domain.extract.DesignParser.ParseResult;
import com.vidnyan.vetree.domain.model.DesignIndex;
import com.vidnyan.vetree.domain.model.SourceFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scans a source tree and publishes the resulting design index.
 * Implements the indexing use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DesignIndexService implements IndexDesignUseCase {

    private final SourceFileRepository sourceFileRepository;
    private final DesignParser designParser;
    private final IndexProperties properties;

    private final AtomicReference<Snapshot> current = new AtomicReference<>();
    private final Object scanLock = new Object();

    private record Snapshot(DesignIndex index, ScanSummary summary) {}

    @Override
    public ScanSummary refresh() {
        return refresh(Path.of(properties.getRootPath()));
    }

    @Override
    public ScanSummary refresh(Path root) {
        synchronized (scanLock) {
            Instant startTime = Instant.now();
            log.info("Starting scan of: {}", root);

            // Step 1: Discover files
            List<Path> files;
            try {
                files = sourceFileRepository.discover(root);
            } catch (IOException e) {
                log.error("Failed to discover sources under {}: {}", root, e.getMessage());
                files = List.of();
            }
            log.info("Found {} source files", files.size());

            // Step 2: Read in discovery order
            List<SourceFile> sources = new ArrayList<>();
            int unreadable = 0;
            for (Path file : files) {
                try {
                    sources.add(new SourceFile(file.toString(), sourceFileRepository.read(file)));
                } catch (IOException e) {
                    unreadable++;
                    log.warn("Failed to read {}: {}", file, e.getMessage());
                }
            }

            // Step 3: Parse and publish
            ParseResult result = designParser.parse(
                    sources, new LinkedHashSet<>(properties.getDefines()), properties.isEnablePreprocess());
            DesignIndex index = result.index();
            DesignIndex.Stats stats = index.stats();
            long duration = Duration.between(startTime, Instant.now()).toMillis();

            ScanSummary summary = new ScanSummary(
                    root.toString(),
                    files.size(),
                    result.filesParsed(),
                    unreadable + result.filesFailed(),
                    stats.moduleCount(),
                    stats.instanceCount(),
                    index.duplicateNames(),
                    duration);

            current.set(new Snapshot(index, summary));

            log.info("Scan complete: {} files, {} modules, {} instances in {}ms",
                    result.filesParsed(), stats.moduleCount(), stats.instanceCount(), duration);
            if (stats.duplicateNameCount() > 0) {
                log.info("{} module names have several definitions: {}",
                        stats.duplicateNameCount(), index.duplicateNames());
            }
            return summary;
        }
    }

    @Override
    public Optional<DesignIndex> currentIndex() {
        Snapshot snapshot = current.get();
        return snapshot == null ? Optional.empty() : Optional.of(snapshot.index());
    }

    @Override
    public Optional<ScanSummary> lastSummary() {
        Snapshot snapshot = current.get();
        return snapshot == null ? Optional.empty() : Optional.of(snapshot.summary());
    }
}
