package com.vidnyan.vetree.adapter.out.filesystem;

import com.vidnyan.vetree.IndexProperties;
import com.vidnyan.vetree.application.port.out.SourceFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Discovers Verilog/SystemVerilog sources on the local filesystem.
 * Excluded directories are pruned, unreadable entries are skipped with a warning, and
 * results are sorted by path so every scan processes files in the same order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemSourceRepository implements SourceFileRepository {

    private final IndexProperties properties;

    @Override
    public List<Path> discover(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }

        List<Path> found = new ArrayList<>();
        Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        if (!dir.equals(root) && isExcluded(dir)) {
                            log.debug("Pruned {}", dir);
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && hasSourceExtension(file) && isWithinSizeLimit(file, attrs.size())) {
                            found.add(file);
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException e) {
                        log.warn("Skipping unreadable {}: {}", file, e.toString());
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException e) {
                        if (e != null) {
                            log.warn("Listing of {} stopped early: {}", dir, e.toString());
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });

        Collections.sort(found);
        return List.copyOf(found);
    }

    @Override
    public String read(Path file) throws IOException {
        // invalid UTF-8 sequences become replacement characters instead of failing the file
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private boolean isExcluded(Path dir) {
        Path name = dir.getFileName();
        return name != null && properties.getExcludeDirs().contains(name.toString());
    }

    private boolean hasSourceExtension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return properties.getExtensions().stream()
                .anyMatch(ext -> name.endsWith(ext.toLowerCase(Locale.ROOT)));
    }

    private boolean isWithinSizeLimit(Path file, long size) {
        if (size > properties.maxFileSizeBytes()) {
            log.warn("Skipping {} ({} bytes exceeds {} MB limit)", file, size, properties.getMaxFileSizeMb());
            return false;
        }
        return true;
    }
}
