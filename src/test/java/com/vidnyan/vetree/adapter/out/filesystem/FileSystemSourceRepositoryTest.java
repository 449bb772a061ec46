package com.vidnyan.vetree.adapter.out.filesystem;

import com.vidnyan.vetree.IndexProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class FileSystemSourceRepositoryTest {

    @TempDir
    Path tempDir;

    private IndexProperties properties;
    private FileSystemSourceRepository repository;

    @BeforeEach
    void setUp() {
        properties = new IndexProperties();
        repository = new FileSystemSourceRepository(properties);
    }

    @Test
    void discover_ShouldFindSourcesInSortedOrder() throws IOException {
        // Arrange
        Files.createDirectories(tempDir.resolve("sub"));
        Files.createDirectories(tempDir.resolve("build"));
        Files.createDirectories(tempDir.resolve(".git"));
        Files.writeString(tempDir.resolve("sub/c.sv"), "module c; endmodule");
        Files.writeString(tempDir.resolve("a.v"), "module a; endmodule");
        Files.writeString(tempDir.resolve("B.SV"), "module b; endmodule");
        Files.writeString(tempDir.resolve("notes.txt"), "module n; endmodule");
        Files.writeString(tempDir.resolve("build/gen.v"), "module gen; endmodule");
        Files.writeString(tempDir.resolve(".git/hook.v"), "module hook; endmodule");

        // Act
        List<Path> results = repository.discover(tempDir);

        // Assert
        assertEquals(List.of(tempDir.resolve("B.SV"), tempDir.resolve("a.v"), tempDir.resolve("sub/c.sv")), results);
    }

    @Test
    void discover_ShouldUseConfiguredExtensionsAndExcludes() throws IOException {
        properties.setExtensions(List.of(".vh"));
        properties.setExcludeDirs(List.of("vendor"));
        Files.createDirectories(tempDir.resolve("vendor"));
        Files.createDirectories(tempDir.resolve("build"));
        Files.writeString(tempDir.resolve("defs.vh"), "`define W 8");
        Files.writeString(tempDir.resolve("top.v"), "module top; endmodule");
        Files.writeString(tempDir.resolve("vendor/ip.vh"), "");
        Files.writeString(tempDir.resolve("build/gen.vh"), "");

        assertEquals(List.of(tempDir.resolve("build/gen.vh"), tempDir.resolve("defs.vh")), repository.discover(tempDir));
    }

    @Test
    void discover_ShouldSkipFilesOverSizeLimit() throws IOException {
        properties.setMaxFileSizeMb(0.001);
        Files.writeString(tempDir.resolve("small.v"), "module small; endmodule");
        Files.writeString(tempDir.resolve("big.v"), "// " + "x".repeat(4096));

        assertEquals(List.of(tempDir.resolve("small.v")), repository.discover(tempDir));
    }

    @Test
    void discover_ShouldSkipSymlinkLoopsAndKeepScanning() throws IOException {
        Path ip = Files.createDirectories(tempDir.resolve("ip"));
        Files.writeString(ip.resolve("core.v"), "module core; endmodule");
        Files.writeString(tempDir.resolve("top.v"), "module top; endmodule");
        try {
            Files.createSymbolicLink(ip.resolve("loop"), tempDir);
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported");
        }

        assertEquals(List.of(ip.resolve("core.v"), tempDir.resolve("top.v")), repository.discover(tempDir));
    }

    @Test
    void discover_ShouldPruneExcludedDirectories() throws IOException {
        Path vendor = Files.createDirectories(tempDir.resolve("rtl/node_modules/pkg"));
        Files.writeString(vendor.resolve("dep.v"), "module dep; endmodule");
        Files.createSymbolicLink(tempDir.resolve("rtl/node_modules/loop"), tempDir);
        Files.writeString(tempDir.resolve("rtl/top.v"), "module top; endmodule");

        assertEquals(List.of(tempDir.resolve("rtl/top.v")), repository.discover(tempDir));
    }

    @Test
    void discover_ShouldSkipUnreadableDirectory() throws IOException {
        Path locked = Files.createDirectories(tempDir.resolve("locked"));
        Files.writeString(locked.resolve("hidden.v"), "module hidden; endmodule");
        Files.writeString(tempDir.resolve("top.v"), "module top; endmodule");
        try {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        } catch (UnsupportedOperationException e) {
            assumeTrue(false, "POSIX permissions not supported");
        }
        try {
            assumeFalse(Files.isReadable(locked), "permissions are not enforced for this user");

            assertEquals(List.of(tempDir.resolve("top.v")), repository.discover(tempDir));
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    void discover_ShouldRejectMissingDirectory() {
        assertThrows(IOException.class, () -> repository.discover(tempDir.resolve("missing")));
    }

    @Test
    void read_ShouldReplaceInvalidUtf8() throws IOException {
        Path file = tempDir.resolve("bad.v");
        Files.write(file, new byte[] {'m', (byte) 0xFF, 'x'});

        assertEquals("m\uFFFDx", repository.read(file));
    }
}
