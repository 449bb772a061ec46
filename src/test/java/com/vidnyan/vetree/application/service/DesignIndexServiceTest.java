package com.vidnyan.vetree.application.service;

import com.vidnyan.vetree.IndexProperties;
import com.vidnyan.vetree.adapter.out.filesystem.FileSystemSourceRepository;
import com.vidnyan.vetree.application.port.in.IndexDesignUseCase.ScanSummary;
import com.vidnyan.vetree.application.port.out.SourceFileRepository;
import com.vidnyan.vetree.domain.extract.DesignParser;
import com.vidnyan.vetree.domain.model.DesignIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DesignIndexServiceTest {

    @TempDir
    Path tempDir;

    private final IndexProperties properties = new IndexProperties();

    private DesignIndexService serviceOnDisk() {
        return new DesignIndexService(new FileSystemSourceRepository(properties), new DesignParser(), properties);
    }

    @Test
    void refresh_ShouldIndexSourceTree() throws IOException {
        Files.writeString(tempDir.resolve("a_defs.vh"), "`define USE_FAST\n");
        Files.writeString(tempDir.resolve("leaf.v"), "module leaf(input a);\nendmodule\n");
        Files.writeString(tempDir.resolve("top.sv"), """
                module top;
                `ifdef USE_FAST
                  leaf u_fast (.a(x));
                `else
                  leaf u_slow (.a(x));
                `endif
                endmodule
                """);
        properties.setExtensions(List.of(".v", ".sv", ".vh"));
        DesignIndexService service = serviceOnDisk();

        ScanSummary summary = service.refresh(tempDir);

        assertEquals(3, summary.filesDiscovered());
        assertEquals(3, summary.filesParsed());
        assertEquals(0, summary.filesFailed());
        assertEquals(2, summary.moduleCount());
        assertEquals(1, summary.instanceCount());
        DesignIndex index = service.currentIndex().orElseThrow();
        assertEquals("u_fast", index.findModules("top").get(0).instances().get(0).instanceName());
        assertEquals(summary, service.lastSummary().orElseThrow());
    }

    @Test
    void refresh_ShouldApplyConfiguredDefines() throws IOException {
        Files.writeString(tempDir.resolve("top.v"), "module top;\n`ifdef SIM\n  tb_only u_tb ();\n`endif\nendmodule\n");
        DesignIndexService service = serviceOnDisk();

        assertEquals(0, service.refresh(tempDir).instanceCount());

        properties.setDefines(List.of("SIM"));
        assertEquals(1, service.refresh(tempDir).instanceCount());
    }

    @Test
    void refresh_ShouldReplacePreviousIndex() throws IOException {
        Files.writeString(tempDir.resolve("a.v"), "module a;\nendmodule\n");
        DesignIndexService service = serviceOnDisk();
        service.refresh(tempDir);
        DesignIndex first = service.currentIndex().orElseThrow();

        Files.writeString(tempDir.resolve("a.v"), "module renamed;\nendmodule\n");
        service.refresh(tempDir);

        DesignIndex second = service.currentIndex().orElseThrow();
        assertNotSame(first, second);
        assertTrue(first.isDefined("a"));
        assertFalse(second.isDefined("a"));
        assertTrue(second.isDefined("renamed"));
    }

    @Test
    void refresh_ShouldCountUnreadableFilesAndContinue() throws IOException {
        SourceFileRepository repository = mock(SourceFileRepository.class);
        Path broken = Path.of("broken.v");
        Path good = Path.of("good.v");
        when(repository.discover(any())).thenReturn(List.of(broken, good));
        when(repository.read(broken)).thenThrow(new IOException("permission denied"));
        when(repository.read(good)).thenReturn("module good;\nendmodule\n");
        DesignIndexService service = new DesignIndexService(repository, new DesignParser(), properties);

        ScanSummary summary = service.refresh(Path.of("."));

        assertEquals(2, summary.filesDiscovered());
        assertEquals(1, summary.filesParsed());
        assertEquals(1, summary.filesFailed());
        assertTrue(service.currentIndex().orElseThrow().isDefined("good"));
    }

    @Test
    void refresh_ShouldPublishEmptyIndexWhenRootIsMissing() {
        DesignIndexService service = serviceOnDisk();

        ScanSummary summary = service.refresh(tempDir.resolve("missing"));

        assertEquals(0, summary.filesDiscovered());
        assertTrue(service.currentIndex().orElseThrow().isEmpty());
    }

    @Test
    void currentIndex_ShouldBeEmptyBeforeFirstScan() {
        DesignIndexService service = serviceOnDisk();

        assertTrue(service.currentIndex().isEmpty());
        assertTrue(service.lastSummary().isEmpty());
    }

    @Test
    void refresh_ShouldReportDuplicateNames() throws IOException {
        Files.writeString(tempDir.resolve("a.v"), "module fifo;\nendmodule\n");
        Files.writeString(tempDir.resolve("b.v"), "module fifo;\nendmodule\n");

        ScanSummary summary = serviceOnDisk().refresh(tempDir);

        assertEquals(List.of("fifo"), summary.duplicateNames());
        assertEquals(1, summary.duplicateNameCount());
    }
}
