package com.vidnyan.vetree.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.vetree.application.port.in.IndexDesignUseCase;
import com.vidnyan.vetree.application.port.in.IndexDesignUseCase.ScanSummary;
import com.vidnyan.vetree.application.port.in.NavigateDesignUseCase;
import com.vidnyan.vetree.domain.hierarchy.HierarchyForest;
import com.vidnyan.vetree.domain.hierarchy.HierarchyNode;
import com.vidnyan.vetree.domain.model.DesignIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CLI Runner for one-shot indexing.
 * Runs when vetree.analyze.path is set, prints the index and hierarchy, then exits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IndexCliRunner implements CommandLineRunner {

    private static final int MAX_PRINTED_NODES = 500;

    private final IndexDesignUseCase indexDesignUseCase;
    private final NavigateDesignUseCase navigateDesignUseCase;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext context;

    @Value("${vetree.analyze.path:}")
    private String sourcePath;

    @Value("${vetree.analyze.output:}")
    private String outputPath;

    private int printedNodes;

    @Override
    public void run(String... args) throws Exception {
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set vetree.analyze.path property.");
            return;
        }

        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║               VETREE - Verilog Design Indexer                ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Indexing: {}", truncatePath(sourcePath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            ScanSummary summary = indexDesignUseCase.refresh(Path.of(sourcePath));
            HierarchyForest forest = navigateDesignUseCase.hierarchy();

            printSummary(summary);
            printHierarchy(forest);

            if (outputPath != null && !outputPath.isBlank()) {
                writeJson(summary, forest);
            }

            log.info("");
            log.info("Indexing complete!");
        } finally {
            SpringApplication.exit(context, () -> 0);
        }
    }

    private void printSummary(ScanSummary summary) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" INDEX SUMMARY");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files found:    {}", summary.filesDiscovered());
        log.info(" Files parsed:   {}", summary.filesParsed());
        log.info(" Files failed:   {}", summary.filesFailed());
        log.info(" Modules:        {}", summary.moduleCount());
        log.info(" Instances:      {}", summary.instanceCount());
        log.info(" Duration:       {}ms", summary.durationMs());
        log.info("───────────────────────────────────────────────────────────────");

        if (summary.duplicateNameCount() > 0) {
            log.info(" DUPLICATE MODULE NAMES: {}", summary.duplicateNameCount());
            navigateDesignUseCase.duplicates().forEach((name, files) ->
                    log.info("   {} defined in {}", name, files));
            log.info("───────────────────────────────────────────────────────────────");
        }
    }

    private void printHierarchy(HierarchyForest forest) {
        log.info(" HIERARCHY ({} roots)", forest.roots().size());
        if (forest.isEmpty()) {
            log.info("   (no root modules)");
            return;
        }
        printedNodes = 0;
        for (HierarchyNode tree : forest.trees()) {
            printNode(tree, 1);
        }
        if (printedNodes >= MAX_PRINTED_NODES) {
            log.info(" ... {} nodes total", forest.stats().nodeCount());
        }
        HierarchyForest.Stats stats = forest.stats();
        log.info(" Cycles: {}  Depth-limited: {}  External: {}",
                stats.cycleHits(), stats.depthLimitHits(), stats.externalHits());
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private void printNode(HierarchyNode node, int indent) {
        if (printedNodes >= MAX_PRINTED_NODES) {
            return;
        }
        printedNodes++;
        String where = node.navigationTarget() != null ? "  (" + node.navigationTarget().format() + ")" : "";
        log.info("{}{}{}", "  ".repeat(indent), node.label(), where);
        for (HierarchyNode child : node.children()) {
            printNode(child, indent + 1);
        }
    }

    private void writeJson(ScanSummary summary, HierarchyForest forest) throws IOException {
        DesignIndex index = indexDesignUseCase.currentIndex().orElse(DesignIndex.empty());
        Map<String, Object> export = new LinkedHashMap<>();
        export.put("summary", summary);
        export.put("modules", index.modules());
        export.put("hierarchy", forest);
        objectMapper.writeValue(Path.of(outputPath).toFile(), export);
        log.info(" Wrote JSON export to {}", outputPath);
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
