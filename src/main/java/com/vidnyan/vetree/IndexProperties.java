package com.vidnyan.vetree;

import com.vidnyan.vetree.domain.hierarchy.HierarchyOptions;
import com.vidnyan.vetree.domain.hierarchy.ResolveStrategy;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for indexing and hierarchy building.
 * Can be configured via application.properties or application.yml
 */
@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "vetree.index")
public class IndexProperties {

    /**
     * Directory to scan.
     * Default: current directory
     */
    private String rootPath = ".";

    /**
     * Source file suffixes, case-insensitive.
     */
    private List<String> extensions = new ArrayList<>(List.of(".v", ".sv"));

    /**
     * Directory names never descended into.
     */
    private List<String> excludeDirs = new ArrayList<>(List.of(".git", "node_modules", "out", "dist", "build"));

    /**
     * Resolve `ifdef regions before extraction. Off gives faster, less accurate scans.
     */
    private boolean enablePreprocess = true;

    private int maxHierarchyDepth = HierarchyOptions.DEFAULT_MAX_DEPTH;

    /**
     * "all" or "first".
     */
    private String hierarchyResolve = "all";

    private String hierarchyTopModule = "";

    /**
     * Files larger than this are left out of the scan.
     */
    private double maxFileSizeMb = 5;

    /**
     * Preprocessor symbols defined before the first file.
     */
    private List<String> defines = new ArrayList<>();

    /**
     * Keywords added to the built-in instantiation denylist.
     */
    private List<String> extraKeywords = new ArrayList<>();

    /**
     * Rebuild requests closer together than this collapse into one rebuild.
     */
    private long refreshDebounceMs = 300;

    private boolean scanOnStartup = false;

    @PostConstruct
    public void init() {
        if (maxHierarchyDepth <= 0) {
            log.warn("Invalid max-hierarchy-depth {}, using {}", maxHierarchyDepth, HierarchyOptions.DEFAULT_MAX_DEPTH);
            maxHierarchyDepth = HierarchyOptions.DEFAULT_MAX_DEPTH;
        }
        if (ResolveStrategy.parse(hierarchyResolve).isEmpty()) {
            log.warn("Unknown hierarchy-resolve '{}', using 'all'", hierarchyResolve);
            hierarchyResolve = "all";
        }
        if (refreshDebounceMs < 0) {
            refreshDebounceMs = 0;
        }
    }

    /**
     * Hierarchy settings derived from these properties.
     */
    public HierarchyOptions hierarchyOptions() {
        return new HierarchyOptions(
                maxHierarchyDepth,
                ResolveStrategy.parse(hierarchyResolve).orElse(ResolveStrategy.ALL),
                hierarchyTopModule == null ? "" : hierarchyTopModule.trim());
    }

    public long maxFileSizeBytes() {
        return (long) (maxFileSizeMb * 1024 * 1024);
    }
}
