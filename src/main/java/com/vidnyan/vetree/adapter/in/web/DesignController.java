package com.vidnyan.vetree.adapter.in.web;

import com.vidnyan.vetree.application.port.in.IndexDesignUseCase;
import com.vidnyan.vetree.application.port.in.IndexDesignUseCase.ScanSummary;
import com.vidnyan.vetree.application.port.in.NavigateDesignUseCase;
import com.vidnyan.vetree.application.port.in.NavigateDesignUseCase.ModulePorts;
import com.vidnyan.vetree.application.service.RefreshScheduler;
import com.vidnyan.vetree.domain.connection.ConnectionMatch;
import com.vidnyan.vetree.domain.hierarchy.HierarchyForest;
import com.vidnyan.vetree.domain.model.ModuleDefinition;
import com.vidnyan.vetree.domain.model.SourceLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API over the design index.
 */
@Slf4j
@RestController
@RequestMapping("/api/design")
@RequiredArgsConstructor
public class DesignController {

    private final IndexDesignUseCase indexDesignUseCase;
    private final NavigateDesignUseCase navigateDesignUseCase;
    private final RefreshScheduler refreshScheduler;

    /**
     * Request a rescan. Bursts of requests collapse into one rescan.
     */
    @PostMapping("/refresh")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public RefreshResponse refresh() {
        log.info("Received refresh request");
        refreshScheduler.requestRefresh();
        return new RefreshResponse(true);
    }

    @GetMapping("/summary")
    public ScanSummary summary() {
        return indexDesignUseCase.lastSummary().orElse(ScanSummary.empty());
    }

    @GetMapping("/modules")
    public List<ModuleEntry> modules() {
        return indexDesignUseCase.currentIndex()
                .map(index -> index.modules().stream().map(ModuleEntry::of).toList())
                .orElse(List.of());
    }

    @GetMapping("/modules/{name}")
    public List<ModuleDefinition> module(@PathVariable String name) {
        List<ModuleDefinition> modules = navigateDesignUseCase.findModules(name);
        if (modules.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Module not found: " + name);
        }
        return modules;
    }

    @GetMapping("/modules/{name}/ports")
    public ModulePorts ports(@PathVariable String name, @RequestParam(required = false) String file) {
        return navigateDesignUseCase.modulePorts(name, file)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Module not found: " + name));
    }

    @GetMapping("/files")
    public Map<String, List<ModuleEntry>> files() {
        Map<String, List<ModuleEntry>> result = new LinkedHashMap<>();
        navigateDesignUseCase.modulesByFile().forEach((file, modules) ->
                result.put(file, modules.stream().map(ModuleEntry::of).toList()));
        return result;
    }

    @GetMapping("/definitions")
    public List<SourceLocation> definitions(@RequestParam String word) {
        return navigateDesignUseCase.findDefinitions(word);
    }

    @GetMapping("/hierarchy")
    public HierarchyForest hierarchy(@RequestParam(required = false) String root) {
        if (root == null || root.isBlank()) {
            return navigateDesignUseCase.hierarchy();
        }
        return navigateDesignUseCase.hierarchyFrom(root);
    }

    @GetMapping("/connections")
    public List<ConnectionMatch> connections(@RequestParam String parent,
                                             @RequestParam String left,
                                             @RequestParam String right) {
        return navigateDesignUseCase.connections(parent, left, right);
    }

    @GetMapping("/duplicates")
    public Map<String, List<String>> duplicates() {
        return navigateDesignUseCase.duplicates();
    }

    public record RefreshResponse(boolean scheduled) {}

    /**
     * Module summary without ports and instances.
     */
    public record ModuleEntry(
        String name,
        String filePath,
        SourceLocation location,
        int portCount,
        int instanceCount
    ) {
        static ModuleEntry of(ModuleDefinition module) {
            return new ModuleEntry(module.name(), module.filePath(), module.location(),
                    module.ports().size(), module.instances().size());
        }
    }
}
