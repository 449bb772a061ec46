package com.vidnyan.vetree.domain.extract;

import com.vidnyan.vetree.domain.model.DesignIndex;
import com.vidnyan.vetree.domain.model.ModuleDefinition;
import com.vidnyan.vetree.domain.model.SourceFile;
import com.vidnyan.vetree.domain.text.ConditionalPreprocessor;
import com.vidnyan.vetree.domain.text.SourceSanitizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs sanitize, preprocess and extract over source files.
 * <p>
 * Files are processed in the order given. The symbol set is copied once per run and then
 * shared across files, so a {@code `define} in an earlier file is visible to later ones.
 */
@Slf4j
public class DesignParser {

    private final StructuralExtractor extractor;

    public DesignParser(StructuralExtractor extractor) {
        this.extractor = extractor;
    }

    public DesignParser() {
        this(new StructuralExtractor());
    }

    /**
     * Parse one file. {@code defines} is mutated by the file's active directives.
     */
    public List<ModuleDefinition> parseFile(SourceFile file, Set<String> defines, boolean preprocess) {
        String clean = SourceSanitizer.sanitize(file.text());
        if (preprocess) {
            clean = ConditionalPreprocessor.preprocess(clean, defines);
        }
        return extractor.extract(file.filePath(), clean);
    }

    /**
     * Parse files in order and build a fresh index.
     */
    public DesignIndex parseAll(List<SourceFile> files, Set<String> initialDefines, boolean preprocess) {
        return parse(files, initialDefines, preprocess).index();
    }

    /**
     * Parse files in order. A file that fails to parse is logged and counted, and the
     * remaining files are still indexed.
     */
    public ParseResult parse(List<SourceFile> files, Set<String> initialDefines, boolean preprocess) {
        Set<String> defines = new LinkedHashSet<>(initialDefines);
        List<ModuleDefinition> modules = new ArrayList<>();
        int parsed = 0;
        int failed = 0;

        for (SourceFile file : files) {
            try {
                List<ModuleDefinition> found = parseFile(file, defines, preprocess);
                modules.addAll(found);
                parsed++;
                log.debug("  {}: {} modules", file.filePath(), found.size());
            } catch (RuntimeException e) {
                failed++;
                log.warn("Failed to parse {}: {}", file.filePath(), e.getMessage());
            }
        }
        return new ParseResult(DesignIndex.of(modules), parsed, failed);
    }

    public record ParseResult(
        DesignIndex index,
        int filesParsed,
        int filesFailed
    ) {}
}
