package com.vidnyan.vetree.domain.extract;

import com.vidnyan.vetree.domain.model.DesignIndex;
import com.vidnyan.vetree.domain.model.InstanceReference;
import com.vidnyan.vetree.domain.model.ModuleDefinition;
import com.vidnyan.vetree.domain.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DesignParserTest {

    private static final SourceFile DEFINES = new SourceFile("defs.v", "`define USE_FAST\n");

    private static final SourceFile CORE_SELECT = new SourceFile("top.v", """
            module top(input clk);
            `ifdef USE_FAST
              fast_core u_core (.clk(clk));
            `else
              slow_core u_core (.clk(clk));
            `endif
            endmodule
            """);

    private final DesignParser parser = new DesignParser();

    @Test
    void parseFile_ShouldIgnoreInstancesInCommentsAndStrings() {
        SourceFile file = new SourceFile("a.v", """
                module a;
                  // dead u_dead (.x(y));
                  /* old u_old (
                     .x(y)); */
                  (* keep_hierarchy *) live u_live (.x(y));
                  initial $display("fake u_fake (.x(y));");
                endmodule
                """);

        List<ModuleDefinition> modules = parser.parseFile(file, new HashSet<>(), true);

        assertEquals(List.of("u_live"), modules.get(0).instances().stream()
                .map(InstanceReference::instanceName).toList());
        assertEquals(5, modules.get(0).instances().get(0).location().line());
    }

    @Test
    void parseAll_ShouldCarryDefinesAcrossFilesInOrder() {
        DesignIndex index = parser.parseAll(List.of(DEFINES, CORE_SELECT), Set.of(), true);

        assertEquals("fast_core", index.findModules("top").get(0).instances().get(0).moduleName());
    }

    @Test
    void parseAll_ShouldNotSeeDefinesFromLaterFiles() {
        DesignIndex index = parser.parseAll(List.of(CORE_SELECT, DEFINES), Set.of(), true);

        assertEquals("slow_core", index.findModules("top").get(0).instances().get(0).moduleName());
    }

    @Test
    void parseAll_ShouldUseInitialDefinesWithoutMutatingThem() {
        Set<String> initial = new HashSet<>(Set.of("USE_FAST"));

        DesignIndex index = parser.parseAll(List.of(new SourceFile("u.v", "`undef USE_FAST\n"), CORE_SELECT),
                initial, true);

        assertEquals("slow_core", index.findModules("top").get(0).instances().get(0).moduleName());
        assertEquals(Set.of("USE_FAST"), initial);
    }

    @Test
    void parseAll_WithoutPreprocessShouldSeeEveryBranch() {
        DesignIndex index = parser.parseAll(List.of(DEFINES, CORE_SELECT), Set.of(), false);

        assertEquals(List.of("fast_core", "slow_core"), index.findModules("top").get(0).instances().stream()
                .map(InstanceReference::moduleName).toList());
    }

    @Test
    void parse_ShouldCountFailedFilesAndIndexTheRest() {
        StructuralExtractor extractor = spy(new StructuralExtractor());
        doThrow(new IllegalStateException("bad input")).when(extractor).extract(eq("bad.v"), anyString());
        DesignParser failing = new DesignParser(extractor);

        DesignParser.ParseResult result = failing.parse(List.of(
                new SourceFile("bad.v", "module bad;\nendmodule\n"),
                new SourceFile("good.v", "module good;\nendmodule\n")), Set.of(), true);

        assertEquals(1, result.filesParsed());
        assertEquals(1, result.filesFailed());
        assertTrue(result.index().isDefined("good"));
        assertFalse(result.index().isDefined("bad"));
    }

    @Test
    void parseFile_ShouldKeepLineNumbersAfterInactiveRegions() {
        List<ModuleDefinition> modules = parser.parseFile(CORE_SELECT, new HashSet<>(), true);

        InstanceReference slow = modules.get(0).instances().get(0);
        assertEquals("slow_core", slow.moduleName());
        assertEquals(5, slow.location().line());
        assertEquals(3, slow.location().column());
    }
}
