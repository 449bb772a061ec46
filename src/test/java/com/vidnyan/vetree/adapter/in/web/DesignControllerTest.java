package com.vidnyan.vetree.adapter.in.web;

import com.vidnyan.vetree.application.port.in.IndexDesignUseCase;
import com.vidnyan.vetree.application.port.in.NavigateDesignUseCase;
import com.vidnyan.vetree.application.service.RefreshScheduler;
import com.vidnyan.vetree.domain.connection.ConnectionMatch;
import com.vidnyan.vetree.domain.extract.DesignParser;
import com.vidnyan.vetree.domain.hierarchy.HierarchyBuilder;
import com.vidnyan.vetree.domain.hierarchy.HierarchyOptions;
import com.vidnyan.vetree.domain.model.DesignIndex;
import com.vidnyan.vetree.domain.model.PortBinding;
import com.vidnyan.vetree.domain.model.SourceFile;
import com.vidnyan.vetree.domain.model.SourceLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DesignControllerTest {

    @Mock
    private IndexDesignUseCase indexDesignUseCase;
    @Mock
    private NavigateDesignUseCase navigateDesignUseCase;
    @Mock
    private RefreshScheduler refreshScheduler;

    private MockMvc mockMvc;

    private final DesignIndex index = new DesignParser().parseAll(List.of(new SourceFile("top.v",
            "module top(input clk);\n  leaf u_leaf (.clk(clk));\nendmodule\nmodule leaf(input clk);\nendmodule\n")),
            Set.of(), true);

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new DesignController(indexDesignUseCase, navigateDesignUseCase, refreshScheduler))
                .build();
    }

    @Test
    void refresh_ShouldScheduleRescan() throws Exception {
        mockMvc.perform(post("/api/design/refresh"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.scheduled").value(true));

        verify(refreshScheduler).requestRefresh();
    }

    @Test
    void summary_ShouldBeEmptyBeforeFirstScan() throws Exception {
        when(indexDesignUseCase.lastSummary()).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/design/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.filesDiscovered").value(0))
                .andExpect(jsonPath("$.moduleCount").value(0))
                .andExpect(jsonPath("$.duplicateNames").isEmpty());
    }

    @Test
    void modules_ShouldListEntries() throws Exception {
        when(indexDesignUseCase.currentIndex()).thenReturn(Optional.of(index));

        mockMvc.perform(get("/api/design/modules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].name").value("top"))
                .andExpect(jsonPath("$[0].instanceCount").value(1))
                .andExpect(jsonPath("$[1].portCount").value(1));
    }

    @Test
    void module_ShouldReturnNotFoundForUnknownName() throws Exception {
        when(navigateDesignUseCase.findModules("nope")).thenReturn(List.of());

        mockMvc.perform(get("/api/design/modules/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    void hierarchy_ShouldRenderForest() throws Exception {
        when(navigateDesignUseCase.hierarchy())
                .thenReturn(HierarchyBuilder.build(index, HierarchyOptions.defaults()));

        mockMvc.perform(get("/api/design/hierarchy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roots[0]").value("top"))
                .andExpect(jsonPath("$.trees[0].children[0].label").value("u_leaf: leaf"));
    }

    @Test
    void hierarchy_ShouldBuildFromRequestedRoot() throws Exception {
        when(navigateDesignUseCase.hierarchyFrom("leaf"))
                .thenReturn(HierarchyBuilder.buildFrom(index, "leaf", HierarchyOptions.defaults()));

        mockMvc.perform(get("/api/design/hierarchy").param("root", "leaf"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.trees[0].label").value("leaf"));
    }

    @Test
    void connections_ShouldDelegateToNavigation() throws Exception {
        SourceLocation at = SourceLocation.at("top.v", 2, 3);
        ConnectionMatch match = new ConnectionMatch("clk",
                new PortBinding("clk", "clk", at), new PortBinding("ck", "clk", at), at);
        when(navigateDesignUseCase.connections("top", "u_a", "u_b")).thenReturn(List.of(match));

        mockMvc.perform(get("/api/design/connections")
                        .param("parent", "top").param("left", "u_a").param("right", "u_b"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].net").value("clk"))
                .andExpect(jsonPath("$[0].right.portName").value("ck"));
    }
}
