package co.fanki.componentflow.analysis.application;

import co.fanki.componentflow.analysis.application.ComponentFlowService.ComponentFlowAnalysis;
import co.fanki.componentflow.analysis.application.ComponentFlowService.EntryFlow;
import co.fanki.componentflow.analysis.application.ComponentFlowService.FlowSummary;
import co.fanki.componentflow.analysis.domain.FlowNode;
import co.fanki.componentflow.analysis.domain.MarkupElementStats;
import co.fanki.componentflow.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for {@link ComponentFlowController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ComponentFlowControllerTest {

    private static final String REQUEST = """
            {
              "projectRoot": "/work/shop",
              "entryFiles": ["src/App.tsx"],
              "config": { "maxDepth": 3 }
            }
            """;

    private ComponentFlowService service;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        service = mock(ComponentFlowService.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new ComponentFlowController(service))
                .build();
    }

    @Test
    void whenAnalyzing_givenValidRequest_shouldReturnAnalysis()
            throws Exception {
        final FlowNode app = FlowNode.leaf("App", "/work/shop/src/App.tsx");
        when(service.analyze(any())).thenReturn(new ComponentFlowAnalysis(
                List.of(new EntryFlow("/work/shop/src/App.tsx", app)),
                List.of(),
                new FlowSummary(1, 1, 0, 0, 0, 0, false),
                List.of()));

        mockMvc.perform(post("/api/component-flow/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries[0].flow.name").value("App"))
                .andExpect(jsonPath("$.entries[0].flow.isExternal")
                        .value(false))
                .andExpect(jsonPath("$.summary.totalEntries").value(1));
    }

    @Test
    void whenAnalyzing_givenDomainFailure_shouldAnswerBadRequest()
            throws Exception {
        when(service.analyze(any())).thenThrow(new DomainException(
                "projectRoot is required", "INVALID_REQUEST"));

        mockMvc.perform(post("/api/component-flow/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("projectRoot is required"))
                .andExpect(jsonPath("$.errorCode").value("INVALID_REQUEST"));
    }

    @Test
    void whenAnalyzing_givenInvalidConfig_shouldAnswerInvalidConfig()
            throws Exception {
        when(service.analyze(any())).thenThrow(new IllegalArgumentException(
                "maxDepth must be >= 1 but was 0"));

        mockMvc.perform(post("/api/component-flow/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(REQUEST))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_CONFIG"));
    }

    @Test
    void whenCountingMarkup_givenFile_shouldReturnStats() throws Exception {
        when(service.analyzeMarkupElements(any())).thenReturn(
                new MarkupElementStats("/work/shop/src/App.tsx", 2,
                        Map.of("div", 2), 1));

        mockMvc.perform(post("/api/component-flow/markup-elements")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filePath\":\"src/App.tsx\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(2))
                .andExpect(jsonPath("$.byTag.div").value(2));
    }
}
