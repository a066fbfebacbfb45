package com.aquifer.wellfield.web;

import com.aquifer.wellfield.domain.OptimizationMethod;
import com.aquifer.wellfield.domain.OptimizationResult;
import com.aquifer.wellfield.domain.OptimizationStatus;
import com.aquifer.wellfield.domain.SitingResult;
import com.aquifer.wellfield.domain.SolverSettings;
import com.aquifer.wellfield.service.WellfieldService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WellfieldController.class)
class WellfieldControllerTest {

    private static final String ALLOCATION = """
            {
              "wells": [{"name": "W1", "x": 0, "y": 0}, {"name": "W2", "x": 500, "y": 0}],
              "transmissivity": 500,
              "storativity": %s,
              "initialHead": 50,
              "maxRates": [1500, 1500],
              "constraintPoints": [{"name": "P1", "x": 250, "y": 200, "minHead": 45}],
              "time": 100%s
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WellfieldService wellfieldService;

    @Test
    void allocationDefaultsToLinear() throws Exception {
        when(wellfieldService.optimizeAllocation(any(), eq(OptimizationMethod.LINEAR), isNull()))
                .thenReturn(OptimizationResult.builder()
                        .method(OptimizationMethod.LINEAR)
                        .status(OptimizationStatus.OPTIMAL)
                        .success(true)
                        .authoritative(true)
                        .rates(new double[]{1200, 1200})
                        .totalRate(2400)
                        .build());

        mockMvc.perform(post("/api/v1/allocation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ALLOCATION.formatted("0.0002", "")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.status").value("OPTIMAL"))
                .andExpect(jsonPath("$.totalRate").value(2400.0));

        verify(wellfieldService).optimizeAllocation(any(), eq(OptimizationMethod.LINEAR), isNull());
    }

    @Test
    void infeasibleAllocationIsStillOk() throws Exception {
        when(wellfieldService.optimizeAllocation(any(), any(), any()))
                .thenReturn(OptimizationResult.builder()
                        .method(OptimizationMethod.LINEAR)
                        .status(OptimizationStatus.INFEASIBLE)
                        .success(false)
                        .message("Infeasible")
                        .build());

        mockMvc.perform(post("/api/v1/allocation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ALLOCATION.formatted("0.0002", "")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.status").value("INFEASIBLE"));
    }

    @Test
    void storativityAboveOneIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/allocation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ALLOCATION.formatted("1.5", "")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Parameter"));

        verifyNoInteractions(wellfieldService);
    }

    @Test
    void partialSettingsKeepConfiguredValuesForAbsentFields() throws Exception {
        when(wellfieldService.defaultSettings()).thenReturn(SolverSettings.defaults());
        when(wellfieldService.optimizeAllocation(any(), any(), any()))
                .thenReturn(OptimizationResult.builder().status(OptimizationStatus.OPTIMAL).success(true).build());

        mockMvc.perform(post("/api/v1/allocation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ALLOCATION.formatted("0.0002",
                                ",\n  \"method\": \"NONLINEAR\", \"settings\": {\"timeLimitMs\": 5000}")))
                .andExpect(status().isOk());

        ArgumentCaptor<SolverSettings> captor = ArgumentCaptor.forClass(SolverSettings.class);
        verify(wellfieldService).optimizeAllocation(any(), eq(OptimizationMethod.NONLINEAR), captor.capture());
        SolverSettings used = captor.getValue();
        assertEquals(5000L, used.getTimeLimitMs());
        assertEquals(SolverSettings.defaults().getMaxIterations(), used.getMaxIterations());
        assertEquals(SolverSettings.defaults().getFeasibilityTolerance(), used.getFeasibilityTolerance());
        assertEquals(SolverSettings.defaults().getFiniteDifferenceStep(), used.getFiniteDifferenceStep());
    }

    @Test
    void outOfRangeSettingsAreBadRequest() throws Exception {
        when(wellfieldService.defaultSettings()).thenReturn(SolverSettings.defaults());

        mockMvc.perform(post("/api/v1/allocation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(ALLOCATION.formatted("0.0002", ",\n  \"settings\": {\"maxIterations\": 0}")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Parameter"));

        verify(wellfieldService, never()).optimizeAllocation(any(), any(), any());
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/allocation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed Request"));
    }

    @Test
    void sitingPassesSeedThrough() throws Exception {
        when(wellfieldService.searchSiting(any(), any(), eq(7L)))
                .thenReturn(SitingResult.builder().feasible(true).iterations(100).build());

        mockMvc.perform(post("/api/v1/siting")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "wellCount": 2, "minX": 0, "maxX": 100, "minY": 0, "maxY": 100,
                                  "totalDemand": 500, "transmissivity": 500, "storativity": 0.0002,
                                  "initialHead": 50, "time": 10, "maxIterations": 100, "seed": 7,
                                  "constraintPoints": [{"x": 50, "y": 50, "maxDrawdown": 2}]
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.feasible").value(true))
                .andExpect(jsonPath("$.iterations").value(100));
    }

    @Test
    void drawdownWithoutWellsIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/drawdown")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"wells": [], "transmissivity": 500, "storativity": 0.0002,
                                 "xs": [10], "ys": [0], "time": 1}
                                """))
                .andExpect(status().isBadRequest());
    }
}
