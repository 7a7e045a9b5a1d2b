package com.plantwatch.detector.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.plantwatch.detector.analytics.ModelEvaluationService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(EvaluationController.class)
class EvaluationControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    ModelEvaluationService evaluationService;

    @Test
    void evaluatesFromStartOfRange() throws Exception {
        Instant from = Instant.parse("2024-03-01T00:00:00Z");
        when(evaluationService.evaluate(from, null)).thenReturn(List.of(new ModelEvaluationService.VariableEvaluation(
                "TI-1", 4, 10.0, 15.4, 8.3, null, 75.0, 1,
                new ModelEvaluationService.ResidualStats(7.5, 13.5, 2.5, -1.25, 11.25, -5.0, 30.0),
                1, 25.0, 40.0, 40.0)));

        mockMvc.perform(get("/evaluation").param("from", from.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.variables[0].variableId").value("TI-1"))
                .andExpect(jsonPath("$.variables[0].r2").isEmpty())
                .andExpect(jsonPath("$.variables[0].intervalCoveragePct").value(75.0))
                .andExpect(jsonPath("$.variables[0].residuals.median").value(2.5));
    }
}
