package com.taxdesk.engine.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxdesk.engine.controller.dto.DeductionAnalysisRequestDto;
import com.taxdesk.engine.controller.dto.TaxLiabilityRequestDto;
import java.math.BigDecimal;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class TaxControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @Test
    void computesLiabilityFromProvidedFigures() throws Exception {
        var request = new TaxLiabilityRequestDto("web-tax-1", "sole_proprietorship", "CA", "single", 2024, null,
                new BigDecimal("120000"), new BigDecimal("20000"));

        mockMvc.perform(post("/tax/liability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.projectionMethod").value("PROVIDED"))
                .andExpect(jsonPath("$.calculation.entityType").value("SOLE_PROPRIETORSHIP"))
                .andExpect(jsonPath("$.calculation.totalTax").value(32240.55))
                .andExpect(jsonPath("$.quarterlyEstimates.installments.length()").value(4))
                .andExpect(jsonPath("$.recommendations.length()").value(3));
    }

    @Test
    void unknownEntityTypeIsBadRequest() throws Exception {
        var request = new TaxLiabilityRequestDto("web-tax-2", "llc", "CA", null, 2024, null,
                new BigDecimal("120000"), new BigDecimal("20000"));

        mockMvc.perform(post("/tax/liability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorKind").value("UNSUPPORTED_ENTITY_TYPE"));
    }

    @Test
    void missingTablesIsServerError() throws Exception {
        var request = new TaxLiabilityRequestDto("web-tax-3", "c_corp", "NY", null, 2031, null,
                new BigDecimal("500000"), new BigDecimal("300000"));

        mockMvc.perform(post("/tax/liability")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorKind").value("CONFIGURATION_ERROR"));
    }

    @Test
    void analyzesDeductionsForDefaultYear() throws Exception {
        var request = new DeductionAnalysisRequestDto("web-tax-4", null,
                Map.of("Meals & Entertainment", Map.of("Business Meals", new BigDecimal("6000"))));

        mockMvc.perform(post("/tax/deductions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.taxYear").value(2024))
                .andExpect(jsonPath("$.totalExpenses").value(6000.00))
                .andExpect(jsonPath("$.categories[0].deductiblePercentage").value(50))
                .andExpect(jsonPath("$.recommendations[0].type").value("meals_optimization"));
    }
}
