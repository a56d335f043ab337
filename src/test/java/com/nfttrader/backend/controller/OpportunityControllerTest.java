package com.nfttrader.backend.controller;

import com.nfttrader.backend.model.OpportunityType;
import com.nfttrader.backend.model.TradingOpportunity;
import com.nfttrader.backend.service.OpportunityScannerService;
import com.nfttrader.backend.service.strategy.OpportunityStrategy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OpportunityController.class)
public class OpportunityControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OpportunityScannerService opportunityScannerService;

    @Test
    void scanOpportunities_shouldReturnFreshResults() throws Exception {
        when(opportunityScannerService.scanOpportunities("0xowner")).thenReturn(List.of(
                TradingOpportunity.builder().id("flip-0xc-7").type(OpportunityType.FLIP).build()));

        mockMvc.perform(post("/api/nft/owners/0xowner/opportunities/scan"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalOpportunities").value(1))
                .andExpect(jsonPath("$.data[0].type").value("flip"));
    }

    @Test
    void scanOpportunities_shouldReturnServerErrorOnFailure() throws Exception {
        when(opportunityScannerService.scanOpportunities("0xowner")).thenThrow(new IllegalStateException("down"));

        mockMvc.perform(post("/api/nft/owners/0xowner/opportunities/scan"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Failed to scan opportunities: down"));
    }

    @Test
    void getOpportunities_shouldReturnCachedResults() throws Exception {
        when(opportunityScannerService.getOpportunities("0xowner")).thenReturn(List.of());

        mockMvc.perform(get("/api/nft/owners/0xowner/opportunities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalOpportunities").value(0));
    }

    @Test
    void getStrategies_shouldDescribeRegisteredStrategies() throws Exception {
        OpportunityStrategy strategy = mock(OpportunityStrategy.class);
        when(strategy.getType()).thenReturn(OpportunityType.MEAN_REVERSION);
        when(strategy.getName()).thenReturn("Mean Reversion");
        when(strategy.getDescription()).thenReturn("Buys sharp decliners");
        when(opportunityScannerService.getStrategies()).thenReturn(List.of(strategy));

        mockMvc.perform(get("/api/nft/strategies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("mean_reversion"))
                .andExpect(jsonPath("$[0].name").value("Mean Reversion"));
    }
}
