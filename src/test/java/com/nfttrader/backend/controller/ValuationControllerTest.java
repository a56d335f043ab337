package com.nfttrader.backend.controller;

import com.nfttrader.backend.exception.AssetNotFoundException;
import com.nfttrader.backend.model.MarketSentiment;
import com.nfttrader.backend.model.Valuation;
import com.nfttrader.backend.service.ValuationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ValuationController.class)
public class ValuationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ValuationService valuationService;

    @Test
    void getValuation_shouldReturnValuationFromService() throws Exception {
        Valuation valuation = Valuation.builder()
                .contractAddress("0xc")
                .tokenId("7")
                .estimatedValue(new BigDecimal("110"))
                .confidence(1.0)
                .marketSentiment(MarketSentiment.BULLISH)
                .build();
        when(valuationService.getValuation("0xc", "7")).thenReturn(valuation);

        mockMvc.perform(get("/api/nft/valuations/0xc/7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.estimatedValue").value(110))
                .andExpect(jsonPath("$.data.marketSentiment").value("bullish"));
    }

    @Test
    void getValuation_shouldReturnNotFoundForUnknownAsset() throws Exception {
        when(valuationService.getValuation("0xc", "404")).thenThrow(new AssetNotFoundException("0xc", "404"));

        mockMvc.perform(get("/api/nft/valuations/0xc/404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Asset not found: 0xc/404"));
    }

    @Test
    void getValuation_shouldReturnServerErrorOnUnexpectedFailure() throws Exception {
        when(valuationService.getValuation("0xc", "7")).thenThrow(new IllegalStateException("provider down"));

        mockMvc.perform(get("/api/nft/valuations/0xc/7"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Failed to compute valuation: provider down"));
    }

    @Test
    void clearCaches_shouldDelegateToService() throws Exception {
        mockMvc.perform(delete("/api/nft/caches"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(valuationService).clearCaches();
    }
}
