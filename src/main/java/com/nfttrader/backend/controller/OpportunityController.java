package com.nfttrader.backend.controller;

import com.nfttrader.backend.model.TradingOpportunity;
import com.nfttrader.backend.service.OpportunityScannerService;
import com.nfttrader.backend.service.strategy.OpportunityStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/nft")
public class OpportunityController {

    private static final Logger logger = LoggerFactory.getLogger(OpportunityController.class);

    private final OpportunityScannerService opportunityScannerService;

    public OpportunityController(OpportunityScannerService opportunityScannerService) {
        this.opportunityScannerService = opportunityScannerService;
    }

    @PostMapping("/owners/{ownerAddress}/opportunities/scan")
    public ResponseEntity<Map<String, Object>> scanOpportunities(@PathVariable String ownerAddress) {
        try {
            logger.info("Scanning opportunities for {}", ownerAddress);
            List<TradingOpportunity> opportunities = opportunityScannerService.scanOpportunities(ownerAddress);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("data", opportunities);
            response.put("totalOpportunities", opportunities.size());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error scanning opportunities for {}", ownerAddress, e);
            Map<String, Object> errorResponse = new HashMap<>();
            errorResponse.put("success", false);
            errorResponse.put("message", "Failed to scan opportunities: " + e.getMessage());
            return ResponseEntity.status(500).body(errorResponse);
        }
    }

    @GetMapping("/owners/{ownerAddress}/opportunities")
    public ResponseEntity<Map<String, Object>> getOpportunities(@PathVariable String ownerAddress) {
        List<TradingOpportunity> opportunities = opportunityScannerService.getOpportunities(ownerAddress);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", opportunities);
        response.put("totalOpportunities", opportunities.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/strategies")
    public ResponseEntity<List<Map<String, Object>>> getStrategies() {
        List<Map<String, Object>> strategies = new ArrayList<>();
        for (OpportunityStrategy strategy : opportunityScannerService.getStrategies()) {
            Map<String, Object> info = new HashMap<>();
            info.put("id", strategy.getType().getValue());
            info.put("name", strategy.getName());
            info.put("description", strategy.getDescription());
            strategies.add(info);
        }
        return ResponseEntity.ok(strategies);
    }
}
