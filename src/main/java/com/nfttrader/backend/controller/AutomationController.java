package com.nfttrader.backend.controller;

import com.nfttrader.backend.model.AutomatedTrade;
import com.nfttrader.backend.model.AutomationHealth;
import com.nfttrader.backend.model.TradingPerformance;
import com.nfttrader.backend.service.AutomationSchedulerService;
import com.nfttrader.backend.service.TradeExecutionService;
import com.nfttrader.backend.service.TradingPerformanceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/nft")
public class AutomationController {

    private static final Logger logger = LoggerFactory.getLogger(AutomationController.class);

    private final AutomationSchedulerService automationSchedulerService;
    private final TradeExecutionService tradeExecutionService;
    private final TradingPerformanceService tradingPerformanceService;

    public AutomationController(
            AutomationSchedulerService automationSchedulerService,
            TradeExecutionService tradeExecutionService,
            TradingPerformanceService tradingPerformanceService) {
        this.automationSchedulerService = automationSchedulerService;
        this.tradeExecutionService = tradeExecutionService;
        this.tradingPerformanceService = tradingPerformanceService;
    }

    @PostMapping("/owners/{ownerAddress}/automation/start")
    public ResponseEntity<Map<String, Object>> startAutomation(
            @PathVariable String ownerAddress,
            @RequestParam(defaultValue = "15") int intervalMinutes) {
        try {
            automationSchedulerService.startAutomation(ownerAddress, intervalMinutes);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("running", true);
            response.put("intervalMinutes", intervalMinutes);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            Map<String, Object> errorResponse = new HashMap<>();
            errorResponse.put("success", false);
            errorResponse.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
        }
    }

    @PostMapping("/owners/{ownerAddress}/automation/stop")
    public ResponseEntity<Map<String, Object>> stopAutomation(@PathVariable String ownerAddress) {
        boolean wasRunning = automationSchedulerService.stopAutomation(ownerAddress);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("running", false);
        response.put("wasRunning", wasRunning);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/owners/{ownerAddress}/trades")
    public ResponseEntity<Map<String, Object>> getTrades(@PathVariable String ownerAddress) {
        List<AutomatedTrade> trades = tradeExecutionService.getActiveTrades(ownerAddress);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", trades);
        response.put("totalTrades", trades.size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/owners/{ownerAddress}/performance")
    public ResponseEntity<Map<String, Object>> getPerformance(@PathVariable String ownerAddress) {
        try {
            TradingPerformance performance = tradingPerformanceService.getTradingPerformance(ownerAddress);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("data", performance);
            response.put("automationRunning", automationSchedulerService.isRunning(ownerAddress));
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error calculating performance for {}", ownerAddress, e);
            Map<String, Object> errorResponse = new HashMap<>();
            errorResponse.put("success", false);
            errorResponse.put("message", "Failed to calculate performance: " + e.getMessage());
            return ResponseEntity.status(500).body(errorResponse);
        }
    }

    @DeleteMapping("/owners/{ownerAddress}")
    public ResponseEntity<Map<String, Object>> clearOwnerData(@PathVariable String ownerAddress) {
        automationSchedulerService.clearOwnerData(ownerAddress);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Automation data cleared for " + ownerAddress);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/automation/health")
    public ResponseEntity<AutomationHealth> getHealth() {
        return ResponseEntity.ok(automationSchedulerService.getHealthStatus());
    }
}
