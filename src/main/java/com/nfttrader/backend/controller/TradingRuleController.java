package com.nfttrader.backend.controller;

import com.nfttrader.backend.dto.TradingRuleRequest;
import com.nfttrader.backend.exception.RuleNotFoundException;
import com.nfttrader.backend.model.AutomatedTrade;
import com.nfttrader.backend.model.TradingRule;
import com.nfttrader.backend.service.TradingRuleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/nft/owners/{ownerAddress}/rules")
public class TradingRuleController {

    private static final Logger logger = LoggerFactory.getLogger(TradingRuleController.class);

    private final TradingRuleService tradingRuleService;

    public TradingRuleController(TradingRuleService tradingRuleService) {
        this.tradingRuleService = tradingRuleService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getRules(@PathVariable String ownerAddress) {
        List<TradingRule> rules = tradingRuleService.getRules(ownerAddress);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", rules);
        response.put("totalRules", rules.size());
        return ResponseEntity.ok(response);
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> createRule(
            @PathVariable String ownerAddress,
            @RequestBody TradingRuleRequest request) {
        try {
            TradingRule rule = tradingRuleService.createRule(ownerAddress, request);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("data", rule);
            return ResponseEntity.status(HttpStatus.CREATED).body(response);
        } catch (IllegalArgumentException e) {
            return errorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            logger.error("Error creating rule for {}", ownerAddress, e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to create rule: " + e.getMessage());
        }
    }

    @GetMapping("/{ruleId}")
    public ResponseEntity<Map<String, Object>> getRule(
            @PathVariable String ownerAddress,
            @PathVariable String ruleId) {
        Optional<TradingRule> rule = tradingRuleService.getRule(ownerAddress, ruleId);
        if (rule.isEmpty()) {
            return errorResponse(HttpStatus.NOT_FOUND, "Rule " + ruleId + " not found");
        }

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("data", rule.get());
        return ResponseEntity.ok(response);
    }

    @PutMapping("/{ruleId}")
    public ResponseEntity<Map<String, Object>> updateRule(
            @PathVariable String ownerAddress,
            @PathVariable String ruleId,
            @RequestBody TradingRuleRequest updates) {
        try {
            Optional<TradingRule> rule = tradingRuleService.updateRule(ownerAddress, ruleId, updates);
            if (rule.isEmpty()) {
                return errorResponse(HttpStatus.NOT_FOUND, "Rule " + ruleId + " not found");
            }

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("data", rule.get());
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            return errorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            logger.error("Error updating rule {} for {}", ruleId, ownerAddress, e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to update rule: " + e.getMessage());
        }
    }

    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Map<String, Object>> deleteRule(
            @PathVariable String ownerAddress,
            @PathVariable String ruleId) {
        if (!tradingRuleService.deleteRule(ownerAddress, ruleId)) {
            return errorResponse(HttpStatus.NOT_FOUND, "Rule " + ruleId + " not found");
        }

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Rule deleted");
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{ruleId}/execute")
    public ResponseEntity<Map<String, Object>> executeRule(
            @PathVariable String ownerAddress,
            @PathVariable String ruleId) {
        try {
            logger.info("Manual execution of rule {} for {}", ruleId, ownerAddress);
            Optional<AutomatedTrade> trade = tradingRuleService.executeRule(ownerAddress, ruleId);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("executed", trade.isPresent());
            response.put("data", trade.orElse(null));
            return ResponseEntity.ok(response);
        } catch (RuleNotFoundException e) {
            return errorResponse(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            logger.error("Error executing rule {} for {}", ruleId, ownerAddress, e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to execute rule: " + e.getMessage());
        }
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("success", false);
        errorResponse.put("message", message);
        return ResponseEntity.status(status).body(errorResponse);
    }
}
