package com.nfttrader.backend.controller;

import com.nfttrader.backend.exception.NftDataNotFoundException;
import com.nfttrader.backend.model.CollectionAnalytics;
import com.nfttrader.backend.model.Valuation;
import com.nfttrader.backend.service.ValuationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/nft")
public class ValuationController {

    private static final Logger logger = LoggerFactory.getLogger(ValuationController.class);

    private final ValuationService valuationService;

    public ValuationController(ValuationService valuationService) {
        this.valuationService = valuationService;
    }

    @GetMapping("/valuations/{contractAddress}/{tokenId}")
    public ResponseEntity<Map<String, Object>> getValuation(
            @PathVariable String contractAddress,
            @PathVariable String tokenId) {
        try {
            logger.info("Fetching valuation for {}/{}", contractAddress, tokenId);
            Valuation valuation = valuationService.getValuation(contractAddress, tokenId);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("data", valuation);
            return ResponseEntity.ok(response);
        } catch (NftDataNotFoundException e) {
            return errorResponse(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            logger.error("Error valuing {}/{}", contractAddress, tokenId, e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to compute valuation: " + e.getMessage());
        }
    }

    @GetMapping("/collections/{contractAddress}/analytics")
    public ResponseEntity<Map<String, Object>> getCollectionAnalytics(@PathVariable String contractAddress) {
        try {
            logger.info("Fetching collection analytics for {}", contractAddress);
            CollectionAnalytics analytics = valuationService.getCollectionAnalytics(contractAddress);

            Map<String, Object> response = new HashMap<>();
            response.put("success", true);
            response.put("data", analytics);
            return ResponseEntity.ok(response);
        } catch (NftDataNotFoundException e) {
            return errorResponse(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (Exception e) {
            logger.error("Error fetching collection analytics for {}", contractAddress, e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                "Failed to fetch collection analytics: " + e.getMessage());
        }
    }

    @DeleteMapping("/caches")
    public ResponseEntity<Map<String, Object>> clearCaches() {
        valuationService.clearCaches();

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", "Valuation caches cleared");
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("success", false);
        errorResponse.put("message", message);
        return ResponseEntity.status(status).body(errorResponse);
    }
}
