package com.nfttrader.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

/**
 * A single NFT as resolved by one market-data source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssetInfo {
    private String contractAddress;
    private String tokenId;
    private String name;
    private String marketplace;          // source that resolved the asset
    private BigDecimal lastSalePrice;
    private Double rarity;               // 0..1, null when the source has no rarity data
    private Integer collectionSupply;

    @Builder.Default
    private Map<String, Object> traits = new HashMap<>();

    @JsonIgnore
    public boolean hasTraits() {
        return traits != null && !traits.isEmpty();
    }
}
