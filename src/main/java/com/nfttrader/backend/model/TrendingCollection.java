package com.nfttrader.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendingCollection {
    private String contractAddress;
    private String name;
    private String sampleTokenId;        // item whose listings are compared across sources
}
