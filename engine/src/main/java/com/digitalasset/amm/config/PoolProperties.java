// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.config;

import com.digitalasset.amm.constants.PoolConstants;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pool settings bound from {@code amm.pool.*}.
 */
@Validated
@ConfigurationProperties(prefix = "amm.pool")
public class PoolProperties {

    @NotBlank
    private String assetA;

    @NotBlank
    private String assetB;

    @NotBlank
    private String address = "pool";

    /** Swap fee in basis points, taken from the input side. */
    @Min(0)
    @Max(PoolConstants.MAX_FEE_BPS)
    private int feeBps = PoolConstants.DEFAULT_FEE_BPS;

    /** Number of events kept by the journal. */
    @Min(1)
    private int historySize = PoolConstants.DEFAULT_HISTORY_SIZE;

    public String getAssetA() {
        return assetA;
    }

    public void setAssetA(String assetA) {
        this.assetA = assetA;
    }

    public String getAssetB() {
        return assetB;
    }

    public void setAssetB(String assetB) {
        this.assetB = assetB;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public int getFeeBps() {
        return feeBps;
    }

    public void setFeeBps(int feeBps) {
        this.feeBps = feeBps;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }
}
