package com.autobudget.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Live channel counters published by the external channel monitor. Read-only here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LiveChannelMetrics {

    private String channel;
    private long clicks;

    @JsonProperty("added_to_cart")
    @JsonAlias("cart_count")
    private long cart;

    private long orders;

    @Builder.Default
    private BigDecimal sales = BigDecimal.ZERO;
}
