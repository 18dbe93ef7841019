package com.autobudget.domain.model;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One row of the remote ads API campaign list, already mapped from its wire aliases. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemoteCampaign {

    private String channelName;
    private BigDecimal cost;
    private double roas;
    private BigDecimal balance;
    private long visits;
    private double conversionRate;
}
