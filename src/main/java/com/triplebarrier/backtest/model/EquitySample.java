package com.triplebarrier.backtest.model;

import lombok.Value;

/**
 * Account equity right after a trade
 */
@Value
public class EquitySample {
    int tradeId;
    long timestamp;
    String symbol;
    double equity;
}
