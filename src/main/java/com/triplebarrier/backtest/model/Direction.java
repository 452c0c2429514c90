package com.triplebarrier.backtest.model;

/**
 * Trade direction
 */
public enum Direction {
    LONG, SHORT
}
