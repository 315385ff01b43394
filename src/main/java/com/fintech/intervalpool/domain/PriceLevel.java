package com.fintech.intervalpool.domain;

/**
 * Price classification tier assigned by the upstream source.
 */
public enum PriceLevel {
    VERY_CHEAP,
    CHEAP,
    NORMAL,
    EXPENSIVE,
    VERY_EXPENSIVE
}
