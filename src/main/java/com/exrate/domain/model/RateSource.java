package com.exrate.domain.model;

/**
 * Where a cached exchange rate came from
 */
public enum RateSource {
    API,
    DATABASE,
    FALLBACK
}
