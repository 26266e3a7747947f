package com.exrate.domain.model;

/**
 * Which step of the conversion chain produced a result
 */
public enum ConversionSource {
    SAME_CURRENCY,
    HISTORICAL,
    CURRENT,
    INVERSE,
    IDENTITY_FALLBACK
}
