package com.exrate.domain.model;

/**
 * Outcome of a conversion, including the rate that was applied and where it came from
 */
public record ConversionResult(
        double originalAmount,
        double convertedAmount,
        String fromCurrency,
        String toCurrency,
        double rate,
        ConversionSource source
) {

    public static ConversionResult sameCurrency(ConversionRequest request) {
        return new ConversionResult(request.amount(), request.amount(),
                request.fromCurrency(), request.toCurrency(), 1.0, ConversionSource.SAME_CURRENCY);
    }

    public static ConversionResult identityFallback(ConversionRequest request) {
        return new ConversionResult(request.amount(), request.amount(),
                request.fromCurrency(), request.toCurrency(), 1.0, ConversionSource.IDENTITY_FALLBACK);
    }

    public boolean isApproximate() {
        return source == ConversionSource.IDENTITY_FALLBACK;
    }
}
