package com.exrate.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Read-only view of an expense, as seen by the rate subsystem
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Expense {
    private long id;
    private double amount;
    private String currency;            // opaque currency code
    private LocalDateTime date;         // when the expense happened
    private Double conversionRate;      // legacy inline rate to base currency, may be null

    public boolean hasInlineConversionRate() {
        return conversionRate != null && conversionRate > 0 && !conversionRate.isInfinite();
    }
}
