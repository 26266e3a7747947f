package com.exrate.domain.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * Nearest recorded rate found in the rate history around a target date
 */
@Value
public class ClosestRate {
    double rate;
    LocalDate date;
    long daysDifference;
}
