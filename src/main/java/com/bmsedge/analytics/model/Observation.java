package com.bmsedge.analytics.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One numeric value observed on one calendar day.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Observation {

    private final LocalDate date;
    private final double value;

    public Observation(LocalDate date, double value) {
        this.date = Objects.requireNonNull(date, "date");
        this.value = value;
    }
}
