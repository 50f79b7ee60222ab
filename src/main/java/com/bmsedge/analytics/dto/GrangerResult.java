package com.bmsedge.analytics.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@EqualsAndHashCode
@ToString
public final class GrangerResult {

    private final double fStatistic;
    private final double pValue;
    private final int lagOrder;
    private final int denominatorDegreesOfFreedom;

    public GrangerResult(double fStatistic, double pValue, int lagOrder, int denominatorDegreesOfFreedom) {
        this.fStatistic = fStatistic;
        this.pValue = pValue;
        this.lagOrder = lagOrder;
        this.denominatorDegreesOfFreedom = denominatorDegreesOfFreedom;
    }

    @JsonProperty("fStatistic")
    public double getFStatistic() {
        return fStatistic;
    }

    @JsonProperty("pValue")
    public double getPValue() {
        return pValue;
    }

    public boolean isSignificant(double alpha) {
        return pValue < alpha;
    }
}
