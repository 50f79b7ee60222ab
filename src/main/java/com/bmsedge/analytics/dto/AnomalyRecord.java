package com.bmsedge.analytics.dto;

import com.bmsedge.analytics.model.AnomalyDirection;
import com.bmsedge.analytics.model.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A period whose value strayed too far from the moving average of the preceding periods.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class AnomalyRecord {

    // yyyy-MM-dd, yyyy-'W'ww or yyyy-MM depending on granularity
    private final String periodKey;
    private final String productId;
    private final String productName;
    private final double actualValue;
    private final double expectedValue;
    private final double deviation;
    private final double zScore;
    private final AnomalyDirection direction;
    private final Severity severity;

    public AnomalyRecord(String periodKey, String productId, String productName,
                         double actualValue, double expectedValue, double deviation, double zScore,
                         AnomalyDirection direction, Severity severity) {
        this.periodKey = periodKey;
        this.productId = productId;
        this.productName = productName;
        this.actualValue = actualValue;
        this.expectedValue = expectedValue;
        this.deviation = deviation;
        this.zScore = zScore;
        this.direction = direction;
        this.severity = severity;
    }

    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }

    public String getDisplayName() {
        return productName == null || productName.isBlank() ? productId : productName;
    }
}
