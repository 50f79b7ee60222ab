package com.bmsedge.analytics.model;

public enum ForecastHorizon {
    WEEK("week", 7),
    TWO_WEEKS("2weeks", 14),
    MONTH("month", 30);

    private final String value;
    private final int days;

    ForecastHorizon(String value, int days) {
        this.value = value;
        this.days = days;
    }

    public String getValue() {
        return value;
    }

    public int getDays() {
        return days;
    }

    public static ForecastHorizon fromValue(String value) {
        if (value != null) {
            for (ForecastHorizon h : values()) {
                if (h.value.equalsIgnoreCase(value.trim())) {
                    return h;
                }
            }
        }
        return WEEK;
    }
}
