package com.droidassist.extraction;

import lombok.Builder;
import lombok.Value;

/**
 * Accepted value ranges per unit family. Megabyte values are checked against
 * the MB range as written; gigabyte and terabyte values are first normalized
 * to gigabytes and checked against the GB range.
 */
@Value
@Builder
public class PlausibilityPolicy {

    @Builder.Default
    double currencyMin = 0.01;
    @Builder.Default
    double currencyMax = 9999;
    @Builder.Default
    double dataGbMin = 0.01;
    @Builder.Default
    double dataGbMax = 1000;
    @Builder.Default
    double dataMbMin = 1;
    @Builder.Default
    double dataMbMax = 999999;

    public static PlausibilityPolicy defaults() {
        return PlausibilityPolicy.builder().build();
    }

    public boolean isPlausible(double value, ValueUnit unit) {
        return switch (unit) {
            case CURRENCY -> within(value, currencyMin, currencyMax);
            case DATA_MB -> within(value, dataMbMin, dataMbMax);
            case DATA_GB, DATA_TB -> within(unit.toGigabytes(value), dataGbMin, dataGbMax);
        };
    }

    private static boolean within(double value, double min, double max) {
        return value >= min && value <= max;
    }
}
