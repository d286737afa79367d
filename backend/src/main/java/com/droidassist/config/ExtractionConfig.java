package com.droidassist.config;

import com.droidassist.extraction.PlausibilityPolicy;
import com.droidassist.extraction.ValueExtractor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Value extraction policy. The plausibility bounds are empirical and meant to be tuned per carrier app.
 */
@Configuration
public class ExtractionConfig {

    @Value("${droidassist.extraction.currency-min:0.01}")
    private double currencyMin;

    @Value("${droidassist.extraction.currency-max:9999}")
    private double currencyMax;

    @Value("${droidassist.extraction.data-gb-min:0.01}")
    private double dataGbMin;

    @Value("${droidassist.extraction.data-gb-max:1000}")
    private double dataGbMax;

    @Value("${droidassist.extraction.data-mb-min:1}")
    private double dataMbMin;

    @Value("${droidassist.extraction.data-mb-max:999999}")
    private double dataMbMax;

    @Value("${droidassist.extraction.top-region-size:15}")
    private int topRegionSize;

    @Bean
    public PlausibilityPolicy plausibilityPolicy() {
        return PlausibilityPolicy.builder()
            .currencyMin(currencyMin)
            .currencyMax(currencyMax)
            .dataGbMin(dataGbMin)
            .dataGbMax(dataGbMax)
            .dataMbMin(dataMbMin)
            .dataMbMax(dataMbMax)
            .build();
    }

    @Bean
    public ValueExtractor valueExtractor(PlausibilityPolicy plausibilityPolicy) {
        return new ValueExtractor(plausibilityPolicy, topRegionSize);
    }
}
