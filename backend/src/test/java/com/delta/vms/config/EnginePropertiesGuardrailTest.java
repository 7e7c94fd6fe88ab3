package com.delta.vms.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EnginePropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToDefault() {
        EngineProperties properties = new EngineProperties();
        properties.getAlerts().setUserAgent("   ");
        assertEquals("vendor-engine/0.1", properties.getAlerts().getUserAgent());
    }

    @Test
    void limitsAndPeriodsAreClamped() {
        EngineProperties properties = new EngineProperties();
        properties.getMatching().setDefaultLimit(0);
        properties.getMatching().setMaxLimit(-5);
        properties.getOwnership().setProtectionPeriodDays(-1);
        properties.getMatching().setExclusiveTopFraction(3.0);
        properties.getFees().setVolumeDiscountWindowDays(0);
        assertEquals(1, properties.getMatching().getDefaultLimit());
        assertEquals(1, properties.getMatching().getMaxLimit());
        assertEquals(1, properties.getOwnership().getProtectionPeriodDays());
        assertEquals(1.0, properties.getMatching().getExclusiveTopFraction());
        assertEquals(1, properties.getFees().getVolumeDiscountWindowDays());
    }

    @Test
    void defaultHorizonNeverExceedsMaximum() {
        EngineProperties properties = new EngineProperties();
        properties.getForecast().setMaxHorizonDays(10);
        properties.getForecast().setDefaultHorizonDays(30);
        assertEquals(10, properties.getForecast().getDefaultHorizonDays());
    }
}
