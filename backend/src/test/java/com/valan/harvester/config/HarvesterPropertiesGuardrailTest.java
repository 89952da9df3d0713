package com.valan.harvester.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HarvesterPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToDefault() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setUserAgent("   ");
        assertEquals("Valan/1.0", properties.getUserAgent());
    }

    @Test
    void delaysTimeoutsAndCeilingAreClamped() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.getRegistry().setPublicationDelayMs(-5);
        properties.getRegistry().setRequestTimeoutSeconds(0);
        properties.getScan().setMissCeiling(0);
        properties.getScan().setInitialHighWaterMark(-1);
        assertEquals(0, properties.getRegistry().getPublicationDelayMs());
        assertEquals(1, properties.getRegistry().getRequestTimeoutSeconds());
        assertEquals(1, properties.getScan().getMissCeiling());
        assertEquals(0, properties.getScan().getInitialHighWaterMark());
    }

    @Test
    void emptyStoreStartsFromKnownRegistryPosition() {
        HarvesterProperties properties = new HarvesterProperties();
        assertEquals(392000L, properties.getScan().getInitialHighWaterMark());
    }

    @Test
    void baseUrlLosesTrailingSlashes() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.getRegistry().setBaseUrl("https://registry.example/publicaties//");
        assertEquals("https://registry.example/publicaties", properties.getRegistry().getBaseUrl());
    }
}
