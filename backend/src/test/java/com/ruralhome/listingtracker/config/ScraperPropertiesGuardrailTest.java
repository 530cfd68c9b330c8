package com.ruralhome.listingtracker.config;

import com.ruralhome.listingtracker.scrape.model.NewsworthyPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScraperPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToBrowserDefault() {
        ScraperProperties properties = new ScraperProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("Mozilla/5.0"));
    }

    @Test
    void concurrencyAndDelayAreClamped() {
        ScraperProperties properties = new ScraperProperties();
        properties.setGlobalConcurrency(0);
        properties.setPerHostDelayMs(-10);
        properties.setMaxConcurrentDetails(-3);
        properties.setWriteQueueCapacity(0);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getPerHostDelayMs());
        assertEquals(1, properties.getMaxConcurrentDetails());
        assertEquals(1, properties.getWriteQueueCapacity());
    }

    @Test
    void pageSizeNeverExceedsSourceMaximum() {
        ScraperProperties properties = new ScraperProperties();
        properties.getSearch().setMaxPageSize(1000);
        properties.getSearch().setPageLimit(750);
        assertEquals(200, properties.getSearch().getMaxPageSize());
        assertEquals(200, properties.getSearch().getPageLimit());

        properties.getSearch().setPageLimit(0);
        assertEquals(1, properties.getSearch().getPageLimit());
    }

    @Test
    void urlsAreNormalized() {
        ScraperProperties properties = new ScraperProperties();
        properties.setSiteBaseUrl("https://www.example.com//");
        properties.setGraphqlUrl(" ");
        assertEquals("https://www.example.com", properties.getSiteBaseUrl());
        assertEquals("https://www.example.com/frontdoor/graphql", properties.getGraphqlUrl());
    }

    @Test
    void notifyAndRunSettingsAreBounded() {
        ScraperProperties properties = new ScraperProperties();
        properties.getNotify().setPolicy(null);
        properties.getNotify().setCutoffHourUtc(30);
        properties.getNotify().setWindowHours(0);
        properties.getRun().setMaxDurationSeconds(-5);
        assertEquals(NewsworthyPolicy.ALL_NEW, properties.getNotify().getPolicy());
        assertEquals(23, properties.getNotify().getCutoffHourUtc());
        assertEquals(1, properties.getNotify().getWindowHours());
        assertEquals(0, properties.getRun().getMaxDurationSeconds());
    }
}
