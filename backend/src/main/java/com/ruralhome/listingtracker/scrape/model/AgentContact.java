package com.ruralhome.listingtracker.scrape.model;

/**
 * Resolved agent name/phone. {@code fresh} marks data the agent cache does not hold yet.
 */
public record AgentContact(String agentUrl, String name, String phone, boolean fresh) {
    public boolean hasUrl() {
        return agentUrl != null && !agentUrl.isBlank();
    }
}
