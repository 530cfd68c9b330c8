package com.ruralhome.listingtracker.scrape.service;

import com.ruralhome.listingtracker.config.ScraperProperties;
import com.ruralhome.listingtracker.scrape.http.ListingHttpClient;
import com.ruralhome.listingtracker.scrape.model.AgentCacheEntry;
import com.ruralhome.listingtracker.scrape.model.AgentContact;
import com.ruralhome.listingtracker.scrape.model.HttpFetchResult;
import com.ruralhome.listingtracker.scrape.persistence.AgentCache;
import com.ruralhome.listingtracker.scrape.util.PhoneNumbers;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * Fills in agent name and phone that the listing payload left out, using the agent cache first and the public
 * profile page second. Only reads the cache; new data is flagged {@code fresh} so the listing writer stores it.
 */
@Service
public class AgentProfileService {
    private static final Logger log = LoggerFactory.getLogger(AgentProfileService.class);

    private final AgentCache agentCache;
    private final ListingHttpClient httpClient;
    private final ScraperProperties properties;

    public AgentProfileService(AgentCache agentCache, ListingHttpClient httpClient, ScraperProperties properties) {
        this.agentCache = agentCache;
        this.httpClient = httpClient;
        this.properties = properties;
    }

    public AgentContact enrich(String agentUrl, String name, String phone) {
        String url = absoluteUrl(agentUrl);
        String safeName = blankToNull(name);
        String safePhone = PhoneNumbers.normalize(phone);
        if (url == null) {
            return new AgentContact(null, safeName, safePhone, false);
        }

        Optional<AgentCacheEntry> cached = lookupCache(url);
        if (safeName != null && safePhone != null) {
            boolean changed = cached
                .map(entry -> !Objects.equals(entry.agentName(), safeName) || !Objects.equals(entry.agentPhone(), safePhone))
                .orElse(true);
            return new AgentContact(url, safeName, safePhone, changed);
        }
        if (cached.isPresent()) {
            AgentCacheEntry entry = cached.get();
            return new AgentContact(
                url,
                safeName != null ? safeName : blankToNull(entry.agentName()),
                safePhone != null ? safePhone : blankToNull(entry.agentPhone()),
                false
            );
        }
        if (!properties.getAgents().isProfileLookupEnabled()) {
            return new AgentContact(url, safeName, safePhone, false);
        }

        AgentContact fetched = fetchProfile(url);
        String mergedName = safeName != null ? safeName : fetched.name();
        String mergedPhone = safePhone != null ? safePhone : fetched.phone();
        boolean fresh = mergedName != null || mergedPhone != null;
        return new AgentContact(url, mergedName, mergedPhone, fresh);
    }

    AgentContact fetchProfile(String url) {
        HttpFetchResult result = httpClient.get(url, "text/html,application/xhtml+xml");
        if (!result.isSuccessful() || result.body() == null) {
            log.warn("Agent profile fetch failed for {}: {}", url, result.failureCode());
            return new AgentContact(url, null, null, false);
        }
        Document document = Jsoup.parse(result.body(), url);
        Element nameElement = document.selectFirst("[data-testid=agent-name]");
        if (nameElement == null) {
            nameElement = document.selectFirst("h1");
        }
        String profileName = nameElement == null ? null : blankToNull(nameElement.text());
        Element phoneElement = document.selectFirst("a[href^=tel:]");
        String profilePhone = phoneElement == null
            ? null
            : PhoneNumbers.normalize(phoneElement.attr("href").substring("tel:".length()));
        log.debug("Agent profile {}: name={} phone={}", url, profileName, profilePhone);
        return new AgentContact(url, profileName, profilePhone, profileName != null || profilePhone != null);
    }

    private Optional<AgentCacheEntry> lookupCache(String url) {
        try {
            return agentCache.lookup(url);
        } catch (RuntimeException e) {
            log.warn("Agent cache lookup failed for {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    String absoluteUrl(String href) {
        String value = blankToNull(href);
        if (value == null) {
            return null;
        }
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return value;
        }
        if (value.startsWith("//")) {
            return "https:" + value;
        }
        return properties.getSiteBaseUrl() + (value.startsWith("/") ? value : "/" + value);
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
