package com.ruralhome.listingtracker.config;

import com.ruralhome.listingtracker.scrape.model.NewsworthyPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) "
            + "Chrome/136.0.0.0 Safari/537.36";
    private static final String DEFAULT_SITE_BASE_URL = "https://www.realtor.com";

    private String userAgent;
    private String siteBaseUrl = DEFAULT_SITE_BASE_URL;
    private String graphqlUrl = DEFAULT_SITE_BASE_URL + "/frontdoor/graphql";
    private int perHostDelayMs = 100;
    private int globalConcurrency = 10;
    private int requestTimeoutSeconds = 30;
    private int maxConcurrentDetails = 10;
    private int writeQueueCapacity = 100;
    private Search search = new Search();
    private Details details = new Details();
    private Agents agents = new Agents();
    private Notify notify = new Notify();
    private Run run = new Run();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public String getSiteBaseUrl() {
        return stripTrailingSlash(siteBaseUrl, DEFAULT_SITE_BASE_URL);
    }

    public void setSiteBaseUrl(String siteBaseUrl) {
        this.siteBaseUrl = siteBaseUrl;
    }

    public String getGraphqlUrl() {
        if (graphqlUrl == null || graphqlUrl.isBlank()) {
            return getSiteBaseUrl() + "/frontdoor/graphql";
        }
        return graphqlUrl.trim();
    }

    public void setGraphqlUrl(String graphqlUrl) {
        this.graphqlUrl = graphqlUrl;
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getMaxConcurrentDetails() {
        return Math.max(1, maxConcurrentDetails);
    }

    public void setMaxConcurrentDetails(int maxConcurrentDetails) {
        this.maxConcurrentDetails = Math.max(1, maxConcurrentDetails);
    }

    public int getWriteQueueCapacity() {
        return Math.max(1, writeQueueCapacity);
    }

    public void setWriteQueueCapacity(int writeQueueCapacity) {
        this.writeQueueCapacity = Math.max(1, writeQueueCapacity);
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Details getDetails() {
        return details;
    }

    public void setDetails(Details details) {
        this.details = details;
    }

    public Agents getAgents() {
        return agents;
    }

    public void setAgents(Agents agents) {
        this.agents = agents;
    }

    public Notify getNotify() {
        return notify;
    }

    public void setNotify(Notify notify) {
        this.notify = notify;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    private static String stripTrailingSlash(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.isEmpty() ? fallback : trimmed;
    }

    public static class Search {
        private static final int SOURCE_MAX_PAGE_SIZE = 200;

        private String stateCode = "WI";
        private List<String> partitions = new ArrayList<>(
            List.of("Kenosha", "Milwaukee", "Racine", "Walworth", "Waukesha")
        );
        private int pageLimit = SOURCE_MAX_PAGE_SIZE;
        private int maxPageSize = SOURCE_MAX_PAGE_SIZE;
        private int partitionDelayMs = 500;
        private String clientName = "RDC_WEB_SRP_FS_PAGE";
        private String clientVersion = "3.0.2449";

        public String getStateCode() {
            return stateCode == null || stateCode.isBlank() ? "WI" : stateCode.trim().toUpperCase();
        }

        public void setStateCode(String stateCode) {
            this.stateCode = stateCode;
        }

        public List<String> getPartitions() {
            return partitions;
        }

        public void setPartitions(List<String> partitions) {
            this.partitions = partitions == null ? new ArrayList<>() : new ArrayList<>(partitions);
        }

        public int getPageLimit() {
            return Math.max(1, Math.min(pageLimit, getMaxPageSize()));
        }

        public void setPageLimit(int pageLimit) {
            this.pageLimit = pageLimit;
        }

        public int getMaxPageSize() {
            return Math.max(1, Math.min(maxPageSize, SOURCE_MAX_PAGE_SIZE));
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public int getPartitionDelayMs() {
            return Math.max(0, partitionDelayMs);
        }

        public void setPartitionDelayMs(int partitionDelayMs) {
            this.partitionDelayMs = Math.max(0, partitionDelayMs);
        }

        public String getClientName() {
            return clientName;
        }

        public void setClientName(String clientName) {
            this.clientName = clientName;
        }

        public String getClientVersion() {
            return clientVersion;
        }

        public void setClientVersion(String clientVersion) {
            this.clientVersion = clientVersion;
        }
    }

    public static class Details {
        private boolean enabled = true;
        private String clientName = "RDC_WEB_DETAILS_PAGE";
        private String clientVersion = "2.161.0";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getClientName() {
            return clientName;
        }

        public void setClientName(String clientName) {
            this.clientName = clientName;
        }

        public String getClientVersion() {
            return clientVersion;
        }

        public void setClientVersion(String clientVersion) {
            this.clientVersion = clientVersion;
        }
    }

    public static class Agents {
        private boolean profileLookupEnabled = false;

        public boolean isProfileLookupEnabled() {
            return profileLookupEnabled;
        }

        public void setProfileLookupEnabled(boolean profileLookupEnabled) {
            this.profileLookupEnabled = profileLookupEnabled;
        }
    }

    public static class Notify {
        private NewsworthyPolicy policy = NewsworthyPolicy.ALL_NEW;
        private int windowHours = 24;
        private int cutoffHourUtc = 2;

        public NewsworthyPolicy getPolicy() {
            return policy == null ? NewsworthyPolicy.ALL_NEW : policy;
        }

        public void setPolicy(NewsworthyPolicy policy) {
            this.policy = policy;
        }

        public int getWindowHours() {
            return Math.max(1, windowHours);
        }

        public void setWindowHours(int windowHours) {
            this.windowHours = Math.max(1, windowHours);
        }

        public int getCutoffHourUtc() {
            return Math.max(0, Math.min(23, cutoffHourUtc));
        }

        public void setCutoffHourUtc(int cutoffHourUtc) {
            this.cutoffHourUtc = cutoffHourUtc;
        }
    }

    public static class Run {
        private int daysOld = 1;
        private int maxDurationSeconds = 0;
        private int staleRunMinutes = 180;

        /**
         * Lookback for the search date floor; zero or less disables the floor.
         */
        public int getDaysOld() {
            return daysOld;
        }

        public void setDaysOld(int daysOld) {
            this.daysOld = daysOld;
        }

        /**
         * Zero disables the run deadline.
         */
        public int getMaxDurationSeconds() {
            return Math.max(0, maxDurationSeconds);
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = Math.max(0, maxDurationSeconds);
        }

        public int getStaleRunMinutes() {
            return Math.max(1, staleRunMinutes);
        }

        public void setStaleRunMinutes(int staleRunMinutes) {
            this.staleRunMinutes = Math.max(1, staleRunMinutes);
        }
    }

    public static class Cli {
        private boolean run = false;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
