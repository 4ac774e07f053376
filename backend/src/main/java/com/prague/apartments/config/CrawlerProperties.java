package com.prague.apartments.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";

    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private Upstream upstream = new Upstream();
    private Scheduler scheduler = new Scheduler();
    private Api api = new Api();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public Upstream getUpstream() {
        return upstream;
    }

    public void setUpstream(Upstream upstream) {
        this.upstream = upstream;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
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

    public static class Upstream {
        private static final String DEFAULT_PRICE_UNIT = "za měsíc";

        private String baseUrl = "https://www.sreality.cz/api/cs/v2/estates";
        private int categoryMain = 1;
        private int categorySub = 2;
        private int categoryType = 2;
        private int page = 1;
        private String defaultPriceUnit = DEFAULT_PRICE_UNIT;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        /**
         * Non-positive values leave {@code category_main_cb} out of the request.
         */
        public int getCategoryMain() {
            return categoryMain;
        }

        public void setCategoryMain(int categoryMain) {
            this.categoryMain = categoryMain;
        }

        public int getCategorySub() {
            return categorySub;
        }

        public void setCategorySub(int categorySub) {
            this.categorySub = categorySub;
        }

        public int getCategoryType() {
            return categoryType;
        }

        public void setCategoryType(int categoryType) {
            this.categoryType = categoryType;
        }

        public int getPage() {
            return Math.max(1, page);
        }

        public void setPage(int page) {
            this.page = Math.max(1, page);
        }

        public String getDefaultPriceUnit() {
            if (defaultPriceUnit == null || defaultPriceUnit.isBlank()) {
                return DEFAULT_PRICE_UNIT;
            }
            return defaultPriceUnit;
        }

        public void setDefaultPriceUnit(String defaultPriceUnit) {
            this.defaultPriceUnit = defaultPriceUnit;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int intervalMs = 60_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalMs() {
            return Math.max(100, intervalMs);
        }

        public void setIntervalMs(int intervalMs) {
            this.intervalMs = Math.max(100, intervalMs);
        }
    }

    public static class Api {
        private int defaultLimit = 20;
        private int maxLimit = 500;
        private int defaultNewHours = 24;

        public int getDefaultLimit() {
            return Math.max(1, defaultLimit);
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = Math.max(1, defaultLimit);
        }

        public int getMaxLimit() {
            return Math.max(getDefaultLimit(), maxLimit);
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = Math.max(1, maxLimit);
        }

        public int getDefaultNewHours() {
            return Math.max(1, defaultNewHours);
        }

        public void setDefaultNewHours(int defaultNewHours) {
            this.defaultNewHours = Math.max(1, defaultNewHours);
        }
    }

    public static class Cli {
        private boolean run;
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
