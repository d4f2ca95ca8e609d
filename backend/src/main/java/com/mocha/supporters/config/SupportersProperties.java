package com.mocha.supporters.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "supporters")
public class SupportersProperties {
    private static final String DEFAULT_USER_AGENT = "mocha-supporter-sync/0.1 (+https://mochajs.org)";
    private static final String DEFAULT_SLUG = "mochajs";

    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private String blocklistLocation = "classpath:blocklist.json";
    private Ledger ledger = new Ledger();
    private Assets assets = new Assets();
    private Export export = new Export();
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

    public String getBlocklistLocation() {
        return blocklistLocation;
    }

    public void setBlocklistLocation(String blocklistLocation) {
        this.blocklistLocation = blocklistLocation;
    }

    public Ledger getLedger() {
        return ledger;
    }

    public void setLedger(Ledger ledger) {
        this.ledger = ledger;
    }

    public Assets getAssets() {
        return assets;
    }

    public void setAssets(Assets assets) {
        this.assets = assets;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
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

    public static String normalizeSlug(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_SLUG;
        }
        return candidate.trim();
    }

    public static class Ledger {
        private String endpoint = "https://api.opencollective.com/graphql/v2";
        private String defaultSlug = DEFAULT_SLUG;
        private int pageSize = 1000;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getDefaultSlug() {
            return normalizeSlug(defaultSlug);
        }

        public void setDefaultSlug(String defaultSlug) {
            this.defaultSlug = normalizeSlug(defaultSlug);
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, pageSize);
        }
    }

    public static class Assets {
        private String outputDir = "../docs/images/supporters";
        private int maxConcurrency = 0;

        public String getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(String outputDir) {
            this.outputDir = outputDir;
        }

        /**
         * Upper bound on concurrent avatar downloads; 0 or less means one task per supporter.
         */
        public int getMaxConcurrency() {
            return Math.max(0, maxConcurrency);
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = Math.max(0, maxConcurrency);
        }
    }

    public static class Export {
        private String path = "";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public boolean isEnabled() {
            return path != null && !path.isBlank();
        }
    }

    public static class Cli {
        private boolean run;
        private String slug = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getSlug() {
            return slug;
        }

        public void setSlug(String slug) {
            this.slug = slug;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
