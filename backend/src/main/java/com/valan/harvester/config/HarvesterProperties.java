package com.valan.harvester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {
    private static final String DEFAULT_USER_AGENT = "Valan/1.0";
    private static final String DEFAULT_SOURCE = "tenderned";

    private String userAgent;
    private String source = DEFAULT_SOURCE;
    private Registry registry = new Registry();
    private Scan scan = new Scan();
    private Promotion promotion = new Promotion();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public String getSource() {
        return source == null || source.isBlank() ? DEFAULT_SOURCE : source.trim();
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Registry getRegistry() {
        return registry;
    }

    public void setRegistry(Registry registry) {
        this.registry = registry;
    }

    public Scan getScan() {
        return scan;
    }

    public void setScan(Scan scan) {
        this.scan = scan;
    }

    public Promotion getPromotion() {
        return promotion;
    }

    public void setPromotion(Promotion promotion) {
        this.promotion = promotion;
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

    public static class Registry {
        private String baseUrl = "https://www.tenderned.nl/papi/tenderned-rs-tns/v2/publicaties";
        private String documentSuffix = "pdf";
        private String detailUrlTemplate = "https://www.tenderned.nl/aankondigingen/overzicht/{id}";
        private int publicationDelayMs = 150;
        private int documentDelayMs = 200;
        private int requestTimeoutSeconds = 30;
        private int documentTimeoutSeconds = 60;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            if (baseUrl == null || baseUrl.isBlank()) {
                return;
            }
            String trimmed = baseUrl.trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            this.baseUrl = trimmed;
        }

        public String getDocumentSuffix() {
            return documentSuffix;
        }

        public void setDocumentSuffix(String documentSuffix) {
            if (documentSuffix != null && !documentSuffix.isBlank()) {
                this.documentSuffix = documentSuffix.trim().replaceAll("^/+", "");
            }
        }

        public String getDetailUrlTemplate() {
            return detailUrlTemplate;
        }

        public void setDetailUrlTemplate(String detailUrlTemplate) {
            this.detailUrlTemplate = detailUrlTemplate;
        }

        public int getPublicationDelayMs() {
            return Math.max(0, publicationDelayMs);
        }

        public void setPublicationDelayMs(int publicationDelayMs) {
            this.publicationDelayMs = Math.max(0, publicationDelayMs);
        }

        public int getDocumentDelayMs() {
            return Math.max(0, documentDelayMs);
        }

        public void setDocumentDelayMs(int documentDelayMs) {
            this.documentDelayMs = Math.max(0, documentDelayMs);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getDocumentTimeoutSeconds() {
            return Math.max(1, documentTimeoutSeconds);
        }

        public void setDocumentTimeoutSeconds(int documentTimeoutSeconds) {
            this.documentTimeoutSeconds = Math.max(1, documentTimeoutSeconds);
        }
    }

    public static class Scan {
        private int missCeiling = 50;
        private boolean updateExisting;
        private long initialHighWaterMark = 392000;
        private int progressLogInterval = 500;

        public int getMissCeiling() {
            return Math.max(1, missCeiling);
        }

        public void setMissCeiling(int missCeiling) {
            this.missCeiling = Math.max(1, missCeiling);
        }

        public boolean isUpdateExisting() {
            return updateExisting;
        }

        public void setUpdateExisting(boolean updateExisting) {
            this.updateExisting = updateExisting;
        }

        public long getInitialHighWaterMark() {
            return Math.max(0, initialHighWaterMark);
        }

        public void setInitialHighWaterMark(long initialHighWaterMark) {
            this.initialHighWaterMark = Math.max(0, initialHighWaterMark);
        }

        public int getProgressLogInterval() {
            return Math.max(1, progressLogInterval);
        }

        public void setProgressLogInterval(int progressLogInterval) {
            this.progressLogInterval = Math.max(1, progressLogInterval);
        }
    }

    public static class Promotion {
        private String tenderFunction = "feed_tenderned_tenders_to_master";
        private String awardFunction = "feed_tenderned_awards_to_master";

        public String getTenderFunction() {
            return tenderFunction;
        }

        public void setTenderFunction(String tenderFunction) {
            this.tenderFunction = tenderFunction;
        }

        public String getAwardFunction() {
            return awardFunction;
        }

        public void setAwardFunction(String awardFunction) {
            this.awardFunction = awardFunction;
        }
    }

    public static class Cli {
        private boolean run;
        private String mode = "incremental";
        private long startId = 420000;
        private long endId = 100000;
        private boolean promoteAfterRun;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public long getStartId() {
            return startId;
        }

        public void setStartId(long startId) {
            this.startId = startId;
        }

        public long getEndId() {
            return endId;
        }

        public void setEndId(long endId) {
            this.endId = endId;
        }

        public boolean isPromoteAfterRun() {
            return promoteAfterRun;
        }

        public void setPromoteAfterRun(boolean promoteAfterRun) {
            this.promoteAfterRun = promoteAfterRun;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
