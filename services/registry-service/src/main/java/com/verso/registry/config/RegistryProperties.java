package com.verso.registry.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "registry")
public class RegistryProperties {
    private Store store = new Store();
    private Listing listing = new Listing();
    private Audit audit = new Audit();
    private Retention retention = new Retention();

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Listing getListing() {
        return listing;
    }

    public void setListing(Listing listing) {
        this.listing = listing;
    }

    public Audit getAudit() {
        return audit;
    }

    public void setAudit(Audit audit) {
        this.audit = audit;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public enum Backend {
        MEMORY,
        JDBC
    }

    public static class Store {
        private Backend backend = Backend.MEMORY;

        public Backend getBackend() {
            return backend;
        }

        public void setBackend(Backend backend) {
            this.backend = backend;
        }
    }

    public static class Listing {
        private int fanOutPoolSize = 32;
        private long fanOutTimeoutMs = 5_000L;
        private int textLimit = 1000;
        private int entityLimit = 100;
        private int contentLimit = 20;
        private int versionLimit = 20;

        public int getFanOutPoolSize() {
            return fanOutPoolSize;
        }

        public void setFanOutPoolSize(int fanOutPoolSize) {
            this.fanOutPoolSize = fanOutPoolSize;
        }

        public long getFanOutTimeoutMs() {
            return fanOutTimeoutMs;
        }

        public void setFanOutTimeoutMs(long fanOutTimeoutMs) {
            this.fanOutTimeoutMs = fanOutTimeoutMs;
        }

        public int getTextLimit() {
            return textLimit;
        }

        public void setTextLimit(int textLimit) {
            this.textLimit = textLimit;
        }

        public int getEntityLimit() {
            return entityLimit;
        }

        public void setEntityLimit(int entityLimit) {
            this.entityLimit = entityLimit;
        }

        public int getContentLimit() {
            return contentLimit;
        }

        public void setContentLimit(int contentLimit) {
            this.contentLimit = contentLimit;
        }

        public int getVersionLimit() {
            return versionLimit;
        }

        public void setVersionLimit(int versionLimit) {
            this.versionLimit = versionLimit;
        }
    }

    public static class Audit {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Retention {
        private boolean sweepEnabled = true;
        private int eventDays = 90;
        private int metricDays = 365;
        private int tokenDays = 30;
        private int deviceDays = 400;

        public boolean isSweepEnabled() {
            return sweepEnabled;
        }

        public void setSweepEnabled(boolean sweepEnabled) {
            this.sweepEnabled = sweepEnabled;
        }

        public int getEventDays() {
            return eventDays;
        }

        public void setEventDays(int eventDays) {
            this.eventDays = eventDays;
        }

        public int getMetricDays() {
            return metricDays;
        }

        public void setMetricDays(int metricDays) {
            this.metricDays = metricDays;
        }

        public int getTokenDays() {
            return tokenDays;
        }

        public void setTokenDays(int tokenDays) {
            this.tokenDays = tokenDays;
        }

        public int getDeviceDays() {
            return deviceDays;
        }

        public void setDeviceDays(int deviceDays) {
            this.deviceDays = deviceDays;
        }
    }
}
