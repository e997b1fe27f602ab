package com.entity.reconciliation.api;

/**
 * Settings of the reconciliation API.
 */
public class ReconciliationOptions {

    /** Path the REST resource is mounted at, relative to the public URL. */
    public static final String SERVICE_PATH = "/reconcile";

    private final String publicUrl;
    private final int suggestLimit;

    private ReconciliationOptions(Builder builder) {
        this.publicUrl = builder.publicUrl;
        this.suggestLimit = builder.suggestLimit;
    }

    /**
     * Base URL clients reach the service at, without a trailing slash.
     */
    public String getPublicUrl() { return publicUrl; }

    /**
     * Maximum number of entities returned by entity suggestions.
     */
    public int getSuggestLimit() { return suggestLimit; }

    /**
     * The URL advertised for the suggest and propose-properties endpoints.
     */
    public String getServiceUrl() {
        return publicUrl + SERVICE_PATH;
    }

    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String publicUrl = "http://localhost:8080";
        private int suggestLimit = 25;

        public Builder publicUrl(String publicUrl) {
            if (publicUrl == null || publicUrl.isBlank()) {
                throw new IllegalArgumentException("publicUrl must not be blank");
            }
            this.publicUrl = publicUrl.endsWith("/")
                    ? publicUrl.substring(0, publicUrl.length() - 1) : publicUrl;
            return this;
        }

        public Builder suggestLimit(int suggestLimit) {
            if (suggestLimit <= 0) {
                throw new IllegalArgumentException("suggestLimit must be > 0");
            }
            this.suggestLimit = suggestLimit;
            return this;
        }

        public ReconciliationOptions build() {
            return new ReconciliationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ReconciliationOptions{publicUrl='" + publicUrl + "', suggestLimit=" + suggestLimit + '}';
    }
}
