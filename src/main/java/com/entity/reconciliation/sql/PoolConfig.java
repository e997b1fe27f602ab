package com.entity.reconciliation.sql;

/**
 * Configuration for {@link SimpleSqlConnectionPool}.
 */
public class PoolConfig {

    private final String databasePath;
    private final boolean readOnly;
    private final int maxTotal;
    private final int maxIdle;
    private final int minIdle;
    private final long maxWaitMillis;
    private final boolean testOnBorrow;

    private PoolConfig(Builder builder) {
        this.databasePath = builder.databasePath;
        this.readOnly = builder.readOnly;
        this.maxTotal = builder.maxTotal;
        this.maxIdle = builder.maxIdle;
        this.minIdle = builder.minIdle;
        this.maxWaitMillis = builder.maxWaitMillis;
        this.testOnBorrow = builder.testOnBorrow;
    }

    public String getDatabasePath() { return databasePath; }
    public boolean isReadOnly() { return readOnly; }
    public int getMaxTotal() { return maxTotal; }
    public int getMaxIdle() { return maxIdle; }
    public int getMinIdle() { return minIdle; }
    public long getMaxWaitMillis() { return maxWaitMillis; }
    public boolean isTestOnBorrow() { return testOnBorrow; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String databasePath;
        private boolean readOnly = true;
        private int maxTotal = 8;
        private int maxIdle = 4;
        private int minIdle = 1;
        private long maxWaitMillis = 5000;
        private boolean testOnBorrow = true;

        public Builder databasePath(String databasePath) {
            if (databasePath == null || databasePath.isBlank()) {
                throw new IllegalArgumentException("databasePath must not be blank");
            }
            this.databasePath = databasePath;
            return this;
        }

        public Builder readOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        public Builder maxTotal(int maxTotal) {
            if (maxTotal <= 0) throw new IllegalArgumentException("maxTotal must be > 0");
            this.maxTotal = maxTotal;
            return this;
        }

        public Builder maxIdle(int maxIdle) {
            if (maxIdle < 0) throw new IllegalArgumentException("maxIdle must be >= 0");
            this.maxIdle = maxIdle;
            return this;
        }

        public Builder minIdle(int minIdle) {
            if (minIdle < 0) throw new IllegalArgumentException("minIdle must be >= 0");
            this.minIdle = minIdle;
            return this;
        }

        public Builder maxWaitMillis(long maxWaitMillis) {
            if (maxWaitMillis <= 0) throw new IllegalArgumentException("maxWaitMillis must be > 0");
            this.maxWaitMillis = maxWaitMillis;
            return this;
        }

        public Builder testOnBorrow(boolean testOnBorrow) {
            this.testOnBorrow = testOnBorrow;
            return this;
        }

        public PoolConfig build() {
            if (databasePath == null) {
                throw new IllegalArgumentException("databasePath is required");
            }
            if (maxIdle > maxTotal) {
                throw new IllegalArgumentException("maxIdle cannot exceed maxTotal");
            }
            if (minIdle > maxIdle) {
                throw new IllegalArgumentException("minIdle cannot exceed maxIdle");
            }
            return new PoolConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "databasePath='" + databasePath + '\'' +
                ", readOnly=" + readOnly +
                ", maxTotal=" + maxTotal +
                ", maxIdle=" + maxIdle +
                ", minIdle=" + minIdle +
                ", maxWaitMillis=" + maxWaitMillis +
                ", testOnBorrow=" + testOnBorrow +
                '}';
    }
}
