package com.entity.reconciliation.sql;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Thread-safe connection pool using {@link Semaphore} for flow control
 * and {@link ConcurrentLinkedDeque} for idle connections.
 *
 * <p>Connections are opened lazily up to {@code maxTotal}; {@code minIdle} of them
 * are opened eagerly so the first queries do not pay for it.</p>
 */
public class SimpleSqlConnectionPool implements SqlConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(SimpleSqlConnectionPool.class);

    private final PoolConfig config;
    private final Supplier<SqlConnection> connectionFactory;
    private final Semaphore permits;
    private final ConcurrentLinkedDeque<SqlConnection> idleConnections = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong totalBorrowed = new AtomicLong(0);
    private final AtomicLong totalReleased = new AtomicLong(0);
    private final AtomicLong totalCreated = new AtomicLong(0);

    public SimpleSqlConnectionPool(PoolConfig config) {
        this(config, () -> new SqliteConnection(config.getDatabasePath(), config.isReadOnly()));
    }

    public SimpleSqlConnectionPool(PoolConfig config, Supplier<SqlConnection> connectionFactory) {
        this.config = config;
        this.connectionFactory = connectionFactory;
        this.permits = new Semaphore(config.getMaxTotal(), true);

        for (int i = 0; i < config.getMinIdle(); i++) {
            try {
                idleConnections.addLast(createConnection());
            } catch (RuntimeException e) {
                log.warn("pool.precreate.failed {}/{}: {}", i + 1, config.getMinIdle(), e.getMessage());
            }
        }

        log.info("Connection pool initialized: {}", config);
    }

    @Override
    public SqlConnection borrow() {
        if (closed.get()) {
            throw new IllegalStateException("Pool is closed");
        }

        try {
            if (!permits.tryAcquire(config.getMaxWaitMillis(), TimeUnit.MILLISECONDS)) {
                throw new IllegalStateException(
                        "Timeout waiting for connection (maxWait=" + config.getMaxWaitMillis() + "ms)");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for connection", e);
        }

        SqlConnection conn;
        try {
            conn = idleConnections.pollFirst();
            if (conn == null) {
                conn = createConnection();
            } else if (config.isTestOnBorrow() && !conn.isConnected()) {
                log.debug("Idle connection failed validation, opening a new one");
                closeQuietly(conn);
                conn = createConnection();
            }
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }

        totalBorrowed.incrementAndGet();
        log.debug("Connection borrowed (active={}, idle={})", getActiveCount(), idleConnections.size());
        return conn;
    }

    @Override
    public void release(SqlConnection connection) {
        if (connection == null) {
            return;
        }

        totalReleased.incrementAndGet();

        if (closed.get() || idleConnections.size() >= config.getMaxIdle()) {
            closeQuietly(connection);
        } else {
            idleConnections.addLast(connection);
        }

        permits.release();
        log.debug("Connection released (active={}, idle={})", getActiveCount(), idleConnections.size());
    }

    @Override
    public PoolStats getStats() {
        int idle = idleConnections.size();
        int active = getActiveCount();
        return new PoolStats(active + idle, active, idle,
                totalBorrowed.get(), totalReleased.get(), totalCreated.get());
    }

    @Override
    public PoolConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing connection pool for {}", config.getDatabasePath());
            SqlConnection conn;
            while ((conn = idleConnections.pollFirst()) != null) {
                closeQuietly(conn);
            }
        }
    }

    private SqlConnection createConnection() {
        SqlConnection conn = connectionFactory.get();
        totalCreated.incrementAndGet();
        return conn;
    }

    private int getActiveCount() {
        return config.getMaxTotal() - permits.availablePermits();
    }

    private void closeQuietly(SqlConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            log.warn("Error closing connection: {}", e.getMessage());
        }
    }
}
