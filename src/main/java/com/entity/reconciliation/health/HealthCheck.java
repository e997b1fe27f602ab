package com.entity.reconciliation.health;

/**
 * Checks one component of the service (store, database, connection pool)
 * and reports its {@link HealthStatus}.
 */
public interface HealthCheck {

    String getName();

    /**
     * Runs the check. Never throws; failures are reported as {@link HealthStatus.Status#DOWN}.
     */
    HealthStatus check();
}
