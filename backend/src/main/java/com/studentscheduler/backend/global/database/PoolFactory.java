package com.studentscheduler.backend.global.database;

import com.zaxxer.hikari.HikariDataSource;

/**
 * Opens a new connection pool. Implementations must fail when the server cannot be reached
 * instead of handing back a pool that connects lazily.
 */
@FunctionalInterface
public interface PoolFactory {

    HikariDataSource open();
}
