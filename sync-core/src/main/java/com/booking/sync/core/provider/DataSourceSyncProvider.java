package com.booking.sync.core.provider;

import com.booking.sync.core.exception.SyncException;

import org.apache.commons.dbcp2.BasicDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import java.util.Objects;

/**
 * Base for JDBC engines: connections come from a pooled {@link BasicDataSource}.
 */
public abstract class DataSourceSyncProvider implements SyncProvider, Closeable {

    public interface Configuration {
        String JDBC_DRIVER_CLASS = "provider.jdbc.driver.class";
        String JDBC_URL = "provider.jdbc.url";
        String JDBC_USERNAME = "provider.jdbc.username";
        String JDBC_PASSWORD = "provider.jdbc.password";
        String JDBC_CATALOG = "provider.jdbc.catalog";
        String POOL_MAX_TOTAL = "provider.pool.max.total";
    }

    private static final Logger LOG = LogManager.getLogger(DataSourceSyncProvider.class);

    private final BasicDataSource dataSource;
    private final String catalog;

    protected DataSourceSyncProvider(Map<String, Object> configuration) {
        Object driverClass = configuration.get(Configuration.JDBC_DRIVER_CLASS);
        Object url = configuration.get(Configuration.JDBC_URL);
        Object username = configuration.get(Configuration.JDBC_USERNAME);
        Object password = configuration.getOrDefault(Configuration.JDBC_PASSWORD, "");
        Object maxTotal = configuration.getOrDefault(Configuration.POOL_MAX_TOTAL, "8");

        Objects.requireNonNull(driverClass, String.format("Configuration required: %s", Configuration.JDBC_DRIVER_CLASS));
        Objects.requireNonNull(url, String.format("Configuration required: %s", Configuration.JDBC_URL));
        Objects.requireNonNull(username, String.format("Configuration required: %s", Configuration.JDBC_USERNAME));

        this.dataSource = new BasicDataSource();
        this.dataSource.setDriverClassName(driverClass.toString());
        this.dataSource.setUrl(url.toString());
        this.dataSource.setUsername(username.toString());
        this.dataSource.setPassword(password.toString());
        this.dataSource.setMaxTotal(Integer.parseInt(maxTotal.toString()));
        this.dataSource.setTestOnBorrow(true);

        Object catalog = configuration.get(Configuration.JDBC_CATALOG);

        this.catalog = (catalog != null) ? catalog.toString() : null;

        if (this.catalog != null) {
            this.dataSource.setDefaultCatalog(this.catalog);
        }
    }

    @Override
    public Connection createConnection() throws SQLException {
        return this.dataSource.getConnection();
    }

    @Override
    public void enrichException(SyncException exception) {
        exception.setDataSource(this.dataSource.getUrl());
        exception.setInitialCatalog(this.catalog);
    }

    protected BasicDataSource getDataSource() {
        return this.dataSource;
    }

    @Override
    public void close() throws IOException {
        try {
            this.dataSource.close();
        } catch (SQLException exception) {
            throw new IOException(exception);
        } finally {
            DataSourceSyncProvider.LOG.info(String.format("closed data source %s", this.dataSource.getUrl()));
        }
    }
}
