package com.mm.chartdata.jdbc;

import com.mm.chartdata.config.ConnectionsProperties;
import com.mm.chartdata.config.ConnectionsProperties.ConnectionConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves a chart's {@code connectionId} to a pooled {@link DataSource}. No id means the
 * application's default data source; named ids get their own Hikari pool, created on first use.
 */
@Component
public class DataSourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(DataSourceRegistry.class);

    private final DataSource defaultDataSource;
    private final ConnectionsProperties props;
    private final Map<String, HikariDataSource> pools = new ConcurrentHashMap<>();

    public DataSourceRegistry(DataSource defaultDataSource, ConnectionsProperties props) {
        this.defaultDataSource = defaultDataSource;
        this.props = props;
    }

    @PostConstruct
    void validate() {
        List<String> missing = new ArrayList<>();
        props.getConnections().forEach((id, cfg) -> {
            if (cfg == null || cfg.getUrl() == null || cfg.getUrl().isBlank()) missing.add("app.connections." + id + ".url");
        });
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing required connection configuration: " + String.join(", ", missing));
        }
    }

    /**
     * @throws ConnectionNotFoundException when {@code connectionId} is not configured
     */
    public DataSource resolve(String connectionId) {
        if (connectionId == null || connectionId.isBlank() || "default".equals(connectionId)) {
            return defaultDataSource;
        }
        ConnectionConfig cfg = props.getConnections().get(connectionId);
        if (cfg == null) throw new ConnectionNotFoundException(connectionId);
        return pools.computeIfAbsent(connectionId, id -> createPool(id, cfg));
    }

    public Set<String> connectionIds() {
        Set<String> ids = new TreeSet<>(props.getConnections().keySet());
        ids.add("default");
        return ids;
    }

    private HikariDataSource createPool(String id, ConnectionConfig cfg) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("chart-" + id);
        config.setJdbcUrl(cfg.getUrl());
        config.setUsername(cfg.getUsername());
        config.setPassword(cfg.getPassword());
        if (cfg.getDriverClassName() != null && !cfg.getDriverClassName().isBlank()) {
            config.setDriverClassName(cfg.getDriverClassName());
        }
        config.setMaximumPoolSize(cfg.getMaximumPoolSize());
        config.setMinimumIdle(0);
        config.setConnectionTimeout(cfg.getConnectionTimeoutMs());
        config.setReadOnly(true);
        log.info("Creating connection pool id={} maxPoolSize={}", id, cfg.getMaximumPoolSize());
        return new HikariDataSource(config);
    }

    @PreDestroy
    void close() {
        pools.forEach((id, ds) -> {
            log.info("Closing connection pool id={}", id);
            ds.close();
        });
        pools.clear();
    }
}
