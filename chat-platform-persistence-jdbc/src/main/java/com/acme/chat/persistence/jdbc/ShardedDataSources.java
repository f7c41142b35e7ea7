package com.acme.chat.persistence.jdbc;

import com.acme.chat.config.DatabaseConfig;
import com.acme.chat.shard.ShardRouter;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * The owned collection of per-shard connection pools.
 *
 * <p>Built once at startup and closed once at shutdown. Shard {@code i} is reached through the
 * pool at index {@code i}; the {@link ShardRouter} over the pools decides which index serves a
 * channel. Pools share no state, so operations on different shards never contend.
 */
public class ShardedDataSources implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ShardedDataSources.class);

    private final DatabaseConfig config;
    private final List<DataSource> dataSources;
    private final ShardRouter<DataSource> router;

    public ShardedDataSources(DatabaseConfig config, List<? extends DataSource> dataSources) {
        this.config = config;
        this.dataSources = List.copyOf(dataSources);
        this.router = new ShardRouter<>(this.dataSources);
    }

    /**
     * Open one Hikari pool per configured shard. If any pool fails to start, the pools already
     * opened are closed before the failure propagates.
     */
    public static ShardedDataSources open(DatabaseConfig config) {
        if (config.getShardCount() < 1) {
            throw new IllegalArgumentException("shard-count must be at least 1, was " + config.getShardCount());
        }

        List<HikariDataSource> opened = new ArrayList<>();
        try {
            for (int shard = 0; shard < config.getShardCount(); shard++) {
                opened.add(new HikariDataSource(hikariConfig(config, shard)));
                LOG.info("Opened pool for shard {}: {}", shard, config.buildShardUrl(shard));
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to open shard pool {} of {}", opened.size(), config.getShardCount(), e);
            for (HikariDataSource dataSource : opened) {
                try {
                    dataSource.close();
                } catch (RuntimeException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
            }
            throw e;
        }
        return new ShardedDataSources(config, opened);
    }

    static HikariConfig hikariConfig(DatabaseConfig config, int shard) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("chat-shard-" + shard);
        hikari.setJdbcUrl(config.buildShardUrl(shard));
        hikari.setUsername(config.getUsername());
        hikari.setPassword(config.getPassword());
        hikari.setMaximumPoolSize(config.getMaximumPoolSize());
        hikari.setMinimumIdle(config.getMinimumIdle());
        hikari.setMaxLifetime(config.getMaxLifetime().toMillis());
        hikari.setIdleTimeout(config.getIdleTimeout().toMillis());
        hikari.setConnectionTimeout(config.getConnectionTimeout().toMillis());
        hikari.setAutoCommit(true);
        return hikari;
    }

    public ShardRouter<DataSource> router() {
        return router;
    }

    public DatabaseConfig config() {
        return config;
    }

    public int shardCount() {
        return dataSources.size();
    }

    /** Pools in shard-index order. */
    public List<DataSource> dataSources() {
        return dataSources;
    }

    /** Probe every shard with {@link Connection#isValid(int)}. Never throws. */
    public List<ShardHealth> health() {
        List<ShardHealth> result = new ArrayList<>(dataSources.size());
        for (int shard = 0; shard < dataSources.size(); shard++) {
            try (Connection conn = dataSources.get(shard).getConnection()) {
                boolean valid = conn.isValid(config.getQueryTimeoutSeconds());
                result.add(new ShardHealth(shard, valid, valid ? null : "connection is not valid"));
            } catch (SQLException e) {
                LOG.warn("Health probe failed for shard {}: {}", shard, e.getMessage());
                result.add(new ShardHealth(shard, false, e.getMessage()));
            }
        }
        return result;
    }

    /**
     * Close every pool. All pools are attempted; the first failure is rethrown with the others
     * attached as suppressed.
     */
    @Override
    public void close() {
        RuntimeException failure = null;
        for (int shard = 0; shard < dataSources.size(); shard++) {
            if (!(dataSources.get(shard) instanceof AutoCloseable closeable)) {
                continue;
            }
            try {
                closeable.close();
                LOG.info("Closed pool for shard {}", shard);
            } catch (Exception e) {
                RuntimeException wrapped = e instanceof RuntimeException runtime
                        ? runtime
                        : new IllegalStateException("Failed to close pool for shard " + shard, e);
                if (failure == null) {
                    failure = wrapped;
                } else {
                    failure.addSuppressed(wrapped);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /** Result of probing one shard. {@code error} is null when healthy. */
    public record ShardHealth(int shard, boolean healthy, String error) {
    }
}
