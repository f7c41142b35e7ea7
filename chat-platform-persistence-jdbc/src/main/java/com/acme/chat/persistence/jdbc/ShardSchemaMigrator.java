package com.acme.chat.persistence.jdbc;

import com.acme.chat.core.PermanentException;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.List;

/**
 * Applies the chat schema to every shard with Flyway. Each shard is an independent database, so
 * each keeps its own schema history table.
 */
public final class ShardSchemaMigrator {

    private static final Logger LOG = LoggerFactory.getLogger(ShardSchemaMigrator.class);

    static final String H2_LOCATION = "classpath:db/migration/h2";
    static final String POSTGRES_LOCATION = "classpath:db/migration/postgresql";

    private ShardSchemaMigrator() {
    }

    /**
     * Migrate all shards in index order.
     *
     * @throws PermanentException if any shard fails to migrate; later shards are not attempted
     */
    public static void migrate(ShardedDataSources shards) {
        String location = shards.config().isH2() ? H2_LOCATION : POSTGRES_LOCATION;
        List<DataSource> dataSources = shards.dataSources();
        for (int shard = 0; shard < dataSources.size(); shard++) {
            migrateShard(shard, dataSources.get(shard), location);
        }
    }

    static void migrateShard(int shard, DataSource dataSource, String location) {
        try {
            MigrateResult result = Flyway.configure()
                    .dataSource(dataSource)
                    .locations(location)
                    .load()
                    .migrate();
            LOG.info("Shard {} schema migrated: {} migration(s) applied from {}",
                    shard, result.migrationsExecuted, location);
        } catch (FlywayException e) {
            LOG.error("Schema migration failed for shard {}", shard, e);
            throw new PermanentException("Schema migration failed for shard " + shard, e);
        }
    }
}
