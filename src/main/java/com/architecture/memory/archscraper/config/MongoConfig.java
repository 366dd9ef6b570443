package com.architecture.memory.archscraper.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.AbstractMongoClientConfiguration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Mongo client for the architecture store. The database comes from {@code spring.data.mongodb.database},
 * or from the connection string when that is blank.
 */
@Configuration
@Slf4j
@EnableMongoRepositories(basePackages = "com.architecture.memory.archscraper.repository")
public class MongoConfig extends AbstractMongoClientConfiguration {

    private final ConnectionString connectionString;
    private final String database;
    private final int maxPoolSize;
    private final int minPoolSize;
    private final Duration readTimeout;

    public MongoConfig(@Value("${spring.data.mongodb.uri}") String uri,
                       @Value("${spring.data.mongodb.database:}") String database,
                       @Value("${mongo.pool.max-size:20}") int maxPoolSize,
                       @Value("${mongo.pool.min-size:2}") int minPoolSize,
                       @Value("${mongo.read-timeout:30s}") Duration readTimeout) {
        this.connectionString = new ConnectionString(uri);
        this.database = database;
        this.maxPoolSize = maxPoolSize;
        this.minPoolSize = minPoolSize;
        this.readTimeout = readTimeout;
    }

    @Override
    protected String getDatabaseName() {
        if (database != null && !database.isBlank()) {
            return database;
        }
        String fromUri = connectionString.getDatabase();
        if (fromUri == null) {
            throw new IllegalStateException("No MongoDB database configured in spring.data.mongodb.database or the URI");
        }
        return fromUri;
    }

    // creates the name, resourceCount and source indexes declared on ArchitectureDocument
    @Override
    protected boolean autoIndexCreation() {
        return true;
    }

    @Override
    protected void configureClientSettings(MongoClientSettings.Builder builder) {
        log.info("Mongo client for {} (database {}, pool {}-{})",
                connectionString.getHosts(), getDatabaseName(), minPoolSize, maxPoolSize);
        builder.applyConnectionString(connectionString)
                .applyToConnectionPoolSettings(pool -> pool
                        .maxSize(maxPoolSize)
                        .minSize(minPoolSize)
                        .maxConnectionIdleTime(60, TimeUnit.SECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(10, TimeUnit.SECONDS)
                        .readTimeout((int) readTimeout.toMillis(), TimeUnit.MILLISECONDS));
    }
}
