package com.moviemart.cms.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.AbstractMongoClientConfiguration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import java.util.concurrent.TimeUnit;

/**
 * Mongo client with explicit pool and socket limits. The {@code MongoTemplate} and mapping
 * converter come from {@link AbstractMongoClientConfiguration}. Index creation stays off: the
 * collections and their indexes belong to the CRUD layer.
 */
@Configuration
@EnableMongoRepositories(basePackages = "com.moviemart.cms.repository")
public class MongoConfig extends AbstractMongoClientConfiguration {

    @Value("${spring.data.mongodb.uri}")
    private String uri;

    @Value("${spring.data.mongodb.database}")
    private String database;

    @Value("${cms.mongodb.pool.max-size:20}")
    private int maxPoolSize;

    @Value("${cms.mongodb.socket.read-timeout-seconds:30}")
    private int readTimeoutSeconds;

    @Override
    protected String getDatabaseName() {
        return database;
    }

    @Override
    public MongoClient mongoClient() {
        ConnectionString connectionString = new ConnectionString(uri);
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(connectionString)
                .applyToConnectionPoolSettings(builder ->
                    builder.maxConnectionIdleTime(60, TimeUnit.SECONDS)
                           .maxSize(maxPoolSize)
                           .minSize(2))
                .applyToSocketSettings(builder ->
                    builder.connectTimeout(10, TimeUnit.SECONDS)
                           .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS))
                .build();
        return MongoClients.create(settings);
    }
}
