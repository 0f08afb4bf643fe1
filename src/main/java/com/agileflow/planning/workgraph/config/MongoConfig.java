package com.agileflow.planning.workgraph.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.AbstractMongoClientConfiguration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import java.util.concurrent.TimeUnit;

@Configuration
@EnableMongoRepositories(basePackages = "com.agileflow.planning.workgraph.repository")
public class MongoConfig extends AbstractMongoClientConfiguration {

    @Value("${spring.data.mongodb.uri}")
    private String uri;

    @Value("${spring.data.mongodb.database}")
    private String database;

    @Override
    protected String getDatabaseName() {
        return database;
    }

    @Override
    protected void configureClientSettings(MongoClientSettings.Builder builder) {
        builder.applyConnectionString(new ConnectionString(uri))
                .applyToConnectionPoolSettings(pool ->
                    pool.maxConnectionIdleTime(60, TimeUnit.SECONDS)
                        .maxSize(50)
                        .minSize(5))
                .applyToSocketSettings(socket ->
                    socket.connectTimeout(10, TimeUnit.SECONDS)
                          .readTimeout(10, TimeUnit.SECONDS));
    }

    // Indexes on work items, activity events and rebalance records are declared on the documents
    @Override
    protected boolean autoIndexCreation() {
        return true;
    }
}
