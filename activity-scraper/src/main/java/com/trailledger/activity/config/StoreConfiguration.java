package com.trailledger.activity.config;

import com.trailledger.activity.store.GraphParticipationStore;
import com.trailledger.activity.store.ParticipationStore;
import com.trailledger.activity.store.TabularParticipationStore;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.neo4j.core.DatabaseSelectionProvider;
import org.springframework.data.neo4j.core.Neo4jClient;
import org.springframework.data.neo4j.core.transaction.Neo4jTransactionManager;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Selects the storage backend from {@code trail-ledger.store.backend}.
 * Each backend gets its own transaction manager so the two never share one.
 * The graph client and its transaction manager target the database named by
 * {@code spring.data.neo4j.database}.
 */
@Configuration
@Slf4j
public class StoreConfiguration {

    @Bean
    @ConditionalOnProperty(name = "trail-ledger.store.backend", havingValue = "TABULAR", matchIfMissing = true)
    public ParticipationStore tabularParticipationStore(DataSource dataSource) {
        log.info("Using relational participation store");
        return new TabularParticipationStore(
                new JdbcTemplate(dataSource),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
    }

    @Bean
    @ConditionalOnProperty(name = "trail-ledger.store.backend", havingValue = "GRAPH")
    public ParticipationStore graphParticipationStore(Driver driver, DatabaseSelectionProvider databaseSelection) {
        log.info("Using graph participation store");
        Neo4jClient client = Neo4jClient.with(driver)
                .withDatabaseSelectionProvider(databaseSelection)
                .build();
        Neo4jTransactionManager transactionManager = Neo4jTransactionManager.with(driver)
                .withDatabaseSelectionProvider(databaseSelection)
                .build();
        return new GraphParticipationStore(client, new TransactionTemplate(transactionManager));
    }
}
