package com.trailledger.activity.config;

import com.trailledger.activity.store.ParticipationStore;
import org.junit.jupiter.api.Test;
import org.neo4j.driver.Driver;
import org.springframework.data.neo4j.core.DatabaseSelection;
import org.springframework.data.neo4j.core.DatabaseSelectionProvider;

import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StoreConfigurationTest {

    private final Driver driver = mock(Driver.class);
    private final DatabaseSelectionProvider databaseSelection = mock(DatabaseSelectionProvider.class);

    @Test
    void graphQueriesTargetConfiguredDatabase() {
        when(databaseSelection.getDatabaseSelection()).thenReturn(DatabaseSelection.byName("trails"));
        ParticipationStore store = new StoreConfiguration().graphParticipationStore(driver, databaseSelection);

        // the mocked driver has no sessions, only the database lookup matters here
        catchThrowable(() -> store.findPersonByUrl("https://club.example/members/jdoe"));

        verify(databaseSelection, atLeastOnce()).getDatabaseSelection();
    }

    @Test
    void graphTransactionsTargetConfiguredDatabase() {
        when(databaseSelection.getDatabaseSelection()).thenReturn(DatabaseSelection.byName("trails"));
        ParticipationStore store = new StoreConfiguration().graphParticipationStore(driver, databaseSelection);

        catchThrowable(() -> store.inTransaction(() -> "unused"));

        verify(databaseSelection, atLeastOnce()).getDatabaseSelection();
    }
}
