package com.trailledger.activity.store;

import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the shared store behaviour against H2 in PostgreSQL mode.
 */
class TabularParticipationStoreTest extends ParticipationStoreContractTest {

    private JdbcTemplate jdbcTemplate;

    @Override
    protected ParticipationStore createStore() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:store-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL", "sa", "");
        jdbcTemplate = new JdbcTemplate(dataSource);
        TabularParticipationStore tabular = new TabularParticipationStore(
                jdbcTemplate, new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
        tabular.ensureSchema();
        return tabular;
    }

    @Test
    void ensureSchemaCanRunTwice() {
        store.ensureSchema();
        store.createPerson(jane());

        assertThat(store.findPersonByUrl(JANE)).isPresent();
    }

    @Test
    void blankUserNameIsStoredAsNull() {
        store.createPerson(jane().toBuilder().userName(" ").build());

        Integer nulls = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM person WHERE user_name IS NULL", Integer.class);
        assertThat(nulls).isEqualTo(1);
    }
}
