package com.personstore.repository;

import com.personstore.model.Person;
import com.personstore.model.PersonName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Repository
public class PersonRepository {

    private static final Logger log = LoggerFactory.getLogger(PersonRepository.class);

    static final String CREATE_TABLE = """
        CREATE TABLE person
            (username TEXT, email TEXT, firstname TEXT, lastname TEXT, biography TEXT, occupation TEXT)
        """;
    static final String DROP_TABLE = "DROP TABLE IF EXISTS person";
    static final String INSERT = "INSERT INTO person VALUES (?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    private static final RowMapper<Person> PERSON_MAPPER = (rs, rowNum) -> new Person(
        rs.getString("username"),
        rs.getString("email"),
        rs.getString("firstname"),
        rs.getString("lastname"),
        rs.getString("biography"),
        rs.getString("occupation")
    );

    private static final RowMapper<PersonName> NAME_MAPPER = (rs, rowNum) -> new PersonName(
        rs.getString("firstname"),
        rs.getString("lastname")
    );

    public PersonRepository(JdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
        this.jdbc = jdbc;
        this.tx = new TransactionTemplate(transactionManager);
    }

    // ========== SCHEMA ==========

    public void createTable() {
        log.debug("Creating table person");
        jdbc.execute(CREATE_TABLE);
    }

    public void dropTable() {
        log.debug("Dropping table person if present");
        jdbc.execute(DROP_TABLE);
    }

    // ========== WRITE OPERATIONS ==========

    public void insert(Person person) {
        Objects.requireNonNull(person, "person");
        jdbc.update(INSERT, person.toColumnValues());
    }

    /**
     * Insert all rows as one JDBC batch. Either every row is committed or none is.
     */
    public void insertAll(List<Person> people) {
        List<Object[]> batchArgs = people.stream()
            .map(p -> Objects.requireNonNull(p, "person").toColumnValues())
            .toList();
        if (batchArgs.isEmpty()) {
            return;
        }
        log.debug("Inserting batch of {} persons", batchArgs.size());
        tx.executeWithoutResult(status -> jdbc.batchUpdate(INSERT, batchArgs));
    }

    // ========== READ OPERATIONS ==========

    public List<Person> findAllOrderByLastName() {
        return jdbc.query("SELECT * FROM person ORDER BY lastname", PERSON_MAPPER);
    }

    public Optional<Person> findFirstByLastName(String lastName) {
        List<Person> results = jdbc.query(
            "SELECT * FROM person WHERE lastname = ? LIMIT 1",
            PERSON_MAPPER,
            lastName
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public Optional<Person> findFirstByBiographyLike(String text) {
        List<Person> results = jdbc.query(
            "SELECT * FROM person WHERE biography LIKE ? LIMIT 1",
            PERSON_MAPPER,
            containsPattern(text)
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<PersonName> findNamesByLastNameLike(String text) {
        return jdbc.query(
            "SELECT firstname, lastname FROM person WHERE lastname LIKE ? ORDER BY firstname",
            NAME_MAPPER,
            containsPattern(text)
        );
    }

    // % and _ in the text keep their LIKE meaning
    static String containsPattern(String text) {
        return "%" + Objects.requireNonNull(text, "search text") + "%";
    }
}
