package com.personstore.service;

import com.personstore.model.Person;
import com.personstore.model.PersonName;
import com.personstore.repository.PersonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Access to the {@code person} table. Each call runs a single statement on its
 * own connection and keeps no state between calls. Apart from
 * {@link #createTable()}, data access failures propagate as
 * {@link DataAccessException}.
 */
@Service
public class PersonStore {

    private static final Logger log = LoggerFactory.getLogger(PersonStore.class);

    private final PersonRepository personRepository;

    public PersonStore(PersonRepository personRepository) {
        this.personRepository = personRepository;
    }

    /**
     * Create the person table.
     *
     * @return true if the table was created, false if it already exists or the database refused
     */
    public boolean createTable() {
        try {
            personRepository.createTable();
        } catch (DataAccessException e) {
            log.warn("Could not create table person: {}", e.getMostSpecificCause().getMessage());
            return false;
        }
        return true;
    }

    /**
     * Drop the person table if it exists. Safe to call repeatedly.
     */
    public void dropTable() {
        personRepository.dropTable();
    }

    public void insertOne(Person person) {
        personRepository.insert(person);
    }

    /**
     * Insert all people in one batch. A failing row rolls back the whole batch.
     */
    public void insertMany(List<Person> people) {
        personRepository.insertAll(people);
    }

    /**
     * Every row, ordered by lastname (case-sensitive, codepoint order).
     */
    public List<Person> fetchAll() {
        return personRepository.findAllOrderByLastName();
    }

    /**
     * Case-sensitive exact lastname search returning the first match only.
     * <p>
     * The result always holds exactly one element: the match, or {@code null}
     * when nothing matches. Callers that want an empty result for "no match"
     * should use {@link #findFirstByLastName(String)}.
     *
     * @param lastName the lastname to match exactly
     * @return a one-element list holding the first match or null
     */
    public List<Person> findByLastNameExact(String lastName) {
        return Collections.singletonList(findFirstByLastName(lastName).orElse(null));
    }

    public Optional<Person> findFirstByLastName(String lastName) {
        return personRepository.findFirstByLastName(lastName);
    }

    /**
     * Case-insensitive substring search over biography, first match only.
     */
    public Optional<Person> findByBiographyContains(String text) {
        return personRepository.findFirstByBiographyLike(text);
    }

    /**
     * Case-insensitive substring search over lastname. Returns every match as
     * (firstname, lastname), ordered by firstname.
     */
    public List<PersonName> findByLastNameContains(String text) {
        return personRepository.findNamesByLastNameLike(text);
    }
}
