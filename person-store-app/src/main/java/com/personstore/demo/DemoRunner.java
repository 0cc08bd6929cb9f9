package com.personstore.demo;

import com.personstore.model.Person;
import com.personstore.model.PersonName;
import com.personstore.service.PersonStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Walks through every store operation on a freshly recreated table and prints the results.
 */
@Component
@ConditionalOnProperty(prefix = "personstore.demo", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DemoRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoRunner.class);

    static final Person NEO = Person.fromFields(
        "Neo", "ThomasAnderson@gmail.com", "Thomas", "Anderson",
        "Thomas Anderson is a Computer Programmer.", "Computer Programmer");

    static final List<Person> SAMPLE_PEOPLE = List.of(
        new Person("Janey", "JaneDoe@gmail.com", "Jane", "Doe",
            "Jane Doe is a Software Engineer.", "Software Engineer"),
        new Person("Joey", "JoeShmo@gmail.com", "Joseph", "Shmo",
            "Joseph Shmo is a Data Scientist.", "Data Scientist"),
        new Person("Jonny", "JohnSmith@gmail.com", "John", "Smith",
            "John Doe is a Database Administrator.", "Database Administrator")
    );

    static final String EXACT_LASTNAME = "Shmo";
    static final String BIOGRAPHY_KEYWORD = "eng";
    static final String LASTNAME_KEYWORD = "s";

    private final PersonStore personStore;

    public DemoRunner(PersonStore personStore) {
        this.personStore = personStore;
    }

    @Override
    public void run(String... args) {
        personStore.dropTable();
        if (!personStore.createTable()) {
            log.warn("Table person could not be created, skipping demo");
            return;
        }

        System.out.println();
        System.out.println("table functions:");
        personStore.insertOne(NEO);
        personStore.insertMany(SAMPLE_PEOPLE);
        for (Person person : personStore.fetchAll()) {
            System.out.println(person);
        }

        System.out.println();
        System.out.println("search functions:");
        List<Person> exact = personStore.findByLastNameExact(EXACT_LASTNAME);
        System.out.println("lastname match: " + formatList(exact));

        Optional<Person> biography = personStore.findByBiographyContains(BIOGRAPHY_KEYWORD);
        System.out.println("biography match: " + biography.map(Person::toString).orElse("None"));

        System.out.println("matches for: " + LASTNAME_KEYWORD);
        for (PersonName name : personStore.findByLastNameContains(LASTNAME_KEYWORD)) {
            System.out.println("    name: " + name);
        }
        log.info("Demo finished");
    }

    private static String formatList(List<Person> people) {
        StringBuilder sb = new StringBuilder("[");
        for (Person p : people) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(p == null ? "None" : p.toString());
        }
        return sb.append("]").toString();
    }
}
