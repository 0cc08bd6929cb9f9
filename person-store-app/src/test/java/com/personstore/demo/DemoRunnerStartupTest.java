package com.personstore.demo;

import com.personstore.model.Person;
import com.personstore.service.PersonStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * With the demo enabled the runner executes while the application starts.
 */
@SpringBootTest(properties = "personstore.demo.enabled=true")
@ActiveProfiles("test")
class DemoRunnerStartupTest {

    @Autowired
    private PersonStore personStore;

    @Autowired
    private DemoRunner demoRunner;

    @Test
    void populatesStoreOnStartup() {
        assertThat(demoRunner).isNotNull();
        assertThat(personStore.fetchAll()).extracting(Person::username)
            .containsExactly("Neo", "Janey", "Joey", "Jonny");
    }
}
