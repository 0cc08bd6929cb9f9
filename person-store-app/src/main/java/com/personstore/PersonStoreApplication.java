package com.personstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PersonStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(PersonStoreApplication.class, args);
    }
}
