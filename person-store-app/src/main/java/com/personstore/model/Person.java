package com.personstore.model;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A row of the {@code person} table. Every field is free text and may be null.
 * Rows have no identity, so two persons with equal fields are indistinguishable.
 */
public record Person(
    String username,
    String email,
    String firstName,
    String lastName,
    String biography,
    String occupation
) {
    public static final int FIELD_COUNT = 6;

    /**
     * Build a person from positional values in column order
     * (username, email, firstname, lastname, biography, occupation).
     *
     * @param fields exactly six values
     * @return the person
     * @throws IllegalArgumentException if the number of values is not six
     */
    public static Person fromFields(String... fields) {
        if (fields == null || fields.length != FIELD_COUNT) {
            throw new IllegalArgumentException("Expected " + FIELD_COUNT + " fields but got "
                + (fields == null ? 0 : fields.length));
        }
        return new Person(fields[0], fields[1], fields[2], fields[3], fields[4], fields[5]);
    }

    public static Person fromFields(List<String> fields) {
        return fromFields(fields == null ? null : fields.toArray(new String[0]));
    }

    /**
     * Values in column order, ready to bind to the insert statement.
     */
    public Object[] toColumnValues() {
        return new Object[] { username, email, firstName, lastName, biography, occupation };
    }

    // Tuple-style rendering used by the demo output
    @Override
    public String toString() {
        return format(toColumnValues());
    }

    static String format(Object[] values) {
        return Arrays.stream(values)
            .map(v -> v == null ? "None" : "'" + v + "'")
            .collect(Collectors.joining(", ", "(", ")"));
    }
}
