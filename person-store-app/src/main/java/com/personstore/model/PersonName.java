package com.personstore.model;

/**
 * The (firstname, lastname) projection returned by partial lastname searches.
 */
public record PersonName(String firstName, String lastName) {

    @Override
    public String toString() {
        return Person.format(new Object[] { firstName, lastName });
    }
}
