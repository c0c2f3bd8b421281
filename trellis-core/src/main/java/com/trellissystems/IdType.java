package com.trellissystems;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Helpers for element identifiers.
 * Identifiers are random (version 4) UUIDs in their canonical string form.
 */
public final class IdType {

    private IdType() {
    }

    /**
     * Generates a new random identifier.
     *
     * @return a UUID4 string
     */
    public static String generate() {
        return UUID.randomUUID().toString();
    }

    /**
     * Checks whether the given string is a well-formed identifier.
     *
     * @param candidate the string to check
     * @return true if the string parses as a UUID
     */
    public static boolean isValid(String candidate) {
        if (candidate == null || candidate.length() != 36) {
            return false;
        }
        try {
            UUID.fromString(candidate);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Resolves the identifier of an element or validates a raw identifier.
     *
     * @param item an {@link Element} or an identifier string
     * @return the identifier
     * @throws TypeConstraintException if the item is neither an element nor a valid id
     */
    public static String of(Object item) {
        if (item instanceof Element) {
            return ((Element) item).getId();
        }
        if (item instanceof String && isValid((String) item)) {
            return (String) item;
        }
        throw new TypeConstraintException("Expected an Element or a valid id, got: " + item);
    }

    /**
     * Resolves the identifiers of a batch of elements or raw ids.
     *
     * @param items the elements or ids
     * @return the identifiers in iteration order
     */
    public static List<String> allOf(Collection<?> items) {
        List<String> ids = new ArrayList<>(items.size());
        for (Object item : items) {
            ids.add(of(item));
        }
        return ids;
    }
}
