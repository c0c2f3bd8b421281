package com.trellissystems;

/**
 * Thrown when a value violates a declared type constraint,
 * e.g. inserting a disallowed type into a typed {@code Pile}.
 */
public class TypeConstraintException extends TrellisException {

    public TypeConstraintException(String message) {
        super(message);
    }
}
