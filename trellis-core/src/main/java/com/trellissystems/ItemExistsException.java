package com.trellissystems;

/**
 * Thrown when an id is inserted at a position while already being present.
 */
public class ItemExistsException extends TrellisException {

    public ItemExistsException(String id) {
        super("Item already exists: " + id);
    }
}
