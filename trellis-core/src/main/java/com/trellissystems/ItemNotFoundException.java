package com.trellissystems;

/**
 * Thrown when a lookup by id or position finds nothing and no default was supplied.
 */
public class ItemNotFoundException extends TrellisException {

    private final transient Object key;

    public ItemNotFoundException(Object key) {
        super("Item not found: " + key);
        this.key = key;
    }

    public ItemNotFoundException(Object key, String message) {
        super(message);
        this.key = key;
    }

    public ItemNotFoundException(Object key, Throwable cause) {
        super("Item not found: " + key, cause);
        this.key = key;
    }

    /**
     * Returns the key that could not be resolved.
     *
     * @return the missing key
     */
    public Object getKey() {
        return key;
    }
}
