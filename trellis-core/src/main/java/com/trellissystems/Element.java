package com.trellissystems;

import java.time.Instant;
import java.util.Objects;

/**
 * Base class of every addressable entity in Trellis.
 * An element carries an immutable UUID4 identifier and its creation time.
 * Two elements are equal exactly when their identifiers are equal.
 */
public abstract class Element {

    private final String id;
    private final Instant createdAt;

    /**
     * Creates a new element with a freshly generated identifier.
     */
    protected Element() {
        this(IdType.generate(), Instant.now());
    }

    /**
     * Creates an element with an existing identifier, e.g. when rebuilding a copy.
     *
     * @param id        the identifier to reuse
     * @param createdAt the original creation time
     * @throws TypeConstraintException if the identifier is not a valid UUID
     */
    protected Element(String id, Instant createdAt) {
        if (!IdType.isValid(id)) {
            throw new TypeConstraintException("Invalid element id: " + id);
        }
        this.id = id;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt cannot be null");
    }

    /**
     * Returns the identifier of this element.
     *
     * @return the UUID string
     */
    public final String getId() {
        return id;
    }

    /**
     * Returns the time this element was created.
     *
     * @return the creation timestamp
     */
    public final Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Element)) {
            return false;
        }
        return id.equals(((Element) o).id);
    }

    @Override
    public final int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + "}";
    }
}
