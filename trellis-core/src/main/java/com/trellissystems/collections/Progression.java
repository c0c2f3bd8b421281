package com.trellissystems.collections;

import com.trellissystems.Element;
import com.trellissystems.IdType;
import com.trellissystems.ItemNotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered list of element ids with list-like semantics.
 *
 * <p>Entries are always valid ids; duplicates are allowed. {@link #extend(Progression)} only
 * accepts another progression, raw ids go through {@link #include(Collection)}.
 * {@link #plus} and {@link #minus} return modified copies; {@link #append} and {@link #exclude}
 * are their in-place counterparts.
 *
 * <p>Not synchronized: a progression has a single writer, its owner.
 */
public class Progression extends Element implements Iterable<String> {

    private final List<String> order;
    private final String name;

    public Progression() {
        this(null, List.of());
    }

    public Progression(String name) {
        this(name, List.of());
    }

    /**
     * Creates a progression holding the ids of the given elements or raw ids.
     *
     * @param name  an optional name
     * @param items elements or ids, in order
     */
    public Progression(String name, Collection<?> items) {
        this.name = name;
        this.order = new ArrayList<>(IdType.allOf(items));
    }

    public String getName() {
        return name;
    }

    public int size() {
        return order.size();
    }

    public boolean isEmpty() {
        return order.isEmpty();
    }

    /**
     * Appends an element (or id) at the end.
     *
     * @param item an element or id
     */
    public void append(Object item) {
        order.add(IdType.of(item));
    }

    /**
     * Appends every id of another progression.
     *
     * @param other the progression to append
     */
    public void extend(Progression other) {
        order.addAll(other.order);
    }

    /**
     * Appends the element (or id) unless already present.
     *
     * @param item an element or id
     * @return true, the item is present afterwards
     */
    public boolean include(Object item) {
        String id = IdType.of(item);
        if (!order.contains(id)) {
            order.add(id);
        }
        return true;
    }

    /**
     * Appends every element (or id) of a batch that is not yet present.
     *
     * @param items elements or ids
     * @return true if all are present afterwards
     */
    public boolean include(Collection<?> items) {
        for (String id : IdType.allOf(items)) {
            if (!order.contains(id)) {
                order.add(id);
            }
        }
        return true;
    }

    /**
     * Checks whether an element (or id) is present. A collection or progression argument
     * is a batch test: every entry must be present.
     *
     * @param item an element, id, collection or progression
     * @return true if present
     */
    public boolean contains(Object item) {
        if (item instanceof Progression) {
            return containsAll(((Progression) item).order);
        }
        if (item instanceof Collection) {
            return containsAll((Collection<?>) item);
        }
        if (item instanceof Element) {
            return order.contains(((Element) item).getId());
        }
        return item instanceof String && order.contains(item);
    }

    /**
     * Checks whether every element (or id) of a batch is present.
     * An empty batch is never contained.
     *
     * @param items elements or ids
     * @return true if all are present
     */
    public boolean containsAll(Collection<?> items) {
        if (items.isEmpty()) {
            return false;
        }
        for (Object item : items) {
            if (!contains(item)) {
                return false;
            }
        }
        return true;
    }

    public String get(int index) {
        return order.get(resolveIndex(index));
    }

    /**
     * Replaces the id at a position.
     *
     * @param index the position, negative values count from the end
     * @param item  an element or id
     */
    public void set(int index, Object item) {
        order.set(resolveIndex(index), IdType.of(item));
    }

    public Progression slice(int fromIndex, int toIndex) {
        checkRange(fromIndex, toIndex);
        return new Progression(name, order.subList(fromIndex, toIndex));
    }

    /**
     * Replaces a range with the given elements (or ids).
     *
     * @param fromIndex start position, inclusive
     * @param toIndex   end position, exclusive
     * @param items     the replacement
     */
    public void setSlice(int fromIndex, int toIndex, Collection<?> items) {
        checkRange(fromIndex, toIndex);
        List<String> replacement = IdType.allOf(items);
        List<String> range = order.subList(fromIndex, toIndex);
        range.clear();
        range.addAll(replacement);
    }

    public void deleteSlice(int fromIndex, int toIndex) {
        checkRange(fromIndex, toIndex);
        order.subList(fromIndex, toIndex).clear();
    }

    /**
     * Removes the first occurrence of an element (or id).
     *
     * @param item an element or id
     * @throws ItemNotFoundException if the item is absent
     */
    public void remove(Object item) {
        String id = IdType.of(item);
        if (!order.remove(id)) {
            throw new ItemNotFoundException(id);
        }
    }

    /**
     * Removes every occurrence of an element (or id).
     *
     * @param item an element or id
     * @return false if the item was absent
     */
    public boolean exclude(Object item) {
        String id = IdType.of(item);
        return order.removeAll(Collections.singleton(id));
    }

    /**
     * Removes every occurrence of every id in another progression.
     *
     * @param other the ids to remove
     * @return false if none of them was present
     */
    public boolean exclude(Progression other) {
        return order.removeAll(other.order);
    }

    /**
     * Removes a number of ids from the front.
     *
     * @param count how many ids to remove
     * @return true once removed
     * @throws IndexOutOfBoundsException if fewer ids are available
     */
    public boolean exclude(int count) {
        if (count > order.size()) {
            throw new IndexOutOfBoundsException("Cannot remove more items than available: " + count);
        }
        order.subList(0, count).clear();
        return true;
    }

    /**
     * Removes and returns the last id.
     *
     * @return the id
     * @throws ItemNotFoundException if empty
     */
    public String pop() {
        return pop(-1);
    }

    public String pop(int index) {
        return order.remove(resolveIndex(index));
    }

    /**
     * Removes and returns the first id.
     *
     * @return the id
     * @throws ItemNotFoundException if empty
     */
    public String popLeft() {
        return pop(0);
    }

    public void clear() {
        order.clear();
    }

    /**
     * Returns a copy with the element (or id) appended.
     *
     * @param item an element or id
     * @return a new progression
     */
    public Progression plus(Object item) {
        Progression copy = copy();
        if (item instanceof Progression) {
            copy.extend((Progression) item);
        } else {
            copy.append(item);
        }
        return copy;
    }

    /**
     * Returns a copy without any occurrence of the element (or id), or of the ids of
     * another progression.
     *
     * @param item an element, id or progression
     * @return a new progression
     */
    public Progression minus(Object item) {
        Progression copy = copy();
        if (item instanceof Progression) {
            copy.exclude((Progression) item);
        } else {
            copy.exclude(item);
        }
        return copy;
    }

    public Progression copy() {
        return new Progression(name, order);
    }

    public Progression reversed() {
        List<String> reversed = new ArrayList<>(order);
        Collections.reverse(reversed);
        return new Progression(name, reversed);
    }

    /**
     * Returns a snapshot of the ids.
     *
     * @return the ids in order
     */
    public List<String> toList() {
        return List.copyOf(order);
    }

    @Override
    public Iterator<String> iterator() {
        return toList().iterator();
    }

    @Override
    public String toString() {
        return "Progression(" + order + ")";
    }

    private int resolveIndex(int index) {
        int position = index < 0 ? order.size() + index : index;
        if (position < 0 || position >= order.size()) {
            throw new ItemNotFoundException(index, "Index out of range: " + index);
        }
        return position;
    }

    private void checkRange(int fromIndex, int toIndex) {
        if (fromIndex < 0 || toIndex > order.size() || fromIndex > toIndex) {
            throw new ItemNotFoundException(fromIndex + ":" + toIndex);
        }
    }
}
