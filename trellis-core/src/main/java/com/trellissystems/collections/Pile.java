package com.trellissystems.collections;

import com.trellissystems.Element;
import com.trellissystems.IdType;
import com.trellissystems.ItemExistsException;
import com.trellissystems.ItemNotFoundException;
import com.trellissystems.TypeConstraintException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Ordered, keyed collection of elements.
 *
 * <p>A pile keeps an id-to-item map and an order list. Positional access ({@link #get(int)},
 * {@link #slice(int, int)}) resolves through the order list, key access ({@link #get(String)})
 * through the map. Every mutation updates both under one {@link ReentrantLock} per instance,
 * so {@code size() == keys().size()} always holds.
 *
 * <p>Each operation has a synchronous form and an asynchronous form ({@code includeAsync},
 * {@code popAsync}, ...) that runs on the pile's executor and takes the same lock.
 *
 * <p>When allowed item types are declared, every inserted item's runtime class must be one of
 * them; otherwise a {@link TypeConstraintException} is thrown.
 *
 * @param <T> the element type
 */
public class Pile<T extends Element> implements Iterable<T> {

    private final Map<String, T> items = new HashMap<>();
    private final List<String> order = new ArrayList<>();
    private final Set<Class<?>> itemTypes;
    private final ReentrantLock lock = new ReentrantLock();
    private final Executor asyncExecutor;

    /**
     * Creates an empty pile accepting any element type.
     */
    public Pile() {
        this(null, ForkJoinPool.commonPool());
    }

    /**
     * Creates an empty pile restricted to the given runtime types.
     *
     * @param itemTypes the allowed classes, or null for no restriction
     */
    public Pile(Collection<? extends Class<? extends T>> itemTypes) {
        this(itemTypes, ForkJoinPool.commonPool());
    }

    /**
     * Creates an empty pile restricted to the given runtime types, running asynchronous
     * operations on the given executor.
     *
     * @param itemTypes     the allowed classes, or null for no restriction
     * @param asyncExecutor the executor for the {@code *Async} operations
     */
    public Pile(Collection<? extends Class<? extends T>> itemTypes, Executor asyncExecutor) {
        if (itemTypes != null && itemTypes.isEmpty()) {
            throw new IllegalArgumentException("Allowed item types cannot be an empty set");
        }
        this.itemTypes = itemTypes == null ? null : Collections.unmodifiableSet(new HashSet<>(itemTypes));
        this.asyncExecutor = Objects.requireNonNull(asyncExecutor, "asyncExecutor cannot be null");
    }

    /**
     * Creates an unrestricted pile holding the given items in iteration order.
     *
     * @param items the initial items
     * @param <T>   the element type
     * @return a new pile
     */
    public static <T extends Element> Pile<T> of(Collection<? extends T> items) {
        Pile<T> pile = new Pile<>();
        pile.include(items);
        return pile;
    }

    /**
     * Creates a typed pile holding the given items in iteration order.
     *
     * @param items     the initial items
     * @param itemTypes the allowed classes
     * @param <T>       the element type
     * @return a new pile
     */
    public static <T extends Element> Pile<T> of(Collection<? extends T> items,
                                                 Collection<? extends Class<? extends T>> itemTypes) {
        Pile<T> pile = new Pile<>(itemTypes);
        pile.include(items);
        return pile;
    }

    // ---- queries ----

    public int size() {
        return withLock(items::size);
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Checks whether an element (or an id) is present.
     * Values that are neither elements nor ids are simply reported as absent.
     *
     * @param item an element or id
     * @return true if present
     */
    public boolean contains(Object item) {
        String id = idOrNull(item);
        return id != null && withLock(() -> items.containsKey(id));
    }

    /**
     * Checks whether every element (or id) of a batch is present.
     *
     * @param batch elements or ids
     * @return true if all are present
     */
    public boolean containsAll(Collection<?> batch) {
        return withLock(() -> {
            for (Object item : batch) {
                String id = idOrNull(item);
                if (id == null || !items.containsKey(id)) {
                    return false;
                }
            }
            return true;
        });
    }

    /**
     * Returns the item with the given id.
     *
     * @param id the item id
     * @return the item
     * @throws ItemNotFoundException if no such item exists
     */
    public T get(String id) {
        return withLock(() -> {
            T item = items.get(id);
            if (item == null) {
                throw new ItemNotFoundException(id);
            }
            return item;
        });
    }

    /**
     * Returns the item with the given id, or the default if absent.
     *
     * @param id           the item id
     * @param defaultValue returned when the id is absent
     * @return the item or the default
     */
    public T get(String id, T defaultValue) {
        return withLock(() -> items.getOrDefault(id, defaultValue));
    }

    /**
     * Returns the stored item equal to the given element.
     *
     * @param element the element to look up
     * @return the stored item
     * @throws ItemNotFoundException if the element is not present
     */
    public T get(Element element) {
        return get(element.getId());
    }

    /**
     * Returns the item at a position of the order list.
     *
     * @param index the position, negative values count from the end
     * @return the item
     * @throws ItemNotFoundException if the position is out of range
     */
    public T get(int index) {
        return withLock(() -> items.get(order.get(resolveIndex(index))));
    }

    /**
     * Returns a new pile with the items between two positions.
     *
     * @param fromIndex start position, inclusive
     * @param toIndex   end position, exclusive
     * @return a pile with the same type restriction
     * @throws ItemNotFoundException if the range is invalid
     */
    public Pile<T> slice(int fromIndex, int toIndex) {
        return withLock(() -> {
            if (fromIndex < 0 || toIndex > order.size() || fromIndex > toIndex) {
                throw new ItemNotFoundException(fromIndex + ":" + toIndex);
            }
            Pile<T> result = emptyCopy();
            for (String id : order.subList(fromIndex, toIndex)) {
                result.putLast(items.get(id));
            }
            return result;
        });
    }

    /**
     * Returns a snapshot of the ids in order.
     *
     * @return the ids
     */
    public List<String> keys() {
        return withLock(() -> List.copyOf(order));
    }

    /**
     * Returns a snapshot of the items in order.
     *
     * @return the items
     */
    public List<T> values() {
        return withLock(() -> {
            List<T> result = new ArrayList<>(order.size());
            for (String id : order) {
                result.add(items.get(id));
            }
            return result;
        });
    }

    /**
     * Iterates over a snapshot taken when the iterator is created.
     * Concurrent mutations do not affect an iteration already in progress.
     */
    @Override
    public Iterator<T> iterator() {
        return values().iterator();
    }

    public Stream<T> stream() {
        return values().stream();
    }

    /**
     * Returns the declared allowed types.
     *
     * @return the allowed classes, or null if unrestricted
     */
    public Set<Class<?>> getItemTypes() {
        return itemTypes;
    }

    // ---- mutations ----

    /**
     * Replaces the item at a position.
     *
     * @param index the position, negative values count from the end
     * @param item  the new item
     * @throws ItemNotFoundException   if the position is out of range
     * @throws ItemExistsException     if the new item is already stored at another position
     * @throws TypeConstraintException if the item type is not allowed
     */
    public void set(int index, T item) {
        checkType(item);
        withLock(() -> {
            int position = resolveIndex(index);
            String replaced = order.get(position);
            if (!replaced.equals(item.getId()) && items.containsKey(item.getId())) {
                throw new ItemExistsException(item.getId());
            }
            items.remove(replaced);
            items.put(item.getId(), item);
            order.set(position, item.getId());
            return null;
        });
    }

    /**
     * Removes and returns the item with the given id.
     *
     * @param id the item id
     * @return the removed item
     * @throws ItemNotFoundException if no such item exists
     */
    public T pop(String id) {
        return withLock(() -> {
            if (!items.containsKey(id)) {
                throw new ItemNotFoundException(id);
            }
            return remove(id);
        });
    }

    /**
     * Removes and returns the item with the given id, or returns the default if absent.
     *
     * @param id           the item id
     * @param defaultValue returned when the id is absent
     * @return the removed item or the default
     */
    public T pop(String id, T defaultValue) {
        return withLock(() -> items.containsKey(id) ? remove(id) : defaultValue);
    }

    /**
     * Removes and returns the stored item equal to the given element.
     *
     * @param element the element to remove
     * @return the removed item
     * @throws ItemNotFoundException if the element is not present
     */
    public T pop(Element element) {
        return pop(element.getId());
    }

    /**
     * Removes and returns the item at a position.
     *
     * @param index the position, negative values count from the end
     * @return the removed item
     * @throws ItemNotFoundException if the position is out of range
     */
    public T pop(int index) {
        return withLock(() -> remove(order.get(resolveIndex(index))));
    }

    /**
     * Adds the item at the end unless it is already present.
     * Including an item twice leaves the pile as after the first inclusion.
     *
     * @param item the item
     * @return true, the item is always present afterwards
     * @throws TypeConstraintException if the item type is not allowed
     */
    public boolean include(T item) {
        checkType(item);
        return withLock(() -> {
            if (!items.containsKey(item.getId())) {
                putLast(item);
            }
            return true;
        });
    }

    /**
     * Adds every missing item of a batch at the end, in iteration order.
     * The whole batch is type-checked before anything is inserted.
     *
     * @param batch the items
     * @return true if every item is present afterwards
     */
    public boolean include(Collection<? extends T> batch) {
        batch.forEach(this::checkType);
        return withLock(() -> {
            for (T item : batch) {
                if (!items.containsKey(item.getId())) {
                    putLast(item);
                }
            }
            return true;
        });
    }

    /**
     * Removes the element (or id) if present.
     *
     * @param item an element or id
     * @return true if something was removed, false if it was absent
     */
    public boolean exclude(Object item) {
        String id = idOrNull(item);
        if (id == null) {
            return false;
        }
        return withLock(() -> {
            if (!items.containsKey(id)) {
                return false;
            }
            remove(id);
            return true;
        });
    }

    /**
     * Overwrites items whose ids are already present (keeping their position)
     * and appends the others.
     *
     * @param batch the items
     */
    public void update(Collection<? extends T> batch) {
        batch.forEach(this::checkType);
        withLock(() -> {
            for (T item : batch) {
                if (items.containsKey(item.getId())) {
                    items.put(item.getId(), item);
                } else {
                    putLast(item);
                }
            }
            return null;
        });
    }

    /**
     * Inserts an item at a position.
     *
     * @param index the position, between 0 and {@code size()}
     * @param item  the item
     * @throws ItemExistsException if the item is already present
     */
    public void insert(int index, T item) {
        checkType(item);
        withLock(() -> {
            if (index < 0 || index > order.size()) {
                throw new ItemNotFoundException(index, "Insert position out of range: " + index);
            }
            if (items.containsKey(item.getId())) {
                throw new ItemExistsException(item.getId());
            }
            items.put(item.getId(), item);
            order.add(index, item.getId());
            return null;
        });
    }

    public void clear() {
        withLock(() -> {
            items.clear();
            order.clear();
            return null;
        });
    }

    /**
     * Returns a copy of this pile with the item included.
     *
     * @param item the item
     * @return a new pile
     */
    public Pile<T> plus(T item) {
        Pile<T> copy = copy();
        copy.include(item);
        return copy;
    }

    /**
     * Returns a copy of this pile without the element (or id).
     *
     * @param item an element or id
     * @return a new pile
     * @throws ItemNotFoundException if the item is not present
     */
    public Pile<T> minus(Object item) {
        if (!contains(item)) {
            throw new ItemNotFoundException(item);
        }
        Pile<T> copy = copy();
        copy.exclude(item);
        return copy;
    }

    /**
     * Returns a shallow copy with the same order and type restriction.
     *
     * @return a new pile
     */
    public Pile<T> copy() {
        return withLock(() -> {
            Pile<T> copy = emptyCopy();
            for (String id : order) {
                copy.putLast(items.get(id));
            }
            return copy;
        });
    }

    // ---- asynchronous forms ----

    public CompletableFuture<T> getAsync(String id) {
        return async(() -> get(id));
    }

    public CompletableFuture<Void> setAsync(int index, T item) {
        return async(() -> {
            set(index, item);
            return null;
        });
    }

    public CompletableFuture<T> popAsync(String id) {
        return async(() -> pop(id));
    }

    public CompletableFuture<Boolean> includeAsync(T item) {
        return async(() -> include(item));
    }

    public CompletableFuture<Boolean> excludeAsync(Object item) {
        return async(() -> exclude(item));
    }

    public CompletableFuture<Void> updateAsync(Collection<? extends T> batch) {
        return async(() -> {
            update(batch);
            return null;
        });
    }

    public CompletableFuture<Void> clearAsync() {
        return async(() -> {
            clear();
            return null;
        });
    }

    /**
     * Visits the items of a snapshot of the order, one step per executor task.
     * Items removed after the snapshot was taken are skipped.
     *
     * @param action the visitor
     * @return a future completing after the last visit
     */
    public CompletableFuture<Void> forEachAsync(Consumer<? super T> action) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String id : keys()) {
            chain = chain.thenRunAsync(() -> {
                T item = get(id, null);
                if (item != null) {
                    action.accept(item);
                }
            }, asyncExecutor);
        }
        return chain;
    }

    @Override
    public String toString() {
        return "Pile{size=" + size() + (itemTypes == null ? "" : ", types=" + itemTypes) + "}";
    }

    // ---- internals ----

    private <R> CompletableFuture<R> async(Supplier<R> operation) {
        return CompletableFuture.supplyAsync(() -> withLock(operation), asyncExecutor);
    }

    private <R> R withLock(Supplier<R> operation) {
        lock.lock();
        try {
            return operation.get();
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private void putLast(T item) {
        items.put(item.getId(), item);
        order.add(item.getId());
    }

    // caller holds the lock
    private T remove(String id) {
        order.remove(id);
        return items.remove(id);
    }

    // caller holds the lock
    private int resolveIndex(int index) {
        int position = index < 0 ? order.size() + index : index;
        if (position < 0 || position >= order.size()) {
            throw new ItemNotFoundException(index, "Index out of range: " + index);
        }
        return position;
    }

    private Pile<T> emptyCopy() {
        return new Pile<>(itemTypes == null ? null : castTypes(), asyncExecutor);
    }

    @SuppressWarnings("unchecked")
    private Collection<? extends Class<? extends T>> castTypes() {
        List<Class<? extends T>> types = new ArrayList<>();
        for (Class<?> type : itemTypes) {
            types.add((Class<? extends T>) type);
        }
        return types;
    }

    private void checkType(T item) {
        Objects.requireNonNull(item, "Pile items cannot be null");
        if (itemTypes != null && !itemTypes.contains(item.getClass())) {
            throw new TypeConstraintException("Invalid item type " + item.getClass().getName()
                    + ". Expected one of " + itemTypes);
        }
    }

    private static String idOrNull(Object item) {
        if (item instanceof Element) {
            return ((Element) item).getId();
        }
        if (item instanceof String && IdType.isValid((String) item)) {
            return (String) item;
        }
        return null;
    }
}
