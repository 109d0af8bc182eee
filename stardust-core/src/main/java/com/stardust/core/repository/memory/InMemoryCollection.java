package com.stardust.core.repository.memory;

import com.stardust.core.repository.RecordNotFoundException;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Keyed document collection backing the in-memory repositories.
 *
 * Values are copied on the way in and on the way out, so callers never hold a reference to
 * stored state. Single-document updates and conditional deletes run inside
 * {@link ConcurrentHashMap#compute}, which gives the same per-document atomicity a document
 * store offers.
 */
class InMemoryCollection<T> {

    private final String entityType;
    private final Function<T, UUID> idOf;
    private final UnaryOperator<T> copier;
    private final Map<UUID, T> documents = new ConcurrentHashMap<>();

    InMemoryCollection(String entityType, Function<T, UUID> idOf, UnaryOperator<T> copier) {
        this.entityType = entityType;
        this.idOf = idOf;
        this.copier = copier;
    }

    T put(T document) {
        documents.put(idOf.apply(document), copier.apply(document));
        return copier.apply(document);
    }

    Optional<T> get(UUID id) {
        return Optional.ofNullable(documents.get(id)).map(copier);
    }

    List<T> find(Predicate<T> filter) {
        return documents.values().stream()
                .filter(filter)
                .map(copier)
                .toList();
    }

    List<T> find(Predicate<T> filter, Comparator<T> order) {
        return documents.values().stream()
                .filter(filter)
                .sorted(order)
                .map(copier)
                .toList();
    }

    Optional<T> updateIf(UUID id, Predicate<T> filter, Consumer<T> patch) {
        var result = new AtomicReference<T>();
        documents.computeIfPresent(id, (key, current) -> {
            if (!filter.test(current)) {
                return current;
            }
            T working = copier.apply(current);
            patch.accept(working);
            result.set(copier.apply(working));
            return working;
        });
        return Optional.ofNullable(result.get());
    }

    T update(UUID id, Consumer<T> patch) {
        return updateIf(id, doc -> true, patch)
                .orElseThrow(() -> new RecordNotFoundException(entityType, id));
    }

    boolean removeIf(UUID id, Predicate<T> filter) {
        var removed = new AtomicBoolean(false);
        documents.computeIfPresent(id, (key, current) -> {
            if (filter.test(current)) {
                removed.set(true);
                return null;
            }
            return current;
        });
        return removed.get();
    }

    long size() {
        return documents.size();
    }

    void clear() {
        documents.clear();
    }
}
