package org.pycatalyst.compiler.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The vector, tuple and set tables owned by a function or class.
 */
public final class IrCollectionTable {

    private final Map<String, IrVector> vectors = new LinkedHashMap<>();
    private final Map<String, IrTuple> tuples = new LinkedHashMap<>();
    private final Map<String, IrSet> sets = new LinkedHashMap<>();

    public Map<String, IrVector> vectors() {
        return Collections.unmodifiableMap(vectors);
    }

    public Map<String, IrTuple> tuples() {
        return Collections.unmodifiableMap(tuples);
    }

    public Map<String, IrSet> sets() {
        return Collections.unmodifiableMap(sets);
    }

    /**
     * Registers a collection, replacing a same-named entry of the same kind.
     * @param collection The collection.
     * @throws IllegalStateException if the name is taken by another kind.
     */
    public void put(IrCollection collection) {
        Optional<IrCollection> existing = get(collection.name());
        if (existing.isPresent() && existing.get().kind() != collection.kind()) {
            throw new IllegalStateException("'" + collection.name() + "' is already a " + existing.get().kind());
        }
        if (collection instanceof IrVector vector) {
            vectors.put(vector.name(), vector);
        } else if (collection instanceof IrTuple tuple) {
            tuples.put(tuple.name(), tuple);
        } else if (collection instanceof IrSet set) {
            sets.put(set.name(), set);
        } else {
            throw new IllegalArgumentException("Unknown collection " + collection);
        }
    }

    /**
     * @param name A name.
     * @return The collection of any kind with that name.
     */
    public Optional<IrCollection> get(String name) {
        if (vectors.containsKey(name)) return Optional.of(vectors.get(name));
        if (tuples.containsKey(name)) return Optional.of(tuples.get(name));
        return Optional.ofNullable(sets.get(name));
    }

    /**
     * @return The names of all collections.
     */
    public Set<String> names() {
        Set<String> names = new HashSet<>(vectors.keySet());
        names.addAll(tuples.keySet());
        names.addAll(sets.keySet());
        return names;
    }

    /**
     * Drops every collection whose name is not in the given set.
     * @param names The collections that stay in scope.
     */
    public void retain(Set<String> names) {
        vectors.keySet().retainAll(names);
        tuples.keySet().retainAll(names);
        sets.keySet().retainAll(names);
    }

    /**
     * @return All collections, vectors first, then tuples, then sets.
     */
    public List<IrCollection> all() {
        List<IrCollection> all = new ArrayList<>(vectors.values());
        all.addAll(tuples.values());
        all.addAll(sets.values());
        return all;
    }
}
