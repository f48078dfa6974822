package de.upb.sse.jrefactor.ast;

import java.util.*;

/**
 * Flyweight table for {@link Type.Class}.
 *
 * Keyed by fully qualified name. A name maps to every structurally distinct variant seen so far,
 * e.g. the same class resolved once with and once without its members. Canonical instances are
 * never mutated. All reads and writes go through this pool's monitor so that two threads interning
 * equal content cannot both add a variant.
 *
 * The pool lives as long as a parsing session; {@link #clear()} is the session reset.
 */
public class TypePool {
    /** Pool behind {@link Type.Class#build(String, List, Type.Class)}. */
    public static final TypePool DEFAULT = new TypePool();

    // there shouldn't be too many distinct types represented by the same fully qualified name
    private final Map<String, List<Type.Class>> flyweights = new HashMap<>();

    public synchronized Type.Class build(String fullyQualifiedName, List<Type.Var> members, Type.Class supertype) {
        Type.Class test = new Type.Class(fullyQualifiedName, members, supertype);

        List<Type.Class> variants = flyweights.computeIfAbsent(fullyQualifiedName, k -> new ArrayList<>(2));
        for (Type.Class variant : variants) {
            if (variant.deepEquals(test)) {
                return variant;
            }
        }

        variants.add(test);
        return test;
    }

    /**
     * Snapshot of the canonical variants of a name, in the order they were first interned.
     */
    public synchronized List<Type.Class> variants(String fullyQualifiedName) {
        List<Type.Class> variants = flyweights.get(fullyQualifiedName);
        return variants == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(variants));
    }

    public synchronized int size() {
        return flyweights.values().stream().mapToInt(List::size).sum();
    }

    public synchronized void clear() {
        flyweights.clear();
    }
}
