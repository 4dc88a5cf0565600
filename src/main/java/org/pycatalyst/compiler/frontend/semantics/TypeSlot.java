package org.pycatalyst.compiler.frontend.semantics;

/**
 * A mutable cell holding the current type tag of a symbol.
 * <p>
 * Signatures are discovered while translating: a parameter may sharpen after later call
 * sites were seen, so symbols share a slot instead of copying a tag. A fixed slot (the
 * constructor return sentinel, collection element types) never changes.
 */
public final class TypeSlot {

    private TypeTag tag;
    private final boolean fixed;

    /**
     * Creates a refinable slot.
     * @param initial The initial tag.
     */
    public TypeSlot(TypeTag initial) {
        this(initial, false);
    }

    private TypeSlot(TypeTag initial, boolean fixed) {
        this.tag = initial;
        this.fixed = fixed;
    }

    /**
     * Creates a slot whose tag can never change.
     * @param tag The tag.
     * @return The fixed slot.
     */
    public static TypeSlot fixed(TypeTag tag) {
        return new TypeSlot(tag, true);
    }

    /**
     * @return The current tag.
     */
    public TypeTag get() {
        return tag;
    }

    /**
     * @return {@code true} if the slot cannot be refined.
     */
    public boolean isFixed() {
        return fixed;
    }

    /**
     * Unifies the given tag into this slot in place. Fixed slots are left untouched.
     * @param other The tag observed at a use site.
     * @return The tag held after unification.
     */
    public TypeTag unify(TypeTag other) {
        if (!fixed) {
            tag = TypeLattice.unify(tag, other);
        }
        return tag;
    }

    @Override
    public String toString() {
        return tag.toString();
    }
}
