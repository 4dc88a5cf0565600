package org.pycatalyst.compiler.frontend.semantics;

/**
 * The unification and casting rules shared by every operator, assignment and call site.
 */
public final class TypeLattice {

    /** Rank shared by {@code auto}, {@code void} and {@code None}. */
    public static final int LOWEST_RANK = 9;
    /** Marker rank for tags outside the lattice. */
    public static final int NOT_IN_LATTICE = -1;

    private TypeLattice() {}

    /**
     * Combines two tags into the one that represents both without losing precision.
     * <p>
     * If both tags are in the lattice the one with the lower rank wins; two distinct tags of
     * the same rank, or any tag outside the lattice, yield {@link TypeTag#AUTO}. The result
     * does not depend on the argument order.
     *
     * @param a The first tag.
     * @param b The second tag.
     * @return The unified tag.
     */
    public static TypeTag unify(TypeTag a, TypeTag b) {
        if (!a.inLattice() || !b.inLattice()) {
            return TypeTag.AUTO;
        }
        if (a == b) {
            return a;
        }
        if (a.rank() < b.rank()) {
            return a;
        }
        if (b.rank() < a.rank()) {
            return b;
        }
        return TypeTag.AUTO;
    }

    /**
     * Decides whether a variable of type {@code declared} may be re-assigned a value of type
     * {@code assigned}: only identical tags and int into float are accepted.
     *
     * @param declared The recorded type of the variable.
     * @param assigned The type of the new value.
     * @return {@code true} if the assignment keeps the declared type without precision loss.
     */
    public static boolean acceptsAssignment(TypeTag declared, TypeTag assigned) {
        return declared == assigned || (declared == TypeTag.FLOAT && assigned == TypeTag.INT);
    }

    /**
     * Wraps code in a cast that truncates towards zero.
     * @param code The expression to cast.
     * @return The cast expression.
     */
    public static String truncatingCast(String code) {
        return "(int)" + code;
    }

    /**
     * Wraps code in a cast that widens to double precision.
     * @param code The expression to cast.
     * @return The cast expression.
     */
    public static String wideningCast(String code) {
        return "(double)" + code;
    }
}
