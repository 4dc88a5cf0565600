package org.pycatalyst.compiler.frontend.semantics;

/**
 * The static type tags the translator can infer for a value.
 * <p>
 * The first seven tags form the precedence lattice used by {@link TypeLattice#unify(TypeTag, TypeTag)}:
 * a lower rank means a higher precedence, and {@code AUTO}, {@code VOID} and {@code NONE} share the
 * lowest rank. The remaining tags are outside the lattice; unifying with them always yields {@code AUTO}.
 */
public enum TypeTag {
    /** A string. */
    STR("str", 0, "std::string"),
    /** A double precision floating point number. */
    FLOAT("float", 1, "double"),
    /** An integer. */
    INT("int", 2, "int"),
    /** A boolean. */
    BOOL("bool", 3, "bool"),
    /** Unknown; rendered as a deduced type. */
    AUTO("auto", TypeLattice.LOWEST_RANK, "auto"),
    /** No value, the initial return type of every function. */
    VOID("void", TypeLattice.LOWEST_RANK, "void"),
    /** The source language's null value. */
    NONE("None", TypeLattice.LOWEST_RANK, "void"),
    /** Return sentinel of constructors; no return type is emitted. */
    CONSTRUCTOR("constructor", TypeLattice.NOT_IN_LATTICE, ""),
    /** A homogeneous list, see {@link org.pycatalyst.compiler.ir.IrVector}. */
    LIST("list", TypeLattice.NOT_IN_LATTICE, "std::vector"),
    /** A fixed-arity tuple, see {@link org.pycatalyst.compiler.ir.IrTuple}. */
    TUPLE("tuple", TypeLattice.NOT_IN_LATTICE, "std::tuple"),
    /** A homogeneous set, see {@link org.pycatalyst.compiler.ir.IrSet}. */
    SET("set", TypeLattice.NOT_IN_LATTICE, "std::unordered_set");

    private final String pythonName;
    private final int rank;
    private final String cppName;

    TypeTag(String pythonName, int rank, String cppName) {
        this.pythonName = pythonName;
        this.rank = rank;
        this.cppName = cppName;
    }

    /**
     * @return The name of the type in the source language.
     */
    public String pythonName() {
        return pythonName;
    }

    /**
     * @return The precedence rank, lower is stronger. Only meaningful if {@link #inLattice()}.
     */
    public int rank() {
        return rank;
    }

    /**
     * @return The C++ spelling of the type (without template arguments for collections).
     */
    public String cppName() {
        return cppName;
    }

    /**
     * @return {@code true} if the tag takes part in the precedence lattice.
     */
    public boolean inLattice() {
        return rank != TypeLattice.NOT_IN_LATTICE;
    }

    /**
     * @return {@code true} for the three collection kinds.
     */
    public boolean isCollection() {
        return this == LIST || this == TUPLE || this == SET;
    }

    /**
     * @return {@code true} for int, float and bool.
     */
    public boolean isNumeric() {
        return this == INT || this == FLOAT || this == BOOL;
    }

    /**
     * Maps the runtime type name of a literal to its tag.
     *
     * @param runtimeTypeName e.g. {@code "int"} or {@code "str"}.
     * @return The tag, or {@code AUTO} for names without a static counterpart.
     */
    public static TypeTag fromPythonName(String runtimeTypeName) {
        for (TypeTag tag : values()) {
            if (tag.inLattice() && tag.pythonName.equals(runtimeTypeName)) {
                return tag;
            }
        }
        return AUTO;
    }

    @Override
    public String toString() {
        return pythonName;
    }
}
