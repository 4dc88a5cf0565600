package org.pycatalyst.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A class with its attributes, collections and methods.
 */
public final class IrClass {

    /** The name of the constructor method in the source language. */
    public static final String CONSTRUCTOR_NAME = "__init__";

    private final String name;
    private final int lineno;
    private final int endLineno;
    private final List<String> bases;
    private final Map<String, IrVariable> attributes = new LinkedHashMap<>();
    private final Map<String, IrFunction> methods = new LinkedHashMap<>();
    private final IrCollectionTable collections = new IrCollectionTable();

    /**
     * @param name The class name.
     * @param lineno The line of the {@code class} keyword.
     * @param endLineno The last line of the body.
     * @param bases The plain base class names.
     */
    public IrClass(String name, int lineno, int endLineno, List<String> bases) {
        this.name = name;
        this.lineno = lineno;
        this.endLineno = endLineno;
        this.bases = List.copyOf(bases);
    }

    public String name() {
        return name;
    }

    public int lineno() {
        return lineno;
    }

    public int endLineno() {
        return endLineno;
    }

    public List<String> bases() {
        return bases;
    }

    public Map<String, IrVariable> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * @return The methods by plain name, in declaration order.
     */
    public Map<String, IrFunction> methods() {
        return Collections.unmodifiableMap(methods);
    }

    public IrCollectionTable collections() {
        return collections;
    }

    /**
     * Defines an attribute.
     * @param attribute The attribute.
     * @throws IllegalStateException if the attribute exists.
     */
    public void addAttribute(IrVariable attribute) {
        if (attributes.putIfAbsent(attribute.name(), attribute) != null) {
            throw new IllegalStateException("Duplicate attribute '" + attribute.name() + "' in " + name);
        }
    }

    /**
     * Adds a method.
     * @param method The method, owned by this class.
     * @return {@code false} if a method with the same name exists; the existing one is kept.
     */
    public boolean addMethod(IrFunction method) {
        return methods.putIfAbsent(method.name(), method) == null;
    }

    @Override
    public String toString() {
        return "class " + name + bases;
    }
}
