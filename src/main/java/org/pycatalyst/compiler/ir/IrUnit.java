package org.pycatalyst.compiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The translation result for one source file.
 * <p>
 * Functions are keyed by qualified name; methods appear both here ({@code Class::method})
 * and in their {@link IrClass}.
 */
public final class IrUnit {

    /** The reserved name of the synthetic entry function; not a valid identifier in the source. */
    public static final String ENTRY_FUNCTION_NAME = "<module>";

    private final String name;
    private final Map<String, IrFunction> functions = new LinkedHashMap<>();
    private final Map<String, IrClass> classes = new LinkedHashMap<>();
    private final Set<IrDependency> dependencies = new LinkedHashSet<>();

    /**
     * Creates a unit with an empty entry function.
     * @param name The program name.
     * @param lastLine The last line of the source.
     */
    public IrUnit(String name, int lastLine) {
        this.name = name;
        functions.put(ENTRY_FUNCTION_NAME, IrFunction.entry(lastLine));
    }

    public String name() {
        return name;
    }

    public IrFunction entryFunction() {
        return functions.get(ENTRY_FUNCTION_NAME);
    }

    /**
     * @return All functions by qualified name, the entry function first.
     */
    public Map<String, IrFunction> functions() {
        return Collections.unmodifiableMap(functions);
    }

    /**
     * @return Functions that are neither methods nor the entry function.
     */
    public List<IrFunction> freeFunctions() {
        return functions.values().stream()
                .filter(f -> !f.isMethod() && !f.isEntry())
                .collect(Collectors.toList());
    }

    public Map<String, IrClass> classes() {
        return Collections.unmodifiableMap(classes);
    }

    /**
     * @param qualifiedName A function name or {@code Class::method}.
     * @return The function, if registered.
     */
    public Optional<IrFunction> function(String qualifiedName) {
        return Optional.ofNullable(functions.get(qualifiedName));
    }

    public Optional<IrClass> classNamed(String className) {
        return Optional.ofNullable(classes.get(className));
    }

    /**
     * Registers a function under its qualified name.
     * @param function The function.
     * @return {@code false} if the name is taken by a function or class; the existing entry is kept.
     */
    public boolean registerFunction(IrFunction function) {
        if (!function.isMethod() && classes.containsKey(function.name())) {
            return false;
        }
        return functions.putIfAbsent(function.qualifiedName(), function) == null;
    }

    /**
     * Registers a class.
     * @param irClass The class.
     * @return {@code false} if the name is taken by a class or a function.
     */
    public boolean registerClass(IrClass irClass) {
        if (functions.containsKey(irClass.name())) {
            return false;
        }
        return classes.putIfAbsent(irClass.name(), irClass) == null;
    }

    /**
     * Records that the generated code needs a header.
     * @param dependency The dependency.
     */
    public void require(IrDependency dependency) {
        dependencies.add(dependency);
    }

    /**
     * @return The dependencies in first-required order.
     */
    public Set<IrDependency> dependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    /**
     * @return The function owning the line (method spans before free functions), or the entry function.
     */
    public IrFunction functionSpanning(int line) {
        for (IrFunction f : functions.values()) {
            if (f.isMethod() && f.spans(line)) return f;
        }
        for (IrFunction f : functions.values()) {
            if (!f.isMethod() && !f.isEntry() && f.spans(line)) return f;
        }
        return entryFunction();
    }
}
