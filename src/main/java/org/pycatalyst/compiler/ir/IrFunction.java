package org.pycatalyst.compiler.ir;

import org.pycatalyst.compiler.frontend.semantics.TypeSlot;
import org.pycatalyst.compiler.frontend.semantics.TypeTag;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * A function, method or the synthetic entry function together with its emitted code.
 * <p>
 * Fragments are kept in a map ordered by their start line. Ranges never overlap; a fragment
 * added on a line that already holds one is merged into it.
 */
public final class IrFunction {

    private final String name;
    private final String qualifiedName;
    private final String ownerClass;
    private final String receiverName;
    private final int lineno;
    private final int endLineno;
    private final Map<String, IrVariable> parameters = new LinkedHashMap<>();
    private final Map<String, IrVariable> locals = new LinkedHashMap<>();
    private final IrCollectionTable collections = new IrCollectionTable();
    private final TypeSlot returnType;
    private final NavigableMap<Integer, IrFragment> fragments = new TreeMap<>();
    private boolean translated;

    private IrFunction(String name, String ownerClass, String receiverName, int lineno, int endLineno, TypeSlot returnType) {
        this.name = name;
        this.ownerClass = ownerClass;
        this.receiverName = receiverName;
        this.qualifiedName = ownerClass == null ? name : ownerClass + "::" + name;
        this.lineno = lineno;
        this.endLineno = endLineno;
        this.returnType = returnType;
    }

    /**
     * Creates a free function.
     * @param name The function name.
     * @param lineno The line of the {@code def}.
     * @param endLineno The last line of the body.
     * @return The function, returning void until a return is seen.
     */
    public static IrFunction free(String name, int lineno, int endLineno) {
        return new IrFunction(name, null, null, lineno, endLineno, new TypeSlot(TypeTag.VOID));
    }

    /**
     * Creates a method. {@code __init__} gets the fixed constructor return type.
     * @param ownerClass The class name.
     * @param name The method name.
     * @param receiverName The name of the explicit receiver parameter (usually {@code self}).
     * @param lineno The line of the {@code def}.
     * @param endLineno The last line of the body.
     * @return The method.
     */
    public static IrFunction method(String ownerClass, String name, String receiverName, int lineno, int endLineno) {
        TypeSlot ret = IrClass.CONSTRUCTOR_NAME.equals(name)
                ? TypeSlot.fixed(TypeTag.CONSTRUCTOR)
                : new TypeSlot(TypeTag.VOID);
        return new IrFunction(name, ownerClass, receiverName, lineno, endLineno, ret);
    }

    /**
     * Creates the synthetic entry function holding the top-level statements.
     * @param endLineno The last line of the file.
     * @return The entry function.
     */
    public static IrFunction entry(int endLineno) {
        return new IrFunction(IrUnit.ENTRY_FUNCTION_NAME, null, null, 0, endLineno, TypeSlot.fixed(TypeTag.INT));
    }

    public String name() {
        return name;
    }

    /**
     * @return {@code name} for free functions, {@code Class::name} for methods.
     */
    public String qualifiedName() {
        return qualifiedName;
    }

    /**
     * @return The owning class name, empty for free functions.
     */
    public Optional<String> ownerClass() {
        return Optional.ofNullable(ownerClass);
    }

    /**
     * @return The receiver parameter name of a method, or {@code null}.
     */
    public String receiverName() {
        return receiverName;
    }

    public int lineno() {
        return lineno;
    }

    public int endLineno() {
        return endLineno;
    }

    public boolean isMethod() {
        return ownerClass != null;
    }

    public boolean isConstructor() {
        return returnType.get() == TypeTag.CONSTRUCTOR;
    }

    public boolean isEntry() {
        return IrUnit.ENTRY_FUNCTION_NAME.equals(name);
    }

    public TypeSlot returnType() {
        return returnType;
    }

    /**
     * @return The parameters in declaration order, without the receiver.
     */
    public Map<String, IrVariable> parameters() {
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * @return The locals in order of first assignment.
     */
    public Map<String, IrVariable> locals() {
        return Collections.unmodifiableMap(locals);
    }

    public IrCollectionTable collections() {
        return collections;
    }

    /**
     * Adds a parameter.
     * @param parameter The parameter.
     * @throws IllegalStateException if the name is already a parameter.
     */
    public void addParameter(IrVariable parameter) {
        if (parameters.putIfAbsent(parameter.name(), parameter) != null) {
            throw new IllegalStateException("Duplicate parameter '" + parameter.name() + "' in " + qualifiedName);
        }
    }

    /**
     * Declares a local variable.
     * @param variable The variable.
     * @throws IllegalStateException if the name is already a local.
     */
    public void declareLocal(IrVariable variable) {
        if (locals.putIfAbsent(variable.name(), variable) != null) {
            throw new IllegalStateException("Duplicate local '" + variable.name() + "' in " + qualifiedName);
        }
    }

    /**
     * Drops every local not in the given set, when the block that declared them closes.
     * @param names The locals that stay in scope.
     */
    public void retainLocals(Set<String> names) {
        locals.keySet().retainAll(names);
    }

    /**
     * @return {@code true} once the whole body has been translated, so the return type is final.
     */
    public boolean isTranslated() {
        return translated;
    }

    public void markTranslated() {
        translated = true;
    }

    /**
     * Adds a fragment; a fragment already starting on the same line is merged with it.
     * @param fragment The fragment.
     */
    public void addFragment(IrFragment fragment) {
        fragments.merge(fragment.startLine(), fragment, IrFragment::mergeWith);
    }

    /**
     * @return The fragments ordered by start line.
     */
    public Collection<IrFragment> fragments() {
        return Collections.unmodifiableCollection(fragments.values());
    }

    /**
     * @param line A source line.
     * @return The fragment whose range covers the line.
     */
    public Optional<IrFragment> fragmentCovering(int line) {
        Map.Entry<Integer, IrFragment> floor = fragments.floorEntry(line);
        if (floor != null && floor.getValue().covers(line)) {
            return Optional.of(floor.getValue());
        }
        return Optional.empty();
    }

    /**
     * @param line A source line.
     * @return The last fragment starting at or before the line.
     */
    public Optional<IrFragment> lastFragmentUpTo(int line) {
        Map.Entry<Integer, IrFragment> floor = fragments.floorEntry(line);
        return floor == null ? Optional.empty() : Optional.of(floor.getValue());
    }

    /**
     * @param line A source line.
     * @return {@code true} if the line is strictly inside the span of the definition.
     */
    public boolean spans(int line) {
        return lineno < line && line <= endLineno;
    }

    /**
     * @return The number of parameters without a default value.
     */
    public int requiredParameterCount() {
        return (int) parameters.values().stream().filter(p -> !p.hasDefault()).count();
    }

    @Override
    public String toString() {
        return qualifiedName + parameters.values() + " -> " + returnType;
    }
}
