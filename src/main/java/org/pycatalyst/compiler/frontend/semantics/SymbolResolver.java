package org.pycatalyst.compiler.frontend.semantics;

import org.pycatalyst.compiler.ir.IrClass;
import org.pycatalyst.compiler.ir.IrCollection;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrSymbol;
import org.pycatalyst.compiler.ir.IrTuple;
import org.pycatalyst.compiler.ir.IrUnit;
import org.pycatalyst.compiler.ir.IrVariable;
import org.pycatalyst.compiler.ir.IrVector;

import java.util.Optional;

/**
 * Resolves names against the scope chain of one function.
 * <p>
 * Inside a method the chain is: class attributes, class vectors, class tuples and sets,
 * parameters, locals, then the method's own vectors, tuples and sets. A free function (and the
 * entry function) only has the last three levels.
 */
public class SymbolResolver {

    private final IrUnit unit;
    private final IrFunction function;
    private final IrClass owner;

    /**
     * @param unit The translation unit.
     * @param function The function whose body is being translated.
     */
    public SymbolResolver(IrUnit unit, IrFunction function) {
        this.unit = unit;
        this.function = function;
        this.owner = function.ownerClass().flatMap(unit::classNamed).orElse(null);
    }

    public IrFunction function() {
        return function;
    }

    public IrUnit unit() {
        return unit;
    }

    /**
     * @return The class owning the current method.
     */
    public Optional<IrClass> enclosingClass() {
        return Optional.ofNullable(owner);
    }

    /**
     * Resolves a name following the full lookup order.
     * @param name The name.
     * @return The symbol.
     * @throws SymbolNotFoundException if no level defines the name.
     */
    public IrSymbol resolve(String name) throws SymbolNotFoundException {
        if (owner != null) {
            IrVariable attribute = owner.attributes().get(name);
            if (attribute != null) return attribute;
            IrVector classVector = owner.collections().vectors().get(name);
            if (classVector != null) return classVector;
            Optional<IrCollection> classCollection = owner.collections().get(name);
            if (classCollection.isPresent()) return classCollection.get();
        }
        Optional<IrSymbol> local = resolveLocalScope(name);
        if (local.isPresent()) return local.get();
        throw new SymbolNotFoundException(name, function.qualifiedName());
    }

    /**
     * Resolves a name in the function's own tables only: parameters, locals, collections.
     * @param name The name.
     * @return The symbol, if any.
     */
    public Optional<IrSymbol> resolveLocalScope(String name) {
        IrVariable parameter = function.parameters().get(name);
        if (parameter != null) return Optional.of(parameter);
        IrVariable local = function.locals().get(name);
        if (local != null) return Optional.of(local);
        return function.collections().get(name).map(IrSymbol.class::cast);
    }

    /**
     * Resolves a scalar variable assignable by a plain-name assignment: a parameter or local.
     * @param name The name.
     * @return The variable, if any.
     */
    public Optional<IrVariable> resolveAssignable(String name) {
        IrVariable parameter = function.parameters().get(name);
        if (parameter != null) return Optional.of(parameter);
        return Optional.ofNullable(function.locals().get(name));
    }

    /**
     * Resolves a collection by name, preferring the enclosing class.
     * @param name The name.
     * @return The collection, if any.
     */
    public Optional<IrCollection> resolveCollection(String name) {
        if (owner != null) {
            Optional<IrCollection> classCollection = owner.collections().get(name);
            if (classCollection.isPresent()) return classCollection;
        }
        return function.collections().get(name);
    }

    /**
     * Resolves the base of an indexed access in the order vector, tuple, variable, parameter.
     * @param name The base name.
     * @return The symbol.
     * @throws SymbolNotFoundException if nothing matches.
     */
    public IrSymbol resolveIndexBase(String name) throws SymbolNotFoundException {
        Optional<IrCollection> collection = resolveCollection(name);
        if (collection.isPresent() && collection.get() instanceof IrVector) return collection.get();
        if (collection.isPresent() && collection.get() instanceof IrTuple) return collection.get();
        IrVariable local = function.locals().get(name);
        if (local != null) return local;
        if (owner != null && owner.attributes().containsKey(name)) return owner.attributes().get(name);
        IrVariable parameter = function.parameters().get(name);
        if (parameter != null) return parameter;
        if (collection.isPresent()) return collection.get();
        throw new SymbolNotFoundException(name, function.qualifiedName());
    }

    /**
     * Resolves {@code self.<name>} inside a method: an attribute or a class collection.
     * @param name The member name.
     * @return The member.
     * @throws SymbolNotFoundException if the class has no such member or this is not a method.
     */
    public IrSymbol resolveMember(String name) throws SymbolNotFoundException {
        if (owner == null) {
            throw new SymbolNotFoundException(name, function.qualifiedName());
        }
        IrVariable attribute = owner.attributes().get(name);
        if (attribute != null) return attribute;
        return owner.collections().get(name)
                .map(IrSymbol.class::cast)
                .orElseThrow(() -> new SymbolNotFoundException(name, owner.name()));
    }

    /**
     * @param name A name.
     * @return {@code true} if the name is the receiver parameter of the current method.
     */
    public boolean isReceiver(String name) {
        return function.receiverName() != null && function.receiverName().equals(name);
    }
}
