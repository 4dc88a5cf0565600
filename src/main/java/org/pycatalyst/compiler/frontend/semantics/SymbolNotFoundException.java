package org.pycatalyst.compiler.frontend.semantics;

/**
 * Thrown when a name cannot be resolved in the current scope chain.
 * <p>
 * Never crosses the expression translator: callers turn it into a refusal of the enclosing
 * statement.
 */
public class SymbolNotFoundException extends Exception {

    private final String symbolName;

    /**
     * @param symbolName The unresolved name.
     * @param scopeName The qualified name of the scope searched.
     */
    public SymbolNotFoundException(String symbolName, String scopeName) {
        super("Symbol '" + symbolName + "' not found in scope '" + scopeName + "'");
        this.symbolName = symbolName;
    }

    public String getSymbolName() {
        return symbolName;
    }
}
