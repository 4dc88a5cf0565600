package org.pycatalyst.compiler.frontend.parser.ast;

/**
 * The collection a comprehension builds.
 */
public enum ComprehensionKind {
    LIST,
    SET,
    DICT,
    GENERATOR
}
