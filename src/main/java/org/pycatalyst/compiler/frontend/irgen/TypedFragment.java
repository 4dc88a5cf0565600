package org.pycatalyst.compiler.frontend.irgen;

import org.pycatalyst.compiler.frontend.semantics.TypeTag;

import java.util.List;

/**
 * The result of translating an expression: the generated code and its static type.
 *
 * @param code The target-language expression.
 * @param type The inferred type tag.
 * @param elementTypes For collection-typed expressions the element types (one per slot for
 *                     tuples, a single entry for lists and sets); empty otherwise.
 */
public record TypedFragment(String code, TypeTag type, List<TypeTag> elementTypes) {

	public TypedFragment {
		elementTypes = List.copyOf(elementTypes);
	}

	/**
	 * Creates a fragment for a scalar expression.
	 * @param code The code.
	 * @param type The type.
	 * @return The fragment.
	 */
	public static TypedFragment of(String code, TypeTag type) {
		return new TypedFragment(code, type, List.of());
	}

	public boolean isCollection() {
		return type.isCollection();
	}
}
