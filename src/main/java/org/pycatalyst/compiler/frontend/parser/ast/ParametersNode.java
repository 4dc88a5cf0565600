package org.pycatalyst.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The parameter list of a function or lambda.
 *
 * @param positionalOnly Parameters before a {@code /} marker.
 * @param args Regular positional-or-keyword parameters.
 * @param vararg The {@code *args} parameter, or {@code null}.
 * @param keywordOnly Parameters after {@code *} or {@code *args}.
 * @param kwarg The {@code **kwargs} parameter, or {@code null}.
 */
public record ParametersNode(List<ParameterNode> positionalOnly, List<ParameterNode> args, ParameterNode vararg,
                             List<ParameterNode> keywordOnly, ParameterNode kwarg) {

    /**
     * @return {@code true} if only regular parameters are declared.
     */
    public boolean isPlain() {
        return positionalOnly.isEmpty() && vararg == null && keywordOnly.isEmpty() && kwarg == null;
    }
}
