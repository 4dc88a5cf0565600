package org.pycatalyst.compiler.backend.emit;

import org.pycatalyst.compiler.api.TranslatorOptions;
import org.pycatalyst.compiler.ir.IrFragment;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrUnit;

import java.util.List;
import java.util.Optional;

/**
 * Reattaches source comments to a translated unit.
 * <p>
 * A comment-only line that no fragment covers becomes a {@code //} line in the function whose
 * span contains it, or in the entry function one level deeper than in the source. A comment
 * trailing the last line of a translated fragment becomes that fragment's comment.
 * Pass-through fragments already carry their source text and are left alone.
 */
public class CommentStitcher {

    private final String indentUnit;

    public CommentStitcher(TranslatorOptions options) {
        this.indentUnit = options.indentUnit();
    }

    /**
     * @param unit The translated unit; fragments are added and updated in place.
     * @param sourceLines The raw source lines the unit was translated from.
     */
    public void stitch(IrUnit unit, List<String> sourceLines) {
        for (int line = 1; line <= sourceLines.size(); line++) {
            String text = sourceLines.get(line - 1);
            Optional<IrFragment> covering = coveringFragment(unit, line);
            if (covering.isPresent()) {
                attachTrailing(covering.get(), line, text);
                continue;
            }
            String stripped = text.strip();
            if (!stripped.startsWith("#")) {
                continue;
            }
            IrFunction owner = unit.functionSpanning(line);
            String indent = leadingWhitespace(text) + (owner.isEntry() ? indentUnit : "");
            owner.addFragment(new IrFragment(line, line, Integer.MAX_VALUE, indent + "//" + stripped.substring(1)));
        }
    }

    private static Optional<IrFragment> coveringFragment(IrUnit unit, int line) {
        for (IrFunction function : unit.functions().values()) {
            Optional<IrFragment> fragment = function.fragmentCovering(line);
            if (fragment.isPresent()) {
                return fragment;
            }
        }
        return Optional.empty();
    }

    private static void attachTrailing(IrFragment fragment, int line, String text) {
        if (fragment.isPassThrough() || fragment.endLine() != line || fragment.comment() != null
                || fragment.endColumn() >= text.length()) {
            return;
        }
        String rest = text.substring(fragment.endColumn()).strip();
        if (rest.startsWith(":")) {
            rest = rest.substring(1).strip();
        }
        if (rest.startsWith("#")) {
            fragment.setComment(rest.substring(1).strip());
        }
    }

    private static String leadingWhitespace(String text) {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return text.substring(0, i);
    }
}
