package org.pycatalyst.compiler.frontend.irgen;

import java.util.List;

/**
 * Renders refused source text as inert comment lines.
 */
public final class PassThrough {

	private PassThrough() {}

	/**
	 * Renders a line range of the source as comments, the first line carrying the reason.
	 * Rendering is deterministic, so refusing the same statement twice yields the same text.
	 *
	 * @param sourceLines The raw source lines.
	 * @param startLine The first line, 1-based.
	 * @param endLine The last line, 1-based and inclusive.
	 * @param reason Why the code was not translated.
	 * @param indent The indentation of the enclosing block.
	 * @return The inert text.
	 */
	public static String render(List<String> sourceLines, int startLine, int endLine, String reason, String indent) {
		StringBuilder sb = new StringBuilder();
		sb.append(indent).append("// Not translated: ").append(reason);
		for (int line = startLine; line <= endLine && line <= sourceLines.size(); line++) {
			sb.append('\n').append(indent).append("// ").append(stripTrailing(sourceLines.get(line - 1)));
		}
		return sb.toString();
	}

	private static String stripTrailing(String line) {
		return line.replaceAll("\\s+$", "");
	}
}
