package org.pycatalyst.compiler.frontend.irgen;

/**
 * Signals that a construct cannot be represented faithfully in the target language.
 * <p>
 * Expression failures propagate to the nearest enclosing statement, which is then passed
 * through verbatim with {@link #getReason()} as annotation.
 */
public class NotTranslatableException extends Exception {

	private final String reason;

	/**
	 * @param reason A short, user-facing explanation.
	 */
	public NotTranslatableException(String reason) {
		super(reason, null, false, false);
		this.reason = reason;
	}

	/**
	 * @return Why the construct was refused.
	 */
	public String getReason() {
		return reason;
	}
}
