package org.pycatalyst.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress log of a translation, gated by the translator verbosity on top of the SLF4J level.
 * <ul>
 *   <li>{@link #QUIET}: nothing.</li>
 *   <li>{@link #PASS_THROUGHS}: one INFO line per statement left untranslated.</li>
 *   <li>{@link #PHASES}: additionally DEBUG lines for each translation phase and every
 *       declaration skipped while collecting signatures.</li>
 * </ul>
 * Pass-throughs are also reported as diagnostics; this log is for following a run, not for
 * collecting results.
 */
public final class CompilerLogger {

    public static final int QUIET = 0;
    public static final int PASS_THROUGHS = 1;
    public static final int PHASES = 2;

    private static final Logger logger = LoggerFactory.getLogger(CompilerLogger.class);

    private static volatile int verbosity = PASS_THROUGHS;

    private CompilerLogger() {}

    /**
     * @param level The new verbosity, clamped to {@link #QUIET}..{@link #PHASES}.
     */
    public static void setVerbosity(int level) {
        verbosity = Math.max(QUIET, Math.min(PHASES, level));
    }

    public static int getVerbosity() {
        return verbosity;
    }

    /**
     * Logs a statement that was passed through.
     * @param function The qualified name of the function holding the statement.
     * @param line The first line of the statement.
     * @param reason Why it was not translated.
     */
    public static void passedThrough(String function, int line, String reason) {
        if (verbosity >= PASS_THROUGHS) {
            logger.info("Passed through {} line {}: {}", function, line, reason);
        }
    }

    /**
     * Logs a declaration refused while collecting signatures.
     */
    public static void skippedDeclaration(int line, String reason) {
        if (verbosity >= PHASES) {
            logger.debug("Signatures: skipped line {}: {}", line, reason);
        }
    }

    public static void phase(String message) {
        if (verbosity >= PHASES) {
            logger.debug("Translator: {}", message);
        }
    }
}
