package org.pycatalyst.compiler.diagnostics;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.pycatalyst.compiler.Translator;
import org.pycatalyst.compiler.api.TranslationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link CompilerLogger}, capturing its output with a Logback list
 * appender.
 */
public class CompilerLoggerTest {

    private Logger logger;
    private Level previousLevel;
    private ListAppender<ILoggingEvent> events;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(CompilerLogger.class);
        previousLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        events = new ListAppender<>();
        events.start();
        logger.addAppender(events);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(events);
        logger.setLevel(previousLevel);
        CompilerLogger.setVerbosity(CompilerLogger.PASS_THROUGHS);
    }

    @Test
    @Tag("unit")
    void testVerbosityGatesEachKindOfMessage() {
        CompilerLogger.setVerbosity(CompilerLogger.QUIET);
        CompilerLogger.passedThrough("main", 3, "lambda expressions not supported");
        CompilerLogger.phase("parsed 1 top-level statements of a.py");
        assertThat(events.list).isEmpty();

        CompilerLogger.setVerbosity(CompilerLogger.PASS_THROUGHS);
        CompilerLogger.passedThrough("main", 3, "lambda expressions not supported");
        CompilerLogger.skippedDeclaration(7, "decorated functions not supported");
        CompilerLogger.phase("parsed 1 top-level statements of a.py");

        CompilerLogger.setVerbosity(CompilerLogger.PHASES);
        CompilerLogger.skippedDeclaration(7, "decorated functions not supported");
        CompilerLogger.phase("parsed 1 top-level statements of a.py");

        assertThat(events.list).extracting(ILoggingEvent::getLevel, ILoggingEvent::getFormattedMessage).containsExactly(
                tuple(Level.INFO, "Passed through main line 3: lambda expressions not supported"),
                tuple(Level.DEBUG, "Signatures: skipped line 7: decorated functions not supported"),
                tuple(Level.DEBUG, "Translator: parsed 1 top-level statements of a.py"));
    }

    @Test
    @Tag("unit")
    void testVerbosityIsClamped() {
        CompilerLogger.setVerbosity(9);
        assertThat(CompilerLogger.getVerbosity()).isEqualTo(CompilerLogger.PHASES);

        CompilerLogger.setVerbosity(-4);
        assertThat(CompilerLogger.getVerbosity()).isEqualTo(CompilerLogger.QUIET);
    }

    /**
     * The translator applies its verbosity to the log and reports every pass-through.
     */
    @Test
    @Tag("integration")
    void testTranslatorLogsPassThroughs() throws TranslationException {
        Translator translator = new Translator();
        translator.setVerbosity(CompilerLogger.PASS_THROUGHS);

        translator.translate(List.of("x = 1", "f = lambda: 1"), "test.py");

        assertThat(events.list).extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("Passed through <module> line 2: lambda expressions not supported");
    }
}
