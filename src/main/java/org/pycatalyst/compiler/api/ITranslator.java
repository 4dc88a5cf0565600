package org.pycatalyst.compiler.api;

import org.pycatalyst.compiler.ir.IrUnit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the script-to-C++ translator.
 */
public interface ITranslator {

    /**
     * Translates the given script.
     *
     * @param sourceLines The lines of the script.
     * @param programName A name for the program, used for diagnostics and as the unit name.
     * @return The translated unit: classes, functions and required dependencies.
     * @throws TranslationException if the script cannot be parsed.
     */
    IrUnit translate(List<String> sourceLines, String programName) throws TranslationException;

    /**
     * Sets the verbosity of the translation log.
     * @param level 0 logs nothing, 1 logs each pass-through, 2 also logs every phase.
     */
    void setVerbosity(int level);

    /**
     * Translates the script stored in a file.
     * @param programPath The path to the script.
     * @return The translated unit.
     * @throws TranslationException if the script cannot be parsed.
     * @throws IOException if the file cannot be read.
     */
    default IrUnit translate(String programPath) throws TranslationException, IOException {
        return translate(Files.readAllLines(Path.of(programPath), StandardCharsets.UTF_8), programPath);
    }
}
