package org.pycatalyst.compiler.api;

import com.typesafe.config.Config;

/**
 * Settings shared by the translator and the renderer.
 *
 * @param indentUnit The text used for one level of indentation in the generated code.
 * @param entryFileName The base name of the generated file holding the entry function.
 */
public record TranslatorOptions(String indentUnit, String entryFileName) {

    private static final String INDENT_KEY = "indent";
    private static final String ENTRY_FILE_NAME_KEY = "entry-file-name";

    /**
     * @return The built-in defaults: four spaces per level and {@code main} as file name.
     */
    public static TranslatorOptions defaults() {
        return new TranslatorOptions("    ", "main");
    }

    /**
     * Reads the options from the {@code pycatalyst} block of a configuration, falling back to
     * {@link #defaults()} for missing keys.
     *
     * @param config The (resolved) application configuration.
     * @return The options.
     */
    public static TranslatorOptions fromConfig(Config config) {
        TranslatorOptions defaults = defaults();
        if (!config.hasPath("pycatalyst")) {
            return defaults;
        }
        Config c = config.getConfig("pycatalyst");
        String indent = c.hasPath(INDENT_KEY) ? c.getString(INDENT_KEY) : defaults.indentUnit();
        String entry = c.hasPath(ENTRY_FILE_NAME_KEY) ? c.getString(ENTRY_FILE_NAME_KEY) : defaults.entryFileName();
        return new TranslatorOptions(indent, entry);
    }
}
