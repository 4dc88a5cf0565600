package org.pycatalyst.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.pycatalyst.cli.CommandLineInterface;
import org.pycatalyst.cli.config.ConfigLoader;
import org.pycatalyst.compiler.Translator;
import org.pycatalyst.compiler.api.TranslationException;
import org.pycatalyst.compiler.api.TranslatorOptions;
import org.pycatalyst.compiler.backend.emit.CommentStitcher;
import org.pycatalyst.compiler.backend.emit.CppRenderer;
import org.pycatalyst.compiler.diagnostics.Diagnostic;
import org.pycatalyst.compiler.ir.IrUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "translate",
    mixinStandardHelpOptions = true,
    description = "Translates a Python script into a C++ source file"
)
public class TranslateCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(TranslateCommand.class);
    private static final String OUTPUT_DIRECTORY_KEY = "pycatalyst.output-directory";

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "<script>", description = "The Python script to translate")
    private File script;

    @Option(names = {"-o", "--output"}, description = "Output directory (default: pycatalyst.output-directory)")
    private File outputDirectory;

    @Option(names = "--stdout", description = "Print the C++ source instead of writing a file")
    private boolean toStdout;

    @Option(names = {"-v", "--verbosity"}, description = "Translation log verbosity: 0 (quiet), 1 (pass-throughs), 2 (phases)")
    private Integer verbosity;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final Config config;
        try {
            config = parent != null ? parent.getConfig() : ConfigLoader.load(null);
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        final TranslatorOptions options = TranslatorOptions.fromConfig(config);

        final List<String> lines;
        try {
            lines = Files.readAllLines(script.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.error("Cannot read {}", script, e);
            err.println("Error: cannot read " + script + ": " + e.getMessage());
            return 1;
        }

        final Translator translator = new Translator(options);
        if (verbosity != null) {
            translator.setVerbosity(verbosity);
        }
        final IrUnit unit;
        try {
            unit = translator.translate(lines, script.getPath());
        } catch (TranslationException e) {
            err.println("Translation failed:");
            err.println(e.getMessage());
            return 1;
        }
        final List<Diagnostic> warnings = translator.getDiagnostics().ofType(Diagnostic.Type.WARNING);
        for (Diagnostic warning : warnings) {
            LOG.warn("{}", warning);
        }

        new CommentStitcher(options).stitch(unit, lines);
        final String cpp = new CppRenderer(options).render(unit);

        if (toStdout) {
            out.print(cpp);
            out.flush();
            return 0;
        }
        final Path directory = outputDirectory != null
                ? outputDirectory.toPath()
                : Path.of(config.hasPath(OUTPUT_DIRECTORY_KEY) ? config.getString(OUTPUT_DIRECTORY_KEY) : "output");
        final Path target = directory.resolve(options.entryFileName() + ".cpp");
        try {
            Files.createDirectories(directory);
            Files.writeString(target, cpp, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.error("Cannot write {}", target, e);
            err.println("Error: cannot write " + target + ": " + e.getMessage());
            return 1;
        }
        out.println("Translated " + script + " to " + target + " (" + warnings.size() + " statements passed through)");
        return 0;
    }
}
