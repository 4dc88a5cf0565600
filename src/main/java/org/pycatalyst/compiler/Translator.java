package org.pycatalyst.compiler;

import org.pycatalyst.compiler.api.ITranslator;
import org.pycatalyst.compiler.api.TranslationException;
import org.pycatalyst.compiler.api.TranslatorOptions;
import org.pycatalyst.compiler.diagnostics.CompilerLogger;
import org.pycatalyst.compiler.diagnostics.Diagnostic;
import org.pycatalyst.compiler.diagnostics.DiagnosticsEngine;
import org.pycatalyst.compiler.frontend.irgen.StatementHandlerRegistry;
import org.pycatalyst.compiler.frontend.irgen.TranslationContext;
import org.pycatalyst.compiler.frontend.irgen.ported.PortedFunctionRegistry;
import org.pycatalyst.compiler.frontend.lexer.Lexer;
import org.pycatalyst.compiler.frontend.lexer.Token;
import org.pycatalyst.compiler.frontend.parser.Parser;
import org.pycatalyst.compiler.frontend.parser.ast.ClassDefNode;
import org.pycatalyst.compiler.frontend.parser.ast.FunctionDefNode;
import org.pycatalyst.compiler.frontend.parser.ast.ModuleNode;
import org.pycatalyst.compiler.frontend.parser.ast.StatementNode;
import org.pycatalyst.compiler.frontend.signatures.ClassSignatureCollector;
import org.pycatalyst.compiler.frontend.signatures.FunctionSignatureCollector;
import org.pycatalyst.compiler.frontend.signatures.ISignatureCollector;
import org.pycatalyst.compiler.frontend.signatures.SignatureContext;
import org.pycatalyst.compiler.frontend.signatures.SkippedDeclaration;
import org.pycatalyst.compiler.ir.IrFunction;
import org.pycatalyst.compiler.ir.IrUnit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * The main translator implementation. This class orchestrates the pipeline from script
 * source to an {@link IrUnit}: lexing, parsing, signature collection (pass 1) and body
 * translation (pass 2). It is not thread-safe.
 */
public class Translator implements ITranslator {

    private DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final TranslatorOptions options;
    private int verbosity = -1;

    public Translator() {
        this(TranslatorOptions.defaults());
    }

    public Translator(TranslatorOptions options) {
        this.options = options;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Only syntax errors abort; every statement that cannot be translated is passed through
     * and reported as a warning.
     */
    @Override
    public IrUnit translate(List<String> sourceLines, String programName) throws TranslationException {
        if (verbosity >= 0) {
            CompilerLogger.setVerbosity(verbosity);
        }
        diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        String fullSource = String.join("\n", sourceLines) + "\n";
        Lexer lexer = new Lexer(fullSource, diagnostics, programName);
        List<Token> tokens = lexer.scanTokens();
        if (diagnostics.hasErrors()) {
            throw new TranslationException(diagnostics.summary());
        }

        // Phase 2: Parsing
        Parser parser = new Parser(tokens, diagnostics);
        ModuleNode module = parser.parse(sourceLines.size());
        if (diagnostics.hasErrors()) {
            throw new TranslationException(diagnostics.summary());
        }
        CompilerLogger.phase("parsed " + module.body().size() + " top-level statements of " + programName);

        // Phase 3: Signatures (pass 1)
        IrUnit unit = new IrUnit(programName, Math.max(1, sourceLines.size()));
        SignatureContext signatures = collectSignatures(module, unit);
        CompilerLogger.phase("registered " + (unit.functions().size() - 1) + " functions and "
                + unit.classes().size() + " classes");

        // Phase 4: Bodies (pass 2)
        StatementHandlerRegistry handlers = StatementHandlerRegistry.initializeWithDefaults();
        PortedFunctionRegistry ported = PortedFunctionRegistry.initializeWithDefaults();
        List<Map.Entry<IrFunction, FunctionDefNode>> bodies = new ArrayList<>(signatures.bodies().entrySet());
        bodies.sort(Comparator.comparingInt(e -> e.getKey().lineno()));
        for (Map.Entry<IrFunction, FunctionDefNode> body : bodies) {
            TranslationContext ctx = newContext(unit, body.getKey(), handlers, ported, programName, sourceLines);
            List<StatementNode> statements = body.getValue().body();
            ctx.translateBody(statements, statements.isEmpty() ? null : statements.get(0));
            body.getKey().markTranslated();
            CompilerLogger.phase("translated body of " + body.getKey().qualifiedName());
        }

        TranslationContext entry = newContext(unit, unit.entryFunction(), handlers, ported, programName, sourceLines);
        List<StatementNode> topLevel = new ArrayList<>();
        for (StatementNode statement : module.body()) {
            if (!(statement instanceof FunctionDefNode) && !(statement instanceof ClassDefNode)) {
                topLevel.add(statement);
            }
        }
        entry.translateBody(topLevel, module.body().isEmpty() ? null : module.body().get(0));
        unit.entryFunction().markTranslated();
        for (SkippedDeclaration skipped : signatures.skipped()) {
            entry.passThrough(skipped.node(), skipped.reason());
        }
        CompilerLogger.phase("translated entry body, " + diagnostics.ofType(Diagnostic.Type.WARNING).size() + " warnings");
        return unit;
    }

    /**
     * Registers classes with their methods first, then the remaining top-level functions, so a
     * function cannot take the name of a class defined after it.
     */
    private SignatureContext collectSignatures(ModuleNode module, IrUnit unit) {
        SignatureContext ctx = new SignatureContext(unit);
        ISignatureCollector classes = new ClassSignatureCollector();
        ISignatureCollector functions = new FunctionSignatureCollector();
        for (StatementNode statement : module.body()) {
            if (statement instanceof ClassDefNode) {
                classes.collect(statement, ctx);
            }
        }
        for (StatementNode statement : module.body()) {
            if (statement instanceof FunctionDefNode) {
                functions.collect(statement, ctx);
            }
        }
        return ctx;
    }

    private TranslationContext newContext(IrUnit unit, IrFunction function, StatementHandlerRegistry handlers,
                                          PortedFunctionRegistry ported, String programName, List<String> sourceLines) {
        return new TranslationContext(unit, function, handlers, ported, options, diagnostics, programName, sourceLines);
    }

    /**
     * @return The diagnostics of the last translation, including one warning per pass-through.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}
