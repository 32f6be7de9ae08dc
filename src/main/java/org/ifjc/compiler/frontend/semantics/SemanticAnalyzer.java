package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.builtins.BuiltinProvider;
import org.ifjc.compiler.builtins.IfjBuiltins;
import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.ProgramNode;
import org.ifjc.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.ifjc.compiler.frontend.semantics.analysis.ISymbolCollector;
import org.ifjc.compiler.frontend.semantics.analysis.SignatureCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Performs semantic analysis on a parsed program: scoping, declarations, call arity and
 * expression types. It traverses the AST and dispatches nodes to the handlers of an
 * {@link AnalysisHandlerRegistry}.
 *
 * <p>Analysis runs in two passes. Pass 1 seeds the builtins, collects every callable header,
 * checks {@code main()}, then walks all bodies declaring locals and running the checks that need
 * no types. Pass 2 re-enters the frames pass 1 recorded, resolves every name and infers types.
 * The first error aborts the run.
 *
 * <p>The global-identifier registry outlives a run so callers can read it afterwards; it is
 * reset at the start of each run.
 */
public class SemanticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final SemanticOptions options;
    private final BuiltinProvider builtins;
    private final GlobalRegistry globals;

    /**
     * Constructs an analyzer with the default options and the standard builtin table.
     */
    public SemanticAnalyzer() {
        this(SemanticOptions.defaults(), new IfjBuiltins());
    }

    public SemanticAnalyzer(SemanticOptions options, BuiltinProvider builtins) {
        this(options, builtins, new GlobalRegistry(options.globalPrefix()));
    }

    /**
     * @param options  Limits and language extensions.
     * @param builtins Source of builtin signatures.
     * @param globals  Registry receiving the global-naming-convention identifiers.
     */
    public SemanticAnalyzer(SemanticOptions options, BuiltinProvider builtins, GlobalRegistry globals) {
        this.options = options;
        this.builtins = builtins;
        this.globals = globals;
    }

    /**
     * Analyzes {@code program}.
     *
     * @param program The parsed program.
     * @return The annotations of a successful run.
     * @throws SemanticException on the first semantic error.
     */
    public AnalysisResult analyze(ProgramNode program) {
        log.info("Analyzing {} class(es)", program.classes().size());
        globals.reset();
        SemanticContext context = new SemanticContext(options, builtins, globals);
        AnalysisHandlerRegistry registry = AnalysisHandlerRegistry.initializeWithDefaults(context.registry(), builtins);

        builtins.install(context.registry(), options.builtins());
        new SignatureCollector(context.registry()).collect(program);
        collectSymbols(program, context, registry);
        analyzeStatements(program, context, registry);

        AnalysisResult result = new AnalysisResult(context);
        log.info("Analysis finished: {} scope(s), {} registry entries, {} global identifier(s)",
                context.scopeMap().size(), context.registry().size(), result.globalIdentifiers().size());
        return result;
    }

    /**
     * Pass 1: declares locals and parameters and runs the literal-only checks.
     */
    private void collectSymbols(ProgramNode program, SemanticContext context, AnalysisHandlerRegistry registry) {
        context.beginDeclarationPass();
        try {
            collect(program.getChildren(), context, registry);
        } finally {
            context.endPass();
        }
    }

    /**
     * Pass 2: resolves every name and infers expression types.
     */
    private void analyzeStatements(ProgramNode program, SemanticContext context, AnalysisHandlerRegistry registry) {
        context.beginResolutionPass();
        try {
            traverseAndAnalyze(program.getChildren(), context, registry);
        } finally {
            context.endPass();
        }
    }

    private void collect(List<AstNode> nodes, SemanticContext context, AnalysisHandlerRegistry registry) {
        for (AstNode node : nodes) {
            if (node == null) continue;
            Optional<ISymbolCollector> collector = registry.resolveCollector(node.getClass());
            collector.ifPresent(c -> c.collect(node, context));
            collect(node.getChildren(), context, registry);
            collector.ifPresent(c -> c.collectAfterChildren(node, context));
        }
    }

    private void traverseAndAnalyze(List<AstNode> nodes, SemanticContext context, AnalysisHandlerRegistry registry) {
        for (AstNode node : nodes) {
            if (node == null) continue;
            Optional<IAnalysisHandler> handler = registry.resolveHandler(node.getClass());
            handler.ifPresent(h -> h.analyze(node, context));
            traverseAndAnalyze(node.getChildren(), context, registry);
            handler.ifPresent(h -> h.afterChildren(node, context));
        }
    }

    /**
     * @return The registry that receives global-naming-convention identifiers.
     */
    public GlobalRegistry globals() {
        return globals;
    }

    public SemanticOptions options() {
        return options;
    }
}
