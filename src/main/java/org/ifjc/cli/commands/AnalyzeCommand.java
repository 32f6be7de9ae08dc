package org.ifjc.cli.commands;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.ifjc.cli.CommandLineInterface;
import org.ifjc.compiler.builtins.IfjBuiltins;
import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.ProgramNode;
import org.ifjc.compiler.frontend.parser.json.AstFormatException;
import org.ifjc.compiler.frontend.parser.json.AstJsonReader;
import org.ifjc.compiler.frontend.semantics.AnalysisResult;
import org.ifjc.compiler.frontend.semantics.AnalysisResult.SymbolRow;
import org.ifjc.compiler.frontend.semantics.SemanticAnalyzer;
import org.ifjc.compiler.frontend.semantics.SemanticOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command running semantic analysis on a parsed program.
 * <p>
 * Reads the JSON form of an AST, runs both analysis passes and reports the outcome.
 * The exit status is 0 on success, the error code of the first semantic error otherwise,
 * and 1 for unreadable input or configuration.
 */
@Command(
    name = "analyze",
    description = "Run semantic analysis on a parsed program (JSON AST)"
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Path to the JSON AST to analyze"
    )
    private File file;

    @Option(
        names = {"--dump-symbols"},
        description = "Print every declared symbol grouped by scope"
    )
    private boolean dumpSymbols;

    @Option(
        names = {"--json"},
        description = "Print the result as a JSON document"
    )
    private boolean json;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        SemanticOptions options;
        try {
            options = SemanticOptions.fromConfig(parent.getConfig());
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            return 1;
        }

        ProgramNode program;
        try {
            program = new AstJsonReader().read(file.toPath());
        } catch (IOException e) {
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return 1;
        } catch (AstFormatException e) {
            err.println("Error: malformed AST in " + file + ": " + e.getMessage());
            return 1;
        }

        SemanticAnalyzer analyzer = new SemanticAnalyzer(options, new IfjBuiltins());
        AnalysisResult result;
        try {
            result = analyzer.analyze(program);
        } catch (SemanticException e) {
            log.warn("Analysis of {} failed: {}", file, e.toString());
            err.println("Error: " + e.kind() + ": " + e.getMessage());
            if (json) {
                out.println(gson().toJson(errorDocument(e)));
            }
            return e.exitCode();
        }

        if (json) {
            out.println(gson().toJson(resultDocument(result)));
        } else {
            out.println("OK: " + file.getName() + " (" + program.classes().size() + " class(es), "
                    + result.globalIdentifiers().size() + " global identifier(s))");
            if (dumpSymbols) {
                printSymbols(out, result.symbolListing());
            }
        }
        out.flush();
        return 0;
    }

    private static Gson gson() {
        return new GsonBuilder().setPrettyPrinting().serializeNulls().create();
    }

    private Map<String, Object> resultDocument(AnalysisResult result) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("status", "ok");
        document.put("globals", result.globalIdentifiers());
        document.put("globalTypes", result.globalTypes());
        if (dumpSymbols) {
            document.put("symbols", result.symbolListing());
        } else {
            document.put("symbols", result.symbolListing().stream()
                    .filter(row -> !row.scope().equals("global"))
                    .toList());
        }
        return document;
    }

    private static Map<String, Object> errorDocument(SemanticException e) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("status", "error");
        document.put("kind", e.kind().name());
        document.put("code", e.exitCode());
        document.put("message", e.getMessage());
        return document;
    }

    private static void printSymbols(PrintWriter out, List<SymbolRow> rows) {
        String scope = null;
        for (SymbolRow row : rows) {
            if (!row.scope().equals(scope)) {
                scope = row.scope();
                out.println("[" + scope + "]");
            }
            out.printf("  %-20s %-10s %3d  %-8s %s%n", row.name(), row.kind(), row.arity(), row.type(),
                    row.codegenName() == null ? "" : row.codegenName());
        }
    }
}
