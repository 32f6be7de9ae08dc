package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.AssignmentNode;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.semantics.DataType;
import org.ifjc.compiler.frontend.semantics.GlobalRegistry;
import org.ifjc.compiler.frontend.semantics.SemanticContext;
import org.ifjc.compiler.frontend.semantics.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Types the assigned value, resolves the target and lets the target learn the value's type.
 */
public class AssignmentAnalysisHandler implements IAnalysisHandler {

    private static final Logger log = LoggerFactory.getLogger(AssignmentAnalysisHandler.class);

    private final ExpressionTyper typer;

    public AssignmentAnalysisHandler(ExpressionTyper typer) {
        this.typer = typer;
    }

    @Override
    public void analyze(AstNode node, SemanticContext context) {
        AssignmentNode assignment = (AssignmentNode) node;
        String name = assignment.name();
        DataType valueType = typer.type(assignment.value(), context);

        Optional<Symbol> local = context.scopes().lookupDefined(name);
        if (local.isPresent()) {
            Symbol symbol = local.get();
            symbol.learn(valueType);
            context.annotateSymbol(assignment, symbol);
            context.annotateCodegenName(assignment, symbol.codegenName());
            log.debug("assign {} : {} -> {}", name, valueType, symbol.type());
            return;
        }
        Optional<Symbol> setter = context.registry().setter(name);
        if (setter.isPresent()) {
            context.annotateSymbol(assignment, setter.get());
            return;
        }
        GlobalRegistry globals = context.globals();
        if (globals.isGlobalName(name)) {
            globals.record(name);
            globals.learn(name, valueType);
            context.annotateCodegenName(assignment, name);
            log.debug("assign global {} : {} -> {}", name, valueType, globals.typeOf(name));
            return;
        }
        throw SemanticException.definition("Assignment to undefined variable '" + name + "'.");
    }
}
