package org.ifjc.compiler.frontend.semantics.analysis;

import org.ifjc.compiler.diagnostics.SemanticException;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.BlockNode;
import org.ifjc.compiler.frontend.parser.ast.ClassNode;
import org.ifjc.compiler.frontend.parser.ast.FunctionNode;
import org.ifjc.compiler.frontend.parser.ast.GetterNode;
import org.ifjc.compiler.frontend.parser.ast.IfNode;
import org.ifjc.compiler.frontend.parser.ast.ProgramNode;
import org.ifjc.compiler.frontend.parser.ast.SetterNode;
import org.ifjc.compiler.frontend.parser.ast.WhileNode;
import org.ifjc.compiler.frontend.semantics.FunctionRegistry;

/**
 * Collects every callable header before any body is walked, so calls may precede the
 * declaration of their target.
 * <p>
 * The scan descends into nested blocks of a class's root block but never into the body of a
 * function, getter or setter. After the scan the program must contain {@code main()}.
 */
public class SignatureCollector {

    public static final String MAIN = "main";

    private final FunctionRegistry registry;
    private boolean seenMain;

    public SignatureCollector(FunctionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers the headers of every class in {@code program} and checks the {@code main()} gate.
     *
     * @param program The program to scan.
     * @throws SemanticException of kind REDEFINITION on a duplicate header within one class,
     *                           of kind DEFINITION if {@code main} is missing or takes parameters.
     */
    public void collect(ProgramNode program) {
        seenMain = false;
        for (ClassNode classNode : program.classes()) {
            if (classNode.body() != null) {
                scan(classNode.body(), classNode.name());
            }
        }
        if (!seenMain) {
            throw SemanticException.definition("Missing function 'main()'.");
        }
    }

    private void scan(AstNode node, String owningClass) {
        if (node instanceof FunctionNode function) {
            if (MAIN.equals(function.name())) {
                if (function.arity() != 0) {
                    throw SemanticException.definition("Function 'main' must not take parameters.");
                }
                seenMain = true;
            }
            registry.registerFunction(function.name(), function.arity(), owningClass, function);
        } else if (node instanceof GetterNode getter) {
            registry.registerGetter(getter.name(), owningClass, getter);
        } else if (node instanceof SetterNode setter) {
            registry.registerSetter(setter.name(), owningClass, setter);
        } else if (node instanceof BlockNode || node instanceof IfNode || node instanceof WhileNode) {
            for (AstNode child : node.getChildren()) {
                scan(child, owningClass);
            }
        }
    }

    public boolean seenMain() {
        return seenMain;
    }
}
