package org.ifjc.compiler.frontend.semantics;

import org.ifjc.compiler.builtins.BuiltinProvider;
import org.ifjc.compiler.frontend.parser.ast.AssignmentNode;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.BlockNode;
import org.ifjc.compiler.frontend.parser.ast.BreakNode;
import org.ifjc.compiler.frontend.parser.ast.ClassNode;
import org.ifjc.compiler.frontend.parser.ast.ContinueNode;
import org.ifjc.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.ifjc.compiler.frontend.parser.ast.FunctionNode;
import org.ifjc.compiler.frontend.parser.ast.GetterNode;
import org.ifjc.compiler.frontend.parser.ast.IfNode;
import org.ifjc.compiler.frontend.parser.ast.ReturnNode;
import org.ifjc.compiler.frontend.parser.ast.SetterNode;
import org.ifjc.compiler.frontend.parser.ast.VarDeclarationNode;
import org.ifjc.compiler.frontend.parser.ast.WhileNode;
import org.ifjc.compiler.frontend.semantics.analysis.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping AST node classes to analysis handlers (pass 2) and symbol collectors (pass 1).
 */
public final class AnalysisHandlerRegistry {

    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();
    private final Map<Class<? extends AstNode>, ISymbolCollector> collectors = new HashMap<>();

    /**
     * Registers a pass-2 analysis handler for the given AST node class.
     *
     * @param nodeType The concrete AST node class.
     * @param handler  The handler instance.
     * @param <T>      Concrete AST type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, IAnalysisHandler handler) {
        handlers.put(nodeType, handler);
    }

    /**
     * Registers a pass-1 symbol collector for the given AST node class.
     *
     * @param nodeType  The concrete AST node class.
     * @param collector The collector instance.
     * @param <T>       Concrete AST type parameter.
     */
    public <T extends AstNode> void registerCollector(Class<T> nodeType, ISymbolCollector collector) {
        collectors.put(nodeType, collector);
    }

    public Optional<IAnalysisHandler> resolveHandler(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(handlers.get(nodeType));
    }

    public Optional<ISymbolCollector> resolveCollector(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(collectors.get(nodeType));
    }

    /**
     * Creates a registry pre-populated with the default handlers and collectors.
     *
     * @param functions The registry calls are checked against.
     * @param builtins  The builtin metadata used for argument checks.
     * @return A fully initialized registry.
     */
    public static AnalysisHandlerRegistry initializeWithDefaults(FunctionRegistry functions, BuiltinProvider builtins) {
        AnalysisHandlerRegistry registry = new AnalysisHandlerRegistry();

        CallValidator calls = new CallValidator(functions, builtins);
        LiteralExpressionChecker checker = new LiteralExpressionChecker(calls);
        ExpressionTyper typer = new ExpressionTyper(calls);

        // Pass-1 collectors
        AccessorSymbolCollector accessors = new AccessorSymbolCollector();
        ExpressionSymbolCollector expressions = new ExpressionSymbolCollector(checker);
        FlowControlSymbolCollector flowControl = new FlowControlSymbolCollector();
        registry.registerCollector(ClassNode.class, new ClassSymbolCollector());
        registry.registerCollector(BlockNode.class, new BlockSymbolCollector());
        registry.registerCollector(FunctionNode.class, new FunctionSymbolCollector());
        registry.registerCollector(GetterNode.class, accessors);
        registry.registerCollector(SetterNode.class, accessors);
        registry.registerCollector(VarDeclarationNode.class, new VariableSymbolCollector());
        registry.registerCollector(AssignmentNode.class, new AssignmentSymbolCollector(checker));
        registry.registerCollector(WhileNode.class, new LoopSymbolCollector(checker));
        registry.registerCollector(BreakNode.class, flowControl);
        registry.registerCollector(ContinueNode.class, flowControl);
        registry.registerCollector(IfNode.class, expressions);
        registry.registerCollector(ExpressionStatementNode.class, expressions);
        registry.registerCollector(ReturnNode.class, expressions);

        // Pass-2 handlers
        CallableAnalysisHandler callables = new CallableAnalysisHandler();
        ExpressionAnalysisHandler expressionHandler = new ExpressionAnalysisHandler(typer);
        registry.register(ClassNode.class, new ClassAnalysisHandler());
        registry.register(BlockNode.class, new BlockAnalysisHandler());
        registry.register(FunctionNode.class, callables);
        registry.register(GetterNode.class, callables);
        registry.register(SetterNode.class, callables);
        registry.register(VarDeclarationNode.class, new VariableAnalysisHandler());
        registry.register(AssignmentNode.class, new AssignmentAnalysisHandler(typer));
        registry.register(IfNode.class, expressionHandler);
        registry.register(WhileNode.class, expressionHandler);
        registry.register(ExpressionStatementNode.class, expressionHandler);
        registry.register(ReturnNode.class, expressionHandler);

        return registry;
    }
}
