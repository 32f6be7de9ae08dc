package org.ifjc.compiler.frontend.parser.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.ifjc.compiler.frontend.parser.ast.AssignmentNode;
import org.ifjc.compiler.frontend.parser.ast.AstNode;
import org.ifjc.compiler.frontend.parser.ast.BinaryExpression;
import org.ifjc.compiler.frontend.parser.ast.BinaryOperator;
import org.ifjc.compiler.frontend.parser.ast.BlockNode;
import org.ifjc.compiler.frontend.parser.ast.BreakNode;
import org.ifjc.compiler.frontend.parser.ast.CallExpression;
import org.ifjc.compiler.frontend.parser.ast.ClassNode;
import org.ifjc.compiler.frontend.parser.ast.ContinueNode;
import org.ifjc.compiler.frontend.parser.ast.DoubleLiteral;
import org.ifjc.compiler.frontend.parser.ast.Expression;
import org.ifjc.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.ifjc.compiler.frontend.parser.ast.FunctionNode;
import org.ifjc.compiler.frontend.parser.ast.GetterNode;
import org.ifjc.compiler.frontend.parser.ast.IdentifierExpression;
import org.ifjc.compiler.frontend.parser.ast.IfNode;
import org.ifjc.compiler.frontend.parser.ast.IntLiteral;
import org.ifjc.compiler.frontend.parser.ast.NullLiteral;
import org.ifjc.compiler.frontend.parser.ast.ParameterNode;
import org.ifjc.compiler.frontend.parser.ast.ProgramNode;
import org.ifjc.compiler.frontend.parser.ast.ReturnNode;
import org.ifjc.compiler.frontend.parser.ast.SetterNode;
import org.ifjc.compiler.frontend.parser.ast.StringLiteral;
import org.ifjc.compiler.frontend.parser.ast.TernaryExpression;
import org.ifjc.compiler.frontend.parser.ast.TypeNameExpression;
import org.ifjc.compiler.frontend.parser.ast.UnaryExpression;
import org.ifjc.compiler.frontend.parser.ast.UnaryOperator;
import org.ifjc.compiler.frontend.parser.ast.VarDeclarationNode;
import org.ifjc.compiler.frontend.parser.ast.WhileNode;

import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link ProgramNode} from the JSON form a parser hands over.
 * <p>
 * Document shape:
 * <pre>
 * {"classes": [{"name": "Program", "body": {"type": "block", "statements": [...]}}]}
 * </pre>
 * Statements are objects with a {@code type}:
 * <ul>
 *   <li>{@code block} ({@code statements}), {@code if} ({@code condition}, {@code then}, optional {@code else}),
 *       {@code while} ({@code condition}, {@code body}), {@code break}, {@code continue}</li>
 *   <li>{@code var} ({@code name}), {@code assign} ({@code name}, {@code value}),
 *       {@code expression} ({@code expression}), {@code call} ({@code name}, {@code args}),
 *       {@code return} (optional {@code value})</li>
 *   <li>{@code function} ({@code name}, {@code params}, {@code body}), {@code getter} ({@code name}, {@code body}),
 *       {@code setter} ({@code name}, {@code param}, {@code body})</li>
 * </ul>
 * Expressions are objects with a {@code kind}: {@code int}, {@code double}, {@code string} ({@code value}),
 * {@code null}, {@code identifier}, {@code type} ({@code name}), {@code call} ({@code name}, {@code args}),
 * {@code not}, {@code not_null} ({@code operand}), {@code binary} ({@code op}, {@code left}, {@code right}),
 * {@code ternary} ({@code condition}, {@code then}, {@code else}).
 */
public class AstJsonReader {

    /**
     * Reads a program from a file.
     *
     * @param file UTF-8 encoded JSON document.
     * @return The program.
     * @throws IOException if the file cannot be read.
     * @throws AstFormatException if the document is malformed.
     */
    public ProgramNode read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    /**
     * Reads a program from a JSON string.
     */
    public ProgramNode read(String json) {
        return program(parse(() -> JsonParser.parseString(json)));
    }

    /**
     * Reads a program from a character stream.
     */
    public ProgramNode read(Reader reader) {
        return program(parse(() -> JsonParser.parseReader(reader)));
    }

    private interface ParseCall {
        JsonElement parse();
    }

    private static JsonElement parse(ParseCall call) {
        try {
            return call.parse();
        } catch (JsonParseException e) {
            throw new AstFormatException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    // === Program structure ===

    private ProgramNode program(JsonElement root) {
        JsonObject object = object(root, "$");
        JsonArray classes = array(object, "classes", "$");
        List<ClassNode> result = new ArrayList<>(classes.size());
        for (int i = 0; i < classes.size(); i++) {
            String path = "$.classes[" + i + "]";
            JsonObject cls = object(classes.get(i), path);
            result.add(new ClassNode(string(cls, "name", path), block(cls.get("body"), path + ".body")));
        }
        return new ProgramNode(result);
    }

    private BlockNode block(JsonElement element, String path) {
        JsonObject object = object(element, path);
        String type = string(object, "type", path);
        if (!"block".equals(type)) {
            throw new AstFormatException(path + ": expected a block, found '" + type + "'.");
        }
        JsonArray statements = array(object, "statements", path);
        List<AstNode> result = new ArrayList<>(statements.size());
        for (int i = 0; i < statements.size(); i++) {
            result.add(statement(statements.get(i), path + ".statements[" + i + "]"));
        }
        return new BlockNode(result);
    }

    private BlockNode optionalBlock(JsonObject object, String member, String path) {
        JsonElement element = object.get(member);
        return element == null || element.isJsonNull() ? null : block(element, path + "." + member);
    }

    // === Statements ===

    private AstNode statement(JsonElement element, String path) {
        JsonObject object = object(element, path);
        String type = string(object, "type", path);
        return switch (type) {
            case "block" -> block(object, path);
            case "if" -> new IfNode(expression(object.get("condition"), path + ".condition"),
                    block(object.get("then"), path + ".then"),
                    optionalBlock(object, "else", path));
            case "while" -> new WhileNode(expression(object.get("condition"), path + ".condition"),
                    block(object.get("body"), path + ".body"));
            case "break" -> new BreakNode();
            case "continue" -> new ContinueNode();
            case "expression" -> new ExpressionStatementNode(expression(object.get("expression"), path + ".expression"));
            case "call" -> new ExpressionStatementNode(call(object, path));
            case "var" -> new VarDeclarationNode(string(object, "name", path));
            case "assign" -> new AssignmentNode(string(object, "name", path), expression(object.get("value"), path + ".value"));
            case "return" -> {
                JsonElement value = object.get("value");
                yield new ReturnNode(value == null || value.isJsonNull() ? null : expression(value, path + ".value"));
            }
            case "function" -> {
                JsonArray params = array(object, "params", path);
                List<ParameterNode> parameters = new ArrayList<>(params.size());
                for (int i = 0; i < params.size(); i++) {
                    parameters.add(new ParameterNode(text(params.get(i), path + ".params[" + i + "]")));
                }
                yield new FunctionNode(string(object, "name", path), parameters, block(object.get("body"), path + ".body"));
            }
            case "getter" -> new GetterNode(string(object, "name", path), block(object.get("body"), path + ".body"));
            case "setter" -> new SetterNode(string(object, "name", path),
                    new ParameterNode(string(object, "param", path)),
                    block(object.get("body"), path + ".body"));
            default -> throw new AstFormatException(path + ": unknown statement type '" + type + "'.");
        };
    }

    // === Expressions ===

    private Expression expression(JsonElement element, String path) {
        JsonObject object = object(element, path);
        String kind = string(object, "kind", path);
        return switch (kind) {
            case "int" -> new IntLiteral(integer(object, path));
            case "double" -> new DoubleLiteral(number(object, path).doubleValue());
            case "string" -> new StringLiteral(string(object, "value", path));
            case "null" -> new NullLiteral();
            case "identifier" -> new IdentifierExpression(string(object, "name", path));
            case "type" -> new TypeNameExpression(string(object, "name", path));
            case "call" -> call(object, path);
            case "not" -> new UnaryExpression(UnaryOperator.NOT, expression(object.get("operand"), path + ".operand"));
            case "not_null" -> new UnaryExpression(UnaryOperator.NOT_NULL, expression(object.get("operand"), path + ".operand"));
            case "binary" -> {
                String op = string(object, "op", path);
                BinaryOperator operator = BinaryOperator.fromText(op).orElseThrow(() ->
                        new AstFormatException(path + ": unknown operator '" + op + "'."));
                yield new BinaryExpression(operator,
                        expression(object.get("left"), path + ".left"),
                        expression(object.get("right"), path + ".right"));
            }
            case "ternary" -> new TernaryExpression(expression(object.get("condition"), path + ".condition"),
                    expression(object.get("then"), path + ".then"),
                    expression(object.get("else"), path + ".else"));
            default -> throw new AstFormatException(path + ": unknown expression kind '" + kind + "'.");
        };
    }

    private CallExpression call(JsonObject object, String path) {
        JsonElement args = object.get("args");
        List<Expression> arguments = new ArrayList<>();
        if (args != null && !args.isJsonNull()) {
            JsonArray array = array(object, "args", path);
            for (int i = 0; i < array.size(); i++) {
                arguments.add(expression(array.get(i), path + ".args[" + i + "]"));
            }
        }
        return new CallExpression(string(object, "name", path), arguments);
    }

    // === Primitive accessors ===

    private static JsonObject object(JsonElement element, String path) {
        if (element == null || !element.isJsonObject()) {
            throw new AstFormatException(path + ": expected an object.");
        }
        return element.getAsJsonObject();
    }

    private static JsonArray array(JsonObject object, String member, String path) {
        JsonElement element = object.get(member);
        if (element == null || !element.isJsonArray()) {
            throw new AstFormatException(path + ": '" + member + "' must be an array.");
        }
        return element.getAsJsonArray();
    }

    private static String string(JsonObject object, String member, String path) {
        return text(object.get(member), path + "." + member);
    }

    private static String text(JsonElement element, String path) {
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new AstFormatException(path + ": expected a string.");
        }
        return element.getAsString();
    }

    private static long integer(JsonObject object, String path) {
        BigDecimal value = new BigDecimal(number(object, path).toString());
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw new AstFormatException(path + ".value: expected an integer, found " + value.toPlainString() + ".", e);
        }
    }

    private static Number number(JsonObject object, String path) {
        JsonElement element = object.get("value");
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new AstFormatException(path + ".value: expected a number.");
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        return primitive.getAsNumber();
    }
}
