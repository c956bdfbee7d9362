package com.cinderlang.compiler.json;

import com.cinderlang.compiler.InternalConsistencyException;
import com.cinderlang.compiler.ast.SourceSpan;
import com.cinderlang.compiler.ast.TypedName;
import com.cinderlang.compiler.ast.expr.*;
import com.cinderlang.compiler.ast.stmt.*;
import com.cinderlang.compiler.dialect.Dialect;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 从 JSON 文档读取 Cinder IL AST
 *
 * <p>文档格式：</p>
 * <pre>
 * {
 *   "dialect": {"defaultType": "u256", "boolType": "bool"},
 *   "sourceIndices": {"main.src": 0},
 *   "ast": {"nodeType": "Block", "statements": [ ... ]}
 * }
 * </pre>
 *
 * <p>未声明 dialect 时按无类型方言处理，所有类型后缀原样输出。</p>
 *
 * <p>只检查文档结构；空名称、非法字面量等语义问题原样保留，由打印器断言。</p>
 */
public class AstJsonReader {
    private static final Logger LOG = Logger.getLogger(AstJsonReader.class.getName());

    private int nodeCount;

    public AstDocument read(String json) {
        return read(new StringReader(json));
    }

    public AstDocument read(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new AstJsonException("JSON 语法错误: " + e.getMessage(), "$", e);
        }
        JsonObject doc = asObject(root, "$");

        nodeCount = 0;
        Block block = readBlock(require(doc, "ast", "$"), "$.ast");
        Dialect dialect = doc.has("dialect") ? readDialect(doc.get("dialect"), "$.dialect") : Dialect.untyped();
        Map<String, Integer> indices = doc.has("sourceIndices")
                ? readSourceIndices(doc.get("sourceIndices"), "$.sourceIndices")
                : Collections.<String, Integer>emptyMap();

        LOG.fine("读取 AST 完成: " + nodeCount + " 个节点, " + indices.size() + " 个源文件");
        return new AstDocument(block, dialect, indices);
    }

    // ============ 文档头 ============

    private Dialect readDialect(JsonElement element, String path) {
        JsonObject obj = asObject(element, path);
        return Dialect.of(optString(obj, "defaultType", path), optString(obj, "boolType", path));
    }

    private Map<String, Integer> readSourceIndices(JsonElement element, String path) {
        JsonObject obj = asObject(element, path);
        Map<String, Integer> indices = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
            String entryPath = path + "." + entry.getKey();
            int index = asInt(entry.getValue(), entryPath);
            if (index < 0) {
                throw new AstJsonException("源索引不能为负数", entryPath);
            }
            indices.put(entry.getKey(), index);
        }
        return indices;
    }

    // ============ 语句 ============

    private Statement readStatement(JsonElement element, String path) {
        JsonObject obj = asObject(element, path);
        String nodeType = nodeType(obj, path);
        SourceSpan span = readSpan(obj, path);
        nodeCount++;

        switch (nodeType) {
            case "Block":
                return readBlockBody(obj, span, path);
            case "ExpressionStatement":
                return new ExpressionStatement(span, readExpression(require(obj, "expression", path), path + ".expression"));
            case "Assignment": {
                List<Identifier> targets = new ArrayList<>();
                JsonArray names = asArray(require(obj, "variableNames", path), path + ".variableNames");
                for (int i = 0; i < names.size(); i++) {
                    targets.add(readIdentifier(names.get(i), path + ".variableNames[" + i + "]"));
                }
                return new Assignment(span, targets, readExpression(require(obj, "value", path), path + ".value"));
            }
            case "VariableDeclaration": {
                List<TypedName> variables = readTypedNames(require(obj, "variables", path), path + ".variables");
                Expression value = obj.has("value") && !obj.get("value").isJsonNull()
                        ? readExpression(obj.get("value"), path + ".value")
                        : null;
                return new VariableDeclaration(span, variables, value);
            }
            case "FunctionDefinition":
                return new FunctionDefinition(span,
                        requireString(obj, "name", path),
                        obj.has("parameters") ? readTypedNames(obj.get("parameters"), path + ".parameters") : new ArrayList<>(),
                        obj.has("returnVariables") ? readTypedNames(obj.get("returnVariables"), path + ".returnVariables") : new ArrayList<>(),
                        readBlock(require(obj, "body", path), path + ".body"));
            case "If":
                return new IfStmt(span,
                        readExpression(require(obj, "condition", path), path + ".condition"),
                        readBlock(require(obj, "body", path), path + ".body"));
            case "Switch":
                return readSwitch(obj, span, path);
            case "ForLoop":
                return new ForLoop(span,
                        readBlock(require(obj, "pre", path), path + ".pre"),
                        readExpression(require(obj, "condition", path), path + ".condition"),
                        readBlock(require(obj, "post", path), path + ".post"),
                        readBlock(require(obj, "body", path), path + ".body"));
            case "Break":
                return new BreakStmt(span);
            case "Continue":
                return new ContinueStmt(span);
            case "Leave":
                return new LeaveStmt(span);
            default:
                throw new AstJsonException("未知语句类型: " + nodeType, path);
        }
    }

    private Block readBlock(JsonElement element, String path) {
        JsonObject obj = asObject(element, path);
        String nodeType = nodeType(obj, path);
        if (!nodeType.equals("Block")) {
            throw new AstJsonException("期望 Block，实际为 " + nodeType, path);
        }
        nodeCount++;
        return readBlockBody(obj, readSpan(obj, path), path);
    }

    private Block readBlockBody(JsonObject obj, SourceSpan span, String path) {
        List<Statement> statements = new ArrayList<>();
        if (obj.has("statements")) {
            JsonArray array = asArray(obj.get("statements"), path + ".statements");
            for (int i = 0; i < array.size(); i++) {
                statements.add(readStatement(array.get(i), path + ".statements[" + i + "]"));
            }
        }
        return new Block(span, statements);
    }

    private SwitchStmt readSwitch(JsonObject obj, SourceSpan span, String path) {
        Expression expression = readExpression(require(obj, "expression", path), path + ".expression");
        List<SwitchCase> cases = new ArrayList<>();
        if (obj.has("cases")) {
            JsonArray array = asArray(obj.get("cases"), path + ".cases");
            for (int i = 0; i < array.size(); i++) {
                String casePath = path + ".cases[" + i + "]";
                JsonObject caseObj = asObject(array.get(i), casePath);
                Literal value = null;
                if (caseObj.has("value") && !caseObj.get("value").isJsonNull()) {
                    Expression expr = readExpression(caseObj.get("value"), casePath + ".value");
                    if (!(expr instanceof Literal)) {
                        throw new AstJsonException("case 值必须是字面量", casePath + ".value");
                    }
                    value = (Literal) expr;
                }
                cases.add(new SwitchCase(value, readBlock(require(caseObj, "body", casePath), casePath + ".body")));
            }
        }
        return new SwitchStmt(span, expression, cases);
    }

    // ============ 表达式 ============

    private Expression readExpression(JsonElement element, String path) {
        JsonObject obj = asObject(element, path);
        String nodeType = nodeType(obj, path);
        switch (nodeType) {
            case "Literal":
                nodeCount++;
                return new Literal(readSpan(obj, path),
                        readLiteralKind(requireString(obj, "kind", path), path + ".kind"),
                        requireString(obj, "value", path),
                        optString(obj, "type", path));
            case "Identifier":
                return readIdentifier(obj, path);
            case "FunctionCall": {
                nodeCount++;
                Identifier callee = readIdentifier(require(obj, "functionName", path), path + ".functionName");
                List<Expression> arguments = new ArrayList<>();
                if (obj.has("arguments")) {
                    JsonArray array = asArray(obj.get("arguments"), path + ".arguments");
                    for (int i = 0; i < array.size(); i++) {
                        arguments.add(readExpression(array.get(i), path + ".arguments[" + i + "]"));
                    }
                }
                return new FunctionCall(readSpan(obj, path), callee, arguments);
            }
            default:
                throw new AstJsonException("未知表达式类型: " + nodeType, path);
        }
    }

    private Identifier readIdentifier(JsonElement element, String path) {
        JsonObject obj = asObject(element, path);
        String nodeType = nodeType(obj, path);
        if (!nodeType.equals("Identifier")) {
            throw new AstJsonException("期望 Identifier，实际为 " + nodeType, path);
        }
        nodeCount++;
        return new Identifier(readSpan(obj, path), requireString(obj, "name", path));
    }

    private Literal.LiteralKind readLiteralKind(String kind, String path) {
        switch (kind) {
            case "number": return Literal.LiteralKind.NUMBER;
            case "bool":   return Literal.LiteralKind.BOOLEAN;
            case "string": return Literal.LiteralKind.STRING;
            default:
                throw new AstJsonException("未知字面量类型: " + kind, path);
        }
    }

    private List<TypedName> readTypedNames(JsonElement element, String path) {
        JsonArray array = asArray(element, path);
        List<TypedName> names = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            String itemPath = path + "[" + i + "]";
            JsonObject obj = asObject(array.get(i), itemPath);
            names.add(new TypedName(readSpan(obj, itemPath), requireString(obj, "name", itemPath),
                    optString(obj, "type", itemPath)));
        }
        return names;
    }

    private SourceSpan readSpan(JsonObject obj, String path) {
        if (!obj.has("src") || obj.get("src").isJsonNull()) {
            return null;
        }
        String spanPath = path + ".src";
        JsonObject src = asObject(obj.get("src"), spanPath);
        String source = requireString(src, "source", spanPath);
        int start = asInt(require(src, "start", spanPath), spanPath + ".start");
        int end = asInt(require(src, "end", spanPath), spanPath + ".end");
        try {
            return new SourceSpan(source, start, end);
        } catch (InternalConsistencyException e) {
            throw new AstJsonException("非法来源区间: " + e.getMessage(), spanPath, e);
        }
    }

    // ============ JSON 访问辅助 ============

    private static String nodeType(JsonObject obj, String path) {
        return requireString(obj, "nodeType", path);
    }

    private static JsonElement require(JsonObject obj, String field, String path) {
        JsonElement value = obj.get(field);
        if (value == null || value.isJsonNull()) {
            throw new AstJsonException("缺少字段 '" + field + "'", path);
        }
        return value;
    }

    private static String requireString(JsonObject obj, String field, String path) {
        return asString(require(obj, field, path), path + "." + field);
    }

    private static String optString(JsonObject obj, String field, String path) {
        JsonElement value = obj.get(field);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        return asString(value, path + "." + field);
    }

    private static JsonObject asObject(JsonElement element, String path) {
        if (element == null || !element.isJsonObject()) {
            throw new AstJsonException("期望 JSON 对象", path);
        }
        return element.getAsJsonObject();
    }

    private static JsonArray asArray(JsonElement element, String path) {
        if (element == null || !element.isJsonArray()) {
            throw new AstJsonException("期望 JSON 数组", path);
        }
        return element.getAsJsonArray();
    }

    private static String asString(JsonElement element, String path) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new AstJsonException("期望字符串", path);
        }
        return element.getAsString();
    }

    private static int asInt(JsonElement element, String path) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new AstJsonException("期望整数", path);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        try {
            return Integer.parseInt(primitive.getAsString());
        } catch (NumberFormatException e) {
            throw new AstJsonException("期望整数: " + primitive.getAsString(), path, e);
        }
    }
}
