package com.gaiarust.cli;

import com.gaiarust.hir.SourceLocation;
import com.gaiarust.hir.decl.HirExprStmt;
import com.gaiarust.hir.decl.HirFunction;
import com.gaiarust.hir.decl.HirImpl;
import com.gaiarust.hir.decl.HirLet;
import com.gaiarust.hir.decl.HirModule;
import com.gaiarust.hir.decl.HirParam;
import com.gaiarust.hir.decl.HirStmt;
import com.gaiarust.hir.decl.HirWhereClause;
import com.gaiarust.hir.expr.HirBinary;
import com.gaiarust.hir.expr.HirBoolLiteral;
import com.gaiarust.hir.expr.HirCall;
import com.gaiarust.hir.expr.HirExpr;
import com.gaiarust.hir.expr.HirFloatLiteral;
import com.gaiarust.hir.expr.HirIntLiteral;
import com.gaiarust.hir.expr.HirStringLiteral;
import com.gaiarust.hir.expr.HirUnary;
import com.gaiarust.hir.expr.HirVariable;
import com.gaiarust.hir.type.HirType;
import com.gaiarust.hir.type.HirTypeParser;
import com.gaiarust.hir.type.TypeSyntaxException;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从 JSON 读取 HIR 模块。
 *
 * <pre>
 * {"name": "demo",
 *  "functions": [{"name": "add", "generics": ["T"], "lifetimes": ["a"],
 *                 "where": [{"param": "T", "bounds": ["Clone"]}],
 *                 "params": [{"name": "x", "type": "i32"}], "returns": "i32",
 *                 "body": [{"let": "y", "type": "i32", "init": {"int": 1}},
 *                          {"expr": {"binary": "+", "left": {"var": "x"}, "right": {"var": "y"}}}]}],
 *  "impls": [{"id": "VecIter", "trait": "Iterator", "self": "Vec&lt;u8&gt;",
 *             "types": {"Item": "u8"}, "methods": [...]}]}
 * </pre>
 * 表达式：{"var"}, {"int"}, {"float"}, {"bool"}, {"str"}, {"binary", "left", "right"},
 * {"unary", "operand"}, {"call", "args"}。节点可带 "line" / "column"。
 */
public final class HirJsonReader {

    private final String file;

    public HirJsonReader(String file) {
        this.file = file != null ? file : "<input>";
    }

    /** 读取文件，模块名缺省时取文件名 */
    public static HirModule readFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return new HirJsonReader(path.toString()).read(reader);
        }
    }

    public HirModule read(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new HirFormatException("malformed JSON: " + e.getMessage(), null, e);
        }
        return readRoot(root);
    }

    public HirModule read(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new HirFormatException("malformed JSON: " + e.getMessage(), null, e);
        }
        return readRoot(root);
    }

    private HirModule readRoot(JsonElement root) {
        try {
            return readModule(object(root, "$"));
        } catch (IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
            // 字段类型不符，如 {"int": "x"}
            throw new HirFormatException("unexpected value: " + e.getMessage(), null, e);
        }
    }

    private HirModule readModule(JsonObject json) {
        String name = json.has("name") ? string(json, "name", "$") : defaultModuleName();
        List<HirFunction> functions = new ArrayList<HirFunction>();
        JsonArray fns = optionalArray(json, "functions", "$");
        for (int i = 0; i < fns.size(); i++) {
            String path = "functions[" + i + "]";
            functions.add(readFunction(object(fns.get(i), path), path));
        }
        List<HirImpl> impls = new ArrayList<HirImpl>();
        JsonArray implArray = optionalArray(json, "impls", "$");
        for (int i = 0; i < implArray.size(); i++) {
            String path = "impls[" + i + "]";
            impls.add(readImpl(object(implArray.get(i), path), path));
        }
        return new HirModule(name, functions, impls);
    }

    private String defaultModuleName() {
        String base = file;
        int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        if (slash >= 0) base = base.substring(slash + 1);
        return base.endsWith(".json") ? base.substring(0, base.length() - 5) : base;
    }

    // ============ 条目 ============

    private HirFunction readFunction(JsonObject json, String path) {
        HirFunction.Builder builder = HirFunction.builder(string(json, "name", path))
                .location(location(json));
        for (String lt : strings(json, "lifetimes", path)) {
            builder.lifetime(lt);
        }
        for (String tp : strings(json, "generics", path)) {
            builder.typeParam(tp);
        }
        JsonArray where = optionalArray(json, "where", path);
        for (int i = 0; i < where.size(); i++) {
            String p = path + ".where[" + i + "]";
            JsonObject clause = object(where.get(i), p);
            builder.where(new HirWhereClause(string(clause, "param", p), strings(clause, "bounds", p)));
        }
        JsonArray params = optionalArray(json, "params", path);
        for (int i = 0; i < params.size(); i++) {
            String p = path + ".params[" + i + "]";
            JsonObject param = object(params.get(i), p);
            builder.param(new HirParam(location(param), string(param, "name", p), type(param, "type", p)));
        }
        if (json.has("returns")) {
            builder.returns(type(json, "returns", path));
        }
        JsonArray body = optionalArray(json, "body", path);
        for (int i = 0; i < body.size(); i++) {
            String p = path + ".body[" + i + "]";
            builder.stmt(readStmt(object(body.get(i), p), p));
        }
        return builder.build();
    }

    private HirImpl readImpl(JsonObject json, String path) {
        String id = string(json, "id", path);
        String traitName = json.has("trait") ? string(json, "trait", path) : null;
        HirType selfType = type(json, "self", path);
        Map<String, HirType> types = new LinkedHashMap<String, HirType>();
        if (json.has("types")) {
            JsonObject bindings = object(json.get("types"), path + ".types");
            for (Map.Entry<String, JsonElement> e : bindings.entrySet()) {
                types.put(e.getKey(), parseType(e.getValue().getAsString(), path + ".types." + e.getKey()));
            }
        }
        List<HirFunction> methods = new ArrayList<HirFunction>();
        JsonArray ms = optionalArray(json, "methods", path);
        for (int i = 0; i < ms.size(); i++) {
            String p = path + ".methods[" + i + "]";
            methods.add(readFunction(object(ms.get(i), p), p));
        }
        return new HirImpl(location(json), id, traitName, selfType, types, methods);
    }

    private HirStmt readStmt(JsonObject json, String path) {
        SourceLocation loc = location(json);
        if (json.has("let")) {
            HirType declared = json.has("type") ? type(json, "type", path) : null;
            return new HirLet(loc, string(json, "let", path), declared, readExpr(json, "init", path));
        }
        if (json.has("expr")) {
            return new HirExprStmt(loc, readExpr(json, "expr", path));
        }
        throw new HirFormatException("statement needs 'let' or 'expr'", path);
    }

    // ============ 表达式 ============

    private HirExpr readExpr(JsonObject parent, String key, String path) {
        if (!parent.has(key)) throw new HirFormatException("missing '" + key + "'", path);
        String p = path + "." + key;
        return readExpr(object(parent.get(key), p), p);
    }

    private HirExpr readExpr(JsonObject json, String path) {
        SourceLocation loc = location(json);
        if (json.has("var")) {
            return new HirVariable(loc, string(json, "var", path));
        }
        if (json.has("int")) {
            return new HirIntLiteral(loc, json.get("int").getAsLong());
        }
        if (json.has("float")) {
            return new HirFloatLiteral(loc, json.get("float").getAsDouble());
        }
        if (json.has("bool")) {
            return new HirBoolLiteral(loc, json.get("bool").getAsBoolean());
        }
        if (json.has("str")) {
            return new HirStringLiteral(loc, string(json, "str", path));
        }
        if (json.has("binary")) {
            String op = string(json, "binary", path);
            HirBinary.BinaryOp operator = HirBinary.BinaryOp.fromSource(op);
            if (operator == null) throw new HirFormatException("unknown binary operator '" + op + "'", path);
            return new HirBinary(loc, readExpr(json, "left", path), operator, readExpr(json, "right", path));
        }
        if (json.has("unary")) {
            String op = string(json, "unary", path);
            HirUnary.UnaryOp operator = HirUnary.UnaryOp.fromSource(op);
            if (operator == null) throw new HirFormatException("unknown unary operator '" + op + "'", path);
            return new HirUnary(loc, operator, readExpr(json, "operand", path));
        }
        if (json.has("call")) {
            List<HirExpr> args = new ArrayList<HirExpr>();
            JsonArray array = optionalArray(json, "args", path);
            for (int i = 0; i < array.size(); i++) {
                String p = path + ".args[" + i + "]";
                args.add(readExpr(object(array.get(i), p), p));
            }
            return new HirCall(loc, string(json, "call", path), args);
        }
        throw new HirFormatException("unrecognized expression " + json, path);
    }

    // ============ 工具 ============

    private SourceLocation location(JsonObject json) {
        if (!json.has("line")) return SourceLocation.UNKNOWN;
        int column = json.has("column") ? json.get("column").getAsInt() : 0;
        return new SourceLocation(file, json.get("line").getAsInt(), column);
    }

    private HirType type(JsonObject json, String key, String path) {
        return parseType(string(json, key, path), path + "." + key);
    }

    private static HirType parseType(String source, String path) {
        try {
            return HirTypeParser.parse(source);
        } catch (TypeSyntaxException e) {
            throw new HirFormatException(e.getMessage(), path, e);
        }
    }

    private static JsonObject object(JsonElement element, String path) {
        if (element == null || !element.isJsonObject()) {
            throw new HirFormatException("expected an object", path);
        }
        return element.getAsJsonObject();
    }

    private static String string(JsonObject json, String key, String path) {
        JsonElement element = json.get(key);
        if (element == null || !element.isJsonPrimitive()) {
            throw new HirFormatException("missing string '" + key + "'", path);
        }
        return element.getAsString();
    }

    private static JsonArray optionalArray(JsonObject json, String key, String path) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) return new JsonArray();
        if (!element.isJsonArray()) throw new HirFormatException("'" + key + "' must be an array", path);
        return element.getAsJsonArray();
    }

    private static List<String> strings(JsonObject json, String key, String path) {
        JsonArray array = optionalArray(json, key, path);
        if (array.size() == 0) return Collections.emptyList();
        List<String> result = new ArrayList<String>();
        for (JsonElement e : array) {
            result.add(e.getAsString());
        }
        return result;
    }
}
