package com.gaiarust.hir.type;

import java.util.ArrayList;
import java.util.List;

/**
 * 类型语法读取器，把 {@link HirType#toDisplayString()} 的文本形式还原为 HirType。
 *
 * <pre>
 * type := '&amp;' lifetime? 'mut'? type
 *       | '*' ('const' | 'mut') type
 *       | 'dyn' IDENT
 *       | '(' ')' | '!'
 *       | '?T' DIGITS
 *       | '&lt;' IDENT '&gt;' '::' IDENT
 *       | IDENT ('&lt;' type (',' type)* '&gt;')?
 * </pre>
 */
public final class HirTypeParser {

    private final String source;
    private int pos;

    private HirTypeParser(String source) {
        this.source = source;
    }

    /** 解析完整的类型文本，尾部有多余字符时抛出 TypeSyntaxException */
    public static HirType parse(String source) {
        if (source == null) throw new IllegalArgumentException("type source is null");
        HirTypeParser parser = new HirTypeParser(source);
        HirType type = parser.parseType();
        parser.skipWhitespace();
        if (parser.pos < source.length()) {
            throw parser.error("unexpected trailing input");
        }
        return type;
    }

    private HirType parseType() {
        skipWhitespace();
        if (atEnd()) throw error("expected type");
        char c = peek();
        switch (c) {
            case '&':
                pos++;
                return parseReference();
            case '*':
                pos++;
                return parsePointer();
            case '(':
                pos++;
                expect(')');
                return HirTypes.UNIT;
            case '!':
                pos++;
                return HirTypes.NEVER;
            case '?':
                pos++;
                return parseVariable();
            case '<':
                pos++;
                return parseProjection();
            default:
                return parseNamed();
        }
    }

    private HirType parseReference() {
        skipWhitespace();
        String lifetime = null;
        if (!atEnd() && peek() == '\'') {
            pos++;
            lifetime = identifier();
        }
        boolean mutable = tryKeyword("mut");
        return new ReferenceType(lifetime, mutable, parseType());
    }

    private HirType parsePointer() {
        if (tryKeyword("mut")) return new PointerType(true, parseType());
        if (tryKeyword("const")) return new PointerType(false, parseType());
        throw error("expected 'const' or 'mut' after '*'");
    }

    private HirType parseVariable() {
        expect('T');
        int start = pos;
        while (!atEnd() && Character.isDigit(peek())) pos++;
        if (start == pos) throw error("expected type variable id");
        return new TypeVariable(Integer.parseInt(source.substring(start, pos)));
    }

    private HirType parseProjection() {
        String implId = identifier();
        expect('>');
        expect(':');
        expect(':');
        return new ProjectionType(implId, identifier());
    }

    private HirType parseNamed() {
        String name = identifier();
        if ("dyn".equals(name)) {
            return new TraitObjectType(identifier());
        }
        List<HirType> args = new ArrayList<HirType>();
        skipWhitespace();
        if (!atEnd() && peek() == '<') {
            pos++;
            args.add(parseType());
            skipWhitespace();
            while (!atEnd() && peek() == ',') {
                pos++;
                args.add(parseType());
                skipWhitespace();
            }
            expect('>');
        }
        if (args.isEmpty()) {
            PrimitiveType primitive = HirTypes.fromKeyword(name);
            if (primitive != null) return primitive;
            if ("String".equals(name)) return HirTypes.STRING;
        }
        if ("Vec".equals(name)) {
            if (args.size() != 1) throw error("Vec expects exactly one type argument");
            return new VecType(args.get(0));
        }
        return new NamedType(name, args);
    }

    // ============ 词法辅助 ============

    private String identifier() {
        skipWhitespace();
        int start = pos;
        while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) pos++;
        if (start == pos) throw error("expected identifier");
        return source.substring(start, pos);
    }

    private boolean tryKeyword(String keyword) {
        skipWhitespace();
        int end = pos + keyword.length();
        if (!source.startsWith(keyword, pos)) return false;
        if (end < source.length() && (Character.isLetterOrDigit(source.charAt(end)) || source.charAt(end) == '_')) {
            return false;
        }
        pos = end;
        return true;
    }

    private void expect(char c) {
        skipWhitespace();
        if (atEnd() || peek() != c) throw error("expected '" + c + "'");
        pos++;
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) pos++;
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return source.charAt(pos);
    }

    private TypeSyntaxException error(String message) {
        return new TypeSyntaxException(message, source, pos);
    }
}
