package com.gaiarust.analysis.constraint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 约束存储按名称处理类型，这里负责从复合类型名中取出直接组成部分：
 * Vec&lt;T&gt; → [T]，HashMap&lt;K, V&gt; → [K, V]，&amp;'a mut T → [T]，[T; 4] → [T]，(A, B) → [A, B]。
 * 投影（&lt;T as Trait&gt;::Item）和 dyn Trait 视为原子名称。
 */
final class TypeNames {

    private TypeNames() {}

    static List<String> components(String name) {
        String s = name.trim();
        if (s.isEmpty() || s.startsWith("<") || s.startsWith("dyn ")) {
            return Collections.emptyList();
        }
        if (s.startsWith("&")) {
            String rest = s.substring(1).trim();
            if (rest.startsWith("'")) {
                int space = firstWhitespace(rest);
                rest = space < 0 ? "" : rest.substring(space).trim();
            }
            if (rest.startsWith("mut ")) rest = rest.substring(4).trim();
            return single(rest);
        }
        if (s.startsWith("*const ")) return single(s.substring(7).trim());
        if (s.startsWith("*mut ")) return single(s.substring(5).trim());
        if (s.startsWith("[") && s.endsWith("]")) {
            List<String> parts = splitTopLevel(s.substring(1, s.length() - 1), ';');
            return parts.isEmpty() ? Collections.<String>emptyList() : single(parts.get(0));
        }
        if (s.startsWith("(") && s.endsWith(")")) {
            return nonEmpty(splitTopLevel(s.substring(1, s.length() - 1), ','));
        }
        int lt = s.indexOf('<');
        if (lt > 0 && s.endsWith(">")) {
            List<String> args = new ArrayList<String>();
            for (String arg : splitTopLevel(s.substring(lt + 1, s.length() - 1), ',')) {
                // 关联类型等式 Item = u8 只取右侧
                List<String> sides = splitTopLevel(arg, '=');
                args.add(sides.get(sides.size() - 1));
            }
            return nonEmpty(args);
        }
        return Collections.emptyList();
    }

    private static List<String> single(String component) {
        return component.isEmpty()
                ? Collections.<String>emptyList()
                : Collections.singletonList(component);
    }

    private static List<String> nonEmpty(List<String> parts) {
        List<String> result = new ArrayList<String>();
        for (String p : parts) {
            if (!p.isEmpty()) result.add(p);
        }
        return result;
    }

    private static int firstWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) return i;
        }
        return -1;
    }

    /** 按最外层分隔符切分，忽略 &lt;&gt; [] () 内部的分隔符 */
    private static List<String> splitTopLevel(String s, char separator) {
        List<String> parts = new ArrayList<String>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '<' || c == '[' || c == '(') {
                depth++;
            } else if (c == '>' || c == ']' || c == ')') {
                depth--;
            } else if (c == separator && depth == 0) {
                parts.add(s.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(s.substring(start).trim());
        return parts;
    }
}
