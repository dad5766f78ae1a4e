package com.gaiarust.analysis.lifetime;

import java.util.Objects;

/**
 * 生命周期：Named(name) | Inferred(id) | Static。按结构比较。
 * 名称去掉前导撇号保存，"static" 即 'static。
 */
public final class Lifetime {

    public enum Kind {
        NAMED,
        INFERRED,
        STATIC
    }

    public static final Lifetime STATIC = new Lifetime(Kind.STATIC, "static", -1);

    private final Kind kind;
    private final String name;
    private final int id;

    private Lifetime(Kind kind, String name, int id) {
        this.kind = kind;
        this.name = name;
        this.id = id;
    }

    /** 命名生命周期；"a" 与 "'a" 相同，"static" 返回 {@link #STATIC} */
    public static Lifetime named(String name) {
        String normalized = normalize(name);
        if (normalized.equals("static")) return STATIC;
        return new Lifetime(Kind.NAMED, normalized, -1);
    }

    public static Lifetime inferred(int id) {
        if (id < 0) throw new IllegalArgumentException("inferred lifetime id must be non-negative: " + id);
        return new Lifetime(Kind.INFERRED, null, id);
    }

    /** 去掉前导撇号 */
    public static String normalize(String name) {
        if (name == null) throw new IllegalArgumentException("lifetime name is null");
        String s = name.trim();
        if (s.startsWith("'")) s = s.substring(1);
        if (s.isEmpty()) throw new IllegalArgumentException("empty lifetime name");
        return s;
    }

    public Kind getKind() {
        return kind;
    }

    /** 命名生命周期的名称（不含撇号），其他情况为 null；Static 返回 "static" */
    public String getName() {
        return name;
    }

    /** 推断生命周期的 id，其他情况为 -1 */
    public int getId() {
        return id;
    }

    public boolean isStatic() {
        return kind == Kind.STATIC;
    }

    public boolean isInferred() {
        return kind == Kind.INFERRED;
    }

    /** 'a, 'l0, 'static */
    public String toDisplayString() {
        switch (kind) {
            case NAMED: return "'" + name;
            case INFERRED: return "'l" + id;
            default: return "'static";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Lifetime)) return false;
        Lifetime that = (Lifetime) o;
        return kind == that.kind && id == that.id && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, id);
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
