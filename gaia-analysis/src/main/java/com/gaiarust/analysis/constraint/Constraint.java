package com.gaiarust.analysis.constraint;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 类型约束：TypeEquality(A, B) | TraitBound(T, Trait) | LifetimeBound(T, 'a) | SizedBound(T)。
 * 在条目的约束生成阶段创建，加入 {@link ConstraintSet} 后不再修改，只会被重新索引。
 */
public final class Constraint {

    public enum Kind {
        TYPE_EQUALITY,
        TRAIT_BOUND,
        LIFETIME_BOUND,
        SIZED_BOUND
    }

    private final Kind kind;
    private final String subject;
    private final String object;    // SIZED_BOUND 时为 null

    private Constraint(Kind kind, String subject, String object) {
        this.kind = kind;
        this.subject = requireName(subject);
        this.object = kind == Kind.SIZED_BOUND ? null : requireName(object);
    }

    private static String requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("constraint operand must be a non-empty name");
        }
        return name.trim();
    }

    public static Constraint typeEquality(String a, String b) {
        return new Constraint(Kind.TYPE_EQUALITY, a, b);
    }

    public static Constraint traitBound(String type, String traitName) {
        return new Constraint(Kind.TRAIT_BOUND, type, traitName);
    }

    /** T: 'a。生命周期名统一写成带撇号的形式 */
    public static Constraint lifetimeBound(String type, String lifetime) {
        String lt = requireName(lifetime);
        return new Constraint(Kind.LIFETIME_BOUND, type, lt.startsWith("'") ? lt : "'" + lt);
    }

    public static Constraint sizedBound(String type) {
        return new Constraint(Kind.SIZED_BOUND, type, null);
    }

    public Kind getKind() {
        return kind;
    }

    /** 约束的主体：等式左侧、被约束的类型 */
    public String getSubject() {
        return subject;
    }

    /** 等式右侧、trait 名或生命周期名；SizedBound 返回 null */
    public String getObject() {
        return object;
    }

    public boolean isTypeEquality() {
        return kind == Kind.TYPE_EQUALITY;
    }

    public boolean isTraitBound() {
        return kind == Kind.TRAIT_BOUND;
    }

    /**
     * 该约束提到的类型 / 生命周期键。
     * 等式两侧都算；LifetimeBound 同时算类型和生命周期；trait 名不是键。
     */
    public List<String> keys() {
        switch (kind) {
            case TYPE_EQUALITY:
                return subject.equals(object)
                        ? Collections.singletonList(subject)
                        : Arrays.asList(subject, object);
            case LIFETIME_BOUND:
                return Arrays.asList(subject, object);
            case TRAIT_BOUND:
            case SIZED_BOUND:
            default:
                return Collections.singletonList(subject);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Constraint)) return false;
        Constraint that = (Constraint) o;
        return kind == that.kind && subject.equals(that.subject) && Objects.equals(object, that.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, subject, object);
    }

    @Override
    public String toString() {
        switch (kind) {
            case TYPE_EQUALITY: return subject + " == " + object;
            case TRAIT_BOUND: return subject + ": " + object;
            case LIFETIME_BOUND: return subject + ": " + object;
            case SIZED_BOUND: return subject + ": Sized";
            default: return kind.name();
        }
    }
}
