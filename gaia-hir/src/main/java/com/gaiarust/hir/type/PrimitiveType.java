package com.gaiarust.hir.type;

/**
 * 原始类型: i8..i64, isize, u8..u64, usize, f32, f64, bool, char, str, (), !
 */
public final class PrimitiveType extends HirType {

    public enum Kind {
        I8("i8", true, false),
        I16("i16", true, false),
        I32("i32", true, false),
        I64("i64", true, false),
        ISIZE("isize", true, false),
        U8("u8", true, false),
        U16("u16", true, false),
        U32("u32", true, false),
        U64("u64", true, false),
        USIZE("usize", true, false),
        F32("f32", false, true),
        F64("f64", false, true),
        BOOL("bool", false, false),
        CHAR("char", false, false),
        STR("str", false, false),
        UNIT("()", false, false),
        NEVER("!", false, false);

        private final String keyword;
        private final boolean integer;
        private final boolean floating;

        Kind(String keyword, boolean integer, boolean floating) {
            this.keyword = keyword;
            this.integer = integer;
            this.floating = floating;
        }

        public String getKeyword() {
            return keyword;
        }

        /** 根据关键字查找，未知返回 null */
        public static Kind fromKeyword(String keyword) {
            for (Kind k : values()) {
                if (k.keyword.equals(keyword)) return k;
            }
            return null;
        }
    }

    private final Kind kind;

    PrimitiveType(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isInteger() {
        return kind.integer;
    }

    public boolean isFloat() {
        return kind.floating;
    }

    public boolean isNumeric() {
        return kind.integer || kind.floating;
    }

    @Override
    public String toDisplayString() {
        return kind.keyword;
    }

    @Override
    public <R> R accept(HirTypeVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrimitiveType)) return false;
        return kind == ((PrimitiveType) o).kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }
}
