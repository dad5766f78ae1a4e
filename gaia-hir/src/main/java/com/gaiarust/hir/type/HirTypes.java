package com.gaiarust.hir.type;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * 预定义类型常量和工厂方法。
 */
public final class HirTypes {

    private HirTypes() {}

    private static final Map<PrimitiveType.Kind, PrimitiveType> PRIMITIVES =
            new EnumMap<PrimitiveType.Kind, PrimitiveType>(PrimitiveType.Kind.class);

    static {
        for (PrimitiveType.Kind kind : PrimitiveType.Kind.values()) {
            PRIMITIVES.put(kind, new PrimitiveType(kind));
        }
    }

    // 原始类型
    public static final PrimitiveType I8 = primitive(PrimitiveType.Kind.I8);
    public static final PrimitiveType I16 = primitive(PrimitiveType.Kind.I16);
    public static final PrimitiveType I32 = primitive(PrimitiveType.Kind.I32);
    public static final PrimitiveType I64 = primitive(PrimitiveType.Kind.I64);
    public static final PrimitiveType ISIZE = primitive(PrimitiveType.Kind.ISIZE);
    public static final PrimitiveType U8 = primitive(PrimitiveType.Kind.U8);
    public static final PrimitiveType U16 = primitive(PrimitiveType.Kind.U16);
    public static final PrimitiveType U32 = primitive(PrimitiveType.Kind.U32);
    public static final PrimitiveType U64 = primitive(PrimitiveType.Kind.U64);
    public static final PrimitiveType USIZE = primitive(PrimitiveType.Kind.USIZE);
    public static final PrimitiveType F32 = primitive(PrimitiveType.Kind.F32);
    public static final PrimitiveType F64 = primitive(PrimitiveType.Kind.F64);
    public static final PrimitiveType BOOL = primitive(PrimitiveType.Kind.BOOL);
    public static final PrimitiveType CHAR = primitive(PrimitiveType.Kind.CHAR);
    public static final PrimitiveType STR = primitive(PrimitiveType.Kind.STR);
    public static final PrimitiveType UNIT = primitive(PrimitiveType.Kind.UNIT);
    public static final PrimitiveType NEVER = primitive(PrimitiveType.Kind.NEVER);

    // 常用复合类型
    public static final StringType STRING = StringType.INSTANCE;
    public static final ReferenceType STATIC_STR = new ReferenceType("static", false, STR);

    public static PrimitiveType primitive(PrimitiveType.Kind kind) {
        return PRIMITIVES.get(kind);
    }

    /** 根据关键字查找原始类型（i32, bool, ...），未知返回 null */
    public static PrimitiveType fromKeyword(String keyword) {
        PrimitiveType.Kind kind = PrimitiveType.Kind.fromKeyword(keyword);
        return kind != null ? PRIMITIVES.get(kind) : null;
    }

    /** 创建 Vec&lt;elem&gt; 类型 */
    public static VecType vecOf(HirType elem) {
        return new VecType(elem);
    }

    /** 创建 &amp;'lifetime inner；lifetime 为 null 表示省略 */
    public static ReferenceType ref(String lifetime, HirType inner) {
        return new ReferenceType(lifetime, false, inner);
    }

    /** 创建 &amp;'lifetime mut inner */
    public static ReferenceType refMut(String lifetime, HirType inner) {
        return new ReferenceType(lifetime, true, inner);
    }

    /** 创建命名类型 */
    public static NamedType named(String name, HirType... typeArgs) {
        return new NamedType(name, Arrays.asList(typeArgs));
    }

    // ============ 分类工具 ============

    public static boolean isNumeric(HirType type) {
        return type instanceof PrimitiveType && ((PrimitiveType) type).isNumeric();
    }

    public static boolean isInteger(HirType type) {
        return type instanceof PrimitiveType && ((PrimitiveType) type).isInteger();
    }

    public static boolean isBool(HirType type) {
        return BOOL.equals(type);
    }

    public static boolean isReference(HirType type) {
        return type instanceof ReferenceType;
    }
}
