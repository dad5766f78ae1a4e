package com.gaiarust.hir.type;

/**
 * HIR 类型基类。
 * 递归、不可变，按结构比较；同一个类型值可以在多处共享，但从不被原地修改。
 */
public abstract class HirType {

    protected HirType() {
    }

    /** 人类可读的类型名，与 {@link HirTypeParser} 接受的语法一致 */
    public abstract String toDisplayString();

    /** 接受 HirTypeVisitor 进行类型分派 */
    public abstract <R> R accept(HirTypeVisitor<R> visitor);

    @Override
    public String toString() {
        return toDisplayString();
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();
}
