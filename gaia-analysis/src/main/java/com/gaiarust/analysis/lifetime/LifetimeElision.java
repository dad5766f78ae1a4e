package com.gaiarust.analysis.lifetime;

import com.gaiarust.hir.type.HirType;
import com.gaiarust.hir.type.ReferenceType;

import java.util.ArrayList;
import java.util.List;

/**
 * 函数签名的生命周期省略规则。
 * <ol>
 *   <li>恰好一个引用参数且返回引用：参数和返回值共用一个新生命周期</li>
 *   <li>多个引用参数、第一个参数是引用且返回引用：返回值沿用第一个参数的生命周期，其余引用参数各自独立</li>
 *   <li>其余情况：每个引用参数一个独立的新生命周期，返回值没有生命周期</li>
 * </ol>
 * 规则 3 下返回引用是歧义的，由 {@link ElisionResult#requireOutputLifetime(String)} 拒绝。
 */
public final class LifetimeElision {

    private LifetimeElision() {}

    public static ElisionResult elideFunctionLifetimes(boolean[] inputIsRef, boolean hasReturnRef,
                                                       LifetimeContext ctx) {
        List<Lifetime> explicit = new ArrayList<Lifetime>();
        for (int i = 0; i < inputIsRef.length; i++) {
            explicit.add(null);
        }
        return elide(inputIsRef, explicit, hasReturnRef, ctx);
    }

    /**
     * 按参数类型省略：顶层引用参数参与省略；已写明生命周期的参数沿用它，
     * 其余引用参数分配新生命周期。
     *
     * @throws LifetimeException UNREGISTERED_LIFETIME，参数写明的生命周期未登记
     */
    public static ElisionResult elideSignature(List<HirType> paramTypes, HirType returnType, LifetimeContext ctx) {
        boolean[] inputIsRef = new boolean[paramTypes.size()];
        List<Lifetime> explicit = new ArrayList<Lifetime>();
        for (int i = 0; i < paramTypes.size(); i++) {
            HirType type = paramTypes.get(i);
            inputIsRef[i] = type instanceof ReferenceType;
            Lifetime written = null;
            if (inputIsRef[i] && ((ReferenceType) type).hasLifetime()) {
                String name = ((ReferenceType) type).getLifetimeName();
                written = ctx.lookup(name);
                if (written == null) {
                    throw new LifetimeException(LifetimeError.unregisteredLifetime(name));
                }
            }
            explicit.add(written);
        }
        return elide(inputIsRef, explicit, returnType instanceof ReferenceType, ctx);
    }

    private static ElisionResult elide(boolean[] inputIsRef, List<Lifetime> explicit, boolean hasReturnRef,
                                       LifetimeContext ctx) {
        int refCount = 0;
        for (boolean isRef : inputIsRef) {
            if (isRef) refCount++;
        }

        List<Lifetime> inputs = new ArrayList<Lifetime>();
        for (int i = 0; i < inputIsRef.length; i++) {
            if (!inputIsRef[i]) {
                inputs.add(null);
            } else {
                Lifetime written = explicit.get(i);
                inputs.add(written != null ? written : ctx.freshLifetime());
            }
        }

        if (hasReturnRef && refCount == 1) {
            Lifetime shared = null;
            for (Lifetime lt : inputs) {
                if (lt != null) shared = lt;
            }
            return new ElisionResult(inputs, shared, ElisionResult.Rule.SINGLE_INPUT, true);
        }
        if (hasReturnRef && refCount > 1 && inputIsRef[0]) {
            return new ElisionResult(inputs, inputs.get(0), ElisionResult.Rule.FIRST_INPUT, true);
        }
        return new ElisionResult(inputs, null, ElisionResult.Rule.INDEPENDENT, hasReturnRef);
    }
}
