package com.gaiarust.hir.type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 用户类型或泛型参数，可含类型实参: Point, T, HashMap&lt;K, V&gt;
 */
public final class NamedType extends HirType {

    private final String name;
    private final List<HirType> typeArgs;

    public NamedType(String name) {
        this(name, Collections.<HirType>emptyList());
    }

    public NamedType(String name, List<HirType> typeArgs) {
        this.name = Objects.requireNonNull(name, "name");
        this.typeArgs = typeArgs == null || typeArgs.isEmpty()
                ? Collections.<HirType>emptyList()
                : Collections.unmodifiableList(new ArrayList<HirType>(typeArgs));
    }

    public String getName() {
        return name;
    }

    public List<HirType> getTypeArgs() {
        return typeArgs;
    }

    public boolean hasTypeArgs() {
        return !typeArgs.isEmpty();
    }

    @Override
    public String toDisplayString() {
        if (typeArgs.isEmpty()) return name;
        StringBuilder sb = new StringBuilder(name).append('<');
        for (int i = 0; i < typeArgs.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(typeArgs.get(i).toDisplayString());
        }
        return sb.append('>').toString();
    }

    @Override
    public <R> R accept(HirTypeVisitor<R> visitor) {
        return visitor.visitNamed(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NamedType)) return false;
        NamedType that = (NamedType) o;
        return name.equals(that.name) && typeArgs.equals(that.typeArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeArgs);
    }
}
