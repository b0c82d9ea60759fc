package org.dgflux.otCompiler.ir.type;

import javax.annotation.Nullable;

/** Nothing is known about the type. */
public final class NoType extends TypeInfo {
    @Override
    protected TypeInfo unifyInner(TypeInfo other) {
        return other;
    }

    @Override
    public String getKind() {
        return "NoType";
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o instanceof NoType;
    }

    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public String toString() {
        return "NoType";
    }
}
