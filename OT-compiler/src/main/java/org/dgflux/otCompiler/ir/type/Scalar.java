package org.dgflux.otCompiler.ir.type;

import javax.annotation.Nullable;

/** A single number, as opposed to a vector of values. */
public final class Scalar extends FinalType {
    @Override
    public String getKind() {
        return "Scalar";
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o instanceof Scalar;
    }

    @Override
    public int hashCode() {
        return 2;
    }

    @Override
    public String toString() {
        return "Scalar";
    }
}
