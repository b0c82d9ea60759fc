package org.dgflux.otCompiler.ir.operator;

import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** An operator defined outside this compiler; no pass can handle it. */
public final class OTOpaqueOperator extends OTOperator {
    public final String name;

    public OTOpaqueOperator(String name) {
        this.name = name;
    }

    @Override
    public OperatorFamily family() {
        return OperatorFamily.OPAQUE;
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTOpaqueOperator.class, this.name);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        return this.name.equals(((OTOpaqueOperator) other).name);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }
}
