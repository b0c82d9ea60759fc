package org.dgflux.otCompiler.ir.operator;

import org.dgflux.otCompiler.ir.type.BoundaryTag;
import org.dgflux.util.IIndentStream;

import java.util.Objects;

/** Restricts volume data to the faces of the boundary {@code tag}. */
public final class OTRestrictToBoundary extends OTOperator {
    public final BoundaryTag tag;

    public OTRestrictToBoundary(BoundaryTag tag) {
        this.tag = tag;
    }

    @Override
    public OperatorFamily family() {
        return OperatorFamily.RESTRICT_TO_BOUNDARY;
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTRestrictToBoundary.class, this.tag);
    }

    @Override
    protected boolean sameStructure(OTOperator other) {
        return this.tag.equals(((OTRestrictToBoundary) other).tag);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("Restrict<")
                .append(this.tag.toString())
                .append(">");
    }
}
