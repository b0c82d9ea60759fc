package org.dgflux.otCompiler.ir.expression;

import com.google.common.collect.ImmutableList;
import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.otCompiler.ir.type.BoundaryTag;
import org.dgflux.util.IIndentStream;
import org.dgflux.util.Utilities;

import java.util.List;
import java.util.Objects;

/** The operand of a flux applied on a boundary: interior (volume) fields,
 * the boundary fields they are paired with, and the tag of the boundary.
 * Flux kernels refer to the fields by position. */
public final class OTBoundaryPair extends OTExpression {
    public final ImmutableList<OTExpression> volumeFields;
    public final ImmutableList<OTExpression> boundaryFields;
    public final BoundaryTag tag;

    public OTBoundaryPair(List<OTExpression> volumeFields, List<OTExpression> boundaryFields, BoundaryTag tag) {
        Utilities.enforce(!volumeFields.isEmpty() || !boundaryFields.isEmpty(),
                "Empty boundary pair");
        this.volumeFields = ImmutableList.copyOf(volumeFields);
        this.boundaryFields = ImmutableList.copyOf(boundaryFields);
        this.tag = tag;
    }

    /** Build a pair from two fields, each of which may be a {@link OTVectorExpression}. */
    public static OTBoundaryPair of(OTExpression field, OTExpression boundaryField, BoundaryTag tag) {
        return new OTBoundaryPair(
                OTVectorExpression.flatten(field), OTVectorExpression.flatten(boundaryField), tag);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (OTExpression field: this.volumeFields)
            field.accept(visitor);
        for (OTExpression field: this.boundaryFields)
            field.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTBoundaryPair.class, this.volumeFields, this.boundaryFields, this.tag);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTBoundaryPair o = (OTBoundaryPair) other;
        return this.tag.equals(o.tag) &&
                this.volumeFields.equals(o.volumeFields) &&
                this.boundaryFields.equals(o.boundaryFields);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("pair<")
                .append(this.tag.toString())
                .append(">([")
                .joinI(", ", this.volumeFields)
                .append("], [")
                .joinI(", ", this.boundaryFields)
                .append("])");
    }
}
