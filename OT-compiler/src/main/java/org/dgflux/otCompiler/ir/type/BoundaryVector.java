package org.dgflux.otCompiler.ir.type;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;

/** A vector of values on the boundary {@code tag}. */
public final class BoundaryVector extends FinalType implements IHasRepresentation, IBoundaryType {
    public final BoundaryTag tag;
    public final Representation representation;

    public BoundaryVector(BoundaryTag tag, Representation representation) {
        this.tag = tag;
        this.representation = representation;
    }

    @Override
    public Representation getRepresentation() {
        return this.representation;
    }

    @Override
    public BoundaryTag getBoundaryTag() {
        return this.tag;
    }

    @Override
    public String getKind() {
        return "BoundaryVector";
    }

    @Override
    protected void addJsonFields(ObjectMapper mapper, ObjectNode node) {
        node.put("boundary", this.tag.name());
        node.set("representation", this.representation.toJson(mapper));
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        BoundaryVector that = (BoundaryVector) o;
        return this.tag.equals(that.tag) && this.representation.equals(that.representation);
    }

    @Override
    public int hashCode() {
        return 9 + 31 * (this.tag.hashCode() + 31 * this.representation.hashCode());
    }

    @Override
    public String toString() {
        return "Boundary(" + this.tag + ", " + this.representation + ")";
    }
}
