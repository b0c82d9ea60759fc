package org.dgflux.otCompiler.ir.type;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;

/** A vector on the boundary {@code tag}, of unknown representation. */
public final class KnownBoundary extends TypeInfo implements IBoundaryType {
    public final BoundaryTag tag;

    public KnownBoundary(BoundaryTag tag) {
        this.tag = tag;
    }

    @Override
    public BoundaryTag getBoundaryTag() {
        return this.tag;
    }

    @Override
    @Nullable
    protected TypeInfo unifyInner(TypeInfo other) {
        if (other instanceof BoundaryVector vector && vector.tag.equals(this.tag))
            return other;
        return super.unifyInner(other);
    }

    @Override
    public String getKind() {
        return "KnownBoundary";
    }

    @Override
    protected void addJsonFields(ObjectMapper mapper, ObjectNode node) {
        node.put("boundary", this.tag.name());
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        return this.tag.equals(((KnownBoundary) o).tag);
    }

    @Override
    public int hashCode() {
        return 5 + 31 * this.tag.hashCode();
    }

    @Override
    public String toString() {
        return "KnownAsBoundary(" + this.tag + ")";
    }
}
