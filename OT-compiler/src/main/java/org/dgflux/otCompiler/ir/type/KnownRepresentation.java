package org.dgflux.otCompiler.ir.type;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;

/** The representation is known, but not the domain. */
public final class KnownRepresentation extends TypeInfo implements IHasRepresentation {
    public final Representation representation;

    public KnownRepresentation(Representation representation) {
        this.representation = representation;
    }

    @Override
    public Representation getRepresentation() {
        return this.representation;
    }

    @Override
    @Nullable
    protected TypeInfo unifyInner(TypeInfo other) {
        if (other instanceof VolumeVector vector &&
                vector.representation.equals(this.representation))
            return other;
        if (other instanceof BoundaryVector vector &&
                vector.representation.equals(this.representation))
            return other;
        if (other instanceof InteriorFacesVector vector &&
                vector.representation.equals(this.representation))
            return other;
        if (other instanceof KnownVolume)
            return new VolumeVector(this.representation);
        if (other instanceof KnownInteriorFaces) {
            if (this.representation.isNodal())
                return new VolumeVector(this.representation);
            return new InteriorFacesVector(this.representation);
        }
        if (other instanceof KnownBoundary boundary)
            return new BoundaryVector(boundary.tag, this.representation);
        return super.unifyInner(other);
    }

    @Override
    public String getKind() {
        return "KnownRepresentation";
    }

    @Override
    protected void addJsonFields(ObjectMapper mapper, ObjectNode node) {
        node.set("representation", this.representation.toJson(mapper));
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        return this.representation.equals(((KnownRepresentation) o).representation);
    }

    @Override
    public int hashCode() {
        return 6 + 31 * this.representation.hashCode();
    }

    @Override
    public String toString() {
        return "KnownRepresentation(" + this.representation + ")";
    }
}
