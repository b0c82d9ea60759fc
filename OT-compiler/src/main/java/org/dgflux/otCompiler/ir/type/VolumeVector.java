package org.dgflux.otCompiler.ir.type;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;

/** A vector of values over the whole volume mesh. */
public final class VolumeVector extends FinalType implements IHasRepresentation, IVolumeType {
    public final Representation representation;

    public VolumeVector(Representation representation) {
        this.representation = representation;
    }

    public static VolumeVector nodal() {
        return new VolumeVector(NodalRepresentation.INSTANCE);
    }

    @Override
    public Representation getRepresentation() {
        return this.representation;
    }

    @Override
    public String getKind() {
        return "VolumeVector";
    }

    @Override
    protected void addJsonFields(ObjectMapper mapper, ObjectNode node) {
        node.set("representation", this.representation.toJson(mapper));
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        return this.representation.equals(((VolumeVector) o).representation);
    }

    @Override
    public int hashCode() {
        return 7 + 31 * this.representation.hashCode();
    }

    @Override
    public String toString() {
        return "Volume(" + this.representation + ")";
    }
}
