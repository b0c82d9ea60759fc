package org.dgflux.otCompiler.ir.type;

import javax.annotation.Nullable;

/** A vector of values on the interior faces, of unknown representation.
 * Interior face vectors only exist on quadrature grids; in the nodal case
 * such data is an ordinary nodal volume vector. */
public final class KnownInteriorFaces extends TypeInfo {
    @Override
    @Nullable
    protected TypeInfo unifyInner(TypeInfo other) {
        if (other instanceof InteriorFacesVector)
            return other;
        if (other instanceof KnownVolume)
            return new VolumeVector(NodalRepresentation.INSTANCE);
        if (other.equals(new VolumeVector(NodalRepresentation.INSTANCE)))
            return other;
        return super.unifyInner(other);
    }

    @Override
    public String getKind() {
        return "KnownInteriorFaces";
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o instanceof KnownInteriorFaces;
    }

    @Override
    public int hashCode() {
        return 4;
    }

    @Override
    public String toString() {
        return "KnownAsIntFace";
    }
}
