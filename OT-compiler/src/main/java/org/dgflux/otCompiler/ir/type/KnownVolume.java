package org.dgflux.otCompiler.ir.type;

import javax.annotation.Nullable;

/** A volume vector whose representation is not known yet. */
public final class KnownVolume extends TypeInfo implements IVolumeType {
    @Override
    @Nullable
    protected TypeInfo unifyInner(TypeInfo other) {
        // Combinations with KnownRepresentation and KnownInteriorFaces are handled there
        if (other instanceof VolumeVector)
            return other;
        return super.unifyInner(other);
    }

    @Override
    public String getKind() {
        return "KnownVolume";
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o instanceof KnownVolume;
    }

    @Override
    public int hashCode() {
        return 3;
    }

    @Override
    public String toString() {
        return "KnownAsVolume";
    }
}
