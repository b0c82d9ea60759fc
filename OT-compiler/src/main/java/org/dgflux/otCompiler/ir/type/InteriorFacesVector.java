package org.dgflux.otCompiler.ir.type;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dgflux.otCompiler.compiler.errors.MalformedTypeError;

import javax.annotation.Nullable;

/** A vector of values on the interior faces; always on a quadrature grid. */
public final class InteriorFacesVector extends FinalType implements IHasRepresentation {
    public final Representation representation;

    /** @throws MalformedTypeError if {@code representation} is not a quadrature representation. */
    public InteriorFacesVector(Representation representation) {
        if (!representation.is(QuadratureRepresentation.class))
            throw new MalformedTypeError("InteriorFacesVector is not usable with non-quadrature representation "
                    + representation);
        this.representation = representation;
    }

    @Override
    public Representation getRepresentation() {
        return this.representation;
    }

    @Override
    public String getKind() {
        return "InteriorFacesVector";
    }

    @Override
    protected void addJsonFields(ObjectMapper mapper, ObjectNode node) {
        node.set("representation", this.representation.toJson(mapper));
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        return this.representation.equals(((InteriorFacesVector) o).representation);
    }

    @Override
    public int hashCode() {
        return 8 + 31 * this.representation.hashCode();
    }

    @Override
    public String toString() {
        return "InteriorFaces(" + this.representation + ")";
    }
}
