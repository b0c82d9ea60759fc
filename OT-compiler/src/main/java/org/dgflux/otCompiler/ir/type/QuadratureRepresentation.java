package org.dgflux.otCompiler.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;

/** Data sampled on the quadrature grid named {@code quadratureTag}. */
public final class QuadratureRepresentation extends Representation {
    public final String quadratureTag;

    public QuadratureRepresentation(String quadratureTag) {
        this.quadratureTag = quadratureTag;
    }

    @Override
    public boolean isNodal() {
        return false;
    }

    @Override
    public JsonNode toJson(ObjectMapper mapper) {
        ObjectNode result = mapper.createObjectNode();
        result.put("kind", "Quadrature");
        result.put("tag", this.quadratureTag);
        return result;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (o == null || this.getClass() != o.getClass()) return false;
        return this.quadratureTag.equals(((QuadratureRepresentation) o).quadratureTag);
    }

    @Override
    public int hashCode() {
        return this.quadratureTag.hashCode();
    }

    @Override
    public String toString() {
        return "Quadrature(" + this.quadratureTag + ")";
    }
}
