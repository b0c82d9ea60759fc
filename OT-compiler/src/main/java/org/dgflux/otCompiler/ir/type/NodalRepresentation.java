package org.dgflux.otCompiler.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;

/** Data sampled at the nodes of the discretization. */
public final class NodalRepresentation extends Representation {
    public static final NodalRepresentation INSTANCE = new NodalRepresentation();

    private NodalRepresentation() {}

    @Override
    public boolean isNodal() {
        return true;
    }

    @Override
    public JsonNode toJson(ObjectMapper mapper) {
        ObjectNode result = mapper.createObjectNode();
        result.put("kind", "Nodal");
        return result;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o instanceof NodalRepresentation;
    }

    @Override
    public int hashCode() {
        return 1;
    }

    @Override
    public String toString() {
        return "Nodal";
    }
}
