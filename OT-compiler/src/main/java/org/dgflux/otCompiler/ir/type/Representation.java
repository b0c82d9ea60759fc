package org.dgflux.otCompiler.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dgflux.util.ICastable;

/** Describes how a vector is sampled: at the nodes, or on a quadrature grid.
 * Representations are values; they are compared structurally. */
public abstract class Representation implements ICastable {
    public abstract boolean isNodal();

    public abstract JsonNode toJson(ObjectMapper mapper);
}
