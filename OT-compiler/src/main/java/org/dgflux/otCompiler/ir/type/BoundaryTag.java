package org.dgflux.otCompiler.ir.type;

/** Identifies a part of the mesh boundary.
 * Tags are opaque; two tags are equal if they have the same name. */
public record BoundaryTag(String name) {
    /** Tag of the boundary used for all faces that have no other tag. */
    public static final BoundaryTag NONE = new BoundaryTag("none");

    /** Tag of the inter-partition boundary shared with partition {@code rank}. */
    public static BoundaryTag forRank(int rank) {
        return new BoundaryTag("rank_boundary:" + rank);
    }

    @Override
    public String toString() {
        return this.name;
    }
}
