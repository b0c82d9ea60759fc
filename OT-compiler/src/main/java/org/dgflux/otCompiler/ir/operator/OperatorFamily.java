package org.dgflux.otCompiler.ir.operator;

/** Groups operators by the way the compiler passes treat them.
 * Passes switch over the family of an operator; a new family
 * must be handled in every switch. */
public enum OperatorFamily {
    /** Reduces a volume vector to a scalar. */
    NODAL_REDUCTION,
    /** Only defined on nodal volume data. */
    NODAL_ONLY,
    /** Volume operators which may later be specialized to a quadrature grid. */
    SPECIALIZABLE_VOLUME,
    /** Volume operators already specialized to a quadrature grid. */
    QUADRATURE_VOLUME,
    ELEMENTWISE_MAX,
    /** Restricts volume data to a boundary. */
    RESTRICT_TO_BOUNDARY,
    /** Fetches data from a neighboring partition. */
    FLUX_EXCHANGE,
    FLUX,
    QUADRATURE_UPSAMPLER,
    QUADRATURE_INTERIOR_FACES_UPSAMPLER,
    QUADRATURE_BOUNDARY_UPSAMPLER,
    ELEMENTWISE_LINEAR,
    /** Operators unknown to this compiler. */
    OPAQUE
}
