package org.dgflux.otCompiler.ir.type;

/** A type which knows the representation of its values. */
public interface IHasRepresentation {
    Representation getRepresentation();
}
