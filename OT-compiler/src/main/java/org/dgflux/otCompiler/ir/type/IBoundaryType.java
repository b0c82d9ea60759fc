package org.dgflux.otCompiler.ir.type;

/** A type whose values are known to live on a tagged boundary. */
public interface IBoundaryType {
    BoundaryTag getBoundaryTag();
}
