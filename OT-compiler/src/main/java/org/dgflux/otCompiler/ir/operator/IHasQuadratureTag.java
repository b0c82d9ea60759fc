package org.dgflux.otCompiler.ir.operator;

/** An operator whose input or output lives on a named quadrature grid. */
public interface IHasQuadratureTag {
    String getQuadratureTag();
}
