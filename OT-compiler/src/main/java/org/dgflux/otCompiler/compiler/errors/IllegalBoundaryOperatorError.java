package org.dgflux.otCompiler.compiler.errors;

import org.dgflux.otCompiler.ir.IOTNode;

/** An operator was applied directly to boundary data.
 * Only restriction, exchange and quadrature upsampling operators may appear in boundary terms. */
public class IllegalBoundaryOperatorError extends BaseCompilerException {
    public static final String KIND = "Illegal boundary operator";

    public IllegalBoundaryOperatorError(Object operator, IOTNode where) {
        super("Found '" + operator + "' in a boundary term. " +
                "No operator applies directly to boundary data, so this is likely in error.", where);
    }

    public IllegalBoundaryOperatorError(String message, IOTNode where) {
        super(message, where);
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
