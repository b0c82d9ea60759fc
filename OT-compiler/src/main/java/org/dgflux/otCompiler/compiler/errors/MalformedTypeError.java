package org.dgflux.otCompiler.compiler.errors;

/** An internally inconsistent type value was constructed.
 * This is a violation of the type lattice contract by the caller. */
public class MalformedTypeError extends BaseCompilerException {
    public static final String KIND = "Malformed type";

    public MalformedTypeError(String message) {
        super(message);
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
