package org.dgflux.otCompiler.compiler.errors;

import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.type.TypeInfo;

/** Type inference converged without finding a final type for some expression. */
public class IncompleteInferenceError extends BaseCompilerException {
    public static final String KIND = "Incomplete type inference";

    public final TypeInfo partialType;

    public IncompleteInferenceError(OTExpression expression, TypeInfo partialType) {
        super("type inference was unable to deduce complete type information for '"
                + expression + "' (only '" + partialType + "')", expression);
        this.partialType = partialType;
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
