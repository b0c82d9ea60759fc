package org.dgflux.otCompiler.compiler.errors;

import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.operator.OTOperator;

import javax.annotation.Nullable;

/** Exception thrown when a pass has no rule for an operator.
 * Unlike {@link IllegalBoundaryOperatorError} the program may be legal;
 * the operator is simply outside the responsibility of this compiler. */
public class UnsupportedOperatorException extends BaseCompilerException {
    public static final String KIND = "Unsupported operator";

    public final OTOperator operator;

    public UnsupportedOperatorException(String pass, OTOperator operator, @Nullable OTExpression binding) {
        super(pass + " does not know how to handle '" + operator + "'", binding);
        this.operator = operator;
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
