package org.dgflux.otCompiler.compiler.errors;

import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.type.TypeInfo;

import javax.annotation.Nullable;

/** Two types could not be unified in either direction. */
public class TypeConflictError extends BaseCompilerException {
    public static final String KIND = "Type conflict";

    public final TypeInfo left;
    public final TypeInfo right;

    public TypeConflictError(TypeInfo left, TypeInfo right, @Nullable OTExpression expression) {
        super(makeMessage(left, right, expression), expression);
        this.left = left;
        this.right = right;
    }

    static String makeMessage(TypeInfo left, TypeInfo right, @Nullable OTExpression expression) {
        String result = "types '" + left + "' and '" + right + "'";
        if (expression != null)
            result += " for '" + expression + "'";
        return result + " cannot be unified";
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
