package org.dgflux.otCompiler.compiler.errors;

import org.dgflux.otCompiler.ir.expression.OTBoundaryPair;
import org.dgflux.otCompiler.ir.expression.OTExpression;

import java.util.Set;
import java.util.stream.Collectors;

/** The same variable is used as both boundary and volume data of one boundary pair. */
public class AliasedDomainVariableError extends BaseCompilerException {
    public static final String KIND = "Aliased domain variable";

    public final Set<OTExpression> shared;

    public AliasedDomainVariableError(Set<OTExpression> shared, OTBoundaryPair pair) {
        super("Variables are being used as both boundary and volume quantities: " +
                shared.stream().map(OTExpression::toString).collect(Collectors.joining(", ")),
                pair);
        this.shared = shared;
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
