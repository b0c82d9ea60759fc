package org.dgflux.otCompiler.compiler;

import org.dgflux.otCompiler.ir.expression.OTBoundaryPair;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTOperatorBinding;
import org.dgflux.otCompiler.ir.expression.OTVariable;
import org.dgflux.otCompiler.ir.flux.FluxExpression;
import org.dgflux.otCompiler.ir.flux.FluxFieldComponent;
import org.dgflux.otCompiler.ir.flux.FluxNormal;
import org.dgflux.otCompiler.ir.operator.OTDiffOperator;
import org.dgflux.otCompiler.ir.operator.OTFluxOperator;
import org.dgflux.otCompiler.ir.operator.OTRestrictToBoundary;
import org.dgflux.otCompiler.ir.type.BoundaryTag;

/** Helpers for building operator templates in tests. */
public class OTTestBase {
    protected static final BoundaryTag WALL = new BoundaryTag("wall");
    protected static final BoundaryTag INFLOW = new BoundaryTag("inflow");

    /** A compiler which throws on the first error. */
    public static OTCompiler testCompiler() {
        CompilerOptions options = new CompilerOptions();
        options.languageOptions.throwOnError = true;
        options.ioOptions.quiet = true;
        return new OTCompiler(options);
    }

    /** A compiler which records errors instead of throwing. */
    public static OTCompiler reportingCompiler() {
        return new OTCompiler(new CompilerOptions());
    }

    public static OTVariable var(String name) {
        return new OTVariable(name);
    }

    public static OTOperatorBinding restrict(OTExpression field, BoundaryTag tag) {
        return new OTRestrictToBoundary(tag).bind(field);
    }

    public static OTOperatorBinding diff(OTExpression field) {
        return new OTDiffOperator(0).bind(field);
    }

    /** Central flux in direction 0: (u_int + u_ext) / 2 * n_0. */
    public static FluxExpression centralFlux() {
        return FluxFieldComponent.interior(0)
                .plus(FluxFieldComponent.exterior(0))
                .times(0.5)
                .times(new FluxNormal(0));
    }

    /** Apply 'flux' to the pair (field, boundaryField) on 'tag'. */
    public static OTOperatorBinding fluxOnBoundary(
            FluxExpression flux, OTExpression field, OTExpression boundaryField, BoundaryTag tag) {
        return new OTFluxOperator(flux).bind(OTBoundaryPair.of(field, boundaryField, tag));
    }
}
