package org.dgflux.otCompiler.compiler.visitors.inner;

import org.dgflux.otCompiler.compiler.OTCompiler;
import org.dgflux.otCompiler.compiler.errors.IllegalBoundaryOperatorError;
import org.dgflux.otCompiler.compiler.errors.TagMismatchError;
import org.dgflux.otCompiler.compiler.errors.UnsupportedOperatorException;
import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.ir.expression.OTBoundaryNormalComponent;
import org.dgflux.otCompiler.ir.expression.OTBoundaryPair;
import org.dgflux.otCompiler.ir.expression.OTCallExpression;
import org.dgflux.otCompiler.ir.expression.OTCommonSubexpression;
import org.dgflux.otCompiler.ir.expression.OTConstant;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTFluxExchange;
import org.dgflux.otCompiler.ir.expression.OTNaryExpression;
import org.dgflux.otCompiler.ir.expression.OTNormal;
import org.dgflux.otCompiler.ir.expression.OTOperatorBinding;
import org.dgflux.otCompiler.ir.expression.OTPowerExpression;
import org.dgflux.otCompiler.ir.expression.OTProductExpression;
import org.dgflux.otCompiler.ir.expression.OTQuotientExpression;
import org.dgflux.otCompiler.ir.expression.OTScalarParameter;
import org.dgflux.otCompiler.ir.expression.OTSubscriptExpression;
import org.dgflux.otCompiler.ir.expression.OTSumExpression;
import org.dgflux.otCompiler.ir.expression.OTVariable;
import org.dgflux.otCompiler.ir.flux.FluxCall;
import org.dgflux.otCompiler.ir.flux.FluxConstant;
import org.dgflux.otCompiler.ir.flux.FluxExpression;
import org.dgflux.otCompiler.ir.flux.FluxFieldComponent;
import org.dgflux.otCompiler.ir.flux.FluxNormal;
import org.dgflux.otCompiler.ir.flux.FluxPower;
import org.dgflux.otCompiler.ir.flux.FluxProduct;
import org.dgflux.otCompiler.ir.flux.FluxQuotient;
import org.dgflux.otCompiler.ir.flux.FluxScalarParameter;
import org.dgflux.otCompiler.ir.flux.FluxSum;
import org.dgflux.otCompiler.ir.operator.OTFluxExchangeOperator;
import org.dgflux.otCompiler.ir.operator.OTOperator;
import org.dgflux.otCompiler.ir.operator.OTQuadratureBoundaryGridUpsampler;
import org.dgflux.otCompiler.ir.operator.OTRestrictToBoundary;
import org.dgflux.otCompiler.ir.type.BoundaryTag;
import org.dgflux.util.Linq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates the boundary fields of a {@link OTBoundaryPair} into flux kernel
 * expressions, moving as much of the computation as possible into the kernel.
 *
 * <p>Whatever cannot be computed by the kernel becomes a new input: volume
 * data restricted to the boundary becomes an interior field component,
 * anything else a boundary (exterior) field component.
 * Inputs are registered at most once; the interior inputs start with the
 * volume fields of the pair.
 */
public class MaxFluxEvaluableExpression extends TranslateVisitor<FluxExpression> {
    final OTBoundaryPair pair;
    final ExpensiveBoundaryOperators expensive;
    final List<OTExpression> volumeInputs;
    final Map<OTExpression, Integer> volumeIndex;
    final List<OTExpression> boundaryInputs;
    final Map<OTExpression, Integer> boundaryIndex;
    /** Fold zero terms and factors while translating. */
    final boolean simplify;

    public MaxFluxEvaluableExpression(OTCompiler compiler, OTBoundaryPair pair,
                                      ExpensiveBoundaryOperators expensive) {
        super(compiler);
        this.pair = pair;
        this.expensive = expensive;
        this.volumeInputs = new ArrayList<>();
        this.volumeIndex = new HashMap<>();
        this.boundaryInputs = new ArrayList<>();
        this.boundaryIndex = new HashMap<>();
        this.simplify = compiler.options.languageOptions.simplifyFluxes();
        for (OTExpression field: pair.volumeFields) {
            this.volumeIndex.putIfAbsent(field, this.volumeInputs.size());
            this.volumeInputs.add(field);
        }
    }

    /** Translate all the boundary fields of the pair, in order. */
    public List<FluxExpression> translate() {
        this.startVisit(this.pair);
        List<FluxExpression> result = Linq.map(this.pair.boundaryFields, this::analyze);
        this.endVisit();
        return result;
    }

    public List<OTExpression> getVolumeInputs() {
        return Collections.unmodifiableList(this.volumeInputs);
    }

    public List<OTExpression> getBoundaryInputs() {
        return Collections.unmodifiableList(this.boundaryInputs);
    }

    int registerVolume(OTExpression expression) {
        Integer index = this.volumeIndex.get(expression);
        if (index != null)
            return index;
        int result = this.volumeInputs.size();
        this.volumeIndex.put(expression, result);
        this.volumeInputs.add(expression);
        this.log(2).append("Volume input ")
                .append(result)
                .append(": ")
                .append(expression)
                .newline();
        return result;
    }

    int registerBoundary(OTExpression expression) {
        Integer index = this.boundaryIndex.get(expression);
        if (index != null)
            return index;
        int result = this.boundaryInputs.size();
        this.boundaryIndex.put(expression, result);
        this.boundaryInputs.add(expression);
        this.log(2).append("Boundary input ")
                .append(result)
                .append(": ")
                .append(expression)
                .newline();
        return result;
    }

    VisitDecision translateTo(OTExpression expression, FluxExpression translation) {
        this.set(expression, translation);
        return VisitDecision.STOP;
    }

    VisitDecision boundaryInput(OTExpression expression) {
        return this.translateTo(expression, FluxFieldComponent.exterior(this.registerBoundary(expression)));
    }

    void checkTag(String construct, BoundaryTag tag, OTExpression expression) {
        if (!tag.equals(this.pair.tag))
            throw new TagMismatchError(construct, tag, this.pair.tag, expression);
    }

    /** Expressions which have no flux kernel equivalent are computed outside the kernel. */
    @Override
    public VisitDecision preorder(OTExpression expression) {
        if (this.maybeGet(expression) != null)
            return VisitDecision.STOP;
        return this.boundaryInput(expression);
    }

    VisitDecision arithmetic(OTExpression expression) {
        if (this.maybeGet(expression) != null)
            return VisitDecision.STOP;
        return VisitDecision.CONTINUE;
    }

    @Override
    public VisitDecision preorder(OTNaryExpression expression) {
        return this.arithmetic(expression);
    }

    @Override
    public VisitDecision preorder(OTQuotientExpression expression) {
        return this.arithmetic(expression);
    }

    @Override
    public VisitDecision preorder(OTPowerExpression expression) {
        return this.arithmetic(expression);
    }

    @Override
    public VisitDecision preorder(OTCallExpression expression) {
        return this.arithmetic(expression);
    }

    @Override
    public void postorder(OTSumExpression expression) {
        List<FluxExpression> terms = Linq.map(expression.children, this::get);
        this.set(expression, this.simplify ? FluxSum.create(terms) : new FluxSum(terms));
    }

    @Override
    public void postorder(OTProductExpression expression) {
        List<FluxExpression> factors = Linq.map(expression.children, this::get);
        this.set(expression, this.simplify ? FluxProduct.create(factors) : new FluxProduct(factors));
    }

    @Override
    public void postorder(OTQuotientExpression expression) {
        FluxExpression numerator = this.get(expression.numerator);
        FluxExpression denominator = this.get(expression.denominator);
        this.set(expression, this.simplify
                ? FluxQuotient.create(numerator, denominator)
                : new FluxQuotient(numerator, denominator));
    }

    @Override
    public void postorder(OTPowerExpression expression) {
        this.set(expression, new FluxPower(this.get(expression.base), this.get(expression.exponent)));
    }

    @Override
    public void postorder(OTCallExpression expression) {
        this.set(expression, new FluxCall(expression.function, Linq.map(expression.parameters, this::get)));
    }

    @Override
    public VisitDecision preorder(OTConstant expression) {
        return this.translateTo(expression, new FluxConstant(expression.value));
    }

    @Override
    public VisitDecision preorder(OTScalarParameter expression) {
        return this.translateTo(expression, new FluxScalarParameter(expression.name));
    }

    @Override
    public VisitDecision preorder(OTVariable expression) {
        return this.boundaryInput(expression);
    }

    @Override
    public VisitDecision preorder(OTSubscriptExpression expression) {
        return this.boundaryInput(expression);
    }

    @Override
    public VisitDecision preorder(OTFluxExchange expression) {
        return this.boundaryInput(expression);
    }

    @Override
    public VisitDecision preorder(OTNormal expression) {
        throw new IllegalBoundaryOperatorError("The boundary term contains the flux normal " + expression +
                ". Normals in boundary terms must be boundary normal components.", expression);
    }

    @Override
    public VisitDecision preorder(OTBoundaryNormalComponent expression) {
        this.checkTag("Boundary normal component", expression.tag, expression);
        return this.translateTo(expression, new FluxNormal(expression.axis));
    }

    @Override
    public VisitDecision preorder(OTCommonSubexpression expression) {
        if (this.maybeGet(expression) != null)
            return VisitDecision.STOP;
        // Inlining the body into the kernel would evaluate its operators once per use
        if (this.expensive.isExpensive(expression.child))
            return this.boundaryInput(expression);
        return this.translateTo(expression, this.analyze(expression.child));
    }

    @Override
    public VisitDecision preorder(OTOperatorBinding expression) {
        if (this.maybeGet(expression) != null)
            return VisitDecision.STOP;
        OTOperator operator = expression.operator;
        return switch (operator.family()) {
            case RESTRICT_TO_BOUNDARY -> {
                this.checkTag("RestrictToBoundary", operator.to(OTRestrictToBoundary.class).tag, expression);
                yield this.translateTo(expression,
                        FluxFieldComponent.interior(this.registerVolume(expression.field)));
            }
            case FLUX_EXCHANGE -> {
                this.checkTag("FluxExchangeOperator",
                        operator.to(OTFluxExchangeOperator.class).getBoundaryTag(), expression);
                yield this.boundaryInput(expression);
            }
            case QUADRATURE_BOUNDARY_UPSAMPLER -> {
                this.checkTag("QuadratureBoundaryGridUpsampler",
                        operator.to(OTQuadratureBoundaryGridUpsampler.class).boundaryTag, expression);
                yield this.boundaryInput(expression);
            }
            // not yet specialized to the boundary
            case QUADRATURE_UPSAMPLER -> this.boundaryInput(expression);
            case NODAL_REDUCTION,
                 NODAL_ONLY,
                 SPECIALIZABLE_VOLUME,
                 QUADRATURE_VOLUME,
                 ELEMENTWISE_MAX,
                 FLUX,
                 QUADRATURE_INTERIOR_FACES_UPSAMPLER,
                 ELEMENTWISE_LINEAR -> throw new IllegalBoundaryOperatorError(operator, expression);
            case OPAQUE -> throw new UnsupportedOperatorException("boundary flux evaluation", operator, expression);
        };
    }

    @Override
    public String toString() {
        return "MaxFluxEvaluableExpression " + this.id;
    }
}
