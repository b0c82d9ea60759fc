package org.dgflux.otCompiler.compiler.visitors.inner;

import org.dgflux.otCompiler.compiler.OTCompiler;
import org.dgflux.otCompiler.compiler.errors.IllegalBoundaryOperatorError;
import org.dgflux.otCompiler.compiler.errors.UnsupportedOperatorException;
import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.ir.IOTInnerNode;
import org.dgflux.otCompiler.ir.expression.OTCommonSubexpression;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTFluxExchange;
import org.dgflux.otCompiler.ir.expression.OTLeafExpression;
import org.dgflux.otCompiler.ir.expression.OTOperatorBinding;
import org.dgflux.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/** Visitor which detects whether a boundary expression applies operators
 * which should not be evaluated more than once.
 * Results are cached per expression for the lifetime of the visitor. */
public class ExpensiveBoundaryOperators extends TranslateVisitor<Boolean> {
    /** One entry for each node on the context stack: true if any child visited so far is expensive. */
    final List<Boolean> pending;
    /** Set by pop: the result for the children of the node just popped. */
    boolean childrenExpensive;

    public ExpensiveBoundaryOperators(OTCompiler compiler) {
        super(compiler);
        this.pending = new ArrayList<>();
        this.childrenExpensive = false;
    }

    /** True if evaluating 'expression' invokes an expensive operator. */
    public boolean isExpensive(OTExpression expression) {
        return this.analyze(expression);
    }

    @Override
    public void startVisit(IOTInnerNode node) {
        super.startVisit(node);
        this.pending.clear();
    }

    @Override
    public void push(IOTInnerNode node) {
        super.push(node);
        this.pending.add(false);
    }

    @Override
    public void pop(IOTInnerNode node) {
        this.childrenExpensive = Utilities.removeLast(this.pending);
        super.pop(node);
    }

    VisitDecision produce(OTExpression expression, boolean expensive) {
        this.set(expression, expensive);
        if (!this.pending.isEmpty() && expensive)
            this.pending.set(this.pending.size() - 1, true);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTExpression expression) {
        Boolean known = this.maybeGet(expression);
        if (known != null)
            return this.produce(expression, known);
        return VisitDecision.CONTINUE;
    }

    @Override
    public void postorder(OTExpression expression) {
        this.produce(expression, this.childrenExpensive);
    }

    @Override
    public VisitDecision preorder(OTLeafExpression expression) {
        return this.produce(expression, false);
    }

    @Override
    public VisitDecision preorder(OTCommonSubexpression expression) {
        // Any expensive operator below is evaluated once, by the subexpression
        return this.produce(expression, false);
    }

    @Override
    public VisitDecision preorder(OTFluxExchange expression) {
        return this.produce(expression, true);
    }

    @Override
    public VisitDecision preorder(OTOperatorBinding expression) {
        boolean expensive = switch (expression.operator.family()) {
            case RESTRICT_TO_BOUNDARY -> false;
            case FLUX_EXCHANGE,
                 QUADRATURE_UPSAMPLER,
                 QUADRATURE_INTERIOR_FACES_UPSAMPLER,
                 QUADRATURE_BOUNDARY_UPSAMPLER -> true;
            case NODAL_REDUCTION,
                 NODAL_ONLY,
                 SPECIALIZABLE_VOLUME,
                 QUADRATURE_VOLUME,
                 ELEMENTWISE_MAX,
                 FLUX,
                 ELEMENTWISE_LINEAR -> throw new IllegalBoundaryOperatorError(expression.operator, expression);
            case OPAQUE -> throw new UnsupportedOperatorException(
                    "expensive operator detection", expression.operator, expression);
        };
        return this.produce(expression, expensive);
    }

    @Override
    public String toString() {
        return "ExpensiveBoundaryOperators " + this.id;
    }
}
