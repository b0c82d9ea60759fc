package org.dgflux.otCompiler.compiler.visitors.inner;

import org.dgflux.otCompiler.compiler.OTCompiler;
import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.ir.IOTInnerNode;
import org.dgflux.otCompiler.ir.expression.OTBoundaryPair;
import org.dgflux.otCompiler.ir.expression.OTCallExpression;
import org.dgflux.otCompiler.ir.expression.OTCommonSubexpression;
import org.dgflux.otCompiler.ir.expression.OTComparisonExpression;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTFluxExchange;
import org.dgflux.otCompiler.ir.expression.OTIfExpression;
import org.dgflux.otCompiler.ir.expression.OTIfPositiveExpression;
import org.dgflux.otCompiler.ir.expression.OTLeafExpression;
import org.dgflux.otCompiler.ir.expression.OTNaryExpression;
import org.dgflux.otCompiler.ir.expression.OTOperatorBinding;
import org.dgflux.otCompiler.ir.expression.OTPowerExpression;
import org.dgflux.otCompiler.ir.expression.OTQuotientExpression;
import org.dgflux.otCompiler.ir.expression.OTSubscriptExpression;
import org.dgflux.otCompiler.ir.expression.OTVariable;
import org.dgflux.otCompiler.ir.expression.OTVectorExpression;
import org.dgflux.otCompiler.ir.expression.OTWholeDomainFlux;
import org.dgflux.util.IWritesLogs;
import org.dgflux.util.Linq;
import org.dgflux.util.Logger;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Base class for Inner visitors which rewrite expressions.
 * This class recurses over the structure of expressions and if any fields have
 * changed builds a new version of the object.  Classes that extend this should
 * override the preorder methods and ignore the postorder methods. */
public abstract class InnerRewriteVisitor
        extends InnerVisitor
        implements IWritesLogs {
    protected InnerRewriteVisitor(OTCompiler compiler) {
        super(compiler);
    }

    /** Result produced by the last preorder invocation. */
    @Nullable
    protected IOTInnerNode lastResult;

    IOTInnerNode getResult() {
        return Objects.requireNonNull(this.lastResult);
    }

    @Override
    public IOTInnerNode apply(IOTInnerNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return this.getResult();
    }

    /** Rewrite a whole template. */
    public OTExpression rewrite(OTExpression expression) {
        return this.apply(expression).to(OTExpression.class);
    }

    /**
     * Replace the 'old' IR node with the 'newOp' IR node if
     * any of its fields differs. */
    protected void map(IOTInnerNode old, IOTInnerNode newOp) {
        if (old == newOp || old.equals(newOp)) {
            // Ignore new op.
            this.lastResult = old;
            return;
        }

        Logger.INSTANCE.belowLevel(this, 1)
                .appendSupplier(this::toString)
                .append(":")
                .appendSupplier(old::toString)
                .append(" -> ")
                .appendSupplier(newOp::toString)
                .newline();
        this.lastResult = newOp;
    }

    protected OTExpression getResultExpression() {
        return this.getResult().to(OTExpression.class);
    }

    protected OTExpression transform(OTExpression expression) {
        expression.accept(this);
        return this.getResultExpression();
    }

    protected List<OTExpression> transform(List<OTExpression> expressions) {
        return Linq.map(expressions, this::transform);
    }

    @Override
    public VisitDecision preorder(OTLeafExpression expression) {
        this.map(expression, expression);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTNaryExpression expression) {
        this.push(expression);
        List<OTExpression> children = this.transform(expression.children);
        this.pop(expression);
        OTExpression result = expression.replaceChildren(children);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTQuotientExpression expression) {
        this.push(expression);
        OTExpression numerator = this.transform(expression.numerator);
        OTExpression denominator = this.transform(expression.denominator);
        this.pop(expression);
        OTExpression result = new OTQuotientExpression(numerator, denominator);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTPowerExpression expression) {
        this.push(expression);
        OTExpression base = this.transform(expression.base);
        OTExpression exponent = this.transform(expression.exponent);
        this.pop(expression);
        OTExpression result = new OTPowerExpression(base, exponent);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTIfExpression expression) {
        this.push(expression);
        OTExpression condition = this.transform(expression.condition);
        OTExpression then = this.transform(expression.then);
        OTExpression otherwise = this.transform(expression.otherwise);
        this.pop(expression);
        OTExpression result = new OTIfExpression(condition, then, otherwise);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTIfPositiveExpression expression) {
        this.push(expression);
        OTExpression criterion = this.transform(expression.criterion);
        OTExpression then = this.transform(expression.then);
        OTExpression otherwise = this.transform(expression.otherwise);
        this.pop(expression);
        OTExpression result = new OTIfPositiveExpression(criterion, then, otherwise);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTComparisonExpression expression) {
        this.push(expression);
        OTExpression left = this.transform(expression.left);
        OTExpression right = this.transform(expression.right);
        this.pop(expression);
        OTExpression result = new OTComparisonExpression(left, expression.operator, right);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTCallExpression expression) {
        this.push(expression);
        List<OTExpression> parameters = this.transform(expression.parameters);
        this.pop(expression);
        OTExpression result = new OTCallExpression(expression.function, parameters);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTSubscriptExpression expression) {
        this.push(expression);
        OTVariable aggregate = this.transform(expression.aggregate).to(OTVariable.class);
        this.pop(expression);
        OTExpression result = new OTSubscriptExpression(aggregate, expression.index);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTFluxExchange expression) {
        this.push(expression);
        List<OTExpression> args = this.transform(expression.argFields);
        this.pop(expression);
        OTExpression result = new OTFluxExchange(expression.index, expression.rank, args);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTCommonSubexpression expression) {
        this.push(expression);
        OTExpression child = this.transform(expression.child);
        this.pop(expression);
        OTExpression result = expression.withChild(child);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTOperatorBinding expression) {
        this.push(expression);
        OTExpression field = this.transform(expression.field);
        this.pop(expression);
        OTExpression result = new OTOperatorBinding(expression.operator, field);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTVectorExpression expression) {
        this.push(expression);
        List<OTExpression> components = this.transform(expression.components);
        this.pop(expression);
        OTExpression result = new OTVectorExpression(components);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTBoundaryPair expression) {
        this.push(expression);
        List<OTExpression> volumeFields = this.transform(expression.volumeFields);
        List<OTExpression> boundaryFields = this.transform(expression.boundaryFields);
        this.pop(expression);
        OTExpression result = new OTBoundaryPair(volumeFields, boundaryFields, expression.tag);
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTWholeDomainFlux expression) {
        this.push(expression);
        List<OTExpression> interiors = this.transform(expression.interiors);
        List<OTBoundaryPair> boundaries = Linq.map(expression.boundaries,
                b -> this.transform(b).to(OTBoundaryPair.class));
        this.pop(expression);
        OTExpression result = new OTWholeDomainFlux(interiors, boundaries, expression.isLift);
        this.map(expression, result);
        return VisitDecision.STOP;
    }
}
