package org.dgflux.otCompiler.ir.flux;

import org.dgflux.util.IWritesLogs;
import org.dgflux.util.Linq;

import java.util.List;
import java.util.function.Function;

/** Rebuilds a flux expression bottom-up.
 * The default methods return the original node when nothing below it changed.
 * Subclasses override the methods for the nodes they replace. */
public class FluxRewriter implements Function<FluxExpression, FluxExpression>, IWritesLogs {
    /** If true, arithmetic nodes are rebuilt with their zero-folding factories. */
    protected final boolean simplify;

    public FluxRewriter(boolean simplify) {
        this.simplify = simplify;
    }

    @Override
    public FluxExpression apply(FluxExpression expression) {
        return expression.rewrite(this);
    }

    List<FluxExpression> applyAll(List<FluxExpression> expressions) {
        return Linq.map(expressions, this::apply);
    }

    public FluxExpression rewrite(FluxFieldComponent expression) {
        return expression;
    }

    public FluxExpression rewrite(FluxNormal expression) {
        return expression;
    }

    public FluxExpression rewrite(FluxConstant expression) {
        return expression;
    }

    public FluxExpression rewrite(FluxScalarParameter expression) {
        return expression;
    }

    public FluxExpression rewrite(FluxSum expression) {
        List<FluxExpression> terms = this.applyAll(expression.terms);
        if (!this.simplify) {
            if (terms.equals(expression.terms))
                return expression;
            return new FluxSum(terms);
        }
        return FluxSum.create(terms);
    }

    public FluxExpression rewrite(FluxProduct expression) {
        List<FluxExpression> factors = this.applyAll(expression.factors);
        if (!this.simplify) {
            if (factors.equals(expression.factors))
                return expression;
            return new FluxProduct(factors);
        }
        return FluxProduct.create(factors);
    }

    public FluxExpression rewrite(FluxQuotient expression) {
        FluxExpression numerator = this.apply(expression.numerator);
        FluxExpression denominator = this.apply(expression.denominator);
        if (this.simplify)
            return FluxQuotient.create(numerator, denominator);
        if (numerator == expression.numerator && denominator == expression.denominator)
            return expression;
        return new FluxQuotient(numerator, denominator);
    }

    public FluxExpression rewrite(FluxPower expression) {
        FluxExpression base = this.apply(expression.base);
        FluxExpression exponent = this.apply(expression.exponent);
        if (base == expression.base && exponent == expression.exponent)
            return expression;
        return new FluxPower(base, exponent);
    }

    public FluxExpression rewrite(FluxCall expression) {
        List<FluxExpression> parameters = this.applyAll(expression.parameters);
        if (parameters.equals(expression.parameters))
            return expression;
        return new FluxCall(expression.function, parameters);
    }
}
