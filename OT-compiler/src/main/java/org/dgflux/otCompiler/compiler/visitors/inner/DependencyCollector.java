package org.dgflux.otCompiler.compiler.visitors.inner;

import org.dgflux.otCompiler.compiler.OTCompiler;
import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.ir.IOTInnerNode;
import org.dgflux.otCompiler.ir.expression.OTCallExpression;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTFluxExchange;
import org.dgflux.otCompiler.ir.expression.OTOperatorBinding;
import org.dgflux.otCompiler.ir.expression.OTScalarParameter;
import org.dgflux.otCompiler.ir.expression.OTSubscriptExpression;
import org.dgflux.otCompiler.ir.expression.OTVariable;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Discovers the free variables of an expression.
 * Operator bindings, subscripts and flux exchanges are dependencies as a whole;
 * the visitor does not look inside them.  Common subexpressions are transparent.
 */
public class DependencyCollector extends InnerVisitor {
    final Set<OTExpression> dependencies;
    /** If true a call is a dependency; otherwise only its arguments are. */
    final boolean callsAsDependencies;

    public DependencyCollector(OTCompiler compiler, boolean callsAsDependencies) {
        super(compiler);
        this.dependencies = new LinkedHashSet<>();
        this.callsAsDependencies = callsAsDependencies;
    }

    /** Dependencies of 'expression', in the order they are first found. */
    public Set<OTExpression> collect(OTExpression expression) {
        this.apply(expression);
        return new LinkedHashSet<>(this.dependencies);
    }

    @Override
    public void startVisit(IOTInnerNode node) {
        super.startVisit(node);
        this.dependencies.clear();
    }

    @Override
    public void postorder(OTVariable node) {
        this.dependencies.add(node);
    }

    @Override
    public void postorder(OTScalarParameter node) {
        this.dependencies.add(node);
    }

    @Override
    public VisitDecision preorder(OTSubscriptExpression node) {
        this.dependencies.add(node);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTFluxExchange node) {
        this.dependencies.add(node);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTOperatorBinding node) {
        this.dependencies.add(node);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(OTCallExpression node) {
        if (this.callsAsDependencies) {
            this.dependencies.add(node);
            return VisitDecision.STOP;
        }
        return VisitDecision.CONTINUE;
    }
}
