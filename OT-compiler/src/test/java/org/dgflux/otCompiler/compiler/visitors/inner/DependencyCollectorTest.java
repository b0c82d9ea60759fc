package org.dgflux.otCompiler.compiler.visitors.inner;

import org.dgflux.otCompiler.compiler.OTTestBase;
import org.dgflux.otCompiler.ir.expression.OTCallExpression;
import org.dgflux.otCompiler.ir.expression.OTConstant;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTFluxExchange;
import org.dgflux.otCompiler.ir.expression.OTOperatorBinding;
import org.dgflux.otCompiler.ir.expression.OTScalarParameter;
import org.dgflux.otCompiler.ir.expression.OTSubscriptExpression;
import org.dgflux.otCompiler.ir.expression.OTVariable;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Set;

public class DependencyCollectorTest extends OTTestBase {
    static Set<OTExpression> collect(OTExpression expression, boolean calls) {
        return new DependencyCollector(testCompiler(), calls).collect(expression);
    }

    @Test
    public void variablesAndBindings() {
        OTVariable u = var("u");
        OTVariable v = var("v");
        OTVariable w = var("w");
        OTOperatorBinding restricted = restrict(w, WALL);
        OTExpression expression = u.plus(v.times(restricted)).plus(new OTConstant(1));
        Assert.assertEquals(Set.of(u, v, restricted), collect(expression, false));
    }

    @Test
    public void wholeNodesAreDependencies() {
        OTVariable q = var("q");
        OTSubscriptExpression component = q.subscript(1);
        OTFluxExchange exchange = new OTFluxExchange(0, 1, List.of(var("u")));
        OTScalarParameter dt = new OTScalarParameter("dt");
        Assert.assertEquals(Set.of(component, exchange, dt),
                collect(component.times(exchange).times(dt), true));
    }

    @Test
    public void calls() {
        OTVariable u = var("u");
        OTCallExpression call = new OTCallExpression("sqrt", u);
        Assert.assertEquals(Set.of(call), collect(call, true));
        Assert.assertEquals(Set.of(u), collect(call, false));
    }

    @Test
    public void sharedSubexpressionsAreTransparent() {
        OTVariable u = var("u");
        Assert.assertEquals(Set.of(u), collect(u.plus(new OTConstant(1)).cse(), true));
    }

    @Test
    public void collectorCanBeReused() {
        DependencyCollector collector = new DependencyCollector(testCompiler(), true);
        Assert.assertEquals(Set.of(var("a")), collector.collect(var("a")));
        Assert.assertEquals(Set.of(var("b")), collector.collect(var("b")));
    }
}
