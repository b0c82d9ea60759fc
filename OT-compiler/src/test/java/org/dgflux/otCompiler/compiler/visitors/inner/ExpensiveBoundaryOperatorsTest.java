package org.dgflux.otCompiler.compiler.visitors.inner;

import org.dgflux.otCompiler.compiler.OTTestBase;
import org.dgflux.otCompiler.compiler.errors.IllegalBoundaryOperatorError;
import org.dgflux.otCompiler.compiler.errors.UnsupportedOperatorException;
import org.dgflux.otCompiler.ir.expression.OTBoundaryNormalComponent;
import org.dgflux.otCompiler.ir.expression.OTConstant;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTFluxExchange;
import org.dgflux.otCompiler.ir.expression.OTVariable;
import org.dgflux.otCompiler.ir.operator.OTFluxExchangeOperator;
import org.dgflux.otCompiler.ir.operator.OTOpaqueOperator;
import org.dgflux.otCompiler.ir.operator.OTQuadratureBoundaryGridUpsampler;
import org.dgflux.otCompiler.ir.operator.OTQuadratureGridUpsampler;
import org.dgflux.otCompiler.ir.operator.OTQuadratureInteriorFacesGridUpsampler;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class ExpensiveBoundaryOperatorsTest extends OTTestBase {
    final ExpensiveBoundaryOperators detector = new ExpensiveBoundaryOperators(testCompiler());

    @Test
    public void cheapExpressions() {
        OTVariable u = var("u");
        Assert.assertFalse(this.detector.isExpensive(u));
        Assert.assertFalse(this.detector.isExpensive(new OTConstant(2).times(u)));
        Assert.assertFalse(this.detector.isExpensive(restrict(u, WALL).negate()));
        Assert.assertFalse(this.detector.isExpensive(
                restrict(u, WALL).times(new OTBoundaryNormalComponent(WALL, 1))));
    }

    @Test
    public void expensiveOperators() {
        OTVariable u = var("u");
        Assert.assertTrue(this.detector.isExpensive(new OTFluxExchangeOperator(0, 1).bind(u)));
        Assert.assertTrue(this.detector.isExpensive(new OTQuadratureGridUpsampler("q").bind(u)));
        Assert.assertTrue(this.detector.isExpensive(new OTQuadratureInteriorFacesGridUpsampler("q").bind(u)));
        Assert.assertTrue(this.detector.isExpensive(
                new OTQuadratureBoundaryGridUpsampler("q", WALL).bind(restrict(u, WALL))));
        Assert.assertTrue(this.detector.isExpensive(new OTFluxExchange(0, 1, List.of(u))));
    }

    @Test
    public void expensiveAnywhereBelow() {
        OTVariable u = var("u");
        OTExpression upsampled = new OTQuadratureGridUpsampler("q").bind(u);
        OTExpression expression = restrict(u, WALL).plus(new OTConstant(2).times(upsampled));
        Assert.assertTrue(this.detector.isExpensive(expression));
        // cached results are still combined correctly
        Assert.assertTrue(this.detector.isExpensive(restrict(u, WALL).minus(upsampled)));
        Assert.assertFalse(this.detector.isExpensive(restrict(u, WALL).times(new OTConstant(2))));
    }

    @Test
    public void sharedSubexpressionsAreCheap() {
        OTVariable u = var("u");
        OTExpression upsampled = new OTQuadratureGridUpsampler("q").bind(u);
        Assert.assertFalse(this.detector.isExpensive(upsampled.cse()));
        Assert.assertFalse(this.detector.isExpensive(upsampled.cse().plus(restrict(u, WALL))));
    }

    @Test
    public void illegalOperators() {
        OTVariable u = var("u");
        Assert.assertThrows(IllegalBoundaryOperatorError.class, () -> this.detector.isExpensive(diff(u)));
        Assert.assertThrows(UnsupportedOperatorException.class,
                () -> this.detector.isExpensive(new OTOpaqueOperator("limiter").bind(u)));
    }
}
