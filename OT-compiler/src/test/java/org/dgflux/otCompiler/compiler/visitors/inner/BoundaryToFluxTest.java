package org.dgflux.otCompiler.compiler.visitors.inner;

import org.dgflux.otCompiler.compiler.CompilerOptions;
import org.dgflux.otCompiler.compiler.OTCompiler;
import org.dgflux.otCompiler.compiler.OTTestBase;
import org.dgflux.otCompiler.compiler.errors.AliasedDomainVariableError;
import org.dgflux.otCompiler.compiler.errors.IllegalBoundaryOperatorError;
import org.dgflux.otCompiler.compiler.errors.TagMismatchError;
import org.dgflux.otCompiler.ir.expression.OTBoundaryPair;
import org.dgflux.otCompiler.ir.expression.OTCommonSubexpression;
import org.dgflux.otCompiler.ir.expression.OTConstant;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTNormal;
import org.dgflux.otCompiler.ir.expression.OTOperatorBinding;
import org.dgflux.otCompiler.ir.expression.OTScalarParameter;
import org.dgflux.otCompiler.ir.expression.OTVariable;
import org.dgflux.otCompiler.ir.expression.OTVectorExpression;
import org.dgflux.otCompiler.ir.flux.FluxConstant;
import org.dgflux.otCompiler.ir.flux.FluxExpression;
import org.dgflux.otCompiler.ir.flux.FluxFieldComponent;
import org.dgflux.otCompiler.ir.flux.FluxNormal;
import org.dgflux.otCompiler.ir.flux.FluxProduct;
import org.dgflux.otCompiler.ir.operator.OTFluxExchangeOperator;
import org.dgflux.otCompiler.ir.operator.OTFluxOperator;
import org.dgflux.otCompiler.ir.operator.OTFluxOperatorBase;
import org.dgflux.otCompiler.ir.operator.OTQuadratureBoundaryGridUpsampler;
import org.dgflux.otCompiler.ir.operator.OTQuadratureFluxOperator;
import org.dgflux.otCompiler.ir.type.BoundaryTag;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class BoundaryToFluxTest extends OTTestBase {
    static OTExpression rewrite(OTExpression template) {
        return new BoundaryToFlux(testCompiler()).rewrite(template);
    }

    static OTBoundaryPair pairOf(OTExpression rewritten) {
        return rewritten.to(OTOperatorBinding.class).field.to(OTBoundaryPair.class);
    }

    static FluxExpression fluxOf(OTExpression rewritten) {
        return rewritten.to(OTOperatorBinding.class).operator.to(OTFluxOperatorBase.class).flux;
    }

    @Test
    public void restrictedVolumeDataMovesIntoKernel() {
        OTVariable u = var("u");
        OTExpression template = fluxOnBoundary(centralFlux(), u, restrict(u, WALL).negate(), WALL);
        OTExpression result = rewrite(template);

        OTBoundaryPair pair = pairOf(result);
        Assert.assertEquals(List.of(u), pair.volumeFields);
        Assert.assertTrue(pair.boundaryFields.isEmpty());
        Assert.assertEquals(WALL, pair.tag);

        FluxExpression interior = FluxFieldComponent.interior(0);
        FluxExpression expected = interior
                .plus(new FluxProduct(new FluxConstant(-1), interior))
                .times(0.5)
                .times(new FluxNormal(0));
        Assert.assertEquals(expected, fluxOf(result));
    }

    @Test
    public void boundaryDataStaysInput() {
        OTVariable u = var("u");
        OTVariable g = var("g");
        OTExpression template = fluxOnBoundary(centralFlux(), u, g, WALL);
        OTExpression result = rewrite(template);
        Assert.assertSame(template, result);
    }

    @Test
    public void restrictedFieldBecomesNewInteriorInput() {
        OTVariable u = var("u");
        OTVariable v = var("v");
        OTExpression template = fluxOnBoundary(
                FluxFieldComponent.exterior(0), u, restrict(v, WALL), WALL);
        OTExpression result = rewrite(template);
        OTBoundaryPair pair = pairOf(result);
        Assert.assertEquals(List.of(u, v), pair.volumeFields);
        Assert.assertTrue(pair.boundaryFields.isEmpty());
        Assert.assertEquals(FluxFieldComponent.interior(1), fluxOf(result));
    }

    @Test
    public void zeroFluxCollapses() {
        OTVariable u = var("u");
        OTVariable v = var("v");
        FluxExpression flux = FluxFieldComponent.exterior(0).times(new FluxNormal(0));
        OTExpression template = v.plus(fluxOnBoundary(flux, u, new OTConstant(0), WALL));
        OTExpression result = rewrite(template);
        Assert.assertEquals(v.plus(OTConstant.zero()), result);
    }

    @Test
    public void zeroBoundaryFactorCollapses() {
        OTVariable u = var("u");
        FluxExpression flux = FluxFieldComponent.exterior(0).times(new FluxNormal(0));
        OTExpression template = fluxOnBoundary(flux, u, new OTConstant(0).times(restrict(u, WALL)), WALL);
        Assert.assertEquals(OTConstant.zero(), rewrite(template));
    }

    @Test
    public void zeroFoldingCanBeDisabled() {
        CompilerOptions options = new CompilerOptions();
        options.languageOptions.noFluxSimplify = true;
        OTVariable u = var("u");
        FluxExpression flux = FluxFieldComponent.exterior(0).times(new FluxNormal(0));
        OTExpression template = fluxOnBoundary(flux, u, new OTConstant(0), WALL);
        OTExpression result = new BoundaryToFlux(new OTCompiler(options)).rewrite(template);
        Assert.assertEquals(new FluxProduct(new FluxConstant(0), new FluxNormal(0)), fluxOf(result));
        Assert.assertTrue(pairOf(result).boundaryFields.isEmpty());
    }

    @Test
    public void expensiveSubexpressionIsFetchedOnce() {
        OTVariable u = var("u");
        BoundaryTag rank1 = BoundaryTag.forRank(1);
        OTCommonSubexpression exchanged = new OTFluxExchangeOperator(0, 1).bind(u).cse("x");
        OTExpression boundaryField = exchanged.plus(exchanged.times(new OTConstant(2)));
        OTExpression template = fluxOnBoundary(centralFlux(), u, boundaryField, rank1);
        OTExpression result = rewrite(template);

        OTBoundaryPair pair = pairOf(result);
        Assert.assertEquals(List.of(u), pair.volumeFields);
        Assert.assertEquals(List.of(exchanged), pair.boundaryFields);
        Assert.assertEquals(rank1, pair.tag);
    }

    @Test
    public void cheapSubexpressionIsInlined() {
        OTVariable u = var("u");
        OTCommonSubexpression restricted = restrict(u, WALL).cse();
        OTExpression template = fluxOnBoundary(
                FluxFieldComponent.exterior(0), u, restricted.times(new OTConstant(3)), WALL);
        OTExpression result = rewrite(template);
        Assert.assertTrue(pairOf(result).boundaryFields.isEmpty());
        Assert.assertEquals(new FluxProduct(FluxFieldComponent.interior(0), new FluxConstant(3)),
                fluxOf(result));
    }

    @Test
    public void sameFieldOnBothSidesIsAliasing() {
        OTVariable u = var("u");
        OTExpression template = fluxOnBoundary(centralFlux(), u, u, WALL);
        AliasedDomainVariableError error = Assert.assertThrows(AliasedDomainVariableError.class,
                () -> rewrite(template));
        Assert.assertEquals(1, error.shared.size());
        Assert.assertTrue(error.shared.contains(u));
    }

    @Test
    public void sharedRestrictionIsAliasing() {
        OTVariable u = var("u");
        OTOperatorBinding restricted = restrict(u, WALL);
        OTExpression template = fluxOnBoundary(centralFlux(), restricted, restricted.negate(), WALL);
        AliasedDomainVariableError error = Assert.assertThrows(AliasedDomainVariableError.class,
                () -> rewrite(template));
        Assert.assertEquals(1, error.shared.size());
        Assert.assertTrue(error.shared.contains(restricted));
    }

    @Test
    public void sharedScalarParameterIsAliasing() {
        OTVariable u = var("u");
        OTScalarParameter g = new OTScalarParameter("g");
        OTExpression template = fluxOnBoundary(centralFlux(), u.times(g), restrict(u, WALL).times(g), WALL);
        AliasedDomainVariableError error = Assert.assertThrows(AliasedDomainVariableError.class,
                () -> rewrite(template));
        Assert.assertEquals(1, error.shared.size());
        Assert.assertTrue(error.shared.contains(g));
    }

    @Test
    public void bareNormalInBoundaryData() {
        OTVariable u = var("u");
        OTExpression template = fluxOnBoundary(centralFlux(), u,
                new OTNormal(0).times(restrict(u, WALL)), WALL);
        Assert.assertThrows(IllegalBoundaryOperatorError.class, () -> rewrite(template));
    }

    @Test
    public void volumeOperatorInBoundaryData() {
        OTVariable u = var("u");
        OTVariable v = var("v");
        OTExpression template = fluxOnBoundary(centralFlux(), u, diff(v), WALL);
        Assert.assertThrows(IllegalBoundaryOperatorError.class, () -> rewrite(template));
    }

    @Test
    public void tagMismatch() {
        OTVariable u = var("u");
        OTExpression template = fluxOnBoundary(centralFlux(), u, restrict(u, INFLOW), WALL);
        TagMismatchError error = Assert.assertThrows(TagMismatchError.class, () -> rewrite(template));
        Assert.assertEquals(INFLOW, error.tag);
        Assert.assertEquals(WALL, error.pairTag);

        OTExpression upsampled = fluxOnBoundary(centralFlux(), u,
                new OTQuadratureBoundaryGridUpsampler("q", INFLOW).bind(restrict(u, INFLOW)), WALL);
        Assert.assertThrows(TagMismatchError.class, () -> rewrite(upsampled));
    }

    @Test
    public void otherExpressionsAreUnchanged() {
        OTVariable u = var("u");
        OTExpression template = new OTVectorExpression(
                diff(u).plus(new OTConstant(1)),
                new OTFluxOperator(centralFlux()).bind(u));
        Assert.assertSame(template, rewrite(template));
    }

    @Test
    public void rewritesInsideSubexpressions() {
        OTVariable u = var("u");
        OTExpression flux = fluxOnBoundary(FluxFieldComponent.exterior(0), u, restrict(u, WALL), WALL);
        OTCommonSubexpression c = flux.cse();
        OTExpression template = c.plus(diff(c));
        OTExpression result = rewrite(template);

        OTExpression expectedFlux = new OTFluxOperator(FluxFieldComponent.interior(0))
                .bind(new OTBoundaryPair(List.of(u), List.of(), WALL));
        OTCommonSubexpression expected = c.withChild(expectedFlux);
        Assert.assertEquals(expected.plus(diff(expected)), result);
    }

    @Test
    public void operatorParametersArePreserved() {
        OTVariable u = var("u");
        OTExpression template = new OTQuadratureFluxOperator(FluxFieldComponent.exterior(0), "q", true)
                .bind(OTBoundaryPair.of(u, restrict(u, WALL), WALL));
        OTQuadratureFluxOperator rewritten = rewrite(template)
                .to(OTOperatorBinding.class).operator.to(OTQuadratureFluxOperator.class);
        Assert.assertEquals("q", rewritten.quadratureTag);
        Assert.assertTrue(rewritten.isLift);
        Assert.assertEquals(FluxFieldComponent.interior(0), rewritten.flux);
    }
}
