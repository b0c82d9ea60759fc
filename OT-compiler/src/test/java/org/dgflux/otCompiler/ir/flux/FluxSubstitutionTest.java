package org.dgflux.otCompiler.ir.flux;

import org.dgflux.otCompiler.compiler.errors.InternalCompilerError;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class FluxSubstitutionTest {
    static final FluxExpression INT0 = FluxFieldComponent.interior(0);
    static final FluxExpression EXT0 = FluxFieldComponent.exterior(0);
    static final FluxExpression EXT1 = FluxFieldComponent.exterior(1);

    @Test
    public void replacesExteriorComponents() {
        FluxExpression flux = INT0.minus(EXT1).times(new FluxNormal(0));
        FluxSubstitution substitution = new FluxSubstitution(
                List.of(new FluxScalarParameter("g"), FluxFieldComponent.interior(2)), true);
        FluxExpression expected = INT0.minus(FluxFieldComponent.interior(2)).times(new FluxNormal(0));
        Assert.assertEquals(expected, substitution.apply(flux));
    }

    @Test
    public void unchangedTreeIsKept() {
        FluxExpression flux = new FluxPower(INT0, new FluxConstant(2));
        FluxSubstitution substitution = new FluxSubstitution(List.of(), false);
        Assert.assertSame(flux, substitution.apply(flux));
    }

    @Test
    public void zerosAreFolded() {
        FluxSubstitution substitution = new FluxSubstitution(List.of(new FluxConstant(0)), true);
        Assert.assertTrue(substitution.apply(EXT0.times(new FluxNormal(1))).isZero());
        Assert.assertEquals(INT0, substitution.apply(INT0.plus(EXT0)));
        Assert.assertTrue(substitution.apply(new FluxQuotient(EXT0, INT0)).isZero());
    }

    @Test
    public void zerosAreKeptWithoutSimplification() {
        FluxSubstitution substitution = new FluxSubstitution(List.of(new FluxConstant(0)), false);
        FluxExpression result = substitution.apply(EXT0.times(new FluxNormal(1)));
        Assert.assertFalse(result.isZero());
        Assert.assertEquals(new FluxProduct(new FluxConstant(0), new FluxNormal(1)), result);
    }

    @Test
    public void callsAreRewritten() {
        FluxSubstitution substitution = new FluxSubstitution(List.of(INT0), true);
        Assert.assertEquals(new FluxCall("abs", List.of(INT0)),
                substitution.apply(new FluxCall("abs", List.of(EXT0))));
    }

    @Test
    public void missingBoundaryValue() {
        FluxSubstitution substitution = new FluxSubstitution(List.of(INT0), true);
        Assert.assertThrows(InternalCompilerError.class, () -> substitution.apply(EXT1));
    }
}
