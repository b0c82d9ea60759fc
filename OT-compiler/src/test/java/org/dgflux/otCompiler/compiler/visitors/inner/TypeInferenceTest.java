package org.dgflux.otCompiler.compiler.visitors.inner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.dgflux.otCompiler.compiler.CompilerOptions;
import org.dgflux.otCompiler.compiler.OTCompiler;
import org.dgflux.otCompiler.compiler.OTTestBase;
import org.dgflux.otCompiler.compiler.errors.CompilationError;
import org.dgflux.otCompiler.compiler.errors.IncompleteInferenceError;
import org.dgflux.otCompiler.compiler.errors.TypeConflictError;
import org.dgflux.otCompiler.compiler.errors.UnsupportedOperatorException;
import org.dgflux.otCompiler.ir.expression.OTBoundaryNormalComponent;
import org.dgflux.otCompiler.ir.expression.OTBoundaryPair;
import org.dgflux.otCompiler.ir.expression.OTCallExpression;
import org.dgflux.otCompiler.ir.expression.OTCommonSubexpression;
import org.dgflux.otCompiler.ir.expression.OTComparisonExpression;
import org.dgflux.otCompiler.ir.expression.OTConstant;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTFluxExchange;
import org.dgflux.otCompiler.ir.expression.OTGeometricFactor;
import org.dgflux.otCompiler.ir.expression.OTIfExpression;
import org.dgflux.otCompiler.ir.expression.OTIfPositiveExpression;
import org.dgflux.otCompiler.ir.expression.OTNormal;
import org.dgflux.otCompiler.ir.expression.OTOnes;
import org.dgflux.otCompiler.ir.expression.OTOperatorBinding;
import org.dgflux.otCompiler.ir.expression.OTScalarParameter;
import org.dgflux.otCompiler.ir.expression.OTVariable;
import org.dgflux.otCompiler.ir.expression.OTVectorExpression;
import org.dgflux.otCompiler.ir.expression.OTWholeDomainFlux;
import org.dgflux.otCompiler.ir.operator.OTElementwiseLinearOperator;
import org.dgflux.otCompiler.ir.operator.OTElementwiseMaxOperator;
import org.dgflux.otCompiler.ir.operator.OTFluxExchangeOperator;
import org.dgflux.otCompiler.ir.operator.OTFluxOperator;
import org.dgflux.otCompiler.ir.operator.OTMassOperator;
import org.dgflux.otCompiler.ir.operator.OTNodalReductionOperator;
import org.dgflux.otCompiler.ir.operator.OTOpaqueOperator;
import org.dgflux.otCompiler.ir.operator.OTQuadratureBoundaryGridUpsampler;
import org.dgflux.otCompiler.ir.operator.OTQuadratureGridUpsampler;
import org.dgflux.otCompiler.ir.operator.OTQuadratureInteriorFacesGridUpsampler;
import org.dgflux.otCompiler.ir.operator.OTQuadratureMassOperator;
import org.dgflux.otCompiler.ir.operator.OTQuadratureStiffnessTOperator;
import org.dgflux.otCompiler.ir.operator.OTStiffnessTOperator;
import org.dgflux.otCompiler.ir.type.BoundaryTag;
import org.dgflux.otCompiler.ir.type.BoundaryVector;
import org.dgflux.otCompiler.ir.type.InteriorFacesVector;
import org.dgflux.otCompiler.ir.type.KnownVolume;
import org.dgflux.otCompiler.ir.type.NodalRepresentation;
import org.dgflux.otCompiler.ir.type.QuadratureRepresentation;
import org.dgflux.otCompiler.ir.type.Scalar;
import org.dgflux.otCompiler.ir.type.TypeInfo;
import org.dgflux.otCompiler.ir.type.VolumeVector;
import org.dgflux.util.Utilities;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;

public class TypeInferenceTest extends OTTestBase {
    static final QuadratureRepresentation QUAD = new QuadratureRepresentation("q");

    static TypeDict infer(OTExpression template) {
        return new TypeInference(testCompiler()).infer(template);
    }

    @Test
    public void scalarDoesNotMakeSumScalar() {
        OTVariable x = var("x");
        OTConstant one = new OTConstant(1);
        OTExpression sum = x.plus(one);
        TypeDict types = infer(sum);
        Assert.assertEquals(VolumeVector.nodal(), types.get(x));
        Assert.assertEquals(VolumeVector.nodal(), types.get(sum));
        Assert.assertEquals(new Scalar(), types.get(one));
    }

    @Test
    public void scalarExpression() {
        OTExpression product = new OTConstant(2).times(new OTScalarParameter("dt"));
        TypeDict types = infer(product);
        Assert.assertEquals(new Scalar(), types.get(product));
        Assert.assertEquals(new Scalar(), types.get(new OTScalarParameter("dt")));
    }

    @Test
    public void conditionalsAndCalls() {
        OTVariable u = var("u");
        OTVariable v = var("v");
        OTScalarParameter dt = new OTScalarParameter("dt");
        OTExpression condition = new OTComparisonExpression(
                u, OTComparisonExpression.ComparisonOperator.GE, new OTConstant(0));
        OTExpression choice = new OTIfExpression(condition, v, new OTConstant(1));
        OTExpression positive = new OTIfPositiveExpression(dt, new OTCallExpression("abs", v), new OTConstant(0));
        OTExpression scalarChoice = new OTIfExpression(
                new OTComparisonExpression(dt, OTComparisonExpression.ComparisonOperator.GE, new OTConstant(0)),
                new OTConstant(1), new OTConstant(2));
        TypeDict types = infer(new OTVectorExpression(choice, positive, scalarChoice));

        Assert.assertEquals(VolumeVector.nodal(), types.get(condition));
        Assert.assertEquals(VolumeVector.nodal(), types.get(choice));
        Assert.assertEquals(VolumeVector.nodal(), types.get(u));
        Assert.assertEquals(VolumeVector.nodal(), types.get(positive));
        Assert.assertEquals(new Scalar(), types.get(dt));
        Assert.assertEquals(new Scalar(), types.get(scalarChoice));
    }

    @Test
    public void inferenceIsIdempotent() {
        OTVariable u = var("u");
        OTCommonSubexpression c = u.plus(new OTConstant(1)).cse("c");
        OTExpression template = new OTVectorExpression(
                diff(c).plus(c),
                fluxOnBoundary(centralFlux(), u, restrict(u, WALL).negate(), WALL));
        TypeDict first = infer(template);
        TypeDict second = new TypeInference(testCompiler()).infer(template, first.asMap());
        Assert.assertEquals(0, second.getChangeCount());
        Assert.assertEquals(first.asMap(), second.asMap());
    }

    @Test
    public void rootOrderDoesNotMatter() {
        OTVariable u = var("u");
        OTVariable v = var("v");
        OTExpression upsampled = new OTQuadratureGridUpsampler("q").bind(u);
        OTExpression first = upsampled.plus(new OTOnes("q"));
        OTExpression second = restrict(v, WALL).times(new OTBoundaryNormalComponent(WALL, 0));

        TypeDict forward = infer(new OTVectorExpression(first, second));
        TypeDict backward = infer(new OTVectorExpression(second, first));
        Assert.assertEquals(forward.asMap(), backward.asMap());

        Assert.assertEquals(VolumeVector.nodal(), forward.get(u));
        Assert.assertEquals(new VolumeVector(QUAD), forward.get(upsampled));
        Assert.assertEquals(new VolumeVector(QUAD), forward.get(first));
        Assert.assertEquals(VolumeVector.nodal(), forward.get(v));
        Assert.assertEquals(new BoundaryVector(WALL, NodalRepresentation.INSTANCE), forward.get(second));
    }

    @Test
    public void commonSubexpressionTakesOuterType() {
        OTVariable u = var("u");
        OTExpression body = u.plus(new OTConstant(1));
        OTCommonSubexpression c = body.cse();
        OTExpression template = diff(c).plus(c);
        TypeDict types = infer(template);
        Assert.assertEquals(VolumeVector.nodal(), types.get(c));
        Assert.assertEquals(VolumeVector.nodal(), types.get(body));
        Assert.assertEquals(VolumeVector.nodal(), types.get(u));
        Assert.assertEquals(VolumeVector.nodal(), types.get(template));
    }

    @Test
    public void defaultedVariableReachesSubexpression() {
        OTVariable x = var("x");
        OTCommonSubexpression c = x.cse();
        OTExpression sum = c.plus(new OTConstant(1));
        TypeDict types = infer(sum);
        Assert.assertEquals(VolumeVector.nodal(), types.get(x));
        Assert.assertEquals(VolumeVector.nodal(), types.get(c));
        Assert.assertEquals(VolumeVector.nodal(), types.get(sum));

        OTExpression body = x.plus(new OTConstant(1));
        OTCommonSubexpression wrapped = body.cse();
        types = infer(wrapped);
        Assert.assertEquals(VolumeVector.nodal(), types.get(body));
        Assert.assertEquals(VolumeVector.nodal(), types.get(wrapped));
    }

    @Test
    public void subexpressionSeesOtherRoots() {
        OTVariable x = var("x");
        OTExpression shared = x.cse().plus(new OTConstant(1));
        OTExpression differentiated = diff(x);
        TypeDict forward = infer(new OTVectorExpression(shared, differentiated));
        TypeDict backward = infer(new OTVectorExpression(differentiated, shared));
        Assert.assertEquals(forward.asMap(), backward.asMap());
        Assert.assertEquals(VolumeVector.nodal(), forward.get(shared));

        // The refined node is below the root of the shared body
        OTExpression body = x.plus(new OTConstant(1));
        OTCommonSubexpression deep = body.cse();
        forward = infer(new OTVectorExpression(deep, differentiated));
        backward = infer(new OTVectorExpression(differentiated, deep));
        Assert.assertEquals(forward.asMap(), backward.asMap());
        Assert.assertEquals(VolumeVector.nodal(), forward.get(body));
    }

    @Test
    public void fluxOnBoundaryPair() {
        OTVariable u = var("u");
        OTOperatorBinding restricted = restrict(u, WALL);
        OTExpression boundaryField = restricted.negate();
        OTExpression flux = fluxOnBoundary(centralFlux(), u, boundaryField, WALL);
        TypeDict types = infer(flux);
        BoundaryVector onWall = new BoundaryVector(WALL, NodalRepresentation.INSTANCE);
        Assert.assertEquals(VolumeVector.nodal(), types.get(flux));
        Assert.assertEquals(VolumeVector.nodal(), types.get(u));
        Assert.assertEquals(onWall, types.get(restricted));
        Assert.assertEquals(onWall, types.get(boundaryField));
    }

    @Test
    public void quadratureFluxArgumentsShareRepresentation() {
        OTVariable u = var("u");
        OTVariable v = var("v");
        OTExpression uq = new OTQuadratureInteriorFacesGridUpsampler("q").bind(u);
        OTExpression vq = new OTQuadratureInteriorFacesGridUpsampler("q").bind(v);
        OTExpression flux = new OTFluxOperator(centralFlux())
                .bind(new OTVectorExpression(uq, vq));
        TypeDict types = infer(flux);
        Assert.assertEquals(new InteriorFacesVector(QUAD), types.get(uq));
        Assert.assertEquals(new InteriorFacesVector(QUAD), types.get(vq));
        Assert.assertEquals(VolumeVector.nodal(), types.get(flux));
    }

    @Test
    public void wholeDomainFlux() {
        OTVariable u = var("u");
        OTExpression flux = new OTWholeDomainFlux(List.of(u),
                List.of(OTBoundaryPair.of(u, restrict(u, WALL), WALL)), false);
        TypeDict types = infer(flux);
        Assert.assertEquals(VolumeVector.nodal(), types.get(flux));
        Assert.assertEquals(new BoundaryVector(WALL, NodalRepresentation.INSTANCE), types.get(restrict(u, WALL)));
    }

    @Test
    public void operatorRules() {
        OTVariable u = var("u");
        OTExpression reduction = new OTNodalReductionOperator(OTNodalReductionOperator.ReductionKind.SUM).bind(u);
        OTExpression upsampled = new OTQuadratureGridUpsampler("q").bind(u);
        OTExpression quadratureMass = new OTQuadratureMassOperator("q").bind(upsampled);
        OTExpression mass = new OTMassOperator(OTMassOperator.Kind.MASS).bind(u);
        OTExpression max = new OTElementwiseMaxOperator().bind(u);
        OTExpression boundaryUpsampled = new OTQuadratureBoundaryGridUpsampler("q", WALL).bind(restrict(u, WALL));

        TypeDict types = infer(new OTVectorExpression(
                reduction, quadratureMass, mass, max, boundaryUpsampled));
        Assert.assertEquals(new Scalar(), types.get(reduction));
        Assert.assertEquals(new VolumeVector(QUAD), types.get(upsampled));
        Assert.assertEquals(VolumeVector.nodal(), types.get(quadratureMass));
        Assert.assertEquals(VolumeVector.nodal(), types.get(mass));
        Assert.assertEquals(VolumeVector.nodal(), types.get(max));
        Assert.assertEquals(new BoundaryVector(WALL, QUAD), types.get(boundaryUpsampled));
        Assert.assertEquals(VolumeVector.nodal(), types.get(u));
    }

    @Test
    public void fluxExchangeLeaf() {
        OTVariable u = var("u");
        OTFluxExchange exchange = new OTFluxExchange(0, 2, List.of(u));
        TypeDict types = infer(exchange);
        Assert.assertEquals(new BoundaryVector(BoundaryTag.forRank(2), NodalRepresentation.INSTANCE),
                types.get(exchange));
        Assert.assertEquals(VolumeVector.nodal(), types.get(u));
    }

    @Test
    public void hintsAreRespected() {
        OTVariable u = var("u");
        OTExpression template = u.times(new OTConstant(2));
        TypeInfo onWall = new BoundaryVector(WALL, NodalRepresentation.INSTANCE);
        TypeDict types = new TypeInference(testCompiler()).infer(template, Map.of(u, onWall));
        Assert.assertEquals(onWall, types.get(template));
    }

    @Test
    public void conflictingHint() {
        OTVariable u = var("u");
        TypeInference inference = new TypeInference(testCompiler());
        Assert.assertThrows(TypeConflictError.class, () -> inference.infer(
                diff(u), Map.of(u, new BoundaryVector(WALL, NodalRepresentation.INSTANCE))));
    }

    @Test
    public void boundaryDataIsNotVolumeData() {
        OTVariable u = var("u");
        Assert.assertThrows(TypeConflictError.class, () -> infer(diff(restrict(u, WALL))));
    }

    @Test
    public void incompleteInference() {
        OTGeometricFactor jacobian = OTGeometricFactor.jacobian();
        IncompleteInferenceError error = Assert.assertThrows(IncompleteInferenceError.class,
                () -> infer(jacobian));
        Assert.assertEquals(new KnownVolume(), error.partialType);
        Assert.assertEquals(jacobian, error.getNode());
    }

    @Test
    public void finalCheckCanBeDisabled() {
        CompilerOptions options = new CompilerOptions();
        options.languageOptions.noFinalCheck = true;
        OTGeometricFactor jacobian = OTGeometricFactor.jacobian();
        TypeDict types = new TypeInference(new OTCompiler(options)).infer(jacobian);
        Assert.assertEquals(new KnownVolume(), types.get(jacobian));
    }

    @Test
    public void unsupportedOperators() {
        OTVariable u = var("u");
        Assert.assertThrows(UnsupportedOperatorException.class,
                () -> infer(new OTOpaqueOperator("filter").bind(u)));
        Assert.assertThrows(UnsupportedOperatorException.class,
                () -> infer(new OTFluxExchangeOperator(0, 1).bind(u)));
    }

    @Test
    public void bareNormal() {
        Assert.assertThrows(CompilationError.class, () -> infer(new OTNormal(0).times(var("u"))));
    }

    @Test
    public void statisticsAndJson() {
        OTVariable x = var("x");
        OTExpression sum = x.plus(new OTConstant(1));
        TypeDict types = infer(sum);
        Assert.assertTrue(types.getIterations() >= 2);
        Assert.assertTrue(types.getChangeCount() >= 3);
        Assert.assertEquals(3, types.size());

        ArrayNode json = types.toJson(Utilities.deterministicObjectMapper());
        Assert.assertEquals(3, json.size());
        boolean found = false;
        for (JsonNode entry: json) {
            if (entry.get("expression").asText().equals("x")) {
                Assert.assertEquals("VolumeVector", entry.get("type").get("kind").asText());
                found = true;
            }
        }
        Assert.assertTrue(found);
    }

    @Test
    public void volumeOperatorFamilies() {
        OTVariable u = var("u");
        OTExpression upsampled = new OTQuadratureGridUpsampler("q").bind(u);
        OTExpression stiffness = new OTStiffnessTOperator(1).bind(u);
        OTExpression quadratureStiffness = new OTQuadratureStiffnessTOperator(0, "q").bind(upsampled);
        OTExpression linear = new OTElementwiseLinearOperator("filter").bind(u);
        TypeDict types = infer(new OTVectorExpression(stiffness, quadratureStiffness, linear));
        Assert.assertEquals(VolumeVector.nodal(), types.get(stiffness));
        Assert.assertEquals(VolumeVector.nodal(), types.get(quadratureStiffness));
        Assert.assertEquals(VolumeVector.nodal(), types.get(linear));
        Assert.assertEquals(new VolumeVector(QUAD), types.get(upsampled));
        Assert.assertEquals(VolumeVector.nodal(), types.get(u));
    }
}
