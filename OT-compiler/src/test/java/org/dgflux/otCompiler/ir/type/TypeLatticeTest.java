package org.dgflux.otCompiler.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import org.dgflux.otCompiler.compiler.errors.InternalCompilerError;
import org.dgflux.otCompiler.compiler.errors.MalformedTypeError;
import org.dgflux.otCompiler.compiler.errors.TypeConflictError;
import org.dgflux.otCompiler.ir.expression.OTVariable;
import org.dgflux.util.Utilities;
import org.junit.Assert;
import org.junit.Test;

import javax.annotation.Nullable;
import java.util.List;

public class TypeLatticeTest {
    static final BoundaryTag WALL = new BoundaryTag("wall");
    static final BoundaryTag INFLOW = new BoundaryTag("inflow");
    static final Representation NODAL = NodalRepresentation.INSTANCE;
    static final Representation QUAD = new QuadratureRepresentation("q");
    static final Representation OTHER_QUAD = new QuadratureRepresentation("q2");

    static List<TypeInfo> sample() {
        return List.of(
                new NoType(),
                new KnownVolume(),
                new KnownBoundary(WALL),
                new KnownBoundary(INFLOW),
                new KnownInteriorFaces(),
                new KnownRepresentation(NODAL),
                new KnownRepresentation(QUAD),
                new Scalar(),
                new VolumeVector(NODAL),
                new VolumeVector(QUAD),
                new BoundaryVector(WALL, NODAL),
                new BoundaryVector(WALL, QUAD),
                new BoundaryVector(INFLOW, NODAL),
                new InteriorFacesVector(QUAD),
                new InteriorFacesVector(OTHER_QUAD));
    }

    @Nullable
    static TypeInfo tryUnify(TypeInfo left, TypeInfo right) {
        try {
            return left.unify(right);
        } catch (TypeConflictError ex) {
            return null;
        }
    }

    @Test
    public void unifyIsCommutative() {
        for (TypeInfo left: sample()) {
            for (TypeInfo right: sample()) {
                TypeInfo direct = tryUnify(left, right);
                TypeInfo reverse = tryUnify(right, left);
                Assert.assertEquals(left + " with " + right, direct, reverse);
            }
        }
    }

    @Test
    public void noTypeIsIdentity() {
        for (TypeInfo type: sample()) {
            Assert.assertEquals(type, type.unify(new NoType()));
            Assert.assertEquals(type, new NoType().unify(type));
        }
    }

    @Test
    public void finalTypesOnlyUnifyWithThemselves() {
        for (TypeInfo left: sample()) {
            if (!left.isFinal())
                continue;
            for (TypeInfo right: sample()) {
                if (!right.isFinal())
                    continue;
                if (left.equals(right)) {
                    Assert.assertEquals(left, left.unify(right));
                } else {
                    Assert.assertThrows(TypeConflictError.class, () -> left.unify(right));
                }
            }
        }
    }

    @Test
    public void partialTypesCombine() {
        Assert.assertEquals(new VolumeVector(QUAD),
                new KnownVolume().unify(new KnownRepresentation(QUAD)));
        Assert.assertEquals(new BoundaryVector(WALL, NODAL),
                new KnownRepresentation(NODAL).unify(new KnownBoundary(WALL)));
        Assert.assertEquals(new InteriorFacesVector(QUAD),
                new KnownInteriorFaces().unify(new KnownRepresentation(QUAD)));
        Assert.assertEquals(new BoundaryVector(WALL, QUAD),
                new KnownBoundary(WALL).unify(new BoundaryVector(WALL, QUAD)));
        Assert.assertThrows(TypeConflictError.class,
                () -> new KnownBoundary(WALL).unify(new KnownVolume()));
        Assert.assertThrows(TypeConflictError.class,
                () -> new KnownRepresentation(NODAL).unify(new KnownRepresentation(QUAD)));
    }

    @Test
    public void interiorFacesDegradeToNodalVolume() {
        Assert.assertEquals(VolumeVector.nodal(), new KnownInteriorFaces().unify(new KnownVolume()));
        Assert.assertEquals(VolumeVector.nodal(), new KnownVolume().unify(new KnownInteriorFaces()));
        Assert.assertEquals(VolumeVector.nodal(), new KnownInteriorFaces().unify(VolumeVector.nodal()));
        Assert.assertEquals(VolumeVector.nodal(), new KnownRepresentation(NODAL).unify(new KnownInteriorFaces()));
        Assert.assertThrows(TypeConflictError.class,
                () -> new KnownInteriorFaces().unify(new VolumeVector(QUAD)));
    }

    @Test
    public void conflictNamesTypesAndExpression() {
        OTVariable u = new OTVariable("u");
        TypeConflictError error = Assert.assertThrows(TypeConflictError.class,
                () -> new Scalar().unify(VolumeVector.nodal(), u));
        Assert.assertEquals(new Scalar(), error.left);
        Assert.assertEquals(VolumeVector.nodal(), error.right);
        Assert.assertSame(u, error.getNode());
        Assert.assertTrue(error.getMessage().contains("'u'"));
    }

    @Test
    public void interiorFacesRequireQuadrature() {
        Assert.assertThrows(MalformedTypeError.class, () -> new InteriorFacesVector(NODAL));
    }

    @Test
    public void disagreeingUnifiersAreInternalErrors() {
        TypeInfo stubborn = new TypeInfo() {
            @Override
            protected TypeInfo unifyInner(TypeInfo other) {
                return new Scalar();
            }

            @Override
            public String getKind() {
                return "Stubborn";
            }

            @Override
            public boolean equals(@Nullable Object o) {
                return this == o;
            }

            @Override
            public int hashCode() {
                return 0;
            }
        };
        // NoType answers 'stubborn', stubborn answers Scalar
        Assert.assertThrows(InternalCompilerError.class, () -> stubborn.unify(new NoType()));
    }

    @Test
    public void extractParts() {
        TypeInfo type = new BoundaryVector(WALL, QUAD);
        Assert.assertEquals(new KnownRepresentation(QUAD), type.extractRepresentation());
        Assert.assertEquals(new KnownBoundary(WALL), type.extractDomain());
        Assert.assertEquals(new KnownVolume(), new VolumeVector(QUAD).extractDomain());
        Assert.assertEquals(new NoType(), new InteriorFacesVector(QUAD).extractDomain());
        Assert.assertEquals(new NoType(), new KnownVolume().extractRepresentation());
        Assert.assertEquals(new NoType(), new Scalar().extractRepresentation());
    }

    @Test
    public void toJson() {
        JsonNode node = new BoundaryVector(WALL, QUAD).toJson(Utilities.deterministicObjectMapper());
        Assert.assertEquals("BoundaryVector", node.get("kind").asText());
        Assert.assertEquals("wall", node.get("boundary").asText());
        Assert.assertEquals("Quadrature", node.get("representation").get("kind").asText());
        Assert.assertEquals("q", node.get("representation").get("tag").asText());
        Assert.assertEquals("Scalar", new Scalar().toJson(Utilities.deterministicObjectMapper()).get("kind").asText());
    }

    @Test
    public void rankBoundaryTags() {
        Assert.assertEquals(BoundaryTag.forRank(3), BoundaryTag.forRank(3));
        Assert.assertNotEquals(BoundaryTag.forRank(3), BoundaryTag.forRank(4));
    }
}
