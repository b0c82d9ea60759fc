/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.dgflux.otCompiler.compiler.visitors.inner;

import org.dgflux.otCompiler.compiler.OTCompiler;
import org.dgflux.otCompiler.compiler.errors.CompilationError;
import org.dgflux.otCompiler.compiler.errors.InternalCompilerError;
import org.dgflux.otCompiler.compiler.errors.UnsupportedOperatorException;
import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
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
import org.dgflux.otCompiler.ir.expression.OTNaryExpression;
import org.dgflux.otCompiler.ir.expression.OTNodeCoordinateComponent;
import org.dgflux.otCompiler.ir.expression.OTNormal;
import org.dgflux.otCompiler.ir.expression.OTOnes;
import org.dgflux.otCompiler.ir.expression.OTOperatorBinding;
import org.dgflux.otCompiler.ir.expression.OTPowerExpression;
import org.dgflux.otCompiler.ir.expression.OTQuotientExpression;
import org.dgflux.otCompiler.ir.expression.OTScalarParameter;
import org.dgflux.otCompiler.ir.expression.OTSubscriptExpression;
import org.dgflux.otCompiler.ir.expression.OTVariable;
import org.dgflux.otCompiler.ir.expression.OTVectorExpression;
import org.dgflux.otCompiler.ir.expression.OTWholeDomainFlux;
import org.dgflux.otCompiler.ir.operator.IHasQuadratureTag;
import org.dgflux.otCompiler.ir.operator.OTOperator;
import org.dgflux.otCompiler.ir.operator.OTQuadratureBoundaryGridUpsampler;
import org.dgflux.otCompiler.ir.operator.OTRestrictToBoundary;
import org.dgflux.otCompiler.ir.type.BoundaryTag;
import org.dgflux.otCompiler.ir.type.BoundaryVector;
import org.dgflux.otCompiler.ir.type.InteriorFacesVector;
import org.dgflux.otCompiler.ir.type.KnownBoundary;
import org.dgflux.otCompiler.ir.type.KnownInteriorFaces;
import org.dgflux.otCompiler.ir.type.KnownRepresentation;
import org.dgflux.otCompiler.ir.type.KnownVolume;
import org.dgflux.otCompiler.ir.type.NoType;
import org.dgflux.otCompiler.ir.type.NodalRepresentation;
import org.dgflux.otCompiler.ir.type.QuadratureRepresentation;
import org.dgflux.otCompiler.ir.type.Representation;
import org.dgflux.otCompiler.ir.type.Scalar;
import org.dgflux.otCompiler.ir.type.TypeInfo;
import org.dgflux.otCompiler.ir.type.VolumeVector;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Infers the type of every subexpression of an operator template.
 *
 * <p>Each node kind has a rule which reads the types currently recorded in a
 * {@link TypeDict}, writes constraints on its operands, and produces the type
 * of the node itself, which is unified with the recorded one.  The whole
 * template is traversed repeatedly until the dictionary stops changing.
 *
 * <p>Every preorder method computes the type of its node, stores it in
 * {@link #result}, and returns STOP: the rules decide themselves which
 * children to visit, and in which order.
 */
public class TypeInference extends InnerVisitor {
    TypeDict typeDict;
    /** For each common subexpression, the dictionary change count right after its body was last inferred. */
    final Map<OTCommonSubexpression, Integer> cseLastChange;
    /** Type produced by the last rule applied. */
    @Nullable
    TypeInfo result;

    public TypeInference(OTCompiler compiler) {
        super(compiler);
        this.typeDict = new TypeDict();
        this.cseLastChange = new HashMap<>();
        this.result = null;
    }

    /** Representation shared by all the arguments of one flux. */
    static final class RepresentationCell {
        TypeInfo representation = new NoType();
    }

    /** Infer the types of all subexpressions of 'template'.
     * If 'template' is a {@link OTVectorExpression}, each of its components is a root.
     *
     * @param template  Expression to analyze.
     * @param hints     Types known in advance for some expressions.
     * @return          The dictionary mapping each subexpression to its type. */
    public TypeDict infer(OTExpression template, Map<OTExpression, TypeInfo> hints) {
        this.startVisit(template);
        this.typeDict = new TypeDict(hints);
        this.cseLastChange.clear();
        List<OTExpression> roots = OTVectorExpression.flatten(template);

        this.fixpoint(roots);
        if (this.defaultVariables()) {
            this.cseLastChange.clear();
            this.fixpoint(roots);
        }

        if (this.compiler.options.languageOptions.checkFinalTypes())
            this.typeDict.checkFinal();
        this.endVisit();
        return this.typeDict;
    }

    public TypeDict infer(OTExpression template) {
        return this.infer(template, Map.of());
    }

    void fixpoint(List<OTExpression> roots) {
        do {
            this.typeDict.iterations++;
            this.typeDict.clearChanged();
            for (OTExpression root: roots)
                this.rec(root);
        } while (this.typeDict.isChanged());
        this.log(1)
                .append("Type inference converged after ")
                .append(this.typeDict.iterations)
                .append(" iterations, ")
                .append(this.typeDict.getChangeCount())
                .append(" changes")
                .newline();
    }

    /** Variables whose domain nothing constrains are volume fields.
     * @return true if any variable was changed. */
    boolean defaultVariables() {
        List<OTExpression> toDefault = new ArrayList<>();
        for (Map.Entry<OTExpression, TypeInfo> entry: this.typeDict.asMap().entrySet()) {
            OTExpression expression = entry.getKey();
            if ((expression.is(OTVariable.class) || expression.is(OTSubscriptExpression.class))
                    && entry.getValue().is(KnownRepresentation.class))
                toDefault.add(expression);
        }
        for (OTExpression expression: toDefault)
            this.typeDict.set(expression, new KnownVolume());
        return !toDefault.isEmpty();
    }

    /** Apply the rule for 'expression' and record the result. */
    TypeInfo rec(OTExpression expression) {
        this.result = null;
        expression.accept(this);
        TypeInfo type = this.result;
        if (type == null)
            throw new InternalCompilerError("No type produced for " + expression, expression);
        this.typeDict.set(expression, type);
        return type;
    }

    VisitDecision produce(TypeInfo type) {
        this.result = type;
        return VisitDecision.STOP;
    }

    /** Unify the types of all the children which are not scalars.
     * Scalars can be mixed with vectors without changing the type of the result. */
    TypeInfo inferForChildren(OTExpression expression, List<OTExpression> children) {
        TypeInfo type = this.typeDict.get(expression);
        List<OTExpression> nonScalar = new ArrayList<>();

        for (OTExpression child: children) {
            if (type.is(NoType.class)) {
                type = this.rec(child);
                if (type.is(Scalar.class))
                    type = new NoType();
                else
                    nonScalar.add(child);
            } else {
                TypeInfo childType = this.rec(child);
                if (!childType.is(Scalar.class)) {
                    nonScalar.add(child);
                    type = type.unify(childType, child);
                }
            }
        }

        for (OTExpression child: nonScalar)
            this.typeDict.set(child, type);
        if (nonScalar.isEmpty())
            type = new Scalar();
        return type;
    }

    @Override
    public VisitDecision preorder(OTExpression expression) {
        throw new InternalCompilerError("No type rule for " + expression, expression);
    }

    @Override
    public VisitDecision preorder(OTNaryExpression expression) {
        return this.produce(this.inferForChildren(expression, expression.children));
    }

    @Override
    public VisitDecision preorder(OTQuotientExpression expression) {
        return this.produce(this.inferForChildren(expression,
                List.of(expression.numerator, expression.denominator)));
    }

    @Override
    public VisitDecision preorder(OTPowerExpression expression) {
        return this.produce(this.inferForChildren(expression,
                List.of(expression.base, expression.exponent)));
    }

    @Override
    public VisitDecision preorder(OTIfExpression expression) {
        return this.produce(this.inferForChildren(expression,
                List.of(expression.condition, expression.then, expression.otherwise)));
    }

    @Override
    public VisitDecision preorder(OTIfPositiveExpression expression) {
        return this.produce(this.inferForChildren(expression,
                List.of(expression.criterion, expression.then, expression.otherwise)));
    }

    @Override
    public VisitDecision preorder(OTComparisonExpression expression) {
        return this.produce(this.inferForChildren(expression,
                List.of(expression.left, expression.right)));
    }

    @Override
    public VisitDecision preorder(OTCallExpression expression) {
        // functions do not change the type of their arguments
        return this.produce(this.inferForChildren(expression, expression.parameters));
    }

    @Override
    public VisitDecision preorder(OTConstant expression) {
        return this.produce(new Scalar().unify(this.typeDict.get(expression), expression));
    }

    @Override
    public VisitDecision preorder(OTScalarParameter expression) {
        return this.produce(new Scalar().unify(this.typeDict.get(expression), expression));
    }

    @Override
    public VisitDecision preorder(OTVariable expression) {
        return this.produce(new KnownRepresentation(NodalRepresentation.INSTANCE)
                .unify(this.typeDict.get(expression), expression));
    }

    @Override
    public VisitDecision preorder(OTSubscriptExpression expression) {
        return this.produce(new KnownRepresentation(NodalRepresentation.INSTANCE)
                .unify(this.typeDict.get(expression), expression));
    }

    static Representation representation(@Nullable String quadratureTag) {
        if (quadratureTag == null)
            return NodalRepresentation.INSTANCE;
        return new QuadratureRepresentation(quadratureTag);
    }

    @Override
    public VisitDecision preorder(OTOnes expression) {
        return this.produce(new VolumeVector(representation(expression.quadratureTag))
                .unify(this.typeDict.get(expression), expression));
    }

    @Override
    public VisitDecision preorder(OTNodeCoordinateComponent expression) {
        return this.produce(new VolumeVector(representation(expression.quadratureTag))
                .unify(this.typeDict.get(expression), expression));
    }

    @Override
    public VisitDecision preorder(OTBoundaryNormalComponent expression) {
        return this.produce(new BoundaryVector(expression.tag, representation(expression.quadratureTag))
                .unify(this.typeDict.get(expression), expression));
    }

    @Override
    public VisitDecision preorder(OTGeometricFactor expression) {
        return this.produce(new KnownVolume());
    }

    @Override
    public VisitDecision preorder(OTNormal expression) {
        throw new CompilationError("Flux normal " + expression + " used outside of a flux kernel", expression);
    }

    @Override
    public VisitDecision preorder(OTBoundaryPair expression) {
        throw new CompilationError("Boundary pair " + expression + " is not the argument of a flux", expression);
    }

    @Override
    public VisitDecision preorder(OTVectorExpression expression) {
        for (OTExpression component: expression.components)
            this.rec(component);
        return this.produce(new NoType());
    }

    @Override
    public VisitDecision preorder(OTFluxExchange expression) {
        for (OTExpression arg: expression.argFields) {
            this.typeDict.set(arg, VolumeVector.nodal());
            this.rec(arg);
        }
        return this.produce(new BoundaryVector(expression.getBoundaryTag(), NodalRepresentation.INSTANCE));
    }

    @Override
    public VisitDecision preorder(OTCommonSubexpression expression) {
        // The body only needs another pass if some type changed since it was last inferred,
        // either outside (the wrapper, another root) or inside it (variable defaulting).
        @Nullable Integer last = this.cseLastChange.get(expression);
        if (last != null && last == this.typeDict.getChangeCount())
            return this.produce(this.typeDict.get(expression.child));

        boolean wasChanged = this.typeDict.isChanged();
        int before = this.typeDict.getChangeCount();
        this.typeDict.set(expression.child, this.typeDict.get(expression));
        // Run to a local fixpoint, so that the recorded type is complete
        do {
            this.typeDict.clearChanged();
            this.rec(expression.child);
        } while (this.typeDict.isChanged());

        if (wasChanged || this.typeDict.getChangeCount() != before)
            this.typeDict.markChanged();
        this.cseLastChange.put(expression, this.typeDict.getChangeCount());
        return this.produce(this.typeDict.get(expression.child));
    }

    void processInteriorFluxArgument(RepresentationCell cell, OTExpression argument) {
        this.typeDict.set(argument, new KnownInteriorFaces().unify(cell.representation, argument));
        cell.representation = this.rec(argument).extractRepresentation();
    }

    void processBoundaryFluxArgument(RepresentationCell cell, BoundaryTag tag, OTExpression argument) {
        this.typeDict.set(argument, new KnownBoundary(tag).unify(cell.representation, argument));
        cell.representation = this.rec(argument).extractRepresentation();
    }

    void processBoundaryPair(RepresentationCell cell, OTBoundaryPair pair) {
        for (OTExpression field: pair.volumeFields)
            this.processInteriorFluxArgument(cell, field);
        for (OTExpression field: pair.boundaryFields)
            this.processBoundaryFluxArgument(cell, pair.tag, field);
    }

    TypeInfo fluxBinding(OTOperatorBinding expression) {
        RepresentationCell cell = new RepresentationCell();
        if (expression.field instanceof OTBoundaryPair pair) {
            this.processBoundaryPair(cell, pair);
        } else {
            for (OTExpression field: OTVectorExpression.flatten(expression.field))
                this.processInteriorFluxArgument(cell, field);
        }
        return VolumeVector.nodal();
    }

    @Override
    public VisitDecision preorder(OTWholeDomainFlux expression) {
        RepresentationCell cell = new RepresentationCell();
        for (OTExpression interior: expression.interiors)
            for (OTExpression field: OTVectorExpression.flatten(interior))
                this.processInteriorFluxArgument(cell, field);
        for (OTBoundaryPair pair: expression.boundaries)
            this.processBoundaryPair(cell, pair);
        return this.produce(VolumeVector.nodal());
    }

    /** Constrain the operand to 'fieldType', infer it, and return 'resultType'. */
    TypeInfo pin(OTExpression field, TypeInfo fieldType, TypeInfo resultType) {
        this.typeDict.set(field, fieldType);
        this.rec(field);
        return resultType;
    }

    @Override
    public VisitDecision preorder(OTOperatorBinding expression) {
        OTOperator operator = expression.operator;
        OTExpression field = expression.field;
        TypeInfo type = switch (operator.family()) {
            case NODAL_REDUCTION -> this.pin(field, new KnownVolume(), new Scalar());
            // mass and stiffness may later be specialized for quadrature
            case SPECIALIZABLE_VOLUME -> this.pin(field, new KnownVolume(), VolumeVector.nodal());
            case QUADRATURE_VOLUME -> this.pin(field,
                    new VolumeVector(new QuadratureRepresentation(
                            operator.to(IHasQuadratureTag.class).getQuadratureTag())),
                    VolumeVector.nodal());
            case NODAL_ONLY, ELEMENTWISE_LINEAR -> this.pin(field, VolumeVector.nodal(), VolumeVector.nodal());
            case ELEMENTWISE_MAX -> {
                this.typeDict.set(field, this.typeDict.get(expression).unify(new KnownVolume(), field));
                yield this.rec(field);
            }
            case RESTRICT_TO_BOUNDARY -> {
                // the argument has the same representation as the result
                this.typeDict.set(field, new KnownVolume().unify(
                        this.typeDict.get(expression).extractRepresentation(), field));
                this.rec(field);
                // and the result has the same representation as the argument
                yield new KnownBoundary(operator.to(OTRestrictToBoundary.class).tag)
                        .unify(this.typeDict.get(field).extractRepresentation(), expression);
            }
            case FLUX_EXCHANGE -> throw new UnsupportedOperatorException(
                    "type inference", operator, expression);
            case FLUX -> this.fluxBinding(expression);
            case QUADRATURE_UPSAMPLER -> {
                this.typeDict.set(field, this.typeDict.get(expression).extractDomain());
                this.rec(field);
                yield new KnownRepresentation(new QuadratureRepresentation(
                        operator.to(IHasQuadratureTag.class).getQuadratureTag()))
                        .unify(this.typeDict.get(field).extractDomain(), expression);
            }
            case QUADRATURE_INTERIOR_FACES_UPSAMPLER -> this.pin(field, VolumeVector.nodal(),
                    new InteriorFacesVector(new QuadratureRepresentation(
                            operator.to(IHasQuadratureTag.class).getQuadratureTag())));
            case QUADRATURE_BOUNDARY_UPSAMPLER -> {
                OTQuadratureBoundaryGridUpsampler upsampler = operator.to(OTQuadratureBoundaryGridUpsampler.class);
                yield this.pin(field,
                        new BoundaryVector(upsampler.boundaryTag, NodalRepresentation.INSTANCE),
                        new BoundaryVector(upsampler.boundaryTag,
                                new QuadratureRepresentation(upsampler.quadratureTag)));
            }
            case OPAQUE -> throw new UnsupportedOperatorException("type inference", operator, expression);
        };
        return this.produce(type);
    }

    public TypeDict getTypeDict() {
        return this.typeDict;
    }

    @Override
    public String toString() {
        return "TypeInference " + this.id;
    }
}
