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
import org.dgflux.otCompiler.compiler.errors.AliasedDomainVariableError;
import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.ir.IOTInnerNode;
import org.dgflux.otCompiler.ir.expression.OTBoundaryPair;
import org.dgflux.otCompiler.ir.expression.OTCommonSubexpression;
import org.dgflux.otCompiler.ir.expression.OTConstant;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTOperatorBinding;
import org.dgflux.otCompiler.ir.flux.FluxExpression;
import org.dgflux.otCompiler.ir.flux.FluxSubstitution;
import org.dgflux.otCompiler.ir.operator.OTFluxOperatorBase;
import org.dgflux.otCompiler.ir.operator.OperatorFamily;
import org.dgflux.util.Linq;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites flux operators bound to a {@link OTBoundaryPair}.
 * If the boundary fields of the pair can be computed from the volume fields,
 * the computation is substituted into the flux kernel, and the boundary data
 * does not need to be fetched.  Boundary inputs which cannot be computed
 * in the kernel remain inputs of the rewritten pair.
 * All other nodes of the template are rebuilt unchanged.
 */
public class BoundaryToFlux extends InnerRewriteVisitor {
    final ExpensiveBoundaryOperators expensive;
    /** Each common subexpression is rewritten once. */
    final Map<OTCommonSubexpression, OTExpression> cseResults;

    public BoundaryToFlux(OTCompiler compiler) {
        super(compiler);
        this.expensive = new ExpensiveBoundaryOperators(compiler);
        this.cseResults = new HashMap<>();
    }

    @Override
    public void startVisit(IOTInnerNode node) {
        super.startVisit(node);
        this.cseResults.clear();
    }

    @Override
    public VisitDecision preorder(OTCommonSubexpression expression) {
        OTExpression result = this.cseResults.get(expression);
        if (result != null) {
            this.map(expression, result);
            return VisitDecision.STOP;
        }
        super.preorder(expression);
        this.cseResults.put(expression, this.getResultExpression());
        return VisitDecision.STOP;
    }

    /** Check that no expression is used both as volume and as boundary data. */
    void checkAliasing(OTBoundaryPair pair) {
        Set<OTExpression> boundaryDependencies = new LinkedHashSet<>();
        for (OTExpression field: pair.boundaryFields)
            boundaryDependencies.addAll(new DependencyCollector(this.compiler, false).collect(field));
        Set<OTExpression> volumeDependencies = new LinkedHashSet<>();
        for (OTExpression field: pair.volumeFields)
            volumeDependencies.addAll(new DependencyCollector(this.compiler, true).collect(field));
        Set<OTExpression> shared = Linq.intersect(boundaryDependencies, volumeDependencies);
        if (!shared.isEmpty())
            throw new AliasedDomainVariableError(shared, pair);
    }

    @Override
    public VisitDecision preorder(OTOperatorBinding expression) {
        if (expression.operator.family() != OperatorFamily.FLUX ||
                !(expression.field instanceof OTBoundaryPair pair))
            return super.preorder(expression);

        OTFluxOperatorBase operator = expression.operator.to(OTFluxOperatorBase.class);
        this.checkAliasing(pair);

        MaxFluxEvaluableExpression finder = new MaxFluxEvaluableExpression(this.compiler, pair, this.expensive);
        List<FluxExpression> boundaryValues = finder.translate();
        boolean simplify = this.compiler.options.languageOptions.simplifyFluxes();
        FluxExpression flux = new FluxSubstitution(boundaryValues, simplify).apply(operator.flux);

        if (flux.isZero()) {
            this.log(1)
                    .append("Flux ")
                    .append(expression)
                    .append(" is zero")
                    .newline();
            this.map(expression, OTConstant.zero());
            return VisitDecision.STOP;
        }

        this.push(expression);
        List<OTExpression> volumeFields = this.transform(finder.getVolumeInputs());
        List<OTExpression> boundaryFields = this.transform(finder.getBoundaryInputs());
        this.pop(expression);

        OTBoundaryPair newPair = new OTBoundaryPair(volumeFields, boundaryFields, pair.tag);
        OTExpression result = new OTOperatorBinding(operator.withFlux(flux), newPair);
        this.log(1)
                .append("Rewrote boundary flux with ")
                .append(volumeFields.size())
                .append(" volume and ")
                .append(boundaryFields.size())
                .append(" boundary inputs: ")
                .append(flux)
                .newline();
        this.map(expression, result);
        return VisitDecision.STOP;
    }

    @Override
    public String toString() {
        return "BoundaryToFlux " + this.id;
    }
}
