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

import org.dgflux.otCompiler.compiler.ICompilerComponent;
import org.dgflux.otCompiler.compiler.OTCompiler;
import org.dgflux.otCompiler.compiler.errors.InternalCompilerError;
import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.ir.IOTInnerNode;
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
import org.dgflux.otCompiler.ir.expression.OTLeafExpression;
import org.dgflux.otCompiler.ir.expression.OTNaryExpression;
import org.dgflux.otCompiler.ir.expression.OTNodeCoordinateComponent;
import org.dgflux.otCompiler.ir.expression.OTNormal;
import org.dgflux.otCompiler.ir.expression.OTOnes;
import org.dgflux.otCompiler.ir.expression.OTOperatorBinding;
import org.dgflux.otCompiler.ir.expression.OTPowerExpression;
import org.dgflux.otCompiler.ir.expression.OTProductExpression;
import org.dgflux.otCompiler.ir.expression.OTQuotientExpression;
import org.dgflux.otCompiler.ir.expression.OTScalarParameter;
import org.dgflux.otCompiler.ir.expression.OTSubscriptExpression;
import org.dgflux.otCompiler.ir.expression.OTSumExpression;
import org.dgflux.otCompiler.ir.expression.OTVariable;
import org.dgflux.otCompiler.ir.expression.OTVectorExpression;
import org.dgflux.otCompiler.ir.expression.OTWholeDomainFlux;
import org.dgflux.util.IHasId;
import org.dgflux.util.IWritesLogs;
import org.dgflux.util.Logger;
import org.dgflux.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Depth-first traversal of an operator template.
 * For each node class there is a preorder and a postorder method;
 * by default each one calls the method for the superclass of the node. */
@SuppressWarnings({"SameReturnValue", "EmptyMethod", "unused"})
public abstract class InnerVisitor implements IRTransform, IWritesLogs, IHasId, ICompilerComponent {
    final long id;
    static long crtId = 0;
    public final OTCompiler compiler;
    protected final List<IOTInnerNode> context;

    public InnerVisitor(OTCompiler compiler) {
        this.id = crtId++;
        this.compiler = compiler;
        this.context = new ArrayList<>();
    }

    @Override
    public OTCompiler compiler() {
        return this.compiler;
    }

    @Override
    public long getId() {
        return this.id;
    }

    // A chance for subclasses to do something for every expression visited
    public void visitingExpression(OTExpression expression) {}

    public void push(IOTInnerNode node) {
        this.context.add(node);
        if (node.isExpression()) {
            this.visitingExpression(node.to(OTExpression.class));
        }
    }

    public void pop(IOTInnerNode node) {
        IOTInnerNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    @Nullable
    public IOTInnerNode getParent() {
        if (this.context.isEmpty())
            return null;
        return Utilities.last(this.context);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(IOTInnerNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(node)
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    /************************* PREORDER *****************************/

    // preorder methods return CONTINUE when normal traversal is desired,
    // and STOP when the traversal should stop right away at the current node.
    // base classes
    public VisitDecision preorder(IOTInnerNode ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(OTExpression node) {
        return this.preorder((IOTInnerNode) node);
    }

    public VisitDecision preorder(OTNaryExpression node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTSumExpression node) {
        return this.preorder((OTNaryExpression) node);
    }

    public VisitDecision preorder(OTProductExpression node) {
        return this.preorder((OTNaryExpression) node);
    }

    public VisitDecision preorder(OTQuotientExpression node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTPowerExpression node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTIfExpression node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTIfPositiveExpression node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTComparisonExpression node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTCallExpression node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTLeafExpression node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTVariable node) {
        return this.preorder((OTLeafExpression) node);
    }

    public VisitDecision preorder(OTConstant node) {
        return this.preorder((OTLeafExpression) node);
    }

    public VisitDecision preorder(OTScalarParameter node) {
        return this.preorder((OTLeafExpression) node);
    }

    public VisitDecision preorder(OTNormal node) {
        return this.preorder((OTLeafExpression) node);
    }

    public VisitDecision preorder(OTBoundaryNormalComponent node) {
        return this.preorder((OTLeafExpression) node);
    }

    public VisitDecision preorder(OTNodeCoordinateComponent node) {
        return this.preorder((OTLeafExpression) node);
    }

    public VisitDecision preorder(OTOnes node) {
        return this.preorder((OTLeafExpression) node);
    }

    public VisitDecision preorder(OTGeometricFactor node) {
        return this.preorder((OTLeafExpression) node);
    }

    public VisitDecision preorder(OTSubscriptExpression node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTFluxExchange node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTCommonSubexpression node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTOperatorBinding node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTBoundaryPair node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTVectorExpression node) {
        return this.preorder((OTExpression) node);
    }

    public VisitDecision preorder(OTWholeDomainFlux node) {
        return this.preorder((OTExpression) node);
    }

    /************************* POSTORDER *****************************/

    @SuppressWarnings("unused")
    public void postorder(IOTInnerNode ignored) {}

    public void postorder(OTExpression node) {
        this.postorder((IOTInnerNode) node);
    }

    public void postorder(OTNaryExpression node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTSumExpression node) {
        this.postorder((OTNaryExpression) node);
    }

    public void postorder(OTProductExpression node) {
        this.postorder((OTNaryExpression) node);
    }

    public void postorder(OTQuotientExpression node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTPowerExpression node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTIfExpression node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTIfPositiveExpression node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTComparisonExpression node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTCallExpression node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTLeafExpression node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTVariable node) {
        this.postorder((OTLeafExpression) node);
    }

    public void postorder(OTConstant node) {
        this.postorder((OTLeafExpression) node);
    }

    public void postorder(OTScalarParameter node) {
        this.postorder((OTLeafExpression) node);
    }

    public void postorder(OTNormal node) {
        this.postorder((OTLeafExpression) node);
    }

    public void postorder(OTBoundaryNormalComponent node) {
        this.postorder((OTLeafExpression) node);
    }

    public void postorder(OTNodeCoordinateComponent node) {
        this.postorder((OTLeafExpression) node);
    }

    public void postorder(OTOnes node) {
        this.postorder((OTLeafExpression) node);
    }

    public void postorder(OTGeometricFactor node) {
        this.postorder((OTLeafExpression) node);
    }

    public void postorder(OTSubscriptExpression node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTFluxExchange node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTCommonSubexpression node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTOperatorBinding node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTBoundaryPair node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTVectorExpression node) {
        this.postorder((OTExpression) node);
    }

    public void postorder(OTWholeDomainFlux node) {
        this.postorder((OTExpression) node);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }

    @Override
    public IOTInnerNode apply(IOTInnerNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }
}
