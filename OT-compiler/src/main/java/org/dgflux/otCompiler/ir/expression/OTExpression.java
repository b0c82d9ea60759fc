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

package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.ir.IOTInnerNode;
import org.dgflux.otCompiler.ir.OTNode;
import org.dgflux.otCompiler.ir.operator.OTOperator;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;

/** Base class for all operator template expressions.
 * Expressions are immutable.  Equality and hashing are structural,
 * so expressions can be used as keys of the maps that passes build;
 * the hash code is computed once, on first use. */
public abstract class OTExpression
        extends OTNode
        implements IOTInnerNode {
    private int hash;
    private boolean hashComputed;

    protected OTExpression() {
        super();
    }

    @Override
    public boolean isExpression() {
        return true;
    }

    /** Compute a structural hash code.  Only called once per node. */
    protected abstract int computeHash();

    /** Compare the fields of this node with an expression of the same class. */
    protected abstract boolean sameStructure(OTExpression other);

    @Override
    public final int hashCode() {
        if (!this.hashComputed) {
            this.hash = this.computeHash();
            this.hashComputed = true;
        }
        return this.hash;
    }

    @Override
    public final boolean equals(@Nullable Object o) {
        if (this == o)
            return true;
        if (o == null || this.getClass() != o.getClass())
            return false;
        OTExpression other = (OTExpression) o;
        if (this.hashCode() != other.hashCode())
            return false;
        return this.sameStructure(other);
    }

    public boolean isZero() {
        return false;
    }

    @CheckReturnValue
    public OTExpression plus(OTExpression other) {
        return new OTSumExpression(this, other);
    }

    @CheckReturnValue
    public OTExpression minus(OTExpression other) {
        return new OTSumExpression(this, other.negate());
    }

    @CheckReturnValue
    public OTExpression times(OTExpression other) {
        return new OTProductExpression(this, other);
    }

    @CheckReturnValue
    public OTExpression div(OTExpression other) {
        return new OTQuotientExpression(this, other);
    }

    /** Apply {@code operator} to this expression. */
    public OTOperatorBinding bind(OTOperator operator) {
        return new OTOperatorBinding(operator, this);
    }

    @CheckReturnValue
    public OTExpression negate() {
        return new OTProductExpression(new OTConstant(-1), this);
    }

    public OTCommonSubexpression cse(String prefix) {
        return new OTCommonSubexpression(this, prefix);
    }

    public OTCommonSubexpression cse() {
        return new OTCommonSubexpression(this, null);
    }
}
