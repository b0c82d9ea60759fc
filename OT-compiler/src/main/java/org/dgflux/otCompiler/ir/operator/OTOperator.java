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

package org.dgflux.otCompiler.ir.operator;

import org.dgflux.otCompiler.ir.OTNode;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.otCompiler.ir.expression.OTOperatorBinding;

import javax.annotation.Nullable;

/** Base class for the operators which can be applied to fields.
 * Operators are immutable values; equality is structural. */
public abstract class OTOperator extends OTNode {
    private int hash;
    private boolean hashComputed;

    protected OTOperator() {
        super();
    }

    public abstract OperatorFamily family();

    protected abstract int computeHash();

    /** Compare the fields of this operator with an operator of the same class. */
    protected abstract boolean sameStructure(OTOperator other);

    public OTOperatorBinding bind(OTExpression field) {
        return new OTOperatorBinding(this, field);
    }

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
        OTOperator other = (OTOperator) o;
        if (this.hashCode() != other.hashCode())
            return false;
        return this.sameStructure(other);
    }
}
