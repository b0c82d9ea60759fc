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

package org.dgflux.otCompiler.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dgflux.otCompiler.compiler.errors.InternalCompilerError;
import org.dgflux.otCompiler.compiler.errors.TypeConflictError;
import org.dgflux.otCompiler.ir.expression.OTExpression;
import org.dgflux.util.ICastable;

import javax.annotation.Nullable;

/**
 * A piece of information about the values an expression produces.
 *
 * <p>Type information forms a lattice.  {@link NoType} is the bottom,
 * the "Known" types carry one aspect of the final type (its domain or its
 * representation), and the {@link FinalType} subclasses are fully specified.
 * {@link #unify} computes the most specific type consistent with two types.
 *
 * <p>Type information objects are immutable values compared structurally. */
public abstract class TypeInfo implements ICastable {
    /** Return a type that can represent both {@code this} and {@code other}.
     *
     * @param other       Type to unify with.
     * @param expression  Expression the types describe; only used for diagnostics.
     * @throws TypeConflictError if the types are incompatible. */
    public final TypeInfo unify(TypeInfo other, @Nullable OTExpression expression) {
        if (this.equals(other))
            return this;

        @Nullable TypeInfo direct = this.unifyInner(other);
        @Nullable TypeInfo reverse = other.unifyInner(this);
        if (direct == null) {
            if (reverse == null)
                throw new TypeConflictError(this, other, expression);
            return reverse;
        } else if (reverse == null) {
            return direct;
        }

        if (!direct.equals(reverse))
            throw new InternalCompilerError("types '" + this + "' and '" + other +
                    "' don't agree about their unifier: '" + direct + "' vs '" + reverse + "'", expression);
        return direct;
    }

    public final TypeInfo unify(TypeInfo other) {
        return this.unify(other, null);
    }

    /** Attempt to unify {@code this} with {@code other}.
     * Subclasses only handle the combinations they know about;
     * {@link #unify} tries both orders.
     * @return null if this class has no rule for {@code other}. */
    @Nullable
    protected TypeInfo unifyInner(TypeInfo other) {
        return null;
    }

    /** True if no more information can be added to this type. */
    public boolean isFinal() {
        return false;
    }

    /** The representation part of this type, as a {@link KnownRepresentation},
     * or {@link NoType} if the representation is not known. */
    public TypeInfo extractRepresentation() {
        if (this instanceof IHasRepresentation withRepresentation)
            return new KnownRepresentation(withRepresentation.getRepresentation());
        return new NoType();
    }

    /** The domain part of this type: {@link KnownVolume}, {@link KnownBoundary},
     * or {@link NoType} for anything else. */
    public TypeInfo extractDomain() {
        if (this instanceof IVolumeType)
            return new KnownVolume();
        if (this instanceof IBoundaryType boundary)
            return new KnownBoundary(boundary.getBoundaryTag());
        return new NoType();
    }

    /** Short name of this kind of type, used for serialization. */
    public abstract String getKind();

    /** Add the fields of this type to its JSON representation. */
    protected void addJsonFields(ObjectMapper mapper, ObjectNode node) {}

    public JsonNode toJson(ObjectMapper mapper) {
        ObjectNode result = mapper.createObjectNode();
        result.put("kind", this.getKind());
        this.addJsonFields(mapper, result);
        return result;
    }

    @Override
    public abstract boolean equals(@Nullable Object o);

    @Override
    public abstract int hashCode();
}
