package org.dgflux.otCompiler.ir;

import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;

/** A node which can be traversed by an {@link InnerVisitor}. */
public interface IOTInnerNode extends IOTNode {
    void accept(InnerVisitor visitor);

    default boolean isExpression() {
        return false;
    }
}
