package org.dgflux.otCompiler.compiler.visitors;

/** Returned by preorder visitor methods: whether to descend into the children of a node. */
public enum VisitDecision {
    STOP,
    CONTINUE;

    public boolean stop() {
        return this.equals(STOP);
    }

    public boolean cont() {
        return this.equals(CONTINUE);
    }
}
