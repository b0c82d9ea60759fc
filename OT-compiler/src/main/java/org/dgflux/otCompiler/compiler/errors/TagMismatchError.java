package org.dgflux.otCompiler.compiler.errors;

import org.dgflux.otCompiler.ir.IOTNode;

/** A tag recorded on an operator or leaf disagrees with the tag of the enclosing boundary pair. */
public class TagMismatchError extends BaseCompilerException {
    public static final String KIND = "Tag mismatch";

    public final Object tag;
    public final Object pairTag;

    public TagMismatchError(String construct, Object tag, Object pairTag, IOTNode where) {
        super(construct + " and BoundaryPair do not agree about boundary tag: " +
                tag + " vs " + pairTag, where);
        this.tag = tag;
        this.pairTag = pairTag;
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
