package org.dgflux.otCompiler.ir;

import org.dgflux.otCompiler.compiler.errors.InternalCompilerError;
import org.dgflux.util.ICastable;
import org.dgflux.util.IHasId;
import org.dgflux.util.ToIndentableString;

import javax.annotation.Nullable;

/** A node of the operator template IR: an expression or an operator. */
public interface IOTNode extends ICastable, IHasId, ToIndentableString {
    default <T> T checkNull(@Nullable T value) {
        if (value == null)
            throw new InternalCompilerError("Did not expect a null value", this);
        return value;
    }

    default void error(String message) {
        throw new InternalCompilerError(message, this);
    }
}
