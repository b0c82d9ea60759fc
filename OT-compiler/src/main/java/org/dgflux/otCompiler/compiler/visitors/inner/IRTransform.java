package org.dgflux.otCompiler.compiler.visitors.inner;

import org.dgflux.otCompiler.ir.IOTInnerNode;
import org.dgflux.util.ICastable;

import java.util.function.Function;

/** A transformation of operator templates. */
public interface IRTransform extends Function<IOTInnerNode, IOTInnerNode>, ICastable {}
