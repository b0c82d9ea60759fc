package org.dgflux.otCompiler.compiler;

/** Interface implemented by objects that belong to a compiler instance. */
public interface ICompilerComponent {
    OTCompiler compiler();
}
