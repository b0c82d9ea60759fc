package org.dgflux.otCompiler.ir.type;

/** A type whose values are known to live in the volume. */
public interface IVolumeType {}
