package org.dgflux.otCompiler.ir.type;

/** A type to which no more information can be added.
 * It unifies only with equal types and with {@link NoType}. */
public abstract class FinalType extends TypeInfo {
    @Override
    public boolean isFinal() {
        return true;
    }
}
