package org.dgflux.util;

/** An object that can print itself on an {@link IIndentStream}. */
public interface ToIndentableString {
    IIndentStream toString(IIndentStream builder);
}
