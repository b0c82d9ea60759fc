package org.dgflux.util;

/** An object with a unique numeric id, used in logs. */
public interface IHasId {
    long getId();
}
