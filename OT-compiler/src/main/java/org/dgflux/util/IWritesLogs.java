package org.dgflux.util;

/** Marker interface for classes that write to the {@link Logger}. */
public interface IWritesLogs {
    default IIndentStream log(int level) {
        return Logger.INSTANCE.belowLevel(this, level);
    }
}
