package org.dgflux.util;

/** An {@link IndentStream} that accumulates its output in a string. */
public class IndentStreamBuilder extends IndentStream {
    public IndentStreamBuilder() {
        super(new StringBuilder());
    }
}
