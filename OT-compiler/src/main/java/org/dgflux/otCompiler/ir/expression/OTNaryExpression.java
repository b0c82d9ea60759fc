package org.dgflux.otCompiler.ir.expression;

import com.google.common.collect.ImmutableList;
import org.dgflux.util.IIndentStream;
import org.dgflux.util.Utilities;

import java.util.List;

/** An arithmetic expression with any number of operands, all of the same role. */
public abstract class OTNaryExpression extends OTExpression {
    public final ImmutableList<OTExpression> children;

    protected OTNaryExpression(List<OTExpression> children) {
        Utilities.enforce(!children.isEmpty(), "Empty operand list");
        this.children = ImmutableList.copyOf(children);
    }

    /** Rebuild an expression of the same kind with other operands. */
    public abstract OTNaryExpression replaceChildren(List<OTExpression> children);

    abstract String symbol();

    @Override
    protected int computeHash() {
        return 31 * this.getClass().hashCode() + this.children.hashCode();
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        return this.children.equals(((OTNaryExpression) other).children);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("(");
        boolean first = true;
        for (OTExpression child: this.children) {
            if (!first)
                builder.append(" ").append(this.symbol()).append(" ");
            first = false;
            builder.append(child);
        }
        return builder.append(")");
    }
}
