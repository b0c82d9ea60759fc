package org.dgflux.otCompiler.ir.expression;

import org.dgflux.otCompiler.compiler.visitors.VisitDecision;
import org.dgflux.otCompiler.compiler.visitors.inner.InnerVisitor;
import org.dgflux.util.IIndentStream;

import java.util.Objects;

public final class OTComparisonExpression extends OTExpression {
    public enum ComparisonOperator {
        LT("<"),
        LE("<="),
        EQ("=="),
        NE("!="),
        GE(">="),
        GT(">");

        private final String text;

        ComparisonOperator(String text) {
            this.text = text;
        }

        @Override
        public String toString() {
            return this.text;
        }
    }

    public final OTExpression left;
    public final ComparisonOperator operator;
    public final OTExpression right;

    public OTComparisonExpression(OTExpression left, ComparisonOperator operator, OTExpression right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.left.accept(visitor);
        this.right.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    protected int computeHash() {
        return Objects.hash(OTComparisonExpression.class, this.left, this.operator, this.right);
    }

    @Override
    protected boolean sameStructure(OTExpression other) {
        OTComparisonExpression o = (OTComparisonExpression) other;
        return this.operator == o.operator &&
                this.left.equals(o.left) &&
                this.right.equals(o.right);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.left)
                .append(" ")
                .append(this.operator.toString())
                .append(" ")
                .append(this.right)
                .append(")");
    }
}
