package casper.ast;

public class SubscriptedExpression extends Expression {

    private final Expression base;
    private final Expression index;

    public SubscriptedExpression(Expression base, Expression index) {
        this.base = base;
        this.index = index;
    }

    public Expression getBase() {
        return base;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitSubscriptedExpression(this);
    }
}
