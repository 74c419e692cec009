package casper.ast;

/**
 * {@code ifTrue if test else ifFalse}
 */
public class TernaryExpression extends Expression {

    private final Expression test;
    private final Expression ifTrue;
    private final Expression ifFalse;

    public TernaryExpression(Expression test, Expression ifTrue, Expression ifFalse) {
        this.test = test;
        this.ifTrue = ifTrue;
        this.ifFalse = ifFalse;
    }

    public Expression getTest() {
        return test;
    }

    public Expression getIfTrue() {
        return ifTrue;
    }

    public Expression getIfFalse() {
        return ifFalse;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitTernaryExpression(this);
    }
}
