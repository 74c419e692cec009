package casper.ast;

public class AssignmentStatement extends Statement {

    private final Expression target;
    private final Expression value;

    public AssignmentStatement(Expression target, Expression value) {
        this.target = target;
        this.value = value;
    }

    /** An {@link IdentifierExpression} or a {@link SubscriptedExpression} chain over one. */
    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAssignmentStatement(this);
    }
}
