package casper.ast;

public class ReturnStatement extends Statement {

    private final Expression value;

    public ReturnStatement(Expression value) {
        this.value = value;
    }

    /** Returned value, or null for a bare {@code return}. */
    public Expression getValue() {
        return value;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitReturnStatement(this);
    }
}
