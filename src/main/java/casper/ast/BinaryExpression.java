package casper.ast;

public class BinaryExpression extends Expression {

    private final String op;
    private final Expression left;
    private final Expression right;

    public BinaryExpression(String op, Expression left, Expression right) {
        this.op = op;
        this.left = left;
        this.right = right;
    }

    public String getOp() {
        return op;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBinaryExpression(this);
    }
}
