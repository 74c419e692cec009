package casper.ast;

public class UnaryExpression extends Expression {

    private final String op;
    private final Expression operand;

    public UnaryExpression(String op, Expression operand) {
        this.op = op;
        this.operand = operand;
    }

    public String getOp() {
        return op;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitUnaryExpression(this);
    }
}
