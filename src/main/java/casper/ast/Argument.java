package casper.ast;

public class Argument extends Node {

    private final Expression value;

    public Argument(Expression value) {
        this.value = value;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitArgument(this);
    }
}
