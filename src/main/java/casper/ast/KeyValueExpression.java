package casper.ast;

public class KeyValueExpression extends Node {

    private final Expression key;
    private final Expression value;

    public KeyValueExpression(Expression key, Expression value) {
        this.key = key;
        this.value = value;
    }

    public Expression getKey() {
        return key;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitKeyValueExpression(this);
    }
}
