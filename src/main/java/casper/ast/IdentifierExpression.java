package casper.ast;

public class IdentifierExpression extends Expression {

    private final String name;
    private Node referent;

    public IdentifierExpression(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** Declaration this identifier resolved to during analysis. */
    public Node getReferent() {
        return referent;
    }

    public void setReferent(Node referent) {
        this.referent = referent;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifierExpression(this);
    }
}
