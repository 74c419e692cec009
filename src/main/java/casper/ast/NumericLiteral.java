package casper.ast;

public class NumericLiteral extends Expression {

    private final double value;

    public NumericLiteral(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitNumericLiteral(this);
    }
}
