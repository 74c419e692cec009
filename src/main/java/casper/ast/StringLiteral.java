package casper.ast;

/**
 * String literal as written, quotes and escape sequences included.
 */
public class StringLiteral extends Expression {

    private final String rawText;

    public StringLiteral(String rawText) {
        this.rawText = rawText;
    }

    public String getRawText() {
        return rawText;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }
}
