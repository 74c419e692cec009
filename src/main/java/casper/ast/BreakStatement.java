package casper.ast;

public class BreakStatement extends Statement {

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitBreakStatement(this);
    }
}
