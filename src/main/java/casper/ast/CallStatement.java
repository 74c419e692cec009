package casper.ast;

public class CallStatement extends Statement {

    private final Call call;

    public CallStatement(Call call) {
        this.call = call;
    }

    public Call getCall() {
        return call;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCallStatement(this);
    }
}
