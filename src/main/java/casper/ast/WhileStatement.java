package casper.ast;

import java.util.List;

public class WhileStatement extends Statement {

    private final Expression test;
    private final List<Statement> body;

    public WhileStatement(Expression test, List<Statement> body) {
        this.test = test;
        this.body = List.copyOf(body);
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitWhileStatement(this);
    }
}
