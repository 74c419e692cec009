package casper.ast;

import java.util.List;

public class Program extends Node {

    private final List<Statement> body;

    public Program(List<Statement> body) {
        this.body = List.copyOf(body);
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
