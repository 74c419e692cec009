package casper.ast;

import java.util.List;

public class Call extends Expression {

    private final Expression callee;
    private final List<Argument> arguments;

    public Call(Expression callee, List<Argument> arguments) {
        this.callee = callee;
        this.arguments = List.copyOf(arguments);
    }

    public Expression getCallee() {
        return callee;
    }

    public List<Argument> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitCall(this);
    }
}
