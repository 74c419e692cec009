package casper.ast;

import java.util.List;

/**
 * Counted loop {@code from i = low to high by increments: body}.
 */
public class FromStatement extends Statement {

    private final String loopVariable;
    private final List<Expression> tests;
    private final List<Statement> increments;
    private final List<Statement> body;

    public FromStatement(String loopVariable, List<Expression> tests, List<Statement> increments,
                         List<Statement> body) {
        if (tests.size() != 2) {
            throw new IllegalArgumentException("from loop needs a lower and an upper bound");
        }
        this.loopVariable = loopVariable;
        this.tests = List.copyOf(tests);
        this.increments = List.copyOf(increments);
        this.body = List.copyOf(body);
    }

    public String getLoopVariable() {
        return loopVariable;
    }

    /** Lower and upper bound, in that order. */
    public List<Expression> getTests() {
        return tests;
    }

    public List<Statement> getIncrements() {
        return increments;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFromStatement(this);
    }
}
