package casper.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An if/elif chain. {@code tests.get(i)} guards {@code consequents.get(i)};
 * the alternate is the else arm, or null when there is none.
 */
public class IfStatement extends Statement {

    private final List<Expression> tests;
    private final List<List<Statement>> consequents;
    private final List<Statement> alternate;

    public IfStatement(List<Expression> tests, List<List<Statement>> consequents, List<Statement> alternate) {
        if (tests.size() != consequents.size()) {
            throw new IllegalArgumentException("if chain has " + tests.size() + " tests but "
                + consequents.size() + " consequents");
        }
        this.tests = List.copyOf(tests);
        List<List<Statement>> arms = new ArrayList<>();
        for (List<Statement> consequent : consequents) {
            arms.add(List.copyOf(consequent));
        }
        this.consequents = Collections.unmodifiableList(arms);
        this.alternate = alternate == null ? null : List.copyOf(alternate);
    }

    public List<Expression> getTests() {
        return tests;
    }

    public List<List<Statement>> getConsequents() {
        return consequents;
    }

    public List<Statement> getAlternate() {
        return alternate;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIfStatement(this);
    }
}
