package casper.ast;

import java.util.List;

public class ListExpression extends Expression {

    private final List<Expression> elements;

    public ListExpression(List<Expression> elements) {
        this.elements = List.copyOf(elements);
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitListExpression(this);
    }
}
