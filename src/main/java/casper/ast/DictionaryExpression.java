package casper.ast;

import java.util.List;

public class DictionaryExpression extends Expression {

    private final List<KeyValueExpression> entries;

    public DictionaryExpression(List<KeyValueExpression> entries) {
        this.entries = List.copyOf(entries);
    }

    public List<KeyValueExpression> getEntries() {
        return entries;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitDictionaryExpression(this);
    }
}
