package casper.ast;

import casper.types.TypeKind;

public class Parameter extends Node {

    private final TypeKind type;
    private final String name;
    private final Expression defaultValue;

    public Parameter(TypeKind type, String name, Expression defaultValue) {
        this.type = type;
        this.name = name;
        this.defaultValue = defaultValue;
    }

    public TypeKind getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    /** Value used when the caller omits this argument, or null if it is required. */
    public Expression getDefaultValue() {
        return defaultValue;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitParameter(this);
    }
}
