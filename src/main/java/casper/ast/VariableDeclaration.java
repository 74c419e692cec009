package casper.ast;

import casper.types.TypeKind;

public class VariableDeclaration extends Statement {

    private final TypeKind type;
    private final IdentifierDeclaration name;
    private final Expression initializer;

    public VariableDeclaration(TypeKind type, IdentifierDeclaration name, Expression initializer) {
        this.type = type;
        this.name = name;
        this.initializer = initializer;
    }

    public TypeKind getType() {
        return type;
    }

    public IdentifierDeclaration getName() {
        return name;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitVariableDeclaration(this);
    }
}
