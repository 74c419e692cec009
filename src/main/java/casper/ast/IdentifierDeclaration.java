package casper.ast;

public class IdentifierDeclaration extends Node {

    private final String name;

    public IdentifierDeclaration(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitIdentifierDeclaration(this);
    }
}
