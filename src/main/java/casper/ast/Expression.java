package casper.ast;

import casper.types.TypeKind;

public abstract class Expression extends Node {

    private TypeKind type;

    /** Type inferred by semantic analysis; null before analysis or for calls without a result. */
    public TypeKind getType() {
        return type;
    }

    public void setType(TypeKind type) {
        this.type = type;
    }
}
