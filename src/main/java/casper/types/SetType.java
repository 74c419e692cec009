package casper.types;

import java.util.Objects;

public final class SetType extends TypeKind {

    private final TypeKind elementType;

    public SetType(TypeKind elementType) {
        this.elementType = elementType;
    }

    /** Element type, or null for the type of an empty set literal. */
    public TypeKind getElementType() {
        return elementType;
    }

    @Override
    public boolean isAssignableTo(TypeKind target) {
        return target instanceof SetType
            && elementAssignable(elementType, ((SetType) target).elementType);
    }

    @Override
    public String getName() {
        return "set<" + (elementType == null ? "?" : elementType.getName()) + ">";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SetType)) return false;
        return Objects.equals(elementType, ((SetType) o).elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash("set", elementType);
    }
}
