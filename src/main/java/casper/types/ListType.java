package casper.types;

import java.util.Objects;

public final class ListType extends TypeKind {

    private final TypeKind elementType;

    public ListType(TypeKind elementType) {
        this.elementType = elementType;
    }

    /** Element type, or null for the type of an empty list literal. */
    public TypeKind getElementType() {
        return elementType;
    }

    @Override
    public boolean isAssignableTo(TypeKind target) {
        return target instanceof ListType
            && elementAssignable(elementType, ((ListType) target).elementType);
    }

    @Override
    public String getName() {
        return "list<" + (elementType == null ? "?" : elementType.getName()) + ">";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListType)) return false;
        return Objects.equals(elementType, ((ListType) o).elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash("list", elementType);
    }
}
