package casper.types;

import java.util.Objects;

public final class DictType extends TypeKind {

    private final TypeKind keyType;
    private final TypeKind valueType;

    public DictType(TypeKind keyType, TypeKind valueType) {
        this.keyType = keyType;
        this.valueType = valueType;
    }

    public TypeKind getKeyType() {
        return keyType;
    }

    public TypeKind getValueType() {
        return valueType;
    }

    @Override
    public boolean isAssignableTo(TypeKind target) {
        if (!(target instanceof DictType)) {
            return false;
        }
        DictType other = (DictType) target;
        return elementAssignable(keyType, other.keyType) && elementAssignable(valueType, other.valueType);
    }

    @Override
    public String getName() {
        if (keyType == null) {
            return "dict<?, ?>";
        }
        return "dict<" + keyType.getName() + ", " + valueType.getName() + ">";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DictType)) return false;
        DictType other = (DictType) o;
        return Objects.equals(keyType, other.keyType) && Objects.equals(valueType, other.valueType);
    }

    @Override
    public int hashCode() {
        return Objects.hash("dict", keyType, valueType);
    }
}
