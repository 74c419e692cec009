package casper.types;

/**
 * Structural descriptor of a value's static type. Two descriptors are equal
 * when they have the same shape.
 */
public abstract class TypeKind {

    /**
     * Whether a value of this type may be stored where {@code target} is
     * expected. Collection types with an unknown element type (the type of an
     * empty literal) are assignable to any collection of the same shape.
     */
    public boolean isAssignableTo(TypeKind target) {
        return equals(target);
    }

    static boolean elementAssignable(TypeKind source, TypeKind target) {
        return source == null || source.isAssignableTo(target);
    }

    /** Source-level spelling, e.g. {@code dict<string, num>}. */
    public abstract String getName();

    @Override
    public String toString() {
        return getName();
    }
}
