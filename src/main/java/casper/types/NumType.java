package casper.types;

public final class NumType extends TypeKind {

    public static final NumType INSTANCE = new NumType();

    private NumType() {
    }

    @Override
    public String getName() {
        return "num";
    }
}
