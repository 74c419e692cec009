package casper.types;

public final class BooleanType extends TypeKind {

    public static final BooleanType INSTANCE = new BooleanType();

    private BooleanType() {
    }

    @Override
    public String getName() {
        return "bool";
    }
}
