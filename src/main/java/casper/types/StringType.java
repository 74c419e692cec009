package casper.types;

public final class StringType extends TypeKind {

    public static final StringType INSTANCE = new StringType();

    private StringType() {
    }

    @Override
    public String getName() {
        return "string";
    }
}
