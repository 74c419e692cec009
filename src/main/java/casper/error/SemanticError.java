package casper.error;

/**
 * Raised by the semantic analyzer on the first violated static rule.
 */
public class SemanticError extends CompileError {

    public enum Kind {
        REDECLARATION("redeclaration of name"),
        UNDECLARED_IDENTIFIER("identifier not declared"),
        BREAK_OUTSIDE_LOOP("break statement outside loop"),
        RETURN_OUTSIDE_FUNCTION("return statement outside function"),
        TYPE_MISMATCH("type mismatch"),
        ARITY_MISMATCH("wrong number of arguments"),
        NOT_CALLABLE("not a function"),
        PARAMETER_ORDER("parameter without default follows parameter with default");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Kind kind;

    public SemanticError(Kind kind, String detail, int line) {
        super(format(kind, detail, line), line);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    private static String format(Kind kind, String detail, int line) {
        StringBuilder message = new StringBuilder("Semantic Error: ");
        if (line > 0) {
            message.append("line ").append(line).append(" - ");
        }
        message.append(kind.getDescription());
        if (detail != null && !detail.isEmpty()) {
            message.append(": ").append(detail);
        }
        return message.toString();
    }
}
