package casper.error;

/**
 * Raised by the preprocessor or the grammar matcher when the input does not
 * match the Casper grammar.
 */
public class SyntaxError extends CompileError {

    private final int column;

    public SyntaxError(String message, int line, int column) {
        super(message, line);
        this.column = column;
    }

    public int getColumn() {
        return column;
    }
}
