package casper.error;

/**
 * A dedent to a depth that no enclosing block ever opened.
 */
public class IndentationError extends SyntaxError {

    public IndentationError(int line, int depth) {
        super(String.format("Syntax Error: line %d - inconsistent indentation, "
                + "dedent to column %d matches no enclosing block", line, depth), line, depth);
    }
}
