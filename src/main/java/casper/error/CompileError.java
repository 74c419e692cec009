package casper.error;

/**
 * Base of every diagnostic the front end raises. A compile error rejects the
 * whole program; there is never more than one per run.
 */
public abstract class CompileError extends RuntimeException {

    private final int line;

    protected CompileError(String message, int line) {
        super(message);
        this.line = line;
    }

    /** Source line the error was detected on, or 0 when unknown. */
    public int getLine() {
        return line;
    }
}
