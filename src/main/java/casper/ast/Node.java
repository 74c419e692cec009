package casper.ast;

/**
 * Root of the Casper AST. Structural fields of every node are final; the only
 * state that may be attached after construction is positional and analysis
 * metadata.
 */
public abstract class Node {

    private int line;

    /** Source line this node starts on, or 0 when the node was synthesised. */
    public int getLine() {
        return line;
    }

    /** Records the source line. Only the first call has any effect. */
    public void setLine(int line) {
        if (this.line == 0) {
            this.line = line;
        }
    }

    public abstract <R> R accept(AstVisitor<R> visitor);
}
