package casper.semantics;

import casper.ast.FunctionDeclaration;
import casper.ast.Parameter;
import casper.types.NumType;
import casper.types.StringType;

import java.util.List;

/**
 * Functions every program can call without declaring them. They have no
 * body; only their signatures take part in analysis.
 */
public final class Builtins {

    private static final List<FunctionDeclaration> FUNCTIONS = List.of(
        new FunctionDeclaration(null, "print",
            List.of(new Parameter(StringType.INSTANCE, "message", null)), List.of()),
        new FunctionDeclaration(NumType.INSTANCE, "sqrt",
            List.of(new Parameter(NumType.INSTANCE, "x", null)), List.of()),
        new FunctionDeclaration(NumType.INSTANCE, "length",
            List.of(new Parameter(StringType.INSTANCE, "s", null)), List.of())
    );

    private Builtins() {
    }

    public static List<FunctionDeclaration> functions() {
        return FUNCTIONS;
    }
}
