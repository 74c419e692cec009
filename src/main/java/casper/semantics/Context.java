package casper.semantics;

import casper.ast.FunctionDeclaration;
import casper.ast.Node;
import casper.error.SemanticError;
import casper.types.TypeKind;

import java.util.HashMap;
import java.util.Map;

/**
 * A lexical scope in the tree of scopes built during analysis. A context owns
 * its own bindings and only reads through its parent when a lookup misses
 * locally. The control-flow flags are copied from the parent when the child
 * is created, so they never need a walk up the chain.
 */
public class Context {

    public enum Type {
        PRELUDE,
        PROGRAM,
        BLOCK,
        LOOP,
        FUNCTION
    }

    private final String name;
    private final Type type;
    private final Context parent;
    private final Map<String, Node> locals = new HashMap<>();
    private final boolean inLoop;
    private final TypeKind enclosingFunctionReturnType;

    private Context(String name, Type type, Context parent, boolean inLoop,
                    TypeKind enclosingFunctionReturnType) {
        this.name = name;
        this.type = type;
        this.parent = parent;
        this.inLoop = inLoop;
        this.enclosingFunctionReturnType = enclosingFunctionReturnType;
    }

    /**
     * Scope for a whole program. Its parent holds the built-in functions, so
     * a program may shadow a built-in but not redeclare its own top-level names.
     */
    public static Context root() {
        Context prelude = new Context("PRELUDE", Type.PRELUDE, null, false, null);
        for (FunctionDeclaration builtin : Builtins.functions()) {
            prelude.add(builtin.getName(), builtin);
        }
        return new Context("PROGRAM", Type.PROGRAM, prelude, false, null);
    }

    public Context createChildContextForBlock() {
        return new Context("BLOCK", Type.BLOCK, this, inLoop, enclosingFunctionReturnType);
    }

    public Context createChildContextForLoop() {
        return new Context("LOOP", Type.LOOP, this, true, enclosingFunctionReturnType);
    }

    /** Body scope of {@code function}; a loop around the declaration does not extend into it. */
    public Context createChildContextForFunctionBody(FunctionDeclaration function) {
        return new Context(function.getName(), Type.FUNCTION, this, false, function.getReturnType());
    }

    // =====================================================================
    // BINDINGS
    // =====================================================================

    /** Binds {@code name} in this scope; a second binding in the same scope is a redeclaration. */
    public void add(String name, Node declaration) {
        if (locals.containsKey(name)) {
            throw new SemanticError(SemanticError.Kind.REDECLARATION, name, declaration.getLine());
        }
        locals.put(name, declaration);
    }

    /** Resolves {@code name} from this scope outwards. */
    public Node lookup(String name, int line) {
        for (Context context = this; context != null; context = context.parent) {
            Node declaration = context.locals.get(name);
            if (declaration != null) {
                return declaration;
            }
        }
        throw new SemanticError(SemanticError.Kind.UNDECLARED_IDENTIFIER, name, line);
    }

    public boolean isDeclaredLocally(String name) {
        return locals.containsKey(name);
    }

    // =====================================================================
    // FLAGS AND ACCESSORS
    // =====================================================================

    public boolean isInLoop() {
        return inLoop;
    }

    /** Return type of the innermost enclosing function; null where {@code return} is not allowed. */
    public TypeKind getEnclosingFunctionReturnType() {
        return enclosingFunctionReturnType;
    }

    public String getName() {
        return name;
    }

    public Type getType() {
        return type;
    }

    public Context getParent() {
        return parent;
    }

    public String getFullPath() {
        if (parent == null) {
            return name;
        }
        return parent.getFullPath() + "." + name;
    }

    @Override
    public String toString() {
        return String.format("Context{path='%s', type=%s, inLoop=%s, returnType=%s}",
            getFullPath(), type, inLoop, enclosingFunctionReturnType);
    }
}
