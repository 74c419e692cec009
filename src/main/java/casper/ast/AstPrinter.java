package casper.ast;

import casper.types.TypeKind;

import java.util.List;

/**
 * Renders an AST as a single-line S-expression, e.g.
 * {@code (Program (Var num x (Binary + (Num 1.0) (Num 2.0))))}.
 */
public class AstPrinter implements AstVisitor<String> {

    public static String print(Node node) {
        return node.accept(new AstPrinter());
    }

    // =====================================================================
    // STATEMENTS
    // =====================================================================

    @Override
    public String visitProgram(Program node) {
        return sexp("Program", join(node.getBody()));
    }

    @Override
    public String visitWhileStatement(WhileStatement node) {
        return sexp("While", node.getTest().accept(this), body(node.getBody()));
    }

    @Override
    public String visitIfStatement(IfStatement node) {
        StringBuilder arms = new StringBuilder();
        for (int i = 0; i < node.getTests().size(); i++) {
            if (i > 0) arms.append(' ');
            arms.append(sexp("Test", node.getTests().get(i).accept(this), body(node.getConsequents().get(i))));
        }
        if (node.getAlternate() != null) {
            arms.append(' ').append(sexp("Else", join(node.getAlternate())));
        }
        return sexp("If", arms.toString());
    }

    @Override
    public String visitFromStatement(FromStatement node) {
        return sexp("From", node.getLoopVariable(),
            node.getTests().get(0).accept(this),
            node.getTests().get(1).accept(this),
            sexp("Increments", join(node.getIncrements())),
            body(node.getBody()));
    }

    @Override
    public String visitBreakStatement(BreakStatement node) {
        return "(Break)";
    }

    @Override
    public String visitReturnStatement(ReturnStatement node) {
        if (node.getValue() == null) {
            return "(Return)";
        }
        return sexp("Return", node.getValue().accept(this));
    }

    @Override
    public String visitFunctionDeclaration(FunctionDeclaration node) {
        return sexp("Function", typeName(node.getReturnType()), node.getName(),
            sexp("Params", join(node.getParameters())),
            body(node.getBody()));
    }

    @Override
    public String visitVariableDeclaration(VariableDeclaration node) {
        return sexp("Var", typeName(node.getType()), node.getName().accept(this),
            node.getInitializer().accept(this));
    }

    @Override
    public String visitAssignmentStatement(AssignmentStatement node) {
        return sexp("Assign", node.getTarget().accept(this), node.getValue().accept(this));
    }

    @Override
    public String visitCallStatement(CallStatement node) {
        return sexp("Do", node.getCall().accept(this));
    }

    // =====================================================================
    // EXPRESSIONS
    // =====================================================================

    @Override
    public String visitBinaryExpression(BinaryExpression node) {
        return sexp("Binary", node.getOp(), node.getLeft().accept(this), node.getRight().accept(this));
    }

    @Override
    public String visitUnaryExpression(UnaryExpression node) {
        return sexp("Unary", node.getOp(), node.getOperand().accept(this));
    }

    @Override
    public String visitTernaryExpression(TernaryExpression node) {
        return sexp("Ternary", node.getTest().accept(this), node.getIfTrue().accept(this),
            node.getIfFalse().accept(this));
    }

    @Override
    public String visitListExpression(ListExpression node) {
        return sexp("List", join(node.getElements()));
    }

    @Override
    public String visitSetExpression(SetExpression node) {
        return sexp("Set", join(node.getElements()));
    }

    @Override
    public String visitDictionaryExpression(DictionaryExpression node) {
        return sexp("Dict", join(node.getEntries()));
    }

    @Override
    public String visitKeyValueExpression(KeyValueExpression node) {
        return sexp("KeyValue", node.getKey().accept(this), node.getValue().accept(this));
    }

    @Override
    public String visitCall(Call node) {
        return sexp("Call", node.getCallee().accept(this), join(node.getArguments()));
    }

    @Override
    public String visitSubscriptedExpression(SubscriptedExpression node) {
        return sexp("Subscript", node.getBase().accept(this), node.getIndex().accept(this));
    }

    @Override
    public String visitIdentifierExpression(IdentifierExpression node) {
        return sexp("Id", node.getName());
    }

    @Override
    public String visitIdentifierDeclaration(IdentifierDeclaration node) {
        return node.getName();
    }

    @Override
    public String visitParameter(Parameter node) {
        if (node.getDefaultValue() == null) {
            return sexp("Param", typeName(node.getType()), node.getName());
        }
        return sexp("Param", typeName(node.getType()), node.getName(), node.getDefaultValue().accept(this));
    }

    @Override
    public String visitArgument(Argument node) {
        return sexp("Arg", node.getValue().accept(this));
    }

    @Override
    public String visitBooleanLiteral(BooleanLiteral node) {
        return sexp("Bool", String.valueOf(node.getValue()));
    }

    @Override
    public String visitNumericLiteral(NumericLiteral node) {
        return sexp("Num", String.valueOf(node.getValue()));
    }

    @Override
    public String visitStringLiteral(StringLiteral node) {
        return sexp("Str", "\"" + escapeString(node.getRawText()) + "\"");
    }

    // =====================================================================
    // FORMATTING
    // =====================================================================

    private String body(List<? extends Node> statements) {
        return sexp("Body", join(statements));
    }

    private String join(List<? extends Node> nodes) {
        StringBuilder result = new StringBuilder();
        for (Node node : nodes) {
            if (result.length() > 0) {
                result.append(' ');
            }
            result.append(node.accept(this));
        }
        return result.toString();
    }

    private static String sexp(String head, String... parts) {
        StringBuilder result = new StringBuilder("(").append(head);
        for (String part : parts) {
            if (!part.isEmpty()) {
                result.append(' ').append(part);
            }
        }
        return result.append(')').toString();
    }

    private static String typeName(TypeKind type) {
        return type == null ? "none" : type.getName();
    }

    private static String escapeString(String str) {
        if (str == null) return "";
        return str.replace("\\", "\\\\")
                 .replace("\"", "\\\"")
                 .replace("\n", "\\n")
                 .replace("\r", "\\r")
                 .replace("\t", "\\t");
    }
}
