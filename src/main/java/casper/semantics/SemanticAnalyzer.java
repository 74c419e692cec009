package casper.semantics;

import casper.ast.Argument;
import casper.ast.AssignmentStatement;
import casper.ast.AstVisitor;
import casper.ast.BinaryExpression;
import casper.ast.BooleanLiteral;
import casper.ast.BreakStatement;
import casper.ast.Call;
import casper.ast.CallStatement;
import casper.ast.DictionaryExpression;
import casper.ast.Expression;
import casper.ast.FromStatement;
import casper.ast.FunctionDeclaration;
import casper.ast.IdentifierDeclaration;
import casper.ast.IdentifierExpression;
import casper.ast.IfStatement;
import casper.ast.KeyValueExpression;
import casper.ast.ListExpression;
import casper.ast.Node;
import casper.ast.NumericLiteral;
import casper.ast.Parameter;
import casper.ast.Program;
import casper.ast.ReturnStatement;
import casper.ast.SetExpression;
import casper.ast.Statement;
import casper.ast.StringLiteral;
import casper.ast.SubscriptedExpression;
import casper.ast.TernaryExpression;
import casper.ast.UnaryExpression;
import casper.ast.VariableDeclaration;
import casper.ast.WhileStatement;
import casper.error.SemanticError;
import casper.types.BooleanType;
import casper.types.DictType;
import casper.types.ListType;
import casper.types.NumType;
import casper.types.SetType;
import casper.types.StringType;
import casper.types.TypeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Validates an AST in one recursive walk, threading a {@link Context} through
 * every scope-introducing construct. Expression visits return the inferred
 * type and cache it on the node; statement visits return null. The first
 * violated rule aborts the walk with a {@link SemanticError}.
 */
public class SemanticAnalyzer implements AstVisitor<TypeKind> {

    private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private Context context;

    /** Analyzes a whole program in a fresh root context. */
    public void analyze(Program program) {
        analyze(program, Context.root());
    }

    /**
     * Analyzes {@code node} inside {@code context}; returns the inferred type
     * for expressions and null for statements. A program's top-level
     * statements are bound directly in {@code context}.
     */
    public TypeKind analyze(Node node, Context context) {
        Context saved = this.context;
        this.context = context;
        try {
            return node.accept(this);
        } finally {
            this.context = saved;
        }
    }

    // =====================================================================
    // CONTEXT MANAGEMENT
    // =====================================================================

    private void analyzeBlock(List<Statement> statements, Context blockContext) {
        Context saved = context;
        context = blockContext;
        logger.debug("Pushed context: {}", blockContext);
        try {
            for (Statement statement : statements) {
                statement.accept(this);
            }
        } finally {
            context = saved;
            logger.debug("Popped context: {}", blockContext.getFullPath());
        }
    }

    // =====================================================================
    // STATEMENTS
    // =====================================================================

    @Override
    public TypeKind visitProgram(Program node) {
        analyzeBlock(node.getBody(), context);
        logger.debug("Semantic analysis passed for {} top-level statements", node.getBody().size());
        return null;
    }

    @Override
    public TypeKind visitWhileStatement(WhileStatement node) {
        requireType(node.getTest(), BooleanType.INSTANCE, "while condition");
        analyzeBlock(node.getBody(), context.createChildContextForLoop());
        return null;
    }

    @Override
    public TypeKind visitIfStatement(IfStatement node) {
        for (int i = 0; i < node.getTests().size(); i++) {
            requireType(node.getTests().get(i), BooleanType.INSTANCE, "if condition");
            analyzeBlock(node.getConsequents().get(i), context.createChildContextForBlock());
        }
        if (node.getAlternate() != null) {
            analyzeBlock(node.getAlternate(), context.createChildContextForBlock());
        }
        return null;
    }

    @Override
    public TypeKind visitFromStatement(FromStatement node) {
        requireType(node.getTests().get(0), NumType.INSTANCE, "loop lower bound");
        requireType(node.getTests().get(1), NumType.INSTANCE, "loop upper bound");

        Context loopContext = context.createChildContextForLoop();
        loopContext.add(node.getLoopVariable(), node);
        Context saved = context;
        context = loopContext;
        try {
            for (Statement increment : node.getIncrements()) {
                increment.accept(this);
            }
        } finally {
            context = saved;
        }
        analyzeBlock(node.getBody(), loopContext);
        return null;
    }

    @Override
    public TypeKind visitBreakStatement(BreakStatement node) {
        if (!context.isInLoop()) {
            throw new SemanticError(SemanticError.Kind.BREAK_OUTSIDE_LOOP, null, node.getLine());
        }
        return null;
    }

    @Override
    public TypeKind visitReturnStatement(ReturnStatement node) {
        TypeKind expected = context.getEnclosingFunctionReturnType();
        if (expected == null) {
            throw new SemanticError(SemanticError.Kind.RETURN_OUTSIDE_FUNCTION, null, node.getLine());
        }
        if (node.getValue() == null) {
            throw mismatch(node, "missing return value of type " + expected);
        }
        TypeKind actual = analyzeValue(node.getValue());
        checkAssignable(actual, expected, node, "return value");
        return null;
    }

    @Override
    public TypeKind visitFunctionDeclaration(FunctionDeclaration node) {
        context.add(node.getName(), node);

        boolean seenDefault = false;
        for (Parameter parameter : node.getParameters()) {
            if (parameter.getDefaultValue() != null) {
                seenDefault = true;
            } else if (seenDefault) {
                throw new SemanticError(SemanticError.Kind.PARAMETER_ORDER, parameter.getName(), parameter.getLine());
            }
            parameter.accept(this);
        }

        Context bodyContext = context.createChildContextForFunctionBody(node);
        for (Parameter parameter : node.getParameters()) {
            bodyContext.add(parameter.getName(), parameter);
        }
        analyzeBlock(node.getBody(), bodyContext);
        return null;
    }

    @Override
    public TypeKind visitVariableDeclaration(VariableDeclaration node) {
        context.add(node.getName().getName(), node);
        TypeKind actual = analyzeValue(node.getInitializer());
        checkAssignable(actual, node.getType(), node, "initializer of " + node.getName().getName());
        return null;
    }

    @Override
    public TypeKind visitAssignmentStatement(AssignmentStatement node) {
        TypeKind targetType = analyzeValue(node.getTarget());
        TypeKind valueType = analyzeValue(node.getValue());
        checkAssignable(valueType, targetType, node, "assignment");
        return null;
    }

    @Override
    public TypeKind visitCallStatement(CallStatement node) {
        node.getCall().accept(this);
        return null;
    }

    // =====================================================================
    // EXPRESSIONS
    // =====================================================================

    @Override
    public TypeKind visitBinaryExpression(BinaryExpression node) {
        TypeKind left = analyzeValue(node.getLeft());
        TypeKind right = analyzeValue(node.getRight());
        TypeKind result;
        switch (node.getOp()) {
            case "+":
                if (!(isNum(left) && isNum(right)) && !(isString(left) && isString(right))) {
                    throw operandMismatch(node, "two nums or two strings", left, right);
                }
                result = left;
                break;
            case "-":
            case "*":
            case "/":
            case "%":
                if (!isNum(left) || !isNum(right)) {
                    throw operandMismatch(node, "num operands", left, right);
                }
                result = NumType.INSTANCE;
                break;
            case "<":
            case "<=":
            case ">":
            case ">=":
                if (!isNum(left) || !isNum(right)) {
                    throw operandMismatch(node, "num operands", left, right);
                }
                result = BooleanType.INSTANCE;
                break;
            case "==":
            case "!=":
                if (!left.isAssignableTo(right) && !right.isAssignableTo(left)) {
                    throw operandMismatch(node, "operands of the same type", left, right);
                }
                result = BooleanType.INSTANCE;
                break;
            case "and":
            case "or":
                if (!isBoolean(left) || !isBoolean(right)) {
                    throw operandMismatch(node, "bool operands", left, right);
                }
                result = BooleanType.INSTANCE;
                break;
            default:
                throw new IllegalStateException("Unknown binary operator " + node.getOp());
        }
        node.setType(result);
        return result;
    }

    @Override
    public TypeKind visitUnaryExpression(UnaryExpression node) {
        TypeKind operand = analyzeValue(node.getOperand());
        TypeKind expected = "not".equals(node.getOp()) ? BooleanType.INSTANCE : NumType.INSTANCE;
        if (!operand.equals(expected)) {
            throw mismatch(node, "operator " + node.getOp() + " needs a " + expected + " operand, found " + operand);
        }
        node.setType(expected);
        return expected;
    }

    @Override
    public TypeKind visitTernaryExpression(TernaryExpression node) {
        requireType(node.getTest(), BooleanType.INSTANCE, "conditional test");
        TypeKind ifTrue = analyzeValue(node.getIfTrue());
        TypeKind ifFalse = analyzeValue(node.getIfFalse());
        TypeKind result = unify(ifTrue, ifFalse, node, "conditional branches");
        node.setType(result);
        return result;
    }

    @Override
    public TypeKind visitListExpression(ListExpression node) {
        TypeKind result = new ListType(elementType(node.getElements(), node, "list elements"));
        node.setType(result);
        return result;
    }

    @Override
    public TypeKind visitSetExpression(SetExpression node) {
        TypeKind result = new SetType(elementType(node.getElements(), node, "set elements"));
        node.setType(result);
        return result;
    }

    @Override
    public TypeKind visitDictionaryExpression(DictionaryExpression node) {
        TypeKind keyType = null;
        TypeKind valueType = null;
        for (KeyValueExpression entry : node.getEntries()) {
            entry.accept(this);
            TypeKind key = entry.getKey().getType();
            TypeKind value = entry.getValue().getType();
            keyType = keyType == null ? key : unify(keyType, key, entry, "dictionary keys");
            valueType = valueType == null ? value : unify(valueType, value, entry, "dictionary values");
        }
        TypeKind result = new DictType(keyType, valueType);
        node.setType(result);
        return result;
    }

    @Override
    public TypeKind visitKeyValueExpression(KeyValueExpression node) {
        analyzeValue(node.getKey());
        return analyzeValue(node.getValue());
    }

    @Override
    public TypeKind visitCall(Call node) {
        if (!(node.getCallee() instanceof IdentifierExpression)) {
            throw new SemanticError(SemanticError.Kind.NOT_CALLABLE, "subscripted expression", node.getLine());
        }
        IdentifierExpression callee = (IdentifierExpression) node.getCallee();
        Node declaration = context.lookup(callee.getName(), callee.getLine());
        callee.setReferent(declaration);
        if (!(declaration instanceof FunctionDeclaration)) {
            throw new SemanticError(SemanticError.Kind.NOT_CALLABLE, callee.getName(), node.getLine());
        }
        FunctionDeclaration function = (FunctionDeclaration) declaration;

        List<Parameter> parameters = function.getParameters();
        List<Argument> arguments = node.getArguments();
        int required = function.getRequiredParameterCount();
        if (arguments.size() < required || arguments.size() > parameters.size()) {
            String expected = required == parameters.size()
                ? String.valueOf(required)
                : required + " to " + parameters.size();
            throw new SemanticError(SemanticError.Kind.ARITY_MISMATCH,
                function.getName() + " expects " + expected + " argument(s), got " + arguments.size(),
                node.getLine());
        }
        for (int i = 0; i < arguments.size(); i++) {
            TypeKind actual = arguments.get(i).accept(this);
            Parameter parameter = parameters.get(i);
            checkAssignable(actual, parameter.getType(), arguments.get(i),
                "argument " + parameter.getName() + " of " + function.getName());
        }

        node.setType(function.getReturnType());
        return function.getReturnType();
    }

    @Override
    public TypeKind visitSubscriptedExpression(SubscriptedExpression node) {
        TypeKind base = analyzeValue(node.getBase());
        TypeKind index = analyzeValue(node.getIndex());
        TypeKind result;
        if (base instanceof ListType) {
            requireIndex(index, NumType.INSTANCE, node);
            result = ((ListType) base).getElementType();
        } else if (base instanceof DictType) {
            requireIndex(index, ((DictType) base).getKeyType(), node);
            result = ((DictType) base).getValueType();
        } else if (isString(base)) {
            requireIndex(index, NumType.INSTANCE, node);
            result = StringType.INSTANCE;
        } else {
            throw mismatch(node, "type " + base + " is not subscriptable");
        }
        if (result == null) {
            throw mismatch(node, "cannot subscript an empty collection literal");
        }
        node.setType(result);
        return result;
    }

    @Override
    public TypeKind visitIdentifierExpression(IdentifierExpression node) {
        Node declaration = context.lookup(node.getName(), node.getLine());
        node.setReferent(declaration);
        TypeKind type;
        if (declaration instanceof VariableDeclaration) {
            type = ((VariableDeclaration) declaration).getType();
        } else if (declaration instanceof Parameter) {
            type = ((Parameter) declaration).getType();
        } else if (declaration instanceof FromStatement) {
            type = NumType.INSTANCE;
        } else {
            throw mismatch(node, "function " + node.getName() + " used as a value");
        }
        node.setType(type);
        return type;
    }

    @Override
    public TypeKind visitIdentifierDeclaration(IdentifierDeclaration node) {
        return null;
    }

    @Override
    public TypeKind visitParameter(Parameter node) {
        if (node.getDefaultValue() != null) {
            TypeKind actual = analyzeValue(node.getDefaultValue());
            checkAssignable(actual, node.getType(), node, "default value of " + node.getName());
        }
        return node.getType();
    }

    @Override
    public TypeKind visitArgument(Argument node) {
        return analyzeValue(node.getValue());
    }

    @Override
    public TypeKind visitBooleanLiteral(BooleanLiteral node) {
        node.setType(BooleanType.INSTANCE);
        return BooleanType.INSTANCE;
    }

    @Override
    public TypeKind visitNumericLiteral(NumericLiteral node) {
        node.setType(NumType.INSTANCE);
        return NumType.INSTANCE;
    }

    @Override
    public TypeKind visitStringLiteral(StringLiteral node) {
        node.setType(StringType.INSTANCE);
        return StringType.INSTANCE;
    }

    // =====================================================================
    // TYPE CHECKING HELPERS
    // =====================================================================

    /** Analyzes an expression that must produce a value. */
    private TypeKind analyzeValue(Expression expression) {
        TypeKind type = expression.accept(this);
        if (type == null) {
            throw mismatch(expression, "expression produces no value");
        }
        return type;
    }

    private void requireType(Expression expression, TypeKind expected, String what) {
        TypeKind actual = analyzeValue(expression);
        checkAssignable(actual, expected, expression, what);
    }

    private void requireIndex(TypeKind index, TypeKind expected, Node node) {
        checkAssignable(index, expected, node, "subscript");
    }

    private TypeKind elementType(List<Expression> elements, Node node, String what) {
        TypeKind result = null;
        for (Expression element : elements) {
            TypeKind type = analyzeValue(element);
            result = result == null ? type : unify(result, type, node, what);
        }
        return result;
    }

    /** The more specific of two types when one is assignable to the other. */
    private TypeKind unify(TypeKind first, TypeKind second, Node node, String what) {
        if (first.isAssignableTo(second)) {
            return second;
        }
        if (second.isAssignableTo(first)) {
            return first;
        }
        throw mismatch(node, what + " have different types " + first + " and " + second);
    }

    private void checkAssignable(TypeKind actual, TypeKind expected, Node node, String what) {
        if (!actual.isAssignableTo(expected)) {
            throw mismatch(node, what + ": expected " + expected + " but found " + actual);
        }
    }

    private static SemanticError operandMismatch(BinaryExpression node, String expected, TypeKind left,
                                                 TypeKind right) {
        return mismatch(node, "operator " + node.getOp() + " needs " + expected + ", found " + left + " and " + right);
    }

    private static SemanticError mismatch(Node node, String detail) {
        return new SemanticError(SemanticError.Kind.TYPE_MISMATCH, detail, node.getLine());
    }

    private static boolean isNum(TypeKind type) {
        return NumType.INSTANCE.equals(type);
    }

    private static boolean isString(TypeKind type) {
        return StringType.INSTANCE.equals(type);
    }

    private static boolean isBoolean(TypeKind type) {
        return BooleanType.INSTANCE.equals(type);
    }
}
