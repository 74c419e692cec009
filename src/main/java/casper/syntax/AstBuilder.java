package casper.syntax;

import casper.ast.Argument;
import casper.ast.AssignmentStatement;
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
import casper.types.BooleanType;
import casper.types.DictType;
import casper.types.ListType;
import casper.types.NumType;
import casper.types.SetType;
import casper.types.StringType;
import casper.types.TypeKind;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the Casper AST from a parse tree. There is one visit method per
 * grammar rule or labelled alternative; each returns a new node, a type
 * descriptor, or a list of nodes, and none of them looks at scopes or types.
 */
public class AstBuilder extends CasperBaseVisitor<Object> {

    public Program build(CasperParser.ProgramContext tree) {
        return (Program) visit(tree);
    }

    // =====================================================================
    // PROGRAM AND STATEMENTS
    // =====================================================================

    @Override
    public Object visitProgram(CasperParser.ProgramContext ctx) {
        return at(ctx, new Program(statements(ctx.statement())));
    }

    @Override
    public Object visitSimpleStmt(CasperParser.SimpleStmtContext ctx) {
        return visit(ctx.simpleStatement());
    }

    @Override
    public Object visitWhileStmt(CasperParser.WhileStmtContext ctx) {
        return at(ctx, new WhileStatement(expression(ctx.expression()), block(ctx.block())));
    }

    @Override
    public Object visitIfStmt(CasperParser.IfStmtContext ctx) {
        List<Expression> tests = new ArrayList<>();
        List<List<Statement>> consequents = new ArrayList<>();
        tests.add(expression(ctx.expression()));
        consequents.add(block(ctx.block()));
        for (CasperParser.ElifClauseContext elif : ctx.elifClause()) {
            tests.add(expression(elif.expression()));
            consequents.add(block(elif.block()));
        }
        List<Statement> alternate = ctx.elseClause() == null ? null : block(ctx.elseClause().block());
        return at(ctx, new IfStatement(tests, consequents, alternate));
    }

    @Override
    public Object visitFromStmt(CasperParser.FromStmtContext ctx) {
        List<Expression> tests = List.of(expression(ctx.expression(0)), expression(ctx.expression(1)));
        List<Statement> increments = ctx.increments() == null
            ? Collections.emptyList()
            : statements(ctx.increments().assignment());
        return at(ctx, new FromStatement(ctx.ID().getText(), tests, increments, block(ctx.block())));
    }

    @Override
    public Object visitFunctionDecl(CasperParser.FunctionDeclContext ctx) {
        TypeKind returnType = ctx.type() == null ? null : type(ctx.type());
        List<Parameter> parameters = new ArrayList<>();
        if (ctx.parameters() != null) {
            for (CasperParser.ParameterContext parameter : ctx.parameters().parameter()) {
                parameters.add((Parameter) visit(parameter));
            }
        }
        return at(ctx, new FunctionDeclaration(returnType, ctx.ID().getText(), parameters, block(ctx.block())));
    }

    @Override
    public Object visitVarDecl(CasperParser.VarDeclContext ctx) {
        IdentifierDeclaration name = (IdentifierDeclaration) visit(ctx.declaredId());
        return at(ctx, new VariableDeclaration(type(ctx.type()), name, expression(ctx.expression())));
    }

    @Override
    public Object visitAssignStmt(CasperParser.AssignStmtContext ctx) {
        return visit(ctx.assignment());
    }

    @Override
    public Object visitAssignment(CasperParser.AssignmentContext ctx) {
        return at(ctx, new AssignmentStatement(expression(ctx.varExp()), expression(ctx.expression())));
    }

    @Override
    public Object visitBreakStmt(CasperParser.BreakStmtContext ctx) {
        return at(ctx, new BreakStatement());
    }

    @Override
    public Object visitReturnStmt(CasperParser.ReturnStmtContext ctx) {
        Expression value = ctx.expression() == null ? null : expression(ctx.expression());
        return at(ctx, new ReturnStatement(value));
    }

    @Override
    public Object visitCallStmt(CasperParser.CallStmtContext ctx) {
        return at(ctx, new CallStatement((Call) visit(ctx.call())));
    }

    @Override
    public Object visitSmallBlock(CasperParser.SmallBlockContext ctx) {
        return List.of((Statement) visit(ctx.simpleStatement()));
    }

    @Override
    public Object visitLargeBlock(CasperParser.LargeBlockContext ctx) {
        return statements(ctx.statement());
    }

    @Override
    public Object visitDeclaredId(CasperParser.DeclaredIdContext ctx) {
        return at(ctx, new IdentifierDeclaration(ctx.ID().getText()));
    }

    @Override
    public Object visitParameter(CasperParser.ParameterContext ctx) {
        Expression defaultValue = ctx.expression() == null ? null : expression(ctx.expression());
        return at(ctx, new Parameter(type(ctx.type()), ctx.ID().getText(), defaultValue));
    }

    // =====================================================================
    // TYPES
    // =====================================================================

    @Override
    public Object visitNumType(CasperParser.NumTypeContext ctx) {
        return NumType.INSTANCE;
    }

    @Override
    public Object visitStringType(CasperParser.StringTypeContext ctx) {
        return StringType.INSTANCE;
    }

    @Override
    public Object visitBooleanType(CasperParser.BooleanTypeContext ctx) {
        return BooleanType.INSTANCE;
    }

    @Override
    public Object visitListType(CasperParser.ListTypeContext ctx) {
        return new ListType(type(ctx.type()));
    }

    @Override
    public Object visitSetType(CasperParser.SetTypeContext ctx) {
        return new SetType(type(ctx.type()));
    }

    @Override
    public Object visitDictType(CasperParser.DictTypeContext ctx) {
        return new DictType(type(ctx.type(0)), type(ctx.type(1)));
    }

    // =====================================================================
    // EXPRESSIONS
    // =====================================================================

    @Override
    public Object visitExpression(CasperParser.ExpressionContext ctx) {
        if (ctx.IF() == null) {
            return visit(ctx.orExp(0));
        }
        return at(ctx, new TernaryExpression(
            expression(ctx.orExp(1)), expression(ctx.orExp(0)), expression(ctx.expression())));
    }

    @Override
    public Object visitOrExp(CasperParser.OrExpContext ctx) {
        return foldLeft(ctx.andExp(), ctx.ops);
    }

    @Override
    public Object visitAndExp(CasperParser.AndExpContext ctx) {
        return foldLeft(ctx.compExp(), ctx.ops);
    }

    @Override
    public Object visitCompExp(CasperParser.CompExpContext ctx) {
        return foldLeft(ctx.addExp(), ctx.ops);
    }

    @Override
    public Object visitAddExp(CasperParser.AddExpContext ctx) {
        return foldLeft(ctx.mulExp(), ctx.ops);
    }

    @Override
    public Object visitMulExp(CasperParser.MulExpContext ctx) {
        return foldLeft(ctx.unaryExp(), ctx.ops);
    }

    @Override
    public Object visitUnaryExp(CasperParser.UnaryExpContext ctx) {
        if (ctx.op == null) {
            return visit(ctx.primary());
        }
        return at(ctx, new UnaryExpression(ctx.op.getText(), expression(ctx.unaryExp())));
    }

    @Override
    public Object visitParens(CasperParser.ParensContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Object visitList(CasperParser.ListContext ctx) {
        return at(ctx, new ListExpression(expressions(ctx.expression())));
    }

    @Override
    public Object visitSet(CasperParser.SetContext ctx) {
        return at(ctx, new SetExpression(expressions(ctx.expression())));
    }

    @Override
    public Object visitDict(CasperParser.DictContext ctx) {
        List<KeyValueExpression> entries = new ArrayList<>();
        for (CasperParser.KeyValueContext entry : ctx.keyValue()) {
            entries.add((KeyValueExpression) visit(entry));
        }
        return at(ctx, new DictionaryExpression(entries));
    }

    @Override
    public Object visitKeyValue(CasperParser.KeyValueContext ctx) {
        return at(ctx, new KeyValueExpression(expression(ctx.expression(0)), expression(ctx.expression(1))));
    }

    @Override
    public Object visitCallExp(CasperParser.CallExpContext ctx) {
        return visit(ctx.call());
    }

    @Override
    public Object visitCall(CasperParser.CallContext ctx) {
        List<Argument> arguments = new ArrayList<>();
        if (ctx.arguments() != null) {
            for (CasperParser.ArgumentContext argument : ctx.arguments().argument()) {
                arguments.add((Argument) visit(argument));
            }
        }
        return at(ctx, new Call(expression(ctx.varExp()), arguments));
    }

    @Override
    public Object visitArgument(CasperParser.ArgumentContext ctx) {
        return at(ctx, new Argument(expression(ctx.expression())));
    }

    @Override
    public Object visitVariable(CasperParser.VariableContext ctx) {
        return visit(ctx.varExp());
    }

    @Override
    public Object visitSubscripted(CasperParser.SubscriptedContext ctx) {
        return at(ctx, new SubscriptedExpression(expression(ctx.varExp()), expression(ctx.expression())));
    }

    @Override
    public Object visitSimpleVar(CasperParser.SimpleVarContext ctx) {
        return at(ctx, new IdentifierExpression(ctx.ID().getText()));
    }

    @Override
    public Object visitLiteralExp(CasperParser.LiteralExpContext ctx) {
        return visit(ctx.literal());
    }

    // =====================================================================
    // LITERALS
    // =====================================================================

    @Override
    public Object visitBoolLit(CasperParser.BoolLitContext ctx) {
        return at(ctx, new BooleanLiteral("true".equals(ctx.getText())));
    }

    @Override
    public Object visitNumLit(CasperParser.NumLitContext ctx) {
        return at(ctx, new NumericLiteral(Double.parseDouble(ctx.getText())));
    }

    @Override
    public Object visitStrLit(CasperParser.StrLitContext ctx) {
        return at(ctx, new StringLiteral(ctx.getText()));
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    private Expression foldLeft(List<? extends ParserRuleContext> operands, List<Token> ops) {
        Expression result = expression(operands.get(0));
        for (int i = 0; i < ops.size(); i++) {
            Expression right = expression(operands.get(i + 1));
            result = at(operands.get(0), new BinaryExpression(ops.get(i).getText(), result, right));
        }
        return result;
    }

    private Expression expression(ParserRuleContext ctx) {
        return (Expression) visit(ctx);
    }

    private List<Expression> expressions(List<? extends ParserRuleContext> contexts) {
        List<Expression> result = new ArrayList<>();
        for (ParserRuleContext ctx : contexts) {
            result.add(expression(ctx));
        }
        return result;
    }

    private List<Statement> statements(List<? extends ParserRuleContext> contexts) {
        List<Statement> result = new ArrayList<>();
        for (ParserRuleContext ctx : contexts) {
            result.add((Statement) visit(ctx));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private List<Statement> block(CasperParser.BlockContext ctx) {
        return (List<Statement>) visit(ctx);
    }

    private TypeKind type(CasperParser.TypeContext ctx) {
        return (TypeKind) visit(ctx);
    }

    private static <T extends Node> T at(ParserRuleContext ctx, T node) {
        node.setLine(ctx.getStart().getLine());
        return node;
    }
}
