package casper.ast;

/**
 * Closed dispatch over every node kind. Adding a node class means adding a
 * method here, which every visitor then has to implement.
 */
public interface AstVisitor<R> {

    R visitProgram(Program node);

    R visitWhileStatement(WhileStatement node);

    R visitIfStatement(IfStatement node);

    R visitFromStatement(FromStatement node);

    R visitBreakStatement(BreakStatement node);

    R visitReturnStatement(ReturnStatement node);

    R visitFunctionDeclaration(FunctionDeclaration node);

    R visitVariableDeclaration(VariableDeclaration node);

    R visitAssignmentStatement(AssignmentStatement node);

    R visitCallStatement(CallStatement node);

    R visitBinaryExpression(BinaryExpression node);

    R visitUnaryExpression(UnaryExpression node);

    R visitTernaryExpression(TernaryExpression node);

    R visitListExpression(ListExpression node);

    R visitSetExpression(SetExpression node);

    R visitDictionaryExpression(DictionaryExpression node);

    R visitKeyValueExpression(KeyValueExpression node);

    R visitCall(Call node);

    R visitSubscriptedExpression(SubscriptedExpression node);

    R visitIdentifierExpression(IdentifierExpression node);

    R visitIdentifierDeclaration(IdentifierDeclaration node);

    R visitParameter(Parameter node);

    R visitArgument(Argument node);

    R visitBooleanLiteral(BooleanLiteral node);

    R visitNumericLiteral(NumericLiteral node);

    R visitStringLiteral(StringLiteral node);
}
