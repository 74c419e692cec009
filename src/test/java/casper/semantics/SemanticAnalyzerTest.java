package casper.semantics;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertThrows;

import casper.CasperASTParser;
import casper.ast.BinaryExpression;
import casper.ast.Call;
import casper.ast.CallStatement;
import casper.ast.FunctionDeclaration;
import casper.ast.IdentifierExpression;
import casper.ast.IfStatement;
import casper.ast.Program;
import casper.ast.VariableDeclaration;
import casper.error.SemanticError;
import casper.types.ListType;
import casper.types.NumType;
import casper.types.StringType;
import org.junit.Test;

public class SemanticAnalyzerTest {

    private static Program accept(String source) {
        return CasperASTParser.parse(source);
    }

    private static SemanticError.Kind reject(String source) {
        return assertThrows(SemanticError.class, () -> CasperASTParser.parse(source)).getKind();
    }

    // =====================================================================
    // LOOPS AND BREAK
    // =====================================================================

    @Test
    public void breakInsideWhile() {
        accept("while true:\n    break\n");
        accept("while true: break");
    }

    @Test
    public void breakAtTopLevel() {
        assertThat(reject("break"), is(SemanticError.Kind.BREAK_OUTSIDE_LOOP));
    }

    @Test
    public void breakInNestedIfInheritsTheLoopFlag() {
        accept("while true:\n    if true:\n        break\n");
    }

    @Test
    public void breakInsideCountedLoop() {
        accept("from i = 0 to 10:\n    break\n");
    }

    @Test
    public void functionBodyDoesNotInheritTheLoopFlag() {
        assertThat(reject("while true:\n    stop():\n        break\n"), is(SemanticError.Kind.BREAK_OUTSIDE_LOOP));
    }

    @Test
    public void loopConditionMustBeBoolean() {
        assertThat(reject("while 1: break"), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("if \"yes\": print(\"y\")"), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    @Test
    public void countedLoopVariableIsANumScopedToTheLoop() {
        accept("num total = 0\nfrom i = 0 to 10 by i = i + 1:\n    total = total + i\n");
        assertThat(reject("from i = 0 to 3:\n    string s = i\n"), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("from i = 0 to 3: break\nnum y = i\n"), is(SemanticError.Kind.UNDECLARED_IDENTIFIER));
        assertThat(reject("from i = 0 to \"x\": break"), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    // =====================================================================
    // FUNCTIONS AND RETURN
    // =====================================================================

    @Test
    public void returnOutsideFunction() {
        assertThat(reject("return 1"), is(SemanticError.Kind.RETURN_OUTSIDE_FUNCTION));
    }

    @Test
    public void returnValueMustMatchDeclaredType() {
        accept("num one():\n    return 1\n");
        assertThat(reject("num one():\n    return \"one\"\n"), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("num one():\n    return\n"), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    @Test
    public void functionWithoutReturnTypeAllowsNoReturn() {
        accept("done():\n    print(\"done\")\n");
        assertThat(reject("done():\n    return\n"), is(SemanticError.Kind.RETURN_OUTSIDE_FUNCTION));
        assertThat(reject("done():\n    return 1\n"), is(SemanticError.Kind.RETURN_OUTSIDE_FUNCTION));
        assertThat(reject("num outer():\n    inner():\n        return 1\n    return 2\n"),
            is(SemanticError.Kind.RETURN_OUTSIDE_FUNCTION));
    }

    @Test
    public void recursionSeesTheFunctionName() {
        accept("num fact(num n):\n    return 1 if n < 2 else n * fact(n - 1)\n");
    }

    @Test
    public void defaultValuesFillMissingTrailingArguments() {
        accept("num add(num a, num b = 2):\n    return a + b\nnum r = add(1)\nnum s = add(1, 5)\n");
        assertThat(reject("num add(num a, num b = 2):\n    return a + b\nnum r = add()\n"),
            is(SemanticError.Kind.ARITY_MISMATCH));
        assertThat(reject("num add(num a, num b = 2):\n    return a + b\nnum r = add(1, 2, 3)\n"),
            is(SemanticError.Kind.ARITY_MISMATCH));
    }

    @Test
    public void defaultValueMustMatchParameterType() {
        assertThat(reject("num f(num a = \"x\"):\n    return a\n"), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    @Test
    public void requiredParameterMayNotFollowDefaulted() {
        assertThat(reject("num f(num a = 1, num b):\n    return a\n"), is(SemanticError.Kind.PARAMETER_ORDER));
    }

    @Test
    public void duplicateParameterNames() {
        assertThat(reject("num f(num a, num a):\n    return a\n"), is(SemanticError.Kind.REDECLARATION));
    }

    @Test
    public void argumentTypesAreChecked() {
        accept("print(\"hello\")");
        assertThat(reject("print(1)"), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("print(\"a\", \"b\")"), is(SemanticError.Kind.ARITY_MISMATCH));
    }

    @Test
    public void callWithoutResultCannotBeUsedAsValue() {
        assertThat(reject("greet():\n    print(\"hi\")\nnum x = greet()\n"), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    @Test
    public void onlyFunctionsAreCallable() {
        assertThat(reject("num x = 1\nx(2)\n"), is(SemanticError.Kind.NOT_CALLABLE));
        assertThat(reject("unknown(2)"), is(SemanticError.Kind.UNDECLARED_IDENTIFIER));
    }

    @Test
    public void functionNameIsNotAValue() {
        assertThat(reject("num one():\n    return 1\nnum x = one\n"), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    @Test
    public void builtinsCanBeShadowedAtTopLevel() {
        accept("num print = 1");
        assertThat(reject("num print = 1\nprint(\"x\")\n"), is(SemanticError.Kind.NOT_CALLABLE));
    }

    @Test
    public void callIsAnnotatedWithItsResultType() {
        Program program = accept("num r = sqrt(16)");
        Call call = (Call) ((VariableDeclaration) program.getBody().get(0)).getInitializer();
        assertThat(call.getType(), is(NumType.INSTANCE));
        assertThat(((IdentifierExpression) call.getCallee()).getReferent(), instanceOf(FunctionDeclaration.class));
    }

    // =====================================================================
    // SCOPING
    // =====================================================================

    @Test
    public void undeclaredIdentifier() {
        assertThat(reject("x = 1"), is(SemanticError.Kind.UNDECLARED_IDENTIFIER));
        assertThat(reject("num y = x"), is(SemanticError.Kind.UNDECLARED_IDENTIFIER));
    }

    @Test
    public void redeclarationInTheSameBlock() {
        assertThat(reject("num x = 1\nnum x = 2\n"), is(SemanticError.Kind.REDECLARATION));
        assertThat(reject("if true:\n    num x = 1\n    num x = 2\n"), is(SemanticError.Kind.REDECLARATION));
    }

    @Test
    public void shadowingInANestedBlockLeavesTheOuterDeclarationVisible() {
        Program program = accept(
            "num x = 1\n"
            + "if true:\n"
            + "    string x = \"inner\"\n"
            + "    print(x)\n"
            + "num y = x + 1\n");

        VariableDeclaration outer = (VariableDeclaration) program.getBody().get(0);
        IfStatement nested = (IfStatement) program.getBody().get(1);
        VariableDeclaration inner = (VariableDeclaration) nested.getConsequents().get(0).get(0);
        CallStatement print = (CallStatement) nested.getConsequents().get(0).get(1);
        IdentifierExpression innerUse = (IdentifierExpression) print.getCall().getArguments().get(0).getValue();
        assertThat(innerUse.getReferent(), is(sameInstance(inner)));

        VariableDeclaration y = (VariableDeclaration) program.getBody().get(2);
        IdentifierExpression outerUse = (IdentifierExpression) ((BinaryExpression) y.getInitializer()).getLeft();
        assertThat(outerUse.getReferent(), is(sameInstance(outer)));
        assertThat(outerUse.getType(), is(NumType.INSTANCE));
    }

    @Test
    public void declarationsInABlockAreNotVisibleAfterIt() {
        assertThat(reject("if true:\n    num z = 1\nnum w = z\n"), is(SemanticError.Kind.UNDECLARED_IDENTIFIER));
    }

    @Test
    public void parametersAreVisibleInTheBody() {
        accept("string twice(string s):\n    return s + s\n");
    }

    // =====================================================================
    // TYPES
    // =====================================================================

    @Test
    public void initializerMustMatchDeclaredType() {
        assertThat(reject("num x = \"hello\""), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    @Test
    public void arithmeticInfersNum() {
        Program program = accept("num x = 3 + 4");
        VariableDeclaration declaration = (VariableDeclaration) program.getBody().get(0);
        assertThat(declaration.getInitializer().getType(), is(NumType.INSTANCE));
    }

    @Test
    public void operatorOperandTypes() {
        accept("string s = \"a\" + \"b\"");
        accept("bool b = 1 == 1 and \"a\" != \"b\"");
        accept("bool b = not (1 < 2)");
        assertThat(reject("num n = \"a\" + 1"), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("num n = \"a\" * 2"), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("bool b = not 1"), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("num n = -true"), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("bool b = 1 and true"), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("bool b = 1 == \"1\""), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    @Test
    public void assignmentMustMatchTargetType() {
        accept("num x = 1\nx = x * 2\n");
        assertThat(reject("num x = 1\nx = \"s\"\n"), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    @Test
    public void ternaryBranchesMustAgree() {
        accept("num x = 1 if true else 2");
        assertThat(reject("num x = 1 if true else \"2\""), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("num x = 1 if 0 else 2"), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    @Test
    public void collectionLiteralsAreHomogeneous() {
        Program program = accept("list<num> xs = [1, 2]\nnum first = xs[0]\n");
        VariableDeclaration xs = (VariableDeclaration) program.getBody().get(0);
        assertThat(xs.getInitializer().getType(), is(new ListType(NumType.INSTANCE)));
        assertThat(reject("list<num> xs = [1, \"a\"]"), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("list<string> xs = [1]"), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    @Test
    public void emptyLiteralsFitAnyCollectionOfTheirShape() {
        accept("list<num> xs = []\nset<string> s = set{}\ndict<string, num> d = {}\n");
        assertThat(reject("set<num> s = []"), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    @Test
    public void subscripts() {
        accept("dict<string, num> d = {\"a\": 1}\nnum v = d[\"a\"]\nd[\"b\"] = 2\n");
        accept("string s = \"abc\"\nstring c = s[0]\n");
        assertThat(reject("dict<string, num> d = {\"a\": 1}\nnum v = d[1]\n"), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("set<num> s = set{1}\nnum v = s[0]\n"), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("list<num> xs = [1]\nnum v = xs[\"0\"]\n"), is(SemanticError.Kind.TYPE_MISMATCH));
        assertThat(reject("num n = 1\nnum v = n[0]\n"), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    @Test
    public void builtinResultTypes() {
        accept("num n = length(\"abc\") + sqrt(4)");
        assertThat(reject("string s = sqrt(4)"), is(SemanticError.Kind.TYPE_MISMATCH));
    }

    // =====================================================================
    // DIAGNOSTICS
    // =====================================================================

    @Test
    public void diagnosticsNameTheRuleAndTheSourceLine() {
        SemanticError error = assertThrows(SemanticError.class,
            () -> CasperASTParser.parse("// header\n\nbreak\n"));
        assertThat(error.getLine(), is(3));
        assertThat(error.getMessage(), containsString("break statement outside loop"));
        assertThat(error.getMessage(), containsString("line 3"));
    }

    @Test
    public void analysisStopsAtTheFirstViolation() {
        SemanticError error = assertThrows(SemanticError.class,
            () -> CasperASTParser.parse("num a = b\nbreak\n"));
        assertThat(error.getKind(), is(SemanticError.Kind.UNDECLARED_IDENTIFIER));
        assertThat(error.getMessage(), containsString("b"));
    }

    @Test
    public void analyzeInAGivenContext() {
        Context context = Context.root().createChildContextForLoop();
        Program program = CasperASTParser.parseSyntax("break");
        assertThat(new SemanticAnalyzer().analyze(program.getBody().get(0), context), is(nullValue()));

        Program nested = CasperASTParser.parseSyntax("from i = 0 to 3: break\nbreak\n");
        new SemanticAnalyzer().analyze(nested, Context.root().createChildContextForLoop());

        Program expression = CasperASTParser.parseSyntax("string s = \"a\" + \"b\"");
        VariableDeclaration declaration = (VariableDeclaration) expression.getBody().get(0);
        assertThat(new SemanticAnalyzer().analyze(declaration.getInitializer(), Context.root()),
            is(StringType.INSTANCE));
    }

    @Test
    public void programBindsItsNamesInTheGivenContext() {
        Context context = Context.root();
        new SemanticAnalyzer().analyze(CasperASTParser.parseSyntax("num x = 1\n"), context);
        assertThat(context.isDeclaredLocally("x"), is(true));
    }
}
