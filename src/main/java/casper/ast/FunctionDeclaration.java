package casper.ast;

import casper.types.TypeKind;

import java.util.List;

public class FunctionDeclaration extends Statement {

    private final TypeKind returnType;
    private final String name;
    private final List<Parameter> parameters;
    private final List<Statement> body;

    public FunctionDeclaration(TypeKind returnType, String name, List<Parameter> parameters, List<Statement> body) {
        this.returnType = returnType;
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.body = List.copyOf(body);
    }

    /** Declared return type, or null for a function that returns no value. */
    public TypeKind getReturnType() {
        return returnType;
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public List<Statement> getBody() {
        return body;
    }

    /** Number of leading parameters without a default value. */
    public int getRequiredParameterCount() {
        int required = 0;
        for (Parameter parameter : parameters) {
            if (parameter.getDefaultValue() != null) {
                break;
            }
            required++;
        }
        return required;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitFunctionDeclaration(this);
    }
}
