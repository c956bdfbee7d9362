package com.cinderlang.compiler.ast.stmt;

import com.cinderlang.compiler.ast.AstVisitor;
import com.cinderlang.compiler.ast.SourceSpan;
import com.cinderlang.compiler.ast.TypedName;

import java.util.List;

/**
 * 函数定义
 */
public class FunctionDefinition extends Statement {
    private final String name;
    private final List<TypedName> parameters;
    private final List<TypedName> returnVariables;
    private final Block body;

    public FunctionDefinition(SourceSpan span, String name, List<TypedName> parameters,
                              List<TypedName> returnVariables, Block body) {
        super(span);
        this.name = name;
        this.parameters = parameters;
        this.returnVariables = returnVariables;
        this.body = body;
    }

    public String getName() {
        return name;
    }

    public List<TypedName> getParameters() {
        return parameters;
    }

    public List<TypedName> getReturnVariables() {
        return returnVariables;
    }

    public Block getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionDefinition(this, context);
    }
}
