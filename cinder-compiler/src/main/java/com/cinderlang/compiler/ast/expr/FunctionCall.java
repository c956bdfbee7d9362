package com.cinderlang.compiler.ast.expr;

import com.cinderlang.compiler.ast.AstVisitor;
import com.cinderlang.compiler.ast.SourceSpan;

import java.util.List;

/**
 * 函数调用表达式
 */
public class FunctionCall extends Expression {
    private final Identifier functionName;
    private final List<Expression> arguments;

    public FunctionCall(SourceSpan span, Identifier functionName, List<Expression> arguments) {
        super(span);
        this.functionName = functionName;
        this.arguments = arguments;
    }

    public Identifier getFunctionName() {
        return functionName;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCall(this, context);
    }
}
