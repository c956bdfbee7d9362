package com.cinderlang.compiler.printer;

import com.cinderlang.compiler.InternalConsistencyException;
import com.cinderlang.compiler.Invariants;
import com.cinderlang.compiler.ast.*;
import com.cinderlang.compiler.ast.expr.*;
import com.cinderlang.compiler.ast.stmt.*;

import java.util.List;
import java.util.function.Supplier;

/**
 * Cinder IL 打印器
 *
 * <p>深度优先遍历 AST，输出可重新解析的规范文本，并按需插入 {@code @src} 来源注释。
 * 打印器本身不持有遍历状态，每次 {@link #print} 使用新的 {@link PrinterContext}。</p>
 *
 * <p>上游保证的不变量被破坏时抛出 {@link InternalConsistencyException}，不产生部分输出。</p>
 */
public class IrPrinter implements AstVisitor<String, PrinterContext> {

    private final ProvenanceAnnotator annotator;
    private final TypeSuffixPolicy typeSuffix;

    public IrPrinter(PrinterConfig config) {
        this.annotator = new ProvenanceAnnotator(config.getSourceIndices());
        this.typeSuffix = new TypeSuffixPolicy(config.getDialect());
    }

    /**
     * 使用默认配置（未知方言、无源索引）
     */
    public IrPrinter() {
        this(new PrinterConfig());
    }

    /**
     * 打印节点
     */
    public String print(AstNode node) {
        PrinterContext ctx = new PrinterContext();
        String out = node.accept(this, ctx);
        Invariants.check(ctx.getExpressionDepth() == 0, "Expression depth not restored after printing.");
        return out;
    }

    // ============ 表达式 ============

    @Override
    public String visitLiteral(Literal node, PrinterContext ctx) {
        String comment = annotator.annotate(node.getSpan(), !ctx.isInsideExpression(), ctx);
        String value = Invariants.checkNotNull(node.getValue(), "Literal without value.");
        Invariants.checkNotNull(node.getKind(), "Literal without kind.");

        switch (node.getKind()) {
            case NUMBER:
                Invariants.check(CinderStringUtils.isValidDecimal(value) || CinderStringUtils.isValidHex(value),
                        "Invalid number literal: " + value);
                return comment + value + typeSuffix.suffix(node.getType(), false);
            case BOOLEAN:
                Invariants.check(value.equals("true") || value.equals("false"),
                        "Invalid bool literal: " + value);
                return comment + value + typeSuffix.suffix(node.getType(), true);
            case STRING:
                return comment + CinderStringUtils.escapeAndQuote(value) + typeSuffix.suffix(node.getType(), false);
            default:
                throw new InternalConsistencyException("Unknown literal kind: " + node.getKind());
        }
    }

    @Override
    public String visitIdentifier(Identifier node, PrinterContext ctx) {
        Invariants.check(node.getName() != null && !node.getName().isEmpty(), "Invalid identifier.");
        return annotator.annotate(node.getSpan(), !ctx.isInsideExpression(), ctx) + node.getName();
    }

    @Override
    public String visitFunctionCall(FunctionCall node, PrinterContext ctx) {
        // 注释形式取决于进入调用时的深度
        String comment = annotator.annotate(node.getSpan(), !ctx.isInsideExpression(), ctx);
        Identifier callee = Invariants.checkNotNull(node.getFunctionName(), "Function call without callee.");

        return comment + inExpression(ctx, () ->
                callee.accept(this, ctx) + "(" + joinNodes(node.getArguments(), ", ", ctx) + ")");
    }

    // ============ 语句 ============

    @Override
    public String visitExpressionStatement(ExpressionStatement node, PrinterContext ctx) {
        String comment = annotator.annotate(node.getSpan(), true, ctx);
        Expression expression = Invariants.checkNotNull(node.getExpression(),
                "Expression statement without expression.");
        return comment + inExpression(ctx, () -> expression.accept(this, ctx));
    }

    @Override
    public String visitAssignment(Assignment node, PrinterContext ctx) {
        List<Identifier> targets = node.getVariableNames();
        Invariants.check(targets != null && !targets.isEmpty(), "Assignment without target variables.");
        Expression value = Invariants.checkNotNull(node.getValue(), "Assignment without value.");

        String comment = annotator.annotate(node.getSpan(), true, ctx);
        return comment + inExpression(ctx, () ->
                joinNodes(targets, ", ", ctx) + " := " + value.accept(this, ctx));
    }

    @Override
    public String visitVariableDeclaration(VariableDeclaration node, PrinterContext ctx) {
        String comment = annotator.annotate(node.getSpan(), true, ctx);
        return comment + "let " + inExpression(ctx, () -> {
            String out = formatTypedNames(node.getVariables(), ctx);
            if (node.hasValue()) {
                out += " := " + node.getValue().accept(this, ctx);
            }
            return out;
        });
    }

    @Override
    public String visitFunctionDefinition(FunctionDefinition node, PrinterContext ctx) {
        Invariants.check(node.getName() != null && !node.getName().isEmpty(), "Invalid function name.");
        Block body = Invariants.checkNotNull(node.getBody(), "Function definition without body.");

        String comment = annotator.annotate(node.getSpan(), true, ctx);
        String signature = inExpression(ctx, () -> {
            String out = "(" + formatTypedNames(node.getParameters(), ctx) + ")";
            List<TypedName> returns = node.getReturnVariables();
            if (returns != null && !returns.isEmpty()) {
                out += " -> " + formatTypedNames(returns, ctx);
            }
            return out;
        });

        // 函数体回到调用方深度
        return comment + "function " + node.getName() + signature + "\n" + body.accept(this, ctx);
    }

    @Override
    public String visitIfStmt(IfStmt node, PrinterContext ctx) {
        Expression condition = Invariants.checkNotNull(node.getCondition(), "Invalid if condition.");
        Block body = Invariants.checkNotNull(node.getBody(), "If statement without body.");

        String comment = annotator.annotate(node.getSpan(), true, ctx);
        String head = inExpression(ctx, () -> condition.accept(this, ctx));
        String renderedBody = body.accept(this, ctx);

        return comment + "if " + head + LayoutPolicy.ifBodyDelimiter(renderedBody) + renderedBody;
    }

    @Override
    public String visitSwitchStmt(SwitchStmt node, PrinterContext ctx) {
        Expression expression = Invariants.checkNotNull(node.getExpression(), "Invalid switch expression.");

        StringBuilder out = new StringBuilder();
        out.append(annotator.annotate(node.getSpan(), true, ctx));
        out.append("switch ").append(inExpression(ctx, () -> expression.accept(this, ctx)));

        if (node.getCases() != null) {
            for (SwitchCase switchCase : node.getCases()) {
                Block body = Invariants.checkNotNull(switchCase.getBody(), "Switch case without body.");
                if (switchCase.isDefault()) {
                    out.append("\ndefault ");
                } else {
                    Literal value = switchCase.getValue();
                    out.append("\ncase ").append(inExpression(ctx, () -> value.accept(this, ctx))).append(" ");
                }
                out.append(body.accept(this, ctx));
            }
        }
        return out.toString();
    }

    @Override
    public String visitForLoop(ForLoop node, PrinterContext ctx) {
        Expression condition = Invariants.checkNotNull(node.getCondition(), "Invalid for loop condition.");
        Block preBlock = Invariants.checkNotNull(node.getPre(), "For loop without init block.");
        Block postBlock = Invariants.checkNotNull(node.getPost(), "For loop without post block.");
        Block body = Invariants.checkNotNull(node.getBody(), "For loop without body.");

        String comment = annotator.annotate(node.getSpan(), true, ctx);

        String pre;
        String cond;
        String post;
        ctx.enterExpression();
        try {
            pre = preBlock.accept(this, ctx);
            cond = condition.accept(this, ctx);
            post = postBlock.accept(this, ctx);
        } finally {
            ctx.exitExpression();
        }

        char delim = LayoutPolicy.forHeaderDelimiter(pre, cond, post);
        return comment + "for " + pre + delim + cond + delim + post + "\n" + body.accept(this, ctx);
    }

    @Override
    public String visitBreakStmt(BreakStmt node, PrinterContext ctx) {
        return annotator.annotate(node.getSpan(), true, ctx) + "break";
    }

    @Override
    public String visitContinueStmt(ContinueStmt node, PrinterContext ctx) {
        return annotator.annotate(node.getSpan(), true, ctx) + "continue";
    }

    @Override
    public String visitLeaveStmt(LeaveStmt node, PrinterContext ctx) {
        return annotator.annotate(node.getSpan(), true, ctx) + "leave";
    }

    @Override
    public String visitBlock(Block node, PrinterContext ctx) {
        String comment = annotator.annotate(node.getSpan(), true, ctx);
        int depthAtEntry = ctx.getExpressionDepth();

        List<Statement> statements = node.getStatements();
        String rendered;
        if (statements == null || statements.isEmpty()) {
            rendered = "{ }";
        } else {
            rendered = LayoutPolicy.layoutBlock(joinNodes(statements, "\n", ctx));
        }

        Invariants.check(ctx.getExpressionDepth() == depthAtEntry,
                "Expression depth changed inside block: " + depthAtEntry + " -> " + ctx.getExpressionDepth());
        return comment + rendered;
    }

    // ============ 辅助方法 ============

    /**
     * 在表达式深度 +1 的范围内渲染，任何退出路径都会恢复深度
     */
    private String inExpression(PrinterContext ctx, Supplier<String> render) {
        ctx.enterExpression();
        try {
            return render.get();
        } finally {
            ctx.exitExpression();
        }
    }

    private String joinNodes(List<? extends AstNode> nodes, String separator, PrinterContext ctx) {
        if (nodes == null || nodes.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            sb.append(Invariants.checkNotNull(nodes.get(i), "Null child node.").accept(this, ctx));
        }
        return sb.toString();
    }

    private String formatTypedNames(List<TypedName> names, PrinterContext ctx) {
        if (names == null || names.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < names.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(formatTypedName(names.get(i), ctx));
        }
        return sb.toString();
    }

    private String formatTypedName(TypedName typedName, PrinterContext ctx) {
        Invariants.check(typedName.getName() != null && !typedName.getName().isEmpty(), "Invalid variable name.");
        return annotator.annotate(typedName.getSpan(), false, ctx)
                + typedName.getName()
                + typeSuffix.suffix(typedName.getType(), false);
    }
}
