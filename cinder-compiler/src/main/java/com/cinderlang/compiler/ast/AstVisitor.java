package com.cinderlang.compiler.ast;

import com.cinderlang.compiler.ast.expr.*;
import com.cinderlang.compiler.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>节点种类是封闭集合，所有方法均为抽象方法：新增节点种类时每个实现类都必须同步更新。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 语句 ============

    R visitBlock(Block node, C ctx);

    R visitExpressionStatement(ExpressionStatement node, C ctx);

    R visitAssignment(Assignment node, C ctx);

    R visitVariableDeclaration(VariableDeclaration node, C ctx);

    R visitFunctionDefinition(FunctionDefinition node, C ctx);

    R visitIfStmt(IfStmt node, C ctx);

    R visitSwitchStmt(SwitchStmt node, C ctx);

    R visitForLoop(ForLoop node, C ctx);

    R visitBreakStmt(BreakStmt node, C ctx);

    R visitContinueStmt(ContinueStmt node, C ctx);

    R visitLeaveStmt(LeaveStmt node, C ctx);

    // ============ 表达式 ============

    R visitLiteral(Literal node, C ctx);

    R visitIdentifier(Identifier node, C ctx);

    R visitFunctionCall(FunctionCall node, C ctx);
}
