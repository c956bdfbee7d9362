package com.cinderlang.compiler.printer;

import com.cinderlang.compiler.ast.SourceSpan;
import com.cinderlang.compiler.ast.TypedName;
import com.cinderlang.compiler.ast.expr.*;
import com.cinderlang.compiler.ast.stmt.*;
import com.cinderlang.compiler.dialect.Dialect;
import com.cinderlang.compiler.json.AstDocument;
import com.cinderlang.compiler.json.AstJsonReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static com.cinderlang.compiler.ast.AstFactory.*;
import static org.assertj.core.api.Assertions.*;

/**
 * 打印 → 读取 → 再打印 结果一致
 */
@DisplayName("往返一致性")
class RoundTripTest {

    private static IrPrinter printer(Dialect dialect, Map<String, Integer> indices) {
        PrinterConfig config = new PrinterConfig();
        config.setDialect(dialect);
        config.setSourceIndices(indices);
        return new IrPrinter(config);
    }

    private static Block sampleProgram() {
        FunctionDefinition transfer = function("transfer",
                Arrays.asList(typed("to", "address"), name("amount")),
                Collections.singletonList(typed("ok", "bool")),
                block(
                        let(call("balance", id("caller")), name("bal")),
                        ifStmt(call("lt", id("bal"), id("amount")), block(leave())),
                        exprStmt(call("sstore", id("to"), call("add", call("sload", id("to")), id("amount")))),
                        assign(bool("true", "bool"), "ok")));

        ForLoop loop = forLoop(
                block(let(num("0"), name("i"))),
                call("lt", id("i"), num("0x10")),
                block(assign(call("add", id("i"), num("1")), "i")),
                block(
                        switchStmt(call("mod", id("i"), num("3")),
                                caseOf(num("0"), block(cont())),
                                caseOf(num("1", "u8"), block(exprStmt(call("log", str("one\n\"quoted\"\t\\é\u0001"))))),
                                defaultCase(block(brk()))),
                        exprStmt(call("f", bool("false", "bool")))));

        return block(transfer, loop, let(null, name("a"), typed("b", "u32")), block());
    }

    @Test
    @DisplayName("类型化方言")
    void testTypedDialect() {
        IrPrinter printer = printer(Dialect.typed(), Collections.<String, Integer>emptyMap());
        String first = printer.print(sampleProgram());
        Block reread = IrTextReader.readBlock(first);

        assertThat(printer.print(reread)).isEqualTo(first);
        assertThat(reread.getStatements()).hasSize(4);
        assertThat(reread.getStatements().get(0)).isInstanceOf(FunctionDefinition.class);
        FunctionDefinition f = (FunctionDefinition) reread.getStatements().get(0);
        assertThat(f.getName()).isEqualTo("transfer");
        assertThat(f.getParameters()).extracting(TypedName::getName).containsExactly("to", "amount");
        assertThat(f.getParameters().get(0).getType()).isEqualTo("address");
    }

    @Test
    @DisplayName("无类型方言保留所有类型后缀")
    void testUntypedDialect() {
        IrPrinter printer = printer(Dialect.untyped(), Collections.<String, Integer>emptyMap());
        String first = printer.print(sampleProgram());

        assertThat(first).contains("true:bool", "false:bool", "1:u8");
        assertThat(printer.print(IrTextReader.readBlock(first))).isEqualTo(first);
    }

    @Test
    @DisplayName("字符串字面量值不变")
    void testStringValuePreserved() {
        String value = "\\\"\n\r\t\u0000\u007f~ é中";
        String text = new IrPrinter().print(block(exprStmt(call("log", str(value)))));

        Block reread = IrTextReader.readBlock(text);
        ExpressionStatement stmt = (ExpressionStatement) reread.getStatements().get(0);
        Literal literal = (Literal) ((FunctionCall) stmt.getExpression()).getArguments().get(0);
        assertThat(literal.getKind()).isEqualTo(Literal.LiteralKind.STRING);
        assertThat(literal.getValue()).isEqualTo(value);
    }

    @Test
    @DisplayName("来源注释可作为普通注释忽略")
    void testAnnotationsIgnorable() {
        SourceSpan s1 = new SourceSpan("main.src", 0, 40);
        SourceSpan s2 = new SourceSpan("main.src", 5, 12);
        Block program = new Block(s1, Arrays.<Statement>asList(
                new VariableDeclaration(s2, Collections.singletonList(new TypedName(s2, "x", null)),
                        new FunctionCall(new SourceSpan("main.src", 9, 12), id("g"),
                                Collections.<Expression>singletonList(new Literal(s1, Literal.LiteralKind.NUMBER, "1")))),
                new IfStmt(s1, id("x"), new Block(s2, Collections.<Statement>singletonList(new BreakStmt(s2))))));

        String annotated = printer(Dialect.typed(), Collections.singletonMap("main.src", 0)).print(program);
        String plain = printer(Dialect.typed(), Collections.<String, Integer>emptyMap()).print(program);

        assertThat(annotated).contains("/// @src 0:0:40", "/** @src 0:9:12 */ ");
        assertThat(plain).doesNotContain("@src");
        assertThat(printer(Dialect.typed(), Collections.<String, Integer>emptyMap())
                .print(IrTextReader.readBlock(annotated))).isEqualTo(plain);
    }

    @Test
    @DisplayName("未声明方言的 JSON 文档保留全部类型")
    void testDocumentWithoutDialect() {
        String json = "{\"ast\": {\"nodeType\": \"Block\", \"statements\": ["
                + "{\"nodeType\": \"VariableDeclaration\", \"variables\": [{\"name\": \"x\", \"type\": \"u8\"}],"
                + " \"value\": {\"nodeType\": \"Literal\", \"kind\": \"number\", \"value\": \"1\", \"type\": \"u8\"}},"
                + "{\"nodeType\": \"ExpressionStatement\", \"expression\": {\"nodeType\": \"FunctionCall\","
                + " \"functionName\": {\"nodeType\": \"Identifier\", \"name\": \"f\"},"
                + " \"arguments\": [{\"nodeType\": \"Literal\", \"kind\": \"bool\", \"value\": \"true\", \"type\": \"bool\"}]}}"
                + "]}}";
        AstDocument doc = new AstJsonReader().read(json);
        String text = new IrPrinter(doc.toPrinterConfig()).print(doc.getRoot());

        assertThat(text).isEqualTo("{\n    let x:u8 := 1:u8\n    f(true:bool)\n}");

        Block reread = IrTextReader.readBlock(text);
        VariableDeclaration decl = (VariableDeclaration) reread.getStatements().get(0);
        assertThat(decl.getVariables().get(0).getType()).isEqualTo("u8");
        assertThat(((Literal) decl.getValue()).getType()).isEqualTo("u8");
        FunctionCall call = (FunctionCall) ((ExpressionStatement) reread.getStatements().get(1)).getExpression();
        assertThat(((Literal) call.getArguments().get(0)).getType()).isEqualTo("bool");
        assertThat(new IrPrinter(doc.toPrinterConfig()).print(reread)).isEqualTo(text);
    }
}
