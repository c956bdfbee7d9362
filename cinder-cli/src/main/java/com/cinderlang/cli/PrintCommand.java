package com.cinderlang.cli;

import com.cinderlang.compiler.InternalConsistencyException;
import com.cinderlang.compiler.json.AstJsonException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * picocli print 子命令：将 JSON AST 打印为 Cinder IL 文本
 */
@Command(name = "print", mixinStandardHelpOptions = true, description = "将 JSON AST 打印为 IL 文本")
public class PrintCommand implements Callable<Integer> {

    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_INTERNAL_ERROR = 2;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "JSON AST 文件路径")
    Path file;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认 stdout）")
    Path output;

    @Option(names = "--dialect", description = "方言（untyped, typed, custom），默认使用文档中的声明")
    String dialect;

    @Option(names = "--default-type", description = "custom 方言的默认类型名")
    String defaultType;

    @Option(names = "--bool-type", description = "custom 方言的布尔类型名")
    String boolType;

    @Option(names = "--source", description = "源文件索引，如 --source main.src=0（可重复，覆盖文档中的同名项）")
    Map<String, Integer> sources;

    @Option(names = "--no-src", description = "不输出 @src 来源注释")
    boolean noSrc;

    @Option(names = "--verbose", description = "输出调试日志")
    boolean verbose;

    @Override
    public Integer call() {
        Main.configureLogging(verbose);

        PrintRunner runner = new PrintRunner();
        try {
            runner.setDialect(PrintRunner.resolveDialect(dialect, defaultType, boolType));
            runner.setSourceOverrides(sources);
            runner.setSuppressAnnotations(noSrc);

            String text = runner.render(file);
            if (output != null) {
                runner.write(output, text);
            } else {
                spec.commandLine().getOut().println(text);
                spec.commandLine().getOut().flush();
            }
            return 0;
        } catch (IllegalArgumentException | AstJsonException e) {
            spec.commandLine().getErr().println("错误: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (IOException e) {
            spec.commandLine().getErr().println("错误: 无法读写文件 - " + e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (InternalConsistencyException e) {
            spec.commandLine().getErr().println("内部一致性错误: " + e.getMessage());
            return EXIT_INTERNAL_ERROR;
        }
    }
}
