package com.cinderlang.compiler.json;

/**
 * JSON AST 文档结构错误
 */
public class AstJsonException extends RuntimeException {
    private final String path;

    public AstJsonException(String message, String path) {
        super(message);
        this.path = path;
    }

    public AstJsonException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** 出错元素的 JSON 路径，如 {@code $.ast.statements[2].value} */
    public String getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        if (path == null) {
            return super.getMessage();
        }
        return super.getMessage() + " at " + path;
    }
}
