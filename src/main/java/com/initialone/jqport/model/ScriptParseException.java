package com.initialone.jqport.model;

/**
 * 输入脚本超出支持的语法子集（或本身就有语法错误）。
 * 行列号是尽力估计值，从 1 开始。
 */
public class ScriptParseException extends ConversionException {
    private final int line;
    private final int column;

    public ScriptParseException(String message, int line, int column) {
        super("line " + line + ", column " + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
