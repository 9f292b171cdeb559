package com.initialone.jqport.ast;

/** One lexical token of a strategy script. */
public final class Token {

    public enum Type {
        NAME, NUMBER, STRING, OP,
        NEWLINE, INDENT, DEDENT,
        /** 括号内或行尾的注释 */
        COMMENT,
        /** 独占一行的注释 */
        COMMENT_LINE,
        BLANK_LINE,
        EOF
    }

    final Type type;
    final String text;
    final int line;
    final int column;
    final boolean spaceBefore;

    Token(Type type, String text, int line, int column, boolean spaceBefore) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
        this.spaceBefore = spaceBefore;
    }

    boolean is(Type t, String s) {
        return type == t && text.equals(s);
    }

    boolean isOp(String s) {
        return type == Type.OP && text.equals(s);
    }

    @Override
    public String toString() {
        return type + "(" + text.replace("\n", "\\n") + ")@" + line + ":" + column;
    }
}
