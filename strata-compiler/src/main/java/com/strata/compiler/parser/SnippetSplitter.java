package com.strata.compiler.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 把片段文本切分为顶层语句。
 *
 * <p>识别字符串、字符、文本块与注释；顶层的 {@code ;} 结束一条语句，
 * 顶层的 {@code }} 在其后不是 else / catch / finally / while / ; 等延续时也结束一条语句。</p>
 */
final class SnippetSplitter {

    /**
     * 一条顶层语句
     */
    static final class Piece {
        final String text;
        /** 以 ; 结束 */
        final boolean semicolon;
        /** 以顶层代码块结束 */
        final boolean block;

        Piece(String text, boolean semicolon, boolean block) {
            this.text = text;
            this.semicolon = semicolon;
            this.block = block;
        }
    }

    static final class Result {
        final List<Piece> pieces;
        final boolean incomplete;
        final String error;

        private Result(List<Piece> pieces, boolean incomplete, String error) {
            this.pieces = pieces;
            this.incomplete = incomplete;
            this.error = error;
        }
    }

    private enum State {
        CODE, LINE_COMMENT, BLOCK_COMMENT, STRING, CHAR, TEXT_BLOCK
    }

    private SnippetSplitter() {
    }

    static Result split(String src) {
        List<Piece> pieces = new ArrayList<>();
        Deque<Character> brackets = new ArrayDeque<>();
        State state = State.CODE;
        int start = 0;
        int line = 1;

        for (int i = 0; i < src.length(); i++) {
            char c = src.charAt(i);
            char next = i + 1 < src.length() ? src.charAt(i + 1) : 0;
            if (c == '\n') line++;

            switch (state) {
                case LINE_COMMENT:
                    if (c == '\n') state = State.CODE;
                    continue;
                case BLOCK_COMMENT:
                    if (c == '*' && next == '/') {
                        state = State.CODE;
                        i++;
                    }
                    continue;
                case STRING:
                case CHAR:
                    if (c == '\\') {
                        i++;
                    } else if (c == '\n') {
                        return error("第 " + (line - 1) + " 行: 未闭合的" + (state == State.STRING ? "字符串" : "字符") + "字面量");
                    } else if (c == (state == State.STRING ? '"' : '\'')) {
                        state = State.CODE;
                    }
                    continue;
                case TEXT_BLOCK:
                    if (c == '\\') {
                        i++;
                    } else if (src.startsWith("\"\"\"", i)) {
                        state = State.CODE;
                        i += 2;
                    }
                    continue;
                default:
                    break;
            }

            if (c == '/' && next == '/') {
                state = State.LINE_COMMENT;
                i++;
            } else if (c == '/' && next == '*') {
                state = State.BLOCK_COMMENT;
                i++;
            } else if (src.startsWith("\"\"\"", i)) {
                state = State.TEXT_BLOCK;
                i += 2;
            } else if (c == '"') {
                state = State.STRING;
            } else if (c == '\'') {
                state = State.CHAR;
            } else if (c == '(' || c == '[' || c == '{') {
                brackets.push(c);
            } else if (c == ')' || c == ']' || c == '}') {
                char open = c == ')' ? '(' : c == ']' ? '[' : '{';
                if (brackets.isEmpty() || brackets.peek() != open) {
                    return error("第 " + line + " 行: 意外的 '" + c + "'");
                }
                brackets.pop();
                if (c == '}' && brackets.isEmpty() && endsStatementAfterBlock(src, i + 1)) {
                    add(pieces, src.substring(start, i + 1), false, true);
                    start = i + 1;
                }
            } else if (c == ';' && brackets.isEmpty()) {
                add(pieces, src.substring(start, i + 1), true, false);
                start = i + 1;
            }
        }

        if (state == State.STRING || state == State.CHAR) {
            return error("第 " + line + " 行: 未闭合的" + (state == State.STRING ? "字符串" : "字符") + "字面量");
        }
        if (!brackets.isEmpty() || state == State.BLOCK_COMMENT || state == State.TEXT_BLOCK) {
            return new Result(pieces, true, null);
        }
        add(pieces, src.substring(start), false, false);
        return new Result(pieces, false, null);
    }

    private static void add(List<Piece> pieces, String text, boolean semicolon, boolean block) {
        if (!JavaTokens.tokenize(text).isEmpty()) {
            pieces.add(new Piece(text.trim(), semicolon, block));
        }
    }

    private static Result error(String message) {
        return new Result(new ArrayList<>(), false, message);
    }

    /**
     * 顶层 } 之后，下一个有效记号决定语句是否结束
     */
    private static boolean endsStatementAfterBlock(String src, int from) {
        List<JavaTokens.Token> rest = JavaTokens.tokenize(src.substring(from));
        if (rest.isEmpty()) {
            return true;
        }
        JavaTokens.Token first = rest.get(0);
        if (first.kind == JavaTokens.Kind.IDENT) {
            switch (first.text) {
                case "else":
                case "catch":
                case "finally":
                case "while":
                    return false;
                default:
                    return true;
            }
        }
        // ; , ) . 以及运算符都延续当前语句
        return first.text.equals("{") || first.text.equals("@");
    }
}
