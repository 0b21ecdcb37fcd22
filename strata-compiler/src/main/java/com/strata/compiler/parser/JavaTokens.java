package com.strata.compiler.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 片段分类用的粗粒度词法：标识符、单字符符号和字面量占位，注释被丢弃。
 *
 * <p>每个符号只占一个字符，因此 {@code >>} 会产生两个 {@code >}，便于匹配泛型参数。</p>
 */
final class JavaTokens {

    enum Kind {
        IDENT, SYMBOL, LITERAL
    }

    static final class Token {
        final Kind kind;
        final String text;
        /** 在源文本中的起止偏移 */
        final int start;
        final int end;

        Token(Kind kind, String text, int start, int end) {
            this.kind = kind;
            this.text = text;
            this.start = start;
            this.end = end;
        }

        boolean is(String s) {
            return text.equals(s);
        }

        @Override
        public String toString() {
            return text;
        }
    }

    static final Set<String> KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class",
            "const", "continue", "default", "do", "double", "else", "enum", "extends", "final",
            "finally", "float", "for", "goto", "if", "implements", "import", "instanceof", "int",
            "interface", "long", "native", "new", "package", "private", "protected", "public",
            "return", "short", "static", "strictfp", "super", "switch", "synchronized", "this",
            "throw", "throws", "transient", "try", "void", "volatile", "while",
            "true", "false", "null")));

    static final Set<String> PRIMITIVES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "boolean", "byte", "char", "short", "int", "long", "float", "double", "void")));

    private JavaTokens() {
    }

    static List<Token> tokenize(String src) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = src.length();
        while (i < n) {
            char c = src.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (src.startsWith("//", i)) {
                int nl = src.indexOf('\n', i);
                i = nl < 0 ? n : nl + 1;
            } else if (src.startsWith("/*", i)) {
                int close = src.indexOf("*/", i + 2);
                i = close < 0 ? n : close + 2;
            } else if (src.startsWith("\"\"\"", i)) {
                int end = skipQuoted(src, i + 3, "\"\"\"");
                tokens.add(new Token(Kind.LITERAL, "\"\"\"", i, end));
                i = end;
            } else if (c == '"' || c == '\'') {
                int end = skipQuoted(src, i + 1, String.valueOf(c));
                tokens.add(new Token(Kind.LITERAL, String.valueOf(c), i, end));
                i = end;
            } else if (Character.isJavaIdentifierStart(c)) {
                int start = i;
                while (i < n && Character.isJavaIdentifierPart(src.charAt(i))) i++;
                tokens.add(new Token(Kind.IDENT, src.substring(start, i), start, i));
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(src.charAt(i)) || src.charAt(i) == '_'
                        || src.charAt(i) == '.' && i + 1 < n && Character.isDigit(src.charAt(i + 1)))) {
                    i++;
                }
                tokens.add(new Token(Kind.LITERAL, src.substring(start, i), start, i));
            } else {
                tokens.add(new Token(Kind.SYMBOL, String.valueOf(c), i, i + 1));
                i++;
            }
        }
        return tokens;
    }

    private static int skipQuoted(String src, int from, String close) {
        int i = from;
        while (i < src.length()) {
            if (src.charAt(i) == '\\') {
                i += 2;
            } else if (src.startsWith(close, i)) {
                return i + close.length();
            } else {
                i++;
            }
        }
        return src.length();
    }

    /**
     * 未跟在 {@code .} 之后的非关键字标识符
     */
    static Set<String> referencedNames(List<Token> tokens) {
        Set<String> names = new LinkedHashSet<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.kind != Kind.IDENT || KEYWORDS.contains(t.text)) continue;
            if (i > 0 && tokens.get(i - 1).is(".")) continue;
            names.add(t.text);
        }
        return names;
    }
}
