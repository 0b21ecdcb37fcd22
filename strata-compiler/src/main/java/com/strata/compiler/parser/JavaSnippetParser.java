package com.strata.compiler.parser;

import com.strata.compiler.parser.JavaTokens.Kind;
import com.strata.compiler.parser.JavaTokens.Token;
import strata.api.Decl;
import strata.api.DisplayItem;
import strata.api.Infer;
import strata.api.ParseResult;
import strata.api.SnippetParser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Java 片段解析器。
 *
 * <p>只做包装所需的浅层分类，真正的语法与类型检查留给 javac：</p>
 * <ul>
 *   <li>{@code import ...;} → IMPORT</li>
 *   <li>class / interface / enum / record / @interface → TYPE</li>
 *   <li>{@code Type name(...) { }} → METHOD</li>
 *   <li>{@code Type name [= init]}，{@code var} 换成推断占位类型 → FIELD</li>
 *   <li>以 ; 或代码块结尾的其他语句 → STATEMENT</li>
 *   <li>片段末尾未终止的表达式 → EXPRESSION，绑定为 {@code res<行号>}</li>
 * </ul>
 *
 * <p>成员前的 public / protected / private / static 会被去掉，由包装器按策略重新添加。</p>
 */
public class JavaSnippetParser implements SnippetParser {

    private static final Set<String> MODIFIERS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "public", "protected", "private", "static", "final", "abstract", "strictfp",
            "default", "transient", "volatile", "native", "synchronized", "sealed")));

    /** 包装器会按策略重新添加的修饰符 */
    private static final Set<String> STRIPPED = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "public", "protected", "private", "static")));

    private static final Set<String> STATEMENT_KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "if", "for", "while", "do", "try", "switch", "synchronized", "return", "throw",
            "break", "continue", "assert", "{", ";")));

    @Override
    public ParseResult parse(String source, String lineId) {
        SnippetSplitter.Result split = SnippetSplitter.split(source);
        if (split.error != null) {
            return ParseResult.error(split.error);
        }
        if (split.incomplete) {
            return ParseResult.incomplete(source);
        }
        List<Decl> decls = new ArrayList<>();
        String resultName = "res" + lineId.replace('-', '_');
        for (int i = 0; i < split.pieces.size(); i++) {
            SnippetSplitter.Piece piece = split.pieces.get(i);
            Decl decl = classify(piece, i == split.pieces.size() - 1, resultName);
            if (decl != null) {
                decls.add(decl);
            }
        }
        if (decls.isEmpty()) {
            return ParseResult.blank();
        }
        return ParseResult.parsed(decls);
    }

    private Decl classify(SnippetSplitter.Piece piece, boolean last, String resultName) {
        String text = piece.text;
        List<Token> tokens = JavaTokens.tokenize(text);
        if (tokens.size() == 1 && tokens.get(0).is(";")) {
            return null;
        }
        Set<String> refs = JavaTokens.referencedNames(tokens);
        Token first = tokens.get(0);

        if (first.is("import")) {
            return importDecl(text, tokens);
        }

        // 跳过注解与修饰符，记下需要去掉的部分
        List<int[]> removals = new ArrayList<>();
        int p = 0;
        while (p < tokens.size()) {
            Token t = tokens.get(p);
            if (t.kind == Kind.IDENT && MODIFIERS.contains(t.text)
                    && !(t.is("synchronized") && p + 1 < tokens.size() && tokens.get(p + 1).is("("))) {
                if (STRIPPED.contains(t.text)) {
                    removals.add(new int[]{t.start, t.end});
                }
                p++;
            } else if (t.is("@") && p + 1 < tokens.size() && tokens.get(p + 1).kind == Kind.IDENT
                    && !tokens.get(p + 1).is("interface")) {
                p = skipAnnotation(tokens, p);
            } else {
                break;
            }
        }
        if (p >= tokens.size()) {
            return statement(text, piece, refs);
        }

        Token head = tokens.get(p);
        String typeLabel = typeLabel(tokens, p);
        if (typeLabel != null) {
            int nameAt = typeLabel.equals("annotation") ? p + 2 : p + 1;
            String name = nameAt < tokens.size() ? tokens.get(nameAt).text : "?";
            return new Decl(edit(text, removals, null, null), Decl.Shape.TYPE,
                    Collections.singletonList(DisplayItem.definition(typeLabel, name)), refs);
        }
        if (p == 0 && STATEMENT_KEYWORDS.contains(head.text)) {
            return statement(text, piece, refs);
        }

        int q = p;
        if (tokens.get(q).is("<")) {
            q = skipBalanced(tokens, q, "<", ">");
        }
        int typeStart = q;
        int typeEnd = parseType(tokens, q);
        if (typeEnd > 0 && typeEnd < tokens.size()) {
            Token name = tokens.get(typeEnd);
            Token after = typeEnd + 1 < tokens.size() ? tokens.get(typeEnd + 1) : null;
            if (name.kind == Kind.IDENT && !JavaTokens.KEYWORDS.contains(name.text)) {
                if (after != null && after.is("(")) {
                    return new Decl(edit(text, removals, null, null), Decl.Shape.METHOD,
                            Collections.singletonList(DisplayItem.definition("method", name.text)), refs);
                }
                if (after == null || after.is("=") || after.is(",") || after.is(";") || after.is("[")) {
                    return field(text, tokens, removals, typeStart, typeEnd, refs);
                }
            }
        }

        if (piece.semicolon) {
            return statement(text, piece, refs);
        }
        if (last) {
            return new Decl(stripSemicolon(text), Decl.Shape.EXPRESSION,
                    Collections.singletonList(DisplayItem.identity(resultName)), refs);
        }
        return statement(text, piece, refs);
    }

    private Decl importDecl(String text, List<Token> tokens) {
        StringBuilder path = new StringBuilder();
        for (int i = 1; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.is(";")) break;
            if (t.is("static") && i == 1) {
                path.append("static ");
            } else {
                path.append(t.text);
            }
        }
        String code = text.endsWith(";") ? text : text + ";";
        return new Decl(code, Decl.Shape.IMPORT,
                Collections.singletonList(DisplayItem.importOf(path.toString())), Collections.<String>emptySet());
    }

    private Decl statement(String text, SnippetSplitter.Piece piece, Set<String> refs) {
        String code = text;
        if (!piece.semicolon && !code.endsWith("}")) {
            code = code + ";";
        } else if (piece.block && !isBlockStatement(text)) {
            code = code + ";";
        }
        return new Decl(code, Decl.Shape.STATEMENT, Collections.<DisplayItem>emptyList(), refs);
    }

    private Decl field(String text, List<Token> tokens, List<int[]> removals,
                       int typeStart, int typeEnd, Set<String> refs) {
        Token typeFirst = tokens.get(typeStart);
        Token typeLast = tokens.get(typeEnd - 1);
        String typeText = text.substring(typeFirst.start, typeLast.end);
        boolean inferred = typeEnd - typeStart == 1 && typeFirst.is("var");
        boolean lazy = typeText.startsWith("Supplier") || typeText.startsWith("java.util.function.Supplier");

        List<String> names = new ArrayList<>();
        names.add(tokens.get(typeEnd).text);
        int depth = 0;
        for (int i = typeEnd + 1; i < tokens.size(); i++) {
            String s = tokens.get(i).text;
            if (s.equals("(") || s.equals("[") || s.equals("{")) {
                depth++;
            } else if (s.equals(")") || s.equals("]") || s.equals("}")) {
                depth--;
            } else if (s.equals(",") && depth == 0 && i + 1 < tokens.size()
                    && tokens.get(i + 1).kind == Kind.IDENT) {
                Token after = i + 2 < tokens.size() ? tokens.get(i + 2) : null;
                if (after == null || after.is("=") || after.is(",") || after.is(";") || after.is("[")) {
                    names.add(tokens.get(i + 1).text);
                }
            }
        }
        List<DisplayItem> display = new ArrayList<>(names.size());
        for (String name : names) {
            display.add(lazy ? DisplayItem.lazyIdentity(name) : DisplayItem.identity(name));
        }
        String code = edit(text, removals, inferred ? typeFirst : null, Infer.TYPE_NAME);
        return new Decl(stripSemicolon(code), Decl.Shape.FIELD, display, refs);
    }

    private static String typeLabel(List<Token> tokens, int p) {
        Token t = tokens.get(p);
        Token next = p + 1 < tokens.size() ? tokens.get(p + 1) : null;
        if (t.is("class") || t.is("interface") || t.is("enum")) {
            return t.text;
        }
        if (t.is("record") && next != null && next.kind == Kind.IDENT) {
            return "record";
        }
        if (t.is("@") && next != null && next.is("interface")) {
            return "annotation";
        }
        return null;
    }

    private static boolean isBlockStatement(String text) {
        List<Token> tokens = JavaTokens.tokenize(text);
        return !tokens.isEmpty() && STATEMENT_KEYWORDS.contains(tokens.get(0).text);
    }

    /**
     * 解析类型，返回类型之后的记号下标；不是类型时返回 -1
     */
    static int parseType(List<Token> tokens, int i) {
        if (i >= tokens.size()) return -1;
        Token t = tokens.get(i);
        if (t.kind != Kind.IDENT) return -1;
        if (JavaTokens.PRIMITIVES.contains(t.text)) {
            i++;
        } else if (JavaTokens.KEYWORDS.contains(t.text)) {
            return -1;
        } else {
            i++;
            while (true) {
                if (i < tokens.size() && tokens.get(i).is("<")) {
                    i = parseTypeArguments(tokens, i);
                    if (i < 0) return -1;
                }
                if (i + 1 < tokens.size() && tokens.get(i).is(".")
                        && tokens.get(i + 1).kind == Kind.IDENT
                        && !JavaTokens.KEYWORDS.contains(tokens.get(i + 1).text)) {
                    i += 2;
                } else {
                    break;
                }
            }
        }
        while (i + 1 < tokens.size() && tokens.get(i).is("[") && tokens.get(i + 1).is("]")) {
            i += 2;
        }
        return i;
    }

    private static int parseTypeArguments(List<Token> tokens, int i) {
        i++; // <
        while (i < tokens.size()) {
            if (tokens.get(i).is("?")) {
                i++;
                if (i < tokens.size() && (tokens.get(i).is("extends") || tokens.get(i).is("super"))) {
                    i = parseType(tokens, i + 1);
                    if (i < 0) return -1;
                }
            } else {
                i = parseType(tokens, i);
                if (i < 0) return -1;
            }
            if (i >= tokens.size()) return -1;
            if (tokens.get(i).is(">")) return i + 1;
            if (!tokens.get(i).is(",")) return -1;
            i++;
        }
        return -1;
    }

    private static int skipAnnotation(List<Token> tokens, int p) {
        p += 2;
        while (p + 1 < tokens.size() && tokens.get(p).is(".") && tokens.get(p + 1).kind == Kind.IDENT) {
            p += 2;
        }
        if (p < tokens.size() && tokens.get(p).is("(")) {
            p = skipBalanced(tokens, p, "(", ")");
        }
        return p;
    }

    private static int skipBalanced(List<Token> tokens, int p, String open, String close) {
        int depth = 0;
        for (int i = p; i < tokens.size(); i++) {
            if (tokens.get(i).is(open)) {
                depth++;
            } else if (tokens.get(i).is(close) && --depth == 0) {
                return i + 1;
            }
        }
        return tokens.size();
    }

    /**
     * 去掉修饰符并可选地替换一个记号
     */
    private static String edit(String text, List<int[]> removals, Token replaced, String replacement) {
        StringBuilder sb = new StringBuilder(text);
        List<int[]> edits = new ArrayList<>(removals);
        if (replaced != null) {
            edits.add(new int[]{replaced.start, replaced.end, 1});
        }
        edits.sort((a, b) -> Integer.compare(b[0], a[0]));
        for (int[] e : edits) {
            if (e.length == 3) {
                sb.replace(e[0], e[1], replacement);
            } else {
                int end = e[1];
                while (end < sb.length() && sb.charAt(end) == ' ') end++;
                sb.delete(e[0], end);
            }
        }
        return sb.toString().trim();
    }

    private static String stripSemicolon(String text) {
        String s = text.trim();
        while (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return s;
    }
}
