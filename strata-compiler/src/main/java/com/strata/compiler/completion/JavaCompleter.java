package com.strata.compiler.completion;

import strata.api.Completer;
import strata.api.Frame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 标识符前缀补全。
 *
 * <p>{@code X.前缀} 形式补全 X 的公开成员（X 可以是全限定类名，也可以是已导入或 java.lang 中的简单类名）；
 * 其余情况从关键字、已导入的名字和片段中出现过的标识符中选取。</p>
 */
public class JavaCompleter implements Completer {

    private static final List<String> KEYWORDS = Collections.unmodifiableList(Arrays.asList(
            "abstract", "boolean", "break", "byte", "case", "catch", "char", "class", "continue",
            "default", "do", "double", "else", "enum", "extends", "false", "final", "finally",
            "float", "for", "if", "implements", "import", "instanceof", "int", "interface", "long",
            "new", "null", "private", "protected", "public", "record", "return", "short", "static",
            "super", "switch", "synchronized", "this", "throw", "throws", "true", "try", "var",
            "void", "while"));

    private static final Pattern IMPORT = Pattern.compile("import\\s+(static\\s+)?([\\w$.]+?)(\\.\\*)?\\s*;");
    private static final Pattern ALIAS = Pattern.compile("([\\w$]+)\\s*=\\s*[\\w$.]+\\.INSTANCE\\.");
    private static final Pattern IDENT = Pattern.compile("[A-Za-z_$][\\w$]*");

    private final Supplier<Frame> frame;
    private final Supplier<ClassLoader> loader;
    private final MemberIndex index;

    /**
     * @param frame     当前会话快照（提供内存中的类与加载器代数）
     * @param loader    反射读取类成员时使用的加载器
     * @param cacheSize 成员列表缓存的最大条目数
     */
    public JavaCompleter(Supplier<Frame> frame, Supplier<ClassLoader> loader, long cacheSize) {
        this.frame = frame;
        this.loader = loader;
        this.index = new MemberIndex(cacheSize);
    }

    /**
     * 丢弃缓存的成员列表；类路径变化后调用
     */
    public void invalidate() {
        index.invalidateAll();
    }

    @Override
    public Completion complete(int cursor, String previousImports, String snippet) {
        int end = Math.max(0, Math.min(cursor, snippet.length()));
        int anchor = end;
        while (anchor > 0 && Character.isJavaIdentifierPart(snippet.charAt(anchor - 1))) {
            anchor--;
        }
        String prefix = snippet.substring(anchor, end);

        if (anchor > 0 && snippet.charAt(anchor - 1) == '.') {
            int start = anchor - 1;
            while (start > 0 && (Character.isJavaIdentifierPart(snippet.charAt(start - 1)) || snippet.charAt(start - 1) == '.')) {
                start--;
            }
            String qualifier = snippet.substring(start, anchor - 1);
            return new Completion(anchor, filter(memberCandidates(qualifier, previousImports), prefix));
        }

        Set<String> names = new TreeSet<>(KEYWORDS);
        names.addAll(importedNames(previousImports));
        Matcher m = IDENT.matcher(snippet);
        while (m.find()) {
            if (m.end() != end) names.add(m.group());
        }
        return new Completion(anchor, filter(names, prefix));
    }

    private List<String> memberCandidates(String qualifier, String previousImports) {
        if (qualifier.isEmpty()) {
            return Collections.emptyList();
        }
        Frame current = frame.get();
        for (String className : classNames(qualifier, previousImports)) {
            List<String> members = index.members(className, current.generation(), current.dynamicClasses(), loader.get());
            if (members != null) {
                return members;
            }
        }
        return Collections.emptyList();
    }

    /**
     * 简单名可能指向的全限定类名，按优先级排列
     */
    static List<String> classNames(String qualifier, String previousImports) {
        Set<String> names = new LinkedHashSet<>();
        if (qualifier.contains(".")) {
            names.add(qualifier);
            // 嵌套类：a.b.Outer.Inner → a.b.Outer$Inner
            int dot = qualifier.lastIndexOf('.');
            names.add(qualifier.substring(0, dot) + "$" + qualifier.substring(dot + 1));
            return new ArrayList<>(names);
        }
        Matcher m = IMPORT.matcher(previousImports);
        List<String> wildcards = new ArrayList<>();
        while (m.find()) {
            if (m.group(1) != null) continue;
            String path = m.group(2);
            if (m.group(3) != null) {
                wildcards.add(path);
            } else if (path.endsWith("." + qualifier)) {
                names.add(path);
                int dot = path.lastIndexOf('.');
                names.add(path.substring(0, dot) + "$" + qualifier);
            }
        }
        names.add("java.lang." + qualifier);
        for (String pkg : wildcards) {
            names.add(pkg + "." + qualifier);
        }
        return new ArrayList<>(names);
    }

    static Set<String> importedNames(String previousImports) {
        Set<String> names = new LinkedHashSet<>();
        Matcher m = IMPORT.matcher(previousImports);
        while (m.find()) {
            if (m.group(3) == null) {
                String path = m.group(2);
                names.add(path.substring(path.lastIndexOf('.') + 1));
            }
        }
        Matcher alias = ALIAS.matcher(previousImports);
        while (alias.find()) {
            names.add(alias.group(1));
        }
        return names;
    }

    private static List<String> filter(Iterable<String> names, String prefix) {
        List<String> out = new ArrayList<>();
        for (String name : names) {
            if (name.startsWith(prefix) && !name.equals(prefix)) {
                out.add(name);
            }
        }
        return out;
    }
}
