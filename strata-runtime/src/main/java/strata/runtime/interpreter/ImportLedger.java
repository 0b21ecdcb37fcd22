package strata.runtime.interpreter;

import strata.api.ImportEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 会话中累积的导入绑定。
 *
 * <p>同一本地名最多一条非通配条目，后到的条目原位替换先前的；通配条目始终追加。
 * 渲染前言时只输出被引用到的名字，以及所有隐式条目和通配条目，使包装类不会随会话变长而膨胀。</p>
 */
public class ImportLedger {

    private final List<ImportEntry> entries = new ArrayList<>();

    public synchronized void update(Collection<ImportEntry> incoming) {
        for (ImportEntry entry : incoming) {
            if (entry.isWildcard()) {
                entries.add(entry);
                continue;
            }
            int existing = indexOf(entry.localName());
            if (existing >= 0) {
                entries.set(existing, entry);
            } else {
                entries.add(entry);
            }
        }
    }

    private int indexOf(String localName) {
        for (int i = 0; i < entries.size(); i++) {
            ImportEntry e = entries.get(i);
            if (!e.isWildcard() && e.localName().equals(localName)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 渲染 import 前言，相同的行只输出一次
     */
    public synchronized String previousImportBlock(Set<String> referencedNames) {
        Set<String> lines = new LinkedHashSet<>();
        for (ImportEntry e : entries) {
            if (e.kind() != ImportEntry.Kind.INSTANCE && selected(e, referencedNames)) {
                lines.add(importLine(e));
            }
        }
        return join(lines);
    }

    /**
     * 渲染实例成员别名，每行 {@code T x = prefix.INSTANCE.x;}，修饰符由包装器添加
     */
    public synchronized String previousAliasBlock(Set<String> referencedNames) {
        Set<String> lines = new LinkedHashSet<>();
        for (ImportEntry e : entries) {
            if (e.kind() == ImportEntry.Kind.INSTANCE && selected(e, referencedNames)) {
                lines.add(e.typeHint() + " " + e.localName() + " = " + e.prefix() + ".INSTANCE." + e.sourceName() + ";");
            }
        }
        return join(lines);
    }

    private static boolean selected(ImportEntry e, Set<String> referencedNames) {
        return e.isImplicit() || e.isWildcard() || referencedNames.contains(e.localName());
    }

    private static String importLine(ImportEntry e) {
        StringBuilder sb = new StringBuilder("import ");
        if (e.kind() == ImportEntry.Kind.STATIC) {
            sb.append("static ");
        }
        sb.append(e.prefix()).append('.').append(e.isWildcard() ? "*" : e.sourceName()).append(';');
        return sb.toString();
    }

    private static String join(Set<String> lines) {
        if (lines.isEmpty()) {
            return "";
        }
        return String.join("\n", lines) + "\n";
    }

    /** 全部条目渲染出的前言，供补全使用 */
    public synchronized String renderAll() {
        Set<String> names = new LinkedHashSet<>();
        for (ImportEntry e : entries) {
            names.add(e.localName());
        }
        return previousImportBlock(names) + previousAliasBlock(names);
    }

    /**
     * 移除来自指定包中包装类的条目（加载器切换后这些类已不可达）
     */
    public synchronized int dropPackage(String packageName) {
        int before = entries.size();
        entries.removeIf(e -> e.prefix().startsWith(packageName + "."));
        return before - entries.size();
    }

    public synchronized List<ImportEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }
}
