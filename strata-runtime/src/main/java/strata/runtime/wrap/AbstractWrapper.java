package strata.runtime.wrap;

import strata.api.Decl;
import strata.api.DisplayItem;
import strata.api.Infer;

import java.util.ArrayList;
import java.util.List;

/**
 * 两种包装策略共用的编译单元骨架
 */
abstract class AbstractWrapper implements CodeWrapper {

    protected final String packageName;

    AbstractWrapper(String packageName) {
        this.packageName = packageName;
    }

    @Override
    public Wrapped wrap(List<Decl> decls, String previousImports, String aliases, String wrapperName, String display) {
        StringBuilder sb = new StringBuilder();
        if (!packageName.isEmpty()) {
            sb.append("package ").append(packageName).append(";\n");
        }
        sb.append(previousImports);
        if (!previousImports.isEmpty() && !previousImports.endsWith("\n")) {
            sb.append('\n');
        }
        int importsLength = sb.length();
        for (Decl decl : decls) {
            if (decl.shape() == Decl.Shape.IMPORT) {
                sb.append(decl.code()).append('\n');
            }
        }
        body(sb, decls, aliases, wrapperName, display);
        return new Wrapped(packageName, wrapperName, sb.toString(), importsLength);
    }

    /**
     * 输出包装类本体
     */
    protected abstract void body(StringBuilder sb, List<Decl> decls, String aliases, String name, String display);

    /**
     * 给别名声明的每一行加上修饰符
     */
    protected static void aliases(StringBuilder sb, String aliases, String modifiers) {
        for (String line : aliases.split("\n")) {
            if (!line.trim().isEmpty()) {
                sb.append("    ").append(modifiers).append(line.trim()).append('\n');
            }
        }
    }

    /**
     * @param memberModifiers 字段与方法的修饰符
     * @param initializer     语句所在的初始化块开头（{@code "static "} 或空）
     */
    protected static void members(StringBuilder sb, List<Decl> decls, String memberModifiers, String initializer) {
        for (Decl decl : decls) {
            switch (decl.shape()) {
                case FIELD:
                    sb.append("    ").append(memberModifiers).append(decl.code()).append(";\n");
                    break;
                case METHOD:
                    sb.append("    ").append(memberModifiers).append(decl.code()).append('\n');
                    break;
                case TYPE:
                    sb.append("    public static ").append(decl.code()).append('\n');
                    break;
                case EXPRESSION:
                    sb.append("    ").append(memberModifiers).append(Infer.TYPE_NAME).append(' ')
                            .append(resultName(decl)).append(" = ").append(decl.code()).append(";\n");
                    break;
                case STATEMENT:
                    sb.append("    ").append(initializer).append("{ strata.api.Unchecked.run(() -> {\n")
                            .append(decl.code()).append("\n    }); }\n");
                    break;
                default:
                    // IMPORT 已放在类之前
                    break;
            }
        }
    }

    private static String resultName(Decl decl) {
        for (DisplayItem item : decl.display()) {
            if (item.kind() == DisplayItem.Kind.IDENTITY) {
                return item.name();
            }
        }
        throw new IllegalArgumentException("expression without a result binding: " + decl);
    }

    static List<Decl> withoutMarker(List<Decl> decls, String flatMarker) {
        List<Decl> kept = new ArrayList<>(decls.size());
        for (Decl decl : decls) {
            if (!decl.hasImport(flatMarker)) {
                kept.add(decl);
            }
        }
        return kept;
    }

    protected static void entry(StringBuilder sb, String target) {
        sb.append("    public static final class ").append(ENTRY_CLASS).append(" {\n")
                .append("        public static Object ").append(ENTRY_METHOD).append("() {\n")
                .append("            return ").append(target).append(".$display();\n")
                .append("        }\n")
                .append("    }\n");
    }
}
