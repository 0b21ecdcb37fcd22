package strata.runtime.wrap;

import strata.api.Decl;

import java.util.List;

/**
 * 扁平模块包装：声明成为包装类的 public static 成员，语句在静态初始化块中按顺序执行。
 *
 * <pre>
 * public final class cmd3 {
 *     public static int x = 1;
 *     static Object $display() { return ...; }
 *     public static final class $Main { public static Object $main() { return cmd3.$display(); } }
 * }
 * </pre>
 */
public class FlatModuleWrapper extends AbstractWrapper {

    private final String flatMarker;

    /**
     * @param flatMarker 扁平标记 import；本策略下已是扁平包装，带标记的声明直接丢弃
     */
    public FlatModuleWrapper(String packageName, String flatMarker) {
        super(packageName);
        this.flatMarker = flatMarker;
    }

    @Override
    public Wrapped wrap(List<Decl> decls, String previousImports, String aliases, String wrapperName, String display) {
        return super.wrap(withoutMarker(decls, flatMarker), previousImports, aliases, wrapperName, display);
    }

    @Override
    protected void body(StringBuilder sb, List<Decl> decls, String aliases, String name, String display) {
        sb.append("public final class ").append(name).append(" {\n");
        aliases(sb, aliases, "private static ");
        members(sb, decls, "public static ", "static ");
        sb.append("    static Object $display() {\n")
                .append("        return ").append(display).append(";\n")
                .append("    }\n");
        entry(sb, name);
        sb.append("}\n");
    }
}
