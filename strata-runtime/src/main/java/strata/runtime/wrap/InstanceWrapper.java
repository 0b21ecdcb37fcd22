package strata.runtime.wrap;

import strata.api.Decl;

import java.util.List;

/**
 * 实例包装：声明成为单例实例的成员，入口通过 {@code INSTANCE} 访问。
 *
 * <p>片段中出现扁平标记 import 时，本行改用扁平包装，标记声明被丢弃，
 * 包装类名改为 {@code flatCmdN} 以免与同一行的实例包装类重名。</p>
 */
public class InstanceWrapper extends AbstractWrapper {

    private final String flatMarker;
    private final FlatModuleWrapper flat;

    public InstanceWrapper(String packageName, String flatMarker) {
        super(packageName);
        this.flatMarker = flatMarker;
        this.flat = new FlatModuleWrapper(packageName, flatMarker);
    }

    @Override
    public Wrapped wrap(List<Decl> decls, String previousImports, String aliases, String wrapperName, String display) {
        if (withoutMarker(decls, flatMarker).size() != decls.size()) {
            return flat.wrap(decls, previousImports, aliases, flatName(wrapperName), display);
        }
        return super.wrap(decls, previousImports, aliases, wrapperName, display);
    }

    static String flatName(String wrapperName) {
        return "flat" + Character.toUpperCase(wrapperName.charAt(0)) + wrapperName.substring(1);
    }

    @Override
    protected void body(StringBuilder sb, List<Decl> decls, String aliases, String name, String display) {
        sb.append("public final class ").append(name).append(" implements java.io.Serializable {\n")
                .append("    private static final long serialVersionUID = 1L;\n")
                .append("    public static final ").append(name).append(" INSTANCE = new ").append(name).append("();\n");
        aliases(sb, aliases, "private ");
        members(sb, decls, "public ", "");
        sb.append("    Object $display() {\n")
                .append("        return ").append(display).append(";\n")
                .append("    }\n");
        entry(sb, name + ".INSTANCE");
        sb.append("}\n");
    }
}
