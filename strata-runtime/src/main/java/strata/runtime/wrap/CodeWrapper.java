package strata.runtime.wrap;

import strata.api.Decl;

import java.util.List;

/**
 * 把一批声明和导入前言包装成一个可编译单元。
 *
 * <p>生成的入口为 {@code <包装类>$$Main.$main()}，返回值恰好是调用方给出的展示计算。</p>
 */
public interface CodeWrapper {

    /** 入口类的简单名 */
    String ENTRY_CLASS = "$Main";

    /** 入口方法名 */
    String ENTRY_METHOD = "$main";

    /**
     * @param decls           本片段的声明
     * @param previousImports 导入前言，原样放在用户声明之前
     * @param aliases         实例成员别名声明，每行一条，不带修饰符
     * @param wrapperName     请求的包装类名
     * @param display         展示计算（Java 表达式），在包装类成员的作用域中求值
     */
    Wrapped wrap(List<Decl> decls, String previousImports, String aliases, String wrapperName, String display);
}
