package strata.api;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 片段中的一条顶层语句或定义，外加回显与导入累积需要的元数据。
 *
 * <p>每个片段重新生成，只在一次求值迭代内有效，包装完成后即丢弃。</p>
 */
public final class Decl {

    /**
     * 声明在包装类中的落位方式
     */
    public enum Shape {
        /** 字段：{@code int x = 1} */
        FIELD,
        /** 方法：{@code int twice(int a) { ... }} */
        METHOD,
        /** 类型：class / interface / enum / record / @interface */
        TYPE,
        /** import 语句，提升到编译单元头部 */
        IMPORT,
        /** 以 ; 或代码块结尾的可执行语句 */
        STATEMENT,
        /** 片段末尾未终止的表达式，绑定为 res 变量 */
        EXPRESSION
    }

    private final String code;
    private final Shape shape;
    private final List<DisplayItem> display;
    private final Set<String> referencedNames;

    public Decl(String code, Shape shape, List<DisplayItem> display, Set<String> referencedNames) {
        this.code = code;
        this.shape = shape;
        this.display = Collections.unmodifiableList(display);
        this.referencedNames = Collections.unmodifiableSet(new LinkedHashSet<>(referencedNames));
    }

    public String code() {
        return code;
    }

    public Shape shape() {
        return shape;
    }

    public List<DisplayItem> display() {
        return display;
    }

    public Set<String> referencedNames() {
        return referencedNames;
    }

    /** 是否携带指定的 import 展示项（例如扁平包装标记） */
    public boolean hasImport(String imported) {
        for (DisplayItem item : display) {
            if (item.kind() == DisplayItem.Kind.IMPORT && item.name().equals(imported)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Decl(" + shape + ", " + code + ", " + display + ")";
    }
}
