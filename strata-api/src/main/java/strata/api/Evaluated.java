package strata.api;

import java.util.Collections;
import java.util.List;

/**
 * 一次成功求值的产物：生成的包装类名、它导出的新导入、以及经调用方转换后的展示值。
 */
public final class Evaluated<T> {

    private final String wrapperName;
    private final List<ImportEntry> imports;
    private final T value;

    public Evaluated(String wrapperName, List<ImportEntry> imports, T value) {
        this.wrapperName = wrapperName;
        this.imports = Collections.unmodifiableList(imports);
        this.value = value;
    }

    public String wrapperName() {
        return wrapperName;
    }

    public List<ImportEntry> imports() {
        return imports;
    }

    public T value() {
        return value;
    }

    @Override
    public String toString() {
        return "Evaluated(" + wrapperName + ", " + imports + ", " + value + ")";
    }
}
