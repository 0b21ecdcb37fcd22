package strata.runtime.wrap;

/**
 * 包装结果：一个完整的编译单元
 */
public final class Wrapped {

    private final String packageName;
    private final String simpleName;
    private final String source;
    private final int importsLength;

    Wrapped(String packageName, String simpleName, String source, int importsLength) {
        this.packageName = packageName;
        this.simpleName = simpleName;
        this.source = source;
        this.importsLength = importsLength;
    }

    /** 包装类简单名，可能与请求的名字不同（扁平逃逸） */
    public String simpleName() {
        return simpleName;
    }

    /** 包装类二进制名 */
    public String binaryName() {
        return packageName.isEmpty() ? simpleName : packageName + "." + simpleName;
    }

    /** 入口类二进制名 */
    public String entryClass() {
        return binaryName() + "$" + CodeWrapper.ENTRY_CLASS;
    }

    public String fileName() {
        return simpleName + ".java";
    }

    public String source() {
        return source;
    }

    /** 源码中 package 声明与前置导入块的长度 */
    public int importsLength() {
        return importsLength;
    }

    @Override
    public String toString() {
        return "Wrapped(" + binaryName() + ")";
    }
}
