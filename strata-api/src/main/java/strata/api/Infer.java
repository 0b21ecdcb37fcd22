package strata.api;

/**
 * 类型占位符：{@code var} 字段与 res 绑定先以此类型生成，编译器根据初始化表达式推断出真实类型后替换。
 */
public final class Infer {

    public static final String TYPE_NAME = "strata.api.Infer";

    private Infer() {
    }
}
