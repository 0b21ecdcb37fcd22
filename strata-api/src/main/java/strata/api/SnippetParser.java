package strata.api;

/**
 * 把原始片段文本切分、归类为 {@link Decl}
 */
public interface SnippetParser {

    /**
     * @param source 片段文本（可能含多行）
     * @param lineId 当前行号的标识符安全形式，用于命名 res 变量
     */
    ParseResult parse(String source, String lineId);
}
