package strata.runtime.wrap;

import strata.api.Decl;
import strata.api.DisplayItem;

import java.util.ArrayList;
import java.util.List;

/**
 * 由展示项生成入口点返回的展示计算，结果是 {@code List<String>} 形式的回显行
 */
public final class DisplayCode {

    private static final String DISPLAY = "strata.api.Display";

    private DisplayCode() {
    }

    /**
     * @param hiddenImport 不回显的 import（扁平标记）
     */
    public static String render(List<Decl> decls, String hiddenImport) {
        List<String> items = new ArrayList<>();
        for (Decl decl : decls) {
            for (DisplayItem item : decl.display()) {
                switch (item.kind()) {
                    case DEFINITION:
                        items.add(DISPLAY + ".defined(" + literal(((DisplayItem.Definition) item).label()) + ", "
                                + literal(item.name()) + ")");
                        break;
                    case IMPORT:
                        if (!item.name().equals(hiddenImport)) {
                            items.add(DISPLAY + ".imported(" + literal(item.name()) + ")");
                        }
                        break;
                    case IDENTITY:
                        items.add(DISPLAY + ".identity(" + literal(item.name()) + ", " + item.name() + ")");
                        break;
                    case LAZY_IDENTITY:
                        items.add(DISPLAY + ".lazy(" + literal(item.name()) + ")");
                        break;
                    default:
                        throw new IllegalArgumentException("unknown display item: " + item);
                }
            }
        }
        return DISPLAY + ".lines(" + String.join(", ", items) + ")";
    }

    private static String literal(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
