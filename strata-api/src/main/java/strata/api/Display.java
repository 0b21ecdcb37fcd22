package strata.api;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 包装类入口点使用的回显助手。每个方法返回一行文本，返回 null 表示该项不显示。
 */
public final class Display {

    private Display() {
    }

    /** 汇总回显行，忽略 null */
    public static List<String> lines(String... items) {
        List<String> out = new ArrayList<>(items.length);
        for (String item : items) {
            if (item != null) {
                out.add(item);
            }
        }
        return Collections.unmodifiableList(out);
    }

    public static String defined(String label, String name) {
        return "defined " + label + " " + name;
    }

    public static String imported(String imported) {
        return "import " + imported;
    }

    public static String identity(String name, Object value) {
        if (value instanceof Unit) {
            return null;
        }
        return name + " = " + render(value);
    }

    public static String lazy(String name) {
        return name + " = <lazy>";
    }

    public static String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return quote((String) value, '"');
        }
        if (value instanceof Character) {
            return quote(String.valueOf(value), '\'');
        }
        if (value.getClass().isArray()) {
            StringBuilder sb = new StringBuilder("[");
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                if (i > 0) sb.append(", ");
                sb.append(render(Array.get(value, i)));
            }
            return sb.append(']').toString();
        }
        return String.valueOf(value);
    }

    private static String quote(String s, char q) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append(q);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\n': sb.append("\\n"); break;
                case '\t': sb.append("\\t"); break;
                case '\r': sb.append("\\r"); break;
                case '\\': sb.append("\\\\"); break;
                default:
                    if (c == q) sb.append('\\');
                    sb.append(c);
            }
        }
        return sb.append(q).toString();
    }
}
