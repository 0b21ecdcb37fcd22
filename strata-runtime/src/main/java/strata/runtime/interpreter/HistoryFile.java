package strata.runtime.interpreter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * 持久化的会话历史：只追加的文本记录，以固定分隔符隔开。
 *
 * <p>记录中的反斜杠写成两个；记录中每处分隔符在首字符之后插入一个反斜杠，使其不再构成分隔符。
 * 读回时连续 m 个反斜杠还原为 m / 2 个。分隔符因此至少两个字符且不含反斜杠。</p>
 */
public final class HistoryFile {

    private static final char ESCAPE = '\\';

    private final Path file;
    private final String delimiter;

    public HistoryFile(Path file, String delimiter) {
        if (delimiter.length() < 2 || delimiter.indexOf(ESCAPE) >= 0) {
            throw new IllegalArgumentException(
                    "history delimiter must have at least two characters and no backslash: " + delimiter);
        }
        this.file = file;
        this.delimiter = delimiter;
    }

    public Path path() {
        return file;
    }

    /**
     * 读取已有记录；文件不存在时返回空列表
     */
    public List<String> load() throws IOException {
        List<String> records = new ArrayList<>();
        if (!Files.isRegularFile(file)) {
            return records;
        }
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        int from = 0;
        while (from <= content.length()) {
            int at = content.indexOf(delimiter, from);
            String record = at < 0 ? content.substring(from) : content.substring(from, at);
            if (!record.trim().isEmpty()) {
                records.add(unescape(record));
            }
            if (at < 0) break;
            from = at + delimiter.length();
        }
        return records;
    }

    /**
     * 追加一条记录；末尾的空白被去掉
     */
    public void append(String record) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(file, (escape(record.stripTrailing(), delimiter) + delimiter).getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    static String escape(String record, String delimiter) {
        // 与随后写入的分隔符相连也算
        String padded = record + delimiter;
        StringBuilder sb = new StringBuilder(record.length() + 8);
        for (int i = 0; i < record.length(); i++) {
            char c = record.charAt(i);
            sb.append(c);
            if (c == ESCAPE) {
                sb.append(ESCAPE);
            } else if (padded.startsWith(delimiter, i)) {
                sb.append(ESCAPE);
            }
        }
        return sb.toString();
    }

    static String unescape(String stored) {
        StringBuilder sb = new StringBuilder(stored.length());
        int i = 0;
        while (i < stored.length()) {
            char c = stored.charAt(i);
            if (c != ESCAPE) {
                sb.append(c);
                i++;
                continue;
            }
            int run = 0;
            while (i < stored.length() && stored.charAt(i) == ESCAPE) {
                run++;
                i++;
            }
            for (int k = 0; k < run / 2; k++) {
                sb.append(ESCAPE);
            }
        }
        return sb.toString();
    }
}
