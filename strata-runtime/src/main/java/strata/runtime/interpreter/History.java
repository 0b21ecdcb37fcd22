package strata.runtime.interpreter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 会话历史。可选地把每条记录追加到历史文件，启动时由文件中的记录填充。
 */
public final class History {

    private static final Logger LOG = LoggerFactory.getLogger(History.class);

    private final List<String> entries = new ArrayList<>();
    private final HistoryFile file;

    public History() {
        this.file = null;
    }

    /**
     * 读取历史文件作为初始内容；读取失败时以空历史开始
     */
    public History(HistoryFile file) {
        this.file = file;
        try {
            entries.addAll(file.load());
            LOG.debug("loaded {} history record(s) from {}", entries.size(), file.path());
        } catch (IOException e) {
            LOG.warn("cannot read history file {}: {}", file.path(), e.toString());
        }
    }

    public synchronized void add(String record) {
        entries.add(record);
        if (file != null) {
            try {
                file.append(record);
            } catch (IOException e) {
                LOG.warn("cannot write history file {}: {}", file.path(), e.toString());
            }
        }
    }

    public synchronized List<String> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public synchronized int size() {
        return entries.size();
    }
}
