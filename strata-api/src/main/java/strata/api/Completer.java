package strata.api;

import java.util.Collections;
import java.util.List;

/**
 * 补全候选来源
 */
public interface Completer {

    Completion complete(int cursor, String previousImports, String snippet);

    final class Completion {
        private final int anchor;
        private final List<String> candidates;

        public Completion(int anchor, List<String> candidates) {
            this.anchor = anchor;
            this.candidates = Collections.unmodifiableList(candidates);
        }

        /** 被替换前缀在片段中的起始位置 */
        public int anchor() {
            return anchor;
        }

        public List<String> candidates() {
            return candidates;
        }
    }
}
