package strata.api;

import java.util.Collections;
import java.util.List;

/**
 * 解析器对一个片段的判定
 */
public abstract class ParseResult {

    private ParseResult() {
    }

    public static ParseResult parsed(List<Decl> decls) {
        return new Parsed(decls);
    }

    public static ParseResult incomplete(String partial) {
        return new Incomplete(partial);
    }

    public static ParseResult blank() {
        return Blank.INSTANCE;
    }

    public static ParseResult error(String message) {
        return new Error(message);
    }

    public static final class Parsed extends ParseResult {
        private final List<Decl> decls;

        Parsed(List<Decl> decls) {
            this.decls = Collections.unmodifiableList(decls);
        }

        public List<Decl> decls() {
            return decls;
        }
    }

    public static final class Incomplete extends ParseResult {
        private final String partial;

        Incomplete(String partial) {
            this.partial = partial;
        }

        public String partial() {
            return partial;
        }
    }

    public static final class Blank extends ParseResult {
        static final Blank INSTANCE = new Blank();

        private Blank() {
        }
    }

    public static final class Error extends ParseResult {
        private final String message;

        Error(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }
}
