package strata.api;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 把一个包装好的编译单元编译成字节码。
 */
public interface SnippetCompiler {

    /**
     * 编译失败时返回 null，诊断信息已写入 {@code printer}。
     */
    Output compileOrNull(Request request, Frame frame, Consumer<String> printer);

    final class Request {
        private final String source;
        private final String moduleClass;
        private final int importsLength;
        private final String fileName;

        /**
         * @param source        完整编译单元
         * @param moduleClass   持有用户成员的包装类二进制名，其公开成员会被导出
         * @param importsLength 源码中前置导入块的长度，之后出现的 import 视为用户导入
         * @param fileName      诊断中显示的文件名
         */
        public Request(String source, String moduleClass, int importsLength, String fileName) {
            this.source = source;
            this.moduleClass = moduleClass;
            this.importsLength = importsLength;
            this.fileName = fileName;
        }

        public String source() {
            return source;
        }

        public String moduleClass() {
            return moduleClass;
        }

        public int importsLength() {
            return importsLength;
        }

        public String fileName() {
            return fileName;
        }
    }

    final class Output {
        private final Map<String, byte[]> classFiles;
        private final List<ImportEntry> imports;

        public Output(Map<String, byte[]> classFiles, List<ImportEntry> imports) {
            this.classFiles = Collections.unmodifiableMap(classFiles);
            this.imports = Collections.unmodifiableList(imports);
        }

        /** 二进制类名 → 字节码 */
        public Map<String, byte[]> classFiles() {
            return classFiles;
        }

        /** 导出的导入项；包装类成员的前缀为空 */
        public List<ImportEntry> imports() {
            return imports;
        }
    }
}
