package strata.runtime.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * 会话配置。
 *
 * <p>加载优先级：环境变量 &gt; 系统属性（-Dstrata.xxx）&gt; 工作目录下的 strata.conf &gt; reference.conf。
 * 命令行选项通过 {@code withXxx} 方法叠加在最上层。</p>
 */
public final class ReplConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ReplConfig.class);
    private static final String CONFIG_FILE_NAME = "strata.conf";

    /**
     * 包装策略
     */
    public enum WrapMode {
        /** 扁平模块：成员为 public static */
        OBJECT,
        /** 实例包装：成员属于单例实例 */
        CLASS;

        public static WrapMode parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("unknown wrap mode '" + value + "' (expected object or class)");
            }
        }
    }

    private final WrapMode wrapMode;
    private final String wrapperPackage;
    private final String flatMarker;
    private final String predef;
    private final boolean sharedLoader;
    private final Path historyFile;
    private final String historyDelimiter;
    private final String prompt;
    private final String continuationPrompt;
    private final long completionCacheSize;
    private final Path repository;

    private ReplConfig(WrapMode wrapMode, String wrapperPackage, String flatMarker, String predef,
                       boolean sharedLoader, Path historyFile, String historyDelimiter, String prompt,
                       String continuationPrompt, long completionCacheSize, Path repository) {
        this.wrapMode = wrapMode;
        this.wrapperPackage = wrapperPackage;
        this.flatMarker = flatMarker;
        this.predef = predef;
        this.sharedLoader = sharedLoader;
        this.historyFile = historyFile;
        this.historyDelimiter = historyDelimiter;
        this.prompt = prompt;
        this.continuationPrompt = continuationPrompt;
        this.completionCacheSize = completionCacheSize;
        this.repository = repository;
    }

    /**
     * 按优先级合并所有来源
     */
    public static ReplConfig load() {
        Config fileConfig;
        File file = new File(CONFIG_FILE_NAME);
        if (file.isFile()) {
            LOG.info("Loading configuration from file: {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            fileConfig = ConfigFactory.empty();
        }
        Config combined = ConfigFactory.systemEnvironment()
                .withFallback(ConfigFactory.systemProperties())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources(ReplConfig.class.getClassLoader(), "reference.conf"));
        return from(combined.resolve());
    }

    /**
     * 只使用 reference.conf 的默认值
     */
    public static ReplConfig defaults() {
        Config config = ConfigFactory.parseResources(ReplConfig.class.getClassLoader(), "reference.conf")
                .resolveWith(ConfigFactory.systemProperties());
        return from(config);
    }

    /**
     * @throws ConfigException 缺少配置项或类型不符
     */
    public static ReplConfig from(Config root) {
        Config c = root.getConfig("strata");
        Path history = c.getBoolean("history.enabled") ? Paths.get(c.getString("history.file")) : null;
        return new ReplConfig(
                WrapMode.parse(c.getString("wrap")),
                c.getString("wrapper-package"),
                c.getString("flat-marker"),
                c.getString("predef"),
                c.getBoolean("shared-loader"),
                history,
                c.getString("history.delimiter"),
                c.getString("prompt"),
                c.getString("continuation-prompt"),
                c.getLong("completion.cache-size"),
                Paths.get(c.getString("resolver.repository")));
    }

    public WrapMode wrapMode() {
        return wrapMode;
    }

    public String wrapperPackage() {
        return wrapperPackage;
    }

    public String flatMarker() {
        return flatMarker;
    }

    public String predef() {
        return predef;
    }

    public boolean sharedLoader() {
        return sharedLoader;
    }

    /** 历史文件，禁用时为 null */
    public Path historyFile() {
        return historyFile;
    }

    public String historyDelimiter() {
        return historyDelimiter;
    }

    public String prompt() {
        return prompt;
    }

    public String continuationPrompt() {
        return continuationPrompt;
    }

    public long completionCacheSize() {
        return completionCacheSize;
    }

    public Path repository() {
        return repository;
    }

    // ============ 命令行覆盖 ============

    public ReplConfig withWrapMode(WrapMode mode) {
        return new ReplConfig(mode, wrapperPackage, flatMarker, predef, sharedLoader, historyFile,
                historyDelimiter, prompt, continuationPrompt, completionCacheSize, repository);
    }

    public ReplConfig withPredef(String code) {
        return new ReplConfig(wrapMode, wrapperPackage, flatMarker, code, sharedLoader, historyFile,
                historyDelimiter, prompt, continuationPrompt, completionCacheSize, repository);
    }

    public ReplConfig withSharedLoader(boolean shared) {
        return new ReplConfig(wrapMode, wrapperPackage, flatMarker, predef, shared, historyFile,
                historyDelimiter, prompt, continuationPrompt, completionCacheSize, repository);
    }

    /** @param file 为 null 时禁用历史文件 */
    public ReplConfig withHistoryFile(Path file) {
        return new ReplConfig(wrapMode, wrapperPackage, flatMarker, predef, sharedLoader, file,
                historyDelimiter, prompt, continuationPrompt, completionCacheSize, repository);
    }

    @Override
    public String toString() {
        return "ReplConfig(wrap=" + wrapMode + ", package=" + wrapperPackage + ", history=" + historyFile + ")";
    }
}
