package strata.runtime.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.api.ClassLoaderTier;
import strata.api.Frame;
import strata.api.Res;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;

/**
 * 分层的类与产物注册表。
 *
 * <p>每个 {@link ClassLoaderTier} 拥有只追加的 classpath 根列表与按需构建的加载器；
 * 编译出的类以二进制名 → 字节码存放在内存中，只由 RUNTIME 层（合并模式下为合并后的加载器）提供。</p>
 *
 * <p>调用方不要缓存 {@link #currentLoader} 的返回值：追加 classpath 或切换合并模式都会换掉加载器对象。</p>
 *
 * <p>同时作为编译器看到的 {@link Frame}。</p>
 */
public class ArtifactRegistry implements Frame {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactRegistry.class);

    private final ClassLoader parent;
    private final List<Path> hostClasspath;
    private final Map<ClassLoaderTier, Set<Path>> roots = new EnumMap<>(ClassLoaderTier.class);
    private final Map<String, byte[]> artifacts = new ConcurrentHashMap<>();
    private final Map<String, String> sources = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<BiConsumer<ClassLoaderTier, List<Path>>> observers = new CopyOnWriteArrayList<>();

    private TierClassLoader runtimeLoader;
    private TierClassLoader compilerLoader;
    private TierClassLoader pluginLoader;
    private boolean shared;
    private int generation;

    public ArtifactRegistry(ClassLoader parent) {
        this(parent, detectHostClasspath());
    }

    public ArtifactRegistry(ClassLoader parent, List<Path> hostClasspath) {
        this.parent = parent;
        this.hostClasspath = Collections.unmodifiableList(new ArrayList<>(hostClasspath));
        for (ClassLoaderTier tier : ClassLoaderTier.values()) {
            roots.put(tier, new LinkedHashSet<>());
        }
    }

    /**
     * 宿主 classpath：{@code java.class.path} 加上 API 类所在的位置（嵌入运行时两者可能不同）
     */
    public static List<Path> detectHostClasspath() {
        Set<Path> paths = new LinkedHashSet<>();
        for (String entry : System.getProperty("java.class.path", "").split(File.pathSeparator)) {
            if (!entry.isEmpty()) {
                paths.add(Paths.get(entry).toAbsolutePath());
            }
        }
        CodeSource api = Res.class.getProtectionDomain().getCodeSource();
        if (api != null && api.getLocation() != null) {
            try {
                paths.add(Paths.get(api.getLocation().toURI()).toAbsolutePath());
            } catch (URISyntaxException | IllegalArgumentException e) {
                LOG.debug("cannot locate strata-api on disk: {}", e.toString());
            }
        }
        return new ArrayList<>(paths);
    }

    // ============ classpath 根 ============

    /**
     * 追加 classpath 根。不存在的路径与已有的路径被忽略。
     *
     * @return 实际追加的路径
     */
    public synchronized List<Path> addPaths(ClassLoaderTier tier, List<Path> paths) {
        Set<Path> tierRoots = roots.get(tier);
        List<Path> added = new ArrayList<>();
        for (Path path : paths) {
            Path p = path.toAbsolutePath().normalize();
            if (Files.exists(p) && !tierRoots.contains(p) && !added.contains(p)) {
                added.add(p);
            }
        }
        if (added.isEmpty()) {
            return added;
        }
        tierRoots.addAll(added);
        layer(tier, added);
        LOG.debug("added {} path(s) to {}: {}", added.size(), tier, added);
        for (BiConsumer<ClassLoaderTier, List<Path>> observer : observers) {
            observer.accept(tier, Collections.unmodifiableList(added));
        }
        return added;
    }

    /**
     * 已构建的加载器上叠加新层，未构建的等到首次使用时再带上全部根
     */
    private void layer(ClassLoaderTier tier, List<Path> added) {
        switch (tier) {
            case RUNTIME:
                if (runtimeLoader != null) {
                    runtimeLoader = runtimeLoader.layer(loaderName(tier), added);
                    if (shared) {
                        compilerLoader = runtimeLoader;
                        pluginLoader = null;
                    }
                }
                break;
            case COMPILER_INTERNAL:
                if (compilerLoader != null) {
                    compilerLoader = compilerLoader.layer(loaderName(tier), added);
                    if (shared) {
                        runtimeLoader = compilerLoader;
                    }
                    // 插件加载器以编译器内部加载器为父
                    pluginLoader = null;
                }
                break;
            case PLUGIN:
                if (pluginLoader != null) {
                    pluginLoader = pluginLoader.layer(loaderName(tier), added);
                }
                break;
            default:
                throw new IllegalArgumentException("unknown tier: " + tier);
        }
    }

    public synchronized List<Path> paths(ClassLoaderTier tier) {
        return Collections.unmodifiableList(new ArrayList<>(roots.get(tier)));
    }

    /**
     * 注册 classpath 追加事件的观察者
     */
    public void onPathsAdded(BiConsumer<ClassLoaderTier, List<Path>> observer) {
        observers.add(observer);
    }

    // ============ 产物 ============

    /**
     * 新增或覆盖一个编译产物，之后的类查找立即可见
     */
    public void addArtifact(String binaryName, byte[] bytes) {
        artifacts.put(binaryName, bytes);
    }

    /**
     * @return 字节码，不存在时为 null
     */
    public byte[] lookupArtifact(String binaryName) {
        return artifacts.get(binaryName);
    }

    public Map<String, byte[]> artifacts() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    /**
     * 记录包装类的生成源码
     */
    public void recordSource(String wrapperName, String source) {
        sources.put(wrapperName, source);
    }

    public Map<String, String> sources() {
        synchronized (sources) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        }
    }

    // ============ 加载器 ============

    /**
     * 层级当前的加载器；不要缓存
     */
    public synchronized ClassLoader currentLoader(ClassLoaderTier tier) {
        switch (tier) {
            case RUNTIME:
                if (runtimeLoader == null) {
                    if (shared) {
                        runtimeLoader = compilerLoader = sharedLoader();
                    } else {
                        runtimeLoader = TierClassLoader.root(loaderName(tier), paths(tier), parent, artifacts);
                    }
                }
                return runtimeLoader;
            case COMPILER_INTERNAL:
                if (compilerLoader == null) {
                    if (shared) {
                        runtimeLoader = compilerLoader = sharedLoader();
                    } else {
                        compilerLoader = TierClassLoader.root(loaderName(tier), paths(tier), parent, null);
                    }
                }
                return compilerLoader;
            case PLUGIN:
                if (pluginLoader == null) {
                    pluginLoader = TierClassLoader.root(loaderName(tier), paths(tier),
                            currentLoader(ClassLoaderTier.COMPILER_INTERNAL), null);
                }
                return pluginLoader;
            default:
                throw new IllegalArgumentException("unknown tier: " + tier);
        }
    }

    private TierClassLoader sharedLoader() {
        List<Path> union = new ArrayList<>(roots.get(ClassLoaderTier.RUNTIME));
        for (Path p : roots.get(ClassLoaderTier.COMPILER_INTERNAL)) {
            if (!union.contains(p)) union.add(p);
        }
        return TierClassLoader.root("shared", union, parent, artifacts);
    }

    private String loaderName(ClassLoaderTier tier) {
        if (shared && tier != ClassLoaderTier.PLUGIN) {
            return "shared";
        }
        return tier.name().toLowerCase(Locale.ROOT);
    }

    public synchronized boolean isSharedCompileExecuteMode() {
        return shared;
    }

    /**
     * 合并或拆分 RUNTIME 与 COMPILER_INTERNAL 加载器。
     *
     * <p>若执行用户代码的加载器已经构建，切换会废弃所有旧加载器并清空产物：
     * 此前加载的包装类不再可达，会话中已计算的值随之失效。</p>
     *
     * @return 是否真的替换了加载器
     */
    public synchronized boolean setSharedCompileExecuteMode(boolean enabled) {
        if (enabled == shared) {
            return false;
        }
        shared = enabled;
        if (runtimeLoader == null) {
            compilerLoader = null;
            pluginLoader = null;
            return false;
        }
        generation++;
        LOG.warn("class loader swap (shared={}), generation {}: previously loaded session classes are discarded",
                enabled, generation);
        for (TierClassLoader loader : new TierClassLoader[]{pluginLoader, compilerLoader, runtimeLoader}) {
            if (loader != null) {
                loader.discard();
            }
        }
        runtimeLoader = null;
        compilerLoader = null;
        pluginLoader = null;
        artifacts.clear();
        sources.clear();
        return true;
    }

    // ============ Frame ============

    @Override
    public synchronized List<Path> classpath() {
        List<Path> classpath = new ArrayList<>(hostClasspath);
        for (Path p : roots.get(ClassLoaderTier.RUNTIME)) {
            if (!classpath.contains(p)) classpath.add(p);
        }
        if (shared) {
            for (Path p : roots.get(ClassLoaderTier.COMPILER_INTERNAL)) {
                if (!classpath.contains(p)) classpath.add(p);
            }
        }
        return classpath;
    }

    @Override
    public Map<String, byte[]> dynamicClasses() {
        return artifacts();
    }

    @Override
    public ClassLoader pluginClassLoader() {
        return currentLoader(ClassLoaderTier.PLUGIN);
    }

    @Override
    public synchronized int generation() {
        return generation;
    }
}
