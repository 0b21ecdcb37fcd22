package strata.runtime.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 某一层级的一层加载器。
 *
 * <p>查找顺序：本链已加载的类 → {@code java.*} 交给父加载器 → 内存中的产物 →
 * 本层的 classpath 根 → 父加载器。追加 classpath 时在旧层之上叠加新层，旧层中已加载的类保持同一身份。</p>
 *
 * <p>同一条链的所有层共享一个 {@link Chain}：产物只由链的最上层定义，旧层收到产物请求时转交给它，
 * 因此一个产物名在整条链中只对应一个 {@code Class}。</p>
 *
 * <p>被废弃（加载器切换）后，链上任何一层都不再提供链中定义过的类和产物表中的类。</p>
 */
final class TierClassLoader extends URLClassLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TierClassLoader.class);

    static {
        registerAsParallelCapable();
    }

    /**
     * 一条层叠链的共享状态
     */
    static final class Chain {
        /** 只有执行用户代码的链持有产物表 */
        final Map<String, byte[]> artifacts;
        final Set<String> defined = ConcurrentHashMap.newKeySet();
        volatile TierClassLoader top;
        volatile boolean discarded;

        Chain(Map<String, byte[]> artifacts) {
            this.artifacts = artifacts;
        }
    }

    private final String tierName;
    private final Chain chain;

    private TierClassLoader(String tierName, List<Path> roots, ClassLoader parent, Chain chain) {
        super(tierName, toUrls(roots), parent);
        this.tierName = tierName;
        this.chain = chain;
        chain.top = this;
    }

    /**
     * 新链的第一层
     */
    static TierClassLoader root(String tierName, List<Path> roots, ClassLoader parent, Map<String, byte[]> artifacts) {
        return new TierClassLoader(tierName, roots, parent, new Chain(artifacts));
    }

    /**
     * 在本层之上叠加一层，新层成为链的最上层
     */
    TierClassLoader layer(String tierName, List<Path> roots) {
        return new TierClassLoader(tierName, roots, this, chain);
    }

    private static URL[] toUrls(List<Path> roots) {
        URL[] urls = new URL[roots.size()];
        for (int i = 0; i < urls.length; i++) {
            try {
                urls[i] = roots.get(i).toUri().toURL();
            } catch (MalformedURLException e) {
                throw new IllegalArgumentException("invalid classpath root: " + roots.get(i), e);
            }
        }
        return urls;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (chain.discarded && isChainClass(name)) {
            throw new ClassNotFoundException(name + " (loader " + tierName + " was discarded by a loader swap)");
        }
        byte[] bytes = chain.artifacts != null ? chain.artifacts.get(name) : null;
        TierClassLoader top = chain.top;
        if (bytes != null && top != this && findLoadedInLayers(name) == null) {
            return top.loadClass(name, resolve);
        }
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedInLayers(name);
            if (c == null) {
                if (name.startsWith("java.")) {
                    return super.loadClass(name, resolve);
                }
                if (bytes != null) {
                    c = defineClass(name, bytes, 0, bytes.length);
                    chain.defined.add(name);
                } else {
                    try {
                        c = findClass(name);
                    } catch (ClassNotFoundException e) {
                        return super.loadClass(name, resolve);
                    }
                }
            }
            if (resolve) {
                resolveClass(c);
            }
            return c;
        }
    }

    private boolean isChainClass(String name) {
        return chain.defined.contains(name) || (chain.artifacts != null && chain.artifacts.containsKey(name));
    }

    /**
     * 在本层以及同一条链下方的旧层中查找已加载的类
     */
    private Class<?> findLoadedInLayers(String name) {
        ClassLoader layer = this;
        while (layer instanceof TierClassLoader && ((TierClassLoader) layer).chain == chain) {
            TierClassLoader tier = (TierClassLoader) layer;
            Class<?> c = tier.findLoaded(name);
            if (c != null) {
                return c;
            }
            layer = tier.getParent();
        }
        return null;
    }

    private Class<?> findLoaded(String name) {
        return findLoadedClass(name);
    }

    /**
     * 废弃整条链并关闭每一层
     */
    void discard() {
        chain.discarded = true;
        ClassLoader layer = chain.top;
        while (layer instanceof TierClassLoader && ((TierClassLoader) layer).chain == chain) {
            TierClassLoader tier = (TierClassLoader) layer;
            try {
                tier.close();
            } catch (IOException e) {
                LOG.warn("failed to close {}: {}", tier, e.toString());
            }
            layer = tier.getParent();
        }
    }

    @Override
    public String toString() {
        return "TierClassLoader(" + tierName + (chain.discarded ? ", discarded" : "") + ")";
    }
}
