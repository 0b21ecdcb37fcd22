package strata.runtime.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.api.DependencyResolver;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 在本地 Maven 仓库中定位 jar，不下载，也不解析传递依赖。
 *
 * <p>坐标格式 {@code group:artifact:version} 或 {@code group:artifact:version:classifier}。</p>
 */
public class LocalRepositoryResolver implements DependencyResolver {

    private static final Logger LOG = LoggerFactory.getLogger(LocalRepositoryResolver.class);

    private final Path repository;

    public LocalRepositoryResolver(Path repository) {
        this.repository = repository;
    }

    @Override
    public List<Path> resolve(List<String> coordinates) {
        List<Path> jars = new ArrayList<>();
        for (String coordinate : coordinates) {
            Path jar = locate(coordinate);
            if (Files.isRegularFile(jar)) {
                jars.add(jar);
            } else {
                LOG.warn("{} not found in local repository ({})", coordinate, jar);
            }
        }
        return jars;
    }

    /**
     * 坐标在仓库中对应的 jar 路径（不检查是否存在）
     *
     * @throws IllegalArgumentException 坐标格式错误
     */
    public Path locate(String coordinate) {
        String[] parts = coordinate.trim().split(":");
        if (parts.length < 3 || parts.length > 4) {
            throw new IllegalArgumentException("expected group:artifact:version[:classifier], got " + coordinate);
        }
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("empty segment in " + coordinate);
            }
        }
        String group = parts[0];
        String artifact = parts[1];
        String version = parts[2];
        String file = artifact + "-" + version + (parts.length == 4 ? "-" + parts[3] : "") + ".jar";
        Path dir = repository;
        for (String segment : group.split("\\.")) {
            dir = dir.resolve(segment);
        }
        return dir.resolve(artifact).resolve(version).resolve(file);
    }

    public Path repository() {
        return repository;
    }
}
