package strata.api;

import java.nio.file.Path;
import java.util.List;

/**
 * 依赖坐标 → 本地文件
 */
public interface DependencyResolver {

    /**
     * @param coordinates {@code group:artifact:version} 形式的坐标
     * @return 已存在的 jar 路径；无法解析的坐标不产生路径
     */
    List<Path> resolve(List<String> coordinates);
}
