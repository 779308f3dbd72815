package org.bimrelay.ifc;

import org.bimrelay.ifc.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 把调用方传入的路径解析成 {@code app.ifc.roots} 白名单内的 IFC 文件绝对路径。
 * <p>
 * 校验内容：
 * <ul>
 *   <li>路径必须落在某个 root 之内（阻止 {@code ../} 穿越）</li>
 *   <li>默认不允许符号链接；逐级 realPath 校验，防止 junction/symlink 逃逸</li>
 *   <li>目标必须是存在的普通文件，扩展名为 {@code .ifc}</li>
 * </ul>
 * 服务只读，不提供写入路径解析。
 */
public class SecurePathResolver {

    private final IfcServerProperties properties;
    private final List<Root> roots;

    public SecurePathResolver(IfcServerProperties properties) {
        this.properties = properties;
        this.roots = normalizeRoots(properties);
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.rootPath().toString()));
        }
        return result;
    }

    public ResolvedPath resolveIfcFile(String rootId, String inputPath) {
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("必须提供 IFC 文件路径");
        }
        ResolvedPath resolved = resolve(rootId, inputPath);
        Path file = resolved.absolutePath();
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("不是普通文件：" + resolved.displayPath());
        }
        String name = file.getFileName() == null ? "" : file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (!name.endsWith(".ifc")) {
            throw new IllegalArgumentException("不是 IFC 文件（仅支持 .ifc）：" + resolved.displayPath());
        }
        return resolved;
    }

    ResolvedPath resolve(String rootId, String inputPath) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.ifc.roots）");
        }

        Path rawPath = Path.of(inputPath);
        Root selectedRoot;
        Path absolute;
        // 绝对路径：选层级最深的匹配 root；相对路径：按 rootId 解析，rootId 为空时默认 root0
        if (rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            selectedRoot = (rootId == null || rootId.isBlank()) ? findBestRootForAbsolute(absolute) : findRootById(rootId);
        } else {
            selectedRoot = (rootId == null || rootId.isBlank()) ? roots.get(0) : findRootById(rootId);
            absolute = selectedRoot.rootPath().resolve(rawPath).normalize();
        }

        if (!absolute.startsWith(selectedRoot.rootPath())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }
        if (!Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + inputPath);
        }
        validateWithinRoot(selectedRoot, absolute);

        return new ResolvedPath(selectedRoot.id(), absolute, displayPath(selectedRoot, absolute));
    }

    private void validateWithinRoot(Root root, Path absolute) {
        Path rootReal;
        try {
            rootReal = root.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.rootPath(), e);
        }

        // 逐级检查 root -> 目标路径，中间任何一级是链接都可能逃逸
        Path current = root.rootPath();
        for (Path segment : root.rootPath().relativize(absolute)) {
            current = current.resolve(segment);
            if (!properties.isAllowSymlink() && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
        }

        try {
            if (!absolute.toRealPath().startsWith(rootReal)) {
                throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + absolute);
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("路径无法解析：" + absolute, e);
        }
    }

    private Root findRootById(String rootId) {
        return roots.stream()
                .filter(r -> r.id().equals(rootId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的 rootId：" + rootId));
    }

    private Root findBestRootForAbsolute(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(IfcServerProperties properties) {
        List<String> configured = properties.getRoots();
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.ifc.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private static String displayPath(Root root, Path absolute) {
        return root.rootPath().relativize(absolute).toString().replace('\\', '/');
    }

    private record Root(String id, Path rootPath) {
    }

    public record ResolvedPath(String rootId, Path absolutePath, String displayPath) {
    }
}
