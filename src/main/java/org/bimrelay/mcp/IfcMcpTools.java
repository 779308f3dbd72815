package org.bimrelay.mcp;

import org.bimrelay.ifc.IfcServerProperties;
import org.bimrelay.ifc.SecurePathResolver;
import org.bimrelay.ifc.dto.AllowedRootsResult;
import org.bimrelay.ifc.dto.IfcEntityListResult;
import org.bimrelay.ifc.dto.IfcHeaderResult;
import org.bimrelay.ifc.dto.IfcValidationResult;
import org.bimrelay.ifc.dto.express.IfcEntitySnippet;
import org.bimrelay.ifc.dto.express.IfcEntityTypeCount;
import org.bimrelay.ifc.dto.express.IfcFindingItem;
import org.bimrelay.ifc.express.Finding;
import org.bimrelay.ifc.express.IfcEntity;
import org.bimrelay.ifc.express.IfcExpressParser;
import org.bimrelay.ifc.express.IfcHeaderParser;
import org.bimrelay.ifc.express.IfcSyntaxException;
import org.bimrelay.ifc.express.IfcValidator;
import org.bimrelay.ifc.express.ValidationReportFormatter;
import org.bimrelay.ifc.express.ValidationResult;
import org.bimrelay.ifc.express.ValidationStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * IFC 校验 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出根目录白名单（{@code ifc_list_roots}）。</li>
 *   <li>校验内联 IFC 文本（{@code ifc_validate_content}）或白名单内的 .ifc 文件（{@code ifc_validate_file}）。</li>
 *   <li>读取 HEADER 段（{@code ifc_read_header}）。</li>
 *   <li>按类型分页列出 DATA 段实体（{@code ifc_list_entities}）。</li>
 * </ul>
 * <p>
 * 调用方输入错误（未知 rootId、路径越界、非 .ifc 文件）抛 {@link IllegalArgumentException}，
 * 由 Spring AI 转换为工具错误；IFC 内容本身的问题全部体现在返回结果中。
 */
@Component
public class IfcMcpTools {

    private static final Logger log = LoggerFactory.getLogger(IfcMcpTools.class);

    private final IfcServerProperties properties;
    private final SecurePathResolver pathResolver;
    private final IfcValidator validator;

    public IfcMcpTools(IfcServerProperties properties, SecurePathResolver pathResolver, IfcValidator validator) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.validator = validator;
    }

    @Tool(
            name = "ifc_list_roots",
            description = "列出允许读取 IFC 文件的根目录（rootId + path）。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "ifc_validate_content",
            description = "校验内联的 IFC(ISO-10303-21) 文本：重复 id、悬空引用、GlobalId 格式，并返回实体类型统计与文本报告。"
    )
    public IfcValidationResult validateContent(
            @ToolParam(description = "完整的 IFC 文件文本（包含 HEADER; ... ENDSEC; 与 DATA; ... ENDSEC;）") String content
    ) {
        ValidationResult result = validator.validate(content);
        log.info("内联 IFC 校验完成：valid={}, entities={}", result.isValid(), result.stats().totalEntities());
        return toValidationResult(null, null, false, null, result, List.of());
    }

    @Tool(
            name = "ifc_validate_file",
            description = "读取白名单目录内的 .ifc 文件并校验：重复 id、悬空引用、GlobalId 格式，并返回实体类型统计与文本报告。"
    )
    public IfcValidationResult validateFile(
            @ToolParam(required = false, description = "rootId（可从 ifc_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "IFC 文件路径（.ifc，相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "最大读取字节数（默认 app.ifc.read-max-bytes，上限 app.ifc.read-hard-max-bytes）") Long maxBytes
    ) {
        LoadedFile loaded = load(rootId, path, maxBytes);
        List<String> notes = new ArrayList<>(loaded.notes());
        if (loaded.truncated()) {
            notes.add("已按 maxBytes 截断读取，DATA 段可能不完整（ENDSEC 缺失时会报告 DATA section not found）。");
        }

        ValidationResult result = validator.validate(loaded.text());
        log.info("IFC 文件校验完成：path={}, valid={}, entities={}, errors={}",
                loaded.resolved().displayPath(), result.isValid(), result.stats().totalEntities(), result.errors().size());
        return toValidationResult(
                loaded.resolved().rootId(),
                loaded.resolved().displayPath(),
                loaded.truncated(),
                loaded.decodedWith(),
                result,
                notes
        );
    }

    @Tool(
            name = "ifc_read_header",
            description = "读取 .ifc 文件 HEADER 段：FILE_DESCRIPTION / FILE_NAME / FILE_SCHEMA（如 IFC2X3、IFC4），字符串会解码 \\\\X2\\\\...\\\\X0\\\\ 转义。"
    )
    public IfcHeaderResult readHeader(
            @ToolParam(required = false, description = "rootId（可从 ifc_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "IFC 文件路径（.ifc，相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "最大读取字节数（默认 app.ifc.read-max-bytes，上限 app.ifc.read-hard-max-bytes）") Long maxBytes
    ) {
        LoadedFile loaded = load(rootId, path, maxBytes);
        List<String> warnings = new ArrayList<>(loaded.notes());
        IfcHeaderParser.IfcHeader header = IfcHeaderParser.parse(loaded.text());
        if (header.warnings() != null) {
            warnings.addAll(header.warnings());
        }
        return new IfcHeaderResult(
                loaded.resolved().rootId(),
                loaded.resolved().displayPath(),
                loaded.truncated(),
                loaded.decodedWith(),
                header.fileDescriptions(),
                header.implementationLevel(),
                header.fileName(),
                header.timeStamp(),
                header.authors(),
                header.organizations(),
                header.preprocessorVersion(),
                header.originatingSystem(),
                header.authorization(),
                header.schemas(),
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "ifc_list_entities",
            description = "分页列出 .ifc 文件 DATA 段实体（可按实体类型关键字过滤，如 IFCWALL / IFCPROPERTY）。"
    )
    public IfcEntityListResult listEntities(
            @ToolParam(required = false, description = "rootId（可从 ifc_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "IFC 文件路径（.ifc，相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "实体类型过滤关键字（大小写不敏感，包含匹配）") String typeContains,
            @ToolParam(required = false, description = "匹配偏移（0-based；默认 0）") Integer offset,
            @ToolParam(required = false, description = "返回条数（默认 app.ifc.entity-list-default-limit，上限 app.ifc.entity-list-max-limit）") Integer limit,
            @ToolParam(required = false, description = "最大读取字节数（默认 app.ifc.read-max-bytes，上限 app.ifc.read-hard-max-bytes）") Long maxBytes
    ) {
        LoadedFile loaded = load(rootId, path, maxBytes);
        List<String> warnings = new ArrayList<>(loaded.notes());

        int resolvedOffset = (offset == null) ? 0 : Math.max(0, offset);
        int resolvedLimit = resolveEntityListLimit(limit);
        // 包含匹配：IFCWALL 同时命中 IFCWALL / IFCWALLSTANDARDCASE
        String filter = (typeContains == null || typeContains.isBlank()) ? null : typeContains.trim().toUpperCase(Locale.ROOT);

        IfcExpressParser.ParsedData parsed;
        try {
            parsed = IfcExpressParser.parse(loaded.text());
        } catch (IfcSyntaxException e) {
            warnings.add(e.getMessage());
            return new IfcEntityListResult(
                    loaded.resolved().rootId(), loaded.resolved().displayPath(), loaded.truncated(), loaded.decodedWith(),
                    0, 0, resolvedOffset, resolvedLimit, false, null, null, warnings
            );
        }
        for (Finding w : parsed.warnings()) {
            warnings.add(ValidationReportFormatter.formatFinding(w));
        }

        List<IfcEntitySnippet> out = new ArrayList<>(Math.min(resolvedLimit, 200));
        int matched = 0;
        for (IfcEntity entity : parsed.graph().entities()) {
            if (filter != null && !entity.type().contains(filter)) {
                continue;
            }
            if (matched >= resolvedOffset && out.size() < resolvedLimit) {
                out.add(new IfcEntitySnippet(entity.id(), entity.type(), entity.line(), entity.parameters().size(), entity.raw()));
            }
            matched++;
        }
        boolean hasMore = matched > resolvedOffset + out.size();
        return new IfcEntityListResult(
                loaded.resolved().rootId(),
                loaded.resolved().displayPath(),
                loaded.truncated(),
                loaded.decodedWith(),
                parsed.graph().size(),
                matched,
                resolvedOffset,
                resolvedLimit,
                hasMore,
                hasMore ? resolvedOffset + out.size() : null,
                out.isEmpty() ? null : out,
                warnings.isEmpty() ? null : warnings
        );
    }

    private IfcValidationResult toValidationResult(
            String rootId,
            String path,
            boolean truncated,
            String decodedWith,
            ValidationResult result,
            List<String> notes
    ) {
        ValidationStats stats = result.stats();
        List<IfcEntityTypeCount> counts = new ArrayList<>(stats.entityCounts().size());
        for (Map.Entry<String, Integer> e : stats.entityCounts().entrySet()) {
            counts.add(new IfcEntityTypeCount(e.getKey(), e.getValue()));
        }
        int maxFindings = properties.getMaxReportFindings();
        return new IfcValidationResult(
                rootId,
                path,
                truncated,
                decodedWith,
                result.isValid(),
                stats.totalEntities(),
                stats.uniqueTypes(),
                counts,
                stats.referenceCounts().total(),
                stats.referenceCounts().resolved(),
                stats.referenceCounts().broken(),
                result.errors().size(),
                result.warnings().size(),
                toFindingItems(result.errors(), maxFindings),
                toFindingItems(result.warnings(), maxFindings),
                ValidationReportFormatter.format(result, maxFindings),
                notes.isEmpty() ? null : notes
        );
    }

    private static List<IfcFindingItem> toFindingItems(List<Finding> findings, int max) {
        List<IfcFindingItem> out = new ArrayList<>(Math.min(findings.size(), max));
        for (Finding f : findings) {
            if (out.size() >= max) {
                break;
            }
            IfcEntity entity = f.entity();
            out.add(new IfcFindingItem(
                    f.kind().name(),
                    f.severity().name(),
                    entity == null ? null : entity.id(),
                    entity == null ? null : entity.type(),
                    f.line(),
                    f.message()
            ));
        }
        return out;
    }

    private record LoadedFile(
            SecurePathResolver.ResolvedPath resolved,
            String text,
            String decodedWith,
            boolean truncated,
            List<String> notes
    ) {
    }

    private LoadedFile load(String rootId, String path, Long maxBytes) {
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolveIfcFile(rootId, path);
        Path file = resolved.absolutePath();

        long totalBytes;
        try {
            totalBytes = Files.size(file);
        } catch (IOException e) {
            throw new IllegalStateException("读取文件大小失败：" + resolved.displayPath(), e);
        }

        byte[] bytes = readUpTo(file, resolveReadMaxBytes(maxBytes));
        boolean truncated = totalBytes > bytes.length;

        List<String> notes = new ArrayList<>();
        // ISO 10303-21 规定文件内容为 ISO-8859-1 范围内的字符，非 ASCII 应使用 \X2\ 等转义；
        // 实际导出器也可能直接写 UTF-8，因此先按 UTF-8 严格解码，失败再回退 ISO-8859-1。
        String decodedWith = "utf-8";
        String text = tryDecodeUtf8(bytes, bytes.length);
        if (text == null && truncated) {
            // 截断点落在多字节字符中间时，只丢掉末尾不完整的那个字符
            int complete = completeUtf8Length(bytes);
            if (complete < bytes.length) {
                text = tryDecodeUtf8(bytes, complete);
                if (text != null) {
                    notes.add("截断点落在 UTF-8 多字节字符中间，已丢弃末尾 " + (bytes.length - complete) + " 个字节。");
                }
            }
        }
        if (text == null) {
            text = new String(bytes, StandardCharsets.ISO_8859_1);
            decodedWith = "iso-8859-1";
            notes.add("文件不是有效 UTF-8，已按 ISO-8859-1 解码。");
        }
        return new LoadedFile(resolved, text, decodedWith, truncated, notes);
    }

    /**
     * 按 UTF-8 严格解码前 {@code length} 个字节；存在非法序列时返回 null。
     */
    private static String tryDecodeUtf8(byte[] bytes, int length) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, 0, length))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    /**
     * 去掉末尾不完整 UTF-8 序列后的长度；末尾序列完整（或根本不像 UTF-8）时返回原长度。
     */
    static int completeUtf8Length(byte[] bytes) {
        int lead = bytes.length - 1;
        // 最多回退 3 个续字节（10xxxxxx）找到序列首字节
        while (lead >= 0 && bytes.length - lead <= 3 && (bytes[lead] & 0xC0) == 0x80) {
            lead--;
        }
        if (lead < 0) {
            return bytes.length;
        }
        int b = bytes[lead] & 0xFF;
        int expected = b >= 0xF0 ? 4 : b >= 0xE0 ? 3 : b >= 0xC0 ? 2 : 1;
        return (bytes.length - lead < expected) ? lead : bytes.length;
    }

    private long resolveReadMaxBytes(Long maxBytes) {
        long hardMax = properties.getReadHardMaxBytes().toBytes();
        long resolved = (maxBytes == null) ? properties.getReadMaxBytes().toBytes() : maxBytes;
        resolved = Math.max(1L, resolved);
        return Math.min(resolved, hardMax);
    }

    private int resolveEntityListLimit(Integer limit) {
        int resolved = (limit == null) ? properties.getEntityListDefaultLimit() : limit;
        resolved = Math.max(1, resolved);
        return Math.min(resolved, properties.getEntityListMaxLimit());
    }

    private static byte[] readUpTo(Path file, long maxBytes) {
        // 流式读取：最多读取 maxBytes 字节
        try (InputStream in = Files.newInputStream(file)) {
            ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(maxBytes, 1024 * 1024));
            byte[] buffer = new byte[8192];
            long remaining = maxBytes;
            int read;
            while (remaining > 0 && (read = in.read(buffer, 0, (int) Math.min(buffer.length, remaining))) >= 0) {
                out.write(buffer, 0, read);
                remaining -= read;
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("读取文件失败：" + file, e);
        }
    }
}
