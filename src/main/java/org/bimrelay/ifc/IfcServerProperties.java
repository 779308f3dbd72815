package org.bimrelay.ifc;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * IFC 校验 MCP Server 的业务配置（{@code app.ifc.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #roots}：文件类工具只允许读取这些目录内的 .ifc 文件。</li>
 *   <li>{@link #readMaxBytes}/{@link #readHardMaxBytes}：单次读取的字节上限，避免超大模型占满内存。</li>
 *   <li>{@link #globalIdTypes}：需要做 GlobalId 格式检查的实体类型。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.ifc")
public class IfcServerProperties {

    /**
     * 允许访问的根目录白名单，依次分配 rootId：root0、root1...
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许访问符号链接（默认不允许，防止路径逃逸）。
     */
    private boolean allowSymlink = false;

    /**
     * 文件类工具默认读取的最大字节数（超出部分不参与校验）。
     */
    @NotNull
    private DataSize readMaxBytes = DataSize.ofMegabytes(16);

    /**
     * 调用方通过 maxBytes 参数放宽读取量时的硬上限。
     */
    @NotNull
    private DataSize readHardMaxBytes = DataSize.ofMegabytes(128);

    /**
     * 第一个参数按 22 位 GlobalId 格式检查的实体类型（大写）。
     */
    @NotNull
    private List<String> globalIdTypes = List.of("IFCGLOBALID");

    /**
     * {@code ifc_list_entities} 默认返回条数。
     */
    @Min(1)
    @Max(10_000)
    private int entityListDefaultLimit = 50;

    /**
     * {@code ifc_list_entities} 单次允许返回的最大条数。
     */
    @Min(1)
    @Max(10_000)
    private int entityListMaxLimit = 500;

    /**
     * 工具返回结果中 errors/warnings 各自最多保留的条数（完整数量仍在计数字段中体现）。
     */
    @Min(1)
    @Max(1_000_000)
    private int maxReportFindings = 500;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public DataSize getReadMaxBytes() {
        return readMaxBytes;
    }

    public void setReadMaxBytes(DataSize readMaxBytes) {
        this.readMaxBytes = readMaxBytes;
    }

    public DataSize getReadHardMaxBytes() {
        return readHardMaxBytes;
    }

    public void setReadHardMaxBytes(DataSize readHardMaxBytes) {
        this.readHardMaxBytes = readHardMaxBytes;
    }

    public List<String> getGlobalIdTypes() {
        return globalIdTypes;
    }

    public void setGlobalIdTypes(List<String> globalIdTypes) {
        this.globalIdTypes = globalIdTypes;
    }

    public int getEntityListDefaultLimit() {
        return entityListDefaultLimit;
    }

    public void setEntityListDefaultLimit(int entityListDefaultLimit) {
        this.entityListDefaultLimit = entityListDefaultLimit;
    }

    public int getEntityListMaxLimit() {
        return entityListMaxLimit;
    }

    public void setEntityListMaxLimit(int entityListMaxLimit) {
        this.entityListMaxLimit = entityListMaxLimit;
    }

    public int getMaxReportFindings() {
        return maxReportFindings;
    }

    public void setMaxReportFindings(int maxReportFindings) {
        this.maxReportFindings = maxReportFindings;
    }
}
