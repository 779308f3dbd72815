package org.bimrelay.ifc.dto;

/**
 * 允许读取 IFC 文件的根目录。
 *
 * @param rootId 根目录标识（root0、root1...），文件类工具的 rootId 参数使用该值
 * @param path   根目录绝对路径
 */
public record AllowedRoot(String rootId, String path) {
}
