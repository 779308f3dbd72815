package org.bimrelay.ifc.dto;

import java.util.List;

/**
 * {@code ifc_read_header} 的返回结果。
 *
 * @param rootId              根目录标识
 * @param path                文件路径（'/' 分隔）
 * @param truncated           是否因 maxBytes 只读取了文件前半段
 * @param decodedWith         解码字符集
 * @param fileDescriptions    {@code FILE_DESCRIPTION} 的 description 列表（如 ViewDefinition）
 * @param implementationLevel {@code FILE_DESCRIPTION} 的实现级别
 * @param fileName            {@code FILE_NAME} 的 name
 * @param timeStamp           {@code FILE_NAME} 的 time_stamp
 * @param authors             {@code FILE_NAME} 的 author 列表
 * @param organizations       {@code FILE_NAME} 的 organization 列表
 * @param preprocessorVersion {@code FILE_NAME} 的 preprocessor_version
 * @param originatingSystem   {@code FILE_NAME} 的 originating_system（导出软件）
 * @param authorization       {@code FILE_NAME} 的 authorization
 * @param schemas             {@code FILE_SCHEMA} 列表（如 IFC2X3、IFC4）
 * @param warnings            非致命告警
 */
public record IfcHeaderResult(
        String rootId,
        String path,
        boolean truncated,
        String decodedWith,
        List<String> fileDescriptions,
        String implementationLevel,
        String fileName,
        String timeStamp,
        List<String> authors,
        List<String> organizations,
        String preprocessorVersion,
        String originatingSystem,
        String authorization,
        List<String> schemas,
        List<String> warnings
) {
}
