package org.bimrelay.ifc.dto;

import java.util.List;

/**
 * {@code ifc_list_roots} 的返回结果。
 */
public record AllowedRootsResult(List<AllowedRoot> roots) {
}
