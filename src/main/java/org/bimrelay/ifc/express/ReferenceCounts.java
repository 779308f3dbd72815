package org.bimrelay.ifc.express;

/**
 * 引用计数：{@code resolved + broken == total}。
 */
public record ReferenceCounts(int total, int resolved, int broken) {

    public static final ReferenceCounts ZERO = new ReferenceCounts(0, 0, 0);
}
