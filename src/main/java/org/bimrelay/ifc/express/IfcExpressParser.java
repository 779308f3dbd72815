package org.bimrelay.ifc.express;

import java.util.ArrayList;
import java.util.List;

/**
 * DATA 段解析入口：切分 DATA 段，逐行解析实体，组装 {@link EntityGraph}。
 * <p>
 * 解析是宽容的：坏行被跳过，重复 id 不会中断，只有找不到 DATA 段才失败。
 */
public final class IfcExpressParser {

    private IfcExpressParser() {
    }

    /**
     * @param graph    实体图
     * @param warnings 解析阶段产生的告警
     */
    public record ParsedData(EntityGraph graph, List<Finding> warnings) {
        public ParsedData {
            warnings = List.copyOf(warnings);
        }
    }

    public static ParsedData parse(String content) throws IfcSyntaxException {
        List<SourceLine> lines = DataSectionExtractor.extract(content);
        List<Finding> warnings = new ArrayList<>();
        EntityGraphBuilder builder = new EntityGraphBuilder();
        for (SourceLine line : lines) {
            IfcEntity entity = EntityLineParser.parse(line, warnings);
            if (entity != null) {
                builder.add(entity);
            }
        }
        return new ParsedData(builder.build(), warnings);
    }
}
