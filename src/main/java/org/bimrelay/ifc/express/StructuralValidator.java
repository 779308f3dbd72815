package org.bimrelay.ifc.express;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 实体图结构校验。
 * <p>
 * 三项检查互相独立、都会完整执行，结果按顺序拼接：
 * <ol>
 *   <li>重复 id（SCHEMA）</li>
 *   <li>引用指向不存在的实体（SEMANTIC）</li>
 *   <li>GlobalId 格式（SCHEMA），只检查配置的实体类型</li>
 * </ol>
 */
public class StructuralValidator {

    public static final String DEFAULT_GLOBAL_ID_TYPE = "IFCGLOBALID";

    private static final Pattern GLOBAL_ID = Pattern.compile("^[0-9A-Za-z_$]{22}$");

    private final Set<String> globalIdTypes;

    public StructuralValidator() {
        this(Set.of(DEFAULT_GLOBAL_ID_TYPE));
    }

    public StructuralValidator(Set<String> globalIdTypes) {
        Set<String> normalized = new HashSet<>();
        for (String type : globalIdTypes) {
            if (type != null && !type.isBlank()) {
                normalized.add(type.trim().toUpperCase(Locale.ROOT));
            }
        }
        this.globalIdTypes = Set.copyOf(normalized);
    }

    public List<Finding> validate(EntityGraph graph) {
        List<Finding> findings = new ArrayList<>();
        findings.addAll(validateUniqueIds(graph));
        findings.addAll(validateReferences(graph));
        findings.addAll(validateGlobalIds(graph));
        return findings;
    }

    List<Finding> validateUniqueIds(EntityGraph graph) {
        List<Finding> findings = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (IfcEntity entity : graph.declarations()) {
            if (!seen.add(entity.id())) {
                findings.add(Finding.error(FindingKind.SCHEMA, entity, "Duplicate ID found: " + entity.id()));
            }
        }
        return findings;
    }

    List<Finding> validateReferences(EntityGraph graph) {
        List<Finding> findings = new ArrayList<>();
        for (IfcEntity entity : graph.declarations()) {
            for (IfcValue value : entity.parameters()) {
                if (value instanceof IfcRef ref && !graph.contains(ref.id())) {
                    findings.add(Finding.error(FindingKind.SEMANTIC, entity, "Broken reference to ID " + ref.id()));
                }
            }
        }
        return findings;
    }

    List<Finding> validateGlobalIds(EntityGraph graph) {
        List<Finding> findings = new ArrayList<>();
        if (globalIdTypes.isEmpty()) {
            return findings;
        }
        for (IfcEntity entity : graph.declarations()) {
            if (!globalIdTypes.contains(entity.type()) || entity.parameters().isEmpty()) {
                continue;
            }
            if (entity.parameters().get(0) instanceof IfcString globalId
                    && !GLOBAL_ID.matcher(globalId.text()).matches()) {
                findings.add(Finding.error(FindingKind.SCHEMA, entity, "Invalid Global ID format: " + globalId.raw()));
            }
        }
        return findings;
    }
}
