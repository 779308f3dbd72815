package org.bimrelay.ifc.express;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class StructuralValidatorTest {

    private static EntityGraph graph(String dataLines) throws IfcSyntaxException {
        return IfcExpressParser.parse("DATA;\n" + dataLines + "ENDSEC;\n").graph();
    }

    @Test
    void validate_reportsEveryLaterDuplicate() throws Exception {
        EntityGraph graph = graph("""
                #1=IFCPERSON('A');
                #1=IFCPERSON('B');
                #1=IFCPERSON('C');
                """);

        List<Finding> findings = new StructuralValidator().validate(graph);

        assertThat(findings).hasSize(2);
        assertThat(findings).allSatisfy(f -> {
            assertThat(f.kind()).isEqualTo(FindingKind.SCHEMA);
            assertThat(f.severity()).isEqualTo(Severity.ERROR);
            assertThat(f.message()).isEqualTo("Duplicate ID found: 1");
        });
        assertThat(findings.get(0).entity().raw()).isEqualTo("#1=IFCPERSON('B');");
        assertThat(findings.get(1).entity().raw()).isEqualTo("#1=IFCPERSON('C');");
        assertThat(graph.get(1).raw()).isEqualTo("#1=IFCPERSON('A');");
    }

    @Test
    void validate_reportsBrokenReferencesAgainstOwningEntity() throws Exception {
        EntityGraph graph = graph("""
                #1=IFCRELAGGREGATES(#2,#3,#3);
                #2=IFCPROJECT($);
                """);

        List<Finding> findings = new StructuralValidator().validate(graph);

        assertThat(findings).hasSize(2);
        assertThat(findings).allSatisfy(f -> {
            assertThat(f.kind()).isEqualTo(FindingKind.SEMANTIC);
            assertThat(f.entity().id()).isEqualTo(1);
            assertThat(f.message()).isEqualTo("Broken reference to ID 3");
            assertThat(f.line()).isEqualTo(2);
        });
    }

    @Test
    void validate_duplicateIsStillCheckedForReferences() throws Exception {
        EntityGraph graph = graph("""
                #1=IFCPERSON($);
                #1=IFCPERSON(#9);
                """);

        List<Finding> findings = new StructuralValidator().validate(graph);

        assertThat(findings).extracting(Finding::kind).containsExactly(FindingKind.SCHEMA, FindingKind.SEMANTIC);
    }

    @Test
    void validate_checksGlobalIdFormat() throws Exception {
        EntityGraph graph = graph("""
                #5=IFCGLOBALID('2O2Fr$t4X7Zf8NOew3FLOH');
                #6=IFCGLOBALID('bad-id');
                #7=IFCGLOBALID($);
                #8=IFCGLOBALID(42);
                """);

        List<Finding> findings = new StructuralValidator().validate(graph);

        assertThat(findings).hasSize(1);
        assertThat(findings.get(0).kind()).isEqualTo(FindingKind.SCHEMA);
        assertThat(findings.get(0).entity().id()).isEqualTo(6);
        assertThat(findings.get(0).message()).isEqualTo("Invalid Global ID format: 'bad-id'");
    }

    @Test
    void validate_globalIdTypesAreConfigurable() throws Exception {
        EntityGraph graph = graph("""
                #34=IFCBUILDING('1jTKhVfdn6vBgO53mfGNFh',$);
                #35=IFCWALL('too-short',$);
                #36=IFCGLOBALID('bad-id');
                """);

        List<Finding> findings = new StructuralValidator(Set.of("ifcbuilding", "IFCWALL")).validate(graph);

        assertThat(findings).extracting(f -> f.entity().id()).containsExactly(35);
    }

    @Test
    void validate_cleanGraphHasNoFindings() throws Exception {
        EntityGraph graph = graph("""
                #1=IFCORGANIZATION($,'Autodesk Revit 2024 (PTB)',$,$,$);
                #2=IFCAPPLICATION(#1,'2024','Autodesk Revit 2024 (PTB)','Revit');
                #3=IFCCARTESIANPOINT((0.,0.,0.));
                """);

        assertThat(new StructuralValidator().validate(graph)).isEmpty();
    }
}
