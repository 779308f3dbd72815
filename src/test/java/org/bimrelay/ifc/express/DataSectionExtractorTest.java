package org.bimrelay.ifc.express;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataSectionExtractorTest {

    @Test
    void extract_dropsBlankAndCommentLinesAndKeepsSourceLineNumbers() throws Exception {
        String ifc = """
                ISO-10303-21;
                HEADER;
                FILE_SCHEMA(('IFC4'));
                ENDSEC;
                DATA;
                #1=IFCPERSON('A');

                /* people */
                #2=IFCPERSON('B');
                ENDSEC;
                END-ISO-10303-21;
                """;

        List<SourceLine> lines = DataSectionExtractor.extract(ifc);

        assertThat(lines).containsExactly(
                new SourceLine(6, "#1=IFCPERSON('A');"),
                new SourceLine(9, "#2=IFCPERSON('B');")
        );
    }

    @Test
    void extract_handlesWindowsLineEndings() throws Exception {
        String ifc = "HEADER;\r\nENDSEC;\r\nDATA;\r\n#1=IFCPERSON('A');\r\nENDSEC;\r\n";

        assertThat(DataSectionExtractor.extract(ifc)).containsExactly(new SourceLine(4, "#1=IFCPERSON('A');"));
    }

    @Test
    void extract_failsWithoutDataSection() {
        assertThatThrownBy(() -> DataSectionExtractor.extract("HEADER;\nENDSEC;\n"))
                .isInstanceOf(IfcSyntaxException.class)
                .hasMessage("DATA section not found");
    }

    @Test
    void extract_failsWhenDataSectionIsNotClosed() {
        assertThatThrownBy(() -> DataSectionExtractor.extract("DATA;\n#1=IFCPERSON('A');\n"))
                .isInstanceOf(IfcSyntaxException.class);
    }

    @Test
    void extract_doesNotMistakeLongerKeywordsForDataMarker() {
        assertThatThrownBy(() -> DataSectionExtractor.extract("FILE_DATA;\n#1=IFCPERSON('A');\nENDSEC;\n"))
                .isInstanceOf(IfcSyntaxException.class);
    }

    @Test
    void extract_ignoresDataKeywordInsideHeaderStrings() throws Exception {
        String ifc = """
                ISO-10303-21;
                HEADER;
                FILE_DESCRIPTION(('Exported data; rev 2'),'2;1');
                FILE_NAME('DATA;','',(''),(''),'','','');
                ENDSEC;
                DATA;
                #1=IFCPERSON('A');
                #2=IFCORGANIZATION(#99);
                ENDSEC;
                END-ISO-10303-21;
                """;

        assertThat(DataSectionExtractor.extract(ifc)).containsExactly(
                new SourceLine(7, "#1=IFCPERSON('A');"),
                new SourceLine(8, "#2=IFCORGANIZATION(#99);")
        );
    }

    @Test
    void extract_matchesSectionMarkersOnlyAtLineStart() throws Exception {
        String ifc = "DATA;\n#1=IFCLABEL('ENDSEC;');\n  ENDSEC ;\n";

        assertThat(DataSectionExtractor.extract(ifc)).containsExactly(new SourceLine(2, "#1=IFCLABEL('ENDSEC;');"));
        assertThatThrownBy(() -> DataSectionExtractor.extract("data;\n#1=IFCPERSON('A');\nendsec;\n"))
                .isInstanceOf(IfcSyntaxException.class);
    }
}
