package org.bimrelay.ifc.express;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IfcStringTest {

    @Test
    void text_unquotesAndDecodesEscapes() {
        assertThat(new IfcString("'\\X2\\4E2D6587\\X0\\'").text()).isEqualTo("中文");
        assertThat(new IfcString("'EPIT\\X\\C1CIO'").text()).isEqualTo("EPITÁCIO");
        assertThat(new IfcString("'\\X4\\0001F600\\X0\\'").text()).isEqualTo("\uD83D\uDE00");
        assertThat(new IfcString("'it''s'").text()).isEqualTo("it's");
    }

    @Test
    void text_returnsUnquotedTokensVerbatim() {
        IfcString value = new IfcString(".ELEMENT.");

        assertThat(value.isQuoted()).isFalse();
        assertThat(value.text()).isEqualTo(".ELEMENT.");
        assertThat(new IfcString("'").isQuoted()).isFalse();
    }

    @Test
    void text_leavesMalformedEscapesAlone() {
        assertThat(new IfcString("'\\X2\\4E2\\X0\\'").text()).isEqualTo("\\X2\\4E2\\X0\\");
        assertThat(new IfcString("'C:\\temp'").text()).isEqualTo("C:\\temp");
    }

    @Test
    void text_decodesPageDirectivesAndDoubledBackslash() {
        assertThat(new IfcString("'\\PA\\M\\S\\|ller'").text()).isEqualTo("M\u00fcller");
        assertThat(new IfcString("'a\\\\b'").text()).isEqualTo("a\\b");
        assertThat(new IfcString("'\\PB\\x'").text()).isEqualTo("\\PB\\x");
    }
}
