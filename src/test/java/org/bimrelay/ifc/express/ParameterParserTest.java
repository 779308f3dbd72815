package org.bimrelay.ifc.express;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ParameterParserTest {

    @Test
    void parse_blankTextYieldsEmptyList() {
        ParameterParser.Parameters parameters = ParameterParser.parse("   ");

        assertThat(parameters.values()).isEmpty();
        assertThat(parameters.unterminated()).isFalse();
    }

    @Test
    void parse_classifiesLiterals() {
        ParameterParser.Parameters parameters = ParameterParser.parse("#42,$,3.14,foo");

        assertThat(parameters.values()).containsExactly(
                new IfcRef(42),
                IfcNull.INSTANCE,
                new IfcNumber("3.14", 3.14),
                new IfcString("foo")
        );
    }

    @Test
    void classify_numbers() {
        assertThat(ParameterParser.classify("-2")).isEqualTo(new IfcNumber("-2", -2.0));
        assertThat(ParameterParser.classify("0.")).isEqualTo(new IfcNumber("0.", 0.0));
        assertThat(ParameterParser.classify("1.E-5")).isEqualTo(new IfcNumber("1.E-5", 1.0E-5));
        assertThat(ParameterParser.classify("+.5e3")).isEqualTo(new IfcNumber("+.5e3", 500.0));
    }

    @Test
    void classify_nonNumbersStayVerbatim() {
        assertThat(ParameterParser.classify(".ELEMENT.")).isEqualTo(new IfcString(".ELEMENT."));
        assertThat(ParameterParser.classify("1.2.3")).isEqualTo(new IfcString("1.2.3"));
        assertThat(ParameterParser.classify("#12abc")).isEqualTo(new IfcString("#12abc"));
        assertThat(ParameterParser.classify("*")).isEqualTo(new IfcString("*"));
        assertThat(ParameterParser.classify("'John'")).isEqualTo(new IfcString("'John'"));
    }

    @Test
    void parse_keepsNestedListsAndQuotedCommasInOneToken() {
        ParameterParser.Parameters parameters = ParameterParser.parse("(0.,0.,0.), 'a,(b)' ,IFCLABEL('x,y'),#1");

        assertThat(parameters.values()).containsExactly(
                new IfcString("(0.,0.,0.)"),
                new IfcString("'a,(b)'"),
                new IfcString("IFCLABEL('x,y')"),
                new IfcRef(1)
        );
        assertThat(parameters.unterminated()).isFalse();
    }

    @Test
    void parse_keepsEmptyPositions() {
        assertThat(ParameterParser.parse("#1,,#2").values())
                .containsExactly(new IfcRef(1), new IfcString(""), new IfcRef(2));
    }

    @Test
    void parse_backslashEscapesQuoteWithoutClosingString() {
        ParameterParser.Parameters parameters = ParameterParser.parse("'it\\'s, fine',#2");

        assertThat(parameters.values()).containsExactly(new IfcString("'it\\'s, fine'"), new IfcRef(2));
        assertThat(parameters.unterminated()).isFalse();
    }

    @Test
    void parse_doubledQuoteStaysInsideString() {
        ParameterParser.Parameters parameters = ParameterParser.parse("'O''Reilly, Inc',$");

        assertThat(parameters.values()).hasSize(2);
        assertThat(((IfcString) parameters.values().get(0)).text()).isEqualTo("O'Reilly, Inc");
    }

    @Test
    void parse_controlDirectiveBeforeClosingQuoteDoesNotEscapeIt() {
        ParameterParser.Parameters parameters = ParameterParser.parse("'\\X2\\4E2D6587\\X0\\',#5");

        assertThat(parameters.unterminated()).isFalse();
        assertThat(parameters.values()).hasSize(2);
        assertThat(((IfcString) parameters.values().get(0)).text()).isEqualTo("中文");
        assertThat(parameters.values().get(1)).isEqualTo(new IfcRef(5));
    }

    @Test
    void parse_unterminatedStringIsClosedAtEndOfLine() {
        ParameterParser.Parameters parameters = ParameterParser.parse("'abc,#1");

        assertThat(parameters.values()).containsExactly(new IfcString("'abc,#1"));
        assertThat(parameters.unterminated()).isTrue();
    }

    @Test
    void parse_unbalancedParenthesesAreFlagged() {
        assertThat(ParameterParser.parse("(#1,#2").unterminated()).isTrue();
        assertThat(ParameterParser.parse("#1),#2").unterminated()).isTrue();
    }
}
