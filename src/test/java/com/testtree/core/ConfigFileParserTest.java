package com.testtree.core;

import org.testng.annotations.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigFileParserTest {

    @Test
    public void parse_trimsAndStripsComments() {
        String contents = String.join("\n",
            "# whole-line comment",
            "",
            "   display   =   false   ",
            "output-json-file = target/report.json   # trailing comment",
            "\t",
            "empty =");

        Map<String, String> values = ConfigFileParser.parse(contents);

        assertThat(values).containsExactly(
            Map.entry("display", "false"),
            Map.entry("output-json-file", "target/report.json"),
            Map.entry("empty", ""));
    }

    @Test
    public void parse_valueMayContainEquals() {
        assertThat(ConfigFileParser.parse("url = http://h/?a=b")).containsEntry("url", "http://h/?a=b");
    }

    @Test
    public void parse_lastRepeatWins() {
        assertThat(ConfigFileParser.parse("k = 1\nk = 2")).containsExactly(Map.entry("k", "2"));
    }

    @Test
    public void parse_windowsLineEndings() {
        assertThat(ConfigFileParser.parse("a = 1\r\nb = 2\r\n"))
            .containsExactly(Map.entry("a", "1"), Map.entry("b", "2"));
    }

    @Test
    public void parse_nullOrEmptyYieldsNothing() {
        assertThat(ConfigFileParser.parse((String) null)).isEmpty();
        assertThat(ConfigFileParser.parse("")).isEmpty();
    }

    @Test
    public void parse_lineWithoutEqualsIsRejectedWithLineNumber() {
        assertThatThrownBy(() -> ConfigFileParser.parse("a = 1\n\njust words"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("line 3");
    }

    @Test
    public void parse_emptyKeyIsRejected() {
        assertThatThrownBy(() -> ConfigFileParser.parse(" = value"))
            .isInstanceOf(ConfigurationException.class);
    }
}
