package com.vtb.posture.keywords;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeywordListParserTest {

    @Test
    void parsesLinesAndCommas() {
        String content = """
            # комментарий
            Password, secret
              CVV

            secret,,паспорт
            """;
        assertEquals(List.of("cvv", "password", "secret", "паспорт"), KeywordListParser.parse(content));
    }

    @Test
    void emptyContentGivesEmptyList() {
        assertTrue(KeywordListParser.parse(null).isEmpty());
        assertTrue(KeywordListParser.parse("  \n# only comments\n").isEmpty());
    }

    @Test
    void handlesWindowsLineEndings() {
        assertEquals(List.of("a", "b"), KeywordListParser.parse("b\r\na\r\n"));
    }
}
