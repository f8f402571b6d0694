package com.search.negatives.bulk;

import com.search.negatives.core.model.NegativeKeywordEntry;
import com.search.negatives.exception.InvalidRuleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvNegativeKeywordLoader Tests")
class CsvNegativeKeywordLoaderTest {

    private final CsvNegativeKeywordLoader loader = new CsvNegativeKeywordLoader();

    @Test
    @DisplayName("Loads entries in file order with their line numbers")
    void loadsEntries() throws IOException {
        List<NegativeKeywordEntry> entries = loader.load(new StringReader("""
                negative_keyword,match_type
                free,EXACT
                "free shipping",phrase
                ,
                cheap,Broad
                """));

        assertEquals(3, entries.size());
        assertEquals(new NegativeKeywordEntry("free", "EXACT", 2), entries.get(0));
        assertEquals("free shipping", entries.get(1).keyword());
        assertEquals("phrase", entries.get(1).matchType());
        assertEquals(5, entries.get(2).lineNumber());
    }

    @Test
    @DisplayName("Header aliases are accepted")
    void aliases() throws IOException {
        List<NegativeKeywordEntry> entries = loader.load(new StringReader("Match Type,Negative Keyword\nexact,free\n"));

        assertEquals("free", entries.get(0).keyword());
        assertEquals("exact", entries.get(0).matchType());
    }

    @Test
    @DisplayName("Unknown match type fails with the line number")
    void unknownMatchType() {
        InvalidRuleException e = assertThrows(InvalidRuleException.class,
                () -> loader.load(new StringReader("keyword,type\nfree,EXACT\ncheap,EXACTISH\n")));

        assertTrue(e.getMessage().startsWith("Line 3:"), e.getMessage());
        assertTrue(e.getMessage().contains("EXACTISH"));
    }

    @Test
    @DisplayName("Missing match type column fails the load")
    void missingColumn() {
        assertThrows(InvalidRuleException.class, () -> loader.load(new StringReader("keyword\nfree\n")));
    }

    @Test
    @DisplayName("Empty keyword is left for rule compilation to reject")
    void emptyKeywordKept() throws IOException {
        List<NegativeKeywordEntry> entries = loader.load(new StringReader("keyword,type\n,EXACT\n"));

        assertEquals(1, entries.size());
        assertEquals("", entries.get(0).keyword());
    }
}
