package com.metricsfusion.adapter;

import com.metricsfusion.adapter.documents.ParsedDocumentReader;
import com.metricsfusion.adapter.documents.SuppressedSymbolsReader;
import com.metricsfusion.core.model.SuppressedSymbol;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SuppressedSymbolsReaderTest {

    private final SuppressedSymbolsReader reader = new SuppressedSymbolsReader();

    @Test
    void bareArrayAccepted(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("suppressed.json");
        Files.writeString(file, """
            [
              { "fullyQualifiedName": "N.Worker.Run(...)", "ruleId": "CA1502", "justification": "state machine" },
              { "fullyQualifiedName": "N.Worker", "metric": "Coupling", "filePath": "src/Worker.cs" }
            ]
            """);

        List<SuppressedSymbol> entries = reader.read(file);

        assertEquals(2, entries.size());
        assertEquals("CA1502", entries.get(0).ruleId());
        assertEquals("state machine", entries.get(0).justification());
        assertEquals("Coupling", entries.get(1).metric());
        assertNull(entries.get(1).ruleId());
    }

    @Test
    void wrappedArrayAccepted(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("suppressed.json");
        Files.writeString(file, """
            { "suppressedSymbols": [ { "fullyQualifiedName": "N.Worker.Run(...)", "ruleId": "IDE0051" } ] }
            """);

        assertEquals("IDE0051", reader.read(file).get(0).ruleId());
    }

    @Test
    void emptyFileGivesNoEntries(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("suppressed.json");
        Files.writeString(file, "");

        assertTrue(reader.read(file).isEmpty());
    }

    @Test
    void nonArrayRejected(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("suppressed.json");
        Files.writeString(file, "{ \"suppressedSymbols\": \"N.Worker\" }");

        assertThrows(ParsedDocumentReader.DocumentReadException.class, () -> reader.read(file));
    }

    @Test
    void missingFileRejected(@TempDir Path tmp) {
        assertThrows(ParsedDocumentReader.DocumentReadException.class, () -> reader.read(tmp.resolve("nope.json")));
    }
}
