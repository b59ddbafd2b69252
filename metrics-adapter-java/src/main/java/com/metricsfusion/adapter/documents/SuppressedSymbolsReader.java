package com.metricsfusion.adapter.documents;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.reflect.TypeToken;
import com.metricsfusion.core.model.SuppressedSymbol;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the suppression list: either a bare array of entries or an object with a
 * {@code suppressedSymbols} array.
 */
public class SuppressedSymbolsReader {

    private static final Gson GSON = new Gson();
    private static final Type ENTRY_LIST = new TypeToken<List<SuppressedSymbol>>() {}.getType();

    public List<SuppressedSymbol> read(Path path) {
        if (!Files.exists(path)) {
            throw new ParsedDocumentReader.DocumentReadException("Suppressed symbols file not found: " + path);
        }
        JsonElement root;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new ParsedDocumentReader.DocumentReadException(
                    "Suppressed symbols file is not valid JSON: " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ParsedDocumentReader.DocumentReadException(
                    "Failed to read suppressed symbols: " + path + ": " + e.getMessage(), e);
        }
        JsonElement entries = root;
        if (root != null && root.isJsonObject()) {
            entries = root.getAsJsonObject().get("suppressedSymbols");
        }
        if (entries == null || entries.isJsonNull()) {
            return List.of();
        }
        if (!entries.isJsonArray()) {
            throw new ParsedDocumentReader.DocumentReadException(
                    "Suppressed symbols file must hold an array of entries: " + path);
        }
        List<SuppressedSymbol> result = GSON.fromJson(entries, ENTRY_LIST);
        return result != null ? result : List.of();
    }
}
