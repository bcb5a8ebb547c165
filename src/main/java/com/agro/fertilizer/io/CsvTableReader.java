package com.agro.fertilizer.io;

import com.agro.fertilizer.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tolerant CSV reader for spreadsheet exports.
 * <ul>
 *   <li>delimiter is detected from the header line (';' ',' tab '|')</li>
 *   <li>UTF-8 with or without BOM, falling back to ISO-8859-1</li>
 *   <li>header names are trimmed and known misspellings renamed</li>
 *   <li>double-quoted cells with "" escapes</li>
 * </ul>
 */
@Slf4j
@Component
public class CsvTableReader {

    private static final char[] CANDIDATE_DELIMITERS = {';', ',', '\t', '|'};
    private static final char BOM = '\uFEFF';

    // Misspelled header -> canonical header
    private static final Map<String, String> HEADER_SYNONYMS = Map.of(
            "P205_req_kg_ha", "P2O5_req_kg_ha",
            "K20_req_kg_ha", "K2O_req_kg_ha",
            "P205_pct", "P2O5_pct",
            "K20_pct", "K2O_pct",
            "Cultivo", "cultivo",
            "Producto", "producto",
            "Potrero", "potrero");

    public CsvTable read(Path path, String tableName) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new InvalidInputException("Cannot read " + tableName + " table from " + path, e);
        }
        log.debug("Reading {} table from {} ({} bytes)", tableName, path, bytes.length);
        return parse(decode(bytes), tableName);
    }

    public CsvTable parse(String content, String tableName) {
        String text = content;
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }

        List<String> lines = text.lines()
                .filter(line -> !line.isBlank())
                .toList();
        if (lines.isEmpty()) {
            throw new InvalidInputException("Table '" + tableName + "' is empty");
        }

        char delimiter = detectDelimiter(lines.get(0));
        List<String> headers = normalizeHeaders(splitLine(lines.get(0), delimiter));

        List<Map<String, String>> rows = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            List<String> cells = splitLine(lines.get(i), delimiter);
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                row.put(headers.get(c), c < cells.size() ? cells.get(c).trim() : "");
            }
            rows.add(row);
        }

        log.debug("Table {}: delimiter '{}', columns {}, {} rows", tableName, delimiter, headers, rows.size());
        return new CsvTable(tableName, headers, rows);
    }

    static String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            // Excel on Windows still saves Latin-1
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    static char detectDelimiter(String headerLine) {
        char best = ',';
        int bestCount = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            int count = 0;
            boolean quoted = false;
            for (int i = 0; i < headerLine.length(); i++) {
                char ch = headerLine.charAt(i);
                if (ch == '"') {
                    quoted = !quoted;
                } else if (ch == candidate && !quoted) {
                    count++;
                }
            }
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    static List<String> splitLine(String line, char delimiter) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        cell.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cell.append(ch);
                }
            } else if (ch == '"') {
                quoted = true;
            } else if (ch == delimiter) {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(ch);
            }
        }
        cells.add(cell.toString());
        return cells;
    }

    private List<String> normalizeHeaders(List<String> raw) {
        List<String> headers = new ArrayList<>();
        for (String h : raw) {
            headers.add(h.replace(String.valueOf(BOM), "").trim());
        }
        List<String> normalized = new ArrayList<>();
        for (String h : headers) {
            String canonical = HEADER_SYNONYMS.get(h);
            // Only rename when the canonical name is not already present
            if (canonical != null && !headers.contains(canonical)) {
                log.debug("Renaming column '{}' to '{}'", h, canonical);
                normalized.add(canonical);
            } else {
                normalized.add(h);
            }
        }
        return normalized;
    }
}
