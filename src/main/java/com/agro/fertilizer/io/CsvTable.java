package com.agro.fertilizer.io;

import com.agro.fertilizer.exception.MissingColumnException;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * A parsed delimited table: normalized header names plus one map per row.
 */
@Getter
public class CsvTable {

    private final String name;
    private final List<String> headers;
    private final List<Map<String, String>> rows;

    public CsvTable(String name, List<String> headers, List<Map<String, String>> rows) {
        this.name = name;
        this.headers = List.copyOf(headers);
        this.rows = List.copyOf(rows);
    }

    public boolean hasColumn(String column) {
        return headers.contains(column);
    }

    public void requireColumns(String... columns) {
        for (String column : columns) {
            if (!hasColumn(column)) {
                throw new MissingColumnException(name, column);
            }
        }
    }

    public int size() {
        return rows.size();
    }
}
