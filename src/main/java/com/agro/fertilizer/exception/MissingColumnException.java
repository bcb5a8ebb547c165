package com.agro.fertilizer.exception;

import lombok.Getter;

@Getter
public class MissingColumnException extends BlendingException {

    private final String table;
    private final String column;

    public MissingColumnException(String table, String column) {
        super("Table '" + table + "' is missing required column '" + column + "'");
        this.table = table;
        this.column = column;
    }

    @Override
    public String getErrorCode() {
        return "MISSING_COLUMN";
    }
}
