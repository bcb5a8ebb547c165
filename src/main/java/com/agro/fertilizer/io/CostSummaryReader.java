package com.agro.fertilizer.io;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the integer amount back out of a cost summary by keeping only its digits.
 */
@Component
public class CostSummaryReader {

    /**
     * @return the amount, or 0 when the file is missing or has no digits
     */
    public long readCost(Path summary) {
        if (!Files.exists(summary)) {
            return 0;
        }
        try {
            return parse(Files.readString(summary, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read cost summary " + summary, e);
        }
    }

    public static long parse(String text) {
        StringBuilder digits = new StringBuilder();
        for (char ch : text.toCharArray()) {
            if (ch >= '0' && ch <= '9') {
                digits.append(ch);
            }
        }
        return digits.length() == 0 ? 0 : Long.parseLong(digits.toString());
    }
}
