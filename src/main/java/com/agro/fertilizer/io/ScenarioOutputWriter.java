package com.agro.fertilizer.io;

import com.agro.fertilizer.config.FertilizerProperties;
import com.agro.fertilizer.domain.DoseAssignment;
import com.agro.fertilizer.domain.ScenarioResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the per-scenario dose table and cost summary, namespaced by tag:
 * {@code resultados_dosis_<tag>.csv} and {@code _resumen_<tag>.txt}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScenarioOutputWriter {

    public static final String DOSE_HEADER = "potrero,producto,kg_ha";
    public static final String SUMMARY_PREFIX = "Costo total (CLP): ";

    private final FertilizerProperties properties;

    public Path doseTablePath(String tag) {
        return Path.of(properties.getDataDir()).resolve("resultados_dosis_" + tag + ".csv");
    }

    public Path summaryPath(String tag) {
        return Path.of(properties.getDataDir()).resolve("_resumen_" + tag + ".txt");
    }

    /**
     * Removes outputs left by an earlier run with the same tag.
     */
    public void clear(String tag) {
        for (Path p : new Path[]{doseTablePath(tag), summaryPath(tag)}) {
            try {
                if (Files.deleteIfExists(p)) {
                    log.info("Removed stale output {}", p);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot remove stale output " + p, e);
            }
        }
    }

    public void write(ScenarioResult result) {
        write(result, doseTablePath(result.getTag()), summaryPath(result.getTag()));
    }

    public void write(ScenarioResult result, Path doseTable, Path summary) {
        StringBuilder sb = new StringBuilder(DOSE_HEADER).append('\n');
        for (DoseAssignment d : result.getDoses()) {
            sb.append(csvCell(d.getFieldId())).append(',')
                    .append(csvCell(d.getProductId())).append(',')
                    .append(formatDose(d.getDoseKgHa())).append('\n');
        }

        try {
            if (doseTable.getParent() != null) {
                Files.createDirectories(doseTable.getParent());
            }
            Files.writeString(doseTable, sb.toString(), StandardCharsets.UTF_8);
            Files.writeString(summary, SUMMARY_PREFIX + result.getTotalCost() + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write outputs for scenario " + result.getTag(), e);
        }
        log.info("Scenario {} written -> {} | {}", result.getTag(), doseTable.getFileName(), summary.getFileName());
    }

    static String formatDose(double dose) {
        return BigDecimal.valueOf(dose).setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String csvCell(String value) {
        if (value.indexOf(',') >= 0 || value.indexOf('"') >= 0) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }
}
