package com.agro.fertilizer.config;

import com.agro.fertilizer.domain.ScenarioParameters;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for input/output locations and the solver.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "fertilizer")
public class FertilizerProperties {

    /**
     * Directory holding the three input tables and the tagged outputs.
     */
    private String dataDir = "data";

    private String fieldsFile = "potreros.csv";
    private String requirementsFile = "requerimientos.csv";
    private String productsFile = "productos.csv";

    /**
     * Tolerance used when a scenario does not specify one.
     */
    private double defaultTolerance = ScenarioParameters.DEFAULT_TOLERANCE;

    /**
     * Wall-clock limit for one LP solve. Hitting it is reported as a timeout.
     */
    private long solverTimeLimitMs = 30_000;

    /**
     * OR-Tools linear backend: GLOP, CLP or PDLP.
     */
    private String solverBackend = "GLOP";

    private Cli cli = new Cli();

    @Data
    public static class Cli {
        /**
         * Run a single scenario from command-line flags and exit.
         */
        private boolean enabled = false;
    }
}
