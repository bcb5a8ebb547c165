package com.agro.fertilizer.cli;

import com.agro.fertilizer.config.FertilizerProperties;
import com.agro.fertilizer.domain.AgronomicSummary;
import com.agro.fertilizer.domain.BlendInputs;
import com.agro.fertilizer.domain.ScenarioParameters;
import com.agro.fertilizer.domain.ScenarioResult;
import com.agro.fertilizer.exception.BlendingException;
import com.agro.fertilizer.exception.InvalidInputException;
import com.agro.fertilizer.io.InputLoader;
import com.agro.fertilizer.io.ScenarioOutputWriter;
import com.agro.fertilizer.service.AgronomicSummaryService;
import com.agro.fertilizer.service.BlendingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one scenario against the tables in the data directory and writes its
 * tagged outputs. Enabled by the {@code cli} profile.
 * <pre>
 *   --nmax=300 --mixmax=600 --tol=0.02 --costoap=0 --tag=A [--reqs=path/to/requerimientos_ajustados.csv]
 * </pre>
 * Exit code 0 on success, 1 when no blend could be produced, 2 on I/O failure.
 * Outputs for the tag are removed before running, so a failed run leaves none.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "fertilizer.cli", name = "enabled", havingValue = "true")
public class ScenarioRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_NO_BLEND = 1;
    static final int EXIT_IO = 2;

    private final InputLoader loader;
    private final BlendingService service;
    private final AgronomicSummaryService summaryService;
    private final ScenarioOutputWriter writer;
    private final FertilizerProperties properties;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args, System.out, System.err);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args, PrintStream out, PrintStream err) {
        String tag = option(args, "tag", "A");
        try {
            BlendingService.validateTag(tag);
            writer.clear(tag);
        } catch (BlendingException e) {
            err.println("ERROR [" + e.getErrorCode() + "]: " + e.getMessage());
            return EXIT_NO_BLEND;
        } catch (UncheckedIOException e) {
            err.println("ERROR: " + e.getMessage());
            return EXIT_IO;
        }

        try {
            ScenarioParameters params = parameters(args, tag);
            String reqs = option(args, "reqs", null);
            BlendInputs inputs = loader.loadDefault(reqs != null ? Path.of(reqs) : null);

            ScenarioResult result = service.runScenario(inputs, params);
            writer.write(result);

            AgronomicSummary summary = summaryService.summarize(result, inputs, params);
            out.println("OK -> " + writer.doseTablePath(tag).getFileName() + " | " + writer.summaryPath(tag).getFileName());
            out.println(ScenarioOutputWriter.SUMMARY_PREFIX + result.getTotalCost());
            out.println("Predominant product: " + (summary.getPredominantProduct() == null ? "-" : summary.getPredominantProduct())
                    + ", mix usage: " + summary.getMixUsage());
            return 0;
        } catch (BlendingException e) {
            err.println("ERROR [" + e.getErrorCode() + "]: " + e.getMessage());
            e.getDetails().forEach(d -> err.println("  - " + d));
            return EXIT_NO_BLEND;
        } catch (UncheckedIOException e) {
            log.error("Scenario {} failed writing outputs", tag, e);
            err.println("ERROR: " + e.getMessage());
            try {
                writer.clear(tag);
            } catch (UncheckedIOException cleanup) {
                e.addSuppressed(cleanup);
                log.error("Partial outputs for scenario {} could not be removed", tag, cleanup);
            }
            return EXIT_IO;
        }
    }

    ScenarioParameters parameters(ApplicationArguments args, String tag) {
        return ScenarioParameters.builder()
                .nitrogenCap(number(args, "nmax", 0.0))
                .mixCapacity(number(args, "mixmax", 0.0))
                .tolerance(number(args, "tol", properties.getDefaultTolerance()))
                .applicationCostPerTonne(number(args, "costoap", 0.0))
                .tag(tag)
                .build();
    }

    private static String option(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return fallback;
        }
        return values.get(values.size() - 1).trim();
    }

    private static double number(ApplicationArguments args, String name, double fallback) {
        String raw = option(args, name, null);
        if (raw == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Flag --" + name + " expects a number, got '" + raw + "'", e);
        }
    }
}
