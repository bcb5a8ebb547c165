package com.agro.fertilizer.service;

import com.agro.fertilizer.domain.BlendInputs;
import com.agro.fertilizer.domain.ScenarioParameters;
import com.agro.fertilizer.domain.ScenarioResult;
import com.agro.fertilizer.engine.BlendSolution;
import com.agro.fertilizer.engine.BlendingOptimizer;
import com.agro.fertilizer.engine.FeasibilityPrechecker;
import com.agro.fertilizer.engine.ResultExtractor;
import com.agro.fertilizer.exception.InvalidInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * One scenario: precheck, solve, extract. Depends only on its arguments, so
 * two scenarios never share state and can run side by side.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlendingService {

    private final FeasibilityPrechecker prechecker;
    private final BlendingOptimizer optimizer;
    private final ResultExtractor extractor;

    public ScenarioResult runScenario(BlendInputs inputs, ScenarioParameters params) {
        // Basic Validation
        if (inputs == null) {
            throw new InvalidInputException("Input tables cannot be null");
        }
        validate(params);

        log.info("Running scenario {} (N cap {}, mix cap {}, tol {}, application cost {})",
                params.getTag(), params.getNitrogenCap(), params.getMixCapacity(),
                params.getTolerance(), params.getApplicationCostPerTonne());

        prechecker.check(inputs, params);
        BlendSolution solution = optimizer.optimize(inputs, params);
        return extractor.extract(inputs, params, solution);
    }

    static void validate(ScenarioParameters params) {
        if (params == null) {
            throw new InvalidInputException("Scenario parameters cannot be null");
        }
        validateTag(params.getTag());
        if (!(params.getTolerance() >= 0 && params.getTolerance() <= 1)) {
            throw new InvalidInputException("Tolerance must be within [0, 1]: " + params.getTolerance());
        }
        requireNonNegative("N cap", params.getNitrogenCap());
        requireNonNegative("Mix capacity", params.getMixCapacity());
        requireNonNegative("Application cost", params.getApplicationCostPerTonne());
    }

    /**
     * The tag becomes part of output file names, so it is checked before any
     * file is touched.
     */
    public static void validateTag(String tag) {
        if (tag == null || !tag.matches("[A-Za-z0-9_-]+")) {
            throw new InvalidInputException("Scenario tag must be letters, digits, '_' or '-': " + tag);
        }
    }

    // 0 disables a ceiling; NaN would disable it silently
    private static void requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new InvalidInputException(name + " must be a finite, non-negative number (0 disables it): " + value);
        }
    }
}
