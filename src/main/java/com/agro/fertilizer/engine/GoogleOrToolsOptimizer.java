package com.agro.fertilizer.engine;

import com.agro.fertilizer.config.FertilizerProperties;
import com.agro.fertilizer.domain.BlendInputs;
import com.agro.fertilizer.domain.CropRequirement;
import com.agro.fertilizer.domain.DoseAssignment;
import com.agro.fertilizer.domain.Field;
import com.agro.fertilizer.domain.Nutrient;
import com.agro.fertilizer.domain.Product;
import com.agro.fertilizer.domain.ScenarioParameters;
import com.agro.fertilizer.exception.SolverNonOptimalException;
import com.agro.fertilizer.exception.SolverTimeoutException;
import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Linear program over continuous doses, solved with an OR-Tools LP backend
 * (GLOP by default).
 * <pre>
 *   min  sum dose[f,p] * area[f] * (price[p] + applicationCost) / 1000
 *   s.t. sum_p dose[f,p] * content[p,n] >= req[f,n] * (1 - tol)   for every field f, nutrient n
 *        sum_p dose[f,p] <= mixCapacity                             (if set)
 *        sum_p dose[f,p] * content[p,N] <= nitrogenCap              (if set)
 *        doseMin[p] <= dose[f,p] <= doseMax[p]
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GoogleOrToolsOptimizer implements BlendingOptimizer {

    static {
        Loader.loadNativeLibraries();
    }

    private final FertilizerProperties properties;

    @Override
    public BlendSolution optimize(BlendInputs inputs, ScenarioParameters params) {
        long startTime = System.currentTimeMillis();

        // 1. Initialize Solver
        MPSolver solver = MPSolver.createSolver(properties.getSolverBackend());
        if (solver == null) {
            log.error("Could not create solver {}", properties.getSolverBackend());
            throw new SolverNonOptimalException("SOLVER_NOT_FOUND");
        }

        try {
            solver.setTimeLimit(properties.getSolverTimeLimitMs());

            List<Field> fields = inputs.getFields();
            List<Product> products = new ArrayList<>(inputs.getProducts().values());
            int nf = fields.size();
            int np = products.size();

            // 2. Variables: dose[f][p] in kg/ha. Dose bounds go straight into the
            // variable bounds instead of separate rows.
            MPVariable[][] dose = new MPVariable[nf][np];
            for (int f = 0; f < nf; f++) {
                for (int p = 0; p < np; p++) {
                    Product product = products.get(p);
                    dose[f][p] = solver.makeNumVar(product.getDoseMin(), product.getDoseMax(),
                            "x_" + fields.get(f).getId() + "_" + product.getId());
                }
            }

            // 3. Constraints per field
            for (int f = 0; f < nf; f++) {
                Field field = fields.get(f);
                addFieldConstraints(solver, dose[f], field, inputs.requirementFor(field), products, params);
            }

            // 4. Objective
            MPObjective objective = solver.objective();
            for (int f = 0; f < nf; f++) {
                for (int p = 0; p < np; p++) {
                    objective.setCoefficient(dose[f][p], CostModel.costPerKgHa(fields.get(f), products.get(p), params));
                }
            }
            objective.setMinimization();

            log.debug("Scenario {}: {} variables, {} constraints",
                    params.getTag(), solver.numVariables(), solver.numConstraints());

            // 5. Solve
            final MPSolver.ResultStatus status = solver.solve();
            long elapsed = System.currentTimeMillis() - startTime;

            if (status != MPSolver.ResultStatus.OPTIMAL) {
                if (solver.wallTime() >= properties.getSolverTimeLimitMs()) {
                    log.warn("Scenario {}: solver stopped on time limit ({} ms), status {}",
                            params.getTag(), properties.getSolverTimeLimitMs(), status);
                    throw new SolverTimeoutException(properties.getSolverTimeLimitMs(), status.name());
                }
                log.warn("Scenario {}: solver returned {}", params.getTag(), status);
                throw new SolverNonOptimalException(status.name());
            }

            BlendSolution.BlendSolutionBuilder solution = BlendSolution.builder()
                    .status(status.name())
                    .objectiveValue(objective.value())
                    .computationTimeMs(elapsed);
            for (int f = 0; f < nf; f++) {
                for (int p = 0; p < np; p++) {
                    solution.assignment(new DoseAssignment(
                            fields.get(f).getId(), products.get(p).getId(), dose[f][p].solutionValue()));
                }
            }

            log.info("Scenario {}: {} in {} ms, objective {}", params.getTag(), status, elapsed, objective.value());
            return solution.build();
        } finally {
            solver.delete();
        }
    }

    private void addFieldConstraints(MPSolver solver, MPVariable[] dose, Field field, CropRequirement req,
                                     List<Product> products, ScenarioParameters params) {
        String id = field.getId();

        // C1. Nutrient sufficiency: sum(dose * content) >= req * (1 - tol)
        for (Nutrient nutrient : Nutrient.values()) {
            double required = params.effectiveRequirement(req.requirement(nutrient));
            MPConstraint c = solver.makeConstraint(required, MPSolver.infinity(), nutrient.label() + "_min_" + id);
            for (int p = 0; p < dose.length; p++) {
                c.setCoefficient(dose[p], products.get(p).fraction(nutrient));
            }
        }

        // C2. Total mix per pass
        if (params.hasMixCapacity()) {
            MPConstraint mix = solver.makeConstraint(-MPSolver.infinity(), params.getMixCapacity(), "mix_max_" + id);
            for (MPVariable x : dose) {
                mix.setCoefficient(x, 1.0);
            }
        }

        // C3. N cap
        if (params.hasNitrogenCap()) {
            MPConstraint nCap = solver.makeConstraint(-MPSolver.infinity(), params.getNitrogenCap(), "N_max_" + id);
            for (int p = 0; p < dose.length; p++) {
                nCap.setCoefficient(dose[p], products.get(p).fraction(Nutrient.N));
            }
        }

        log.debug("Field {} ({} ha, {}): constraints added", id, field.getAreaHa(), field.getCrop());
    }
}
