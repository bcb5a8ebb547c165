package com.agro.fertilizer.service;

import com.agro.fertilizer.TestFixtures;
import com.agro.fertilizer.domain.AgronomicSummary;
import com.agro.fertilizer.domain.DoseAssignment;
import com.agro.fertilizer.domain.ProductContribution;
import com.agro.fertilizer.domain.ScenarioParameters;
import com.agro.fertilizer.domain.ScenarioResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AgronomicSummaryServiceTest {

    private final AgronomicSummaryService service = new AgronomicSummaryService();

    private final ScenarioResult corn = ScenarioResult.builder()
            .tag("A")
            .dose(new DoseAssignment("P1", "MAP", 170.91))
            .dose(new DoseAssignment("P1", "Urea", 300.0))
            .build();

    @Test
    void contributionsPerProduct() {
        AgronomicSummary summary = service.summarize(corn, TestFixtures.cornField(),
                ScenarioParameters.builder().mixCapacity(600).build());

        assertThat(summary.getProducts()).extracting(ProductContribution::getProductId).containsExactly("MAP", "Urea");
        ProductContribution map = summary.getProducts().get(0);
        assertThat(map.getNitrogenKgHa()).isCloseTo(18.8, within(0.01));
        assertThat(map.getPhosphateKgHa()).isCloseTo(88.87, within(0.01));
        assertThat(map.getMixSharePct()).isCloseTo(36.29, within(0.01));
        assertThat(summary.getPredominantProduct()).isEqualTo("Urea");
        assertThat(summary.isSuppliesNitrogen()).isTrue();
        assertThat(summary.isSuppliesPhosphate()).isTrue();
        assertThat(summary.isSuppliesPotassium()).isFalse();
        assertThat(summary.getLargestFieldMixKgHa()).isEqualTo(470.91);
        assertThat(summary.getMixUsage()).isEqualTo(AgronomicSummary.MixUsage.WELL_BELOW_LIMIT);
    }

    @Test
    void mixUsageBands() {
        ScenarioParameters cap500 = ScenarioParameters.builder().mixCapacity(500).build();

        assertThat(AgronomicSummaryService.mixUsage(470.91, cap500)).isEqualTo(AgronomicSummary.MixUsage.NEAR_LIMIT);
        assertThat(AgronomicSummaryService.mixUsage(449.0, cap500)).isEqualTo(AgronomicSummary.MixUsage.WELL_BELOW_LIMIT);
        assertThat(AgronomicSummaryService.mixUsage(500.5, cap500)).isEqualTo(AgronomicSummary.MixUsage.ABOVE_LIMIT);
        assertThat(AgronomicSummaryService.mixUsage(470.91, ScenarioParameters.defaults()))
                .isEqualTo(AgronomicSummary.MixUsage.NO_LIMIT);
    }

    @Test
    void emptyResultHasNoPredominantProduct() {
        ScenarioResult empty = ScenarioResult.builder().tag("A").build();

        AgronomicSummary summary = service.summarize(empty, TestFixtures.cornField(), ScenarioParameters.defaults());

        assertThat(summary.getProducts()).isEmpty();
        assertThat(summary.getPredominantProduct()).isNull();
        assertThat(summary.getLargestFieldMixKgHa()).isZero();
    }
}
