package dev.dimitra.auditor.prepass;

import dev.dimitra.auditor.config.PrepassSettings;
import dev.dimitra.auditor.model.FileContent;
import dev.dimitra.auditor.pricing.ModelPricing;
import dev.dimitra.auditor.pricing.PricingTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PrepassPolicyTest {

    private static final ModelPricing SONNET = PricingTable.get(PricingTable.CLAUDE_SONNET).orElseThrow();
    private static final ModelPricing FLASH = PricingTable.get(PricingTable.GEMINI_25_FLASH).orElseThrow();

    private static List<FileContent> tokens(int n) {
        return List.of(new FileContent("a", "x".repeat(n * 4)));
    }

    @Test
    void enabledAboveThreshold() {
        PrepassSettings s = new PrepassSettings(true, 1_000, true, null, null);

        assertThat(PrepassPolicy.shouldRun("r", tokens(1_001), s, FLASH)).isTrue();
        assertThat(PrepassPolicy.shouldRun("r", tokens(1_000), s, FLASH)).isFalse();
    }

    @Test
    void autoEnablesWhenTierIsCrossed() {
        PrepassSettings s = PrepassSettings.defaults();

        assertThat(PrepassPolicy.shouldRun("r", tokens(200_001), s, SONNET)).isTrue();
        assertThat(PrepassPolicy.shouldRun("r", tokens(200_000), s, SONNET)).isFalse();
        assertThat(PrepassPolicy.shouldRun("r", tokens(900_000), s, FLASH)).isFalse();
    }

    @Test
    void autoDisableSuppressesTierTrigger() {
        PrepassSettings s = new PrepassSettings(false, 0, true, null, null);

        assertThat(PrepassPolicy.shouldRun("r", tokens(300_000), s, SONNET)).isFalse();
    }

    @Test
    void defaults() {
        PrepassSettings s = PrepassSettings.defaults();

        assertThat(s.thresholdTokens()).isEqualTo(600_000);
        assertThat(s.provider()).isEqualTo("gemini");
        assertThat(s.model()).isEqualTo("gemini-2.5-flash");
    }
}
