package dev.dimitra.auditor.llm;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderRouterTest {

    private final ProviderRouter router = new ProviderRouter(Map.of(
            "ANTHROPIC_API_KEY", "a", "OPENAI_API_KEY", "o", "GOOGLE_API_KEY", "g")::get);

    @Test
    void createsEachKnownProvider() {
        assertThat(router.create("anthropic", null)).isInstanceOf(ClaudeBatchProvider.class);
        assertThat(router.create("OpenAI", "gpt-4.1-mini").model()).isEqualTo("gpt-4.1-mini");
        assertThat(router.create("gemini", null).model()).isEqualTo(GeminiProvider.DEFAULT_MODEL);
    }

    @Test
    void missingKeyIsReported() {
        assertThatThrownBy(() -> router.create("deepseek", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing env: DEEPSEEK_API_KEY");
    }

    @Test
    void unknownProviderIsRejected() {
        assertThatThrownBy(() -> router.create("mistral", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown provider: mistral");
    }
}
