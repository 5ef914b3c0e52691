// file: core/src/test/java/io/scoreledger/core/resolve/NameFormsTest.java
package io.scoreledger.core.resolve;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NameFormsTest {

    @Test
    void clean_strips_decoration_org_slug_and_suffix() {
        assertEquals("claude-opus-4-6", NameForms.clean("🆕 anthropic/claude-opus-4-6 (thinking)"));
        assertEquals("Model X", NameForms.clean("  * Model X (zero shot) "));
    }

    @Test
    void clean_keeps_slash_when_prefix_is_not_a_slug() {
        assertEquals("Qwen3-Coder 480B/A35B Instruct", NameForms.clean("Qwen3-Coder 480B/A35B Instruct"));
    }

    @Test
    void clean_of_null_or_pure_decoration_is_empty() {
        assertEquals("", NameForms.clean(null));
        assertEquals("", NameForms.clean("  🆕  "));
    }

    @Test
    void normalize_turns_version_dashes_into_dots() {
        assertEquals("claude opus 4.6", NameForms.normalize("claude-opus-4-6"));
        assertEquals("gpt 4o mini", NameForms.normalize("GPT_4o-mini"));
    }

    @Test
    void normalize_drops_version_prefix_and_punctuation() {
        assertEquals("alpha 2", NameForms.normalize("alpha-v2"));
        assertEquals("gemini 2.5 pro preview", NameForms.normalize("Gemini 2.5 Pro (Preview)"));
    }

    @Test
    void tokens_are_the_normalized_words_in_order() {
        assertEquals(List.of("llama", "3.1", "405b"), List.copyOf(NameForms.tokens("Llama-3.1 405B")));
        assertTrue(NameForms.tokens("  ").isEmpty());
    }
}
