package fr.lapetina.arena.round;

import fr.lapetina.arena.round.exception.PromptValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptValidatorTest {

    private final PromptValidator validator = new PromptValidator(10);

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "\t\n"})
    @DisplayName("should reject empty prompts")
    void shouldRejectEmpty(String prompt) {
        assertThatThrownBy(() -> validator.validate(prompt))
                .isInstanceOf(PromptValidationException.class)
                .hasMessage("Prompt cannot be empty");
    }

    @Test
    @DisplayName("should accept a prompt exactly at the limit")
    void shouldAcceptAtLimit() {
        assertThatCode(() -> validator.validate("0123456789")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should reject a prompt one past the limit")
    void shouldRejectPastLimit() {
        assertThatThrownBy(() -> validator.validate("0123456789X"))
                .isInstanceOf(PromptValidationException.class)
                .hasMessage("Prompt too long (max 10 characters)");
    }

    @Test
    @DisplayName("should count code points rather than UTF-16 units")
    void shouldCountCodePoints() {
        String tenEmoji = "😀".repeat(10);

        assertThatCode(() -> validator.validate(tenEmoji)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should default to 2000 characters")
    void shouldDefaultTo2000() {
        PromptValidator defaults = new PromptValidator();

        assertThatCode(() -> defaults.validate("x".repeat(2000))).doesNotThrowAnyException();
        assertThatThrownBy(() -> defaults.validate("x".repeat(2001)))
                .isInstanceOf(PromptValidationException.class);
    }
}
