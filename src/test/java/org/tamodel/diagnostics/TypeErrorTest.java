package org.tamodel.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the message catalogue behind {@link TypeError} and for {@link Result}.
 */
@Tag("unit")
class TypeErrorTest {

    /**
     * Every kind has a catalogue entry that mentions the offending name.
     */
    @ParameterizedTest
    @EnumSource(TypeError.Kind.class)
    void everyKindHasAMessage(TypeError.Kind kind) {
        String message = new TypeError(kind, "subject").message();
        assertThat(message).doesNotStartWith("!").contains("subject");
    }

    @Test
    void onlyShadowingIsAWarning() {
        assertThat(TypeError.shadowsAVariable("x").isWarning()).isTrue();
        assertThat(TypeError.duplicateDefinition("x").isWarning()).isFalse();
        assertThat(TypeError.couldNotLoadLibrary("libm").message()).isEqualTo("Could not load library named libm");
    }

    /**
     * A result is either a value or an error, never both.
     */
    @Test
    void resultHoldsValueOrError() {
        // Arrange
        Result<String> ok = Result.ok("v");
        Result<String> error = Result.error(TypeError.noSuchProcess("P"));

        // Act
        Result<Integer> mapped = ok.map(String::length);
        Result<Integer> mappedError = error.map(String::length);

        // Assert
        assertThat(mapped.get()).isEqualTo(1);
        assertThat(ok.error()).isEmpty();
        assertThat(mappedError.isError()).isTrue();
        assertThat(mappedError.error()).map(TypeError::kind).contains(TypeError.Kind.NO_SUCH_PROCESS);
        assertThat(error.value()).isEmpty();
        assertThatThrownBy(error::get).isInstanceOf(NoSuchElementException.class);
    }
}
