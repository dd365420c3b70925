package com.volunteermedia.security;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtSecretValidatorTest {

    @Test
    void acceptsLongVariedSecret() {
        assertThatCode(() -> JwtSecretValidator.validate("k9Qz7Lw2Xp4Rm8Nv3Bt6Yh1Jc5Fd0Gs-UiOaPe"))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsMissingSecret() {
        assertThatThrownBy(() -> JwtSecretValidator.validate(" "))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not configured");
    }

    @Test
    void rejectsShortSecret() {
        assertThatThrownBy(() -> JwtSecretValidator.validate("k9Qz7Lw2Xp4Rm8Nv"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("at least 32");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "please-CHANGE-me-k9Qz7Lw2Xp4Rm8Nv3Bt6",
            "example-k9Qz7Lw2Xp4Rm8Nv3Bt6Yh1Jc5Fd0G",
            "my-default-k9Qz7Lw2Xp4Rm8Nv3Bt6Yh1Jc5F"
    })
    void rejectsPlaceholderSecrets(String secret) {
        assertThatThrownBy(() -> JwtSecretValidator.validate(secret))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("placeholder");
    }

    @Test
    void rejectsLowVarietySecret() {
        assertThatThrownBy(() -> JwtSecretValidator.validate("abababababababababababababababab12"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("entropy");
    }
}
