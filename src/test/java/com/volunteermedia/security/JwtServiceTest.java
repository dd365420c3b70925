package com.volunteermedia.security;

import com.volunteermedia.exception.UnauthorizedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtServiceTest {

    private static final String SECRET = "k9Qz7Lw2Xp4Rm8Nv3Bt6Yh1Jc5Fd0Gs-UiOaPe";

    private final JwtService jwtService = new JwtService(SECRET, Duration.ofHours(24));

    @Test
    void tokenCarriesUserIdAndAdminFlag() {
        String token = jwtService.generateToken(42L, true);

        AuthenticatedUser user = jwtService.parseToken(token);

        assertThat(user.userId()).isEqualTo(42L);
        assertThat(user.admin()).isTrue();
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtService other = new JwtService("Zx8Cv7Bn6Mq5Wr4Ty3Ui2Op1As0Df9Gh-JkLp", Duration.ofHours(24));
        String foreign = other.generateToken(1L, true);

        assertThatThrownBy(() -> jwtService.parseToken(foreign))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessage("Invalid or expired token");
    }

    @Test
    void expiredTokenIsRejected() {
        JwtService shortLived = new JwtService(SECRET, Duration.ofSeconds(-5));
        String token = shortLived.generateToken(1L, false);

        assertThatThrownBy(() -> jwtService.parseToken(token))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> jwtService.parseToken("not.a.jwt"))
                .isInstanceOf(UnauthorizedException.class);
    }
}
