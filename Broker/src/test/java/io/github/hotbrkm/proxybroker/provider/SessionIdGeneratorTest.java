package io.github.hotbrkm.proxybroker.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SessionIdGenerator")
class SessionIdGeneratorTest {

    @Test
    @DisplayName("Should never repeat a token even when the random source is constant")
    void testUniqueWithConstantRandom() {
        SessionIdGenerator generator = new SessionIdGenerator(new ConstantRandom());
        Set<String> tokens = new HashSet<>();

        for (int i = 0; i < 10_000; i++) {
            tokens.add(generator.nextHex(6));
        }

        assertThat(tokens).hasSize(10_000);
        assertThat(tokens).allMatch(token -> token.matches("[0-9a-f]{12}"));
    }

    @Test
    @DisplayName("Should cover the whole value space of a width before refusing to draw more")
    void testExhaustsValueSpace() {
        SessionIdGenerator generator = new SessionIdGenerator();
        Set<String> tokens = new HashSet<>();

        for (int i = 0; i < 256; i++) {
            tokens.add(generator.nextHex(1));
        }

        assertThat(tokens).hasSize(256);
        assertThatThrownBy(() -> generator.nextHex(1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should keep tokens distinct across a long run of draws")
    void testLongRunStaysDistinct() {
        SessionIdGenerator generator = new SessionIdGenerator();
        Set<String> tokens = new HashSet<>();

        for (int i = 0; i < 200_000; i++) {
            tokens.add(generator.nextHex(6));
        }

        assertThat(tokens).hasSize(200_000);
    }

    @Test
    @DisplayName("Tokens wider than eight bytes should still be unique")
    void testWideTokens() {
        SessionIdGenerator generator = new SessionIdGenerator(new ConstantRandom());

        assertThat(generator.nextHex(12)).hasSize(24).isNotEqualTo(generator.nextHex(12));
    }

    @Test
    @DisplayName("URL-safe tokens should carry no padding")
    void testUrlSafe() {
        String token = new SessionIdGenerator().nextUrlSafe(8);

        assertThat(token).hasSize(11).matches("[A-Za-z0-9_-]+");
    }

    private static final class ConstantRandom extends SecureRandom {
        @Override
        public void nextBytes(byte[] bytes) {
            Arrays.fill(bytes, (byte) 7);
        }
    }
}
