package com.social.infrastructure.security;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;

class BcryptPasswordHasherTest {

    @Test
    void hashesAreSaltedAndVerifiable() {
        BCryptPasswordEncoder encoder = new BCryptPasswordEncoder(4);
        BcryptPasswordHasher hasher = new BcryptPasswordHasher(encoder);

        String first = hasher.hash("correct-horse");
        String second = hasher.hash("correct-horse");

        assertThat(first).startsWith("$2").doesNotContain("correct-horse");
        assertThat(first).isNotEqualTo(second);
        assertThat(encoder.matches("correct-horse", first)).isTrue();
        assertThat(encoder.matches("wrong", first)).isFalse();
    }
}
