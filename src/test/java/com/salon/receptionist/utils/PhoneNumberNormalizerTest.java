package com.salon.receptionist.utils;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhoneNumberNormalizerTest {

    private final PhoneNumberNormalizer normalizer = new PhoneNumberNormalizer("+351");

    @ParameterizedTest
    @ValueSource(strings = {"+351912345678", "+351-912-345-678", " +351 912 345 678 ", "00351912345678", "912345678", "(912) 345.678"})
    void normalize_sameClientSameKey(String raw) {
        assertThat(normalizer.normalize(raw)).isEqualTo("+351912345678");
    }

    @Test
    void normalize_keepsForeignNumbers() {
        assertThat(normalizer.normalize("+1 555 010 9999")).isEqualTo("+15550109999");
    }

    @Test
    void normalize_rejectsGarbage() {
        assertThatThrownBy(() -> normalizer.normalize(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> normalizer.normalize("   ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> normalizer.normalize("call me")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> normalizer.normalize("+0123456789")).isInstanceOf(IllegalArgumentException.class);
    }
}
