package com.fhestream.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HandleTest {

    @Test
    void prefixedUppercaseHex_isNormalized() {
        Handle handle = new Handle("0x" + "AB".repeat(32));

        assertThat(handle.hex()).isEqualTo("ab".repeat(32));
        assertThat(handle).isEqualTo(new Handle("ab".repeat(32)));
    }

    @Test
    void wrongLength_isRejected() {
        assertThatThrownBy(() -> new Handle("ab".repeat(31))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Handle.of(new byte[33])).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonHex_isRejected() {
        assertThatThrownBy(() -> new Handle("zz".repeat(32))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bytes_roundTripThroughOf() {
        byte[] raw = new byte[32];
        raw[0] = (byte) 0xff;
        raw[31] = 7;

        assertThat(Handle.of(raw).bytes()).isEqualTo(raw);
    }
}
