package io.hivecontrol.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ServiceIdentityTest {

    @Test
    void trimsAndMatchesExactly() {
        ServiceIdentity identity = new ServiceIdentity("  w1 ");

        assertThat(identity.sid()).isEqualTo("w1");
        assertThat(identity.matches("w1")).isTrue();
        assertThat(identity.matches("W1")).isFalse();
        assertThat(identity.matches("w10")).isFalse();
        assertThat(identity.matches(" w1 ")).isFalse();
        assertThat(identity.matches("w1\t")).isFalse();
        assertThat(identity.matches(null)).isFalse();
    }

    @Test
    void rejectsBlankSid() {
        assertThatThrownBy(() -> new ServiceIdentity(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("sid must not be null or blank");
    }
}
