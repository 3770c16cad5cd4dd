package io.ingestline.api.lifecycle;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListenAddressTest {

    @Test
    void portOnlyBindsAllInterfaces() {
        var address = ListenAddress.parse(":8080");
        assertThat(address.allInterfaces()).isTrue();
        assertThat(address.port()).isEqualTo(8080);
    }

    @Test
    void missingValueFallsBackToDefault() {
        assertThat(ListenAddress.parse(null)).isEqualTo(new ListenAddress(null, 8080));
        assertThat(ListenAddress.parse("  ")).isEqualTo(new ListenAddress(null, 8080));
    }

    @Test
    void parsesHostAndPort() {
        assertThat(ListenAddress.parse("127.0.0.1:9090")).isEqualTo(new ListenAddress("127.0.0.1", 9090));
        assertThat(ListenAddress.parse("localhost:0")).isEqualTo(new ListenAddress("localhost", 0));
        assertThat(ListenAddress.parse("[::1]:8443")).isEqualTo(new ListenAddress("::1", 8443));
    }

    @Test
    void rejectsMalformedAddresses() {
        assertThatThrownBy(() -> ListenAddress.parse("8080")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ListenAddress.parse("host:http")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ListenAddress.parse(":70000")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ListenAddress.parse("::1:8080")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ListenAddress.parse("[::1:8080")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void postProcessorAppliesHttpAddrAtLowestPrecedence() {
        var env = new MockEnvironment().withProperty(ListenAddressEnvironmentPostProcessor.VARIABLE, "127.0.0.1:9090");

        new ListenAddressEnvironmentPostProcessor().postProcessEnvironment(env, null);

        assertThat(env.getProperty("server.port")).isEqualTo("9090");
        assertThat(env.getProperty("server.address")).isEqualTo("127.0.0.1");
    }

    @Test
    void postProcessorDefaultsToPort8080OnAllInterfaces() {
        var env = new MockEnvironment();

        new ListenAddressEnvironmentPostProcessor().postProcessEnvironment(env, null);

        assertThat(env.getProperty("server.port")).isEqualTo("8080");
        assertThat(env.getProperty("server.address")).isNull();
    }

    @Test
    void explicitServerPropertiesWin() {
        var env = new MockEnvironment()
                .withProperty(ListenAddressEnvironmentPostProcessor.VARIABLE, ":9090")
                .withProperty("server.port", "0");

        new ListenAddressEnvironmentPostProcessor().postProcessEnvironment(env, null);

        assertThat(env.getProperty("server.port")).isEqualTo("0");
    }
}
