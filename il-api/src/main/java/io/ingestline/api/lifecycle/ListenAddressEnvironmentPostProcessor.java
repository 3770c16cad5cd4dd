package io.ingestline.api.lifecycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;
import java.util.Map;

/**
 * Reads {@code HTTP_ADDR} once at startup and turns it into {@code server.port}
 * and {@code server.address}. The values go in at the lowest precedence, so
 * explicit Spring properties still win.
 */
public class ListenAddressEnvironmentPostProcessor implements EnvironmentPostProcessor {
    public static final String VARIABLE = "HTTP_ADDR";
    static final String SOURCE_NAME = "httpAddr";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        var address = ListenAddress.parse(environment.getProperty(VARIABLE, ListenAddress.DEFAULT));

        Map<String, Object> props = new HashMap<>();
        props.put("server.port", address.port());
        if (!address.allInterfaces()) props.put("server.address", address.host());

        environment.getPropertySources().addLast(new MapPropertySource(SOURCE_NAME, props));
    }
}
