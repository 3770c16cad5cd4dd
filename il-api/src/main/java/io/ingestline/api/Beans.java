package io.ingestline.api;

import io.ingestline.api.metrics.HttpInstrumentation;
import io.ingestline.api.metrics.InstrumentationFilter;
import io.ingestline.store.EventStore;
import io.ingestline.store.InMemoryEventStore;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.binder.system.UptimeMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

@Configuration
@EnableConfigurationProperties(IngestProperties.class)
public class Beans {

    @Bean
    @ConditionalOnMissingBean(EventStore.class)
    EventStore eventStore() {
        return new InMemoryEventStore();
    }

    @Bean(destroyMethod = "close")
    PrometheusMeterRegistry prometheusMeterRegistry() {
        var registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new UptimeMetrics().bindTo(registry);
        return registry;
    }

    @Bean(destroyMethod = "close")
    JvmGcMetrics jvmGcMetrics(PrometheusMeterRegistry registry) {
        var gc = new JvmGcMetrics();
        gc.bindTo(registry);
        return gc;
    }

    @Bean
    HttpInstrumentation httpInstrumentation(PrometheusMeterRegistry registry) {
        return new HttpInstrumentation(registry);
    }

    @Bean
    FilterRegistrationBean<InstrumentationFilter> healthInstrumentation(HttpInstrumentation instrumentation) {
        return instrumented("/healthz", Set.of("GET"), instrumentation);
    }

    @Bean
    FilterRegistrationBean<InstrumentationFilter> eventsInstrumentation(HttpInstrumentation instrumentation) {
        return instrumented("/events", Set.of("GET", "POST"), instrumentation);
    }

    private static FilterRegistrationBean<InstrumentationFilter> instrumented(
            String route, Set<String> methods, HttpInstrumentation instrumentation) {
        var registration = new FilterRegistrationBean<>(new InstrumentationFilter(route, methods, instrumentation));
        registration.setName("instrumentation:" + route);
        registration.addUrlPatterns(route);
        registration.setOrder(PipelineOrder.INSTRUMENTATION);
        return registration;
    }
}
