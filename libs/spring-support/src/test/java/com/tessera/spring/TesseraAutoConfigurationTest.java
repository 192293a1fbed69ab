package com.tessera.spring;

import static org.assertj.core.api.Assertions.assertThat;

import com.tessera.domain.EntityCreated;
import com.tessera.domain.EntityType;
import com.tessera.domain.TopicRegistry;
import com.tessera.eventbus.DefaultEventBus;
import com.tessera.eventbus.EventBus;
import com.tessera.eventbus.EventBusHolder;
import com.tessera.eventbus.EventBusMetrics;
import com.tessera.eventbus.testing.RecordingEventHandler;
import com.tessera.eventmodel.CanonicalEncoder;
import com.tessera.eventmodel.DomainEvent;
import com.tessera.eventmodel.EventHasher;
import com.tessera.eventmodel.HashingSettings;
import com.tessera.eventmodel.JacksonCanonicalEncoder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@DisplayName("TesseraAutoConfiguration")
class TesseraAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TesseraAutoConfiguration.class));

    @AfterEach
    void tearDown() {
        EventHasher.reset();
        EventBusHolder.reset();
    }

    static final class Pinged extends DomainEvent {
        private final String target;

        Pinged(String target) {
            this.target = target;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomBusConfig {
        @Bean
        EventBus customBus() {
            return new DefaultEventBus();
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class EntityTypeConfig {
        @Bean
        EntityType<Account> accountType() {
            return Account.TYPE;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class RecordingHandlerConfig {
        @Bean
        RecordingEventHandler auditTrail() {
            return new RecordingEventHandler("audit-trail");
        }
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("should register all beans")
        void shouldRegisterAllBeans() {
            contextRunner.run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).hasSingleBean(CanonicalEncoder.class);
                assertThat(context).hasSingleBean(EventHasher.class);
                assertThat(context).hasSingleBean(TopicRegistry.class);
                assertThat(context).hasSingleBean(EventBusMetrics.class);
                assertThat(context).hasSingleBean(EventBus.class);
                assertThat(context).hasSingleBean(EventHandlerRegistrar.class);
            });
        }

        @Test
        @DisplayName("should install the hasher and bus process-wide")
        void shouldInstallGlobals() {
            contextRunner.run(context -> {
                assertThat(EventHasher.defaultHasher()).isSameAs(context.getBean(EventHasher.class));
                assertThat(EventBusHolder.get()).isSameAs(context.getBean(EventBus.class));
                assertThat(TopicRegistry.global()).isSameAs(context.getBean(TopicRegistry.class));
            });
        }

        @Test
        @DisplayName("should leave the handler timeout unbounded")
        void shouldHaveNoTimeout() {
            contextRunner.run(context ->
                    assertThat(context.getBean(DefaultEventBus.class).handlerTimeout()).isNull());
        }

        @Test
        @DisplayName("should use noop metrics without a meter registry")
        void shouldUseNoopMetrics() {
            contextRunner.run(context -> {
                EventBusMetrics metrics = context.getBean(EventBusMetrics.class);
                assertThat(metrics.busName()).isEqualTo(EventBusMetrics.DEFAULT_BUS_NAME);
                assertThat(metrics.registry()).isNotInstanceOf(SimpleMeterRegistry.class);
            });
        }
    }

    @Nested
    @DisplayName("Properties")
    class PropertiesBinding {

        @Test
        @DisplayName("should hash with the configured salt")
        void shouldUseConfiguredSalt() {
            contextRunner.withPropertyValues("tessera.hashing.salt=pepper").run(context -> {
                var event = new Pinged("db");
                var expected = new EventHasher(new JacksonCanonicalEncoder(), new HashingSettings("pepper"));
                var unsalted = new EventHasher(new JacksonCanonicalEncoder(), HashingSettings.unsalted());

                String digest = context.getBean(EventHasher.class).digest(event);

                assertThat(digest).isEqualTo(expected.digest(event)).isNotEqualTo(unsalted.digest(event));
            });
        }

        @Test
        @DisplayName("should apply the configured handler timeout")
        void shouldApplyTimeout() {
            contextRunner.withPropertyValues("tessera.bus.handler-timeout=250ms").run(context ->
                    assertThat(context.getBean(DefaultEventBus.class).handlerTimeout())
                            .isEqualTo(Duration.ofMillis(250)));
        }

        @Test
        @DisplayName("should not install the bus globally when disabled")
        void shouldNotInstallGlobally() {
            contextRunner.withPropertyValues("tessera.bus.install-global=false").run(context ->
                    assertThat(EventBusHolder.get()).isNotSameAs(context.getBean(EventBus.class)));
        }

        @Test
        @DisplayName("should fail to start with a zero handler timeout")
        void shouldRejectZeroTimeout() {
            contextRunner.withPropertyValues("tessera.bus.handler-timeout=0ms").run(context ->
                    assertThat(context).hasFailed());
        }
    }

    @Nested
    @DisplayName("Metrics")
    class Metrics {

        @Test
        @DisplayName("should record publishes on the meter registry under the bus name")
        void shouldRecordOnRegistry() {
            contextRunner.withUserConfiguration(MeterRegistryConfig.class)
                    .withPropertyValues("tessera.bus.name=orders")
                    .run(context -> {
                        MeterRegistry registry = context.getBean(MeterRegistry.class);
                        assertThat(context.getBean(EventBusMetrics.class).registry()).isSameAs(registry);

                        context.getBean(EventBus.class).publish(List.of(new Pinged("a"), new Pinged("b"))).join();

                        assertThat(registry.get(EventBusMetrics.PUBLISH_BATCHES)
                                .tag(EventBusMetrics.TAG_BUS, "orders").counter().count()).isEqualTo(1.0);
                        assertThat(registry.get(EventBusMetrics.PUBLISH_EVENTS)
                                .tag(EventBusMetrics.TAG_BUS, "orders").counter().count()).isEqualTo(2.0);
                    });
        }

        @Test
        @DisplayName("should ignore the meter registry when metrics are disabled")
        void shouldIgnoreRegistryWhenDisabled() {
            contextRunner.withUserConfiguration(MeterRegistryConfig.class)
                    .withPropertyValues("tessera.bus.metrics-enabled=false")
                    .run(context -> {
                        MeterRegistry registry = context.getBean(MeterRegistry.class);
                        assertThat(context.getBean(EventBusMetrics.class).registry()).isNotSameAs(registry);
                        assertThat(registry.find(EventBusMetrics.PUBLISH_BATCHES).counter()).isNull();
                    });
        }
    }

    @Nested
    @DisplayName("Back-off and wiring")
    class Wiring {

        @Test
        @DisplayName("should back off when the application defines its own bus")
        void shouldBackOffForCustomBus() {
            contextRunner.withUserConfiguration(CustomBusConfig.class).run(context -> {
                assertThat(context).hasSingleBean(EventBus.class);
                assertThat(context).hasBean("customBus");
                assertThat(context).doesNotHaveBean("eventBus");
            });
        }

        @Test
        @DisplayName("should register entity type beans in the topic registry")
        void shouldRegisterEntityTypes() {
            contextRunner.withUserConfiguration(EntityTypeConfig.class).run(context -> {
                TopicRegistry registry = context.getBean(TopicRegistry.class);
                assertThat(registry.contains("spring.account")).isTrue();
                assertThat(registry.topicOf(Account.class)).isEqualTo("spring.account");
            });
        }

        @Test
        @DisplayName("should deliver entity events to handler beans")
        void shouldDeliverEntityEvents() {
            contextRunner.withUserConfiguration(EntityTypeConfig.class, RecordingHandlerConfig.class).run(context -> {
                RecordingEventHandler auditTrail = context.getBean(RecordingEventHandler.class);

                Account account = Account.open("ann");

                assertThat(account.owner()).isEqualTo("ann");
                assertThat(auditTrail.events()).singleElement().isInstanceOf(EntityCreated.class);
            });
        }
    }
}
