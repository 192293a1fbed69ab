package com.tessera.spring;

import com.tessera.domain.EntityType;
import com.tessera.domain.TopicRegistry;
import com.tessera.eventbus.DefaultEventBus;
import com.tessera.eventbus.EventBus;
import com.tessera.eventbus.EventBusHolder;
import com.tessera.eventbus.EventBusMetrics;
import com.tessera.eventmodel.CanonicalEncoder;
import com.tessera.eventmodel.EventHasher;
import com.tessera.eventmodel.HashingSettings;
import com.tessera.eventmodel.JacksonCanonicalEncoder;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration of the event model, entity type registry and event bus.
 *
 * <h2>Beans</h2>
 *
 * <ul>
 *   <li>{@link CanonicalEncoder}: Jackson-based canonical encoding of event fields
 *   <li>{@link EventHasher}: installed as the process-wide hasher behind event equality
 *   <li>{@link TopicRegistry}: the global registry, filled with every {@link EntityType} bean
 *   <li>{@link EventBus}: a {@link DefaultEventBus}, instrumented when a {@link MeterRegistry}
 *       bean exists and installed in {@link EventBusHolder} unless
 *       {@code tessera.bus.install-global=false}
 *   <li>{@link EventHandlerRegistrar}: subscribes {@code EventHandler} beans to the bus
 * </ul>
 *
 * Every bean except the registrar backs off when the application defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(TesseraProperties.class)
public class TesseraAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TesseraAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CanonicalEncoder canonicalEncoder() {
        return new JacksonCanonicalEncoder();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventHasher eventHasher(CanonicalEncoder canonicalEncoder, TesseraProperties properties) {
        String salt = properties.hashing().salt();
        HashingSettings settings = salt != null ? new HashingSettings(salt) : HashingSettings.fromEnvironment();
        EventHasher hasher = new EventHasher(canonicalEncoder, settings);
        EventHasher.install(hasher);
        return hasher;
    }

    @Bean
    @ConditionalOnMissingBean
    public TopicRegistry topicRegistry(ObjectProvider<EntityType<?>> entityTypes) {
        TopicRegistry registry = TopicRegistry.global();
        entityTypes.orderedStream().forEach(registry::register);
        log.debug("Topic registry holds {} entity type(s)", registry.size());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public EventBusMetrics eventBusMetrics(ObjectProvider<MeterRegistry> meterRegistry, TesseraProperties properties) {
        TesseraProperties.Bus bus = properties.bus();
        MeterRegistry registry = bus.metricsEnabled() ? meterRegistry.getIfAvailable() : null;
        if (registry == null) {
            return EventBusMetrics.noop();
        }
        return new EventBusMetrics(registry, bus.name());
    }

    @Bean
    @ConditionalOnMissingBean
    public EventBus eventBus(EventBusMetrics eventBusMetrics, TesseraProperties properties) {
        DefaultEventBus eventBus = new DefaultEventBus(eventBusMetrics, properties.bus().handlerTimeout());
        if (properties.bus().installGlobal()) {
            EventBusHolder.set(eventBus);
            log.info("Installed event bus '{}' as the process-wide bus", properties.bus().name());
        }
        return eventBus;
    }

    @Bean
    public EventHandlerRegistrar eventHandlerRegistrar(ListableBeanFactory beanFactory, EventBus eventBus) {
        return new EventHandlerRegistrar(beanFactory, eventBus);
    }
}
