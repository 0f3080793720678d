package com.flamingo.ai.quartorium.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import java.util.Set;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics of the conversion pipeline.
 *
 * <p>The conversion timers declared with {@code @Timed} publish median and 95th percentile
 * latencies. Every meter carries an {@code application=quartorium} tag.
 */
@Configuration
public class MetricsConfig {

  static final Set<String> CONVERSION_TIMERS =
      Set.of(
          "quartorium.render", "quartorium.transform", "quartorium.serialize", "manuscript.view");

  private static final double[] CONVERSION_PERCENTILES = {0.5, 0.95};

  /** Enables {@code @Timed} on the render gateway, the tree transformer and the serializer. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> applicationTagCustomizer() {
    return registry -> registry.config().commonTags("application", "quartorium");
  }

  @Bean
  public MeterFilter conversionTimerPercentiles() {
    return new MeterFilter() {
      @Override
      public DistributionStatisticConfig configure(
          Meter.Id id, DistributionStatisticConfig config) {
        if (id.getType() == Meter.Type.TIMER && CONVERSION_TIMERS.contains(id.getName())) {
          return DistributionStatisticConfig.builder()
              .percentiles(CONVERSION_PERCENTILES)
              .build()
              .merge(config);
        }
        return config;
      }
    };
  }
}
