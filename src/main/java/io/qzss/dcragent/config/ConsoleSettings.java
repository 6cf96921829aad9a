package io.qzss.dcragent.config;

import io.qzss.dcragent.application.dispatch.DeliveryPolicy;
import java.util.Objects;

/**
 * Console channel settings.
 *
 * @param policy delivery policy
 * @since 0.1.0
 */
public record ConsoleSettings(DeliveryPolicy policy) {
  public ConsoleSettings {
    Objects.requireNonNull(policy, "policy");
  }
}
