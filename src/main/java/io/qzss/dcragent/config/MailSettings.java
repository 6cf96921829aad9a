package io.qzss.dcragent.config;

import io.qzss.dcragent.application.dispatch.DeliveryPolicy;
import io.qzss.dcragent.logging.Logs;
import java.time.Duration;
import java.util.Objects;

/**
 * SMTP channel settings.
 *
 * @param host SMTP server
 * @param port SMTP port
 * @param username account id; blank disables authentication
 * @param password account password
 * @param address recipient list, comma separated
 * @param from sender address
 * @param tls upgrade plain SMTP with STARTTLS
 * @param ssl connect with implicit TLS; wins over {@code tls}
 * @param timeout connect, read and write timeout
 * @param suppressHeaderFromText drop the header from the body when it leads the report text
 * @param policy delivery policy
 * @since 0.1.0
 */
public record MailSettings(
    String host,
    int port,
    String username,
    String password,
    String address,
    String from,
    boolean tls,
    boolean ssl,
    Duration timeout,
    boolean suppressHeaderFromText,
    DeliveryPolicy policy) {

  public MailSettings {
    host = host == null ? "" : host;
    username = username == null ? "" : username;
    password = password == null ? "" : password;
    address = address == null ? "" : address;
    from = from == null || from.isBlank() ? address : from;
    Objects.requireNonNull(timeout, "timeout");
    Objects.requireNonNull(policy, "policy");
  }

  public boolean authenticated() {
    return !username.isBlank();
  }

  @Override
  public String toString() {
    return "MailSettings[host=" + host + ", port=" + port + ", username=" + username
        + ", password=" + Logs.redact(password) + ", address=" + address + ", from=" + from
        + ", tls=" + tls + ", ssl=" + ssl + ", timeout=" + timeout
        + ", suppressHeaderFromText=" + suppressHeaderFromText + ", policy=" + policy + "]";
  }
}
