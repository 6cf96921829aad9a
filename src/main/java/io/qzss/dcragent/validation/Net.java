package io.qzss.dcragent.validation;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.regex.Pattern;

/**
 * Host name and port validation for the SMTP settings.
 *
 * @since 0.1.0
 */
public final class Net {

  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates a DNS host name, IPv4 literal or bracket-less IPv6 literal.
   *
   * @param name option name used in error messages
   * @param value host to check
   * @return trimmed host
   * @throws IllegalArgumentException if the host is malformed
   */
  public static String validateHost(String name, String value) {
    String host = Strings.requireNonBlank(name, value);
    if (host.indexOf(':') >= 0) {
      validateIpv6(name, host);
    } else if (IPV4_PATTERN.matcher(host).matches()) {
      validateIpv4Octets(host);
    } else {
      validateHostname(name, host);
    }
    return host;
  }

  /**
   * Validates a TCP port.
   *
   * @param name option name used in error messages
   * @param port port number
   * @return {@code port}
   */
  public static int validatePort(String name, int port) {
    Numbers.requireRange(name, port, 1, 65535);
    return port;
  }

  private static void validateHostname(String name, String host) {
    int len = host.length();
    if (len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(name + ": host name longer than " + MAX_HOSTNAME_LENGTH);
    }
    int start = 0;
    while (true) {
      int dot = host.indexOf('.', start);
      int end = dot == -1 ? len : dot;
      validateLabel(name, host, start, end);
      if (dot == -1) {
        return;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException(name + ": empty trailing label in " + host);
      }
    }
  }

  private static void validateLabel(String name, String s, int start, int end) {
    int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException(name + ": label length " + labelLen + " must be 1.." + MAX_LABEL_LENGTH);
    }
    if (!isAsciiAlnum(s.charAt(start)) || !isAsciiAlnum(s.charAt(end - 1))) {
      throw new IllegalArgumentException(name + ": labels must start and end with a letter or digit");
    }
    for (int i = start + 1; i < end - 1; i++) {
      char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException(name + ": illegal character '" + c + "' in " + s);
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    for (String part : host.split("\\.")) {
      Numbers.requireRange("IPv4 octet", Integer.parseInt(part), 0, 255);
    }
  }

  private static void validateIpv6(String name, String host) {
    try {
      if (!(InetAddress.getByName(host) instanceof Inet6Address)) {
        throw new IllegalArgumentException(name + ": invalid IPv6 literal " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException(name + ": invalid IPv6 literal " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
  }
}
