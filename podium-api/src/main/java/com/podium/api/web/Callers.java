package com.podium.api.web;

import com.podium.domain.account.Address;

/**
 * Caller identity taken from the {@code X-Caller} header. The host trusts the
 * header as given.
 */
public final class Callers {

  public static final String HEADER = "X-Caller";

  private Callers() {}

  public static Address parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Missing " + HEADER + " header");
    }
    return Address.of(raw);
  }

  /** Blank means absent. */
  public static Address optional(String raw) {
    return raw == null || raw.isBlank() ? null : Address.of(raw);
  }
}
