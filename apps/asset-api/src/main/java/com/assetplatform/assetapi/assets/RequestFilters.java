package com.assetplatform.assetapi.assets;

import java.util.Arrays;
import java.util.List;

public final class RequestFilters {
  private RequestFilters() {}

  /** Splits a bar-delimited filter value; absent or blank input yields {@code null}. */
  public static List<String> splitBarDelimited(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    List<String> parts =
        Arrays.stream(value.split("\\|")).map(String::trim).filter(part -> !part.isEmpty()).toList();
    return parts.isEmpty() ? null : parts;
  }

  public static String normalizeSearch(String search) {
    if (search == null || search.isBlank()) {
      return null;
    }
    return search.trim();
  }

  public static String requireId(String id, String label) {
    if (id == null || id.isBlank()) {
      throw new AssetValidationException(label + " must be provided");
    }
    return id.trim();
  }
}
