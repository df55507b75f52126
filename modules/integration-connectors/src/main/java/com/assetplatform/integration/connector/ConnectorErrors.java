package com.assetplatform.integration.connector;

public final class ConnectorErrors {
  private static final int MAX_MESSAGE_LENGTH = 500;

  private ConnectorErrors() {}

  public static String errorCode(Throwable error) {
    if (error instanceof AssetConnectorException ex && ex.httpStatus() > 0) {
      return "HTTP_" + ex.httpStatus();
    }
    String simpleName = error.getClass().getSimpleName();
    return simpleName == null || simpleName.isBlank() ? "UnknownError" : simpleName;
  }

  public static String sanitizeMessage(Throwable error) {
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return errorCode(error);
    }
    String compact = message.replaceAll("\\s+", " ").trim();
    if (compact.length() <= MAX_MESSAGE_LENGTH) {
      return compact;
    }
    return compact.substring(0, MAX_MESSAGE_LENGTH);
  }
}
