package com.flowdesk.chatbotcore.channel.transport;

/**
 * Why a transport connection closed. Only {@link Kind#LOGGED_OUT} and {@link Kind#UNAUTHORIZED}
 * are non-recoverable: the stored credentials are no longer accepted.
 */
public record DisconnectReason(Kind kind, Integer statusCode, String detail) {

  public enum Kind {
    LOGGED_OUT,
    UNAUTHORIZED,
    RESTART_REQUIRED,
    CONNECTION_LOST,
    STALE,
    TRANSPORT_FAILURE
  }

  public static DisconnectReason fromStatusCode(Integer statusCode, String detail) {
    if (statusCode == null) {
      return new DisconnectReason(Kind.CONNECTION_LOST, null, detail);
    }
    Kind kind =
        switch (statusCode) {
          case 401 -> Kind.LOGGED_OUT;
          case 403 -> Kind.UNAUTHORIZED;
          case 515 -> Kind.RESTART_REQUIRED;
          default -> Kind.CONNECTION_LOST;
        };
    return new DisconnectReason(kind, statusCode, detail);
  }

  public static DisconnectReason stale() {
    return new DisconnectReason(Kind.STALE, null, "transport reported dead handle");
  }

  public static DisconnectReason transportFailure(String detail) {
    return new DisconnectReason(Kind.TRANSPORT_FAILURE, null, detail);
  }

  public boolean recoverable() {
    return kind != Kind.LOGGED_OUT && kind != Kind.UNAUTHORIZED;
  }
}
