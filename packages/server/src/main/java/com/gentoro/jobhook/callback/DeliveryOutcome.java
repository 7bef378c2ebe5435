package com.gentoro.jobhook.callback;

/**
 * Final result of delivering one callback.
 *
 * @param attempts number of POSTs issued
 * @param lastStatus HTTP status of the last response, or {@code -1} if none was received
 * @param reason short description of why delivery stopped, {@code null} when delivered
 */
public record DeliveryOutcome(Kind kind, int attempts, int lastStatus, String reason) {

  public enum Kind {
    DELIVERED,
    EXHAUSTED
  }

  static DeliveryOutcome delivered(int attempts, int status) {
    return new DeliveryOutcome(Kind.DELIVERED, attempts, status, null);
  }

  static DeliveryOutcome exhausted(int attempts, int status, String reason) {
    return new DeliveryOutcome(Kind.EXHAUSTED, attempts, status, reason);
  }

  public boolean isDelivered() {
    return kind == Kind.DELIVERED;
  }
}
