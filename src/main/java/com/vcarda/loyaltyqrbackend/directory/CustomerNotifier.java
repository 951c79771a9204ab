package com.vcarda.loyaltyqrbackend.directory;

import java.util.Map;

/**
 * Outbound customer notifications (push, e-mail, ...). Delivery is best-effort: callers log
 * failures and carry on.
 */
public interface CustomerNotifier {

    String QR_SCANNED = "QR_SCANNED";

    void notify(Long customerId, String kind, Map<String, Object> payload);
}
