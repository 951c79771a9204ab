package com.vcarda.loyaltyqrbackend.directory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Default notifier: writes the notification to the application log.
 * Replace with a push/e-mail gateway bean in deployments that deliver notifications.
 */
@Service
@Slf4j
public class LoggingCustomerNotifier implements CustomerNotifier {

    @Override
    public void notify(Long customerId, String kind, Map<String, Object> payload) {
        log.info("[NOTIFY] customerId={}, kind={}, payload={}", customerId, kind, payload);
    }
}
