package com.geomonitor.gatewayservice.services;

import com.geomonitor.gatewayservice.services.credentials.CredentialIssuedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Hands newly issued keys to the notification side. Delivery lives elsewhere;
 * this service only emits the trigger.
 */
@Slf4j
@Component
public class WelcomeNotificationListener {

    @EventListener
    public void onCredentialIssued(CredentialIssuedEvent event) {
        log.info("Welcome notification requested for account {} (key {}, {} plan)",
                event.accountId(), event.keyPrefix(), event.planTier().getValue());
    }
}
