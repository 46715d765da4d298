package com.phoneauth.messaging;

import com.phoneauth.phone.PhoneNumber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Development dispatcher that writes codes to the log instead of sending them.
 *
 * Replace with an SMS gateway implementation in production deployments.
 */
@Slf4j
@Component
public class LoggingMessageDispatcher implements MessageDispatcher {

    @Override
    public void send(PhoneNumber phone, String code) {
        log.info("Verification code for {}: {}", phone, code);
    }
}
