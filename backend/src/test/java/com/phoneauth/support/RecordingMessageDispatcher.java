package com.phoneauth.support;

import com.phoneauth.messaging.MessageDispatcher;
import com.phoneauth.phone.PhoneNumber;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatcher that keeps the last code sent to each phone, for end-to-end tests.
 */
public class RecordingMessageDispatcher implements MessageDispatcher {

    private final Map<String, String> lastCodes = new ConcurrentHashMap<>();

    @Override
    public void send(PhoneNumber phone, String code) {
        lastCodes.put(phone.value(), code);
    }

    public String lastCodeFor(String canonicalPhone) {
        return lastCodes.get(canonicalPhone);
    }

    public void clear() {
        lastCodes.clear();
    }
}
