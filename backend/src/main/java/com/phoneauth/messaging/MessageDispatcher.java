package com.phoneauth.messaging;

import com.phoneauth.phone.PhoneNumber;

/**
 * Delivers one-time codes to their owner (SMS gateway, e-mail, push).
 *
 * Delivery is fire-and-forget from the caller's point of view: a failure is
 * reported, but the issued code stays valid.
 */
public interface MessageDispatcher {

    /**
     * Send a one-time code.
     *
     * @param phone the recipient
     * @param code  the plaintext code
     * @throws DispatchException if the message could not be handed to the transport
     */
    void send(PhoneNumber phone, String code);
}
