package com.phoneauth.phone;

import com.google.i18n.phonenumbers.NumberParseException;
import com.google.i18n.phonenumbers.PhoneNumberUtil;
import com.google.i18n.phonenumbers.Phonenumber;
import com.phoneauth.exception.AuthErrorCode;
import com.phoneauth.exception.AuthException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Converts user-entered phone numbers into canonical E.164 form.
 *
 * National spellings ({@code 050 123 45 67}, {@code 0501234567}) are resolved
 * against the configured default region; numbers starting with {@code +} or
 * the international dialling prefix are parsed as international. Numbers that
 * cannot have a possible length for their country are rejected.
 */
@Component
@Slf4j
public class PhoneNumberCanonicalizer {

    private final PhoneNumberUtil phoneNumberUtil = PhoneNumberUtil.getInstance();

    private final String defaultRegion;

    public PhoneNumberCanonicalizer(@Value("${app.phone.default-region:AZ}") String defaultRegion) {
        this.defaultRegion = defaultRegion;
    }

    /**
     * Canonicalize a raw phone number.
     *
     * @param rawPhone the phone number as entered by the user
     * @return the canonical phone number
     * @throws AuthException INVALID_PHONE if the input is blank, unparseable or impossible
     */
    public PhoneNumber canonicalize(String rawPhone) {
        if (!StringUtils.hasText(rawPhone)) {
            throw new AuthException(AuthErrorCode.INVALID_PHONE);
        }

        Phonenumber.PhoneNumber parsed;
        try {
            parsed = phoneNumberUtil.parse(rawPhone.trim(), defaultRegion);
        } catch (NumberParseException ex) {
            log.debug("Phone number rejected: {}", ex.getErrorType());
            throw new AuthException(AuthErrorCode.INVALID_PHONE, ex);
        }

        if (!phoneNumberUtil.isPossibleNumber(parsed)) {
            log.debug("Phone number rejected: impossible length for country code {}", parsed.getCountryCode());
            throw new AuthException(AuthErrorCode.INVALID_PHONE);
        }

        String formatted = phoneNumberUtil.format(parsed, PhoneNumberUtil.PhoneNumberFormat.E164);
        if (!PhoneNumber.isE164(formatted)) {
            // Some regions allow national numbers longer than E.164 permits
            log.debug("Phone number rejected: {} digits exceed E.164", formatted.length() - 1);
            throw new AuthException(AuthErrorCode.INVALID_PHONE);
        }

        return new PhoneNumber(formatted);
    }
}
