package com.phoneauth.phone;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A phone number in canonical E.164 form, e.g. {@code +994501234567}.
 *
 * Instances are produced by {@link PhoneNumberCanonicalizer}; every cache key,
 * rate-limit counter and identity lookup uses {@link #value()}, so two spellings
 * of the same number always share state.
 */
public record PhoneNumber(String value) {

    private static final int VISIBLE_PREFIX = 5;
    private static final int VISIBLE_SUFFIX = 2;
    private static final Pattern E164 = Pattern.compile("\\+[1-9]\\d{6,14}");

    public PhoneNumber {
        Objects.requireNonNull(value, "value");
        if (!isE164(value)) {
            throw new IllegalArgumentException("Phone number is not in E.164 form");
        }
    }

    /**
     * Checks whether a string is a well-formed E.164 number: a leading
     * {@code +} followed by at most 15 digits.
     *
     * @param candidate the string to check
     * @return true if the string can back a {@link PhoneNumber}
     */
    public static boolean isE164(String candidate) {
        return candidate != null && E164.matcher(candidate).matches();
    }

    /**
     * Renders the number for logs with the middle digits hidden,
     * e.g. {@code +9945******67}.
     *
     * @return the masked number
     */
    public String masked() {
        int hidden = value.length() - VISIBLE_PREFIX - VISIBLE_SUFFIX;
        if (hidden <= 0) {
            return value;
        }
        return value.substring(0, VISIBLE_PREFIX)
                + "*".repeat(hidden)
                + value.substring(value.length() - VISIBLE_SUFFIX);
    }

    @Override
    public String toString() {
        return masked();
    }
}
