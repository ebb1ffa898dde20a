package com.salon.receptionist.utils;

import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Normalizes caller numbers to E.164 so one client is always stored under one key.
 * "+351 912-345-678", "00351912345678" and "912345678" (with default country 351) all become "+351912345678".
 */
@Component
public class PhoneNumberNormalizer {

    private static final Pattern E164 = Pattern.compile("\\+[1-9]\\d{6,14}");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-().]");

    private final String defaultCountryCode;

    public PhoneNumberNormalizer(@Value("${salon.default-country-code:351}") String defaultCountryCode) {
        this.defaultCountryCode = StringUtils.stripStart(StringUtils.trimToEmpty(defaultCountryCode), "+");
    }

    /**
     * @throws IllegalArgumentException when the input cannot be read as a phone number
     */
    public String normalize(String raw) {
        if (StringUtils.isBlank(raw)) {
            throw new IllegalArgumentException("Phone number is required");
        }
        String digits = SEPARATORS.matcher(raw.trim()).replaceAll("");
        if (digits.startsWith("00")) {
            digits = "+" + digits.substring(2);
        } else if (!digits.startsWith("+")) {
            digits = "+" + defaultCountryCode + StringUtils.stripStart(digits, "0");
        }
        if (!E164.matcher(digits).matches()) {
            throw new IllegalArgumentException("Not a valid phone number: " + raw);
        }
        return digits;
    }
}
