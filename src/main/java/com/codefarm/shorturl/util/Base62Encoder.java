package com.codefarm.shorturl.util;

import org.springframework.stereotype.Component;

@Component
public class Base62Encoder {

    static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";

    private static final int BASE = ALPHABET.length();

    /**
     * Encodes a non-negative number, most significant digit first, without padding.
     * <p>
     * A Snowflake composite from {@link ShortCodeGenerator} encodes to 10 or 11 characters;
     * 11 characters cover everything up to {@link Long#MAX_VALUE}.
     *
     * @param number value to encode, must be {@code >= 0}
     * @return base62 text, {@code "0"} for zero
     */
    public String toBase62(long number) {
        if (number < 0) {
            throw new IllegalArgumentException("Cannot encode negative number: " + number);
        }
        if (number == 0) return "0";
        StringBuilder builder = new StringBuilder();
        while (number > 0) {
            int idx = (int) (number % BASE);
            builder.append(ALPHABET.charAt(idx));
            number = number / BASE;
        }
        return builder.reverse().toString();
    }

    public long fromBase62(String code) {
        if (code == null || code.isEmpty()) {
            throw new IllegalArgumentException("Base62 text cannot be empty");
        }
        long result = 0;
        for (int i = 0; i < code.length(); i++) {
            int val = ALPHABET.indexOf(code.charAt(i));
            if (val < 0) throw new IllegalArgumentException("Invalid base62 character: " + code.charAt(i));
            result = Math.addExact(Math.multiplyExact(result, BASE), val);
        }
        return result;
    }
}
