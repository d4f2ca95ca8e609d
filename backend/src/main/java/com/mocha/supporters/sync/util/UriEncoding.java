package com.mocha.supporters.sync.util;

import java.nio.charset.StandardCharsets;

/**
 * Percent-encodes URL strings the way browsers' {@code encodeURI} does: reserved and
 * unreserved characters pass through, everything else (including {@code %}) is escaped as UTF-8.
 */
public final class UriEncoding {
    private static final String PASS_THROUGH = ";,/?:@&=+$-_.!~*'()#";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private UriEncoding() {
    }

    public static String encodeUri(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder out = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (isPassThrough(c)) {
                if (out != null) {
                    out.append(c);
                }
                continue;
            }
            if (out == null) {
                out = new StringBuilder(value.length() + 16);
                out.append(value, 0, i);
            }
            int end = i + 1;
            if (Character.isHighSurrogate(c) && end < value.length() && Character.isLowSurrogate(value.charAt(end))) {
                end++;
            }
            byte[] bytes = value.substring(i, end).getBytes(StandardCharsets.UTF_8);
            for (byte b : bytes) {
                out.append('%').append(HEX[(b >> 4) & 0x0F]).append(HEX[b & 0x0F]);
            }
            i = end - 1;
        }
        return out == null ? value : out.toString();
    }

    private static boolean isPassThrough(char c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z')
            || (c >= '0' && c <= '9')
            || PASS_THROUGH.indexOf(c) >= 0;
    }
}
