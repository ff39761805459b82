package com.kawari.proxy.core.utils;

/**
 * Header name and value checks shared by the inbound server, dispatch requests and the
 * raw tunnel writer.
 */
public final class HeaderUtils {

    private static final String TOKEN_SYMBOLS = "!#$%&'*+-.^_`|~";

    private HeaderUtils() {
    }

    /**
     * @param name candidate header name.
     * @return whether the name is a non-empty HTTP token.
     */
    public static boolean isToken(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean alnum = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!alnum && TOKEN_SYMBOLS.indexOf(c) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param value candidate header value.
     * @return whether the value holds no CR, LF, NUL or other control character except tab.
     */
    public static boolean isSafeValue(String value) {
        if (value == null) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if ((c < 0x20 && c != '\t') || c == 0x7F) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param name  header name.
     * @param value header value.
     * @throws IllegalArgumentException if either part cannot be written on the wire as is.
     */
    public static void requireValid(String name, String value) {
        if (!isToken(name)) {
            throw new IllegalArgumentException("Invalid header name: \"" + name + "\"");
        }
        if (!isSafeValue(value)) {
            throw new IllegalArgumentException("Invalid value for header " + name);
        }
    }
}
