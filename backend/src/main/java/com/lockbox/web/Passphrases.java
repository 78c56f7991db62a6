package com.lockbox.web;

import java.util.Arrays;

/**
 * Request bodies arrive as Strings; the engine takes char[] so it can be wiped
 * after use. This is as far down as the wipe can reach.
 */
final class Passphrases {

    private Passphrases() {
    }

    static char[] toChars(String value) {
        return value == null ? null : value.toCharArray();
    }

    static void wipe(char[]... values) {
        for (char[] value : values) {
            if (value != null) {
                Arrays.fill(value, '\0');
            }
        }
    }
}
