package com.lockbox.crypto;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;

/**
 * Random password generation and a rough entropy-based strength estimate.
 */
public class PasswordGenerator {

    public static final int DEFAULT_LENGTH = 16;
    public static final int MIN_LENGTH = 4;
    public static final int MAX_LENGTH = 256;

    static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
    static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    static final String DIGITS = "0123456789";
    static final String SYMBOLS = "!@#$%^&*()_+-=[]{}|;:,.<>?";
    static final String AMBIGUOUS = "0O1lI|";

    private final SecureRandom random;

    public PasswordGenerator() {
        this(new SecureRandom());
    }

    public PasswordGenerator(SecureRandom random) {
        this.random = random;
    }

    public record Options(int length,
                          boolean uppercase,
                          boolean lowercase,
                          boolean digits,
                          boolean symbols,
                          boolean excludeAmbiguous) {

        public static Options defaults() {
            return new Options(DEFAULT_LENGTH, true, true, true, true, true);
        }
    }

    public record Strength(String rating, double entropyBits) {}

    /**
     * Generates a password containing at least one character of every selected class.
     * With no class selected, letters and digits are used.
     */
    public String generate(Options options) {
        if (options.length() < MIN_LENGTH || options.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("length must be between " + MIN_LENGTH + " and " + MAX_LENGTH);
        }

        List<String> classes = new ArrayList<>();
        if (options.lowercase()) classes.add(LOWER);
        if (options.uppercase()) classes.add(UPPER);
        if (options.digits()) classes.add(DIGITS);
        if (options.symbols()) classes.add(SYMBOLS);
        if (classes.isEmpty()) {
            classes = List.of(LOWER, UPPER, DIGITS);
        }
        if (options.excludeAmbiguous()) {
            classes = classes.stream().map(PasswordGenerator::withoutAmbiguous).toList();
        }

        String alphabet = String.join("", classes);
        char[] out = new char[options.length()];
        int i = 0;
        for (String charClass : classes) {
            out[i++] = pick(charClass);
        }
        for (; i < out.length; i++) {
            out[i] = pick(alphabet);
        }
        // Fisher-Yates so the guaranteed characters are not always at the front
        for (int j = out.length - 1; j > 0; j--) {
            int k = random.nextInt(j + 1);
            char tmp = out[j];
            out[j] = out[k];
            out[k] = tmp;
        }
        return new String(out);
    }

    /**
     * Entropy is length x log2(charset size); below 30 bits is weak, below 60 medium,
     * below 90 strong, anything else very strong.
     */
    public Strength estimateStrength(String password) {
        if (password == null || password.isEmpty()) {
            return new Strength("weak", 0.0);
        }
        int charset = 0;
        if (password.chars().anyMatch(Character::isLowerCase)) charset += 26;
        if (password.chars().anyMatch(Character::isUpperCase)) charset += 26;
        if (password.chars().anyMatch(Character::isDigit)) charset += 10;
        if (password.chars().anyMatch(c -> SYMBOLS.indexOf(c) >= 0)) charset += SYMBOLS.length();

        double entropy = charset == 0 ? 0.0 : password.length() * (Math.log(charset) / Math.log(2));
        String rating;
        if (entropy < 30) {
            rating = "weak";
        } else if (entropy < 60) {
            rating = "medium";
        } else if (entropy < 90) {
            rating = "strong";
        } else {
            rating = "very_strong";
        }
        return new Strength(rating, entropy);
    }

    private char pick(String alphabet) {
        return alphabet.charAt(random.nextInt(alphabet.length()));
    }

    private static String withoutAmbiguous(String charClass) {
        StringBuilder sb = new StringBuilder(charClass.length());
        for (char c : charClass.toCharArray()) {
            if (AMBIGUOUS.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
