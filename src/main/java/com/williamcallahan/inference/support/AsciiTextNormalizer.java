package com.williamcallahan.inference.support;

/**
 * Locale-independent normalization for provider names, model identifiers and capability names.
 *
 * <p>Only ASCII letters are case-folded so identifiers compare the same under every default locale.</p>
 */
public final class AsciiTextNormalizer {

    private static final int CASE_OFFSET = 'a' - 'A';

    private AsciiTextNormalizer() {
    }

    /**
     * Converts ASCII uppercase letters to lowercase, leaving other characters unchanged.
     *
     * @param text input text (may be null)
     * @return lowercased text, or empty string if null
     */
    public static String toLowerAscii(String text) {
        return shiftAscii(text, 'A', 'Z', CASE_OFFSET);
    }

    private static String shiftAscii(String text, char from, char to, int offset) {
        if (text == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(text.length());
        for (int index = 0; index < text.length(); index++) {
            char current = text.charAt(index);
            if (current >= from && current <= to) {
                normalized.append((char) (current + offset));
            } else {
                normalized.append(current);
            }
        }
        return normalized.toString();
    }
}
