package com.bashnorm.normalize;

/**
 * Switches of the normalizer.
 *
 * @param normalizeDigits        replace digit runs in arguments with {@code numberPlaceholder}
 * @param normalizeLongPatterns  replace arguments containing spaces with {@code longPatternPlaceholder}
 * @param recoverQuotation       keep the user's quotes around quoted arguments
 * @param numberPlaceholder      replacement for digit runs
 * @param longPatternPlaceholder replacement for long patterns
 */
public record NormalizerOptions(boolean normalizeDigits,
                                boolean normalizeLongPatterns,
                                boolean recoverQuotation,
                                String numberPlaceholder,
                                String longPatternPlaceholder) {
    public static final String NUMBER_PLACEHOLDER = "_NUM";
    public static final String LONG_PATTERN_PLACEHOLDER = "_LONG_PATTERN";

    public static NormalizerOptions defaults() {
        return new NormalizerOptions(true, true, true, NUMBER_PLACEHOLDER, LONG_PATTERN_PLACEHOLDER);
    }

    /** Keeps argument text as written, apart from quote recovery. */
    public static NormalizerOptions verbatim() {
        return new NormalizerOptions(false, false, true, NUMBER_PLACEHOLDER, LONG_PATTERN_PLACEHOLDER);
    }

    public NormalizerOptions withNormalizeDigits(boolean value) {
        return new NormalizerOptions(value, normalizeLongPatterns, recoverQuotation, numberPlaceholder, longPatternPlaceholder);
    }

    public NormalizerOptions withNormalizeLongPatterns(boolean value) {
        return new NormalizerOptions(normalizeDigits, value, recoverQuotation, numberPlaceholder, longPatternPlaceholder);
    }

    public NormalizerOptions withRecoverQuotation(boolean value) {
        return new NormalizerOptions(normalizeDigits, normalizeLongPatterns, value, numberPlaceholder, longPatternPlaceholder);
    }

    public NormalizerOptions withNumberPlaceholder(String value) {
        return new NormalizerOptions(normalizeDigits, normalizeLongPatterns, recoverQuotation, value, longPatternPlaceholder);
    }
}
