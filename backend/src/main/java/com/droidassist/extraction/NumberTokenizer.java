package com.droidassist.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds numeric tokens in element text for one value kind.
 *
 * An element either holds one or more "number+unit" tokens of the target kind,
 * or is a bare number in its entirety. Anything else (numbers followed by a
 * foreign unit, numbers embedded in prose) yields no token.
 */
final class NumberTokenizer {

    private static final String NUMBER = "(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)";

    private static final Pattern CURRENCY_PREFIXED = Pattern.compile("¥\\s*" + NUMBER);
    private static final Pattern CURRENCY_SUFFIXED = Pattern.compile(NUMBER + "\\s*(元|¥)");
    private static final Pattern DATA_SUFFIXED = Pattern.compile(
        NUMBER + "\\s*(TB|GB|MB|T|G|M)(?![A-Za-z])", Pattern.CASE_INSENSITIVE);
    /** 2G, 4G, 5G: network generations, not allowances */
    private static final Pattern NETWORK_GENERATION = Pattern.compile("\\d\\s*G", Pattern.CASE_INSENSITIVE);
    private static final Pattern BARE = Pattern.compile(NUMBER);
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private NumberTokenizer() {
    }

    static boolean hasDigit(String text) {
        return DIGIT.matcher(text).find();
    }

    static List<NumberToken> tokenize(String text, ValueKind kind) {
        if (!hasDigit(text)) {
            return List.of();
        }
        List<NumberToken> tokens = kind == ValueKind.CURRENCY ? currencyTokens(text) : dataTokens(text);
        if (!tokens.isEmpty()) {
            return tokens;
        }
        return bare(text).map(List::of).orElse(List.of());
    }

    private static List<NumberToken> currencyTokens(String text) {
        List<NumberToken> tokens = new ArrayList<>();
        Matcher prefixed = CURRENCY_PREFIXED.matcher(text);
        while (prefixed.find()) {
            tokens.add(token(prefixed.group(), prefixed.group(1), ValueUnit.CURRENCY));
        }
        if (tokens.isEmpty()) {
            Matcher suffixed = CURRENCY_SUFFIXED.matcher(text);
            while (suffixed.find()) {
                tokens.add(token(suffixed.group(), suffixed.group(1), ValueUnit.CURRENCY));
            }
        }
        return tokens;
    }

    private static List<NumberToken> dataTokens(String text) {
        List<NumberToken> tokens = new ArrayList<>();
        Matcher m = DATA_SUFFIXED.matcher(text);
        while (m.find()) {
            if (NETWORK_GENERATION.matcher(m.group()).matches()) {
                continue;
            }
            ValueUnit unit = ValueUnit.fromToken(m.group(2)).orElseThrow();
            tokens.add(token(m.group(), m.group(1), unit));
        }
        return tokens;
    }

    private static Optional<NumberToken> bare(String text) {
        Matcher m = BARE.matcher(text);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(token(text, m.group(1), null));
    }

    private static NumberToken token(String raw, String amount, ValueUnit unit) {
        String plain = amount.replace(",", "");
        return new NumberToken(raw.strip(), plain, Double.parseDouble(plain), unit);
    }
}
