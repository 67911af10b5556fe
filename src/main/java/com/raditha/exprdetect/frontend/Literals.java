package com.raditha.exprdetect.frontend;

import com.raditha.exprdetect.model.TypeKind;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;

/**
 * Decoding of character, string and floating literal spellings.
 */
final class Literals {

    private Literals() {
    }

    /**
     * Bytes denoted by a quoted literal spelling, without the terminating NUL.
     * An encoding prefix is accepted and ignored. Source characters up to
     * U+00FF are the file's own bytes; anything above is written as UTF-8.
     */
    static byte[] decode(String spelling) {
        char quote = spelling.endsWith("'") ? '\'' : '"';
        int open = spelling.indexOf(quote);
        int close = spelling.length() - 1;
        String body = spelling.substring(open + 1, close);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\') {
                if (c <= 0xff) {
                    out.write(c);
                    i++;
                    continue;
                }
                int cp = body.codePointAt(i);
                byte[] utf8 = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8);
                out.write(utf8, 0, utf8.length);
                i += Character.charCount(cp);
                continue;
            }
            i++;
            char e = body.charAt(i);
            switch (e) {
                case 'n' -> { out.write('\n'); i++; }
                case 't' -> { out.write('\t'); i++; }
                case 'r' -> { out.write('\r'); i++; }
                case 'a' -> { out.write(7); i++; }
                case 'b' -> { out.write('\b'); i++; }
                case 'f' -> { out.write('\f'); i++; }
                case 'v' -> { out.write(11); i++; }
                case 'e', 'E' -> { out.write(27); i++; }
                case 'x' -> {
                    int start = ++i;
                    while (i < body.length() && Character.digit(body.charAt(i), 16) >= 0) {
                        i++;
                    }
                    out.write(Integer.parseInt(body.substring(start, i), 16) & 0xff);
                }
                default -> {
                    if (e >= '0' && e <= '7') {
                        int start = i;
                        while (i < body.length() && i - start < 3 && body.charAt(i) >= '0' && body.charAt(i) <= '7') {
                            i++;
                        }
                        out.write(Integer.parseInt(body.substring(start, i), 8) & 0xff);
                    } else {
                        out.write(e);
                        i++;
                    }
                }
            }
        }
        return out.toByteArray();
    }

    /**
     * Value of a character constant. Plain constants have type {@code char}
     * promoted to {@code int}, so bytes are sign-extended; prefixed ones take
     * the code point.
     */
    static int characterValue(String spelling) {
        byte[] bytes = decode(spelling);
        if (bytes.length == 0) {
            return 0;
        }
        if (!spelling.startsWith("'")) {
            return new String(bytes, StandardCharsets.UTF_8).codePointAt(0);
        }
        if (bytes.length == 1) {
            return bytes[0];
        }
        int value = 0;
        for (byte b : bytes) {
            value = (value << 8) | (b & 0xff);
        }
        return value;
    }

    /**
     * Exact value of a floating constant rounded to the significand width of
     * its type: 24 bits for {@code float}, 64 for {@code long double} and 53
     * otherwise. Exponent range limits are not modelled.
     *
     * @param digits the spelling without its type suffix
     * @throws NumberFormatException if the spelling is not a number
     */
    static BigDecimal floatingValue(String digits, TypeKind kind) {
        int bits = switch (kind) {
            case FLOAT -> 24;
            case LONG_DOUBLE -> 64;
            default -> 53;
        };
        BigDecimal exact;
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            boolean hasExponent = digits.indexOf('p') >= 0 || digits.indexOf('P') >= 0;
            exact = new BigDecimal(Double.parseDouble(hasExponent ? digits : digits + "p0"));
        } else {
            exact = new BigDecimal(digits.replace("'", ""));
        }
        return roundToBits(exact, bits);
    }

    private static BigDecimal roundToBits(BigDecimal value, int bits) {
        if (value.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal lower = new BigDecimal(BigInteger.TWO.pow(bits - 1));
        BigDecimal upper = new BigDecimal(BigInteger.TWO.pow(bits));
        int exponent = (int) Math.floor(log2(value)) - (bits - 1);
        BigDecimal scaled = scaleByPowerOfTwo(value, -exponent);
        while (scaled.compareTo(upper) >= 0) {
            exponent++;
            scaled = scaleByPowerOfTwo(value, -exponent);
        }
        while (scaled.compareTo(lower) < 0) {
            exponent--;
            scaled = scaleByPowerOfTwo(value, -exponent);
        }
        BigInteger significand = scaled.setScale(0, RoundingMode.HALF_EVEN).toBigInteger();
        return scaleByPowerOfTwo(new BigDecimal(significand), exponent).stripTrailingZeros();
    }

    private static BigDecimal scaleByPowerOfTwo(BigDecimal value, int n) {
        BigDecimal factor = new BigDecimal(BigInteger.TWO.pow(Math.abs(n)));
        return n >= 0 ? value.multiply(factor) : value.divide(factor);
    }

    private static double log2(BigDecimal value) {
        BigInteger unscaled = value.unscaledValue();
        int shift = Math.max(unscaled.bitLength() - 62, 0);
        double leading = unscaled.shiftRight(shift).doubleValue();
        return (Math.log(leading) - value.scale() * Math.log(10)) / Math.log(2) + shift;
    }
}
