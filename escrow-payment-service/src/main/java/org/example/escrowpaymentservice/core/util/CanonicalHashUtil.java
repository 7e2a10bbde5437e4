package org.example.escrowpaymentservice.core.util;

import org.example.escrowpaymentservice.core.exception.PaymentValidationException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Input and result hashes shared with the escrow contract.
 * <p>
 * {@code hash = sha256(serialize(payload) + ";" + salt)} in lowercase hex. Strings are taken
 * verbatim, everything else is written as canonical JSON: object keys sorted at every level,
 * no whitespace, numbers without exponent or trailing zeros. Maps and collections are walked
 * as they are; other objects are first written out as JSON by Jackson.
 */
public final class CanonicalHashUtil {

    private CanonicalHashUtil() {}

    public static final String SEPARATOR = ";";
    public static final String ALGORITHM = "SHA-256";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .build();

    private static final HexFormat HEX = HexFormat.of();

    public static String hash(Object payload, String salt) {
        if (salt == null || salt.isBlank()) {
            throw new PaymentValidationException("Hash salt (identifierFromPurchaser) must not be blank");
        }
        if (payload == null) {
            throw new PaymentValidationException("Hash payload must not be null");
        }

        String preimage = serialize(payload) + SEPARATOR + salt;
        return HEX.formatHex(sha256(preimage.getBytes(StandardCharsets.UTF_8)));
    }

    public static String serialize(Object payload) {
        if (payload instanceof String text) {
            return text;
        }
        return canonicalJson(payload);
    }

    public static String canonicalJson(Object payload) {
        StringBuilder out = new StringBuilder();
        write(payload, out);
        return out.toString();
    }

    private static void write(Object value, StringBuilder out) {
        if (value == null) {
            out.append("null");
        } else if (value instanceof String text) {
            out.append(MAPPER.writeValueAsString(text));
        } else if (value instanceof Boolean flag) {
            out.append(flag);
        } else if (value instanceof Number number) {
            out.append(formatNumber(number));
        } else if (value instanceof Map<?, ?> map) {
            writeObject(map, out);
        } else if (value instanceof Collection<?> items) {
            writeArray(items.iterator(), out);
        } else {
            write(toTree(value), out);
        }
    }

    //Through JSON text rather than convertValue, which widens float fields to their double value
    private static Object toTree(Object value) {
        return MAPPER.readValue(MAPPER.writeValueAsString(value), Object.class);
    }

    private static void writeObject(Map<?, ?> map, StringBuilder out) {
        Map<String, Object> sorted = new TreeMap<>();
        map.forEach((key, entry) -> sorted.put(String.valueOf(key), entry));

        out.append('{');
        boolean first = true;
        for (Map.Entry<String, Object> entry : sorted.entrySet()) {
            if (!first) out.append(',');
            first = false;
            out.append(MAPPER.writeValueAsString(entry.getKey())).append(':');
            write(entry.getValue(), out);
        }
        out.append('}');
    }

    private static void writeArray(Iterator<?> items, StringBuilder out) {
        out.append('[');
        while (items.hasNext()) {
            write(items.next(), out);
            if (items.hasNext()) out.append(',');
        }
        out.append(']');
    }

    static String formatNumber(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger) {
            return number.toString();
        }

        BigDecimal decimal;
        if (number instanceof BigDecimal big) {
            decimal = big;
        } else {
            double primitive = number.doubleValue();
            if (Double.isNaN(primitive) || Double.isInfinite(primitive)) {
                throw new PaymentValidationException("Cannot hash non-finite number: " + number);
            }
            decimal = new BigDecimal(number.toString());
        }

        BigDecimal stripped = decimal.stripTrailingZeros();
        if (stripped.scale() <= 0) {
            return stripped.toBigIntegerExact().toString();
        }
        return stripped.toPlainString();
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance(ALGORITHM).digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
