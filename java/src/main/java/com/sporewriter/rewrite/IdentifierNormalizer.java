package com.sporewriter.rewrite;

import com.sporewriter.model.graph.NodeId;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Canonicalizes raw request identifiers into {@link NodeId}s.
 *
 * Integers pass through, strings holding a base-10 integer become that
 * integer, and any other string stays an opaque token. Applied to every id in
 * every graph and mapping before it is compared or looked up.
 */
public final class IdentifierNormalizer {

    private IdentifierNormalizer() {
    }

    /**
     * Normalize a raw identifier.
     *
     * @param raw Integer, Long, BigInteger, integral number or String
     * @return Canonical node id
     * @throws IllegalArgumentException if {@code raw} is null
     */
    public static NodeId normalize(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Node id must not be null");
        }
        if (raw instanceof NodeId) {
            return (NodeId) raw;
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return NodeId.of(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger) {
            return NodeId.of((BigInteger) raw);
        }
        if (raw instanceof Number) {
            return fromNumber((Number) raw);
        }
        String text = raw.toString();
        try {
            return NodeId.of(new BigInteger(text));
        } catch (NumberFormatException e) {
            return NodeId.token(text);
        }
    }

    private static NodeId fromNumber(Number number) {
        try {
            BigDecimal value = new BigDecimal(number.toString());
            return NodeId.of(value.toBigIntegerExact());
        } catch (ArithmeticException | NumberFormatException e) {
            // fractional or not finite
            return NodeId.token(number.toString());
        }
    }
}
