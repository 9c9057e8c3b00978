package com.sporewriter.model.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Canonical node identifier: either an integer of any size or an opaque string token.
 *
 * Instances are only ever produced already normalized, so two ids that denote
 * the same logical node are always {@code equals}.
 */
public final class NodeId implements Comparable<NodeId> {

    private final BigInteger number;
    private final String token;

    private NodeId(BigInteger number, String token) {
        this.number = number;
        this.token = token;
    }

    public static NodeId of(long number) {
        return new NodeId(BigInteger.valueOf(number), null);
    }

    public static NodeId of(BigInteger number) {
        Objects.requireNonNull(number, "number");
        return new NodeId(number, null);
    }

    public static NodeId token(String token) {
        Objects.requireNonNull(token, "token");
        return new NodeId(null, token);
    }

    public boolean isNumeric() {
        return number != null;
    }

    /**
     * Numeric value of this id.
     *
     * @throws IllegalStateException if this id is a token
     */
    public BigInteger numericValue() {
        if (number == null) {
            throw new IllegalStateException("Node id '" + token + "' is not numeric");
        }
        return number;
    }

    /**
     * Raw wire value: a {@link Long} for numeric ids that fit, a {@link BigInteger}
     * for larger ones, a {@link String} otherwise.
     */
    @JsonValue
    public Object raw() {
        if (number == null) {
            return token;
        }
        return number.bitLength() < Long.SIZE ? (Object) number.longValue() : number;
    }

    /**
     * Numbers sort before tokens; numbers by value, tokens lexicographically.
     */
    @Override
    public int compareTo(NodeId other) {
        if (isNumeric() && other.isNumeric()) {
            return number.compareTo(other.number);
        }
        if (isNumeric() != other.isNumeric()) {
            return isNumeric() ? -1 : 1;
        }
        return token.compareTo(other.token);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeId)) return false;
        NodeId that = (NodeId) o;
        return Objects.equals(number, that.number) && Objects.equals(token, that.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, token);
    }

    @Override
    public String toString() {
        return String.valueOf(raw());
    }
}
