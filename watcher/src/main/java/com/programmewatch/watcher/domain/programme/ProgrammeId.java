package com.programmewatch.watcher.domain.programme;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Stable identifier of a merchant programme within a market.
 * Numeric ids compare by value and sort before non-numeric ids.
 */
public record ProgrammeId(String value) implements Comparable<ProgrammeId> {

    public ProgrammeId {
        Objects.requireNonNull(value, "value");
        value = value.strip();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Programme id must not be blank");
        }
    }

    public static ProgrammeId of(String value) {
        return new ProgrammeId(value);
    }

    public static ProgrammeId of(long value) {
        return new ProgrammeId(Long.toString(value));
    }

    public boolean isNumeric() {
        return value.chars().allMatch(Character::isDigit);
    }

    @Override
    public int compareTo(ProgrammeId other) {
        var thisNumeric = isNumeric();
        var otherNumeric = other.isNumeric();
        if (thisNumeric && otherNumeric) {
            var byValue = new BigInteger(value).compareTo(new BigInteger(other.value));
            return byValue != 0 ? byValue : value.compareTo(other.value);
        }
        if (thisNumeric != otherNumeric) {
            return thisNumeric ? -1 : 1;
        }
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
