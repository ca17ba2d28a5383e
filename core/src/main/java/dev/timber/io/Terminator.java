/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.timber.io;

/**
 * Record terminator of delimited text: either any of CR, LF and CRLF, or one custom character.
 * Writers end records with CRLF when configured with {@link #any()}.
 */
public final class Terminator {

    private static final int ANY_MARKER = -1;

    private static final Terminator ANY = new Terminator(ANY_MARKER);

    private final int custom;

    private Terminator(int custom) {
        this.custom = custom;
    }

    /**
     * Accept CR, LF or CRLF.
     */
    public static Terminator any() {
        return ANY;
    }

    /**
     * Accept only the given character.
     */
    public static Terminator of(char custom) {
        return new Terminator(custom);
    }

    public boolean isAny() {
        return custom == ANY_MARKER;
    }

    /**
     * The custom terminator character.
     *
     * @throws IllegalStateException if this terminator accepts any of CR, LF and CRLF
     */
    public char custom() {
        if (isAny()) {
            throw new IllegalStateException("Terminator accepts CR, LF and CRLF");
        }
        return (char) custom;
    }

    /**
     * Character sequence written after each record.
     */
    public String sequence() {
        return isAny() ? "\r\n" : String.valueOf((char) custom);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Terminator other && other.custom == custom;
    }

    @Override
    public int hashCode() {
        return custom;
    }

    @Override
    public String toString() {
        return isAny() ? "Terminator(CR|LF|CRLF)" : "Terminator(" + (int) custom + ")";
    }
}
