package com.gedcomtree.model;

/**
 * A parsed NAME value. {@code full} is the raw value with the surname slashes removed.
 */
public record Name(
    String full,
    String given,
    String surname,
    String suffix
) {
}
