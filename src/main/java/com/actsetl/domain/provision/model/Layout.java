package com.actsetl.domain.provision.model;

import java.util.Optional;

/**
 * Indentation of a source paragraph, read from its six-token class descriptor
 * ({@code "hanging margin _ alignment _ _"}).
 *
 * @param hanging   hanging indent in layout units
 * @param margin    left margin in layout units
 * @param alignment text alignment ("left", "center", ...)
 */
public record Layout(int hanging, int margin, String alignment) {

    public static final Layout DEFAULT = new Layout(0, 0, "left");

    /** Layout of the section container itself. */
    public static final Layout SECTION = new Layout(-3, 11, "left");

    private static final int DESCRIPTOR_TOKENS = 6;

    /**
     * Parses a class descriptor. Anything other than six tokens with integer
     * indents yields {@link #DEFAULT}.
     */
    public static Layout parse(String descriptor) {
        return parseDescriptor(descriptor).orElse(DEFAULT);
    }

    /**
     * Parses a class descriptor, empty when it is malformed.
     */
    public static Optional<Layout> parseDescriptor(String descriptor) {
        if (descriptor == null || descriptor.isBlank()) {
            return Optional.empty();
        }
        String[] tokens = descriptor.trim().split("\\s+");
        if (tokens.length != DESCRIPTOR_TOKENS) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Layout(Integer.parseInt(tokens[0]), Integer.parseInt(tokens[1]), tokens[3]));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public int indent() {
        return hanging + margin;
    }

    public boolean isCentered() {
        return "center".equals(alignment);
    }

    /**
     * Inline style for the target paragraph. Layout units are twice the rendered unit.
     */
    public String toStyle() {
        return "text-indent:" + half(hanging) + ";margin-left:" + half(margin) + ";text-align:" + alignment;
    }

    private static String half(int units) {
        if (units % 2 == 0) {
            return Integer.toString(units / 2);
        }
        return Double.toString(units / 2.0);
    }
}
