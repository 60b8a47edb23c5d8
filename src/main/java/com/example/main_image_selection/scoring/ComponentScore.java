package com.example.main_image_selection.scoring;

/**
 * Raw value of a component.
 *
 * @param value     component value, expected in {@code [0, 1]}.
 * @param defaulted {@code true} when the value is the default for a missing attribute.
 */
public record ComponentScore(double value, boolean defaulted) {

    public static ComponentScore of(double value) {
        return new ComponentScore(value, false);
    }

    public static ComponentScore defaulted(double value) {
        return new ComponentScore(value, true);
    }
}
