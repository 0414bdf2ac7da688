package com.bko.workoutcalculator.training;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Summary of one completed workout, ready to be shown to the user.
 */
public record InfoMessage(
        String trainingType,
        double duration,
        double distance,
        double speed,
        double calories
) {
    public String formatMessage() {
        return "Тип тренировки: " + trainingType + "; "
                + "Длительность: " + formatDecimal(duration) + " ч.; "
                + "Дистанция: " + formatDecimal(distance) + " км; "
                + "Ср. скорость: " + formatDecimal(speed) + " км/ч; "
                + "Потрачено ккал: " + formatDecimal(calories) + ".";
    }

    // Rounds the exact binary value, so the output does not depend on the default locale.
    static String formatDecimal(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        String text = new BigDecimal(value)
                .setScale(3, RoundingMode.HALF_EVEN)
                .toPlainString();
        // Negative values rounding to zero, and -0.0 itself, keep their sign.
        if (Math.copySign(1.0, value) < 0 && !text.startsWith("-")) {
            return "-" + text;
        }
        return text;
    }
}
