package com.bko.workoutcalculator.training;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SwimmingTest {
    private static final double TOLERANCE = 1e-9;

    @Test
    void computesDistanceSpeedAndCalories() {
        Swimming swimming = new Swimming(720, 1, 80, 25, 40);

        assertEquals(0.9936, swimming.getDistanceKm(), TOLERANCE);
        assertEquals(1.0, swimming.getMeanSpeedKmh(), TOLERANCE);
        assertEquals(336.0, swimming.getCaloriesKcal(), TOLERANCE);
    }

    @Test
    void distanceUsesStrokeLength() {
        Swimming swimming = new Swimming(1000, 1, 80, 25, 40);

        assertEquals(1000 * 1.38 / 1000, swimming.getDistanceKm(), TOLERANCE);
    }

    @Test
    void meanSpeedIgnoresStrokeCount() {
        Swimming few = new Swimming(10, 1.5, 80, 50, 30);
        Swimming many = new Swimming(5000, 1.5, 80, 50, 30);

        assertEquals(few.getMeanSpeedKmh(), many.getMeanSpeedKmh());
        assertEquals(50.0 * 30 / 1000 / 1.5, many.getMeanSpeedKmh(), TOLERANCE);
        assertEquals(few.getCaloriesKcal(), many.getCaloriesKcal());
    }

    @Test
    void summaryKeepsPoolSpeedAndStrokeDistance() {
        InfoMessage info = new Swimming(720, 1, 80, 25, 40).buildSummary();

        assertEquals("Swimming", info.trainingType());
        assertEquals(0.9936, info.distance(), TOLERANCE);
        assertEquals(1.0, info.speed(), TOLERANCE);
        assertEquals(336.0, info.calories(), TOLERANCE);
    }
}
