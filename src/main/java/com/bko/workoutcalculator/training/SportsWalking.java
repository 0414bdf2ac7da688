package com.bko.workoutcalculator.training;

public class SportsWalking extends Training {
    private static final double KMH_IN_MS = 0.278;
    private static final double WEIGHT_MULTIPLIER = 0.035;
    private static final double SPEED_HEIGHT_MULTIPLIER = 0.029;
    private static final double CM_IN_M = 100;

    private final double height;

    public SportsWalking(int action, double duration, double weight, double height) {
        super(WorkoutType.WLK, action, duration, weight);
        this.height = height;
    }

    public double getHeight() {
        return height;
    }

    // A zero height yields Infinity or NaN; callers are expected to validate it first.
    @Override
    public double getCaloriesKcal() {
        double speedMs = getMeanSpeedKmh() * KMH_IN_MS;
        return (WEIGHT_MULTIPLIER * weight
                + (Math.pow(speedMs, 2) / (height / CM_IN_M)) * SPEED_HEIGHT_MULTIPLIER * weight)
                * duration * MIN_IN_H;
    }
}
