package com.bko.workoutcalculator.training;

public class Running extends Training {
    private static final double CALORIES_MEAN_SPEED_MULTIPLIER = 18.0;
    private static final double CALORIES_MEAN_SPEED_SHIFT = 1.79;

    public Running(int action, double duration, double weight) {
        super(WorkoutType.RUN, action, duration, weight);
    }

    @Override
    public double getCaloriesKcal() {
        double meanSpeed = getMeanSpeedKmh();
        return (CALORIES_MEAN_SPEED_MULTIPLIER * meanSpeed + CALORIES_MEAN_SPEED_SHIFT)
                * weight / M_IN_KM * duration * MIN_IN_H;
    }
}
