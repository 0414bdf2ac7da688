package com.bko.workoutcalculator.training;

public class Swimming extends Training {
    private static final double STROKE_LENGTH = 1.38;
    private static final double MEAN_SPEED_SHIFT = 1.1;
    private static final double SPEED_MULTIPLIER = 2.0;

    private final double lengthPool;
    private final int countPool;

    public Swimming(int action, double duration, double weight, double lengthPool, int countPool) {
        super(WorkoutType.SWM, action, duration, weight);
        this.lengthPool = lengthPool;
        this.countPool = countPool;
    }

    public double getLengthPool() {
        return lengthPool;
    }

    public int getCountPool() {
        return countPool;
    }

    @Override
    protected double getStepLengthMeters() {
        return STROKE_LENGTH;
    }

    /**
     * Speed over the pool laps swum. The stroke count does not take part.
     */
    @Override
    public double getMeanSpeedKmh() {
        return lengthPool * countPool / M_IN_KM / duration;
    }

    @Override
    public double getCaloriesKcal() {
        return (getMeanSpeedKmh() + MEAN_SPEED_SHIFT) * SPEED_MULTIPLIER * weight * duration;
    }
}
