package com.bko.workoutcalculator.training;

/**
 * Base calculator for a workout recorded by a step or stroke sensor.
 * <p>
 * Distance and mean speed have default formulas; every variant supplies its own calorie formula.
 */
public abstract class Training {
    protected static final double LEN_STEP = 0.65;
    protected static final double M_IN_KM = 1000;
    protected static final double MIN_IN_H = 60;

    private final WorkoutType workoutType;
    protected final int action;
    protected final double duration;
    protected final double weight;

    protected Training(WorkoutType workoutType, int action, double duration, double weight) {
        this.workoutType = workoutType;
        this.action = action;
        this.duration = duration;
        this.weight = weight;
    }

    public WorkoutType getWorkoutType() {
        return workoutType;
    }

    public int getAction() {
        return action;
    }

    public double getDuration() {
        return duration;
    }

    public double getWeight() {
        return weight;
    }

    /**
     * Distance covered by one action unit, in meters.
     */
    protected double getStepLengthMeters() {
        return LEN_STEP;
    }

    public double getDistanceKm() {
        return action * getStepLengthMeters() / M_IN_KM;
    }

    public double getMeanSpeedKmh() {
        return getDistanceKm() / duration;
    }

    public abstract double getCaloriesKcal();

    public InfoMessage buildSummary() {
        return new InfoMessage(
                workoutType.getDisplayName(),
                duration,
                getDistanceKm(),
                getMeanSpeedKmh(),
                getCaloriesKcal()
        );
    }
}
