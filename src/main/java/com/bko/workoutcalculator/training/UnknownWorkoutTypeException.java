package com.bko.workoutcalculator.training;

public class UnknownWorkoutTypeException extends IllegalArgumentException {
    private final String workoutType;

    public UnknownWorkoutTypeException(String workoutType) {
        super("Unknown workout type '" + workoutType + "'. Supported types: " + WorkoutType.supportedCodes());
        this.workoutType = workoutType;
    }

    public String getWorkoutType() {
        return workoutType;
    }
}
