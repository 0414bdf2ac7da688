package com.bko.workoutcalculator.training;

public class InvalidWorkoutDataException extends IllegalArgumentException {
    private final WorkoutType workoutType;
    private final String parameter;

    public InvalidWorkoutDataException(WorkoutType workoutType, String parameter, String message) {
        super(workoutType.name() + " " + parameter + " " + message);
        this.workoutType = workoutType;
        this.parameter = parameter;
    }

    public WorkoutType getWorkoutType() {
        return workoutType;
    }

    public String getParameter() {
        return parameter;
    }
}
