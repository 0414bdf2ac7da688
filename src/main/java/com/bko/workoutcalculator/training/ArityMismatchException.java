package com.bko.workoutcalculator.training;

public class ArityMismatchException extends IllegalArgumentException {
    private final WorkoutType workoutType;
    private final int actual;

    public ArityMismatchException(WorkoutType workoutType, int actual) {
        super(workoutType.name() + " expects " + workoutType.getArity() + " values "
                + workoutType.getParameterNames() + " but got " + actual);
        this.workoutType = workoutType;
        this.actual = actual;
    }

    public WorkoutType getWorkoutType() {
        return workoutType;
    }

    public int getExpected() {
        return workoutType.getArity();
    }

    public int getActual() {
        return actual;
    }
}
