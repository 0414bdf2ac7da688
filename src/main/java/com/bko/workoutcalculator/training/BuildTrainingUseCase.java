package com.bko.workoutcalculator.training;

import java.util.List;

public interface BuildTrainingUseCase {
    /**
     * Builds the calculator for a workout code from the raw sensor values.
     *
     * @param workoutType short workout code such as {@code RUN}, {@code SWM} or {@code WLK}
     * @param data        raw sensor values in the order listed by {@link WorkoutType#getParameterNames()}
     * @return the calculator for that workout
     * @throws UnknownWorkoutTypeException  if the code is not recognized
     * @throws ArityMismatchException       if the number of values does not match the workout
     * @throws InvalidWorkoutDataException  if a value has the wrong type or is out of range
     */
    Training buildCalculator(String workoutType, List<? extends Number> data);
}
