package com.bko.workoutcalculator.report;

import com.bko.workoutcalculator.training.Training;

public interface ReportTrainingUseCase {
    /**
     * Prints the formatted summary of the given workout as one line.
     */
    void report(Training training);
}
