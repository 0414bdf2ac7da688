package com.bko.workoutcalculator.shared;

public record TrainingSettings(boolean strictValidation) {
}
