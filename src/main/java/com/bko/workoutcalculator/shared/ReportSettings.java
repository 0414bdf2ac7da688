package com.bko.workoutcalculator.shared;

public record ReportSettings(boolean continueOnError) {
}
