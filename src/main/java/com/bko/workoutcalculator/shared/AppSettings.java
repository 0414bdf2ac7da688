package com.bko.workoutcalculator.shared;

public record AppSettings(SensorSettings sensor, TrainingSettings training, ReportSettings report) {
    public static AppSettings defaults() {
        return new AppSettings(
                new SensorSettings(null),
                new TrainingSettings(true),
                new ReportSettings(false)
        );
    }

    public boolean isStrictValidation() {
        return training == null || training.strictValidation();
    }

    public boolean isContinueOnError() {
        return report != null && report.continueOnError();
    }
}
