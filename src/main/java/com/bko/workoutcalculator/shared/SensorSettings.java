package com.bko.workoutcalculator.shared;

public record SensorSettings(String packagesFile) {
    public boolean isPackagesFileConfigured() {
        return packagesFile != null && !packagesFile.isBlank();
    }
}
