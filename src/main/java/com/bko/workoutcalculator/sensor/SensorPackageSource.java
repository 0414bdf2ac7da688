package com.bko.workoutcalculator.sensor;

import java.io.IOException;
import java.util.List;

public interface SensorPackageSource {
    /**
     * Loads the packages to process, in processing order.
     * <p>
     * Command-line arguments of the form {@code CODE:v1,v2,...} take precedence, then the configured
     * packages file, then the built-in sample packages.
     *
     * @param arguments non-option command-line arguments, possibly empty
     * @throws IOException if the configured packages file cannot be read
     */
    List<SensorPackage> loadPackages(List<String> arguments) throws IOException;
}
