package com.bko.workoutcalculator.sensor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One reading sent by a sensor: the workout code and its raw values in positional order.
 */
public record SensorPackage(String workoutType, List<Number> data) {
    public SensorPackage {
        data = data == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(data));
    }
}
