package com.bko.workoutcalculator.sensor.app;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SensorPackageJson {
    @JsonProperty("workout_type")
    private String workoutType;
    private List<Number> data;

    public String getWorkoutType() { return workoutType; }
    public void setWorkoutType(String workoutType) { this.workoutType = workoutType; }
    public List<Number> getData() { return data; }
    public void setData(List<Number> data) { this.data = data; }
}
