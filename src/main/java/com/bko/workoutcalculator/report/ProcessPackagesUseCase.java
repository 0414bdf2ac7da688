package com.bko.workoutcalculator.report;

import com.bko.workoutcalculator.report.app.BatchReport;
import com.bko.workoutcalculator.sensor.SensorPackage;

import java.util.List;

public interface ProcessPackagesUseCase {
    /**
     * Builds and reports every package in order.
     * <p>
     * Stops at the first failing package by rethrowing its exception, unless continue-on-error is
     * enabled, in which case failures are recorded in the returned report.
     */
    BatchReport process(List<SensorPackage> packages);
}
