package com.bko.workoutcalculator.report.app;

import com.bko.workoutcalculator.report.ProcessPackagesUseCase;
import com.bko.workoutcalculator.sensor.SensorPackage;
import com.bko.workoutcalculator.sensor.SensorPackageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

@Component
public class WorkoutReportRunner implements ApplicationRunner {
    private static final Logger logger = LoggerFactory.getLogger(WorkoutReportRunner.class);

    private final SensorPackageSource sensorPackageSource;
    private final ProcessPackagesUseCase processPackagesUseCase;

    public WorkoutReportRunner(SensorPackageSource sensorPackageSource, ProcessPackagesUseCase processPackagesUseCase) {
        this.sensorPackageSource = sensorPackageSource;
        this.processPackagesUseCase = processPackagesUseCase;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> arguments = args == null ? List.of() : args.getNonOptionArgs();
        List<SensorPackage> packages = sensorPackageSource.loadPackages(arguments);
        BatchReport report = processPackagesUseCase.process(packages);
        if (!report.isSuccess()) {
            for (String message : report.getMessages()) {
                logger.warn(message);
            }
            throw new IllegalStateException(report.getFailed() + " of " + packages.size() + " packages failed.");
        }
    }
}
