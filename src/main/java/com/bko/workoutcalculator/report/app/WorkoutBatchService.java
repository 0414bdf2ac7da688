package com.bko.workoutcalculator.report.app;

import com.bko.workoutcalculator.report.ProcessPackagesUseCase;
import com.bko.workoutcalculator.report.ReportTrainingUseCase;
import com.bko.workoutcalculator.sensor.SensorPackage;
import com.bko.workoutcalculator.shared.AppSettings;
import com.bko.workoutcalculator.training.BuildTrainingUseCase;
import com.bko.workoutcalculator.training.Training;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class WorkoutBatchService implements ProcessPackagesUseCase {
    private static final Logger logger = LoggerFactory.getLogger(WorkoutBatchService.class);

    private final BuildTrainingUseCase buildTrainingUseCase;
    private final ReportTrainingUseCase reportTrainingUseCase;
    private final AppSettings settings;

    public WorkoutBatchService(BuildTrainingUseCase buildTrainingUseCase,
                               ReportTrainingUseCase reportTrainingUseCase,
                               AppSettings settings) {
        this.buildTrainingUseCase = buildTrainingUseCase;
        this.reportTrainingUseCase = reportTrainingUseCase;
        this.settings = settings;
    }

    @Override
    public BatchReport process(List<SensorPackage> packages) {
        BatchReport report = new BatchReport();
        if (packages == null || packages.isEmpty()) {
            report.info("No packages to process.");
            return report;
        }

        logger.info("Processing {} packages", packages.size());
        for (int i = 0; i < packages.size(); i++) {
            SensorPackage sensorPackage = packages.get(i);
            try {
                Training training = buildTrainingUseCase.buildCalculator(sensorPackage.workoutType(), sensorPackage.data());
                reportTrainingUseCase.report(training);
                report.addProcessed(1);
            } catch (RuntimeException e) {
                if (!settings.isContinueOnError()) {
                    throw e;
                }
                logger.error("Package {} ({}) failed", i + 1, sensorPackage.workoutType(), e);
                report.addFailed(1);
                report.error("Package " + (i + 1) + " (" + sensorPackage.workoutType() + ") failed: " + e.getMessage());
            }
        }

        report.info("Processed " + report.getProcessed() + " of " + packages.size() + " packages.");
        logger.info("Processed {} packages, {} failed", report.getProcessed(), report.getFailed());
        return report;
    }
}
