package com.bko.workoutcalculator.report.app;

import com.bko.workoutcalculator.report.ReportTrainingUseCase;
import com.bko.workoutcalculator.training.InfoMessage;
import com.bko.workoutcalculator.training.Training;
import org.springframework.stereotype.Service;

import java.io.PrintStream;

@Service
public class ConsoleReportService implements ReportTrainingUseCase {
    private final PrintStream reportOutput;

    public ConsoleReportService(PrintStream reportOutput) {
        this.reportOutput = reportOutput;
    }

    @Override
    public void report(Training training) {
        InfoMessage info = training.buildSummary();
        reportOutput.println(info.formatMessage());
    }
}
