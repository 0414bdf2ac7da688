package com.bko.workoutcalculator.report.app;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class BatchReport {
    private final List<String> messages = new ArrayList<>();
    private boolean success = true;
    private int processed;
    private int failed;

    public void info(String message) {
        messages.add(message);
    }

    public void error(String message) {
        messages.add("ERROR: " + message);
        success = false;
    }

    public List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public boolean isSuccess() {
        return success;
    }

    public int getProcessed() {
        return processed;
    }

    public void addProcessed(int count) {
        this.processed += count;
    }

    public int getFailed() {
        return failed;
    }

    public void addFailed(int count) {
        this.failed += count;
    }
}
