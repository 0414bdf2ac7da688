package com.bko.workoutcalculator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkoutCalculatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkoutCalculatorApplication.class, args);
    }
}
