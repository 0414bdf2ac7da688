package com.bko.workoutcalculator.shared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StreamUtils;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

@Configuration
public class SettingsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SettingsConfiguration.class);
    private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "1");
    private static final Set<String> FALSE_VALUES = Set.of("false", "no", "0");

    @Bean
    public AppSettings appSettings(EnvConfig envConfig) {
        SensorSettings sensor = new SensorSettings(
                envConfig.get("workout.packages_file")
        );
        TrainingSettings training = new TrainingSettings(
                parseFlag("workout.strict_validation", envConfig.get("workout.strict_validation"), true)
        );
        ReportSettings report = new ReportSettings(
                parseFlag("workout.continue_on_error", envConfig.get("workout.continue_on_error"), false)
        );
        return new AppSettings(sensor, training, report);
    }

    // Closing the context closes this stream but must leave System.out open.
    @Bean
    public PrintStream reportOutput() {
        return new PrintStream(StreamUtils.nonClosing(System.out), true, StandardCharsets.UTF_8);
    }

    static boolean parseFlag(String key, String value, boolean defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        String normalized = value.trim().toLowerCase(Locale.US);
        if (TRUE_VALUES.contains(normalized)) {
            return true;
        }
        if (FALSE_VALUES.contains(normalized)) {
            return false;
        }
        logger.warn("Ignoring unrecognized value '{}' for {}, using {}", value, key, defaultValue);
        return defaultValue;
    }
}
