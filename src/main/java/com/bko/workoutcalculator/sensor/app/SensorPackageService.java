package com.bko.workoutcalculator.sensor.app;

import com.bko.workoutcalculator.sensor.SensorPackage;
import com.bko.workoutcalculator.sensor.SensorPackageSource;
import com.bko.workoutcalculator.shared.AppSettings;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Service
public class SensorPackageService implements SensorPackageSource {
    private static final Logger logger = LoggerFactory.getLogger(SensorPackageService.class);
    private static final List<SensorPackage> SAMPLE_PACKAGES = List.of(
            new SensorPackage("SWM", List.<Number>of(720, 1, 80, 25, 40)),
            new SensorPackage("RUN", List.<Number>of(15000, 1, 75)),
            new SensorPackage("WLK", List.<Number>of(9000, 1, 75, 180))
    );

    private final AppSettings settings;
    private final ObjectMapper objectMapper;

    public SensorPackageService(AppSettings settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<SensorPackage> loadPackages(List<String> arguments) throws IOException {
        if (arguments != null && !arguments.isEmpty()) {
            logger.info("Reading {} packages from command-line arguments", arguments.size());
            return parseArguments(arguments);
        }
        if (settings.sensor() != null && settings.sensor().isPackagesFileConfigured()) {
            return readPackagesFile(Path.of(settings.sensor().packagesFile()));
        }
        logger.info("No packages given, using {} sample packages", SAMPLE_PACKAGES.size());
        return SAMPLE_PACKAGES;
    }

    private List<SensorPackage> readPackagesFile(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Packages file not found: " + file);
        }
        logger.info("Reading packages from {}", file);
        List<SensorPackageJson> entries = objectMapper.readValue(file.toFile(), new TypeReference<List<SensorPackageJson>>() {
        });
        List<SensorPackage> packages = new ArrayList<>();
        if (entries == null) {
            return packages;
        }
        for (SensorPackageJson entry : entries) {
            if (entry == null) {
                continue;
            }
            packages.add(new SensorPackage(entry.getWorkoutType(), entry.getData()));
        }
        return packages;
    }

    private List<SensorPackage> parseArguments(List<String> arguments) {
        List<SensorPackage> packages = new ArrayList<>();
        for (String argument : arguments) {
            packages.add(parseArgument(argument));
        }
        return packages;
    }

    static SensorPackage parseArgument(String argument) {
        int separator = argument == null ? -1 : argument.indexOf(':');
        if (separator <= 0) {
            throw new IllegalArgumentException("Expected CODE:v1,v2,... but got '" + argument + "'");
        }
        String code = argument.substring(0, separator).trim();
        String rawValues = argument.substring(separator + 1).trim();
        List<Number> values = new ArrayList<>();
        if (!rawValues.isEmpty()) {
            for (String raw : rawValues.split(",")) {
                try {
                    values.add(new BigDecimal(raw.trim()));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid number '" + raw.trim() + "' in '" + argument + "'", e);
                }
            }
        }
        return new SensorPackage(code, values);
    }
}
