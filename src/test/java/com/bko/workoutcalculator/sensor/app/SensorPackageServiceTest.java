package com.bko.workoutcalculator.sensor.app;

import com.bko.workoutcalculator.sensor.SensorPackage;
import com.bko.workoutcalculator.shared.AppSettings;
import com.bko.workoutcalculator.shared.ReportSettings;
import com.bko.workoutcalculator.shared.SensorSettings;
import com.bko.workoutcalculator.shared.TrainingSettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SensorPackageServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void fallsBackToSamplePackagesInOrder() throws Exception {
        SensorPackageService service = new SensorPackageService(AppSettings.defaults(), new ObjectMapper());

        List<SensorPackage> packages = service.loadPackages(List.of());

        assertEquals(3, packages.size());
        assertEquals("SWM", packages.get(0).workoutType());
        assertEquals(List.of(720, 1, 80, 25, 40), packages.get(0).data());
        assertEquals("RUN", packages.get(1).workoutType());
        assertEquals(List.of(15000, 1, 75), packages.get(1).data());
        assertEquals("WLK", packages.get(2).workoutType());
        assertEquals(List.of(9000, 1, 75, 180), packages.get(2).data());
    }

    @Test
    void readsPackagesFromJsonFile() throws Exception {
        Path file = tempDir.resolve("packages.json");
        Files.writeString(file, "["
                + "{\"workout_type\": \"RUN\", \"data\": [15000, 1, 75], \"device\": \"watch\"},"
                + "{\"workout_type\": \"WLK\", \"data\": [9000, 1.5, 75, 180]}"
                + "]", StandardCharsets.UTF_8);
        SensorPackageService service = new SensorPackageService(settingsWithFile(file.toString()), new ObjectMapper());

        List<SensorPackage> packages = service.loadPackages(List.of());

        assertEquals(2, packages.size());
        assertEquals("RUN", packages.get(0).workoutType());
        assertEquals(15000, packages.get(0).data().get(0).intValue());
        assertEquals("WLK", packages.get(1).workoutType());
        assertEquals(1.5, packages.get(1).data().get(1).doubleValue());
        assertEquals(4, packages.get(1).data().size());
    }

    @Test
    void missingPackagesFileFails() {
        SensorPackageService service = new SensorPackageService(
                settingsWithFile(tempDir.resolve("absent.json").toString()), new ObjectMapper());

        IOException error = assertThrows(IOException.class, () -> service.loadPackages(List.of()));

        assertTrue(error.getMessage().contains("absent.json"));
    }

    @Test
    void argumentsTakePrecedenceOverFile() throws Exception {
        SensorPackageService service = new SensorPackageService(
                settingsWithFile(tempDir.resolve("absent.json").toString()), new ObjectMapper());

        List<SensorPackage> packages = service.loadPackages(List.of("RUN:15000,1,75", "SWM: 720, 1, 80, 25, 40"));

        assertEquals(2, packages.size());
        assertEquals("RUN", packages.get(0).workoutType());
        assertEquals(List.of(new BigDecimal("15000"), new BigDecimal("1"), new BigDecimal("75")), packages.get(0).data());
        assertEquals("SWM", packages.get(1).workoutType());
        assertEquals(5, packages.get(1).data().size());
    }

    @Test
    void parseArgumentKeepsEmptyValueList() {
        SensorPackage sensorPackage = SensorPackageService.parseArgument("XYZ:");

        assertEquals("XYZ", sensorPackage.workoutType());
        assertTrue(sensorPackage.data().isEmpty());
    }

    @Test
    void malformedArgumentsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> SensorPackageService.parseArgument("RUN15000"));
        assertThrows(IllegalArgumentException.class, () -> SensorPackageService.parseArgument(":1,2,3"));
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> SensorPackageService.parseArgument("RUN:15000,one,75"));
        assertTrue(error.getMessage().contains("one"));
    }

    private AppSettings settingsWithFile(String file) {
        return new AppSettings(
                new SensorSettings(file),
                new TrainingSettings(true),
                new ReportSettings(false)
        );
    }
}
