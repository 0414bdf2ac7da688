package com.bko.workoutcalculator.training;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Workout codes reported by the sensors, in the order they are listed in error messages.
 */
public enum WorkoutType {
    RUN("Running", List.of("action", "duration", "weight")),
    SWM("Swimming", List.of("action", "duration", "weight", "length_pool", "count_pool")),
    WLK("SportsWalking", List.of("action", "duration", "weight", "height"));

    private final String displayName;
    private final List<String> parameterNames;

    WorkoutType(String displayName, List<String> parameterNames) {
        this.displayName = displayName;
        this.parameterNames = parameterNames;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Names of the raw sensor values in the positional order the sensors send them.
     */
    public List<String> getParameterNames() {
        return parameterNames;
    }

    public int getArity() {
        return parameterNames.size();
    }

    public static Optional<WorkoutType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.name().equals(code))
                .findFirst();
    }

    public static String supportedCodes() {
        return Arrays.stream(values())
                .map(Enum::name)
                .collect(Collectors.joining(", "));
    }
}
