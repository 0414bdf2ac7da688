package com.bko.workoutcalculator.training.app;

import com.bko.workoutcalculator.shared.AppSettings;
import com.bko.workoutcalculator.training.ArityMismatchException;
import com.bko.workoutcalculator.training.BuildTrainingUseCase;
import com.bko.workoutcalculator.training.InvalidWorkoutDataException;
import com.bko.workoutcalculator.training.Running;
import com.bko.workoutcalculator.training.SportsWalking;
import com.bko.workoutcalculator.training.Swimming;
import com.bko.workoutcalculator.training.Training;
import com.bko.workoutcalculator.training.UnknownWorkoutTypeException;
import com.bko.workoutcalculator.training.WorkoutType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class TrainingDispatcherService implements BuildTrainingUseCase {
    private static final Logger logger = LoggerFactory.getLogger(TrainingDispatcherService.class);

    private final AppSettings settings;

    public TrainingDispatcherService(AppSettings settings) {
        this.settings = settings;
    }

    @Override
    public Training buildCalculator(String workoutType, List<? extends Number> data) {
        WorkoutType type = WorkoutType.fromCode(workoutType)
                .orElseThrow(() -> new UnknownWorkoutTypeException(workoutType));
        int actual = data == null ? 0 : data.size();
        if (actual != type.getArity()) {
            throw new ArityMismatchException(type, actual);
        }

        RawValues values = new RawValues(type, data, settings.isStrictValidation());
        logger.debug("Building {} calculator from {}", type.getDisplayName(), data);
        switch (type) {
            case RUN:
                return new Running(
                        values.count(0),
                        values.positive(1),
                        values.positive(2)
                );
            case WLK:
                return new SportsWalking(
                        values.count(0),
                        values.positive(1),
                        values.positive(2),
                        values.positive(3)
                );
            case SWM:
                return new Swimming(
                        values.count(0),
                        values.positive(1),
                        values.positive(2),
                        values.positive(3),
                        values.count(4)
                );
            default:
                throw new UnknownWorkoutTypeException(workoutType);
        }
    }

    private static final class RawValues {
        private final WorkoutType type;
        private final List<? extends Number> data;
        private final boolean strict;

        private RawValues(WorkoutType type, List<? extends Number> data, boolean strict) {
            this.type = type;
            this.data = data;
            this.strict = strict;
        }

        int count(int index) {
            double value = value(index);
            if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
                throw invalid(index, "must be a whole number but was " + value);
            }
            if (strict && value < 0) {
                throw invalid(index, "must not be negative but was " + value);
            }
            return (int) value;
        }

        double positive(int index) {
            double value = value(index);
            if (strict && !(value > 0)) {
                throw invalid(index, "must be positive but was " + value);
            }
            return value;
        }

        private double value(int index) {
            Number number = data.get(index);
            if (number == null) {
                throw invalid(index, "is missing");
            }
            double value = number.doubleValue();
            if (strict && !Double.isFinite(value)) {
                throw invalid(index, "must be finite but was " + value);
            }
            return value;
        }

        private InvalidWorkoutDataException invalid(int index, String message) {
            return new InvalidWorkoutDataException(type, type.getParameterNames().get(index), message);
        }
    }
}
