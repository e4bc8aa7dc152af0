package com.lynkvertx.batteryopt.service;

import com.lynkvertx.batteryopt.dto.ProfileSeriesDTO;
import com.lynkvertx.batteryopt.dto.TouPeriodDTO;
import com.lynkvertx.batteryopt.exception.InvalidInputException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns a {@link ProfileSeriesDTO} into a per-timestep array.
 *
 * Explicit values are passed through unchanged (length checks happen later in
 * validation). Flat and time-of-use series are expanded over the horizon,
 * with timestep t starting at startMinutes + t * dt (wrapping past midnight).
 */
@Component
public class TariffProfileFactory {

    private static final int MINUTES_PER_DAY = 24 * 60;

    /**
     * Resolve one series.
     *
     * @param name          Series name, used in error messages
     * @param series        The series as supplied by the caller
     * @param timesteps     Horizon length N
     * @param timestepHours Duration of one timestep in hours
     * @param startMinutes  Time of day of timestep 0, in minutes since midnight
     */
    public double[] resolve(String name, ProfileSeriesDTO series, int timesteps, double timestepHours, int startMinutes) {
        if (series == null) {
            throw new InvalidInputException(name + " is required");
        }
        int forms = (series.getValues() != null ? 1 : 0)
            + (series.getFlatValue() != null ? 1 : 0)
            + (series.getTouPeriods() != null ? 1 : 0);
        if (forms != 1) {
            throw new InvalidInputException(name + " must give exactly one of values, flatValue or touPeriods");
        }

        if (series.getValues() != null) {
            return toArray(name, series.getValues());
        }
        if (series.getFlatValue() != null) {
            return flat(series.getFlatValue(), timesteps);
        }
        return timeOfUse(name, series.getTouPeriods(), timesteps, timestepHours, startMinutes);
    }

    public double[] flat(double value, int timesteps) {
        double[] values = new double[timesteps];
        Arrays.fill(values, value);
        return values;
    }

    /**
     * Expand time-of-use periods over the horizon. A timestep takes the value of the
     * first period whose range contains its start time; a timestep no range covers
     * gets the average of all period values.
     */
    public double[] timeOfUse(String name, List<TouPeriodDTO> periods, int timesteps, double timestepHours, int startMinutes) {
        List<TouPeriod> parsed = parsePeriods(name, periods);
        double[] values = new double[timesteps];
        for (int t = 0; t < timesteps; t++) {
            values[t] = valueAt(slotStartMinutes(t, timestepHours, startMinutes), parsed);
        }
        return values;
    }

    /** Minutes since midnight at which timestep t starts */
    public static int slotStartMinutes(int t, double timestepHours, int startMinutes) {
        long minutes = startMinutes + Math.round(t * timestepHours * 60);
        return (int) (minutes % MINUTES_PER_DAY);
    }

    /** Convert "HH:mm" to total minutes since midnight */
    public static int timeToMinutes(String hhmm) {
        if (hhmm == null || hhmm.isEmpty()) return 0;
        String[] parts = hhmm.split(":");
        try {
            int minutes = Integer.parseInt(parts[0].trim()) * 60 + (parts.length > 1 ? Integer.parseInt(parts[1].trim()) : 0);
            if (minutes < 0 || minutes > MINUTES_PER_DAY) {
                throw new InvalidInputException("Time out of range: " + hhmm);
            }
            return minutes;
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Time must be HH:mm: " + hhmm);
        }
    }

    /** Convert minutes since midnight to "HH:mm" */
    public static String minutesToTime(int minutes) {
        int h = (minutes / 60) % 24;
        int m = minutes % 60;
        return String.format("%02d:%02d", h, m);
    }

    private List<TouPeriod> parsePeriods(String name, List<TouPeriodDTO> periods) {
        if (periods.isEmpty()) {
            throw new InvalidInputException(name + " touPeriods must not be empty");
        }
        List<TouPeriod> result = new ArrayList<>();
        for (TouPeriodDTO dto : periods) {
            if (dto.getValue() == null) {
                throw new InvalidInputException(name + " period " + dto.getPeriodType() + " has no value");
            }
            List<int[]> ranges = new ArrayList<>();
            if (dto.getTimeRanges() != null) {
                for (TouPeriodDTO.TimeRangeEntry range : dto.getTimeRanges()) {
                    if (range.getStart() != null && range.getEnd() != null) {
                        ranges.add(new int[]{ timeToMinutes(range.getStart()), timeToMinutes(range.getEnd()) });
                    }
                }
            }
            result.add(new TouPeriod(dto.getPeriodType(), ranges, dto.getValue()));
        }
        return result;
    }

    private double valueAt(int minutes, List<TouPeriod> periods) {
        for (TouPeriod period : periods) {
            for (int[] range : period.timeRanges) {
                if (range[0] <= range[1]) {
                    if (minutes >= range[0] && minutes < range[1]) {
                        return period.value;
                    }
                } else {
                    // Wraps around midnight
                    if (minutes >= range[0] || minutes < range[1]) {
                        return period.value;
                    }
                }
            }
        }
        return periods.stream().mapToDouble(p -> p.value).average().orElse(0.0);
    }

    private static double[] toArray(String name, List<Double> values) {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            Double value = values.get(i);
            if (value == null) {
                throw new InvalidInputException(String.format("%s[%d] must not be null", name, i));
            }
            result[i] = value;
        }
        return result;
    }

    /** Parsed time-of-use period */
    static class TouPeriod {
        String periodType;
        List<int[]> timeRanges; // each int[2] = {startMinute, endMinute}
        double value;

        TouPeriod(String periodType, List<int[]> timeRanges, double value) {
            this.periodType = periodType;
            this.timeRanges = timeRanges;
            this.value = value;
        }
    }
}
