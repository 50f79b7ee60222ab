package com.bmsedge.analytics.model;

import com.bmsedge.analytics.exception.InvalidParameterException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable date-ordered sequence of observations with at most one value per date.
 */
public final class ObservationSeries {

    private static final ObservationSeries EMPTY = new ObservationSeries(Collections.emptyList());

    private final List<Observation> observations;

    private ObservationSeries(List<Observation> sorted) {
        this.observations = Collections.unmodifiableList(sorted);
    }

    public static ObservationSeries empty() {
        return EMPTY;
    }

    /**
     * Sorts the observations by date.
     *
     * @throws InvalidParameterException when two observations share a date
     */
    public static ObservationSeries of(List<Observation> observations) {
        List<Observation> sorted = new ArrayList<>(observations);
        sorted.sort(Comparator.comparing(Observation::getDate));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).getDate().equals(sorted.get(i - 1).getDate())) {
                throw new InvalidParameterException("Duplicate observation date: " + sorted.get(i).getDate());
            }
        }
        return new ObservationSeries(sorted);
    }

    public static ObservationSeries of(List<LocalDate> dates, double[] values) {
        if (dates.size() != values.length) {
            throw new InvalidParameterException(String.format(
                    "Dates and values differ in length: %d != %d", dates.size(), values.length));
        }
        List<Observation> list = new ArrayList<>(dates.size());
        for (int i = 0; i < values.length; i++) {
            list.add(new Observation(dates.get(i), values[i]));
        }
        return of(list);
    }

    public List<Observation> getObservations() {
        return observations;
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>(observations.size());
        for (Observation o : observations) {
            dates.add(o.getDate());
        }
        return dates;
    }

    /**
     * @return a fresh copy of the values in date order
     */
    public double[] values() {
        double[] values = new double[observations.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = observations.get(i).getValue();
        }
        return values;
    }

    public Map<LocalDate, Double> toMap() {
        Map<LocalDate, Double> map = new LinkedHashMap<>();
        for (Observation o : observations) {
            map.put(o.getDate(), o.getValue());
        }
        return map;
    }

    public LocalDate firstDate() {
        return observations.isEmpty() ? null : observations.get(0).getDate();
    }

    public LocalDate lastDate() {
        return observations.isEmpty() ? null : observations.get(observations.size() - 1).getDate();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObservationSeries)) return false;
        return observations.equals(((ObservationSeries) o).observations);
    }

    @Override
    public int hashCode() {
        return observations.hashCode();
    }

    @Override
    public String toString() {
        return "ObservationSeries{size=" + observations.size()
                + ", from=" + firstDate() + ", to=" + lastDate() + "}";
    }
}
