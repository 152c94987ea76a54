package lpp.model.context;

import lpp.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableMap;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Records how the count of one molecule is pinned over simulated time.
 *
 * There are three kinds of assignment:
 * <ul>
 *     <li>a baseline, {@code m[:] = v}, holding the count at v for the whole run;</li>
 *     <li>change points, {@code m[t] = v}, setting the count to v at time t and letting it evolve after;</li>
 *     <li>intervals, {@code m[a:b] = v}, holding the count at v from a until b.</li>
 * </ul>
 *
 * Intervals may overlap. Where they do, the one declared last wins, and {@link #getIntervalPoints()} flattens
 * them into the times at which the fixed count changes.
 */
public class FixedCountHandler {

	private static final Logger logger = Logger.getLogger(FixedCountHandler.class.getName());

	private final Molecule molecule;

	private Double baseline;
	private final NavigableMap<Double, Double> changePoints = new TreeMap<>();
	private final List<Interval> intervals = new ArrayList<>();
	private NavigableMap<Double, OptionalDouble> intervalPoints;

	private static final class Interval {
		final double start;
		final double end;
		final double value;
		final int index;

		Interval(double start, double end, double value, int index) {
			this.start = start;
			this.end = end;
			this.value = value;
			this.index = index;
		}
	}

	private static final class Event {
		final double time;
		final boolean isEnd;
		final Interval interval;

		Event(double time, boolean isEnd, Interval interval) {
			this.time = time;
			this.isEnd = isEnd;
			this.interval = interval;
		}
	}

	private static final class Segment {
		final double start;
		double end;
		final OptionalDouble value;

		Segment(double start, double end, OptionalDouble value) {
			this.start = start;
			this.end = end;
			this.value = value;
		}
	}

	FixedCountHandler(Molecule molecule) {
		this.molecule = molecule;
	}

	public OptionalDouble getBaseline() {
		return baseline == null ? OptionalDouble.empty() : OptionalDouble.of(baseline);
	}

	/**
	 * Fixes the count for the whole run. This is also the molecule's initial count.
	 */
	public void setBaseline(double value) {
		if (baseline != null) {
			logger.warning("assignment to molecule " + molecule.getName() + " of fixed count " + value +
					" shadows previous assignment of count " + baseline);
		}
		baseline = value;
		molecule.setInitialCount(value);
		molecule.getCompartment().setHasConstantMolecules(true);
	}

	public NavigableMap<Double, Double> getChangePoints() {
		return Collections.unmodifiableNavigableMap(changePoints);
	}

	/**
	 * Sets the count to value at time. A change at time 0 is also the molecule's initial count.
	 *
	 * @param location where the assignment was written, for error reporting
	 */
	public void addChangePoint(double time, double value, SourceLocation location) {
		if (Double.isNaN(time) || Double.isInfinite(time)) {
			throw new ContextBuildingIssue(location, "Assignment to molecule " + molecule.getName() + " of count " +
					value + " at time " + time + " has invalid non-finite time.");
		}
		if (time < 0) {
			throw new ContextBuildingIssue(location, "Assignment to molecule " + molecule.getName() + " of count " +
					value + " at time " + time + " has invalid negative time.");
		}
		Double previous = changePoints.put(time, value);
		if (previous != null) {
			logger.warning("assignment to molecule " + molecule.getName() + " of count " + value + " at time " + time +
					" shadows previous assignment of count " + previous);
		}
		if (time == 0) {
			molecule.setInitialCount(value);
		}
		molecule.getCompartment().setHasChangedMolecules(true);
	}

	/**
	 * Fixes the count to value between start and end. An interval covering all time is a baseline.
	 *
	 * @param end the end time, or {@link Double#POSITIVE_INFINITY} for an interval that never ends
	 * @param location where the assignment was written, for error reporting
	 */
	public void addInterval(double value, double start, double end, SourceLocation location) {
		String assignment = "Assignment to molecule " + molecule.getName() + " of count " + value +
				" at times (start, end) = (" + start + ", " + end + ")";
		if (Double.isNaN(start) || Double.isInfinite(start) || Double.isNaN(end)) {
			throw new ContextBuildingIssue(location, assignment + " has invalid non-finite time.");
		} else if (start < 0) {
			throw new ContextBuildingIssue(location, assignment + " has invalid negative start time.");
		} else if (end < 0) {
			throw new ContextBuildingIssue(location, assignment + " has invalid negative end time.");
		} else if (end < start) {
			throw new ContextBuildingIssue(location, assignment + " has end time less than start time.");
		}

		if (start == 0 && Double.isInfinite(end)) {
			setBaseline(value);
		} else {
			intervals.add(new Interval(start, end, value, intervals.size()));
			intervalPoints = null;
			molecule.getCompartment().setHasFixedMolecules(true);
		}
	}

	/**
	 * @return the start time of each stretch of time over which the fixed count is constant, mapped to that
	 * count, or to an empty value where no interval applies. The first key is 0 unless there are no intervals,
	 * in which case the map is empty.
	 */
	public NavigableMap<Double, OptionalDouble> getIntervalPoints() {
		if (intervalPoints == null) {
			intervalPoints = Collections.unmodifiableNavigableMap(flattenIntervals());
		}
		return intervalPoints;
	}

	private NavigableMap<Double, OptionalDouble> flattenIntervals() {
		NavigableMap<Double, OptionalDouble> points = new TreeMap<>();
		if (intervals.isEmpty()) {
			return points;
		}

		List<Event> events = new ArrayList<>();
		for (Interval interval : intervals) {
			events.add(new Event(interval.start, false, interval));
			if (!Double.isInfinite(interval.end)) {
				events.add(new Event(interval.end, true, interval));
			}
		}
		// starts sort before ends at the same time
		events.sort(Comparator.<Event>comparingDouble(e -> e.time)
				.thenComparing(e -> e.isEnd)
				.thenComparingInt(e -> e.interval.index));

		List<Segment> segments = new ArrayList<>();
		List<Interval> active = new ArrayList<>();
		double segmentStart = 0;
		for (Event event : events) {
			segments.add(new Segment(segmentStart, event.time, latestValue(active)));
			if (!event.isEnd) {
				active.add(event.interval);
			} else if (!active.remove(event.interval)) {
				throw new ContextBuildingIssue(SourceLocation.unknown(),
						"Closing constant molecule count declaration that doesn't exist.");
			}
			segmentStart = event.time;
		}
		segments.add(new Segment(segmentStart, Double.POSITIVE_INFINITY, latestValue(active)));

		List<Segment> merged = new ArrayList<>();
		for (Segment segment : segments) {
			if (segment.start == segment.end) {
				continue;
			}
			Segment previous = merged.isEmpty() ? null : merged.get(merged.size() - 1);
			if (previous != null && previous.value.equals(segment.value)) {
				previous.end = segment.end;
			} else {
				merged.add(segment);
			}
		}

		for (Segment segment : merged) {
			points.put(segment.start, segment.value);
		}
		return points;
	}

	private static OptionalDouble latestValue(List<Interval> active) {
		Interval latest = null;
		for (Interval interval : active) {
			if (latest == null || interval.index > latest.index) {
				latest = interval;
			}
		}
		return latest == null ? OptionalDouble.empty() : OptionalDouble.of(latest.value);
	}
}
