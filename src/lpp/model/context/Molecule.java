package lpp.model.context;

import java.util.NavigableMap;
import java.util.OptionalDouble;

/**
 * A species tracked by the simulation. A molecule belongs to exactly one compartment and keeps its position in
 * that compartment's molecule list.
 */
public class Molecule {

	private final Compartment compartment;
	private final String name;
	private final int indexInCompartment;
	private Double initialCount;
	private final FixedCountHandler fixedCountHandler;

	public Molecule(Compartment compartment, String name, int indexInCompartment) {
		if (compartment == null) {
			throw new IllegalArgumentException("molecule " + name + " must belong to a compartment");
		}
		this.compartment = compartment;
		this.name = name;
		this.indexInCompartment = indexInCompartment;
		this.fixedCountHandler = new FixedCountHandler(this);
	}

	public Molecule(Compartment compartment, String name, int indexInCompartment, double initialCount) {
		this(compartment, name, indexInCompartment);
		this.initialCount = initialCount;
	}

	public Compartment getCompartment() {
		return compartment;
	}

	public int getIndexInCompartment() {
		return indexInCompartment;
	}

	public String getName() {
		return name;
	}

	public boolean hasInitialCount() {
		return initialCount != null;
	}

	/**
	 * @throws IllegalStateException if no initial count was assigned; check {@link #hasInitialCount()} first
	 */
	public double getInitialCount() {
		if (initialCount == null) {
			throw new IllegalStateException("Molecule " + name +
					" was asked for its initial count, but its initial count has not yet been specified.");
		}
		return initialCount;
	}

	public void setInitialCount(double initialCount) {
		this.initialCount = initialCount;
	}

	public FixedCountHandler getFixedCountHandler() {
		return fixedCountHandler;
	}

	public OptionalDouble getBaseline() {
		return fixedCountHandler.getBaseline();
	}

	public NavigableMap<Double, Double> getChangePoints() {
		return fixedCountHandler.getChangePoints();
	}

	public NavigableMap<Double, OptionalDouble> getIntervalPoints() {
		return fixedCountHandler.getIntervalPoints();
	}

	@Override
	public String toString() {
		return "Molecule [" + name + " in " + compartment.getName() + "]";
	}
}
