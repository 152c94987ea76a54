package lpp.model.context;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.NavigableMap;
import java.util.OptionalDouble;
import java.util.TreeMap;

import org.junit.Before;
import org.junit.Test;

import lpp.util.SourceLocation;

public class FixedCountHandlerTest {

	private static final double INF = Double.POSITIVE_INFINITY;

	private Compartment compartment;
	private Molecule molecule;
	private FixedCountHandler handler;

	@Before
	public void setUp() {
		compartment = new Compartment(null, "global", CompartmentType.NON_SPATIAL);
		molecule = new Molecule(compartment, "glycogen", 0);
		compartment.addMolecule(molecule);
		handler = molecule.getFixedCountHandler();
	}

	private void interval(double value, double start, double end) {
		handler.addInterval(value, start, end, SourceLocation.unknown());
	}

	/**
	 * Builds the expected points from alternating times and counts; a null count means no fixed count.
	 */
	private static NavigableMap<Double, OptionalDouble> points(Object... timesAndCounts) {
		NavigableMap<Double, OptionalDouble> points = new TreeMap<>();
		for (int i = 0; i < timesAndCounts.length; i += 2) {
			Double count = (Double) timesAndCounts[i + 1];
			points.put((Double) timesAndCounts[i], count == null ? OptionalDouble.empty() : OptionalDouble.of(count));
		}
		return points;
	}

	@Test
	public void testNoIntervals() {
		assertTrue(handler.getIntervalPoints().isEmpty());
		assertFalse(compartment.hasFixedMolecules());
	}

	@Test
	public void testSingleInterval() {
		interval(3, 10, 20);
		assertThat(handler.getIntervalPoints(), is(points(0.0, null, 10.0, 3.0, 20.0, null)));
		assertTrue(compartment.hasFixedMolecules());
	}

	@Test
	public void testIntervalFromZero() {
		interval(2, 0, 5);
		assertThat(handler.getIntervalPoints(), is(points(0.0, 2.0, 5.0, null)));
	}

	@Test
	public void testOpenEndedInterval() {
		interval(4, 5, INF);
		assertThat(handler.getIntervalPoints(), is(points(0.0, null, 5.0, 4.0)));
	}

	@Test
	public void testLaterIntervalWins() {
		interval(1, 0, 10);
		interval(2, 5, 15);
		assertThat(handler.getIntervalPoints(), is(points(0.0, 1.0, 5.0, 2.0, 15.0, null)));
	}

	@Test
	public void testLaterIntervalWinsWhenDeclaredInsideEarlierOne() {
		interval(1, 0, 20);
		interval(2, 5, 10);
		assertThat(handler.getIntervalPoints(), is(points(0.0, 1.0, 5.0, 2.0, 10.0, 1.0, 20.0, null)));
	}

	@Test
	public void testEarlierIntervalHiddenWhereTheyOverlap() {
		interval(2, 5, 15);
		interval(1, 0, 10);
		assertThat(handler.getIntervalPoints(), is(points(0.0, 1.0, 10.0, 2.0, 15.0, null)));
	}

	@Test
	public void testAdjacentEqualCountsMerge() {
		interval(3, 0, 5);
		interval(3, 5, 10);
		assertThat(handler.getIntervalPoints(), is(points(0.0, 3.0, 10.0, null)));
	}

	@Test
	public void testZeroWidthIntervalHasNoEffect() {
		interval(7, 5, 5);
		assertThat(handler.getIntervalPoints(), is(points(0.0, null)));
	}

	@Test
	public void testPointsAreCachedUntilNextInterval() {
		interval(3, 10, 20);
		NavigableMap<Double, OptionalDouble> first = handler.getIntervalPoints();
		assertSame(first, handler.getIntervalPoints());

		interval(5, 30, 40);
		assertThat(handler.getIntervalPoints(),
				is(points(0.0, null, 10.0, 3.0, 20.0, null, 30.0, 5.0, 40.0, null)));
	}

	@Test
	public void testWholeRunIntervalIsBaseline() {
		interval(4, 0, INF);
		assertThat(handler.getBaseline(), is(OptionalDouble.of(4)));
		assertThat(molecule.getInitialCount(), is(4.0));
		assertTrue(compartment.hasConstantMolecules());
		assertFalse(compartment.hasFixedMolecules());
		assertTrue(handler.getIntervalPoints().isEmpty());
	}

	@Test
	public void testChangePoints() {
		handler.addChangePoint(0, 5, SourceLocation.unknown());
		handler.addChangePoint(10, 2, SourceLocation.unknown());
		handler.addChangePoint(10, 3, SourceLocation.unknown());
		assertThat(molecule.getInitialCount(), is(5.0));
		assertThat(handler.getChangePoints().size(), is(2));
		assertThat(handler.getChangePoints().get(10.0), is(3.0));
		assertTrue(compartment.hasChangedMolecules());
	}

	@Test
	public void testChangePointAfterZeroLeavesInitialCountUnset() {
		handler.addChangePoint(10, 2, SourceLocation.unknown());
		assertFalse(molecule.hasInitialCount());
	}

	@Test
	public void testNegativeChangePoint() {
		try {
			handler.addChangePoint(-1, 2, SourceLocation.unknown());
			fail("expected a context building issue");
		} catch (ContextBuildingIssue e) {
			assertThat(e.getProblem(), containsString("has invalid negative time."));
		}
	}

	@Test
	public void testNegativeStart() {
		try {
			interval(2, -1, 5);
			fail("expected a context building issue");
		} catch (ContextBuildingIssue e) {
			assertThat(e.getProblem(), containsString("has invalid negative start time."));
		}
	}

	@Test
	public void testNegativeEnd() {
		try {
			interval(2, 0, -5);
			fail("expected a context building issue");
		} catch (ContextBuildingIssue e) {
			assertThat(e.getProblem(), containsString("has invalid negative end time."));
		}
	}

	@Test
	public void testEndBeforeStart() {
		try {
			interval(2, 10, 5);
			fail("expected a context building issue");
		} catch (ContextBuildingIssue e) {
			assertThat(e.getProblem(), is("Assignment to molecule glycogen of count 2.0 at times (start, end) = " +
					"(10.0, 5.0) has end time less than start time."));
		}
	}

	@Test
	public void testNonFiniteChangePoint() {
		try {
			handler.addChangePoint(Double.NaN, 2, SourceLocation.unknown());
			fail("expected a context building issue");
		} catch (ContextBuildingIssue e) {
			assertThat(e.getProblem(), containsString("has invalid non-finite time."));
		}
		try {
			handler.addChangePoint(INF, 2, SourceLocation.unknown());
			fail("expected a context building issue");
		} catch (ContextBuildingIssue e) {
			assertThat(e.getProblem(), containsString("has invalid non-finite time."));
		}
		assertTrue(handler.getChangePoints().isEmpty());
	}

	@Test
	public void testNonFiniteIntervalBounds() {
		try {
			interval(2, Double.NaN, 5);
			fail("expected a context building issue");
		} catch (ContextBuildingIssue e) {
			assertThat(e.getProblem(), containsString("has invalid non-finite time."));
		}
		try {
			interval(2, 0, Double.NaN);
			fail("expected a context building issue");
		} catch (ContextBuildingIssue e) {
			assertThat(e.getProblem(), containsString("has invalid non-finite time."));
		}
		try {
			interval(2, INF, INF);
			fail("expected a context building issue");
		} catch (ContextBuildingIssue e) {
			assertThat(e.getProblem(), containsString("has invalid non-finite time."));
		}
		assertTrue(handler.getIntervalPoints().isEmpty());
	}
}
