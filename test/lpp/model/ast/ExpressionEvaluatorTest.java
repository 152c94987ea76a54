package lpp.model.ast;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import lpp.lexer.TokenType;
import lpp.scope.ScopeEntry;
import lpp.util.SourceLocation;

public class ExpressionEvaluatorTest {

	private static final Map<String, ScopeEntry> NO_NAMES = Collections.emptyMap();

	private static NumberNode num(double value) {
		return new NumberNode(SourceLocation.unknown(), value, NumberNode.kindOf(value));
	}

	private static SymbolNode op(Operator operator, Node left, Node right) {
		return new SymbolNode(SourceLocation.unknown(), operator, left, right);
	}

	private static IdentifierNode id(String name) {
		return new IdentifierNode(SourceLocation.unknown(), name, IdentifierNode.Kind.NON_FUNCTION);
	}

	private static double eval(Node node, Map<String, ScopeEntry> names) {
		return ExpressionEvaluator.evaluate(node, names).getNum();
	}

	@Test
	public void testArithmetic() {
		assertThat(eval(op(Operator.ADD, num(2), op(Operator.MULTIPLY, num(3), num(4))), NO_NAMES), is(14.0));
		assertThat(eval(op(Operator.SUBTRACT, num(2), num(5)), NO_NAMES), is(-3.0));
		assertThat(eval(op(Operator.DIVIDE, num(7), num(2)), NO_NAMES), is(3.5));
		assertThat(eval(op(Operator.POWER, num(2), num(10)), NO_NAMES), is(1024.0));
		assertThat(eval(op(Operator.MODULUS, num(17), num(5)), NO_NAMES), is(2.0));
	}

	@Test
	public void testComparisonsAreZeroOrOne() {
		assertThat(eval(op(Operator.LT, num(1), num(2)), NO_NAMES), is(1.0));
		assertThat(eval(op(Operator.GEQ, num(1), num(2)), NO_NAMES), is(0.0));
		assertThat(eval(op(Operator.EQUALS, num(3), num(3)), NO_NAMES), is(1.0));
		assertThat(eval(op(Operator.LOGICAL_AND, num(3), num(0)), NO_NAMES), is(0.0));
		assertThat(eval(op(Operator.LOGICAL_OR, num(3), num(0)), NO_NAMES), is(1.0));
	}

	@Test
	public void testIdentifiersResolveThroughScope() {
		Map<String, ScopeEntry> names = new HashMap<>();
		names.put("volume", ScopeEntry.ofNumber(TokenType.IDENTIFIER, 5));
		assertThat(eval(op(Operator.MULTIPLY, id("volume"), num(2)), names), is(10.0));

		NumberNode folded = ExpressionEvaluator.evaluate(id("volume"), names);
		assertThat(folded.getKind(), is(NumberNode.Kind.INTEGER));
	}

	@Test
	public void testUnitIsCarriedThrough() {
		NumberNode volume = new NumberNode(SourceLocation.unknown(), 5, NumberNode.Kind.INTEGER, Prefix.MILLI, Unit.LITER);
		NumberNode result = ExpressionEvaluator.evaluate(op(Operator.ADD, volume, num(2)), NO_NAMES);
		assertThat(result.getNum(), is(7.0));
		assertThat(result.getPrefix(), is(Prefix.MILLI));
		assertThat(result.getUnit(), is(Unit.LITER));
		assertThat(result.siValue(), is(7.0 * 1e-3));
	}

	@Test
	public void testUndeclaredIdentifier() {
		try {
			ExpressionEvaluator.evaluate(id("missing"), NO_NAMES);
			fail("expected an evaluation issue");
		} catch (EvaluationIssue e) {
			assertThat(e.getProblem(), is("Identifier missing is not declared."));
		}
	}

	@Test
	public void testNonNumericEntry() {
		Map<String, ScopeEntry> names = new HashMap<>();
		names.put("Brew", ScopeEntry.ofText(TokenType.IDENTIFIER, "reaction"));
		try {
			ExpressionEvaluator.evaluate(id("Brew"), names);
			fail("expected an evaluation issue");
		} catch (EvaluationIssue e) {
			assertThat(e.getProblem(), containsString("the value is not a number"));
		}
	}

	@Test
	public void testModulusByZero() {
		try {
			ExpressionEvaluator.evaluate(op(Operator.MODULUS, num(4), num(0)), NO_NAMES);
			fail("expected an evaluation issue");
		} catch (EvaluationIssue e) {
			assertThat(e.getProblem(), is("Modulus by zero."));
		}
	}

	@Test
	public void testDivisionByZero() {
		try {
			ExpressionEvaluator.evaluate(op(Operator.DIVIDE, num(1), num(0)), NO_NAMES);
			fail("expected an evaluation issue");
		} catch (EvaluationIssue e) {
			assertThat(e.getProblem(), is("Division by zero."));
		}
		try {
			ExpressionEvaluator.evaluate(op(Operator.DIVIDE, num(0), op(Operator.SUBTRACT, num(2), num(2))), NO_NAMES);
			fail("expected an evaluation issue");
		} catch (EvaluationIssue e) {
			assertThat(e.getProblem(), is("Division by zero."));
		}
	}

	@Test(expected = EvaluationIssue.class)
	public void testArrowsAreNotConstant() {
		ExpressionEvaluator.evaluate(op(Operator.FORWARD, num(1), num(2)), NO_NAMES);
	}

	@Test(expected = EvaluationIssue.class)
	public void testChemicalsAreNotConstant() {
		ExpressionEvaluator.evaluate(
				new ChemicalNode(SourceLocation.unknown(), "WATER", "H2O", "7732-18-5"), NO_NAMES);
	}
}
