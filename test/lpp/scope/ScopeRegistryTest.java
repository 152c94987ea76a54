package lpp.scope;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import lpp.InternalCompilerError;
import lpp.formatters.IndentingWriter;
import lpp.lexer.TokenType;

public class ScopeRegistryTest {

	@Test
	public void testInnerScopesShadowOuterOnes() {
		ScopeRegistry scopes = new ScopeRegistry();
		scopes.openScope("global").put("rate", TokenType.IDENTIFIER, 1);
		scopes.current().put("volume", TokenType.IDENTIFIER, 5);
		scopes.openScope("Brew").put("rate", TokenType.PARAM, 2);

		Map<String, ScopeEntry> view = scopes.lookup();
		assertThat(view.get("rate"), is(ScopeEntry.ofNumber(TokenType.PARAM, 2)));
		assertThat(view.get("volume").getNumber(), is(5.0));
		assertFalse(view.containsKey("missing"));

		scopes.closeScope();
		assertThat(scopes.lookup().get("rate").getNumber(), is(1.0));
	}

	@Test
	public void testClosedScopesAreRegistered() {
		ScopeRegistry scopes = new ScopeRegistry();
		Scope global = scopes.openScope("global");
		global.put("Enzyme", TokenType.IDENTIFIER, "class");
		scopes.openScope("Enzyme").put("rate", TokenType.PARAM, 2);
		Scope enzyme = scopes.closeScope();
		scopes.closeScope();

		assertThat(scopes.getScope("Enzyme"), is(enzyme));
		assertThat(enzyme.getParent(), is(global));
		assertThat(global.getChildren().size(), is(1));
		assertThat(global.getParent(), nullValue());
		assertThat(enzyme.get("rate").getNumber(), is(2.0));
		assertThat(enzyme.get("Enzyme"), nullValue());
		assertThat(scopes.getScopes().keySet().size(), is(2));
	}

	@Test
	public void testPutReplacesValue() {
		Scope scope = new Scope("global");
		scope.put("level", TokenType.IDENTIFIER, 3);
		scope.put("level", TokenType.IDENTIFIER, 4);
		assertThat(scope.get("level").getNumber(), is(4.0));
		assertThat(scope.getSymbols().size(), is(1));
	}

	@Test(expected = InternalCompilerError.class)
	public void testClosingWithoutOpenScope() {
		new ScopeRegistry().closeScope();
	}

	@Test(expected = IllegalStateException.class)
	public void testTextEntryHasNoNumber() {
		ScopeEntry.ofText(TokenType.CHEMICAL, "chemical").getNumber();
	}

	@Test
	public void testChainMapWritesOnlyToMembers() {
		Map<String, Integer> parent = new HashMap<>();
		parent.put("outer", 1);
		ChainMap<String, Integer> chain = new ChainMap<>(new HashMap<>(), parent);
		chain.put("inner", 2);
		chain.put("outer", 3);
		assertThat(chain.get("outer"), is(3));
		assertThat(parent.get("outer"), is(1));
		assertFalse(parent.containsKey("inner"));
		assertThat(chain.size(), is(2));
	}

	@Test
	public void testFormat() throws IOException {
		ScopeRegistry scopes = new ScopeRegistry();
		scopes.openScope("global").put("level", TokenType.IDENTIFIER, 3);
		scopes.openScope("Brew").put("k", TokenType.PARAM, 2);
		scopes.closeScope();
		scopes.closeScope();

		StringWriter sw = new StringWriter();
		scopes.format(new IndentingWriter(sw));
		String lf = System.lineSeparator();
		assertThat(sw.toString(), is("scope Brew (in global)" + lf +
				"  k = PARAM 2.0" + lf +
				"scope global" + lf +
				"  level = IDENTIFIER 3.0"));
	}
}
