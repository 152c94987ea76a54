package lpp.formatters;

import static lpp.model.context.ContextTestUtils.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringWriter;

import org.junit.Test;

public class NodeFormattingVisitorTest {

	private static String format(String text) throws IOException {
		StringWriter w = new StringWriter();
		new NodeFormattingVisitor(new IndentingWriter(w)).writeStatements(parse(text));
		return w.toString();
	}

	@Test
	public void testFoldedAssignments() throws IOException {
		assertThat(format("level = 3;\nlevel = level * 2;"), is(String.join(System.lineSeparator(),
				"Symbol =",
				"  left:",
				"    Identifier level",
				"  right:",
				"    Number 3",
				"Symbol =",
				"  left:",
				"    Identifier level",
				"  right:",
				"    Number 6")));
	}
}
