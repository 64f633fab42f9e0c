package org.metricshub.jvast.frontend.ast;

import static org.junit.Assert.*;

import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

/**
 * Checks, for every statement tag, which constructs the tag accepts.
 * An {@link Identifier} is the smallest node there is, and only event
 * triggers (<code>-&gt; ev;</code>) wrap one.
 */
@RunWith(Parameterized.class)
public class StatementTypeTest {

	/**
	 * @return every statement tag
	 */
	@Parameters(name = "Statement.Type {0}")
	public static Iterable<Statement.Type> statementTypes() {
		return Arrays.asList(Statement.Type.values());
	}

	/** Tag under test */
	@Parameter
	public Statement.Type type;

	@Test
	public void testEmptyStatementAccepted() throws Exception {
		assertTrue(type + " must accept an empty statement", type.accepts(null));
		assertNotNull(type.getConstructClass());
	}

	@Test
	public void testIdentifierOnlyForEventTriggers() throws Exception {
		Identifier event = new Identifier("done");
		assertEquals(type.name(), type == Statement.Type.EVENT_TRIGGER, type.accepts(event));
	}

	@Test
	public void testStatementConstructorsCheckTheTag() throws Exception {
		Identifier event = new Identifier("done");
		if (type == Statement.Type.EVENT_TRIGGER) {
			Statement trigger = new Statement(null, false, false, event, type);
			assertSame(event, trigger.getConstruct(Identifier.class));
		} else {
			assertThrows(AstContractError.class, () -> new Statement(null, false, false, event, type));
		}
	}
}
