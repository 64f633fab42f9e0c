package org.metricshub.jvast.frontend;

import static org.junit.Assert.*;
import static org.metricshub.jvast.AstTestSupport.*;

import org.junit.Test;
import org.metricshub.jvast.arena.AstAllocationException;
import org.metricshub.jvast.arena.AstArena;
import org.metricshub.jvast.frontend.ast.Attribute;
import org.metricshub.jvast.frontend.ast.EventTimingControl;
import org.metricshub.jvast.frontend.ast.Identifier;
import org.metricshub.jvast.frontend.ast.ModuleDeclaration;
import org.metricshub.jvast.frontend.ast.PortDeclaration;
import org.metricshub.jvast.frontend.ast.SourceText;
import org.metricshub.jvast.frontend.ast.Statement;
import org.metricshub.jvast.frontend.ast.TimingControlStatement;

public class AstTreeLifecycleTest {

	@Test
	public void testModuleTree() throws Exception {
		AstFactory factory = factory();
		ModuleDeclaration counter = counterModule(factory);
		SourceText root = factory.newSourceText(listOf(factory, counter), null);

		assertSame(counter, root.findModule("counter"));
		assertNull(root.findModule("missing"));
		assertEquals(0, root.getPrimitives().count());
		assertSame(root, counter.getParent());

		assertEquals(1, counter.getParameters().count());
		assertEquals(2, counter.getPorts().count());
		PortDeclaration q = counter.getPorts().get(1);
		assertTrue(q.isReg());
		assertNotNull(q.getRange());
		assertSame(counter, q.getParent());

		Statement always = counter.getItems().get(0);
		assertEquals(Statement.Type.ALWAYS, always.getType());
		Statement timed = always.getConstruct(Statement.class);
		EventTimingControl control = timed.getConstruct(EventTimingControl.class);
		assertEquals(TimingControlStatement.Type.EVENT_CONTROL, control.getType());
		assertSame(timed, control.getParent());
		assertSame(always, timed.getParent());
	}

	@Test
	public void testEveryNodeIsRecorded() throws Exception {
		AstFactory factory = factory();
		ModuleDeclaration counter = counterModule(factory);
		AstArena arena = factory.getArena();

		assertTrue(arena.owns(counter));
		assertTrue(arena.owns(counter.getPorts()));
		assertTrue(arena.owns(counter.getIdentifier()));
		assertTrue("A whole module is dozens of blocks", arena.size() > 40);
	}

	@Test
	public void testReleaseAllLetsGoOfTheTree() throws Exception {
		AstFactory factory = factory();
		ModuleDeclaration counter = counterModule(factory);
		PortDeclaration clk = counter.getPorts().get(0);
		assertSame(counter, clk.getParent());

		factory.releaseAll();

		assertTrue(factory.getArena().isEmpty());
		assertTrue(counter.isReleased());
		assertTrue(clk.isReleased());
		assertNull("Parent links do not survive a release", clk.getParent());

		ModuleDeclaration again = counterModule(factory);
		assertEquals("The factory keeps working after a release", "counter", again.getIdentifier().getName());
		assertEquals(1, factory.getArena().generation());
	}

	@Test
	public void testNodesOutsideOfAnArenaHaveNoParent() throws Exception {
		AstFactory factory = factory();
		Identifier stray = new Identifier("stray");
		Attribute attribute = factory.newAttribute(stray, null);
		assertNull(stray.getParent());
		assertSame(stray, attribute.getName());
	}

	@Test
	public void testExhaustionWhileBuildingATree() throws Exception {
		AstFactory factory = factory(10);
		assertThrows(AstAllocationException.class, () -> counterModule(factory));
		assertEquals(10, factory.getArena().size());

		factory.releaseAll();
		assertNotNull("A small construct still fits after a release", factory.newIdentifier("ok"));
	}

	@Test
	public void testNullArenaRejected() throws Exception {
		assertThrows(IllegalArgumentException.class, () -> new AstFactory(null));
	}
}
