package org.metricshub.jvast.arena;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.jvast.frontend.ast.Identifier;
import org.metricshub.jvast.util.AstList;
import org.metricshub.jvast.util.AstSettings;

public class AstArenaTest {

	private static AstArena limitedArena(int maxBlocks) {
		AstSettings settings = new AstSettings();
		settings.setMaxBlocks(maxBlocks);
		return new AstArena(settings);
	}

	@Test
	public void testAllocateRecordsInOrder() throws Exception {
		AstArena arena = new AstArena();
		assertTrue("A new arena must be empty", arena.isEmpty());

		AstList<String> first = arena.allocate(AstList::new);
		AstList<String> second = arena.allocate(AstList::new);
		String plain = arena.allocate(() -> "not a block");

		assertEquals(3, arena.size());
		assertEquals("First block gets serial 0", 0, first.getSerial());
		assertEquals("Second block gets serial 1", 1, second.getSerial());
		assertSame(first, arena.lookup(0));
		assertSame(second, arena.lookup(1));
		assertSame("Plain objects are recorded too", plain, arena.lookup(2));
		assertSame(arena, first.getArena());
		assertTrue(arena.owns(first));
		assertTrue(arena.owns(plain));
		assertFalse(arena.owns(new AstList<String>()));
	}

	@Test
	public void testLookupOutOfRange() throws Exception {
		AstArena arena = new AstArena();
		arena.allocate(AstList::new);
		assertNull(arena.lookup(-1));
		assertNull(arena.lookup(1));
	}

	@Test
	public void testReleaseAllDetachesEveryBlock() throws Exception {
		AstArena arena = new AstArena();
		AstList<Object> a = arena.allocate(AstList::new);
		AstList<Object> b = arena.allocate(AstList::new);
		a.append("kept content");

		arena.releaseAll();

		assertTrue(arena.isEmpty());
		assertEquals(1, arena.generation());
		assertTrue(a.isReleased());
		assertTrue(b.isReleased());
		assertNull("Released blocks no longer know their arena", a.getArena());
		assertFalse(arena.owns(a));
		assertEquals("Released blocks keep their own fields", 1, a.count());
	}

	@Test
	public void testReleaseEmptyArenaIsNoOp() throws Exception {
		AstArena arena = new AstArena();
		arena.releaseAll();
		arena.releaseAll();
		assertTrue(arena.isEmpty());
		assertEquals("Releasing nothing must not start a new generation", 0, arena.generation());
	}

	@Test
	public void testArenaIsReusableAfterRelease() throws Exception {
		AstArena arena = new AstArena();
		arena.allocate(AstList::new);
		arena.allocate(AstList::new);
		arena.releaseAll();

		AstList<Object> fresh = arena.allocate(AstList::new);
		assertEquals(1, arena.size());
		assertEquals("Serials restart after a release", 0, fresh.getSerial());
		assertFalse(fresh.isReleased());

		arena.releaseAll();
		assertEquals(2, arena.generation());
	}

	@Test
	public void testBlockCannotBeRecordedTwice() throws Exception {
		AstArena first = new AstArena();
		AstArena second = new AstArena();
		AstList<Object> list = first.allocate(AstList::new);
		assertThrows(IllegalStateException.class, () -> second.allocate(() -> list));
	}

	@Test
	public void testReleasedBlockCannotBeRecordedAgain() throws Exception {
		AstArena arena = new AstArena();
		Identifier parent = arena.allocate(() -> new Identifier("parent"));
		Identifier child = arena.allocate(() -> new Identifier("child"));
		child.setParent(parent);
		assertSame(parent, child.getParent());

		arena.releaseAll();
		for (int i = 0; i < 4; i++) {
			String name = "unrelated" + i;
			arena.allocate(() -> new Identifier(name));
		}

		assertThrows(IllegalStateException.class, () -> arena.allocate(() -> child));
		assertTrue("The refused block stays released", child.isReleased());
		assertFalse(arena.owns(child));
		assertEquals(4, arena.size());
		assertNull("The old parent link must not resolve in the new generation", child.getParent());
	}

	@Test
	public void testNullBlockIsRejected() throws Exception {
		AstArena arena = new AstArena();
		assertThrows(IllegalStateException.class, () -> arena.allocate(() -> null));
		assertTrue(arena.isEmpty());
	}

	@Test
	public void testLimitReportsExhaustion() throws Exception {
		AstArena arena = limitedArena(2);
		arena.allocate(AstList::new);
		arena.allocate(AstList::new);

		AstAllocationException e = assertThrows(AstAllocationException.class, () -> arena.allocate(AstList::new));
		assertTrue(e.getMessage().contains("2"));
		assertEquals("A refused allocation must not be recorded", 2, arena.size());

		arena.releaseAll();
		assertNotNull("Releasing frees room again", arena.allocate(AstList::new));
	}

	@Test
	public void testOutOfMemoryIsReported() throws Exception {
		AstArena arena = new AstArena();
		AstAllocationException e = assertThrows(AstAllocationException.class, () -> arena.allocate(() -> {
			throw new OutOfMemoryError("simulated");
		}));
		assertTrue(e.getCause() instanceof OutOfMemoryError);
		assertTrue(arena.isEmpty());
	}

	@Test
	public void testTracedAllocations() throws Exception {
		AstSettings settings = new AstSettings();
		settings.setTraceAllocations(true);
		AstArena arena = new AstArena(settings);
		arena.allocate(AstList::new);
		assertEquals(1, arena.size());
		assertSame(settings, arena.getSettings());
	}

	@Test
	public void testNullSettingsRejected() throws Exception {
		assertThrows(IllegalArgumentException.class, () -> new AstArena(null));
	}
}
