package org.metricshub.jvast.util;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class AstListTest {

	private static List<String> contents(AstList<String> list) {
		List<String> result = new ArrayList<String>();
		for (String s : list) {
			result.add(s);
		}
		return result;
	}

	@Test
	public void testAppendKeepsInsertionOrder() throws Exception {
		AstList<String> list = new AstList<String>();
		assertTrue(list.isEmpty());
		list.append("a");
		list.append("b");
		list.append("c");
		assertEquals(3, list.count());
		assertEquals(Arrays.asList("a", "b", "c"), contents(list));
		assertEquals("b", list.get(1));
	}

	@Test
	public void testPrependShiftsIndices() throws Exception {
		AstList<String> list = new AstList<String>();
		list.append("b");
		list.append("c");
		list.prepend("a");
		assertEquals("a", list.get(0));
		assertEquals("b", list.get(1));
		assertEquals("c", list.get(2));
	}

	@Test
	public void testRepeatedPrependReversesReductionOrder() throws Exception {
		AstList<String> list = new AstList<String>();
		list.append("E3");
		list.prepend("E2");
		list.prepend("E1");
		assertEquals(Arrays.asList("E1", "E2", "E3"), contents(list));
	}

	@Test
	public void testGetOutOfBoundsIsNull() throws Exception {
		AstList<String> list = new AstList<String>();
		assertNull(list.get(0));
		list.append("x");
		assertNull(list.get(-1));
		assertNull(list.get(1));
		assertEquals("x", list.get(0));
	}

	@Test
	public void testConcat() throws Exception {
		AstList<String> dst = new AstList<String>();
		dst.append("a");
		AstList<String> src = new AstList<String>();
		src.append("b");
		src.append("c");

		dst.concat(src);

		assertEquals(Arrays.asList("a", "b", "c"), contents(dst));
		assertEquals("Source is left as it was", 2, src.count());
	}

	@Test
	public void testConcatNullIsNoOp() throws Exception {
		AstList<String> dst = new AstList<String>();
		dst.append("a");
		dst.concat(null);
		assertEquals(1, dst.count());
	}

	@Test
	public void testConcatWithItself() throws Exception {
		AstList<String> list = new AstList<String>();
		list.append("a");
		list.append("b");
		list.concat(list);
		assertEquals(Arrays.asList("a", "b", "a", "b"), contents(list));
	}

	@Test
	public void testNullElementsAreKept() throws Exception {
		AstList<String> list = new AstList<String>();
		list.append(null);
		list.append("x");
		assertEquals(2, list.count());
		assertNull(list.get(0));
	}

	@Test
	public void testToListIsReadOnly() throws Exception {
		AstList<String> list = new AstList<String>();
		list.append("a");
		assertThrows(UnsupportedOperationException.class, () -> list.toList().add("b"));
		assertEquals("AstList[a]", list.toString());
	}
}
