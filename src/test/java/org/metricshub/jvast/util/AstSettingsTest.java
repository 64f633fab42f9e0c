package org.metricshub.jvast.util;

import static org.junit.Assert.*;

import org.junit.After;
import org.junit.Test;

public class AstSettingsTest {

	@After
	public void clearProperties() {
		System.clearProperty(AstSettings.MAX_BLOCKS_PROPERTY);
		System.clearProperty(AstSettings.TRACE_ALLOCATIONS_PROPERTY);
	}

	@Test
	public void testDefaults() throws Exception {
		AstSettings settings = new AstSettings();
		assertEquals(0, settings.getMaxBlocks());
		assertFalse(settings.isTraceAllocations());
		assertEquals("maxBlocks = 0\ntraceAllocations = false\n", settings.toDescriptionString());
	}

	@Test
	public void testNegativeLimitRejected() throws Exception {
		AstSettings settings = new AstSettings();
		assertThrows(IllegalArgumentException.class, () -> settings.setMaxBlocks(-1));
	}

	@Test
	public void testFromSystemProperties() throws Exception {
		System.setProperty(AstSettings.MAX_BLOCKS_PROPERTY, " 500 ");
		System.setProperty(AstSettings.TRACE_ALLOCATIONS_PROPERTY, "true");
		AstSettings settings = AstSettings.fromSystemProperties();
		assertEquals(500, settings.getMaxBlocks());
		assertTrue(settings.isTraceAllocations());
	}

	@Test
	public void testFromSystemPropertiesKeepsDefaults() throws Exception {
		AstSettings settings = AstSettings.fromSystemProperties();
		assertEquals(0, settings.getMaxBlocks());
		assertFalse(settings.isTraceAllocations());
	}

	@Test
	public void testInvalidMaxBlocksProperty() throws Exception {
		System.setProperty(AstSettings.MAX_BLOCKS_PROPERTY, "lots");
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, AstSettings::fromSystemProperties);
		assertTrue(e.getMessage().contains(AstSettings.MAX_BLOCKS_PROPERTY));
	}
}
