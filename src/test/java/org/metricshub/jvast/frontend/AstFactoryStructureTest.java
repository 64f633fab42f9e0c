package org.metricshub.jvast.frontend;

import static org.junit.Assert.*;
import static org.metricshub.jvast.AstTestSupport.*;

import org.junit.Test;
import org.metricshub.jvast.frontend.ast.AstContractError;
import org.metricshub.jvast.frontend.ast.AstNode;
import org.metricshub.jvast.frontend.ast.ChargeStrength;
import org.metricshub.jvast.frontend.ast.CmosSwitchInstance;
import org.metricshub.jvast.frontend.ast.Delay2;
import org.metricshub.jvast.frontend.ast.Delay3;
import org.metricshub.jvast.frontend.ast.DriveStrength;
import org.metricshub.jvast.frontend.ast.Edge;
import org.metricshub.jvast.frontend.ast.EdgeSensitiveParallelPath;
import org.metricshub.jvast.frontend.ast.EdgeSymbol;
import org.metricshub.jvast.frontend.ast.EnableGateInstances;
import org.metricshub.jvast.frontend.ast.Expression;
import org.metricshub.jvast.frontend.ast.GateInstantiation;
import org.metricshub.jvast.frontend.ast.Identifier;
import org.metricshub.jvast.frontend.ast.LevelSymbol;
import org.metricshub.jvast.frontend.ast.Lvalue;
import org.metricshub.jvast.frontend.ast.ModuleInstance;
import org.metricshub.jvast.frontend.ast.ModuleInstantiation;
import org.metricshub.jvast.frontend.ast.MosSwitchInstance;
import org.metricshub.jvast.frontend.ast.NInputGateInstance;
import org.metricshub.jvast.frontend.ast.NInputGateInstances;
import org.metricshub.jvast.frontend.ast.NOutputGateInstances;
import org.metricshub.jvast.frontend.ast.NetType;
import org.metricshub.jvast.frontend.ast.NumberLiteral;
import org.metricshub.jvast.frontend.ast.Operator;
import org.metricshub.jvast.frontend.ast.ParameterDeclarations;
import org.metricshub.jvast.frontend.ast.PassEnableSwitches;
import org.metricshub.jvast.frontend.ast.PathDeclaration;
import org.metricshub.jvast.frontend.ast.PortConnection;
import org.metricshub.jvast.frontend.ast.PortDirection;
import org.metricshub.jvast.frontend.ast.PrimitivePullStrength;
import org.metricshub.jvast.frontend.ast.PrimitiveStrength;
import org.metricshub.jvast.frontend.ast.PullDirection;
import org.metricshub.jvast.frontend.ast.PullGateInstances;
import org.metricshub.jvast.frontend.ast.SimpleFullPath;
import org.metricshub.jvast.frontend.ast.SimpleParallelPath;
import org.metricshub.jvast.frontend.ast.Statement;
import org.metricshub.jvast.frontend.ast.SwitchGate;
import org.metricshub.jvast.frontend.ast.Switches;
import org.metricshub.jvast.frontend.ast.TypeDeclaration;
import org.metricshub.jvast.frontend.ast.UdpBody;
import org.metricshub.jvast.frontend.ast.UdpDeclaration;
import org.metricshub.jvast.frontend.ast.UdpEntry;
import org.metricshub.jvast.frontend.ast.UdpInputSymbol;
import org.metricshub.jvast.frontend.ast.UdpInstance;
import org.metricshub.jvast.frontend.ast.UdpInstantiation;
import org.metricshub.jvast.frontend.ast.UdpNextState;
import org.metricshub.jvast.frontend.ast.UdpOutputPort;
import org.metricshub.jvast.frontend.ast.UdpPort;
import org.metricshub.jvast.frontend.ast.UdpSequentialEntry;
import org.metricshub.jvast.util.AstList;

public class AstFactoryStructureTest {

	private static Delay3 delay3(AstFactory factory) {
		return factory.newDelay3(numberDelay(factory, "1"), numberDelay(factory, "2"), numberDelay(factory, "3"));
	}

	private static Delay2 delay2(AstFactory factory) {
		return factory.newDelay2(numberDelay(factory, "1"), numberDelay(factory, "2"));
	}

	@Test
	public void testSwitchGateDelayArity() throws Exception {
		AstFactory factory = factory();
		SwitchGate nmos = factory.newSwitchGateD3(SwitchGate.Type.NMOS, delay3(factory));
		assertEquals(3, nmos.getDelay3().arity());
		SwitchGate tran = factory.newSwitchGateD2(SwitchGate.Type.TRAN, delay2(factory));
		assertEquals(2, tran.getDelay2().arity());
		assertNull(factory.newSwitchGateD2(SwitchGate.Type.RTRAN, null).getDelay());

		assertThrows(
				"tran switches take two delays",
				AstContractError.class,
				() -> factory.newSwitchGateD3(SwitchGate.Type.TRAN, delay3(factory)));
		assertThrows(
				"cmos switches take three delays",
				AstContractError.class,
				() -> factory.newSwitchGateD2(SwitchGate.Type.CMOS, delay2(factory)));
		assertThrows(AstContractError.class, nmos::getDelay2);
	}

	@Test
	public void testMosAndCmosSwitches() throws Exception {
		AstFactory factory = factory();
		MosSwitchInstance mos = factory.newMosSwitchInstance(
				factory.newIdentifier("m1"),
				netLvalue(factory, "out"),
				ref(factory, "en"),
				ref(factory, "in"));
		Switches mosSwitches = factory.newSwitches(factory.newSwitchGateD3(SwitchGate.Type.PMOS, null), listOf(factory, (AstNode) mos));
		GateInstantiation mosGates = factory.newGateInstantiation(GateInstantiation.Type.MOS, mosSwitches);
		assertSame(mosSwitches, mosGates.getGates(Switches.class));
		assertSame(mosSwitches, mos.getParent());

		CmosSwitchInstance cmos = factory.newCmosSwitchInstance(
				factory.newIdentifier("c1"),
				netLvalue(factory, "out"),
				ref(factory, "n"),
				ref(factory, "p"),
				ref(factory, "in"));
		Switches cmosSwitches = factory.newSwitches(factory.newSwitchGateD3(SwitchGate.Type.RCMOS, null), listOf(factory, (AstNode) cmos));
		assertEquals(GateInstantiation.Type.CMOS, factory.newGateInstantiation(GateInstantiation.Type.CMOS, cmosSwitches).getType());

		assertThrows(
				"A cmos switch is not a mos gate",
				AstContractError.class,
				() -> factory.newGateInstantiation(GateInstantiation.Type.MOS, cmosSwitches));
	}

	@Test
	public void testPassSwitches() throws Exception {
		AstFactory factory = factory();
		Switches tran = factory.newSwitches(
				factory.newSwitchGateD2(SwitchGate.Type.TRAN, null),
				listOf(factory, (AstNode) factory.newPassSwitchInstance(null, netLvalue(factory, "a"), netLvalue(factory, "b"))));
		assertEquals(GateInstantiation.Type.PASS, factory.newGateInstantiation(GateInstantiation.Type.PASS, tran).getType());

		PassEnableSwitches tranif = factory.newPassEnableSwitches(
				PassEnableSwitches.Type.TRANIF1,
				delay2(factory),
				listOf(factory, factory.newPassEnableSwitch(factory.newIdentifier("t"), netLvalue(factory, "a"), netLvalue(factory, "b"), ref(factory, "en"))));
		GateInstantiation gates = factory.newGateInstantiation(GateInstantiation.Type.PASS_ENABLE, tranif);
		assertEquals(1, gates.getGates(PassEnableSwitches.class).getSwitches().count());
	}

	@Test
	public void testGateTagMustMatchCollection() throws Exception {
		AstFactory factory = factory();
		NInputGateInstance and = factory.newNInputGateInstance(
				factory.newIdentifier("g1"),
				listOf(factory, ref(factory, "a"), ref(factory, "b")),
				netLvalue(factory, "y"));
		NInputGateInstances ands = factory.newNInputGateInstances(
				NInputGateInstances.Type.AND,
				null,
				factory.newDriveStrength(PrimitiveStrength.STRONG, PrimitiveStrength.WEAK),
				listOf(factory, and));

		GateInstantiation gates = factory.newGateInstantiation(GateInstantiation.Type.N_INPUT, ands);
		assertSame(ands, gates.getGates());
		assertEquals(PrimitiveStrength.WEAK, ands.getDriveStrength().getStrength0());

		assertThrows(
				AstContractError.class,
				() -> factory.newGateInstantiation(GateInstantiation.Type.ENABLE, ands));
		assertThrows(
				AstContractError.class,
				() -> gates.getGates(EnableGateInstances.class));
	}

	@Test
	public void testEnableAndNOutputGates() throws Exception {
		AstFactory factory = factory();
		EnableGateInstances bufif = factory.newEnableGateInstances(
				EnableGateInstances.Type.BUFIF0,
				delay3(factory),
				null,
				listOf(factory, factory.newEnableGateInstance(factory.newIdentifier("b0"), netLvalue(factory, "y"), ref(factory, "oe"), ref(factory, "d"))));
		assertEquals(GateInstantiation.Type.ENABLE, factory.newGateInstantiation(GateInstantiation.Type.ENABLE, bufif).getType());

		NOutputGateInstances buffers = factory.newNOutputGateInstances(
				NOutputGateInstances.Type.BUF,
				null,
				null,
				listOf(factory, factory.newNOutputGateInstance(
						factory.newIdentifier("fanout"),
						listOf(factory, (Lvalue) netLvalue(factory, "y0"), netLvalue(factory, "y1")),
						ref(factory, "x"))));
		assertEquals(2, buffers.getInstances().get(0).getOutputs().count());
		assertEquals(GateInstantiation.Type.N_OUTPUT, factory.newGateInstantiation(GateInstantiation.Type.N_OUTPUT, buffers).getType());
	}

	@Test
	public void testPullGates() throws Exception {
		AstFactory factory = factory();
		PrimitivePullStrength up = factory.newPrimitivePullStrength(PullDirection.UP, PrimitiveStrength.STRONG, PrimitiveStrength.NONE);
		PullGateInstances pullups = factory.newPullGateInstances(up, listOf(factory, factory.newPullGateInstance(null, netLvalue(factory, "bus"))));
		assertEquals(GateInstantiation.Type.PULL_UP, factory.newGateInstantiation(GateInstantiation.Type.PULL_UP, pullups).getType());

		assertThrows(
				"A pull-up strength cannot drive a pulldown",
				AstContractError.class,
				() -> factory.newGateInstantiation(GateInstantiation.Type.PULL_DOWN, pullups));

		PullGateInstances plain = factory.newPullGateInstances(null, listOf(factory, factory.newPullGateInstance(null, netLvalue(factory, "bus"))));
		assertEquals(GateInstantiation.Type.PULL_DOWN, factory.newGateInstantiation(GateInstantiation.Type.PULL_DOWN, plain).getType());

		assertEquals(PrimitiveStrength.PULL, factory.newPullStrength(PrimitiveStrength.PULL, PrimitiveStrength.WEAK).getStrength1());
	}

	@Test
	public void testUdpOutputPortRejectsInput() throws Exception {
		AstFactory factory = factory();
		UdpOutputPort out = factory.newUdpPort(PortDirection.OUTPUT, factory.newIdentifier("q"), null, true, number(factory, "0"));
		assertTrue(out.isReg());
		assertEquals(PortDirection.OUTPUT, out.getDirection());

		assertThrows(
				AstContractError.class,
				() -> factory.newUdpPort(PortDirection.INPUT, factory.newIdentifier("d"), null, false, null));
		assertEquals(PortDirection.INPUT, factory.newUdpInputPort(listOf(factory, factory.newIdentifier("d")), null).getDirection());
	}

	@Test
	public void testSequentialUdp() throws Exception {
		AstFactory factory = factory();
		// primitive dff(output reg q, input d, clk); initial q = 0; table 0 r : ? : 0; endtable
		UdpSequentialEntry rising = factory.newUdpSequentialEntry(
				UdpSequentialEntry.Prefix.EDGES,
				listOf(factory, (UdpInputSymbol) LevelSymbol.ZERO, EdgeSymbol.RISING),
				LevelSymbol.ANY,
				UdpNextState.ZERO);
		UdpSequentialEntry hold = factory.newUdpSequentialEntry(
				UdpSequentialEntry.Prefix.LEVELS,
				listOf(factory, (UdpInputSymbol) LevelSymbol.ANY, LevelSymbol.ZERO),
				LevelSymbol.ANY,
				UdpNextState.UNCHANGED);
		UdpBody body = factory.newUdpSequentialBody(
				factory.newUdpInitialStatement(
						factory.newIdentifier("q"),
						factory.newNumber(NumberLiteral.Base.BINARY, NumberLiteral.Representation.BITS, 1, false, "0")),
				listOf(factory, (UdpEntry) rising, hold));

		AstList<UdpPort> ports = listOf(
				factory,
				(UdpPort) factory.newUdpPort(PortDirection.OUTPUT, factory.newIdentifier("q"), null, true, null),
				factory.newUdpInputPort(listOf(factory, factory.newIdentifier("d"), factory.newIdentifier("clk")), null));
		UdpDeclaration dff = factory.newUdpDeclaration(null, factory.newIdentifier("dff"), ports, body);

		assertEquals(UdpBody.Type.SEQUENTIAL, dff.getBodyType());
		assertEquals("q", dff.getInitial().getOutputPort().getName());
		assertEquals(2, dff.getBodyEntries().count());
		assertSame(dff, rising.getParent());

		assertThrows(
				"A level row cannot hold an edge",
				AstContractError.class,
				() -> factory.newUdpSequentialEntry(
						UdpSequentialEntry.Prefix.LEVELS,
						listOf(factory, (UdpInputSymbol) EdgeSymbol.FALLING),
						LevelSymbol.ONE,
						UdpNextState.ONE));
		assertThrows(
				"A combinatorial body cannot hold sequential rows",
				AstContractError.class,
				() -> factory.newUdpCombinatorialBody(listOf(factory, (UdpEntry) rising)));
		assertThrows(AstContractError.class, () -> factory.newUdpDeclaration(null, factory.newIdentifier("x"), ports, null));
	}

	@Test
	public void testCombinatorialUdpAndInstantiation() throws Exception {
		AstFactory factory = factory();
		UdpEntry row = factory.newUdpCombinatorialEntry(listOf(factory, LevelSymbol.ONE, LevelSymbol.ONE), UdpNextState.ONE);
		UdpBody body = factory.newUdpCombinatorialBody(listOf(factory, row));
		assertEquals(UdpBody.Type.COMBINATORIAL, body.getType());
		assertNull(body.getInitial());

		assertThrows(
				AstContractError.class,
				() -> factory.newUdpCombinatorialEntry(listOf(factory, LevelSymbol.ONE), UdpNextState.UNCHANGED));

		UdpInstance instance = factory.newUdpInstance(
				factory.newIdentifier("u1"),
				null,
				netLvalue(factory, "y"),
				listOf(factory, ref(factory, "a"), ref(factory, "b")));
		UdpInstantiation instantiation = factory.newUdpInstantiation(
				listOf(factory, instance),
				factory.newIdentifier("and2"),
				null,
				delay2(factory));
		assertEquals("and2", instantiation.getIdentifier().getName());
		assertSame(instantiation, instance.getParent());
		assertEquals(
				Statement.Type.UDP_INSTANTIATION,
				factory.newStatement(null, false, instantiation, Statement.Type.UDP_INSTANTIATION).getType());
	}

	@Test
	public void testModuleInstantiation() throws Exception {
		AstFactory factory = factory();
		PortConnection named = factory.newNamedPortConnection(factory.newIdentifier("clk"), ref(factory, "sys_clk"));
		PortConnection unconnected = factory.newNamedPortConnection(factory.newIdentifier("q"), null);
		PortConnection ordered = factory.newOrderedPortConnection(number(factory, "16"));
		assertTrue(named.isNamed());
		assertFalse(ordered.isNamed());
		assertNull(unconnected.getExpression());
		assertThrows(AstContractError.class, () -> factory.newNamedPortConnection(null, ref(factory, "x")));

		ModuleInstance u0 = factory.newModuleInstance(factory.newIdentifier("u0"), listOf(factory, named, unconnected));
		ModuleInstantiation inst = factory.newModuleInstantiation(factory.newIdentifier("counter"), listOf(factory, ordered), listOf(factory, u0));
		assertSame(inst, u0.getParent());
		assertEquals(1, inst.getModuleParameters().count());
		assertEquals(0, factory.newModuleInstance(factory.newIdentifier("u1"), null).getPortConnections().count());
	}

	@Test
	public void testPathDeclarations() throws Exception {
		AstFactory factory = factory();
		SimpleParallelPath parallel = factory.newSimpleParallelPathDeclaration(
				factory.newIdentifier("a"),
				Operator.NONE,
				factory.newIdentifier("y"),
				listOf(factory, number(factory, "5")));
		PathDeclaration declaration = factory.newPathDeclaration(PathDeclaration.Type.SIMPLE_PARALLEL_PATH, null, parallel);
		assertSame(parallel, declaration.getDescription());
		assertSame(declaration, parallel.getParent());

		SimpleFullPath full = factory.newSimpleFullPathDeclaration(
				listOf(factory, factory.newIdentifier("a"), factory.newIdentifier("b")),
				Operator.MINUS,
				listOf(factory, factory.newIdentifier("y")),
				listOf(factory, number(factory, "5")));
		assertThrows(
				"A full path is not a parallel path",
				AstContractError.class,
				() -> factory.newPathDeclaration(PathDeclaration.Type.SIMPLE_PARALLEL_PATH, null, full));

		EdgeSensitiveParallelPath edge = factory.newEdgeSensitiveParallelPathDeclaration(
				Edge.POSITIVE,
				factory.newIdentifier("clk"),
				Operator.PLUS,
				factory.newIdentifier("q"),
				ref(factory, "d"),
				listOf(factory, number(factory, "2")));
		Expression state = ref(factory, "en");
		PathDeclaration guarded = factory.newPathDeclaration(PathDeclaration.Type.STATE_DEPENDENT_EDGE_PARALLEL_PATH, state, edge);
		assertTrue(guarded.getType().isStateDependent());
		assertSame(state, guarded.getStateExpression());

		assertThrows(
				"A state dependent path needs its condition",
				AstContractError.class,
				() -> factory.newPathDeclaration(PathDeclaration.Type.STATE_DEPENDENT_EDGE_PARALLEL_PATH, null, edge));
		assertThrows(
				AstContractError.class,
				() -> factory.newPathDeclaration(PathDeclaration.Type.IF_NONE_SIMPLE_FULL_PATH, ref(factory, "c"), full));
		assertTrue(factory.newPathDeclaration(PathDeclaration.Type.IF_NONE_SIMPLE_FULL_PATH, null, full).getType().isIfNone());
		assertEquals(
				Statement.Type.PATH_DECLARATION,
				factory.newStatement(null, false, guarded, Statement.Type.PATH_DECLARATION).getType());
	}

	@Test
	public void testParameterDeclarations() throws Exception {
		AstFactory factory = factory();
		ParameterDeclarations generic = factory.newParameterDeclarations(
				listOf(factory, factory.newSingleAssignment(varLvalue(factory, "W"), number(factory, "8"))),
				true,
				false,
				factory.newRange(number(factory, "7"), number(factory, "0")),
				ParameterDeclarations.Type.GENERIC);
		assertTrue(generic.isSignedValues());
		assertNotNull(generic.getRange());

		ParameterDeclarations integer = factory.newParameterDeclarations(
				listOf(factory, factory.newSingleAssignment(varLvalue(factory, "N"), number(factory, "4"))),
				true,
				true,
				factory.newRange(number(factory, "7"), number(factory, "0")),
				ParameterDeclarations.Type.INTEGER);
		assertFalse("Typed parameters are never signed", integer.isSignedValues());
		assertNull("Typed parameters have no range", integer.getRange());
		assertTrue(integer.isLocal());
	}

	@Test
	public void testTypeDeclarationIsFilledAfterConstruction() throws Exception {
		AstFactory factory = factory();
		TypeDeclaration wires = factory.newTypeDeclaration(TypeDeclaration.Type.NET);
		assertEquals(NetType.NONE, wires.getNetType());
		assertNull(wires.getIdentifiers());

		Identifier a = factory.newIdentifier("a");
		AstList<Identifier> names = listOf(factory, a, factory.newIdentifier("b"));
		wires.setIdentifiers(names);
		wires.setNetType(NetType.TRIREG);
		wires.setChargeStrength(ChargeStrength.LARGE);
		wires.setDelay(delay3(factory));
		wires.setDriveStrength(factory.newDriveStrength(PrimitiveStrength.SUPPLY, PrimitiveStrength.SUPPLY));
		wires.setRange(factory.newRange(number(factory, "7"), number(factory, "0")));
		wires.setSigned(true);
		wires.setVectored(true);

		assertSame(names, wires.getIdentifiers());
		assertSame("Declared names point back at their declaration", wires, a.getParent());
		assertSame(wires, names.get(1).getParent());
		assertSame(wires, wires.getDelay().getParent());
		assertSame(wires, wires.getDriveStrength().getParent());
		assertSame(wires, wires.getRange().getParent());
		assertEquals(NetType.TRIREG, wires.getNetType());
		assertEquals(ChargeStrength.LARGE, wires.getChargeStrength());
		assertTrue(wires.isSigned());
		assertTrue(wires.isVectored());
		assertFalse(wires.isScalared());
		assertEquals(
				Statement.Type.TYPE_DECLARATION,
				factory.newStatement(null, false, wires, Statement.Type.TYPE_DECLARATION).getType());
	}

	@Test
	public void testDriveStrength() throws Exception {
		AstFactory factory = factory();
		DriveStrength strength = factory.newDriveStrength(PrimitiveStrength.PULL, PrimitiveStrength.HIGHZ);
		assertEquals(PrimitiveStrength.PULL, strength.getStrength1());
		assertEquals(PrimitiveStrength.HIGHZ, strength.getStrength0());
	}
}
