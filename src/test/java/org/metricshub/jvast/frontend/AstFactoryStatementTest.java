package org.metricshub.jvast.frontend;

import static org.junit.Assert.*;
import static org.metricshub.jvast.AstTestSupport.*;

import org.junit.Test;
import org.metricshub.jvast.frontend.ast.AstContractError;
import org.metricshub.jvast.frontend.ast.Assignment;
import org.metricshub.jvast.frontend.ast.CaseItem;
import org.metricshub.jvast.frontend.ast.CaseStatement;
import org.metricshub.jvast.frontend.ast.ConditionLoop;
import org.metricshub.jvast.frontend.ast.ConditionalStatement;
import org.metricshub.jvast.frontend.ast.ContinuousAssignment;
import org.metricshub.jvast.frontend.ast.DelayControl;
import org.metricshub.jvast.frontend.ast.DelayTimingControl;
import org.metricshub.jvast.frontend.ast.DelayValue;
import org.metricshub.jvast.frontend.ast.DisableStatement;
import org.metricshub.jvast.frontend.ast.Edge;
import org.metricshub.jvast.frontend.ast.EdgeEventExpression;
import org.metricshub.jvast.frontend.ast.EventControl;
import org.metricshub.jvast.frontend.ast.EventExpression;
import org.metricshub.jvast.frontend.ast.EventSequence;
import org.metricshub.jvast.frontend.ast.EventTimingControl;
import org.metricshub.jvast.frontend.ast.Expression;
import org.metricshub.jvast.frontend.ast.ForLoop;
import org.metricshub.jvast.frontend.ast.ForeverLoop;
import org.metricshub.jvast.frontend.ast.HybridAssignment;
import org.metricshub.jvast.frontend.ast.Identifier;
import org.metricshub.jvast.frontend.ast.IfElse;
import org.metricshub.jvast.frontend.ast.LoopStatement;
import org.metricshub.jvast.frontend.ast.Operator;
import org.metricshub.jvast.frontend.ast.ProceduralAssignment;
import org.metricshub.jvast.frontend.ast.SingleAssignment;
import org.metricshub.jvast.frontend.ast.Statement;
import org.metricshub.jvast.frontend.ast.StatementBlock;
import org.metricshub.jvast.frontend.ast.TaskEnableStatement;
import org.metricshub.jvast.frontend.ast.TimingControlStatement;
import org.metricshub.jvast.frontend.ast.WaitStatement;
import org.metricshub.jvast.util.AstList;

public class AstFactoryStatementTest {

	@Test
	public void testCaseDefaultIsFirstDefaultItem() throws Exception {
		AstFactory factory = factory();
		CaseItem a = factory.newCaseItem(listOf(factory, number(factory, "0")), blockingAssign(factory, "y", number(factory, "1")));
		CaseItem b = factory.newDefaultCaseItem(blockingAssign(factory, "y", number(factory, "2")));
		CaseItem c = factory.newDefaultCaseItem(blockingAssign(factory, "y", number(factory, "3")));

		CaseStatement statement = factory.newCaseStatement(ref(factory, "sel"), listOf(factory, a, b, c), CaseStatement.Type.CASE);

		assertSame("The first default arm wins", b, statement.getDefaultItem());
		assertEquals(3, statement.getCases().count());
		assertFalse(statement.isFunction());
		assertSame(statement, a.getParent());
	}

	@Test
	public void testCaseWithoutDefault() throws Exception {
		AstFactory factory = factory();
		CaseItem a = factory.newCaseItem(listOf(factory, number(factory, "0")), null);
		CaseStatement statement = factory.newCaseStatement(ref(factory, "sel"), listOf(factory, a), CaseStatement.Type.CASEZ);
		assertNull(statement.getDefaultItem());
		assertEquals(CaseStatement.Type.CASEZ, statement.getType());
	}

	@Test
	public void testCaseDefaultScanStopsAtNullEntry() throws Exception {
		AstFactory factory = factory();
		CaseItem a = factory.newCaseItem(listOf(factory, number(factory, "0")), null);
		CaseItem hidden = factory.newDefaultCaseItem(null);
		AstList<CaseItem> items = listOf(factory, a, null, hidden);

		CaseStatement statement = factory.newCaseStatement(ref(factory, "sel"), items, CaseStatement.Type.CASEX);
		assertNull("Arms after a null entry are not scanned", statement.getDefaultItem());
	}

	@Test
	public void testCaseWithNoItems() throws Exception {
		AstFactory factory = factory();
		CaseStatement statement = factory.newCaseStatement(ref(factory, "sel"), null, CaseStatement.Type.CASE);
		assertEquals(0, statement.getCases().count());
		assertNull(statement.getDefaultItem());
	}

	@Test
	public void testIfElseChainKeepsPriorityOrder() throws Exception {
		AstFactory factory = factory();
		ConditionalStatement c1 = factory.newConditionalStatement(blockingAssign(factory, "y", number(factory, "1")), ref(factory, "a"));
		ConditionalStatement c2 = factory.newConditionalStatement(blockingAssign(factory, "y", number(factory, "2")), ref(factory, "b"));
		ConditionalStatement c3 = factory.newConditionalStatement(blockingAssign(factory, "y", number(factory, "3")), ref(factory, "c"));
		Statement otherwise = blockingAssign(factory, "y", number(factory, "0"));

		IfElse chain = factory.newIfElse(c1, otherwise);
		factory.extendIfElse(chain, listOf(factory, c2, c3));

		AstList<ConditionalStatement> branches = chain.getConditionalStatements();
		assertEquals(3, branches.count());
		assertSame(c1, branches.get(0));
		assertSame(c2, branches.get(1));
		assertSame(c3, branches.get(2));
		assertSame(otherwise, chain.getElseStatement());
		assertSame(chain, c3.getParent());

		factory.extendIfElse(chain, null);
		assertEquals("Extending with nothing is a no-op", 3, chain.getConditionalStatements().count());
	}

	@Test
	public void testEventEdges() throws Exception {
		AstFactory factory = factory();
		assertEquals(EventExpression.Type.POSEDGE, factory.newEventExpression(Edge.POSITIVE, ref(factory, "clk")).getType());
		assertEquals(EventExpression.Type.NEGEDGE, factory.newEventExpression(Edge.NEGATIVE, ref(factory, "rst")).getType());
		EdgeEventExpression any = factory.newEventExpression(Edge.ANY, ref(factory, "d"));
		assertEquals(EventExpression.Type.EXPRESSION, any.getType());
		assertNotNull(any.getExpression());

		assertThrows(
				"An event needs an edge",
				AstContractError.class,
				() -> factory.newEventExpression(Edge.NONE, ref(factory, "clk")));
	}

	@Test
	public void testEventSequenceHoldsRightThenLeft() throws Exception {
		AstFactory factory = factory();
		EventExpression clk = factory.newEventExpression(Edge.POSITIVE, ref(factory, "clk"));
		EventExpression rst = factory.newEventExpression(Edge.NEGATIVE, ref(factory, "rst"));

		EventSequence sequence = factory.newEventExpressionSequence(clk, rst);
		assertEquals(EventExpression.Type.SEQUENCE, sequence.getType());
		assertSame(rst, sequence.getSequence().get(0));
		assertSame(clk, sequence.getSequence().get(1));
	}

	@Test
	public void testEventControl() throws Exception {
		AstFactory factory = factory();
		EventControl star = factory.newEventControl(EventControl.Type.ANY, null);
		assertNull(star.getExpression());

		EventExpression clk = factory.newEventExpression(Edge.POSITIVE, ref(factory, "clk"));
		assertThrows(
				"@* cannot list events",
				AstContractError.class,
				() -> factory.newEventControl(EventControl.Type.ANY, clk));
		assertSame(clk, factory.newEventControl(EventControl.Type.TRIGGERS, clk).getExpression());
	}

	@Test
	public void testDelayValues() throws Exception {
		AstFactory factory = factory();
		DelayValue five = numberDelay(factory, "5");
		assertEquals(DelayValue.Type.NUMBER, five.getType());

		DelayValue param = factory.newDelayValue(DelayValue.Type.PARAMETER, factory.newIdentifier("T_RISE"));
		assertEquals("T_RISE", param.getValue(Identifier.class).getName());

		assertThrows(
				"A number delay cannot hold an identifier",
				AstContractError.class,
				() -> factory.newDelayValue(DelayValue.Type.NUMBER, factory.newIdentifier("T")));

		assertEquals(2, factory.newDelay2(five, param).arity());
		assertEquals(3, factory.newDelay3(five, param, numberDelay(factory, "7")).arity());
	}

	@Test
	public void testTimingControlStatements() throws Exception {
		AstFactory factory = factory();
		Statement body = blockingAssign(factory, "q", ref(factory, "d"));
		DelayControl delay = factory.newDelayCtrlValue(numberDelay(factory, "10"));

		DelayTimingControl delayed = factory.newTimingControlStatementDelay(TimingControlStatement.Type.DELAY_CONTROL, body, delay);
		assertEquals(TimingControlStatement.Type.DELAY_CONTROL, delayed.getType());
		assertSame(body, delayed.getStatement());
		assertSame(delay, delayed.getDelay());
		assertEquals(DelayControl.Type.MINTYPMAX, factory.newDelayCtrlMintypmax(number(factory, "1")).getType());

		EventControl events = factory.newEventControl(EventControl.Type.ANY, null);
		EventTimingControl repeated = factory.newTimingControlStatementEvent(
				TimingControlStatement.Type.EVENT_CONTROL_REPEAT,
				number(factory, "3"),
				null,
				events);
		assertNotNull(repeated.getRepeat());
		assertSame(events, repeated.getEventControl());

		assertThrows(
				AstContractError.class,
				() -> factory.newTimingControlStatementDelay(TimingControlStatement.Type.EVENT_CONTROL, body, delay));
		assertThrows(
				AstContractError.class,
				() -> factory.newTimingControlStatementEvent(TimingControlStatement.Type.DELAY_CONTROL, null, body, events));
	}

	@Test
	public void testLoops() throws Exception {
		AstFactory factory = factory();
		Statement body = blockingAssign(factory, "x", number(factory, "0"));

		ForeverLoop forever = factory.newForeverLoopStatement(body);
		assertEquals(LoopStatement.Type.FOREVER, forever.getType());
		assertSame(forever, body.getParent());

		ConditionLoop loop = factory.newWhileLoopStatement(body, ref(factory, "busy"));
		assertEquals(LoopStatement.Type.WHILE, loop.getType());

		ConditionLoop repeat = factory.newRepeatLoopStatement(body, number(factory, "4"));
		assertEquals(LoopStatement.Type.REPEAT, repeat.getType());

		SingleAssignment init = factory.newSingleAssignment(varLvalue(factory, "i"), number(factory, "0"));
		SingleAssignment step = factory.newSingleAssignment(
				varLvalue(factory, "i"),
				factory.newBinaryExpression(ref(factory, "i"), number(factory, "1"), Operator.PLUS, null, false));
		Expression condition = factory.newBinaryExpression(ref(factory, "i"), number(factory, "8"), Operator.LESS, null, false);
		ForLoop forLoop = factory.newForLoopStatement(body, init, step, condition);
		assertEquals(LoopStatement.Type.FOR, forLoop.getType());
		assertSame(init, forLoop.getInitial());
		assertSame(step, forLoop.getModify());
		assertSame(condition, forLoop.getCondition());
	}

	@Test
	public void testAssignments() throws Exception {
		AstFactory factory = factory();
		ProceduralAssignment blocking = factory.newBlockingAssignment(varLvalue(factory, "a"), ref(factory, "b"), null);
		assertEquals(Assignment.Type.BLOCKING, blocking.getType());
		ProceduralAssignment nonblocking = factory.newNonblockingAssignment(varLvalue(factory, "a"), ref(factory, "b"), null);
		assertEquals(Assignment.Type.NONBLOCKING, nonblocking.getType());

		SingleAssignment wire = factory.newSingleAssignment(netLvalue(factory, "w"), ref(factory, "x"));
		ContinuousAssignment assign = factory.newContinuousAssignment(listOf(factory, wire), null, null);
		assertEquals(Assignment.Type.CONTINUOUS, assign.getType());
		assertSame(assign, wire.getParent());
	}

	@Test
	public void testHybridAssignments() throws Exception {
		AstFactory factory = factory();
		SingleAssignment forced = factory.newSingleAssignment(netLvalue(factory, "n"), number(factory, "0"));
		HybridAssignment force = factory.newHybridAssignment(HybridAssignment.Kind.FORCE_NET, forced);
		assertEquals(Assignment.Type.HYBRID, force.getType());
		assertSame(forced, force.getAssignment());

		HybridAssignment release = factory.newHybridLvalAssignment(HybridAssignment.Kind.RELEASE_NET, netLvalue(factory, "n"));
		assertNull(release.getAssignment());
		assertNotNull(release.getLvalue());

		assertThrows(
				"release takes only a target",
				AstContractError.class,
				() -> factory.newHybridAssignment(HybridAssignment.Kind.RELEASE_VAR, forced));
		assertThrows(
				"assign needs a value",
				AstContractError.class,
				() -> factory.newHybridLvalAssignment(HybridAssignment.Kind.ASSIGN, netLvalue(factory, "n")));
	}

	@Test
	public void testStatementTagMustMatchConstruct() throws Exception {
		AstFactory factory = factory();
		DisableStatement disable = factory.newDisableStatement(factory.newIdentifier("blk"));
		Statement statement = factory.newStatement(null, false, disable, Statement.Type.DISABLE);
		assertSame(disable, statement.getConstruct(DisableStatement.class));
		assertFalse(statement.isGenerateStatement());

		assertThrows(
				"A disable statement is not a wait",
				AstContractError.class,
				() -> factory.newStatement(null, false, disable, Statement.Type.WAIT));
		assertThrows(
				AstContractError.class,
				() -> statement.getConstruct(WaitStatement.class));

		Statement empty = factory.newStatement(null, true, null, Statement.Type.BLOCK);
		assertNull("Empty statements are allowed", empty.getConstruct());
		assertTrue(empty.isFunctionStatement());
	}

	@Test
	public void testMiscStatements() throws Exception {
		AstFactory factory = factory();
		TaskEnableStatement display = factory.newTaskEnableStatement(
				listOf(factory, (Expression) factory.newStringExpression("done")),
				factory.newIdentifier("$display"),
				true);
		assertTrue(display.isSystem());
		assertEquals(1, display.getExpressions().count());

		WaitStatement wait = factory.newWaitStatement(ref(factory, "ready"), null);
		assertNull(wait.getStatement());

		StatementBlock block = factory.newStatementBlock(StatementBlock.Type.PARALLEL, factory.newIdentifier("fork1"), null, null);
		assertEquals(0, block.getStatements().count());
		assertEquals(0, block.getDeclarations().count());
		assertEquals("fork1", block.getBlockIdentifier().getName());
	}

	@Test
	public void testGenerateItems() throws Exception {
		AstFactory factory = factory();
		IfElse guarded = factory.newIfElse(
				factory.newConditionalStatement(blockingAssign(factory, "x", number(factory, "1")), ref(factory, "USE_X")),
				null);
		Statement item = factory.newGenerateItem(Statement.Type.GENERATE_CONDITIONAL, guarded);
		assertTrue(item.isGenerateStatement());
		assertSame(guarded, item.getConstruct());

		assertEquals(1, factory.newGenerateBlock(factory.newIdentifier("g"), listOf(factory, item)).getGenerateItems().count());
		assertEquals(0, factory.newGenerateBlock(null, null).getGenerateItems().count());

		assertThrows(
				AstContractError.class,
				() -> factory.newGenerateItem(Statement.Type.GENERATE_LOOP, guarded));
	}
}
