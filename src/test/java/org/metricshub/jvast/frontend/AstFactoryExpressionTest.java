package org.metricshub.jvast.frontend;

import static org.junit.Assert.*;
import static org.metricshub.jvast.AstTestSupport.*;

import org.junit.Test;
import org.metricshub.jvast.frontend.ast.AstContractError;
import org.metricshub.jvast.frontend.ast.AstNode;
import org.metricshub.jvast.frontend.ast.Attribute;
import org.metricshub.jvast.frontend.ast.AttributeList;
import org.metricshub.jvast.frontend.ast.BinaryExpression;
import org.metricshub.jvast.frontend.ast.Concatenation;
import org.metricshub.jvast.frontend.ast.ConcatenationLvalue;
import org.metricshub.jvast.frontend.ast.ConditionalExpression;
import org.metricshub.jvast.frontend.ast.Expression;
import org.metricshub.jvast.frontend.ast.FunctionCall;
import org.metricshub.jvast.frontend.ast.FunctionCallPrimary;
import org.metricshub.jvast.frontend.ast.Identifier;
import org.metricshub.jvast.frontend.ast.IdentifierLvalue;
import org.metricshub.jvast.frontend.ast.Lvalue;
import org.metricshub.jvast.frontend.ast.MacroPrimary;
import org.metricshub.jvast.frontend.ast.MintypmaxExpression;
import org.metricshub.jvast.frontend.ast.Operator;
import org.metricshub.jvast.frontend.ast.Primary;
import org.metricshub.jvast.frontend.ast.PrimaryExpression;
import org.metricshub.jvast.frontend.ast.StringExpression;
import org.metricshub.jvast.frontend.ast.UnaryExpression;

public class AstFactoryExpressionTest {

	@Test
	public void testIdentifier() throws Exception {
		AstFactory factory = factory();
		Identifier id = factory.newIdentifier("clk");
		assertEquals("clk", id.getName());
		assertEquals("Identifier(clk)", id.toString());
		assertTrue(factory.getArena().owns(id));
		assertThrows(AstContractError.class, () -> factory.newIdentifier(null));
	}

	@Test
	public void testAttributesStayInSourceOrder() throws Exception {
		AstFactory factory = factory();
		// (* full_case, parallel_case = 1, keep *) reduced innermost first
		Attribute keep = factory.newAttribute(factory.newIdentifier("keep"), null);
		Attribute parallel = factory.newAttribute(factory.newIdentifier("parallel_case"), number(factory, "1"));
		Attribute full = factory.newAttribute(factory.newIdentifier("full_case"), null);

		AttributeList list = factory.newAttributeList(keep);
		factory.extendAttributes(list, parallel);
		factory.extendAttributes(list, full);

		assertEquals(3, list.getAttributes().count());
		assertSame(full, list.getAttributes().get(0));
		assertSame(parallel, list.getAttributes().get(1));
		assertSame(keep, list.getAttributes().get(2));
		assertSame(parallel, list.find("parallel_case"));
		assertNull(list.find("unknown"));
		assertSame(list, full.getParent());
	}

	@Test
	public void testPrimaryExpressionConstness() throws Exception {
		AstFactory factory = factory();
		Expression constant = number(factory, "42");
		Expression variable = ref(factory, "a");

		assertTrue("A constant primary gives a constant expression", constant.isConstant());
		assertFalse("A plain primary gives a variable expression", variable.isConstant());
		assertEquals(Expression.Type.PRIMARY_EXPRESSION, constant.getType());
		assertEquals(Primary.Kind.CONSTANT_PRIMARY, ((PrimaryExpression) constant).getPrimary().getKind());

		Expression modulePath = factory.newExpressionPrimary(
				factory.newIdentifierPrimary(Primary.Kind.MODULE_PATH_PRIMARY, factory.newIdentifier("top")));
		assertFalse(modulePath.isConstant());

		assertThrows(AstContractError.class, () -> factory.newExpressionPrimary(null));
	}

	@Test
	public void testUnaryAndBinaryExpressions() throws Exception {
		AstFactory factory = factory();
		Expression a = ref(factory, "a");
		Expression b = ref(factory, "b");

		BinaryExpression sum = factory.newBinaryExpression(a, b, Operator.PLUS, null, false);
		assertSame(a, sum.getLeft());
		assertSame(b, sum.getRight());
		assertEquals(Operator.PLUS, sum.getOperation());
		assertEquals("+", sum.getOperation().symbol());
		assertSame("Operands are adopted", sum, a.getParent());
		assertSame(sum, b.getParent());

		UnaryExpression negated = factory.newUnaryExpression(sum, Operator.MINUS, null, false);
		assertEquals(Expression.Type.UNARY_EXPRESSION, negated.getType());
		assertSame(sum, negated.getOperand());
		assertSame(negated, sum.getParent());

		UnaryExpression constant = factory.newUnaryExpression(number(factory, "3"), Operator.BITWISE_NOT, null, true);
		assertTrue(constant.isConstant());
	}

	@Test
	public void testExpressionVariants() throws Exception {
		AstFactory factory = factory();

		StringExpression text = factory.newStringExpression("hello");
		assertEquals("hello", text.getValue());
		assertTrue("Strings are constant", text.isConstant());

		assertFalse(factory.newRangeExpression(number(factory, "7"), number(factory, "0")).isConstant());
		assertEquals(Expression.Type.RANGE_EXPRESSION_INDEX, factory.newIndexExpression(number(factory, "3")).getType());

		ConditionalExpression choice = factory.newConditionalExpression(ref(factory, "sel"), ref(factory, "a"), ref(factory, "b"), null);
		assertEquals(Expression.Type.CONDITIONAL_EXPRESSION, choice.getType());
		assertSame(choice, choice.getIfFalse().getParent());
	}

	@Test
	public void testMintypmax() throws Exception {
		AstFactory factory = factory();
		MintypmaxExpression full = factory.newMintypmaxExpression(number(factory, "1"), number(factory, "2"), number(factory, "3"));
		assertFalse(full.isTypicalOnly());

		MintypmaxExpression typical = factory.newMintypmaxExpression(null, number(factory, "2"), null);
		assertTrue(typical.isTypicalOnly());

		assertThrows(AstContractError.class, () -> factory.newMintypmaxExpression(null, null, null));
		assertThrows(AstContractError.class, () -> factory.newMintypmaxExpression(number(factory, "1"), number(factory, "2"), null));
	}

	@Test
	public void testFunctionCallWithoutArguments() throws Exception {
		AstFactory factory = factory();
		FunctionCall call = factory.newFunctionCall(factory.newIdentifier("$time"), false, true, null, null);
		assertNotNull("Missing arguments become an empty list", call.getArguments());
		assertEquals(0, call.getArguments().count());
		assertTrue(call.isSystem());

		FunctionCallPrimary primary = factory.newPrimaryFunctionCall(call);
		assertEquals(Primary.Kind.PRIMARY, primary.getKind());
		assertEquals(Primary.ValueType.FUNCTION_CALL, primary.getValueType());
		assertFalse(factory.newExpressionPrimary(primary).isConstant());
	}

	@Test
	public void testFunctionCallArgumentsAreAdopted() throws Exception {
		AstFactory factory = factory();
		Expression x = ref(factory, "x");
		FunctionCall call = factory.newFunctionCall(factory.newIdentifier("clog2"), true, false, null, listOf(factory, x));
		assertSame(x, call.getArguments().get(0));
		assertSame(call, x.getParent());
	}

	@Test
	public void testMacroPrimary() throws Exception {
		AstFactory factory = factory();
		MacroPrimary macro = factory.newMacroPrimary(Primary.Kind.CONSTANT_PRIMARY, "`WIDTH");
		assertEquals("`WIDTH", macro.getText());
		assertEquals(Primary.ValueType.MACRO_USAGE, macro.getValueType());
	}

	@Test
	public void testConcatenationExtendsInSourceOrder() throws Exception {
		AstFactory factory = factory();
		// {E1, E2, E3} is reduced from the last element
		Expression e1 = ref(factory, "e1");
		Expression e2 = ref(factory, "e2");
		Expression e3 = ref(factory, "e3");

		Concatenation concatenation = factory.newConcatenation(Concatenation.Type.EXPRESSION, null, e3);
		factory.extendConcatenation(concatenation, null, e2);
		factory.extendConcatenation(concatenation, null, e1);

		assertEquals(3, concatenation.getItems().count());
		assertSame(e1, concatenation.getItems().get(0));
		assertSame(e2, concatenation.getItems().get(1));
		assertSame(e3, concatenation.getItems().get(2));
		assertSame(concatenation, e1.getParent());
	}

	@Test
	public void testConcatenationRepeat() throws Exception {
		AstFactory factory = factory();
		Expression four = number(factory, "4");
		Concatenation replicated = factory.newEmptyConcatenation(Concatenation.Type.CONSTANT_EXPRESSION);
		assertEquals(0, replicated.getItems().count());
		assertNull(replicated.getRepeat());

		factory.extendConcatenation(replicated, four, ref(factory, "b"));
		assertSame(four, replicated.getRepeat());

		factory.extendConcatenation(replicated, number(factory, "8"), ref(factory, "a"));
		assertSame("The first repeat count is kept", four, replicated.getRepeat());
	}

	@Test
	public void testLvaluePartitions() throws Exception {
		AstFactory factory = factory();
		IdentifierLvalue genvar = factory.newLvalueId(Lvalue.Type.GENVAR_IDENTIFIER, factory.newIdentifier("i"));
		assertEquals(Lvalue.Type.GENVAR_IDENTIFIER, genvar.getType());
		assertEquals("i", genvar.getIdentifier().getName());

		Concatenation nets = factory.newConcatenation(Concatenation.Type.NET, null, ref(factory, "lo"));
		ConcatenationLvalue both = factory.newLvalueConcat(Lvalue.Type.NET_CONCATENATION, nets);
		assertSame(nets, both.getConcatenation());

		assertThrows(
				"An identifier cannot be a concatenation lvalue",
				AstContractError.class,
				() -> factory.newLvalueConcat(Lvalue.Type.VAR_IDENTIFIER, nets));
		assertThrows(
				"A concatenation cannot be an identifier lvalue",
				AstContractError.class,
				() -> factory.newLvalueId(Lvalue.Type.VAR_CONCATENATION, factory.newIdentifier("x")));
	}

	@Test
	public void testEveryConstructorAllocatesThroughArena() throws Exception {
		AstFactory factory = factory();
		int before = factory.getArena().size();
		AstNode range = factory.newRange(number(factory, "3"), number(factory, "0"));
		assertTrue(factory.getArena().owns(range));
		assertTrue(factory.getArena().size() > before);
	}
}
