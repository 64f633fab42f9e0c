package org.metricshub.jvast;

import org.metricshub.jvast.arena.AstArena;
import org.metricshub.jvast.frontend.AstFactory;
import org.metricshub.jvast.frontend.ast.AstNode;
import org.metricshub.jvast.frontend.ast.DelayValue;
import org.metricshub.jvast.frontend.ast.EventControl;
import org.metricshub.jvast.frontend.ast.EventTimingControl;
import org.metricshub.jvast.frontend.ast.Expression;
import org.metricshub.jvast.frontend.ast.Edge;
import org.metricshub.jvast.frontend.ast.IdentifierLvalue;
import org.metricshub.jvast.frontend.ast.Lvalue;
import org.metricshub.jvast.frontend.ast.ModuleDeclaration;
import org.metricshub.jvast.frontend.ast.NetType;
import org.metricshub.jvast.frontend.ast.NumberLiteral;
import org.metricshub.jvast.frontend.ast.Operator;
import org.metricshub.jvast.frontend.ast.ParameterDeclarations;
import org.metricshub.jvast.frontend.ast.PortDeclaration;
import org.metricshub.jvast.frontend.ast.PortDirection;
import org.metricshub.jvast.frontend.ast.Primary;
import org.metricshub.jvast.frontend.ast.Statement;
import org.metricshub.jvast.frontend.ast.StatementBlock;
import org.metricshub.jvast.frontend.ast.TimingControlStatement;
import org.metricshub.jvast.util.AstList;
import org.metricshub.jvast.util.AstSettings;

/**
 * Helpers building the small sub-trees most tests need, the way the
 * grammar actions of a parser would.
 */
public final class AstTestSupport {

	private AstTestSupport() {}

	public static AstFactory factory() {
		return new AstFactory(new AstArena(new AstSettings()));
	}

	public static AstFactory factory(int maxBlocks) {
		AstSettings settings = new AstSettings();
		settings.setMaxBlocks(maxBlocks);
		return new AstFactory(new AstArena(settings));
	}

	/**
	 * @return a non-constant expression reading the net or variable <code>name</code>
	 */
	public static Expression ref(AstFactory factory, String name) {
		return factory.newExpressionPrimary(factory.newIdentifierPrimary(Primary.Kind.PRIMARY, factory.newIdentifier(name)));
	}

	/**
	 * @return a constant unsized decimal number
	 */
	public static Expression number(AstFactory factory, String digits) {
		NumberLiteral literal = factory.newNumber(NumberLiteral.Base.DECIMAL, NumberLiteral.Representation.INTEGER, 32, true, digits);
		return factory.newExpressionPrimary(factory.newNumberPrimary(Primary.Kind.CONSTANT_PRIMARY, literal));
	}

	public static IdentifierLvalue netLvalue(AstFactory factory, String name) {
		return factory.newLvalueId(Lvalue.Type.NET_IDENTIFIER, factory.newIdentifier(name));
	}

	public static IdentifierLvalue varLvalue(AstFactory factory, String name) {
		return factory.newLvalueId(Lvalue.Type.VAR_IDENTIFIER, factory.newIdentifier(name));
	}

	@SafeVarargs
	public static <T> AstList<T> listOf(AstFactory factory, T... items) {
		AstList<T> list = factory.newList();
		for (T item : items) {
			list.append(item);
		}
		return list;
	}

	/**
	 * @return <code>target = value;</code> as a statement
	 */
	public static Statement blockingAssign(AstFactory factory, String target, Expression value) {
		return factory.newStatement(
				null,
				false,
				factory.newBlockingAssignment(varLvalue(factory, target), value, null),
				Statement.Type.ASSIGNMENT);
	}

	public static DelayValue numberDelay(AstFactory factory, String digits) {
		return factory.newDelayValue(
				DelayValue.Type.NUMBER,
				factory.newNumber(NumberLiteral.Base.DECIMAL, NumberLiteral.Representation.INTEGER, 32, false, digits));
	}

	/**
	 * Builds the tree of:
	 *
	 * <pre>
	 * module counter #(parameter WIDTH = 8) (input clk, output reg [WIDTH-1:0] q);
	 *   always @(posedge clk) begin
	 *     q = q + 1;
	 *   end
	 * endmodule
	 * </pre>
	 *
	 * @return the module declaration
	 */
	public static ModuleDeclaration counterModule(AstFactory factory) {
		ParameterDeclarations width = factory.newParameterDeclarations(
				listOf(factory, factory.newSingleAssignment(
						factory.newLvalueId(Lvalue.Type.VAR_IDENTIFIER, factory.newIdentifier("WIDTH")),
						number(factory, "8"))),
				false,
				false,
				null,
				ParameterDeclarations.Type.GENERIC);

		PortDeclaration clk = factory.newPortDeclaration(
				PortDirection.INPUT,
				NetType.NONE,
				false,
				false,
				false,
				null,
				listOf(factory, factory.newIdentifier("clk")));
		PortDeclaration q = factory.newPortDeclaration(
				PortDirection.OUTPUT,
				NetType.NONE,
				false,
				true,
				false,
				factory.newRange(
						factory.newBinaryExpression(ref(factory, "WIDTH"), number(factory, "1"), Operator.MINUS, null, true),
						number(factory, "0")),
				listOf(factory, factory.newIdentifier("q")));

		Statement increment = blockingAssign(
				factory,
				"q",
				factory.newBinaryExpression(ref(factory, "q"), number(factory, "1"), Operator.PLUS, null, false));
		Statement body = factory.newStatement(
				null,
				false,
				factory.newStatementBlock(StatementBlock.Type.SEQUENTIAL, null, null, listOf(factory, increment)),
				Statement.Type.BLOCK);
		EventTimingControl onClock = factory.newTimingControlStatementEvent(
				TimingControlStatement.Type.EVENT_CONTROL,
				null,
				body,
				factory.newEventControl(EventControl.Type.TRIGGERS, factory.newEventExpression(Edge.POSITIVE, ref(factory, "clk"))));
		Statement always = factory.newStatement(
				null,
				false,
				factory.newStatement(null, false, onClock, Statement.Type.TIMING_CONTROL),
				Statement.Type.ALWAYS);

		return factory.newModuleDeclaration(
				null,
				factory.newIdentifier("counter"),
				listOf(factory, width),
				listOf(factory, clk, q),
				listOf(factory, always));
	}

	/**
	 * @return whether <code>child</code> reports <code>parent</code> as its parent
	 */
	public static boolean isChildOf(AstNode child, AstNode parent) {
		return child.getParent() == parent;
	}
}
