package org.metricshub.jvast.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * JVast
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.function.Supplier;
import org.metricshub.jvast.arena.AstAllocationException;
import org.metricshub.jvast.arena.AstArena;
import org.metricshub.jvast.frontend.ast.AstContractError;
import org.metricshub.jvast.frontend.ast.AstNode;
import org.metricshub.jvast.frontend.ast.Attribute;
import org.metricshub.jvast.frontend.ast.AttributeList;
import org.metricshub.jvast.frontend.ast.BinaryExpression;
import org.metricshub.jvast.frontend.ast.CaseItem;
import org.metricshub.jvast.frontend.ast.CaseStatement;
import org.metricshub.jvast.frontend.ast.CmosSwitchInstance;
import org.metricshub.jvast.frontend.ast.Concatenation;
import org.metricshub.jvast.frontend.ast.ConcatenationLvalue;
import org.metricshub.jvast.frontend.ast.ConcatenationPrimary;
import org.metricshub.jvast.frontend.ast.ConditionLoop;
import org.metricshub.jvast.frontend.ast.ConditionalExpression;
import org.metricshub.jvast.frontend.ast.ConditionalStatement;
import org.metricshub.jvast.frontend.ast.ContinuousAssignment;
import org.metricshub.jvast.frontend.ast.Delay2;
import org.metricshub.jvast.frontend.ast.Delay3;
import org.metricshub.jvast.frontend.ast.DelayControl;
import org.metricshub.jvast.frontend.ast.DelayTimingControl;
import org.metricshub.jvast.frontend.ast.DelayValue;
import org.metricshub.jvast.frontend.ast.DisableStatement;
import org.metricshub.jvast.frontend.ast.DriveStrength;
import org.metricshub.jvast.frontend.ast.Edge;
import org.metricshub.jvast.frontend.ast.EdgeEventExpression;
import org.metricshub.jvast.frontend.ast.EdgeSensitiveFullPath;
import org.metricshub.jvast.frontend.ast.EdgeSensitiveParallelPath;
import org.metricshub.jvast.frontend.ast.EnableGateInstance;
import org.metricshub.jvast.frontend.ast.EnableGateInstances;
import org.metricshub.jvast.frontend.ast.EventControl;
import org.metricshub.jvast.frontend.ast.EventExpression;
import org.metricshub.jvast.frontend.ast.EventSequence;
import org.metricshub.jvast.frontend.ast.EventTimingControl;
import org.metricshub.jvast.frontend.ast.Expression;
import org.metricshub.jvast.frontend.ast.ForLoop;
import org.metricshub.jvast.frontend.ast.ForeverLoop;
import org.metricshub.jvast.frontend.ast.FunctionCall;
import org.metricshub.jvast.frontend.ast.FunctionCallPrimary;
import org.metricshub.jvast.frontend.ast.GateInstantiation;
import org.metricshub.jvast.frontend.ast.GenerateBlock;
import org.metricshub.jvast.frontend.ast.HybridAssignment;
import org.metricshub.jvast.frontend.ast.Identifier;
import org.metricshub.jvast.frontend.ast.IdentifierLvalue;
import org.metricshub.jvast.frontend.ast.IdentifierPrimary;
import org.metricshub.jvast.frontend.ast.IfElse;
import org.metricshub.jvast.frontend.ast.IndexExpression;
import org.metricshub.jvast.frontend.ast.LevelSymbol;
import org.metricshub.jvast.frontend.ast.LoopStatement;
import org.metricshub.jvast.frontend.ast.Lvalue;
import org.metricshub.jvast.frontend.ast.MacroPrimary;
import org.metricshub.jvast.frontend.ast.MintypmaxExpression;
import org.metricshub.jvast.frontend.ast.MintypmaxPrimary;
import org.metricshub.jvast.frontend.ast.ModuleDeclaration;
import org.metricshub.jvast.frontend.ast.ModuleInstance;
import org.metricshub.jvast.frontend.ast.ModuleInstantiation;
import org.metricshub.jvast.frontend.ast.MosSwitchInstance;
import org.metricshub.jvast.frontend.ast.NInputGateInstance;
import org.metricshub.jvast.frontend.ast.NInputGateInstances;
import org.metricshub.jvast.frontend.ast.NOutputGateInstance;
import org.metricshub.jvast.frontend.ast.NOutputGateInstances;
import org.metricshub.jvast.frontend.ast.NetType;
import org.metricshub.jvast.frontend.ast.NumberLiteral;
import org.metricshub.jvast.frontend.ast.NumberPrimary;
import org.metricshub.jvast.frontend.ast.Operator;
import org.metricshub.jvast.frontend.ast.ParameterDeclarations;
import org.metricshub.jvast.frontend.ast.PassEnableSwitch;
import org.metricshub.jvast.frontend.ast.PassEnableSwitches;
import org.metricshub.jvast.frontend.ast.PassSwitchInstance;
import org.metricshub.jvast.frontend.ast.PathDeclaration;
import org.metricshub.jvast.frontend.ast.PathDescription;
import org.metricshub.jvast.frontend.ast.PortConnection;
import org.metricshub.jvast.frontend.ast.PortDeclaration;
import org.metricshub.jvast.frontend.ast.PortDirection;
import org.metricshub.jvast.frontend.ast.Primary;
import org.metricshub.jvast.frontend.ast.PrimaryExpression;
import org.metricshub.jvast.frontend.ast.PrimitivePullStrength;
import org.metricshub.jvast.frontend.ast.PrimitiveStrength;
import org.metricshub.jvast.frontend.ast.ProceduralAssignment;
import org.metricshub.jvast.frontend.ast.PullDirection;
import org.metricshub.jvast.frontend.ast.PullGateInstance;
import org.metricshub.jvast.frontend.ast.PullGateInstances;
import org.metricshub.jvast.frontend.ast.PullStrength;
import org.metricshub.jvast.frontend.ast.Range;
import org.metricshub.jvast.frontend.ast.RangeExpression;
import org.metricshub.jvast.frontend.ast.SimpleFullPath;
import org.metricshub.jvast.frontend.ast.SimpleParallelPath;
import org.metricshub.jvast.frontend.ast.SingleAssignment;
import org.metricshub.jvast.frontend.ast.SourceText;
import org.metricshub.jvast.frontend.ast.Statement;
import org.metricshub.jvast.frontend.ast.StatementBlock;
import org.metricshub.jvast.frontend.ast.StringExpression;
import org.metricshub.jvast.frontend.ast.SwitchGate;
import org.metricshub.jvast.frontend.ast.Switches;
import org.metricshub.jvast.frontend.ast.TaskEnableStatement;
import org.metricshub.jvast.frontend.ast.TimingControlStatement;
import org.metricshub.jvast.frontend.ast.TypeDeclaration;
import org.metricshub.jvast.frontend.ast.UdpBody;
import org.metricshub.jvast.frontend.ast.UdpCombinatorialEntry;
import org.metricshub.jvast.frontend.ast.UdpDeclaration;
import org.metricshub.jvast.frontend.ast.UdpEntry;
import org.metricshub.jvast.frontend.ast.UdpInitialStatement;
import org.metricshub.jvast.frontend.ast.UdpInputPort;
import org.metricshub.jvast.frontend.ast.UdpInputSymbol;
import org.metricshub.jvast.frontend.ast.UdpInstance;
import org.metricshub.jvast.frontend.ast.UdpInstantiation;
import org.metricshub.jvast.frontend.ast.UdpNextState;
import org.metricshub.jvast.frontend.ast.UdpOutputPort;
import org.metricshub.jvast.frontend.ast.UdpPort;
import org.metricshub.jvast.frontend.ast.UdpSequentialEntry;
import org.metricshub.jvast.frontend.ast.UnaryExpression;
import org.metricshub.jvast.frontend.ast.WaitStatement;
import org.metricshub.jvast.util.AstList;

/**
 * Builds the nodes of the Verilog syntax tree on behalf of the parser.
 * <p>
 * The grammar actions call these methods bottom-up while reducing
 * productions, passing the nodes built so far, until the root
 * ({@link SourceText}) is produced. Every method allocates exactly one new
 * node (plus, where documented, the empty list it needs) through the
 * {@link AstArena} of this factory, links the children it is given to it,
 * checks the grammar invariants local to the node, and returns it.
 * <p>
 * Only the <code>extend*</code> methods modify nodes that already exist.
 * <p>
 * Invariant violations are reported as {@link AstContractError}: they are
 * mistakes of the grammar actions, not of the parsed source.
 * {@link AstAllocationException} reports an exhausted arena.
 * <p>
 * A factory is used by one thread at a time, like its arena.
 */
public class AstFactory {

	private final AstArena arena;

	/**
	 * Creates a factory over a new arena with default settings.
	 */
	public AstFactory() {
		this(new AstArena());
	}

	/**
	 * @param arena the arena recording every node built by this factory
	 */
	public AstFactory(AstArena arena) {
		if (arena == null) {
			throw new IllegalArgumentException("arena must not be null");
		}
		this.arena = arena;
	}

	/**
	 * @return the arena recording the nodes of this factory
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The driver releases the arena once the tree is no longer needed.")
	public AstArena getArena() {
		return arena;
	}

	/**
	 * Releases every node built so far. Shortcut for
	 * <code>getArena().releaseAll()</code>.
	 */
	public void releaseAll() {
		arena.releaseAll();
	}

	private <T extends AstNode> T build(Supplier<T> constructor, Object... children) {
		T node = arena.allocate(constructor);
		for (Object child : children) {
			adopt(node, child);
		}
		return node;
	}

	private static void adopt(AstNode parent, Object child) {
		if (child instanceof AstNode) {
			((AstNode) child).setParent(parent);
		} else if (child instanceof AstList) {
			for (Object element : (AstList<?>) child) {
				if (element instanceof AstNode) {
					((AstNode) element).setParent(parent);
				}
			}
		}
	}

	private <T> AstList<T> orEmpty(AstList<T> list) {
		return list != null ? list : this.<T>newList();
	}

	// ===============================================================================
	// Lists

	/**
	 * @param <T> element type
	 * @return a new empty list, recorded by the arena
	 */
	public <T> AstList<T> newList() {
		return arena.allocate(AstList::new);
	}

	/**
	 * @param first the first element
	 * @param <T> element type
	 * @return a new list holding <code>first</code>
	 */
	public <T> AstList<T> newList(T first) {
		AstList<T> list = newList();
		list.append(first);
		return list;
	}

	// ===============================================================================
	// Identifiers, attributes, literals

	public Identifier newIdentifier(String name) {
		AstContractError.check(name != null, "An identifier needs a name");
		return build(() -> new Identifier(name));
	}

	/**
	 * Creates one <code>name = value</code> attribute.
	 *
	 * @param name attribute name
	 * @param value attribute value, or <code>null</code>
	 * @return the new attribute
	 */
	public Attribute newAttribute(Identifier name, Expression value) {
		return build(() -> new Attribute(name, value), name, value);
	}

	/**
	 * Creates an attribute list holding a single attribute.
	 *
	 * @param attribute the first attribute reduced
	 * @return the new attribute list
	 */
	public AttributeList newAttributeList(Attribute attribute) {
		AstList<Attribute> attributes = newList(attribute);
		return build(() -> new AttributeList(attributes), attributes);
	}

	/**
	 * Adds an attribute to an attribute list under construction.
	 * <p>
	 * Attribute lists are reduced by a left-recursive rule, innermost
	 * attribute first, so the new attribute goes in front to keep the final
	 * list in source order.
	 *
	 * @param list the list being built
	 * @param attribute the attribute to add
	 */
	public void extendAttributes(AttributeList list, Attribute attribute) {
		list.getAttributes().prepend(attribute);
		adopt(list, attribute);
	}

	public NumberLiteral newNumber(NumberLiteral.Base base, NumberLiteral.Representation representation, int width, boolean signed, String digits) {
		return build(() -> new NumberLiteral(base, representation, width, signed, digits));
	}

	public Range newRange(Expression upper, Expression lower) {
		return build(() -> new Range(upper, lower), upper, lower);
	}

	// ===============================================================================
	// Lvalues

	/**
	 * Creates an lvalue naming a single net, variable or genvar.
	 *
	 * @param type one of {@link Lvalue.Type#NET_IDENTIFIER},
	 *        {@link Lvalue.Type#VAR_IDENTIFIER} or {@link Lvalue.Type#GENVAR_IDENTIFIER}
	 * @param identifier the assigned name
	 * @return the new lvalue
	 * @throws AstContractError if <code>type</code> is a concatenation type
	 */
	public IdentifierLvalue newLvalueId(Lvalue.Type type, Identifier identifier) {
		AstContractError.check(type != null && !type.isConcatenation(), "Identifier lvalue cannot be of type " + type);
		return build(() -> new IdentifierLvalue(type, identifier), identifier);
	}

	/**
	 * Creates an lvalue made of a net or variable concatenation.
	 *
	 * @param type {@link Lvalue.Type#NET_CONCATENATION} or {@link Lvalue.Type#VAR_CONCATENATION}
	 * @param concatenation the assigned concatenation
	 * @return the new lvalue
	 * @throws AstContractError if <code>type</code> is an identifier type
	 */
	public ConcatenationLvalue newLvalueConcat(Lvalue.Type type, Concatenation concatenation) {
		AstContractError.check(type != null && type.isConcatenation(), "Concatenation lvalue cannot be of type " + type);
		return build(() -> new ConcatenationLvalue(type, concatenation), concatenation);
	}

	// ===============================================================================
	// Primaries

	public NumberPrimary newNumberPrimary(Primary.Kind kind, NumberLiteral number) {
		return build(() -> new NumberPrimary(kind, number), number);
	}

	public IdentifierPrimary newIdentifierPrimary(Primary.Kind kind, Identifier identifier) {
		return build(() -> new IdentifierPrimary(kind, identifier), identifier);
	}

	public ConcatenationPrimary newConcatenationPrimary(Primary.Kind kind, Concatenation concatenation) {
		return build(() -> new ConcatenationPrimary(kind, concatenation), concatenation);
	}

	public MintypmaxPrimary newMintypmaxPrimary(Primary.Kind kind, MintypmaxExpression expression) {
		return build(() -> new MintypmaxPrimary(kind, expression), expression);
	}

	public MacroPrimary newMacroPrimary(Primary.Kind kind, String text) {
		return build(() -> new MacroPrimary(kind, text));
	}

	/**
	 * Wraps a function call into a (non-constant) primary.
	 *
	 * @param call the function call
	 * @return the new primary
	 */
	public FunctionCallPrimary newPrimaryFunctionCall(FunctionCall call) {
		return build(() -> new FunctionCallPrimary(call), call);
	}

	// ===============================================================================
	// Expressions

	/**
	 * Wraps a primary into an expression. The expression is constant if and
	 * only if the primary is a {@link Primary.Kind#CONSTANT_PRIMARY}.
	 *
	 * @param primary the wrapped primary
	 * @return the new expression
	 */
	public PrimaryExpression newExpressionPrimary(Primary primary) {
		AstContractError.check(primary != null, "A primary expression needs a primary");
		return build(() -> new PrimaryExpression(primary), primary);
	}

	public UnaryExpression newUnaryExpression(Expression operand, Operator operation, AttributeList attributes, boolean constant) {
		return build(() -> new UnaryExpression(operation, operand, attributes, constant), operand, attributes);
	}

	public BinaryExpression newBinaryExpression(Expression left, Expression right, Operator operation, AttributeList attributes, boolean constant) {
		return build(() -> new BinaryExpression(left, operation, right, attributes, constant), left, right, attributes);
	}

	public RangeExpression newRangeExpression(Expression left, Expression right) {
		return build(() -> new RangeExpression(left, right), left, right);
	}

	public IndexExpression newIndexExpression(Expression index) {
		return build(() -> new IndexExpression(index), index);
	}

	public StringExpression newStringExpression(String value) {
		return build(() -> new StringExpression(value));
	}

	public ConditionalExpression newConditionalExpression(Expression condition, Expression ifTrue, Expression ifFalse, AttributeList attributes) {
		return build(() -> new ConditionalExpression(condition, ifTrue, ifFalse, attributes), condition, ifTrue, ifFalse, attributes);
	}

	/**
	 * Creates a <code>min:typ:max</code> expression. For a typical value
	 * alone, pass <code>null</code> for <code>min</code> and <code>max</code>.
	 *
	 * @param min minimum, or <code>null</code>
	 * @param typ typical value
	 * @param max maximum, or <code>null</code>
	 * @return the new expression
	 */
	public MintypmaxExpression newMintypmaxExpression(Expression min, Expression typ, Expression max) {
		AstContractError.check(typ != null, "A mintypmax expression needs a typical value");
		AstContractError.check((min == null) == (max == null), "A mintypmax expression needs both min and max, or neither");
		return build(() -> new MintypmaxExpression(min, typ, max), min, typ, max);
	}

	/**
	 * Creates a function call.
	 *
	 * @param function the called function
	 * @param constant whether this is a constant function call
	 * @param system whether this is a system function
	 * @param attributes attributes of the call, or <code>null</code>
	 * @param arguments the arguments; <code>null</code> is replaced by an empty list
	 * @return the new call
	 */
	public FunctionCall newFunctionCall(Identifier function, boolean constant, boolean system, AttributeList attributes, AstList<Expression> arguments) {
		AstList<Expression> args = orEmpty(arguments);
		return build(() -> new FunctionCall(function, constant, system, attributes, args), function, attributes, args);
	}

	// ===============================================================================
	// Concatenations

	/**
	 * Starts a concatenation with its first reduced element.
	 *
	 * @param type kind of the concatenated items
	 * @param repeat replication count, or <code>null</code>
	 * @param firstValue the first element reduced
	 * @return the new concatenation
	 */
	public Concatenation newConcatenation(Concatenation.Type type, Expression repeat, AstNode firstValue) {
		AstList<AstNode> items = newList(firstValue);
		return build(() -> new Concatenation(type, repeat, items), repeat, items);
	}

	public Concatenation newEmptyConcatenation(Concatenation.Type type) {
		AstList<AstNode> items = newList();
		return build(() -> new Concatenation(type, null, items), items);
	}

	/**
	 * Adds an element to a concatenation under construction.
	 * <p>
	 * Concatenation elements are reduced innermost first, so the element is
	 * put in front: successive extensions leave the items in source order.
	 *
	 * @param concatenation the concatenation being built
	 * @param repeat replication count, recorded if the concatenation has none yet
	 * @param item the element to add
	 */
	public void extendConcatenation(Concatenation concatenation, Expression repeat, AstNode item) {
		concatenation.getItems().prepend(item);
		adopt(concatenation, item);
		if (repeat != null && concatenation.getRepeat() == null) {
			concatenation.setRepeat(repeat);
			adopt(concatenation, repeat);
		}
	}

	// ===============================================================================
	// Path declarations

	/**
	 * Creates a path declaration.
	 *
	 * @param type the kind of path
	 * @param stateExpression the <code>if</code> condition, required by state
	 *        dependent paths and forbidden otherwise
	 * @param description the path itself; its shape (edge sensitivity, full or
	 *        parallel) must match <code>type</code>
	 * @return the new declaration
	 */
	public PathDeclaration newPathDeclaration(PathDeclaration.Type type, Expression stateExpression, PathDescription description) {
		AstContractError.check(type != null && type.accepts(description), "Path description " + description + " does not match " + type);
		AstContractError.check(type.isStateDependent() == (stateExpression != null),
				type + (type.isStateDependent() ? " requires" : " does not take") + " a state expression");
		return build(() -> new PathDeclaration(type, stateExpression, description), stateExpression, description);
	}

	public SimpleParallelPath newSimpleParallelPathDeclaration(
			Identifier inputTerminal,
			Operator polarity,
			Identifier outputTerminal,
			AstList<Expression> delayValue) {
		return build(() -> new SimpleParallelPath(inputTerminal, polarity, outputTerminal, delayValue), inputTerminal, outputTerminal, delayValue);
	}

	public SimpleFullPath newSimpleFullPathDeclaration(
			AstList<Identifier> inputTerminals,
			Operator polarity,
			AstList<Identifier> outputTerminals,
			AstList<Expression> delayValue) {
		return build(() -> new SimpleFullPath(inputTerminals, polarity, outputTerminals, delayValue), inputTerminals, outputTerminals, delayValue);
	}

	public EdgeSensitiveParallelPath newEdgeSensitiveParallelPathDeclaration(
			Edge edge,
			Identifier inputTerminal,
			Operator polarity,
			Identifier outputTerminal,
			Expression dataSource,
			AstList<Expression> delayValue) {
		return build(
				() -> new EdgeSensitiveParallelPath(edge, inputTerminal, polarity, outputTerminal, dataSource, delayValue),
				inputTerminal,
				outputTerminal,
				dataSource,
				delayValue);
	}

	public EdgeSensitiveFullPath newEdgeSensitiveFullPathDeclaration(
			Edge edge,
			AstList<Identifier> inputTerminals,
			Operator polarity,
			AstList<Identifier> outputTerminals,
			Expression dataSource,
			AstList<Expression> delayValue) {
		return build(
				() -> new EdgeSensitiveFullPath(edge, inputTerminals, polarity, outputTerminals, dataSource, delayValue),
				inputTerminals,
				outputTerminals,
				dataSource,
				delayValue);
	}

	// ===============================================================================
	// Procedural statements

	public TaskEnableStatement newTaskEnableStatement(AstList<Expression> expressions, Identifier identifier, boolean system) {
		return build(() -> new TaskEnableStatement(expressions, identifier, system), expressions, identifier);
	}

	public ForeverLoop newForeverLoopStatement(Statement body) {
		return build(() -> new ForeverLoop(body), body);
	}

	/**
	 * Creates a <code>for</code> loop.
	 *
	 * @param body the loop body
	 * @param initial assignment initializing the loop variable
	 * @param modify assignment run after each iteration
	 * @param condition expression deciding whether to iterate again
	 * @return the new loop
	 */
	public ForLoop newForLoopStatement(Statement body, SingleAssignment initial, SingleAssignment modify, Expression condition) {
		return build(() -> new ForLoop(body, initial, condition, modify), body, initial, modify, condition);
	}

	public ConditionLoop newWhileLoopStatement(Statement body, Expression condition) {
		return build(() -> new ConditionLoop(LoopStatement.Type.WHILE, body, condition), body, condition);
	}

	public ConditionLoop newRepeatLoopStatement(Statement body, Expression count) {
		return build(() -> new ConditionLoop(LoopStatement.Type.REPEAT, body, count), body, count);
	}

	/**
	 * @param conditions the expressions selecting this arm
	 * @param body the statement run when the arm is selected
	 * @return a new, non-default, case arm
	 */
	public CaseItem newCaseItem(AstList<Expression> conditions, Statement body) {
		return build(() -> new CaseItem(conditions, body, false), conditions, body);
	}

	/**
	 * @param body the statement run when no other arm is selected
	 * @return a new <code>default:</code> arm, with an empty condition list
	 */
	public CaseItem newDefaultCaseItem(Statement body) {
		AstList<Expression> conditions = newList();
		return build(() -> new CaseItem(conditions, body, true), conditions, body);
	}

	/**
	 * Creates a case statement and resolves its default arm.
	 * <p>
	 * The arms are scanned from the first one; the scan ends at the first
	 * <code>null</code> entry or at the first arm flagged as default, which
	 * becomes the default item. Other default arms are kept but ignored.
	 *
	 * @param expression the selector
	 * @param cases the arms, in source order
	 * @param type <code>case</code>, <code>casex</code> or <code>casez</code>
	 * @return the new case statement
	 */
	public CaseStatement newCaseStatement(Expression expression, AstList<CaseItem> cases, CaseStatement.Type type) {
		AstList<CaseItem> items = orEmpty(cases);
		CaseItem defaultItem = null;
		for (int i = 0; i < items.count(); i++) {
			CaseItem item = items.get(i);
			if (item == null) {
				break;
			}
			if (item.isDefault()) {
				defaultItem = item;
				break;
			}
		}
		CaseItem resolvedDefault = defaultItem;
		return build(() -> new CaseStatement(expression, items, type, resolvedDefault), expression, items);
	}

	public ConditionalStatement newConditionalStatement(Statement statement, Expression condition) {
		return build(() -> new ConditionalStatement(statement, condition), statement, condition);
	}

	/**
	 * Creates an if-else chain with its first branch.
	 *
	 * @param ifCondition the <code>if</code> branch
	 * @param elseStatement the final <code>else</code> body, or <code>null</code>
	 * @return the new chain
	 */
	public IfElse newIfElse(ConditionalStatement ifCondition, Statement elseStatement) {
		AstList<ConditionalStatement> branches = newList(ifCondition);
		return build(() -> new IfElse(branches, elseStatement), branches, elseStatement);
	}

	/**
	 * Adds <code>else if</code> branches after the existing branches of a
	 * chain, before its final <code>else</code>. The new branches must already
	 * be in source order; they get a lower priority than the existing ones.
	 *
	 * @param ifElse the chain to extend
	 * @param newStatements branches to add; <code>null</code> is a no-op
	 */
	public void extendIfElse(IfElse ifElse, AstList<ConditionalStatement> newStatements) {
		if (newStatements == null) {
			return;
		}
		ifElse.getConditionalStatements().concat(newStatements);
		adopt(ifElse, newStatements);
	}

	public WaitStatement newWaitStatement(Expression waitFor, Statement statement) {
		return build(() -> new WaitStatement(waitFor, statement), waitFor, statement);
	}

	public DisableStatement newDisableStatement(Identifier identifier) {
		return build(() -> new DisableStatement(identifier), identifier);
	}

	// ===============================================================================
	// Events, delays and timing controls

	/**
	 * Creates an event on an edge of <code>expression</code>:
	 * {@link Edge#POSITIVE} gives a posedge event, {@link Edge#NEGATIVE} a
	 * negedge event and {@link Edge#ANY} an event on any change.
	 *
	 * @param triggerEdge the edge; {@link Edge#NONE} is a contract violation
	 * @param expression the watched expression
	 * @return the new event
	 */
	public EdgeEventExpression newEventExpression(Edge triggerEdge, Expression expression) {
		AstContractError.check(triggerEdge != null && triggerEdge != Edge.NONE, "An event expression needs an edge, got " + triggerEdge);
		EventExpression.Type type;
		switch (triggerEdge) {
		case POSITIVE:
			type = EventExpression.Type.POSEDGE;
			break;
		case NEGATIVE:
			type = EventExpression.Type.NEGEDGE;
			break;
		default:
			type = EventExpression.Type.EXPRESSION;
			break;
		}
		return build(() -> new EdgeEventExpression(type, expression), expression);
	}

	/**
	 * Joins two events with <code>or</code>. The sequence holds
	 * <code>right</code> first, then <code>left</code>.
	 *
	 * @param left the event reduced first
	 * @param right the event reduced last
	 * @return the new sequence
	 */
	public EventSequence newEventExpressionSequence(EventExpression left, EventExpression right) {
		AstList<EventExpression> sequence = newList();
		sequence.append(right);
		sequence.append(left);
		return build(() -> new EventSequence(sequence), sequence);
	}

	/**
	 * @param type event control kind
	 * @param expression the events; must be <code>null</code> for {@link EventControl.Type#ANY}
	 * @return the new event control
	 */
	public EventControl newEventControl(EventControl.Type type, EventExpression expression) {
		AstContractError.check(type != EventControl.Type.ANY || expression == null, "@* event control cannot have an expression");
		return build(() -> new EventControl(type, expression), expression);
	}

	/**
	 * @param type delay value kind
	 * @param value the value, whose class must match <code>type</code>
	 * @return the new delay value
	 */
	public DelayValue newDelayValue(DelayValue.Type type, AstNode value) {
		AstContractError.check(type != null && type.accepts(value), type + " delay value cannot hold " + value);
		return build(() -> new DelayValue(type, value), value);
	}

	public Delay2 newDelay2(DelayValue min, DelayValue max) {
		return build(() -> new Delay2(min, max), min, max);
	}

	public Delay3 newDelay3(DelayValue min, DelayValue avg, DelayValue max) {
		return build(() -> new Delay3(min, avg, max), min, avg, max);
	}

	public DelayControl newDelayCtrlValue(DelayValue value) {
		return build(() -> DelayControl.ofValue(value), value);
	}

	public DelayControl newDelayCtrlMintypmax(Expression mintypmax) {
		return build(() -> DelayControl.ofMintypmax(mintypmax), mintypmax);
	}

	/**
	 * @param type must be {@link TimingControlStatement.Type#DELAY_CONTROL}
	 * @param statement the controlled statement, or <code>null</code>
	 * @param delayControl the delay
	 * @return the new timing control
	 */
	public DelayTimingControl newTimingControlStatementDelay(TimingControlStatement.Type type, Statement statement, DelayControl delayControl) {
		AstContractError.check(type == TimingControlStatement.Type.DELAY_CONTROL, "Delay timing control cannot be of type " + type);
		return build(() -> new DelayTimingControl(statement, delayControl), statement, delayControl);
	}

	/**
	 * @param type {@link TimingControlStatement.Type#EVENT_CONTROL} or
	 *        {@link TimingControlStatement.Type#EVENT_CONTROL_REPEAT}
	 * @param repeat repeat count of <code>repeat (n) @(...)</code>, or <code>null</code>
	 * @param statement the controlled statement, or <code>null</code>
	 * @param eventControl the events
	 * @return the new timing control
	 */
	public EventTimingControl newTimingControlStatementEvent(
			TimingControlStatement.Type type,
			Expression repeat,
			Statement statement,
			EventControl eventControl) {
		AstContractError.check(type == TimingControlStatement.Type.EVENT_CONTROL || type == TimingControlStatement.Type.EVENT_CONTROL_REPEAT,
				"Event timing control cannot be of type " + type);
		return build(() -> new EventTimingControl(type, repeat, statement, eventControl), repeat, statement, eventControl);
	}

	// ===============================================================================
	// Assignments

	public SingleAssignment newSingleAssignment(Lvalue lvalue, Expression expression) {
		return build(() -> new SingleAssignment(lvalue, expression), lvalue, expression);
	}

	/**
	 * Creates an <code>assign</code> or <code>force</code> procedural continuous assignment.
	 *
	 * @param kind a kind that carries an assignment
	 * @param assignment the assignment
	 * @return the new hybrid assignment
	 */
	public HybridAssignment newHybridAssignment(HybridAssignment.Kind kind, SingleAssignment assignment) {
		AstContractError.check(kind != null && kind.isWithAssignment(), kind + " does not take an assignment");
		return build(() -> HybridAssignment.ofAssignment(kind, assignment), assignment);
	}

	/**
	 * Creates a <code>deassign</code> or <code>release</code> statement.
	 *
	 * @param kind a kind that only names its target
	 * @param lvalue the target
	 * @return the new hybrid assignment
	 */
	public HybridAssignment newHybridLvalAssignment(HybridAssignment.Kind kind, Lvalue lvalue) {
		AstContractError.check(kind != null && !kind.isWithAssignment(), kind + " takes an assignment, not an lvalue");
		return build(() -> HybridAssignment.ofLvalue(kind, lvalue), lvalue);
	}

	public ProceduralAssignment newBlockingAssignment(Lvalue lvalue, Expression expression, TimingControlStatement delayOrEvent) {
		return build(() -> new ProceduralAssignment(true, lvalue, expression, delayOrEvent), lvalue, expression, delayOrEvent);
	}

	public ProceduralAssignment newNonblockingAssignment(Lvalue lvalue, Expression expression, TimingControlStatement delayOrEvent) {
		return build(() -> new ProceduralAssignment(false, lvalue, expression, delayOrEvent), lvalue, expression, delayOrEvent);
	}

	public ContinuousAssignment newContinuousAssignment(AstList<SingleAssignment> assignments, DriveStrength strength, Delay3 delay) {
		return build(() -> new ContinuousAssignment(assignments, strength, delay), assignments, strength, delay);
	}

	// ===============================================================================
	// Blocks, statements and generate items

	public StatementBlock newStatementBlock(
			StatementBlock.Type type,
			Identifier blockIdentifier,
			AstList<AstNode> declarations,
			AstList<Statement> statements) {
		AstList<AstNode> decls = orEmpty(declarations);
		AstList<Statement> stmts = orEmpty(statements);
		return build(() -> new StatementBlock(type, blockIdentifier, decls, stmts), blockIdentifier, decls, stmts);
	}

	/**
	 * Wraps a construct into a statement.
	 *
	 * @param attributes attributes of the statement, or <code>null</code>
	 * @param functionStatement whether the statement is in a function body
	 * @param construct the construct; its class must be the one <code>type</code> accepts
	 * @param type the statement tag
	 * @return the new statement
	 */
	public Statement newStatement(AttributeList attributes, boolean functionStatement, AstNode construct, Statement.Type type) {
		checkStatementConstruct(type, construct);
		return build(() -> new Statement(attributes, functionStatement, false, construct, type), attributes, construct);
	}

	/**
	 * Wraps a construct into a statement flagged as a generate item.
	 *
	 * @param type the statement tag
	 * @param construct the construct; its class must be the one <code>type</code> accepts
	 * @return the new statement
	 */
	public Statement newGenerateItem(Statement.Type type, AstNode construct) {
		checkStatementConstruct(type, construct);
		return build(() -> new Statement(null, false, true, construct, type), construct);
	}

	private static void checkStatementConstruct(Statement.Type type, AstNode construct) {
		AstContractError.check(type != null, "A statement needs a type");
		AstContractError.check(type.accepts(construct), type + " statement cannot wrap " + construct);
	}

	public GenerateBlock newGenerateBlock(Identifier identifier, AstList<Statement> generateItems) {
		AstList<Statement> items = orEmpty(generateItems);
		return build(() -> new GenerateBlock(identifier, items), identifier, items);
	}

	// ===============================================================================
	// User defined primitives

	/**
	 * Creates an output port of a UDP. Input ports are created with
	 * {@link #newUdpInputPort(AstList, AttributeList)}.
	 *
	 * @param direction the direction, anything but {@link PortDirection#INPUT}
	 * @param identifier port name
	 * @param attributes attributes, or <code>null</code>
	 * @param reg whether the output is declared <code>reg</code>
	 * @param defaultValue initial value, or <code>null</code>
	 * @return the new port
	 */
	public UdpOutputPort newUdpPort(PortDirection direction, Identifier identifier, AttributeList attributes, boolean reg, Expression defaultValue) {
		AstContractError.check(direction != PortDirection.INPUT, "UDP input ports are declared as a list of identifiers");
		return build(() -> new UdpOutputPort(direction, identifier, attributes, reg, defaultValue), identifier, attributes, defaultValue);
	}

	public UdpInputPort newUdpInputPort(AstList<Identifier> identifiers, AttributeList attributes) {
		return build(() -> new UdpInputPort(identifiers, attributes), identifiers, attributes);
	}

	/**
	 * Creates a UDP declaration, folding the body into it.
	 *
	 * @param attributes attributes, or <code>null</code>
	 * @param identifier primitive name
	 * @param ports the ports
	 * @param body the table
	 * @return the new declaration
	 */
	public UdpDeclaration newUdpDeclaration(AttributeList attributes, Identifier identifier, AstList<UdpPort> ports, UdpBody body) {
		AstContractError.check(body != null, "A UDP declaration needs a body");
		return build(
				() -> new UdpDeclaration(attributes, identifier, ports, body),
				attributes,
				identifier,
				ports,
				body.getInitial(),
				body.getEntries());
	}

	public UdpInstance newUdpInstance(Identifier identifier, Range range, Lvalue output, AstList<Expression> inputs) {
		return build(() -> new UdpInstance(identifier, range, output, inputs), identifier, range, output, inputs);
	}

	public UdpInstantiation newUdpInstantiation(AstList<UdpInstance> instances, Identifier identifier, DriveStrength driveStrength, Delay2 delay) {
		return build(() -> new UdpInstantiation(instances, identifier, driveStrength, delay), instances, identifier, driveStrength, delay);
	}

	public UdpInitialStatement newUdpInitialStatement(Identifier outputPort, NumberLiteral initialValue) {
		return build(() -> new UdpInitialStatement(outputPort, initialValue), outputPort, initialValue);
	}

	public UdpBody newUdpSequentialBody(UdpInitialStatement initialStatement, AstList<UdpEntry> sequentialEntries) {
		checkUdpEntries(sequentialEntries, true);
		return build(() -> new UdpBody(UdpBody.Type.SEQUENTIAL, initialStatement, sequentialEntries), initialStatement, sequentialEntries);
	}

	public UdpBody newUdpCombinatorialBody(AstList<UdpEntry> combinatorialEntries) {
		checkUdpEntries(combinatorialEntries, false);
		return build(() -> new UdpBody(UdpBody.Type.COMBINATORIAL, null, combinatorialEntries), combinatorialEntries);
	}

	private static void checkUdpEntries(AstList<UdpEntry> entries, boolean sequential) {
		if (entries == null) {
			return;
		}
		for (UdpEntry entry : entries) {
			AstContractError.check(entry == null || entry.isSequential() == sequential,
					(sequential ? "Sequential" : "Combinatorial") + " UDP body cannot hold " + entry);
		}
	}

	/**
	 * @param inputLevels levels of the input columns
	 * @param outputSymbol output column; {@link UdpNextState#UNCHANGED} is only
	 *        valid in sequential tables
	 * @return the new table row
	 */
	public UdpCombinatorialEntry newUdpCombinatorialEntry(AstList<LevelSymbol> inputLevels, UdpNextState outputSymbol) {
		AstContractError.check(outputSymbol != UdpNextState.UNCHANGED, "A combinatorial UDP row cannot keep its state");
		return build(() -> new UdpCombinatorialEntry(inputLevels, outputSymbol), inputLevels);
	}

	/**
	 * @param prefix whether the row has an edge among its inputs
	 * @param levelsOrEdges input columns; only levels when <code>prefix</code> is
	 *        {@link UdpSequentialEntry.Prefix#LEVELS}
	 * @param currentState the current state column
	 * @param output the next state column
	 * @return the new table row
	 */
	public UdpSequentialEntry newUdpSequentialEntry(
			UdpSequentialEntry.Prefix prefix,
			AstList<UdpInputSymbol> levelsOrEdges,
			LevelSymbol currentState,
			UdpNextState output) {
		if (prefix == UdpSequentialEntry.Prefix.LEVELS && levelsOrEdges != null) {
			for (UdpInputSymbol symbol : levelsOrEdges) {
				AstContractError.check(symbol instanceof LevelSymbol, "Level-prefixed UDP row cannot hold edge " + symbol);
			}
		}
		return build(() -> new UdpSequentialEntry(prefix, levelsOrEdges, currentState, output), levelsOrEdges);
	}

	// ===============================================================================
	// Modules

	/**
	 * @param moduleIdentifier name of the instantiated module
	 * @param moduleParameters parameter value assignments, or <code>null</code>
	 * @param moduleInstances the instances
	 * @return the new instantiation
	 */
	public ModuleInstantiation newModuleInstantiation(
			Identifier moduleIdentifier,
			AstList<PortConnection> moduleParameters,
			AstList<ModuleInstance> moduleInstances) {
		return build(
				() -> new ModuleInstantiation(moduleIdentifier, moduleParameters, moduleInstances),
				moduleIdentifier,
				moduleParameters,
				moduleInstances);
	}

	public ModuleInstance newModuleInstance(Identifier instanceIdentifier, AstList<PortConnection> portConnections) {
		AstList<PortConnection> connections = orEmpty(portConnections);
		return build(() -> new ModuleInstance(instanceIdentifier, connections), instanceIdentifier, connections);
	}

	/**
	 * @param portName the port being connected
	 * @param expression what the port connects to, <code>null</code> when left unconnected
	 * @return the new connection
	 */
	public PortConnection newNamedPortConnection(Identifier portName, Expression expression) {
		AstContractError.check(portName != null, "A named port connection needs a port name");
		return build(() -> new PortConnection(portName, expression), portName, expression);
	}

	public PortConnection newOrderedPortConnection(Expression expression) {
		return build(() -> new PortConnection(null, expression), expression);
	}

	/**
	 * Creates parameter declarations. Typed parameters (anything but
	 * {@link ParameterDeclarations.Type#GENERIC}) have no range and are never
	 * signed: <code>range</code> and <code>signedValues</code> are dropped for them.
	 *
	 * @param assignments the individual parameter assignments
	 * @param signedValues whether the values are signed
	 * @param local whether these are <code>localparam</code>
	 * @param range bit range, or <code>null</code>
	 * @param type parameter type
	 * @return the new declarations
	 */
	public ParameterDeclarations newParameterDeclarations(
			AstList<SingleAssignment> assignments,
			boolean signedValues,
			boolean local,
			Range range,
			ParameterDeclarations.Type type) {
		Range kept = type == ParameterDeclarations.Type.GENERIC ? range : null;
		return build(() -> new ParameterDeclarations(assignments, signedValues, local, range, type), assignments, kept);
	}

	public PortDeclaration newPortDeclaration(
			PortDirection direction,
			NetType netType,
			boolean netSigned,
			boolean reg,
			boolean variable,
			Range range,
			AstList<Identifier> portNames) {
		return build(() -> new PortDeclaration(direction, netType, netSigned, reg, variable, range, portNames), range, portNames);
	}

	/**
	 * Creates a type declaration of a known kind. The remaining fields are
	 * filled in with the setters of {@link TypeDeclaration} as the modifiers
	 * are reduced.
	 *
	 * @param type declaration kind
	 * @return the new, otherwise empty, declaration
	 */
	public TypeDeclaration newTypeDeclaration(TypeDeclaration.Type type) {
		return build(() -> new TypeDeclaration(type));
	}

	public ModuleDeclaration newModuleDeclaration(
			AttributeList attributes,
			Identifier identifier,
			AstList<ParameterDeclarations> parameters,
			AstList<PortDeclaration> ports,
			AstList<Statement> items) {
		AstList<ParameterDeclarations> params = orEmpty(parameters);
		AstList<PortDeclaration> portList = orEmpty(ports);
		AstList<Statement> itemList = orEmpty(items);
		return build(
				() -> new ModuleDeclaration(attributes, identifier, params, portList, itemList),
				attributes,
				identifier,
				params,
				portList,
				itemList);
	}

	/**
	 * Creates the root of the tree.
	 *
	 * @param modules module declarations, or <code>null</code>
	 * @param primitives UDP declarations, or <code>null</code>
	 * @return the new root
	 */
	public SourceText newSourceText(AstList<ModuleDeclaration> modules, AstList<UdpDeclaration> primitives) {
		AstList<ModuleDeclaration> moduleList = orEmpty(modules);
		AstList<UdpDeclaration> primitiveList = orEmpty(primitives);
		return build(() -> new SourceText(moduleList, primitiveList), moduleList, primitiveList);
	}

	// ===============================================================================
	// Gates, switches and strengths

	/**
	 * Creates a switch kind taking a three value delay.
	 *
	 * @param type any switch but <code>tran</code> and <code>rtran</code>
	 * @param delay the delay, or <code>null</code>
	 * @return the new switch gate
	 */
	public SwitchGate newSwitchGateD3(SwitchGate.Type type, Delay3 delay) {
		AstContractError.check(type != null && !type.takesDelay2(), type + " switches take a delay2");
		return build(() -> new SwitchGate(type, delay), delay);
	}

	/**
	 * Creates a switch kind taking a two value delay.
	 *
	 * @param type <code>tran</code> or <code>rtran</code>
	 * @param delay the delay, or <code>null</code>
	 * @return the new switch gate
	 */
	public SwitchGate newSwitchGateD2(SwitchGate.Type type, Delay2 delay) {
		AstContractError.check(type != null && type.takesDelay2(), type + " switches take a delay3");
		return build(() -> new SwitchGate(type, delay), delay);
	}

	public DriveStrength newDriveStrength(PrimitiveStrength strength1, PrimitiveStrength strength0) {
		return build(() -> new DriveStrength(strength1, strength0));
	}

	public PrimitivePullStrength newPrimitivePullStrength(PullDirection direction, PrimitiveStrength strength1, PrimitiveStrength strength0) {
		return build(() -> new PrimitivePullStrength(direction, strength1, strength0));
	}

	public PullStrength newPullStrength(PrimitiveStrength strength1, PrimitiveStrength strength2) {
		return build(() -> new PullStrength(strength1, strength2));
	}

	public PullGateInstance newPullGateInstance(Identifier name, Lvalue outputTerminal) {
		return build(() -> new PullGateInstance(name, outputTerminal), name, outputTerminal);
	}

	public PullGateInstances newPullGateInstances(PrimitivePullStrength strength, AstList<PullGateInstance> instances) {
		return build(() -> new PullGateInstances(strength, instances), strength, instances);
	}

	public PassSwitchInstance newPassSwitchInstance(Identifier name, Lvalue terminal1, Lvalue terminal2) {
		return build(() -> new PassSwitchInstance(name, terminal1, terminal2), name, terminal1, terminal2);
	}

	public NInputGateInstance newNInputGateInstance(Identifier name, AstList<Expression> inputTerminals, Lvalue outputTerminal) {
		return build(() -> new NInputGateInstance(name, inputTerminals, outputTerminal), name, inputTerminals, outputTerminal);
	}

	public EnableGateInstance newEnableGateInstance(Identifier name, Lvalue outputTerminal, Expression enableTerminal, Expression inputTerminal) {
		return build(
				() -> new EnableGateInstance(name, outputTerminal, enableTerminal, inputTerminal),
				name,
				outputTerminal,
				enableTerminal,
				inputTerminal);
	}

	public MosSwitchInstance newMosSwitchInstance(Identifier name, Lvalue outputTerminal, Expression enableTerminal, Expression inputTerminal) {
		return build(
				() -> new MosSwitchInstance(name, outputTerminal, enableTerminal, inputTerminal),
				name,
				outputTerminal,
				enableTerminal,
				inputTerminal);
	}

	public CmosSwitchInstance newCmosSwitchInstance(
			Identifier name,
			Lvalue outputTerminal,
			Expression ncontrolTerminal,
			Expression pcontrolTerminal,
			Expression inputTerminal) {
		return build(
				() -> new CmosSwitchInstance(name, outputTerminal, ncontrolTerminal, pcontrolTerminal, inputTerminal),
				name,
				outputTerminal,
				ncontrolTerminal,
				pcontrolTerminal,
				inputTerminal);
	}

	public PassEnableSwitch newPassEnableSwitch(Identifier name, Lvalue terminal1, Lvalue terminal2, Expression enable) {
		return build(() -> new PassEnableSwitch(name, terminal1, terminal2, enable), name, terminal1, terminal2, enable);
	}

	public PassEnableSwitches newPassEnableSwitches(PassEnableSwitches.Type type, Delay2 delay, AstList<PassEnableSwitch> switches) {
		return build(() -> new PassEnableSwitches(type, delay, switches), delay, switches);
	}

	public NInputGateInstances newNInputGateInstances(
			NInputGateInstances.Type type,
			Delay3 delay,
			DriveStrength driveStrength,
			AstList<NInputGateInstance> instances) {
		return build(() -> new NInputGateInstances(type, delay, driveStrength, instances), delay, driveStrength, instances);
	}

	public EnableGateInstances newEnableGateInstances(
			EnableGateInstances.Type type,
			Delay3 delay,
			DriveStrength driveStrength,
			AstList<EnableGateInstance> instances) {
		return build(() -> new EnableGateInstances(type, delay, driveStrength, instances), delay, driveStrength, instances);
	}

	public NOutputGateInstance newNOutputGateInstance(Identifier name, AstList<Lvalue> outputs, Expression input) {
		return build(() -> new NOutputGateInstance(name, outputs, input), name, outputs, input);
	}

	public NOutputGateInstances newNOutputGateInstances(
			NOutputGateInstances.Type type,
			Delay2 delay,
			DriveStrength driveStrength,
			AstList<NOutputGateInstance> instances) {
		return build(() -> new NOutputGateInstances(type, delay, driveStrength, instances), delay, driveStrength, instances);
	}

	public Switches newSwitches(SwitchGate type, AstList<AstNode> switches) {
		return build(() -> new Switches(type, switches), type, switches);
	}

	/**
	 * Wraps a collection of gates into a gate instantiation module item.
	 * <p>
	 * The collection class must be the one <code>type</code> accepts. For
	 * switches, the switch kind must also belong to the tag: CMOS tags take
	 * <code>cmos</code>/<code>rcmos</code>, MOS tags the four MOS switches and
	 * PASS tags <code>tran</code>/<code>rtran</code>. Pull tags must agree
	 * with the direction of the pull strength, when one is given.
	 *
	 * @param type the gate tag
	 * @param gates the collection of instances
	 * @return the new instantiation
	 */
	public GateInstantiation newGateInstantiation(GateInstantiation.Type type, AstNode gates) {
		AstContractError.check(type != null && type.accepts(gates), type + " gate instantiation cannot wrap " + gates);
		switch (type) {
		case CMOS:
		case MOS:
		case PASS:
			SwitchGate switchGate = ((Switches) gates).getType();
			AstContractError.check(switchGate != null && switchGateFamily(switchGate.getType()) == type,
					type + " gate instantiation cannot wrap " + (switchGate == null ? null : switchGate.getType()) + " switches");
			break;
		case PULL_UP:
		case PULL_DOWN:
			PrimitivePullStrength strength = ((PullGateInstances) gates).getStrength();
			PullDirection expected = type == GateInstantiation.Type.PULL_UP ? PullDirection.UP : PullDirection.DOWN;
			PullDirection direction = strength == null ? PullDirection.NONE : strength.getDirection();
			AstContractError.check(direction == PullDirection.NONE || direction == expected, type + " gate instantiation cannot pull " + direction);
			break;
		default:
			break;
		}
		return build(() -> new GateInstantiation(type, gates), gates);
	}

	private static GateInstantiation.Type switchGateFamily(SwitchGate.Type type) {
		switch (type) {
		case CMOS:
		case RCMOS:
			return GateInstantiation.Type.CMOS;
		case TRAN:
		case RTRAN:
			return GateInstantiation.Type.PASS;
		default:
			return GateInstantiation.Type.MOS;
		}
	}
}
