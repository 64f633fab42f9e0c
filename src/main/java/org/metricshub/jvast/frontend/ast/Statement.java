package org.metricshub.jvast.frontend.ast;

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

/**
 * Wraps a statement or module item construct with its tag, its attributes
 * and the context it appeared in.
 * <p>
 * Each {@link Type} accepts exactly one construct class; a statement can
 * only be built with a construct its tag accepts, so reading the construct
 * back through {@link #getConstruct(Class)} with the class of the tag never
 * fails.
 */
public final class Statement extends AstNode {

	/**
	 * Discriminant of statements and generate items, with the construct class
	 * each of them wraps.
	 */
	public enum Type {
		ASSIGNMENT(Assignment.class),
		CASE(CaseStatement.class),
		CONDITIONAL(IfElse.class),
		DISABLE(DisableStatement.class),
		EVENT_TRIGGER(Identifier.class),
		LOOP(LoopStatement.class),
		BLOCK(StatementBlock.class),
		TIMING_CONTROL(TimingControlStatement.class),
		TASK_ENABLE(TaskEnableStatement.class),
		FUNCTION_CALL(FunctionCall.class),
		WAIT(WaitStatement.class),
		INITIAL(Statement.class),
		ALWAYS(Statement.class),
		GENERATE_BLOCK(GenerateBlock.class),
		GENERATE_CASE(CaseStatement.class),
		GENERATE_CONDITIONAL(IfElse.class),
		GENERATE_LOOP(LoopStatement.class),
		MODULE_INSTANTIATION(ModuleInstantiation.class),
		UDP_INSTANTIATION(UdpInstantiation.class),
		GATE_INSTANTIATION(GateInstantiation.class),
		CONTINUOUS_ASSIGNMENT(ContinuousAssignment.class),
		PARAMETER_DECLARATION(ParameterDeclarations.class),
		PORT_DECLARATION(PortDeclaration.class),
		TYPE_DECLARATION(TypeDeclaration.class),
		PATH_DECLARATION(PathDeclaration.class);

		private final Class<? extends AstNode> constructClass;

		Type(Class<? extends AstNode> constructClass) {
			this.constructClass = constructClass;
		}

		/**
		 * @param construct a construct, possibly <code>null</code> (empty statement)
		 * @return whether <code>construct</code> can be wrapped under this tag
		 */
		public boolean accepts(AstNode construct) {
			return construct == null || constructClass.isInstance(construct);
		}

		public Class<? extends AstNode> getConstructClass() {
			return constructClass;
		}
	}

	private final AttributeList attributes;
	private final boolean functionStatement;
	private final boolean generateStatement;
	private final AstNode construct;
	private final Type type;

	public Statement(AttributeList attributes, boolean functionStatement, boolean generateStatement, AstNode construct, Type type) {
		AstContractError.check(type != null && type.accepts(construct), type + " statement cannot wrap " + construct);
		this.attributes = attributes;
		this.functionStatement = functionStatement;
		this.generateStatement = generateStatement;
		this.construct = construct;
		this.type = type;
	}

	public AttributeList getAttributes() {
		return attributes;
	}

	/**
	 * @return whether the statement appears in a function body
	 */
	public boolean isFunctionStatement() {
		return functionStatement;
	}

	/**
	 * @return whether the statement is a generate item
	 */
	public boolean isGenerateStatement() {
		return generateStatement;
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the wrapped construct, <code>null</code> for an empty statement
	 */
	public AstNode getConstruct() {
		return construct;
	}

	/**
	 * @param expected the construct class, usually {@link Type#getConstructClass()}
	 * @param <T> the construct class
	 * @return the construct cast to <code>expected</code>
	 * @throws AstContractError if the tag of this statement wraps another kind of construct
	 */
	public <T extends AstNode> T getConstruct(Class<T> expected) {
		AstContractError.check(expected.isAssignableFrom(type.getConstructClass()) || expected.isInstance(construct),
				type + " statement does not wrap a " + expected.getSimpleName());
		return expected.cast(construct);
	}

	@Override
	public String toString() {
		return "Statement(" + type + (generateStatement ? ", generate" : "") + ")";
	}
}
