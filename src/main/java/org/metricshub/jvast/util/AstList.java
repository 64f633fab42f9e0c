package org.metricshub.jvast.util;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import org.metricshub.jvast.arena.ArenaBlock;

/**
 * Growable ordered sequence used for every variable-length grammar list
 * of the tree (arguments, port lists, case items, concatenation elements...).
 * <p>
 * Order is insertion order: {@link #append(Object)}, {@link #prepend(Object)}
 * and {@link #concat(AstList)} never reorder existing elements relative to
 * each other. There is no removal, so indices only shift when an element is
 * prepended.
 * <p>
 * Backed by an array for amortized constant time append and constant
 * time indexed access.
 *
 * @param <T> type of the elements
 */
public class AstList<T> extends ArenaBlock implements Iterable<T> {

	private final List<T> items = new ArrayList<T>();

	/**
	 * Creates an empty list.
	 */
	public AstList() {}

	/**
	 * Appends an element; it becomes the last one.
	 *
	 * @param element the element, may be <code>null</code>
	 */
	public void append(T element) {
		items.add(element);
	}

	/**
	 * Prepends an element; it becomes the first one and all existing indices
	 * move up by one.
	 *
	 * @param element the element, may be <code>null</code>
	 */
	public void prepend(T element) {
		items.add(0, element);
	}

	/**
	 * Appends every element of <code>src</code>, in order.
	 * <p>
	 * <code>src</code> is considered merged into this list afterwards and
	 * should not be extended on its own anymore.
	 *
	 * @param src the elements to append; <code>null</code> is a no-op
	 */
	public void concat(AstList<? extends T> src) {
		if (src == null) {
			return;
		}
		if (src == this) {
			items.addAll(new ArrayList<T>(items));
		} else {
			items.addAll(src.items);
		}
	}

	/**
	 * @param index position of the element
	 * @return the element at <code>index</code>, or <code>null</code> when the
	 *         index is outside of <code>0..count()-1</code>
	 */
	public T get(int index) {
		if (index < 0 || index >= items.size()) {
			return null;
		}
		return items.get(index);
	}

	/**
	 * @return the number of elements
	 */
	public int count() {
		return items.size();
	}

	public boolean isEmpty() {
		return items.isEmpty();
	}

	/**
	 * @return a read-only view of the elements
	 */
	public List<T> toList() {
		return Collections.unmodifiableList(items);
	}

	@Override
	public Iterator<T> iterator() {
		return toList().iterator();
	}

	@Override
	public String toString() {
		return "AstList" + items;
	}
}
