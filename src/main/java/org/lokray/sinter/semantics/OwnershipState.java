// File: src/main/java/org/lokray/sinter/semantics/OwnershipState.java
package org.lokray.sinter.semantics;

/**
 * The ownership of a pointer binding at one point of a function body. The cleanup validator tracks,
 * per binding, the set of states the binding may be in.
 */
public enum OwnershipState
{
	/**
	 * The binding does not own its object: a parameter, a null-initialised binding, a copy of another
	 * pointer or the address of a value. Releasing it is an error.
	 */
	UNOWNED,

	/**
	 * The binding received a fresh allocation ({@code T.new()}, a deserialiser or {@code .release()})
	 * and must be cleaned or released before it goes out of scope.
	 */
	OWNED,

	/**
	 * The binding was passed to {@code .clean()} or {@code .release()}. Dereferencing or releasing it
	 * again is an error.
	 */
	RELEASED
}
