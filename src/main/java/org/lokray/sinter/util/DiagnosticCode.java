// File: src/main/java/org/lokray/sinter/util/DiagnosticCode.java
package org.lokray.sinter.util;

/**
 * Every diagnostic the compiler can produce, grouped by the stage family that reports it.
 */
public enum DiagnosticCode
{
	LEXICAL(Category.LEXICAL, "LexicalError"),
	SYNTAX(Category.SYNTAX, "SyntaxError"),

	UNRESOLVED_REFERENCE(Category.RESOLUTION, "UnresolvedReferenceError"),
	DUPLICATE_DECLARATION(Category.RESOLUTION, "DuplicateDeclarationError"),
	CYCLIC_INHERITANCE(Category.RESOLUTION, "CyclicInheritanceError"),

	TYPE_MISMATCH(Category.TYPE, "TypeMismatchError"),
	INTERFACE_CONFORMANCE(Category.TYPE, "InterfaceConformanceError"),
	UNDEFINED_METHOD(Category.TYPE, "UndefinedMethodError"),
	UNDEFINED_MEMBER(Category.TYPE, "UndefinedMemberError"),
	MISSING_RETURN(Category.TYPE, "MissingReturnError"),
	INACCESSIBLE_MEMBER(Category.TYPE, "InaccessibleMemberError"),

	CONFLICTING_ANNOTATION(Category.ANNOTATION, "ConflictingAnnotationError"),
	UNSATISFIED_ANNOTATION(Category.ANNOTATION, "UnsatisfiedAnnotationError"),
	INVALID_ANNOTATION(Category.ANNOTATION, "InvalidAnnotationError"),
	REDUNDANT_ANNOTATION(Category.ANNOTATION, "RedundantAnnotationWarning"),

	UNRELEASED_POINTER(Category.CLEANUP, "UnreleasedPointerError"),
	USE_AFTER_RELEASE(Category.CLEANUP, "UseAfterReleaseError"),
	DOUBLE_RELEASE(Category.CLEANUP, "DoubleReleaseError"),
	RELEASE_OF_UNOWNED(Category.CLEANUP, "ReleaseOfUnownedPointerError"),

	CODEGEN(Category.CODEGEN, "CodegenError");

	public enum Category
	{
		LEXICAL,
		SYNTAX,
		RESOLUTION,
		TYPE,
		ANNOTATION,
		CLEANUP,
		CODEGEN
	}

	private final Category category;
	private final String kind;

	DiagnosticCode(Category category, String kind)
	{
		this.category = category;
		this.kind = kind;
	}

	public Category getCategory()
	{
		return category;
	}

	/**
	 * @return The user-facing error kind, e.g. {@code UnreleasedPointerError}.
	 */
	public String getKind()
	{
		return kind;
	}
}
