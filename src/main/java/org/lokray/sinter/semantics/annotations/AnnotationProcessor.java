// File: src/main/java/org/lokray/sinter/semantics/annotations/AnnotationProcessor.java
package org.lokray.sinter.semantics.annotations;

import org.lokray.sinter.ast.Program;
import org.lokray.sinter.ast.declarations.AttributeAnnotation;
import org.lokray.sinter.ast.declarations.ClassDeclaration;
import org.lokray.sinter.ast.declarations.FieldDeclaration;
import org.lokray.sinter.semantics.ClassSymbol;
import org.lokray.sinter.semantics.MethodSymbol;
import org.lokray.sinter.semantics.NamedType;
import org.lokray.sinter.semantics.PointerType;
import org.lokray.sinter.semantics.PrimitiveType;
import org.lokray.sinter.semantics.SemanticModel;
import org.lokray.sinter.semantics.Type;
import org.lokray.sinter.semantics.VariableSymbol;
import org.lokray.sinter.util.Debug;
import org.lokray.sinter.util.DiagnosticCode;
import org.lokray.sinter.util.ErrorReporter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates {@code @attribute} metadata on fields and records which fields each class serialises.
 * <p>
 * Obligations per field:
 * <ul>
 *     <li>bare {@code @attribute}: getter and setter, synthesised unless user-defined</li>
 *     <li>{@code read_only}: getter only; a user-defined setter is an error</li>
 *     <li>{@code write_only}: setter only; a user-defined getter is an error</li>
 *     <li>{@code derived}: no accessor; the class must define {@code name() -> T}</li>
 *     <li>{@code serializable}: the field takes part in {@code as_json}/{@code as_xml}</li>
 * </ul>
 * The accessors themselves are synthesised during scope resolution, so calls to them type check.
 */
public class AnnotationProcessor
{
	private static final String ANNOTATION_NAME = "attribute";

	private final ErrorReporter errorReporter;
	private final SemanticModel model;

	public AnnotationProcessor(ErrorReporter errorReporter, SemanticModel model)
	{
		this.errorReporter = errorReporter;
		this.model = model;
	}

	public void process(Program program)
	{
		for (ClassDeclaration declaration : program.getClasses())
		{
			ClassSymbol classSymbol = (ClassSymbol) model.getBinding(declaration);
			if (classSymbol == null)
			{
				continue;
			}
			Debug.log("Processing annotations of %s", classSymbol.getName());
			for (FieldDeclaration field : declaration.getFields())
			{
				VariableSymbol symbol = model.getVariable(field);
				if (field.getAnnotation() != null && symbol != null)
				{
					processField(classSymbol, field, symbol);
				}
			}
		}
		for (ClassSymbol classSymbol : model.getClasses())
		{
			if (!classSymbol.isInterface())
			{
				classSymbol.setSerialization(collectSerializable(classSymbol));
			}
		}
	}

	private void processField(ClassSymbol owner, FieldDeclaration field, VariableSymbol symbol)
	{
		AttributeAnnotation annotation = field.getAnnotation();
		if (!ANNOTATION_NAME.equals(annotation.getName()))
		{
			errorReporter.error(DiagnosticCode.INVALID_ANNOTATION, annotation.getNameToken(),
					"Unknown annotation '@" + annotation.getName() + "'; fields accept '@" + ANNOTATION_NAME + "'.");
			return;
		}
		if (!checkFlags(annotation))
		{
			return;
		}
		checkConflicts(field, annotation);

		boolean readOnly = annotation.isSet(AccessorPolicy.READ_ONLY);
		boolean writeOnly = annotation.isSet(AccessorPolicy.WRITE_ONLY);
		boolean derived = annotation.isSet(AccessorPolicy.DERIVED);
		String getter = AccessorPolicy.getterName(field.getName());
		String setter = AccessorPolicy.setterName(field.getName());

		if (derived)
		{
			checkDerivedMethod(owner, field, symbol);
		}
		for (MethodSymbol method : userMethods(owner, setter))
		{
			if (readOnly || derived)
			{
				unsatisfied(method, "Field '" + field.getName() + "' is " + (readOnly ? "read_only" : "derived") + " and must not have a setter '" + setter + "'.");
			}
			else if (!isSetterOf(method, symbol))
			{
				unsatisfied(method, "Setter " + owner.getName() + "." + method.signature() + " does not match field '" + field.getName()
						+ "'; expected " + setter + "(" + symbol.getType() + ") -> void.");
			}
		}
		for (MethodSymbol method : userMethods(owner, getter))
		{
			if (writeOnly || derived)
			{
				unsatisfied(method, "Field '" + field.getName() + "' is " + (writeOnly ? "write_only" : "derived") + " and must not have a getter '" + getter + "'.");
			}
			else if (!isGetterOf(method, symbol))
			{
				unsatisfied(method, "Getter " + owner.getName() + "." + method.signature() + " does not match field '" + field.getName()
						+ "'; expected " + getter + "() -> " + symbol.getType() + ".");
			}
		}
		if (annotation.isSet(AccessorPolicy.SERIALIZABLE) && !isSerializableType(symbol.getType()))
		{
			errorReporter.error(DiagnosticCode.INVALID_ANNOTATION, field.getNameToken(),
					"Field '" + field.getName() + "' of type '" + symbol.getType() + "' cannot be serializable.");
		}
	}

	/**
	 * Unknown flags are errors; repeated flags and explicit {@code false} are harmless and only warned about.
	 *
	 * @return False when the annotation is unusable.
	 */
	private boolean checkFlags(AttributeAnnotation annotation)
	{
		boolean valid = true;
		Set<String> seen = new HashSet<>();
		for (AttributeAnnotation.Argument argument : annotation.getArguments())
		{
			String flag = argument.getName();
			if (!AccessorPolicy.isKnownFlag(flag))
			{
				errorReporter.error(DiagnosticCode.INVALID_ANNOTATION, argument.getNameToken(),
						"Unknown attribute flag '" + flag + "'; expected read_only, write_only, derived or serializable.");
				valid = false;
			}
			else if (!seen.add(flag))
			{
				errorReporter.warning(DiagnosticCode.REDUNDANT_ANNOTATION, argument.getNameToken(), "Attribute flag '" + flag + "' is repeated.");
			}
			else if (argument.hasExplicitValue() && !argument.getValue())
			{
				errorReporter.warning(DiagnosticCode.REDUNDANT_ANNOTATION, argument.getNameToken(),
						"Attribute flag '" + flag + "=false' is the default and can be removed.");
			}
		}
		return valid;
	}

	private void checkConflicts(FieldDeclaration field, AttributeAnnotation annotation)
	{
		boolean readOnly = annotation.isSet(AccessorPolicy.READ_ONLY);
		boolean writeOnly = annotation.isSet(AccessorPolicy.WRITE_ONLY);
		boolean derived = annotation.isSet(AccessorPolicy.DERIVED);
		List<String> conflicts = new ArrayList<>();
		if (readOnly && writeOnly)
		{
			conflicts.add("read_only with write_only");
		}
		if (derived && readOnly)
		{
			conflicts.add("derived with read_only");
		}
		if (derived && writeOnly)
		{
			conflicts.add("derived with write_only");
		}
		if (!conflicts.isEmpty())
		{
			errorReporter.error(DiagnosticCode.CONFLICTING_ANNOTATION, annotation.getAtToken(),
					"Field '" + field.getName() + "' has conflicting attribute flags: " + String.join(", ", conflicts) + ".");
		}
	}

	private void checkDerivedMethod(ClassSymbol owner, FieldDeclaration field, VariableSymbol symbol)
	{
		List<MethodSymbol> candidates = owner.findMethods(field.getName());
		String expected = field.getName() + "() -> " + symbol.getType();
		if (candidates.isEmpty())
		{
			errorReporter.error(DiagnosticCode.UNSATISFIED_ANNOTATION, field.getNameToken(),
					"Derived field '" + field.getName() + "' requires a method " + expected + " in class " + owner.getName() + ".");
			return;
		}
		boolean satisfied = candidates.stream().anyMatch(m -> !m.isStatic() && m.getParameterTypes().isEmpty() && m.getReturnType().equals(symbol.getType()));
		if (!satisfied)
		{
			errorReporter.error(DiagnosticCode.UNSATISFIED_ANNOTATION, field.getNameToken(),
					"Derived field '" + field.getName() + "' requires a method " + expected + "; found " + candidates.get(0).signature() + ".");
		}
	}

	private static List<MethodSymbol> userMethods(ClassSymbol owner, String name)
	{
		List<MethodSymbol> result = new ArrayList<>();
		for (MethodSymbol method : owner.getOwnMethods(name))
		{
			if (!method.isSynthesized())
			{
				result.add(method);
			}
		}
		return result;
	}

	private static boolean isGetterOf(MethodSymbol method, VariableSymbol field)
	{
		return !method.isStatic() && method.getParameterTypes().isEmpty() && method.getReturnType().equals(field.getType());
	}

	private static boolean isSetterOf(MethodSymbol method, VariableSymbol field)
	{
		return !method.isStatic() && method.getParameterTypes().equals(List.of(field.getType())) && method.getReturnType().isVoid();
	}

	private void unsatisfied(MethodSymbol method, String message)
	{
		errorReporter.error(DiagnosticCode.UNSATISFIED_ANNOTATION, method.getDeclarationToken(), message);
	}

	static boolean isSerializableType(Type type)
	{
		if (type instanceof PrimitiveType)
		{
			return !type.isVoid();
		}
		if (type instanceof NamedType)
		{
			return !((NamedType) type).isInterface();
		}
		if (type instanceof PointerType)
		{
			ClassSymbol pointee = ((PointerType) type).getPointeeClass();
			return pointee != null && !pointee.isInterface() && ((PointerType) type).getPointee() instanceof NamedType;
		}
		return false;
	}

	private static SerializationMetadata collectSerializable(ClassSymbol classSymbol)
	{
		List<VariableSymbol> fields = new ArrayList<>();
		for (ClassSymbol c : classSymbol.getHierarchy())
		{
			for (VariableSymbol field : c.getOwnFields())
			{
				if (AccessorPolicy.isSerializable(field.getField()) && isSerializableType(field.getType()))
				{
					fields.add(field);
				}
			}
		}
		return new SerializationMetadata(classSymbol, fields);
	}
}
