// File: src/main/java/org/lokray/sinter/codegen/SerializationEmitter.java
package org.lokray.sinter.codegen;

import org.lokray.sinter.semantics.ClassSymbol;
import org.lokray.sinter.semantics.MethodSymbol;
import org.lokray.sinter.semantics.PointerType;
import org.lokray.sinter.semantics.PrimitiveType;
import org.lokray.sinter.semantics.Type;
import org.lokray.sinter.semantics.VariableSymbol;
import org.lokray.sinter.semantics.annotations.SerializationMetadata;
import org.lokray.sinter.util.Debug;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Generates {@code as_json}, {@code as_xml}, {@code from_json} and {@code from_xml} for every class whose
 * serialisation is used, plus the classes reachable through their serializable fields.
 * <p>
 * Output shapes are {@code {"a": 1, "b": "x", "c": {...}}} and {@code <C><a>1</a><b>x</b></C>}. A null pointer
 * field is written as {@code null}. Floating values use {@code %.9g} and {@code %.17g} so that they read back
 * exactly. String fields are escaped on the way out ({@code \"}, {@code \\}, {@code \n}, {@code \r}, {@code \t}
 * in JSON; {@code &lt;}, {@code &gt;}, {@code &amp;} in XML) and unescaped on the way in.
 */
class SerializationEmitter
{
	private final LayoutTable layouts;
	private final StringPool strings;
	private final DStringRuntime formatting;

	SerializationEmitter(LayoutTable layouts, StringPool strings, DStringRuntime formatting)
	{
		this.layouts = layouts;
		this.strings = strings;
		this.formatting = formatting;
	}

	/**
	 * The used classes and everything their serializable fields lead to.
	 */
	static Set<ClassSymbol> closure(Set<ClassSymbol> used)
	{
		Set<ClassSymbol> result = new LinkedHashSet<>();
		Deque<ClassSymbol> work = new ArrayDeque<>(used);
		while (!work.isEmpty())
		{
			ClassSymbol next = work.poll();
			if (next.isInterface() || !result.add(next) || next.getSerialization() == null)
			{
				continue;
			}
			for (VariableSymbol field : next.getSerialization().getFields())
			{
				ClassSymbol nested = LlvmTypes.classOf(field.getType());
				if (nested != null)
				{
					work.add(nested);
				}
			}
		}
		return result;
	}

	void emit(Set<ClassSymbol> classes, StringBuilder out)
	{
		if (classes.isEmpty())
		{
			return;
		}
		emitRuntime(out);
		for (ClassSymbol classSymbol : classes)
		{
			Debug.log("Generating serialisation routines for %s", classSymbol.getName());
			SerializationMetadata metadata = classSymbol.getSerialization();
			List<VariableSymbol> fields = metadata != null ? metadata.getFields() : List.of();
			List<VariableSymbol> stored = metadata != null ? metadata.getStoredFields() : List.of();
			emitWriter(classSymbol, fields, true, out);
			emitWriter(classSymbol, fields, false, out);
			emitReader(classSymbol, stored, true, out);
			emitReader(classSymbol, stored, false, out);
		}
	}

	private void emitWriter(ClassSymbol classSymbol, List<VariableSymbol> fields, boolean json, StringBuilder out)
	{
		String routine = json ? "as_json" : "as_xml";
		FunctionEmitter f = new FunctionEmitter("define ptr " + LlvmTypes.routineName(classSymbol, routine) + "(ptr %this)");
		String isNull = f.assign("icmp eq ptr %this, null");
		f.branch(isNull, "none", "write");
		f.startBlock("none");
		f.terminate("ret ptr " + strings.intern("null"));
		f.startBlock("write");

		StringBuilder format = new StringBuilder(json ? "{" : "<" + classSymbol.getName() + ">");
		List<String> arguments = new ArrayList<>();
		List<String> escaped = new ArrayList<>();
		for (int i = 0; i < fields.size(); i++)
		{
			VariableSymbol field = fields.get(i);
			Type type = field.getType();
			String placeholder = placeholder(type, json);
			if (json)
			{
				format.append(i > 0 ? ", " : "").append('"').append(field.getName()).append("\": ").append(placeholder);
			}
			else
			{
				format.append('<').append(field.getName()).append('>').append(placeholder).append("</").append(field.getName()).append('>');
			}
			arguments.add(fieldArgument(f, classSymbol, field, routine, escaped));
		}
		format.append(json ? "}" : "</" + classSymbol.getName() + ">");
		String text = DStringRuntime.formatToHeap(f, strings.intern(format.toString()), arguments);
		for (String temporary : escaped)
		{
			f.call("void", "@free", List.of("ptr " + temporary));
		}
		f.terminate("ret ptr " + text);
		f.finish(out);
	}

	private static String placeholder(Type type, boolean json)
	{
		if (type == PrimitiveType.INT)
		{
			return "%d";
		}
		if (type == PrimitiveType.FLOAT)
		{
			return "%.9g";
		}
		if (type == PrimitiveType.DOUBLE)
		{
			return "%.17g";
		}
		if (type == PrimitiveType.STR && json)
		{
			return "\"%s\"";
		}
		return "%s";
	}

	/**
	 * Reads one field of {@code %this} and turns it into a typed {@code printf} argument. Nested objects are
	 * serialised first. Escaped copies of string fields are added to {@code escaped} for the caller to free.
	 */
	private String fieldArgument(FunctionEmitter f, ClassSymbol classSymbol, VariableSymbol field, String routine, List<String> escaped)
	{
		Type type = field.getType();
		String llvmType = LlvmTypes.toLlvm(type);
		String address = null;
		String value;
		if (field.isDerived())
		{
			MethodSymbol method = IRGenerator.derivedMethod(classSymbol, field);
			value = f.call(llvmType, LlvmTypes.functionName(method), List.of("ptr %this"));
		}
		else
		{
			address = f.gep(LlvmTypes.structName(classSymbol), "%this", layouts.fieldPath(classSymbol, field));
			value = LlvmTypes.isClassValue(type) ? null : f.load(llvmType, address);
		}
		ClassSymbol nested = LlvmTypes.classOf(type);
		if (type == PrimitiveType.STR)
		{
			String copy = f.call("ptr", routine.equals("as_json") ? "@sinter_json_escape" : "@sinter_xml_escape", List.of("ptr " + value));
			escaped.add(copy);
			return "ptr " + copy;
		}
		if (nested == null)
		{
			return formatting.formatArgument(f, type, value);
		}
		if (type instanceof PointerType)
		{
			return "ptr " + f.call("ptr", LlvmTypes.routineName(nested, routine), List.of("ptr " + value));
		}
		if (address == null)
		{
			address = f.alloca(llvmType, field.getName());
			f.store(llvmType, value, address);
		}
		return "ptr " + f.call("ptr", LlvmTypes.routineName(nested, routine), List.of("ptr " + address));
	}

	/**
	 * Allocates an instance and reads every stored serializable field back. Unknown keys are skipped; a missing
	 * field stops the program.
	 */
	private void emitReader(ClassSymbol classSymbol, List<VariableSymbol> fields, boolean json, StringBuilder out)
	{
		String routine = json ? "from_json" : "from_xml";
		FunctionEmitter f = new FunctionEmitter("define ptr " + LlvmTypes.routineName(classSymbol, routine) + "(ptr %text)");
		String object = f.call("ptr", LlvmTypes.routineName(classSymbol, "new"), List.of());
		for (VariableSymbol field : fields)
		{
			String key = json ? "\"" + field.getName() + "\":" : "<" + field.getName() + ">";
			String value = f.call("ptr", json ? "@sinter_json_find" : "@sinter_xml_find", List.of("ptr %text", "ptr " + strings.intern(key)));
			String missing = f.assign("icmp eq ptr " + value + ", null");
			String missingLabel = f.newLabel("missing." + field.getName());
			String parseLabel = f.newLabel("parse." + field.getName());
			f.branch(missing, missingLabel, parseLabel);
			f.startBlock(missingLabel);
			f.call("void", "@sinter_deserialization_error",
					List.of("ptr " + strings.intern(field.getName()), "ptr " + strings.intern(classSymbol.getName())));
			f.terminate("unreachable");
			f.startBlock(parseLabel);
			String address = f.gep(LlvmTypes.structName(classSymbol), object, layouts.fieldPath(classSymbol, field));
			readField(f, field.getType(), value, address, routine, json);
		}
		f.terminate("ret ptr " + object);
		f.finish(out);
	}

	private void readField(FunctionEmitter f, Type type, String value, String address, String routine, boolean json)
	{
		if (type == PrimitiveType.INT)
		{
			String wide = f.call("i64", "@strtol", List.of("ptr " + value, "ptr null", "i32 10"));
			f.store("i32", f.assign("trunc i64 " + wide + " to i32"), address);
		}
		else if (type == PrimitiveType.FLOAT || type == PrimitiveType.DOUBLE)
		{
			String parsed = f.call("double", "@strtod", List.of("ptr " + value, "ptr null"));
			if (type == PrimitiveType.FLOAT)
			{
				parsed = f.assign("fptrunc double " + parsed + " to float");
			}
			f.store(LlvmTypes.toLlvm(type), parsed, address);
		}
		else if (type == PrimitiveType.BOOLEAN)
		{
			f.store("i1", startsWith(f, value, "true"), address);
		}
		else if (type == PrimitiveType.STR)
		{
			String text;
			if (json)
			{
				String start = f.assign("getelementptr inbounds i8, ptr " + value + ", i64 1");
				text = f.call("ptr", "@sinter_json_read_string", List.of("ptr " + start));
			}
			else
			{
				text = f.call("ptr", "@sinter_xml_read_text", List.of("ptr " + value));
			}
			f.store("ptr", text, address);
		}
		else if (type instanceof PointerType)
		{
			ClassSymbol nested = ((PointerType) type).getPointeeClass();
			String isNull = startsWith(f, value, "null");
			String nullLabel = f.newLabel("null");
			String readLabel = f.newLabel("nested");
			String joinLabel = f.newLabel("stored");
			f.branch(isNull, nullLabel, readLabel);
			f.startBlock(nullLabel);
			f.store("ptr", "null", address);
			f.branch(joinLabel);
			f.startBlock(readLabel);
			String child = f.call("ptr", LlvmTypes.routineName(nested, routine), List.of("ptr " + value));
			f.store("ptr", child, address);
			f.branch(joinLabel);
			f.startBlock(joinLabel);
		}
		else
		{
			// Nested value: read into a temporary instance, copy the record, free the temporary
			ClassSymbol nested = LlvmTypes.classOf(type);
			String struct = LlvmTypes.structName(nested);
			String child = f.call("ptr", LlvmTypes.routineName(nested, routine), List.of("ptr " + value));
			f.store(struct, f.load(struct, child), address);
			f.call("void", "@free", List.of("ptr " + child));
		}
	}

	private String startsWith(FunctionEmitter f, String value, String prefix)
	{
		String compared = f.call("i32", "@strncmp", List.of("ptr " + value, "ptr " + strings.intern(prefix), "i64 " + prefix.length()));
		return f.assign("icmp eq i32 " + compared + ", 0");
	}

	private void emitRuntime(StringBuilder out)
	{
		String message = strings.intern("deserialization error: missing field '%s' for %s\n");
		String empty = strings.intern("");
		String lessThan = strings.intern("&lt;");
		String greaterThan = strings.intern("&gt;");
		String ampersand = strings.intern("&amp;");
		out.append(String.join("\n",
				"; Value after the key \"name\": of the outermost object, or null",
				"define internal ptr @sinter_json_find(ptr %text, ptr %key) {",
				"entry:",
				"  %key.length = call i64 @strlen(ptr %key)",
				"  br label %scan",
				"scan:",
				"  %p = phi ptr [ %text, %entry ], [ %p.next, %advance ]",
				"  %depth = phi i32 [ 0, %entry ], [ %depth.next, %advance ]",
				"  %c = load i8, ptr %p",
				"  switch i8 %c, label %advance [ i8 0, label %missing",
				"                                 i8 123, label %open",
				"                                 i8 91, label %open",
				"                                 i8 125, label %close",
				"                                 i8 93, label %close",
				"                                 i8 34, label %quote ]",
				"open:",
				"  %depth.open = add i32 %depth, 1",
				"  br label %advance",
				"close:",
				"  %depth.close = sub i32 %depth, 1",
				"  br label %advance",
				"quote:",
				"  %top = icmp eq i32 %depth, 1",
				"  br i1 %top, label %compare, label %skip.string",
				"compare:",
				"  %cmp = call i32 @strncmp(ptr %p, ptr %key, i64 %key.length)",
				"  %hit = icmp eq i32 %cmp, 0",
				"  br i1 %hit, label %found, label %skip.string",
				"skip.string:",
				"  %inside = getelementptr inbounds i8, ptr %p, i64 1",
				"  %string.end = call ptr @sinter_json_string_end(ptr %inside)",
				"  %unterminated = icmp eq ptr %string.end, null",
				"  br i1 %unterminated, label %missing, label %advance",
				"advance:",
				"  %at = phi ptr [ %p, %scan ], [ %p, %open ], [ %p, %close ], [ %string.end, %skip.string ]",
				"  %depth.next = phi i32 [ %depth, %scan ], [ %depth.open, %open ], [ %depth.close, %close ], [ %depth, %skip.string ]",
				"  %p.next = getelementptr inbounds i8, ptr %at, i64 1",
				"  br label %scan",
				"found:",
				"  %value = getelementptr inbounds i8, ptr %p, i64 %key.length",
				"  br label %spaces",
				"spaces:",
				"  %q = phi ptr [ %value, %found ], [ %q.next, %space ]",
				"  %qc = load i8, ptr %q",
				"  %is.space = icmp eq i8 %qc, 32",
				"  br i1 %is.space, label %space, label %done",
				"space:",
				"  %q.next = getelementptr inbounds i8, ptr %q, i64 1",
				"  br label %spaces",
				"done:",
				"  ret ptr %q",
				"missing:",
				"  ret ptr null",
				"}",
				"",
				"; Text after the tag <name> directly inside the outermost element, or null",
				"define internal ptr @sinter_xml_find(ptr %text, ptr %tag) {",
				"entry:",
				"  %tag.length = call i64 @strlen(ptr %tag)",
				"  br label %scan",
				"scan:",
				"  %p = phi ptr [ %text, %entry ], [ %p.next, %advance ]",
				"  %depth = phi i32 [ 0, %entry ], [ %depth.next, %advance ]",
				"  %c = load i8, ptr %p",
				"  switch i8 %c, label %advance [ i8 0, label %missing",
				"                                 i8 60, label %tag.start ]",
				"tag.start:",
				"  %second.addr = getelementptr inbounds i8, ptr %p, i64 1",
				"  %second = load i8, ptr %second.addr",
				"  %closing = icmp eq i8 %second, 47",
				"  br i1 %closing, label %close, label %opening",
				"close:",
				"  %depth.close = sub i32 %depth, 1",
				"  br label %advance",
				"opening:",
				"  %top = icmp eq i32 %depth, 1",
				"  br i1 %top, label %compare, label %open",
				"compare:",
				"  %cmp = call i32 @strncmp(ptr %p, ptr %tag, i64 %tag.length)",
				"  %hit = icmp eq i32 %cmp, 0",
				"  br i1 %hit, label %found, label %open",
				"open:",
				"  %depth.open = add i32 %depth, 1",
				"  br label %advance",
				"advance:",
				"  %depth.next = phi i32 [ %depth, %scan ], [ %depth.close, %close ], [ %depth.open, %open ]",
				"  %p.next = getelementptr inbounds i8, ptr %p, i64 1",
				"  br label %scan",
				"found:",
				"  %value = getelementptr inbounds i8, ptr %p, i64 %tag.length",
				"  ret ptr %value",
				"missing:",
				"  ret ptr null",
				"}",
				"",
				"; Closing quote of the string starting at start, skipping escaped characters, or null",
				"define internal ptr @sinter_json_string_end(ptr %start) {",
				"entry:",
				"  br label %scan",
				"scan:",
				"  %p = phi ptr [ %start, %entry ], [ %p.next, %next ]",
				"  %c = load i8, ptr %p",
				"  switch i8 %c, label %plain [ i8 0, label %unterminated",
				"                               i8 34, label %closed",
				"                               i8 92, label %escape ]",
				"escape:",
				"  %escaped.addr = getelementptr inbounds i8, ptr %p, i64 1",
				"  %escaped = load i8, ptr %escaped.addr",
				"  %at.end = icmp eq i8 %escaped, 0",
				"  br i1 %at.end, label %unterminated, label %next",
				"plain:",
				"  br label %next",
				"next:",
				"  %step = phi i64 [ 2, %escape ], [ 1, %plain ]",
				"  %p.next = getelementptr inbounds i8, ptr %p, i64 %step",
				"  br label %scan",
				"closed:",
				"  ret ptr %p",
				"unterminated:",
				"  ret ptr null",
				"}",
				"",
				"define internal ptr @sinter_json_escape(ptr %text) {",
				"entry:",
				"  %is.null = icmp eq ptr %text, null",
				"  %source = select i1 %is.null, ptr " + empty + ", ptr %text",
				"  %length = call i64 @strlen(ptr %source)",
				"  %twice = mul i64 %length, 2",
				"  %size = add i64 %twice, 1",
				"  %buffer = call ptr @malloc(i64 %size)",
				"  br label %scan",
				"scan:",
				"  %in = phi ptr [ %source, %entry ], [ %in.next, %next ]",
				"  %out = phi ptr [ %buffer, %entry ], [ %out.next, %next ]",
				"  %c = load i8, ptr %in",
				"  switch i8 %c, label %plain [ i8 0, label %finish",
				"                               i8 34, label %quote",
				"                               i8 92, label %backslash",
				"                               i8 10, label %newline",
				"                               i8 13, label %carriage",
				"                               i8 9, label %tab ]",
				"quote:",
				"  br label %escape",
				"backslash:",
				"  br label %escape",
				"newline:",
				"  br label %escape",
				"carriage:",
				"  br label %escape",
				"tab:",
				"  br label %escape",
				"escape:",
				"  %letter = phi i8 [ 34, %quote ], [ 92, %backslash ], [ 110, %newline ], [ 114, %carriage ], [ 116, %tab ]",
				"  store i8 92, ptr %out",
				"  %out.second = getelementptr inbounds i8, ptr %out, i64 1",
				"  store i8 %letter, ptr %out.second",
				"  %out.escaped = getelementptr inbounds i8, ptr %out, i64 2",
				"  br label %next",
				"plain:",
				"  store i8 %c, ptr %out",
				"  %out.plain = getelementptr inbounds i8, ptr %out, i64 1",
				"  br label %next",
				"next:",
				"  %out.next = phi ptr [ %out.escaped, %escape ], [ %out.plain, %plain ]",
				"  %in.next = getelementptr inbounds i8, ptr %in, i64 1",
				"  br label %scan",
				"finish:",
				"  store i8 0, ptr %out",
				"  ret ptr %buffer",
				"}",
				"",
				"; Copy of the JSON string body at start, up to its closing quote, with escapes decoded",
				"define internal ptr @sinter_json_read_string(ptr %start) {",
				"entry:",
				"  %length = call i64 @strlen(ptr %start)",
				"  %size = add i64 %length, 1",
				"  %buffer = call ptr @malloc(i64 %size)",
				"  br label %scan",
				"scan:",
				"  %in = phi ptr [ %start, %entry ], [ %in.next, %next ]",
				"  %out = phi ptr [ %buffer, %entry ], [ %out.next, %next ]",
				"  %c = load i8, ptr %in",
				"  switch i8 %c, label %plain [ i8 0, label %finish",
				"                               i8 34, label %finish",
				"                               i8 92, label %escape ]",
				"escape:",
				"  %escaped.addr = getelementptr inbounds i8, ptr %in, i64 1",
				"  %escaped = load i8, ptr %escaped.addr",
				"  %at.end = icmp eq i8 %escaped, 0",
				"  br i1 %at.end, label %finish, label %decode",
				"decode:",
				"  switch i8 %escaped, label %literal [ i8 110, label %newline",
				"                                       i8 114, label %carriage",
				"                                       i8 116, label %tab ]",
				"newline:",
				"  br label %decoded",
				"carriage:",
				"  br label %decoded",
				"tab:",
				"  br label %decoded",
				"literal:",
				"  br label %decoded",
				"decoded:",
				"  %letter = phi i8 [ 10, %newline ], [ 13, %carriage ], [ 9, %tab ], [ %escaped, %literal ]",
				"  store i8 %letter, ptr %out",
				"  br label %next",
				"plain:",
				"  store i8 %c, ptr %out",
				"  br label %next",
				"next:",
				"  %step = phi i64 [ 2, %decoded ], [ 1, %plain ]",
				"  %in.next = getelementptr inbounds i8, ptr %in, i64 %step",
				"  %out.next = getelementptr inbounds i8, ptr %out, i64 1",
				"  br label %scan",
				"finish:",
				"  store i8 0, ptr %out",
				"  ret ptr %buffer",
				"}",
				"",
				"define internal ptr @sinter_xml_escape(ptr %text) {",
				"entry:",
				"  %is.null = icmp eq ptr %text, null",
				"  %source = select i1 %is.null, ptr " + empty + ", ptr %text",
				"  %length = call i64 @strlen(ptr %source)",
				"  %worst = mul i64 %length, 5",
				"  %size = add i64 %worst, 1",
				"  %buffer = call ptr @malloc(i64 %size)",
				"  br label %scan",
				"scan:",
				"  %in = phi ptr [ %source, %entry ], [ %in.next, %next ]",
				"  %out = phi ptr [ %buffer, %entry ], [ %out.next, %next ]",
				"  %c = load i8, ptr %in",
				"  switch i8 %c, label %plain [ i8 0, label %finish",
				"                               i8 60, label %less",
				"                               i8 62, label %greater",
				"                               i8 38, label %ampersand ]",
				"less:",
				"  br label %entity",
				"greater:",
				"  br label %entity",
				"ampersand:",
				"  br label %entity",
				"entity:",
				"  %name = phi ptr [ " + lessThan + ", %less ], [ " + greaterThan + ", %greater ], [ " + ampersand + ", %ampersand ]",
				"  %name.length = phi i64 [ 4, %less ], [ 4, %greater ], [ 5, %ampersand ]",
				"  call ptr @memcpy(ptr %out, ptr %name, i64 %name.length)",
				"  %out.entity = getelementptr inbounds i8, ptr %out, i64 %name.length",
				"  br label %next",
				"plain:",
				"  store i8 %c, ptr %out",
				"  %out.plain = getelementptr inbounds i8, ptr %out, i64 1",
				"  br label %next",
				"next:",
				"  %out.next = phi ptr [ %out.entity, %entity ], [ %out.plain, %plain ]",
				"  %in.next = getelementptr inbounds i8, ptr %in, i64 1",
				"  br label %scan",
				"finish:",
				"  store i8 0, ptr %out",
				"  ret ptr %buffer",
				"}",
				"",
				"; Copy of the element text at start, up to the next tag, with entities decoded",
				"define internal ptr @sinter_xml_read_text(ptr %start) {",
				"entry:",
				"  %length = call i64 @strlen(ptr %start)",
				"  %size = add i64 %length, 1",
				"  %buffer = call ptr @malloc(i64 %size)",
				"  br label %scan",
				"scan:",
				"  %in = phi ptr [ %start, %entry ], [ %in.next, %next ]",
				"  %out = phi ptr [ %buffer, %entry ], [ %out.next, %next ]",
				"  %c = load i8, ptr %in",
				"  switch i8 %c, label %plain [ i8 0, label %finish",
				"                               i8 60, label %finish",
				"                               i8 38, label %entity ]",
				"entity:",
				"  %is.lt = call i32 @strncmp(ptr %in, ptr " + lessThan + ", i64 4)",
				"  %lt = icmp eq i32 %is.lt, 0",
				"  br i1 %lt, label %less, label %not.less",
				"not.less:",
				"  %is.gt = call i32 @strncmp(ptr %in, ptr " + greaterThan + ", i64 4)",
				"  %gt = icmp eq i32 %is.gt, 0",
				"  br i1 %gt, label %greater, label %not.greater",
				"not.greater:",
				"  %is.amp = call i32 @strncmp(ptr %in, ptr " + ampersand + ", i64 5)",
				"  %amp = icmp eq i32 %is.amp, 0",
				"  br i1 %amp, label %ampersand, label %plain",
				"less:",
				"  br label %decoded",
				"greater:",
				"  br label %decoded",
				"ampersand:",
				"  br label %decoded",
				"decoded:",
				"  %letter = phi i8 [ 60, %less ], [ 62, %greater ], [ 38, %ampersand ]",
				"  %skip = phi i64 [ 4, %less ], [ 4, %greater ], [ 5, %ampersand ]",
				"  store i8 %letter, ptr %out",
				"  br label %next",
				"plain:",
				"  store i8 %c, ptr %out",
				"  br label %next",
				"next:",
				"  %step = phi i64 [ %skip, %decoded ], [ 1, %plain ]",
				"  %in.next = getelementptr inbounds i8, ptr %in, i64 %step",
				"  %out.next = getelementptr inbounds i8, ptr %out, i64 1",
				"  br label %scan",
				"finish:",
				"  store i8 0, ptr %out",
				"  ret ptr %buffer",
				"}",
				"",
				"define internal void @sinter_deserialization_error(ptr %field, ptr %owner) {",
				"entry:",
				"  call i32 (ptr, ...) @printf(ptr " + message + ", ptr %field, ptr %owner)",
				"  call void @exit(i32 1)",
				"  unreachable",
				"}",
				"",
				""));
	}
}
