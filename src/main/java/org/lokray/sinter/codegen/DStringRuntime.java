// File: src/main/java/org/lokray/sinter/codegen/DStringRuntime.java
package org.lokray.sinter.codegen;

import org.lokray.sinter.ast.expressions.DStringExpression;
import org.lokray.sinter.semantics.PrimitiveType;
import org.lokray.sinter.semantics.Type;
import org.lokray.sinter.semantics.VariableSymbol;
import org.lokray.sinter.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Lazy re-evaluation support for D-strings.
 * <p>
 * A D-string is a record holding its template, the cached rendering, and one slot per referenced variable with
 * the variable's address, its kind and the value seen at the last rendering:
 *
 * <pre>
 * %sinter.dstring = type { ptr template, ptr cache, i32 slot count, ptr slots, ptr render }
 * %sinter.dslot   = type { ptr location, i32 kind, i64 snapshot }
 * </pre>
 * <p>
 * {@code sinter_dstring_read} samples every slot and calls the literal's render routine only if the cache is
 * empty or some sample differs from its snapshot. Nothing happens on assignment to a referenced variable.
 */
class DStringRuntime
{
	static final String RECORD = "%sinter.dstring";
	static final String SLOT = "%sinter.dslot";
	static final String READ = "@sinter_dstring_read";
	static final String COPY = "@sinter_strdup";

	/**
	 * One compiled D-string literal: its distinct variables and the render routine that formats them.
	 */
	static class Literal
	{
		private final List<VariableSymbol> variables;
		private final String renderName;

		Literal(List<VariableSymbol> variables, String renderName)
		{
			this.variables = variables;
			this.renderName = renderName;
		}

		List<VariableSymbol> getVariables()
		{
			return variables;
		}

		String getRenderName()
		{
			return renderName;
		}
	}

	private final StringPool strings;
	private final StringBuilder renderers = new StringBuilder();
	private int literalCounter;

	DStringRuntime(StringPool strings)
	{
		this.strings = strings;
	}

	/**
	 * Generates the render routine of one literal. Placeholders are looked up through {@code resolve}, which
	 * returns the variable the resolver bound to each part.
	 */
	Literal compile(DStringExpression expression, Function<DStringExpression.Part, VariableSymbol> resolve)
	{
		String name = "@dstring$render$" + (literalCounter++);
		List<VariableSymbol> variables = new ArrayList<>();
		StringBuilder format = new StringBuilder();
		List<Integer> placeholderSlots = new ArrayList<>();
		for (DStringExpression.Part part : expression.getParts())
		{
			if (!part.isPlaceholder())
			{
				format.append(part.getText().replace("%", "%%"));
				continue;
			}
			VariableSymbol variable = resolve.apply(part);
			if (variable == null)
			{
				throw new CodegenException("Unresolved D-string placeholder '{" + part.getText() + "}'.");
			}
			int slot = variables.indexOf(variable);
			if (slot < 0)
			{
				slot = variables.size();
				variables.add(variable);
			}
			placeholderSlots.add(slot);
			format.append(formatOf(variable.getType()));
		}
		Debug.log("D-string %s renders with \"%s\" over %d variable(s)", name, format, variables.size());

		FunctionEmitter render = new FunctionEmitter("define internal void " + name + "(ptr %d)");
		String slots = render.load("ptr", render.gep(RECORD, "%d", "i32 0, i32 3"));
		List<String> values = new ArrayList<>();
		for (int slot = 0; slot < variables.size(); slot++)
		{
			Type type = variables.get(slot).getType();
			String location = render.load("ptr", render.gep(SLOT, slots, "i64 " + slot + ", i32 0"));
			String value = render.load(LlvmTypes.toLlvm(type), location);
			values.add(formatArgument(render, type, value));
		}
		List<String> arguments = new ArrayList<>();
		for (int slot : placeholderSlots)
		{
			arguments.add(values.get(slot));
		}
		String buffer = formatToHeap(render, strings.intern(format.toString()), arguments);
		String cacheAddress = render.gep(RECORD, "%d", "i32 0, i32 1");
		String old = render.load("ptr", cacheAddress);
		render.call("void", "@free", List.of("ptr " + old));
		render.store("ptr", buffer, cacheAddress);
		render.terminate("ret void");
		render.finish(renderers);
		return new Literal(variables, name);
	}

	static String formatOf(Type type)
	{
		if (type == PrimitiveType.INT)
		{
			return "%d";
		}
		if (type == PrimitiveType.FLOAT || type == PrimitiveType.DOUBLE)
		{
			return "%g";
		}
		return "%s";
	}

	/**
	 * Widens a value to what a C variadic call expects: floats become doubles and booleans become
	 * {@code "true"}/{@code "false"}.
	 *
	 * @return A typed argument such as {@code i32 %t4}.
	 */
	String formatArgument(FunctionEmitter emitter, Type type, String value)
	{
		if (type == PrimitiveType.FLOAT)
		{
			return "double " + emitter.assign("fpext float " + value + " to double");
		}
		if (type == PrimitiveType.BOOLEAN)
		{
			return "ptr " + emitter.assign("select i1 " + value + ", ptr " + strings.intern("true") + ", ptr " + strings.intern("false"));
		}
		return LlvmTypes.toLlvm(type) + " " + value;
	}

	/**
	 * Formats into a freshly allocated buffer: one {@code snprintf} to measure, one to write.
	 */
	static String formatToHeap(FunctionEmitter emitter, String format, List<String> arguments)
	{
		String tail = arguments.isEmpty() ? "" : ", " + String.join(", ", arguments);
		String length = emitter.assign("call i32 (ptr, i64, ptr, ...) @snprintf(ptr null, i64 0, ptr " + format + tail + ")");
		String wide = emitter.assign("sext i32 " + length + " to i64");
		String size = emitter.assign("add i64 " + wide + ", 1");
		String buffer = emitter.call("ptr", "@malloc", List.of("i64 " + size));
		emitter.emit("call i32 (ptr, i64, ptr, ...) @snprintf(ptr " + buffer + ", i64 " + size + ", ptr " + format + tail + ")");
		return buffer;
	}

	/**
	 * Fills the record at {@code record}, whose slot array lives at {@code slots}, leaving the cache empty.
	 * Slot locations come from {@code addresses}, parallel to {@link Literal#getVariables()}.
	 */
	void initialise(FunctionEmitter emitter, Literal literal, String template, String record, String slots, List<String> addresses)
	{
		int count = literal.getVariables().size();
		emitter.store("ptr", strings.intern(template), emitter.gep(RECORD, record, "i32 0, i32 0"));
		emitter.store("ptr", "null", emitter.gep(RECORD, record, "i32 0, i32 1"));
		emitter.store("i32", Integer.toString(count), emitter.gep(RECORD, record, "i32 0, i32 2"));
		emitter.store("ptr", count == 0 ? "null" : slots, emitter.gep(RECORD, record, "i32 0, i32 3"));
		emitter.store("ptr", literal.getRenderName(), emitter.gep(RECORD, record, "i32 0, i32 4"));
		for (int i = 0; i < count; i++)
		{
			String kind = Integer.toString(LlvmTypes.sampleKind(literal.getVariables().get(i).getType()));
			emitter.store("ptr", addresses.get(i), emitter.gep(SLOT, slots, "i64 " + i + ", i32 0"));
			emitter.store("i32", kind, emitter.gep(SLOT, slots, "i64 " + i + ", i32 1"));
			emitter.store("i64", "0", emitter.gep(SLOT, slots, "i64 " + i + ", i32 2"));
		}
	}

	static String read(FunctionEmitter emitter, String record)
	{
		return emitter.call("ptr", READ, List.of("ptr " + record));
	}

	/**
	 * Copies a rendering out of its record, so it outlives the next re-render.
	 */
	static String copy(FunctionEmitter emitter, String text)
	{
		return emitter.call("ptr", COPY, List.of("ptr " + text));
	}

	void emitTypes(StringBuilder out)
	{
		out.append(RECORD).append(" = type { ptr, ptr, i32, ptr, ptr }\n");
		out.append(SLOT).append(" = type { ptr, i32, i64 }\n");
	}

	void emitRuntime(StringBuilder out)
	{
		out.append("@sinter_dstring_renders = global i64 0\n\n");

		out.append(String.join("\n",
				"define i64 @sinter_dstring_render_count() {",
				"entry:",
				"  %count = load i64, ptr @sinter_dstring_renders",
				"  ret i64 %count",
				"}",
				"",
				"; Current value of a slot as raw bits",
				"define internal i64 @sinter_dstring_sample(ptr %location, i32 %kind) {",
				"entry:",
				"  switch i32 %kind, label %sample.pointer [ i32 " + LlvmTypes.KIND_INT + ", label %sample.int",
				"                                     i32 " + LlvmTypes.KIND_FLOAT + ", label %sample.float",
				"                                     i32 " + LlvmTypes.KIND_DOUBLE + ", label %sample.double",
				"                                     i32 " + LlvmTypes.KIND_BOOLEAN + ", label %sample.boolean ]",
				"sample.int:",
				"  %i = load i32, ptr %location",
				"  %i.bits = sext i32 %i to i64",
				"  ret i64 %i.bits",
				"sample.float:",
				"  %f = load float, ptr %location",
				"  %f.raw = bitcast float %f to i32",
				"  %f.bits = zext i32 %f.raw to i64",
				"  ret i64 %f.bits",
				"sample.double:",
				"  %g = load double, ptr %location",
				"  %g.bits = bitcast double %g to i64",
				"  ret i64 %g.bits",
				"sample.boolean:",
				"  %b = load i1, ptr %location",
				"  %b.bits = zext i1 %b to i64",
				"  ret i64 %b.bits",
				"sample.pointer:",
				"  %p = load ptr, ptr %location",
				"  %p.bits = ptrtoint ptr %p to i64",
				"  ret i64 %p.bits",
				"}",
				"",
				"define ptr " + READ + "(ptr %d) {",
				"entry:",
				"  %cache.addr = getelementptr inbounds " + RECORD + ", ptr %d, i32 0, i32 1",
				"  %cache = load ptr, ptr %cache.addr",
				"  %empty = icmp eq ptr %cache, null",
				"  %count.addr = getelementptr inbounds " + RECORD + ", ptr %d, i32 0, i32 2",
				"  %count = load i32, ptr %count.addr",
				"  %slots.addr = getelementptr inbounds " + RECORD + ", ptr %d, i32 0, i32 3",
				"  %slots = load ptr, ptr %slots.addr",
				"  br label %loop",
				"loop:",
				"  %i = phi i32 [ 0, %entry ], [ %i.next, %body ]",
				"  %dirty = phi i1 [ %empty, %entry ], [ %dirty.next, %body ]",
				"  %more = icmp slt i32 %i, %count",
				"  br i1 %more, label %body, label %check",
				"body:",
				"  %slot = getelementptr inbounds " + SLOT + ", ptr %slots, i32 %i",
				"  %location.addr = getelementptr inbounds " + SLOT + ", ptr %slot, i32 0, i32 0",
				"  %location = load ptr, ptr %location.addr",
				"  %kind.addr = getelementptr inbounds " + SLOT + ", ptr %slot, i32 0, i32 1",
				"  %kind = load i32, ptr %kind.addr",
				"  %current = call i64 @sinter_dstring_sample(ptr %location, i32 %kind)",
				"  %snapshot.addr = getelementptr inbounds " + SLOT + ", ptr %slot, i32 0, i32 2",
				"  %snapshot = load i64, ptr %snapshot.addr",
				"  %changed = icmp ne i64 %current, %snapshot",
				"  store i64 %current, ptr %snapshot.addr",
				"  %dirty.next = or i1 %dirty, %changed",
				"  %i.next = add i32 %i, 1",
				"  br label %loop",
				"check:",
				"  br i1 %dirty, label %rerender, label %done",
				"rerender:",
				"  %render.addr = getelementptr inbounds " + RECORD + ", ptr %d, i32 0, i32 4",
				"  %render = load ptr, ptr %render.addr",
				"  call void %render(ptr %d)",
				"  %renders = load i64, ptr @sinter_dstring_renders",
				"  %renders.next = add i64 %renders, 1",
				"  store i64 %renders.next, ptr @sinter_dstring_renders",
				"  br label %done",
				"done:",
				"  %text = load ptr, ptr %cache.addr",
				"  ret ptr %text",
				"}",
				"",
				"define internal ptr " + COPY + "(ptr %text) {",
				"entry:",
				"  %length = call i64 @strlen(ptr %text)",
				"  %size = add i64 %length, 1",
				"  %copy = call ptr @malloc(i64 %size)",
				"  call ptr @memcpy(ptr %copy, ptr %text, i64 %size)",
				"  ret ptr %copy",
				"}",
				"",
				""));
		out.append(renderers);
	}
}
