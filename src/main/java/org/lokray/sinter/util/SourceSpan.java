// File: src/main/java/org/lokray/sinter/util/SourceSpan.java
package org.lokray.sinter.util;

import org.lokray.sinter.lexer.Token;

import java.util.Objects;

/**
 * A region of source text, 1-based lines and columns. The end position is inclusive.
 */
public final class SourceSpan
{
	public static final SourceSpan UNKNOWN = new SourceSpan(0, 0, 0, 0);

	private final int line;
	private final int column;
	private final int endLine;
	private final int endColumn;

	public SourceSpan(int line, int column, int endLine, int endColumn)
	{
		this.line = line;
		this.column = column;
		this.endLine = endLine;
		this.endColumn = endColumn;
	}

	public static SourceSpan of(Token token)
	{
		if (token == null)
		{
			return UNKNOWN;
		}
		int length = Math.max(1, token.getLexeme().length());
		return new SourceSpan(token.getLine(), token.getColumn(), token.getLine(), token.getColumn() + length - 1);
	}

	public static SourceSpan between(Token first, Token last)
	{
		if (first == null || last == null)
		{
			return of(first != null ? first : last);
		}
		SourceSpan end = of(last);
		return new SourceSpan(first.getLine(), first.getColumn(), end.endLine, end.endColumn);
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public int getEndLine()
	{
		return endLine;
	}

	public int getEndColumn()
	{
		return endColumn;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof SourceSpan))
		{
			return false;
		}
		SourceSpan that = (SourceSpan) o;
		return line == that.line && column == that.column && endLine == that.endLine && endColumn == that.endColumn;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(line, column, endLine, endColumn);
	}

	@Override
	public String toString()
	{
		return line + ":" + column + "-" + endLine + ":" + endColumn;
	}
}
