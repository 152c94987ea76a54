package lpp.util;

import lpp.InternalCompilerError;
import lpp.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A position in an L++ source file. Lines are 1-based, columns are 0-based and expand tabs to the next
 * multiple of 8. Offsets are character indices into the file's text.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int line;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startOffset, int endOffset, int line, int startColumn, int endColumn) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.line = line;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public String prettyString() {
		StringWriter sw = new StringWriter();
		writePretty(new IndentingWriter(sw));
		return sw.getBuffer().toString();
	}

	public void writePretty(IndentingWriter out) {
		try {
			if (isUnknown()) {
				out.write("at unknown source location");
				return;
			}
			out.write("at line " + line + " column " + startColumn);
			if (endColumn != startColumn) {
				out.write("-" + endColumn);
			}
			if (file != null) {
				out.write(" in file " + file);
			}
		} catch (IOException e) {
			throw new InternalCompilerError("writing to a string failed", e);
		}
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return line < 0;
	}

	/**
	 * @return the smallest location spanning both this location and other, assuming both are on the same line
	 * of the same file
	 */
	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		if (line != other.line) {
			// multi-line spans are represented by their first line
			return line < other.line ? this : other;
		}
		return new SourceLocation(file,
				Integer.min(startOffset, other.startOffset),
				Integer.max(endOffset, other.endOffset),
				line,
				Integer.min(startColumn, other.startColumn),
				Integer.max(endColumn, other.endColumn));
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getLine() {
		return line;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + endColumn;
		result = prime * result + ((file == null) ? 0 : file.hashCode());
		result = prime * result + startOffset;
		result = prime * result + endOffset;
		result = prime * result + startColumn;
		result = prime * result + line;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && startColumn == other.startColumn && line == other.line &&
				startOffset == other.startOffset && endOffset == other.endOffset &&
				Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [file=" + file + ", startOffset=" + startOffset + ", endOffset=" + endOffset +
					", line=" + line + ", startColumn=" + startColumn + ", endColumn=" + endColumn + "]";
		}
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		if (file != null && o.file != null) {
			int comparedFile = file.compareTo(o.file);
			if (comparedFile != 0) {
				return comparedFile;
			}
		}
		int comparedLine = Integer.compare(line, o.line);
		if (comparedLine != 0) {
			return comparedLine;
		}
		int comparedStartColumn = Integer.compare(startColumn, o.startColumn);
		if (comparedStartColumn != 0) {
			return comparedStartColumn;
		}
		return Integer.compare(startOffset, o.startOffset);
	}

}
