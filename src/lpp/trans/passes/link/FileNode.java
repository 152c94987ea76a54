package lpp.trans.passes.link;

import lpp.lexer.Token;
import lpp.lexer.TokenStream;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One tokenized source file taking part in import linking.
 */
public class FileNode {

	private final Path path;
	private final TokenStream stream;
	private int bodyStart;
	private final List<FileNode> dependencies;

	public FileNode(Path path, TokenStream stream) {
		this.path = path;
		this.stream = stream;
		this.bodyStart = stream.firstIndex();
		this.dependencies = new ArrayList<>();
	}

	public Path getPath() {
		return path;
	}

	public Path getDirectory() {
		Path parent = path.getParent();
		return parent == null ? path.getFileSystem().getPath("") : parent;
	}

	public TokenStream getStream() {
		return stream;
	}

	void setBodyStart(int bodyStart) {
		this.bodyStart = bodyStart;
	}

	/**
	 * @return the tokens after the file's import statements
	 */
	public List<Token> getBody() {
		return stream.from(bodyStart);
	}

	/**
	 * @return every file this file needs, ordered so that a file always comes before the files it imports
	 */
	public List<FileNode> getDependencies() {
		return Collections.unmodifiableList(dependencies);
	}

	void setDependencies(List<FileNode> dependencies) {
		this.dependencies.clear();
		this.dependencies.addAll(dependencies);
	}

	@Override
	public String toString() {
		return path.toString();
	}
}
