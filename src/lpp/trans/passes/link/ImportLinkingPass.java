package lpp.trans.passes.link;

import lpp.errors.IssueContext;
import lpp.lexer.Token;
import lpp.lexer.TokenStream;
import lpp.lexer.TokenType;
import lpp.lexer.Tokenizer;
import lpp.trans.intermediate.IOErrorIssue;
import lpp.trans.intermediate.WhileLoadingFile;
import lpp.trans.passes.scan.ScanningPass;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Resolves the leading {@code import Name;} statements of a file and splices the imported code in front of
 * the file's own body, transitively imported code first.
 */
public class ImportLinkingPass {

	private static final Logger logger = Logger.getLogger(ImportLinkingPass.class.getName());

	public static final String SOURCE_EXTENSION = ".lpp";

	private final IssueContext ctx;
	private final Consumer<Tokenizer> configure;
	private final Map<Path, FileNode> loaded = new HashMap<>();
	private final Map<Path, List<FileNode>> discovered = new HashMap<>();
	private final Deque<Path> activeChain = new ArrayDeque<>();

	private ImportLinkingPass(IssueContext ctx, Consumer<Tokenizer> configure) {
		this.ctx = ctx;
		this.configure = configure;
	}

	/**
	 * @param file the path the stream was scanned from; imports resolve against its directory
	 * @param configure applies the scanner flags used for imported files
	 * @return a stream of all imported code followed by the body of the given file
	 */
	public static TokenStream perform(IssueContext ctx, Path file, TokenStream stream, Consumer<Tokenizer> configure) {
		ImportLinkingPass pass = new ImportLinkingPass(ctx, configure);
		FileNode root = new FileNode(canonical(file), stream);
		List<FileNode> dependencies = pass.discoverImports(root);
		root.setDependencies(dependencies);
		logger.fine("Dependencies of " + file + ": " + dependencies);

		List<List<Token>> runs = new ArrayList<>();
		for (int i = dependencies.size() - 1; i >= 0; i--) {
			runs.add(dependencies.get(i).getBody());
		}
		runs.add(root.getBody());
		return TokenStream.concat(file, runs);
	}

	/**
	 * Finds the imports of file, loading each imported file and searching it in turn.
	 *
	 * @return the direct imports of file in order, followed by the dependency lists of each of them; a file
	 * needed by several others appears once, after all files that need it
	 */
	List<FileNode> discoverImports(FileNode file) {
		List<FileNode> cached = discovered.get(file.getPath());
		if (cached != null) {
			return cached;
		}
		activeChain.push(file.getPath());

		List<FileNode> direct = new ArrayList<>();
		for (Map.Entry<Token, Path> entry : readImportHeader(file).entrySet()) {
			Token importToken = entry.getKey();
			Path target = entry.getValue();
			if (activeChain.contains(target)) {
				List<Path> chain = new ArrayList<>();
				// outermost file first
				activeChain.descendingIterator().forEachRemaining(chain::add);
				chain = chain.subList(chain.indexOf(target), chain.size());
				List<Path> cycle = new ArrayList<>(chain);
				cycle.add(target);
				throw new CircularImportIssue(importToken, cycle);
			}
			direct.add(load(importToken, target));
		}

		List<FileNode> all = new ArrayList<>(direct);
		for (FileNode dependency : direct) {
			all.addAll(discoverImports(dependency));
		}
		activeChain.pop();

		List<FileNode> result = keepLastOccurrence(all);
		file.setDependencies(result);
		discovered.put(file.getPath(), result);
		return result;
	}

	/**
	 * Walks the leading import statements, recording where the file's body starts.
	 *
	 * @return the name token and resolved path of each import, in order
	 */
	private Map<Token, Path> readImportHeader(FileNode file) {
		TokenStream stream = file.getStream();
		Map<Token, Path> imports = new LinkedHashMap<>();
		int index = stream.nextSignificant(0);
		file.setBodyStart(index);
		while (stream.type(index) == TokenType.KEYWORD && stream.get(index).getText().equals("import")) {
			int nameIndex = stream.nextSignificant(index);
			Token name = stream.get(nameIndex);
			if (name.getType() != TokenType.IMPORT) {
				break;
			}
			Path target = canonical(file.getDirectory().resolve(name.getText() + SOURCE_EXTENSION));
			if (target.equals(file.getPath())) {
				List<Path> cycle = new ArrayList<>();
				cycle.add(target);
				cycle.add(target);
				throw new CircularImportIssue(name, cycle);
			}
			int semicolon = stream.nextSignificant(nameIndex);
			if (stream.type(semicolon) != TokenType.SYMBOL_SEMICOLON) {
				throw new ImportSyntaxIssue(name, "Semicolon not found after 'import " + name.getText() + "'");
			}
			logger.fine("Found import " + target);
			imports.put(name, target);
			index = stream.nextSignificant(semicolon);
			file.setBodyStart(index);
		}
		return imports;
	}

	private FileNode load(Token importToken, Path target) {
		FileNode node = loaded.get(target);
		if (node == null) {
			logger.info("Loading imported file " + target);
			IssueContext fileCtx = ctx.withContext(new WhileLoadingFile(target, importToken));
			try {
				node = new FileNode(target, ScanningPass.perform(fileCtx, target, configure));
			} catch (IOErrorIssue e) {
				throw e.withContext(new WhileLoadingFile(target, importToken));
			}
			loaded.put(target, node);
		}
		return node;
	}

	private static List<FileNode> keepLastOccurrence(List<FileNode> nodes) {
		Map<Path, Integer> lastIndex = new HashMap<>();
		for (int i = 0; i < nodes.size(); i++) {
			lastIndex.put(nodes.get(i).getPath(), i);
		}
		List<FileNode> result = new ArrayList<>();
		for (int i = 0; i < nodes.size(); i++) {
			if (lastIndex.get(nodes.get(i).getPath()) == i) {
				result.add(nodes.get(i));
			}
		}
		return result;
	}

	private static Path canonical(Path path) {
		return path.toAbsolutePath().normalize();
	}
}
