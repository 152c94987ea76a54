package lpp.parser;

import lpp.lexer.ChemicalToken;
import lpp.lexer.Token;
import lpp.lexer.TokenStream;
import lpp.lexer.TokenType;
import lpp.lexer.Tokenizer;
import lpp.model.ast.ChemicalNode;
import lpp.model.ast.EmptyNode;
import lpp.model.ast.ExpressionEvaluator;
import lpp.model.ast.FunctionNode;
import lpp.model.ast.IdentifierNode;
import lpp.model.ast.IfElseNode;
import lpp.model.ast.IfNode;
import lpp.model.ast.ImportNode;
import lpp.model.ast.IndexNode;
import lpp.model.ast.Keyword;
import lpp.model.ast.KeywordNode;
import lpp.model.ast.LoopingNode;
import lpp.model.ast.Node;
import lpp.model.ast.NumberNode;
import lpp.model.ast.Operator;
import lpp.model.ast.Param;
import lpp.model.ast.ParamNode;
import lpp.model.ast.Prefix;
import lpp.model.ast.Primitive;
import lpp.model.ast.ReturnNode;
import lpp.model.ast.SymbolNode;
import lpp.model.ast.Unit;
import lpp.scope.ScopeRegistry;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Recursive descent parser for a merged, layout-free L++ token stream.
 *
 * Constant expressions are folded as they are parsed: assigned values, parameter values and slice bounds are
 * replaced by the {@link NumberNode} they evaluate to, as are index times, and every declared name is recorded in
 * the scope of the enclosing block. Reaction equations, for loop conditions and increments are kept as written.
 *
 * At the start of a statement the cursor is on the statement's first token. Inside expressions the cursor is on
 * the last token consumed, and each level inspects the tokens after it.
 *
 * The first problem found is thrown as a {@link ParseIssue}; there is no recovery.
 */
public class Parser {

	private static final Logger logger = Logger.getLogger(Parser.class.getName());

	public static final String GLOBAL_SCOPE = "global";

	private static final Set<String> FLAT_DECLARATIONS = Collections.unmodifiableSet(new HashSet<>(
			Arrays.asList("reaction", "protein", "reagent", "container")));

	private static final String EQUATION = Param.EQUATION.getText();

	private final TokenStream stream;
	private final ScopeRegistry scopes;
	private int cur;
	private BlockType curBlockType = BlockType.GLOBAL;
	private Unit unitSeen = Unit.NONE;

	public Parser(TokenStream stream, ScopeRegistry scopes) {
		this.stream = stream;
		this.scopes = scopes;
		this.cur = stream.firstIndex();
	}

	public ScopeRegistry getScopeRegistry() {
		return scopes;
	}

	/**
	 * @return the first top-level statement; the rest follow through {@link Node#getNextStatement()}
	 */
	public Node parse() {
		if (cur().is(TokenType.END)) {
			throw fail("No tokens to parse. Empty file or all code in file is commented out.");
		}
		scopes.openScope(GLOBAL_SCOPE);
		Node root = parseStatement();
		Node last = lastInChain(root);
		int count = 1;
		while (!cur().is(TokenType.END)) {
			Node statement = parseStatement();
			last.setNextStatement(statement);
			last = lastInChain(statement);
			++count;
		}
		scopes.closeScope();
		logger.fine("Parsed " + count + " top-level statements from " + stream.getFile());
		return root;
	}

	// statements

	private Node parseStatement() {
		switch (cur().getType()) {
			case IF:
				return parseIf();
			case LOOPING:
				return parseLoop();
			case RETURN:
				return parseReturn();
			case KEYWORD:
				return parseKeyword();
			case PARAM:
				return parseParam();
			case IDENTIFIER:
				return parseIdentifierStatement();
			case PRIMITIVE: {
				SymbolNode assignment = parsePrimitive();
				next();
				return assignment;
			}
			case INTEGER:
			case FLOAT:
			case CHEMICAL:
				if (curBlockType == BlockType.CONTAINER || curBlockType == BlockType.REAGENT) {
					return inferParam();
				}
				throw fail("Parameter cannot be inferred in this block type.");
			default:
				throw fail("Failed to parse statement.");
		}
	}

	private Node parseIf() {
		Token ifToken = cur();
		Node condition = parseExpression();
		Node body = parseBlock();
		if (cur().is(TokenType.ELSE)) {
			Node elseBody = parseBlock();
			return new IfElseNode(ifToken.getLocation(), condition, body, elseBody);
		}
		return new IfNode(ifToken.getLocation(), condition, body);
	}

	/**
	 * Parses {@code { statements }} following the cursor and leaves the cursor after the closing brace.
	 */
	private Node parseBlock() {
		Token open = peek(1);
		require(TokenType.SYMBOL_CURLY_OPEN, "Missing opening curly brace.");
		next();
		Node first = null;
		Node last = null;
		while (!cur().is(TokenType.SYMBOL_CURLY_CLOSED)) {
			Node statement = parseStatement();
			if (first == null) {
				first = statement;
			} else {
				last.setNextStatement(statement);
			}
			last = lastInChain(statement);
		}
		next();
		return first != null ? first : new EmptyNode(open.getLocation(), "<empty block>");
	}

	/**
	 * A for loop becomes {@code LoopingNode(FOR, declaration, IfElseNode(condition, body, increment))}.
	 */
	private Node parseLoop() {
		Token loopToken = cur();
		switch (loopToken.getText()) {
			case "for": {
				require(TokenType.SYMBOL_PAREN_OPEN, "Missing opening parenthesis after for.");
				require(TokenType.PRIMITIVE, "For loop must begin with a primitive declaration.");
				Node declaration = parsePrimitive();
				Node condition = parseExpression();
				semicolon();
				next();
				if (!cur().is(TokenType.IDENTIFIER)) {
					throw fail("For loop increment must assign to an identifier.");
				}
				Token name = cur();
				Node increment = parseAssignment(
						new IdentifierNode(name.getLocation(), name.getText(), IdentifierNode.Kind.NON_FUNCTION),
						name.getText(), TokenType.IDENTIFIER, false);
				Node body = parseBlock();
				IfElseNode runOrIncrement = new IfElseNode(loopToken.getLocation(), condition, body, increment);
				return new LoopingNode(loopToken.getLocation(), LoopingNode.Kind.FOR, declaration, runOrIncrement);
			}
			case "while": {
				Node condition = parseExpression();
				Node body = parseBlock();
				return new LoopingNode(loopToken.getLocation(), LoopingNode.Kind.WHILE, condition, body);
			}
			default:
				throw fail("do-while loops are not supported.");
		}
	}

	private Node parseReturn() {
		Token returnToken = cur();
		Node value = parseExpression();
		semicolon();
		next();
		return new ReturnNode(returnToken.getLocation(), value);
	}

	private Node parseKeyword() {
		Token keywordToken = cur();
		Keyword keyword = Keyword.fromText(keywordToken.getText());
		if (FLAT_DECLARATIONS.contains(keywordToken.getText()) &&
				stream.type(cur + 2) == TokenType.SYMBOL_PAREN_OPEN) {
			return parseReaction();
		}
		if (consume(TokenType.IDENTIFIER)) {
			return parseDeclarationBlock(keywordToken, keyword);
		}
		if (consume(TokenType.IMPORT)) {
			ImportNode importNode = parseImport();
			semicolon();
			next();
			return importNode;
		}
		throw fail("Failed to parse statement.");
	}

	private Node parseDeclarationBlock(Token keywordToken, Keyword keyword) {
		curBlockType = BlockType.of(keyword);
		Token name = cur();

		// the block's name belongs to the enclosing scope
		IdentifierNode identifier;
		if (nextIs(TokenType.SYMBOL_PAREN_OPEN)) {
			identifier = new IdentifierNode(name.getLocation(), name.getText(), IdentifierNode.Kind.FUNCTION);
			scopes.current().put(name.getText(), TokenType.IDENTIFIER, "function");
			scopes.openScope(name.getText());
			consume(TokenType.SYMBOL_PAREN_OPEN);
			require(TokenType.SYMBOL_PAREN_CLOSED,
					"Keyword identifier should be followed with () for function or {} for non-function.");
		} else if (nextIs(TokenType.SYMBOL_CURLY_OPEN)) {
			identifier = new IdentifierNode(name.getLocation(), name.getText(), IdentifierNode.Kind.NON_FUNCTION);
			scopes.current().put(name.getText(), TokenType.IDENTIFIER, "class");
			scopes.openScope(name.getText());
		} else {
			throw fail("Keyword identifier should be followed with () for function or {} for non-function.");
		}

		Node body = parseBlock();
		KeywordNode keywordNode = new KeywordNode(keywordToken.getLocation(), keyword, identifier, body, true);
		scopes.closeScope();
		curBlockType = BlockType.GLOBAL;
		return keywordNode;
	}

	/**
	 * Parses a declaration written as {@code keyword name(params);}. Whatever the keyword, the result is a
	 * reaction whose body is the parameter chain.
	 */
	private KeywordNode parseReaction() {
		Token keywordToken = cur();
		if (!consume(TokenType.IDENTIFIER)) {
			throw fail("Parsing reaction failed.");
		}
		Token name = cur();
		scopes.current().put(name.getText(), TokenType.IDENTIFIER, "reaction");
		scopes.openScope(name.getText());
		IdentifierNode identifier = new IdentifierNode(
				name.getLocation(), name.getText(), IdentifierNode.Kind.NON_FUNCTION);
		require(TokenType.SYMBOL_PAREN_OPEN, "Parsing reaction failed.");
		Node params = parseParam();
		if (!cur().is(TokenType.SYMBOL_SEMICOLON)) {
			throw fail("Missing semicolon.");
		}
		next();
		scopes.closeScope();
		return new KeywordNode(keywordToken.getLocation(), Keyword.REACTION, identifier, params, false);
	}

	private ImportNode parseImport() {
		Token importToken = cur();
		ImportNode.Kind kind = ImportNode.Kind.fromText(importToken.getText());
		if (kind == null) {
			throw fail("Invalid or no import found directly after keyword 'import'.");
		}
		scopes.current().put(importToken.getText(), TokenType.IMPORT, "import");
		return new ImportNode(importToken.getLocation(), kind);
	}

	private Node parseIdentifierStatement() {
		Token name = cur();
		if (nextIs(TokenType.SYMBOL_EQUAL)) {
			SymbolNode assignment = parseAssignment(
					new IdentifierNode(name.getLocation(), name.getText(), IdentifierNode.Kind.NON_FUNCTION),
					name.getText(), TokenType.IDENTIFIER, true);
			next();
			return assignment;
		}
		if (nextIs(TokenType.SYMBOL_DOT)) {
			SymbolNode call = parseFunction();
			next();
			return call;
		}
		if (nextIs(TokenType.SYMBOL_BRACKET_OPEN)) {
			IndexNode index = parseIndex();
			SymbolNode assignment = parseAssignment(index, name.getText(), TokenType.IDENTIFIER, true);
			next();
			return assignment;
		}
		throw fail("Failed to parse statement.");
	}

	private SymbolNode parsePrimitive() {
		Primitive primitive = Primitive.fromText(cur().getText());
		if (!consume(TokenType.IDENTIFIER)) {
			throw fail("Identifier not found after primitive declaration.");
		}
		Token name = cur();
		return parseAssignment(
				new IdentifierNode(name.getLocation(), name.getText(), IdentifierNode.Kind.PRIMITIVE, primitive),
				name.getText(), TokenType.PRIMITIVE, true);
	}

	/**
	 * Parses {@code = expression} after target. The folded value is always recorded under name; the
	 * assignment keeps the folded value only if evaluate is set.
	 */
	private SymbolNode parseAssignment(Node target, String name, TokenType scopeType, boolean evaluate) {
		Token equals = peek(1);
		if (!consume(TokenType.SYMBOL_EQUAL)) {
			throw fail("Parsing identifier assignment but equals symbol (=) not found.");
		}
		Node expression = parseExpression();
		NumberNode value = fold(expression);
		scopes.current().put(name, scopeType, value.getNum());
		SymbolNode assignment = new SymbolNode(
				equals.getLocation(), Operator.ASSIGNMENT, target, evaluate ? value : expression);

		// the increment of a for loop ends at the closing parenthesis
		if (!consume(TokenType.SYMBOL_PAREN_CLOSED)) {
			semicolonOrComma();
		}
		return assignment;
	}

	private SymbolNode parseFunction() {
		Token object = cur();
		Token dot = peek(1);
		consume(TokenType.SYMBOL_DOT);
		if (!consume(TokenType.FUNCTION)) {
			throw fail("Parsing identifier function call but function is either invalid or missing after dot.");
		}
		Token function = cur();
		IdentifierNode target = new IdentifierNode(
				object.getLocation(), object.getText(), IdentifierNode.Kind.FUNCTION);
		Node params = parseFunctionParen();
		FunctionNode call = new FunctionNode(
				function.getLocation(), function.getText(), FunctionNode.Kind.INSTANCE, params);
		semicolon();
		scopes.current().put(function.getText(), TokenType.FUNCTION, "function");
		return new SymbolNode(dot.getLocation(), Operator.DOT, target, call);
	}

	/**
	 * Leaves the cursor on the closing parenthesis.
	 */
	private Node parseFunctionParen() {
		if (!consume(TokenType.SYMBOL_PAREN_OPEN)) {
			throw fail("Parentheses invalid or not found after function call.");
		}
		if (consume(TokenType.SYMBOL_PAREN_CLOSED)) {
			return new EmptyNode(cur().getLocation(), "<no parameters>");
		}
		if (nextIs(TokenType.PARAM)) {
			next();
			Node params = parseParam();
			prev();
			if (!cur().is(TokenType.SYMBOL_PAREN_CLOSED)) {
				throw fail("Parentheses invalid or not found after function call.");
			}
			return params;
		}
		throw fail("Parentheses invalid or not found after function call.");
	}

	private IndexNode parseIndex() {
		Token name = cur();
		IdentifierNode target = new IdentifierNode(
				name.getLocation(), name.getText(), IdentifierNode.Kind.NON_FUNCTION);
		consume(TokenType.SYMBOL_BRACKET_OPEN);
		Node index = parseExpression();
		if (!(index instanceof SymbolNode) || ((SymbolNode) index).getOperator() != Operator.COLON) {
			index = fold(index);
		}
		require(TokenType.SYMBOL_BRACKET_CLOSED, "Closing square bracket not found.");
		return new IndexNode(name.getLocation().combine(cur().getLocation()), target, index);
	}

	// parameters

	/**
	 * Parses a parameter list entry, either {@code name = value} or an equation written without {@code eq =},
	 * and the entries that follow it.
	 */
	private SymbolNode parseParam() {
		boolean named = nextIs(TokenType.SYMBOL_EQUAL) || nextIs(TokenType.PARAM);
		if (named || startsEquation(cur + 1)) {
			consume(TokenType.PARAM);
			Token paramToken = cur();
			ParamNode param;
			if (startsEquation(cur + 1)) {
				param = new ParamNode(peek(1).getLocation(), Param.EQUATION);
			} else if (consume(TokenType.SYMBOL_EQUAL)) {
				Param type = Param.fromText(paramToken.getText());
				if (type == null) {
					throw fail("Unknown parameter " + paramToken.getText() + ".");
				}
				param = new ParamNode(paramToken.getLocation(), type);
			} else {
				throw fail("Parsing parameter but equality not found.");
			}

			Node expression = parseExpression();
			Node value;
			if (param.getParam() == Param.EQUATION) {
				scopes.current().put(EQUATION, TokenType.PARAM, EQUATION);
				value = expression;
			} else {
				NumberNode folded = fold(expression);
				scopes.current().put(param.getParam().getText(), TokenType.PARAM, folded.getNum());
				value = folded;
			}
			SymbolNode assignment = new SymbolNode(param.getLocation(), Operator.ASSIGNMENT, param, value);
			parseNextParam(assignment);
			return assignment;
		}
		if (consume(TokenType.INTEGER) || consume(TokenType.FLOAT)) {
			return inferParam();
		}
		throw fail("Parsing parameter but equality not found.");
	}

	/**
	 * Parses a value whose parameter is implied: an equation if it starts with a chemical, otherwise the
	 * parameter measured by the unit written after the value. Expects the cursor on the value's first token.
	 */
	private SymbolNode inferParam() {
		prev();
		Token first = peek(1);
		boolean equation = Tokenizer.isChemical(stream, cur + 1);
		unitSeen = Unit.NONE;
		Node expression = parseExpression();

		Param param;
		Node value;
		if (equation) {
			param = Param.EQUATION;
			scopes.current().put(EQUATION, TokenType.PARAM, EQUATION);
			value = expression;
		} else {
			param = unitSeen.getInferredParam();
			if (param == null) {
				throw fail("Unit was not or cannot be inferred successfully.");
			}
			NumberNode folded = fold(expression);
			scopes.current().put(param.getText(), TokenType.PARAM, folded.getNum());
			value = folded;
		}
		unitSeen = Unit.NONE;

		SymbolNode assignment = new SymbolNode(
				first.getLocation(), Operator.ASSIGNMENT, new ParamNode(first.getLocation(), param), value);
		parseNextParam(assignment);
		return assignment;
	}

	private void parseNextParam(SymbolNode param) {
		if (consume(TokenType.SYMBOL_COMMA)) {
			next();
			SymbolNode nextParam = cur().is(TokenType.PARAM) ? parseParam() : inferParam();
			param.setNextStatement(nextParam);
		} else {
			semicolonOrParen();
			next();
		}
	}

	private boolean startsEquation(int index) {
		TokenType type = stream.type(index);
		if (type == TokenType.CHEMICAL || type == TokenType.IDENTIFIER) {
			return true;
		}
		TokenType following = stream.type(index + 1);
		return type == TokenType.INTEGER && (following == TokenType.CHEMICAL || following == TokenType.IDENTIFIER);
	}

	// expressions, loosest binding first

	private Node parseExpression() {
		return parseTernary();
	}

	private Node parseTernary() {
		return parseLogiOr();
	}

	private Node parseLogiOr() {
		Node left = parseLogiAnd();
		if (lookingAt(TokenType.SYMBOL_OR, TokenType.SYMBOL_OR)) {
			Token op = advance(2);
			return new SymbolNode(op.getLocation(), Operator.LOGICAL_OR, left, parseLogiOr());
		}
		return left;
	}

	private Node parseLogiAnd() {
		Node left = parseBitOr();
		if (lookingAt(TokenType.SYMBOL_AND, TokenType.SYMBOL_AND)) {
			Token op = advance(2);
			return new SymbolNode(op.getLocation(), Operator.LOGICAL_AND, left, parseLogiAnd());
		}
		return left;
	}

	private Node parseBitOr() {
		Node left = parseBitAnd();
		if (nextIs(TokenType.SYMBOL_OR) && stream.type(cur + 2) != TokenType.SYMBOL_OR) {
			Token op = advance(1);
			return new SymbolNode(op.getLocation(), Operator.BITWISE_OR, left, parseBitOr());
		}
		return left;
	}

	private Node parseBitAnd() {
		Node left = parseEq();
		if (nextIs(TokenType.SYMBOL_AND) && stream.type(cur + 2) != TokenType.SYMBOL_AND) {
			Token op = advance(1);
			return new SymbolNode(op.getLocation(), Operator.BITWISE_AND, left, parseBitAnd());
		}
		return left;
	}

	private Node parseEq() {
		Node left = parseLesserGreater();
		Operator operator;
		if (lookingAt(TokenType.SYMBOL_EQUAL, TokenType.SYMBOL_EQUAL)) {
			operator = Operator.EQUALS;
		} else if (lookingAt(TokenType.SYMBOL_NOT, TokenType.SYMBOL_EQUAL)) {
			operator = Operator.NOT_EQUALS;
		} else {
			return left;
		}
		Token op = advance(2);
		return new SymbolNode(op.getLocation(), operator, left, parseEq());
	}

	/**
	 * The right operand of a comparison is an additive expression.
	 */
	private Node parseLesserGreater() {
		Node left = parseSlice();
		Operator operator;
		int width = 1;
		if (nextIs(TokenType.SYMBOL_LEQ)) {
			operator = Operator.LEQ;
		} else if (nextIs(TokenType.SYMBOL_GEQ)) {
			operator = Operator.GEQ;
		} else if (lookingAt(TokenType.SYMBOL_LT, TokenType.SYMBOL_EQUAL)) {
			operator = Operator.LEQ;
			width = 2;
		} else if (lookingAt(TokenType.SYMBOL_GT, TokenType.SYMBOL_EQUAL)) {
			operator = Operator.GEQ;
			width = 2;
		} else if (nextIs(TokenType.SYMBOL_LT)) {
			operator = Operator.LT;
		} else if (nextIs(TokenType.SYMBOL_GT)) {
			operator = Operator.GT;
		} else {
			return left;
		}
		Token op = advance(width);
		return new SymbolNode(op.getLocation(), operator, left, parseAddSub());
	}

	/**
	 * Slices fold their bounds. A missing bound is an {@link EmptyNode}.
	 */
	private Node parseSlice() {
		Token start = cur();
		if (consume(TokenType.SYMBOL_COLON)) {
			Node end = nextIs(TokenType.SYMBOL_BRACKET_CLOSED) ? emptyBound() : fold(parseArrow());
			return new SymbolNode(start.getLocation(), Operator.COLON, emptyBound(), end);
		}
		Node op = parseArrow();
		if (!consume(TokenType.SYMBOL_COLON)) {
			return op;
		}
		NumberNode first = fold(op);
		Node end = nextIs(TokenType.SYMBOL_BRACKET_CLOSED) ? emptyBound() : fold(parseArrow());
		return new SymbolNode(start.getLocation(), Operator.COLON, first, end);
	}

	private EmptyNode emptyBound() {
		return new EmptyNode(cur().getLocation(), "<empty>");
	}

	/**
	 * Arrows are spelled with separate symbol tokens: {@code - - >}, {@code < - -}, {@code < - >} and
	 * {@code - - |}. The right side is an additive expression.
	 */
	private Node parseArrow() {
		Node left = parseAddSub();
		Operator arrow;
		if (lookingAt(TokenType.SYMBOL_SUBTRACT, TokenType.SYMBOL_SUBTRACT, TokenType.SYMBOL_GT)) {
			arrow = Operator.FORWARD;
		} else if (lookingAt(TokenType.SYMBOL_LT, TokenType.SYMBOL_SUBTRACT, TokenType.SYMBOL_SUBTRACT)) {
			arrow = Operator.BACKWARD;
		} else if (lookingAt(TokenType.SYMBOL_LT, TokenType.SYMBOL_SUBTRACT, TokenType.SYMBOL_GT)) {
			arrow = Operator.REVERSIBLE;
		} else if (lookingAt(TokenType.SYMBOL_SUBTRACT, TokenType.SYMBOL_SUBTRACT, TokenType.SYMBOL_OR)) {
			arrow = Operator.INHIBITION;
		} else {
			return left;
		}
		Token first = advance(3);
		return new SymbolNode(first.getLocation().combine(cur().getLocation()), arrow, left, parseAddSub());
	}

	private Node parseAddSub() {
		Node left = parseMulDivMod();
		Operator operator;
		if (nextIs(TokenType.SYMBOL_ADD)) {
			operator = Operator.ADD;
		} else if (nextIs(TokenType.SYMBOL_SUBTRACT) && stream.type(cur + 2) != TokenType.SYMBOL_SUBTRACT) {
			operator = Operator.SUBTRACT;
		} else {
			return left;
		}
		Token op = advance(1);
		return new SymbolNode(op.getLocation(), operator, left, parseAddSub());
	}

	private Node parseMulDivMod() {
		Node left = parseTopLevelExpression();
		Operator operator;
		if (nextIs(TokenType.SYMBOL_MULTIPLY)) {
			operator = Operator.MULTIPLY;
		} else if (nextIs(TokenType.SYMBOL_DIVIDE)) {
			operator = Operator.DIVIDE;
		} else if (nextIs(TokenType.SYMBOL_PERCENT)) {
			operator = Operator.MODULUS;
		} else if (nextIs(TokenType.SYMBOL_CARAT)) {
			operator = Operator.POWER;
		} else {
			return left;
		}
		Token op = advance(1);
		return new SymbolNode(op.getLocation(), operator, left, parseMulDivMod());
	}

	private Node parseTopLevelExpression() {
		switch (peek(1).getType()) {
			case SYMBOL_PAREN_OPEN: {
				consume(TokenType.SYMBOL_PAREN_OPEN);
				Node expression = parseExpression();
				require(TokenType.SYMBOL_PAREN_CLOSED, "Closing parenthesis not found.");
				return expression;
			}
			case IDENTIFIER: {
				Token name = advance(1);
				return new IdentifierNode(name.getLocation(), name.getText(), IdentifierNode.Kind.NON_FUNCTION);
			}
			case CHEMICAL:
				next();
				return parseChemical();
			case INTEGER:
			case FLOAT:
				return parseLiteral();
			default:
				throw fail("Failed at parsing top level expression.");
		}
	}

	/**
	 * A literal may carry a unit, or act as the coefficient of the chemical that follows it.
	 */
	private Node parseLiteral() {
		Token literal = advance(1);
		double value;
		try {
			value = Double.parseDouble(literal.getText());
		} catch (NumberFormatException e) {
			throw fail("Malformed number " + literal.getText() + ".");
		}
		NumberNode number = new NumberNode(literal.getLocation(), value, NumberNode.kindOf(value));
		if (consume(TokenType.UNIT)) {
			return parseUnit(number, cur());
		}
		if (nextIs(TokenType.CHEMICAL)) {
			next();
			return new SymbolNode(literal.getLocation(), Operator.MULTIPLY, number, parseChemical());
		}
		return number;
	}

	private ChemicalNode parseChemical() {
		Token token = cur();
		String formula = ChemicalToken.MISSING;
		String registryId = ChemicalToken.MISSING;
		if (token instanceof ChemicalToken) {
			formula = ((ChemicalToken) token).getFormula();
			registryId = ((ChemicalToken) token).getRegistryId();
		}
		scopes.current().put(token.getText(), TokenType.CHEMICAL, "chemical");
		return new ChemicalNode(token.getLocation(), token.getText(), formula, registryId);
	}

	/**
	 * Splits a unit token into SI prefix and unit, and remembers the unit for parameter inference. A unit
	 * spelled out in full has no prefix; otherwise the prefix is the first character, or {@code da} when the
	 * second character is {@code a}.
	 */
	private NumberNode parseUnit(NumberNode number, Token unitToken) {
		String text = unitToken.getText();
		Prefix prefix = Prefix.NONE;
		Unit unit = Unit.fromText(text);
		if (unit == null) {
			int unitStart = text.length() > 1 && text.charAt(1) == 'a' ? 2 : 1;
			prefix = Prefix.fromText(text.substring(0, unitStart));
			unit = Unit.fromText(text.substring(unitStart));
			if (prefix == null || unit == null) {
				throw fail("Unknown unit " + text + ".");
			}
		}
		unitSeen = unit;
		return new NumberNode(number.getLocation().combine(unitToken.getLocation()),
				number.getNum(), number.getKind(), prefix, unit);
	}

	private NumberNode fold(Node expression) {
		return ExpressionEvaluator.evaluate(expression, scopes.lookup());
	}

	// cursor

	private Token cur() {
		return stream.get(cur);
	}

	private Token peek(int ahead) {
		return stream.get(cur + ahead);
	}

	private boolean nextIs(TokenType type) {
		return stream.type(cur + 1) == type;
	}

	private boolean lookingAt(TokenType... types) {
		for (int i = 0; i < types.length; i++) {
			if (stream.type(cur + 1 + i) != types[i]) {
				return false;
			}
		}
		return true;
	}

	private void next() {
		if (cur().is(TokenType.END)) {
			throw fail("Unexpected end of input.");
		}
		++cur;
	}

	private void prev() {
		if (cur <= 0) {
			throw fail("Failed to retrieve previous token.");
		}
		--cur;
	}

	/**
	 * Moves the cursor forward count tokens.
	 *
	 * @return the first token moved over
	 */
	private Token advance(int count) {
		Token first = peek(1);
		for (int i = 0; i < count; i++) {
			next();
		}
		return first;
	}

	private boolean consume(TokenType type) {
		if (nextIs(type)) {
			++cur;
			return true;
		}
		return false;
	}

	private void require(TokenType type, String problem) {
		if (!consume(type)) {
			throw fail(problem);
		}
	}

	private void semicolon() {
		require(TokenType.SYMBOL_SEMICOLON, "Missing semicolon.");
	}

	private void semicolonOrParen() {
		if (!consume(TokenType.SYMBOL_SEMICOLON) && !consume(TokenType.SYMBOL_PAREN_CLOSED)) {
			throw fail("Found neither a required semicolon nor a closing parentheses.");
		}
	}

	private void semicolonOrComma() {
		if (!consume(TokenType.SYMBOL_SEMICOLON) && !consume(TokenType.SYMBOL_COMMA)) {
			throw fail("Found neither a required semicolon nor a comma.");
		}
	}

	private ParseIssue fail(String problem) {
		return new ParseIssue(cur(), problem);
	}

	private static Node lastInChain(Node statement) {
		Node last = statement;
		while (last.getNextStatement() != null) {
			last = last.getNextStatement();
		}
		return last;
	}
}
