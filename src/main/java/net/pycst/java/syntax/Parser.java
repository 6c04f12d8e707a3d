// Copyright 2025 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.pycst.java.syntax;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import javax.annotation.Nullable;

/**
 * Parser is a recursive-descent parser for Python.
 *
 * <p>Each production reads tokens with one token of lookahead and builds its node in source
 * order. The text between tokens is claimed through the tokens' shared whitespace states at the
 * moment the owning node is built: once a state has been consumed, any later attempt to parse the
 * same gap yields empty whitespace.
 */
final class Parser {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final String FALLBACK_INDENT = "    ";

  /** Binary operators by precedence, lowest first. */
  private static final ImmutableList<EnumSet<TokenKind>> BINARY_PRECEDENCE =
      ImmutableList.of(
          EnumSet.of(TokenKind.PIPE),
          EnumSet.of(TokenKind.CARET),
          EnumSet.of(TokenKind.AMPERSAND),
          EnumSet.of(TokenKind.LESS_LESS, TokenKind.GREATER_GREATER),
          EnumSet.of(TokenKind.PLUS, TokenKind.MINUS),
          EnumSet.of(
              TokenKind.STAR,
              TokenKind.AT,
              TokenKind.SLASH,
              TokenKind.SLASH_SLASH,
              TokenKind.PERCENT));

  private static final EnumSet<TokenKind> COMPARISON_OPERATORS =
      EnumSet.of(
          TokenKind.LESS,
          TokenKind.GREATER,
          TokenKind.EQUALS_EQUALS,
          TokenKind.NOT_EQUALS,
          TokenKind.LESS_EQUALS,
          TokenKind.GREATER_EQUALS,
          TokenKind.IN);

  /** Tokens that can begin an expression, including a starred one. */
  private static final EnumSet<TokenKind> EXPRESSION_START =
      EnumSet.of(
          TokenKind.NAME,
          TokenKind.NUMBER,
          TokenKind.STRING,
          TokenKind.ELLIPSIS,
          TokenKind.LPAREN,
          TokenKind.LBRACKET,
          TokenKind.LBRACE,
          TokenKind.PLUS,
          TokenKind.MINUS,
          TokenKind.TILDE,
          TokenKind.NOT,
          TokenKind.LAMBDA,
          TokenKind.AWAIT,
          TokenKind.STAR);

  private final ParseInput input;
  private final PythonVersion version;
  private final Tokenizer tokenizer;

  // Tokens read ahead of the current one; only the parenthesized with form reads ahead.
  private final ArrayDeque<Token> lookahead = new ArrayDeque<>();

  /** The current lookahead token. */
  private Token token;

  // The relative indentation of the first indented block, once seen, unless configured.
  @Nullable private String defaultIndent;

  private Parser(ParseInput input) throws ParseException {
    this.input = input;
    this.version = input.version;
    this.tokenizer = new Tokenizer(input);
    this.defaultIndent = input.defaultIndent;
    this.token = tokenizer.nextToken();
  }

  // Main entry point for parsing a file.
  static Module parseModule(ParseInput input) throws ParseException {
    logger.atFine().log(
        "parsing module: %d chars, encoding %s, Python %s",
        input.source.length(), input.encoding, input.version);
    Parser parser = new Parser(input);
    Module module = parser.parseFileInput();
    logger.atFine().log(
        "parsed %d top-level statements, default indent '%s'",
        module.getBody().size(), module.getDefaultIndent());
    return module;
  }

  // Entry point for a single statement. Empty lines after the statement are not kept.
  static Statement parseStatement(ParseInput input) throws ParseException {
    Parser parser = new Parser(input);
    Statement statement = parser.parseStatement();
    parser.expect(TokenKind.ENDMARKER);
    return statement;
  }

  // Entry point for a single expression, which may be an unparenthesized tuple.
  static Expression parseExpression(ParseInput input) throws ParseException {
    Parser parser = new Parser(input);
    Expression expression = parser.parseTestList();
    parser.expect(TokenKind.NEWLINE);
    parser.expect(TokenKind.ENDMARKER);
    return expression;
  }

  // --- token plumbing ---

  /** Consumes the current token and returns it. ENDMARKER is never consumed past. */
  private Token next() throws ParseException {
    Token consumed = token;
    if (!lookahead.isEmpty()) {
      token = lookahead.poll();
    } else if (tokenizer.hasNext()) {
      token = tokenizer.nextToken();
    }
    return consumed;
  }

  /** Returns the token {@code n >= 1} positions after the current one, or the last one. */
  private Token peek(int n) throws ParseException {
    while (lookahead.size() < n && tokenizer.hasNext()) {
      lookahead.add(tokenizer.nextToken());
    }
    return lookahead.size() >= n
        ? Iterables.get(lookahead, n - 1)
        : Iterables.getLast(lookahead, token);
  }

  private boolean at(TokenKind kind) {
    return token.getKind() == kind;
  }

  private Token expect(TokenKind kind) throws ParseException {
    if (!at(kind)) {
      throw unexpected(kind.toString());
    }
    return next();
  }

  private UnexpectedTokenException unexpected(String... expected) {
    return unexpectedAt(token, expected);
  }

  private UnexpectedTokenException unexpectedAt(Token found, String... expected) {
    return new UnexpectedTokenException(ImmutableSet.copyOf(expected), found, sourceLine(found));
  }

  private String sourceLine(Token t) {
    return ParseException.stripNewline(input.line(t.getStart().line()));
  }

  // --- whitespace ---

  private SimpleWhitespace ws(WhitespaceState state) {
    return WhitespaceParser.parseSimpleWhitespace(input, state);
  }

  private ParenthesizableWhitespace pws(WhitespaceState state) {
    return WhitespaceParser.parseParenthesizableWhitespace(input, state);
  }

  private ImmutableList<EmptyLine> emptyLines() {
    return WhitespaceParser.parseEmptyLines(input, token.whitespaceBefore);
  }

  private TrailingWhitespace endOfLine() throws ParseException {
    Token newline = expect(TokenKind.NEWLINE);
    return WhitespaceParser.parseTrailingWhitespace(input, newline.whitespaceBefore);
  }

  private Comma parseComma() throws ParseException {
    Token comma = expect(TokenKind.COMMA);
    return new Comma(pws(comma.whitespaceBefore), pws(comma.whitespaceAfter));
  }

  // --- statements ---

  // file_input: stmt* ENDMARKER
  private Module parseFileInput() throws ParseException {
    List<Statement> body = new ArrayList<>();
    while (!at(TokenKind.ENDMARKER)) {
      body.add(parseStatement());
    }
    Token end = next();
    ImmutableList<EmptyLine> footer =
        WhitespaceParser.parseEmptyLines(input, end.whitespaceBefore);
    ImmutableList<EmptyLine> header;
    if (body.isEmpty()) {
      header = footer;
      footer = ImmutableList.of();
    } else {
      Statement first = body.get(0);
      header = first.getLeadingLines();
      body.set(0, (Statement) first.withChanges("leadingLines", ImmutableList.of()));
    }
    return new Module(
        header,
        body,
        footer,
        input.encoding,
        defaultIndent != null ? defaultIndent : FALLBACK_INDENT,
        input.defaultNewline,
        input.hasTrailingNewline);
  }

  // stmt: simple_stmt | compound_stmt
  private Statement parseStatement() throws ParseException {
    if (at(TokenKind.INDENT)) {
      throw new IndentationException(
          "unexpected indent", token.getStart(), sourceLine(token));
    }
    ImmutableList<EmptyLine> leadingLines = emptyLines();
    switch (token.getKind()) {
      case IF:
        return parseIfStatement(leadingLines);
      case WHILE:
        return parseWhileStatement(leadingLines);
      case FOR:
        return parseForStatement(leadingLines, null);
      case TRY:
        return parseTryStatement(leadingLines);
      case WITH:
        return parseWithStatement(leadingLines, null);
      case DEF:
        return parseFunctionDef(leadingLines, ImmutableList.of(), ImmutableList.of(), null);
      case CLASS:
        return parseClassDef(leadingLines, ImmutableList.of(), ImmutableList.of());
      case AT:
        return parseDecorated(leadingLines);
      case ASYNC:
        {
          Asynchronous asynchronous = parseAsynchronous();
          switch (token.getKind()) {
            case DEF:
              return parseFunctionDef(
                  leadingLines, ImmutableList.of(), ImmutableList.of(), asynchronous);
            case FOR:
              return parseForStatement(leadingLines, asynchronous);
            case WITH:
              return parseWithStatement(leadingLines, asynchronous);
            default:
              throw unexpected("def", "for", "with");
          }
        }
      default:
        return parseSimpleStatementLine(leadingLines);
    }
  }

  private Asynchronous parseAsynchronous() throws ParseException {
    Token async = expect(TokenKind.ASYNC);
    return new Asynchronous(pws(async.whitespaceAfter));
  }

  // simple_stmt: small_stmt (';' small_stmt)* [';'] NEWLINE
  private SimpleStatementLine parseSimpleStatementLine(ImmutableList<EmptyLine> leadingLines)
      throws ParseException {
    ImmutableList<SmallStatement> body = parseSmallStatements();
    return new SimpleStatementLine(leadingLines, body, endOfLine());
  }

  // Parses small statements up to, but not including, the NEWLINE.
  private ImmutableList<SmallStatement> parseSmallStatements() throws ParseException {
    ImmutableList.Builder<SmallStatement> body = ImmutableList.builder();
    while (true) {
      SmallStatement statement = parseSmallStatement();
      if (!at(TokenKind.SEMI)) {
        if (!at(TokenKind.NEWLINE)) {
          throw unexpected(TokenKind.NEWLINE.toString(), TokenKind.SEMI.toString());
        }
        body.add(statement);
        return body.build();
      }
      Token semi = next();
      Semicolon semicolon =
          new Semicolon(ws(semi.whitespaceBefore), ws(semi.whitespaceAfter));
      body.add((SmallStatement) statement.withChanges("semicolon", semicolon));
      if (at(TokenKind.NEWLINE)) {
        return body.build();
      }
    }
  }

  // small_stmt: expr_stmt | del_stmt | pass_stmt | flow_stmt | import_stmt | global_stmt
  //           | nonlocal_stmt | assert_stmt
  private SmallStatement parseSmallStatement() throws ParseException {
    switch (token.getKind()) {
      case PASS:
      case BREAK:
      case CONTINUE:
        return new FlowStatement(next().getKind());
      case RETURN:
        return parseReturnStatement();
      case RAISE:
        return parseRaiseStatement();
      case ASSERT:
        return parseAssertStatement();
      case DEL:
        {
          Token del = next();
          SimpleWhitespace whitespace = ws(del.whitespaceAfter);
          Token start = token;
          Expression target = parseExprList(false);
          checkTarget(target, start);
          return new DelStatement(whitespace, target);
        }
      case GLOBAL:
      case NONLOCAL:
        return parseGlobalStatement();
      case IMPORT:
        return parseImportStatement();
      case FROM:
        return parseImportFromStatement();
      default:
        return parseExpressionStatement();
    }
  }

  private boolean atEndOfSmallStatement() {
    return at(TokenKind.NEWLINE) || at(TokenKind.SEMI);
  }

  // return_stmt: 'return' [testlist_star_expr]
  private ReturnStatement parseReturnStatement() throws ParseException {
    Token keyword = next();
    if (atEndOfSmallStatement()) {
      return new ReturnStatement(null, null);
    }
    SimpleWhitespace whitespace = ws(keyword.whitespaceAfter);
    Expression value = parseTestListStarExpr(version.atLeast(PythonVersion.PY_3_8));
    return new ReturnStatement(whitespace, value);
  }

  // raise_stmt: 'raise' [test ['from' test]]
  private RaiseStatement parseRaiseStatement() throws ParseException {
    Token keyword = next();
    if (atEndOfSmallStatement()) {
      return new RaiseStatement(null, null, null);
    }
    SimpleWhitespace whitespace = ws(keyword.whitespaceAfter);
    Expression exc = parseTest();
    FromClause cause = null;
    if (at(TokenKind.FROM)) {
      Token from = next();
      ParenthesizableWhitespace before = pws(from.whitespaceBefore);
      ParenthesizableWhitespace after = pws(from.whitespaceAfter);
      cause = new FromClause(before, after, parseTest());
    }
    return new RaiseStatement(whitespace, exc, cause);
  }

  // assert_stmt: 'assert' test [',' test]
  private AssertStatement parseAssertStatement() throws ParseException {
    Token keyword = next();
    SimpleWhitespace whitespace = ws(keyword.whitespaceAfter);
    Expression test = parseTest();
    Comma comma = null;
    Expression msg = null;
    if (at(TokenKind.COMMA)) {
      comma = parseComma();
      msg = parseTest();
    }
    return new AssertStatement(whitespace, test, comma, msg);
  }

  // global_stmt: ('global' | 'nonlocal') NAME (',' NAME)*
  private GlobalStatement parseGlobalStatement() throws ParseException {
    Token keyword = next();
    SimpleWhitespace whitespace = ws(keyword.whitespaceAfter);
    List<NameItem> names = new ArrayList<>();
    while (true) {
      Name name = parseName();
      if (!at(TokenKind.COMMA)) {
        names.add(new NameItem(name, null));
        break;
      }
      names.add(new NameItem(name, parseComma()));
    }
    return new GlobalStatement(keyword.getKind(), whitespace, names);
  }

  // import_name: 'import' dotted_as_name (',' dotted_as_name)*
  private ImportStatement parseImportStatement() throws ParseException {
    Token keyword = next();
    SimpleWhitespace whitespace = ws(keyword.whitespaceAfter);
    List<ImportAlias> names = new ArrayList<>();
    while (true) {
      Expression name = parseDottedName();
      AsName asname = at(TokenKind.AS) ? parseAsName() : null;
      if (!at(TokenKind.COMMA)) {
        names.add(new ImportAlias(name, asname, null));
        break;
      }
      names.add(new ImportAlias(name, asname, parseComma()));
    }
    return new ImportStatement(whitespace, names);
  }

  // import_from: 'from' ('.'* dotted_name | '.'+)
  //              'import' ('*' | '(' import_as_names ')' | import_as_names)
  private ImportFromStatement parseImportFromStatement() throws ParseException {
    Token from = next();
    SimpleWhitespace whitespaceAfterFrom = ws(from.whitespaceAfter);

    // Each dot owns the whitespace before it; the last one also owns the whitespace before the
    // module name, if there is one.
    List<Dot> relative = new ArrayList<>();
    Token lastDot = null;
    while (at(TokenKind.DOT) || at(TokenKind.ELLIPSIS)) {
      lastDot = next();
      int count = lastDot.getKind() == TokenKind.ELLIPSIS ? 3 : 1;
      for (int i = 0; i < count; i++) {
        ParenthesizableWhitespace before =
            i == 0 ? pws(lastDot.whitespaceBefore) : SimpleWhitespace.of("");
        relative.add(new Dot(before, SimpleWhitespace.of("")));
      }
    }
    Expression module = null;
    if (at(TokenKind.NAME)) {
      if (lastDot != null) {
        Dot last = relative.remove(relative.size() - 1);
        relative.add(new Dot(last.getWhitespaceBefore(), pws(lastDot.whitespaceAfter)));
      }
      module = parseDottedName();
    } else if (relative.isEmpty()) {
      throw unexpected("module name");
    }

    Token importToken = expect(TokenKind.IMPORT);
    SimpleWhitespace whitespaceBeforeImport = ws(importToken.whitespaceBefore);
    SimpleWhitespace whitespaceAfterImport = ws(importToken.whitespaceAfter);

    LeftParen lpar = null;
    RightParen rpar = null;
    ImportStar star = null;
    List<ImportAlias> names = new ArrayList<>();
    if (at(TokenKind.STAR)) {
      next();
      star = new ImportStar();
    } else {
      boolean parenthesized = at(TokenKind.LPAREN);
      if (parenthesized) {
        lpar = new LeftParen(pws(next().whitespaceAfter));
      }
      while (true) {
        Name name = parseName();
        AsName asname = at(TokenKind.AS) ? parseAsName() : null;
        if (!at(TokenKind.COMMA)) {
          names.add(new ImportAlias(name, asname, null));
          break;
        }
        names.add(new ImportAlias(name, asname, parseComma()));
        if (parenthesized && at(TokenKind.RPAREN)) {
          break;
        }
      }
      if (parenthesized) {
        rpar = new RightParen(pws(expect(TokenKind.RPAREN).whitespaceBefore));
      }
    }
    return new ImportFromStatement(
        whitespaceAfterFrom,
        relative,
        module,
        whitespaceBeforeImport,
        whitespaceAfterImport,
        lpar,
        names,
        star,
        rpar);
  }

  // dotted_name: NAME ('.' NAME)*
  private Expression parseDottedName() throws ParseException {
    Expression name = parseName();
    while (at(TokenKind.DOT)) {
      Token dot = next();
      Dot d = new Dot(pws(dot.whitespaceBefore), pws(dot.whitespaceAfter));
      name = new Attribute(name, d, parseName());
    }
    return name;
  }

  private AsName parseAsName() throws ParseException {
    Token as = expect(TokenKind.AS);
    ParenthesizableWhitespace before = pws(as.whitespaceBefore);
    ParenthesizableWhitespace after = pws(as.whitespaceAfter);
    return new AsName(before, after, parseName());
  }

  private Name parseName() throws ParseException {
    return new Name(expect(TokenKind.NAME).getText());
  }

  // expr_stmt: testlist_star_expr (annassign | augassign (yield_expr|testlist)
  //                                | ('=' (yield_expr|testlist_star_expr))*)
  // annassign: ':' test ['=' (yield_expr|testlist_star_expr)]
  private SmallStatement parseExpressionStatement() throws ParseException {
    Token start = token;
    Expression first = parseAssignedValue();
    switch (token.getKind()) {
      case COLON:
        {
          if (!isSingleTarget(first)) {
            throw unexpected(TokenKind.NEWLINE.toString(), TokenKind.EQUALS.toString());
          }
          Token colon = next();
          ParenthesizableWhitespace before = pws(colon.whitespaceBefore);
          ParenthesizableWhitespace after = pws(colon.whitespaceAfter);
          Annotation annotation = new Annotation(before, after, parseTest());
          if (!at(TokenKind.EQUALS)) {
            return new AnnotatedAssignStatement(first, annotation, null, null);
          }
          Token eq = next();
          AssignEqual equal = new AssignEqual(pws(eq.whitespaceBefore), pws(eq.whitespaceAfter));
          return new AnnotatedAssignStatement(first, annotation, equal, parseAssignedValue());
        }
      case EQUALS:
        {
          List<AssignTarget> targets = new ArrayList<>();
          Expression value = first;
          Token valueStart = start;
          while (at(TokenKind.EQUALS)) {
            checkTarget(value, valueStart);
            Token eq = next();
            targets.add(
                new AssignTarget(value, ws(eq.whitespaceBefore), ws(eq.whitespaceAfter)));
            valueStart = token;
            value = parseAssignedValue();
          }
          return new AssignStatement(targets, value);
        }
      default:
        if (AugmentedOperator.OPERATORS.contains(token.getKind())) {
          if (!isSingleTarget(first)) {
            throw unexpected(TokenKind.NEWLINE.toString(), TokenKind.EQUALS.toString());
          }
          Token op = next();
          AugmentedOperator operator =
              new AugmentedOperator(
                  pws(op.whitespaceBefore), op.getKind(), pws(op.whitespaceAfter));
          return new AugmentedAssignStatement(first, operator, parseAssignedValue());
        }
        return new ExpressionStatement(first);
    }
  }

  // yield_expr | testlist_star_expr
  private Expression parseAssignedValue() throws ParseException {
    return at(TokenKind.YIELD) ? parseYield() : parseTestListStarExpr(true);
  }

  private static boolean isSingleTarget(Expression e) {
    return e instanceof Name || e instanceof Attribute || e instanceof Subscript;
  }

  private static boolean isValidTarget(Expression e) {
    ImmutableList<SequenceElement> elements;
    if (e instanceof TupleExpression) {
      elements = ((TupleExpression) e).getElements();
    } else if (e instanceof ListExpression) {
      elements = ((ListExpression) e).getElements();
    } else {
      return isSingleTarget(e);
    }
    for (SequenceElement element : elements) {
      if (!isValidTarget(element.getValue())) {
        return false;
      }
    }
    return true;
  }

  // Rejects an expression that cannot be assigned to, reporting its first token.
  private void checkTarget(Expression target, Token start) throws ParseException {
    if (!isValidTarget(target)) {
      throw unexpectedAt(start, "assignment target");
    }
  }

  // if_stmt: 'if' namedexpr_test ':' suite ('elif' namedexpr_test ':' suite)*
  //          ['else' ':' suite]
  private IfStatement parseIfStatement(ImmutableList<EmptyLine> leadingLines)
      throws ParseException {
    Token keyword = next(); // 'if' or 'elif'
    SimpleWhitespace whitespaceBeforeTest = ws(keyword.whitespaceAfter);
    Expression test = parseNamedExprTest();
    Token colon = expect(TokenKind.COLON);
    SimpleWhitespace whitespaceAfterTest = ws(colon.whitespaceBefore);
    Suite body = parseSuite();
    Node orelse = null;
    if (at(TokenKind.ELIF)) {
      orelse = parseIfStatement(emptyLines());
    } else if (at(TokenKind.ELSE)) {
      orelse = parseElseClause();
    }
    return new IfStatement(
        leadingLines, whitespaceBeforeTest, test, whitespaceAfterTest, body, orelse);
  }

  private ElseClause parseElseClause() throws ParseException {
    ImmutableList<EmptyLine> leadingLines = emptyLines();
    expect(TokenKind.ELSE);
    Token colon = expect(TokenKind.COLON);
    SimpleWhitespace whitespaceBeforeColon = ws(colon.whitespaceBefore);
    return new ElseClause(leadingLines, whitespaceBeforeColon, parseSuite());
  }

  // while_stmt: 'while' namedexpr_test ':' suite ['else' ':' suite]
  private WhileStatement parseWhileStatement(ImmutableList<EmptyLine> leadingLines)
      throws ParseException {
    Token keyword = next();
    SimpleWhitespace whitespaceAfterWhile = ws(keyword.whitespaceAfter);
    Expression test = parseNamedExprTest();
    Token colon = expect(TokenKind.COLON);
    SimpleWhitespace whitespaceBeforeColon = ws(colon.whitespaceBefore);
    Suite body = parseSuite();
    ElseClause orelse = at(TokenKind.ELSE) ? parseElseClause() : null;
    return new WhileStatement(
        leadingLines, whitespaceAfterWhile, test, whitespaceBeforeColon, body, orelse);
  }

  // for_stmt: ['async'] 'for' exprlist 'in' testlist_star_expr ':' suite ['else' ':' suite]
  // Starred iterables need 3.9.
  private ForStatement parseForStatement(
      ImmutableList<EmptyLine> leadingLines, @Nullable Asynchronous asynchronous)
      throws ParseException {
    Token keyword = expect(TokenKind.FOR);
    SimpleWhitespace whitespaceAfterFor = ws(keyword.whitespaceAfter);
    Token targetStart = token;
    Expression target = parseExprList(true);
    checkTarget(target, targetStart);
    Token in = expect(TokenKind.IN);
    SimpleWhitespace whitespaceBeforeIn = ws(in.whitespaceBefore);
    SimpleWhitespace whitespaceAfterIn = ws(in.whitespaceAfter);
    Expression iter = parseTestListStarExpr(version.atLeast(PythonVersion.PY_3_9));
    Token colon = expect(TokenKind.COLON);
    SimpleWhitespace whitespaceBeforeColon = ws(colon.whitespaceBefore);
    Suite body = parseSuite();
    ElseClause orelse = at(TokenKind.ELSE) ? parseElseClause() : null;
    return new ForStatement(
        leadingLines,
        asynchronous,
        whitespaceAfterFor,
        target,
        whitespaceBeforeIn,
        whitespaceAfterIn,
        iter,
        whitespaceBeforeColon,
        body,
        orelse);
  }

  // try_stmt: 'try' ':' suite
  //           ((except_clause ':' suite)+ ['else' ':' suite] ['finally' ':' suite]
  //            | 'finally' ':' suite)
  private TryStatement parseTryStatement(ImmutableList<EmptyLine> leadingLines)
      throws ParseException {
    next();
    Token colon = expect(TokenKind.COLON);
    SimpleWhitespace whitespaceBeforeColon = ws(colon.whitespaceBefore);
    Suite body = parseSuite();

    List<ExceptHandler> handlers = new ArrayList<>();
    while (at(TokenKind.EXCEPT)) {
      if (!handlers.isEmpty() && handlers.get(handlers.size() - 1).getType() == null) {
        // A bare except must come last.
        throw unexpected(TokenKind.ELSE.toString(), TokenKind.FINALLY.toString());
      }
      Token start = token;
      ExceptHandler handler = parseExceptHandler();
      if (!handlers.isEmpty() && handler.isStar() != handlers.get(0).isStar()) {
        throw unexpectedAt(start, handlers.get(0).isStar() ? "except*" : "except");
      }
      handlers.add(handler);
    }
    ElseClause orelse = null;
    if (!handlers.isEmpty() && at(TokenKind.ELSE)) {
      orelse = parseElseClause();
    }
    FinallyClause finalBody = null;
    if (at(TokenKind.FINALLY)) {
      ImmutableList<EmptyLine> finallyLines = emptyLines();
      next();
      Token finallyColon = expect(TokenKind.COLON);
      SimpleWhitespace beforeColon = ws(finallyColon.whitespaceBefore);
      finalBody = new FinallyClause(finallyLines, beforeColon, parseSuite());
    }
    if (handlers.isEmpty() && finalBody == null) {
      throw unexpected(TokenKind.EXCEPT.toString(), TokenKind.FINALLY.toString());
    }
    return new TryStatement(
        leadingLines, whitespaceBeforeColon, body, handlers, orelse, finalBody);
  }

  // except_clause: 'except' ['*'] [test ['as' NAME]]
  private ExceptHandler parseExceptHandler() throws ParseException {
    ImmutableList<EmptyLine> leadingLines = emptyLines();
    Token keyword = expect(TokenKind.EXCEPT);
    SimpleWhitespace whitespaceAfterExcept = ws(keyword.whitespaceAfter);
    boolean star = false;
    SimpleWhitespace whitespaceAfterStar = SimpleWhitespace.of("");
    if (at(TokenKind.STAR) && version.atLeast(PythonVersion.PY_3_11)) {
      star = true;
      whitespaceAfterStar = ws(next().whitespaceAfter);
    }
    Expression type = null;
    AsName name = null;
    if (star || !at(TokenKind.COLON)) {
      type = parseTest();
      if (at(TokenKind.AS)) {
        name = parseAsName();
      }
    }
    Token colon = expect(TokenKind.COLON);
    SimpleWhitespace whitespaceBeforeColon = ws(colon.whitespaceBefore);
    return new ExceptHandler(
        leadingLines,
        whitespaceAfterExcept,
        star,
        whitespaceAfterStar,
        type,
        name,
        whitespaceBeforeColon,
        parseSuite());
  }

  // with_stmt: ['async'] 'with' ('(' with_items [','] ')' | with_items) ':' suite
  // with_items: with_item (',' with_item)*
  private WithStatement parseWithStatement(
      ImmutableList<EmptyLine> leadingLines, @Nullable Asynchronous asynchronous)
      throws ParseException {
    Token keyword = expect(TokenKind.WITH);
    SimpleWhitespace whitespaceAfterWith = ws(keyword.whitespaceAfter);
    LeftParen lpar = null;
    RightParen rpar = null;
    List<WithItem> items;
    if (at(TokenKind.LPAREN)
        && version.atLeast(PythonVersion.PY_3_9)
        && isParenthesizedWithItems()) {
      lpar = new LeftParen(pws(next().whitespaceAfter));
      items = parseWithItems(true);
      rpar = new RightParen(pws(expect(TokenKind.RPAREN).whitespaceBefore));
    } else {
      items = parseWithItems(false);
    }
    Token colon = expect(TokenKind.COLON);
    SimpleWhitespace whitespaceBeforeColon = ws(colon.whitespaceBefore);
    return new WithStatement(
        leadingLines,
        asynchronous,
        whitespaceAfterWith,
        lpar,
        items,
        rpar,
        whitespaceBeforeColon,
        parseSuite());
  }

  /**
   * Reports whether the parenthesis at the current token encloses the whole item list of a with
   * statement, that is, whether its matching ')' is directly followed by ':'.
   */
  private boolean isParenthesizedWithItems() throws ParseException {
    // "(yield)" and "()" are ordinary parenthesized expressions.
    TokenKind first = peek(1).getKind();
    if (first == TokenKind.YIELD || first == TokenKind.RPAREN) {
      return false;
    }
    int depth = 1;
    for (int i = 1; ; i++) {
      Token t = peek(i);
      switch (t.getKind()) {
        case LPAREN:
        case LBRACKET:
        case LBRACE:
          depth++;
          break;
        case RPAREN:
        case RBRACKET:
        case RBRACE:
          if (--depth == 0) {
            return peek(i + 1).getKind() == TokenKind.COLON;
          }
          break;
        case NEWLINE:
        case ENDMARKER:
          return false;
        default:
          break;
      }
    }
  }

  // with_item: test ['as' expr]
  private List<WithItem> parseWithItems(boolean parenthesized) throws ParseException {
    List<WithItem> items = new ArrayList<>();
    while (true) {
      Expression item = parseTest();
      AsName asname = null;
      if (at(TokenKind.AS)) {
        Token as = next();
        ParenthesizableWhitespace before = pws(as.whitespaceBefore);
        ParenthesizableWhitespace after = pws(as.whitespaceAfter);
        Token targetStart = token;
        Expression target = parseExpr();
        checkTarget(target, targetStart);
        asname = new AsName(before, after, target);
      }
      if (!at(TokenKind.COMMA)) {
        items.add(new WithItem(item, asname, null));
        return items;
      }
      items.add(new WithItem(item, asname, parseComma()));
      if (parenthesized && at(TokenKind.RPAREN)) {
        return items;
      }
    }
  }

  // decorated: decorator+ (classdef | funcdef | async_funcdef)
  private Statement parseDecorated(ImmutableList<EmptyLine> leadingLines)
      throws ParseException {
    List<Decorator> decorators = new ArrayList<>();
    decorators.add(parseDecorator(ImmutableList.of()));
    // Blank lines produce no tokens, so a following decorator is always the current token.
    while (at(TokenKind.AT)) {
      decorators.add(parseDecorator(emptyLines()));
    }
    ImmutableList<EmptyLine> linesAfterDecorators = emptyLines();
    switch (token.getKind()) {
      case CLASS:
        return parseClassDef(leadingLines, decorators, linesAfterDecorators);
      case DEF:
        return parseFunctionDef(leadingLines, decorators, linesAfterDecorators, null);
      case ASYNC:
        {
          Asynchronous asynchronous = parseAsynchronous();
          if (!at(TokenKind.DEF)) {
            throw unexpected(TokenKind.DEF.toString());
          }
          return parseFunctionDef(leadingLines, decorators, linesAfterDecorators, asynchronous);
        }
      default:
        throw unexpected(TokenKind.DEF.toString(), TokenKind.CLASS.toString());
    }
  }

  // decorator: '@' namedexpr_test NEWLINE  (before 3.9: '@' dotted_name ['(' [arglist] ')'])
  private Decorator parseDecorator(ImmutableList<EmptyLine> leadingLines)
      throws ParseException {
    Token at = expect(TokenKind.AT);
    SimpleWhitespace whitespaceAfterAt = ws(at.whitespaceAfter);
    Expression decorator;
    if (version.atLeast(PythonVersion.PY_3_9)) {
      decorator = parseNamedExprTest();
    } else {
      decorator = parseDottedName();
      if (at(TokenKind.LPAREN)) {
        decorator = parseCall(decorator);
      }
    }
    return new Decorator(leadingLines, whitespaceAfterAt, decorator, endOfLine());
  }

  // funcdef: 'def' NAME parameters ['->' test] ':' suite
  private FunctionDef parseFunctionDef(
      ImmutableList<EmptyLine> leadingLines,
      List<Decorator> decorators,
      ImmutableList<EmptyLine> linesAfterDecorators,
      @Nullable Asynchronous asynchronous)
      throws ParseException {
    Token keyword = expect(TokenKind.DEF);
    SimpleWhitespace whitespaceAfterDef = ws(keyword.whitespaceAfter);
    Name name = parseName();
    Token lparen = expect(TokenKind.LPAREN);
    SimpleWhitespace whitespaceAfterName = ws(lparen.whitespaceBefore);
    ParenthesizableWhitespace whitespaceBeforeParams = pws(lparen.whitespaceAfter);
    Parameters params = parseParameters(TokenKind.RPAREN, true);
    expect(TokenKind.RPAREN);
    Annotation returns = null;
    if (at(TokenKind.RARROW)) {
      Token arrow = next();
      ParenthesizableWhitespace before = pws(arrow.whitespaceBefore);
      ParenthesizableWhitespace after = pws(arrow.whitespaceAfter);
      returns = new Annotation(before, after, parseTest());
    }
    Token colon = expect(TokenKind.COLON);
    SimpleWhitespace whitespaceBeforeColon = ws(colon.whitespaceBefore);
    return new FunctionDef(
        leadingLines,
        decorators,
        linesAfterDecorators,
        asynchronous,
        whitespaceAfterDef,
        name,
        whitespaceAfterName,
        whitespaceBeforeParams,
        params,
        returns,
        whitespaceBeforeColon,
        parseSuite());
  }

  // classdef: 'class' NAME ['(' [arglist] ')'] ':' suite
  private ClassDef parseClassDef(
      ImmutableList<EmptyLine> leadingLines,
      List<Decorator> decorators,
      ImmutableList<EmptyLine> linesAfterDecorators)
      throws ParseException {
    Token keyword = expect(TokenKind.CLASS);
    SimpleWhitespace whitespaceAfterClass = ws(keyword.whitespaceAfter);
    Name name = parseName();
    SimpleWhitespace whitespaceAfterName = ws(token.whitespaceBefore);
    LeftParen lpar = null;
    RightParen rpar = null;
    List<Argument> arguments = ImmutableList.of();
    if (at(TokenKind.LPAREN)) {
      lpar = new LeftParen(pws(next().whitespaceAfter));
      arguments = parseArguments();
      rpar = new RightParen(pws(expect(TokenKind.RPAREN).whitespaceBefore));
    }
    Token colon = expect(TokenKind.COLON);
    SimpleWhitespace whitespaceBeforeColon = ws(colon.whitespaceBefore);
    return new ClassDef(
        leadingLines,
        decorators,
        linesAfterDecorators,
        whitespaceAfterClass,
        name,
        whitespaceAfterName,
        lpar,
        arguments,
        rpar,
        whitespaceBeforeColon,
        parseSuite());
  }

  // suite: simple_stmt | NEWLINE INDENT stmt+ DEDENT
  private Suite parseSuite() throws ParseException {
    if (!at(TokenKind.NEWLINE)) {
      SimpleWhitespace leadingWhitespace = ws(token.whitespaceBefore);
      ImmutableList<SmallStatement> body = parseSmallStatements();
      return new SimpleStatementSuite(leadingWhitespace, body, endOfLine());
    }
    TrailingWhitespace header = endOfLine();
    if (!at(TokenKind.INDENT)) {
      throw unexpected("indented block");
    }
    Token indentToken = next();
    String relative = indentToken.getRelativeIndent();
    if (defaultIndent == null) {
      defaultIndent = relative;
    }
    // The INDENT shares its state with the start of the block's first line.
    String absoluteIndent = indentToken.whitespaceBefore.absoluteIndent;
    List<Statement> body = new ArrayList<>();
    while (!at(TokenKind.DEDENT)) {
      body.add(parseStatement());
    }
    Token dedent = next();
    ImmutableList<EmptyLine> footer =
        WhitespaceParser.parseEmptyLines(input, dedent.whitespaceBefore, absoluteIndent);
    return new IndentedBlock(
        header, relative.equals(defaultIndent) ? null : relative, body, footer);
  }

  // --- parameters and arguments ---

  // typedargslist / varargslist: the parameters of a def (up to ')') or a lambda (up to ':').
  private Parameters parseParameters(TokenKind closer, boolean annotations)
      throws ParseException {
    List<Parameter> posonlyParams = ImmutableList.of();
    ParamSlash posonlyInd = null;
    List<Parameter> params = new ArrayList<>();
    Node starArg = null;
    List<Parameter> kwonlyParams = new ArrayList<>();
    Parameter starKwarg = null;

    while (!at(closer)) {
      if (at(TokenKind.SLASH)) {
        if (!version.atLeast(PythonVersion.PY_3_8)
            || posonlyInd != null
            || starArg != null
            || params.isEmpty()) {
          throw unexpected("parameter");
        }
        Token slash = next();
        ParenthesizableWhitespace whitespaceAfter = pws(slash.whitespaceAfter);
        Comma comma = at(TokenKind.COMMA) ? parseComma() : null;
        posonlyInd = new ParamSlash(whitespaceAfter, comma);
        posonlyParams = params;
        params = new ArrayList<>();
        if (comma == null) {
          break;
        }
      } else if (at(TokenKind.STAR_STAR)) {
        starKwarg = parseParameter("**", annotations);
        break;
      } else if (at(TokenKind.STAR)) {
        if (starArg != null) {
          throw unexpected("parameter");
        }
        if (peek(1).getKind() == TokenKind.COMMA) {
          next();
          starArg = new ParamStar(parseComma());
        } else {
          Parameter star = parseParameter("*", annotations);
          starArg = star;
          if (star.getComma() == null) {
            break;
          }
        }
      } else {
        Parameter param = parseParameter("", annotations);
        (starArg != null ? kwonlyParams : params).add(param);
        if (param.getComma() == null) {
          break;
        }
      }
    }
    if (starArg instanceof ParamStar && kwonlyParams.isEmpty()) {
      throw unexpected("keyword-only parameter");
    }
    return new Parameters(posonlyParams, posonlyInd, params, starArg, kwonlyParams, starKwarg);
  }

  // param: ['*' | '**'] NAME [':' test] ['=' test] [',']
  private Parameter parseParameter(String star, boolean annotations) throws ParseException {
    ParenthesizableWhitespace whitespaceAfterStar = SimpleWhitespace.of("");
    if (!star.isEmpty()) {
      whitespaceAfterStar = pws(next().whitespaceAfter);
    }
    Name name = parseName();
    Annotation annotation = null;
    if (annotations && at(TokenKind.COLON)) {
      Token colon = next();
      ParenthesizableWhitespace before = pws(colon.whitespaceBefore);
      ParenthesizableWhitespace after = pws(colon.whitespaceAfter);
      annotation = new Annotation(before, after, parseTest());
    }
    AssignEqual equal = null;
    Expression defaultValue = null;
    if (star.isEmpty() && at(TokenKind.EQUALS)) {
      Token eq = next();
      equal = new AssignEqual(pws(eq.whitespaceBefore), pws(eq.whitespaceAfter));
      defaultValue = parseTest();
    }
    Comma comma = at(TokenKind.COMMA) ? parseComma() : null;
    // Empty after a comma; before the closer for the last parameter.
    ParenthesizableWhitespace whitespaceAfterParam = pws(token.whitespaceBefore);
    return new Parameter(
        star,
        whitespaceAfterStar,
        name,
        annotation,
        equal,
        defaultValue,
        comma,
        whitespaceAfterParam);
  }

  // arglist: argument (',' argument)* [',']
  // argument: test [comp_for] | test ':=' test | test '=' test | '**' test | '*' test
  private ImmutableList<Argument> parseArguments() throws ParseException {
    ImmutableList.Builder<Argument> args = ImmutableList.builder();
    boolean keywordSeen = false;
    while (!at(TokenKind.RPAREN)) {
      Token start = token;
      String star = "";
      ParenthesizableWhitespace whitespaceAfterStar = SimpleWhitespace.of("");
      Name keyword = null;
      AssignEqual equal = null;
      Expression value;
      if (at(TokenKind.STAR) || at(TokenKind.STAR_STAR)) {
        Token starToken = next();
        star = starToken.getText();
        whitespaceAfterStar = pws(starToken.whitespaceAfter);
        value = parseTest();
      } else {
        value = parseNamedExprTest();
        if (at(TokenKind.EQUALS) && value instanceof Name && !value.isParenthesized()) {
          Token eq = next();
          keyword = (Name) value;
          equal = new AssignEqual(pws(eq.whitespaceBefore), pws(eq.whitespaceAfter));
          value = parseTest();
        } else if (atCompFor()) {
          value = new GeneratorExpression(value, parseCompFor());
        }
      }
      if (keyword != null || star.equals("**")) {
        keywordSeen = true;
      } else if (star.isEmpty() && keywordSeen) {
        throw unexpectedAt(start, "keyword argument");
      }
      Comma comma = at(TokenKind.COMMA) ? parseComma() : null;
      ParenthesizableWhitespace whitespaceAfterArg = pws(token.whitespaceBefore);
      args.add(
          new Argument(
              star, whitespaceAfterStar, keyword, equal, value, comma, whitespaceAfterArg));
      if (comma == null) {
        break;
      }
    }
    return args.build();
  }

  // --- expressions ---

  private boolean atExpressionStart() {
    return EXPRESSION_START.contains(token.getKind());
  }

  /** Parses one element of a sequence; the caller attaches the comma. */
  private interface ElementParser {
    SequenceElement parse() throws ParseException;
  }

  private SequenceElement parseStarred() throws ParseException {
    Token star = expect(TokenKind.STAR);
    return new StarredElement(pws(star.whitespaceAfter), parseExpr(), null);
  }

  // test | star_expr
  private SequenceElement parseTestOrStar() throws ParseException {
    return at(TokenKind.STAR) ? parseStarred() : Element.of(parseTest());
  }

  // namedexpr_test | star_expr
  private SequenceElement parseNamedOrStar() throws ParseException {
    return at(TokenKind.STAR) ? parseStarred() : Element.of(parseNamedExprTest());
  }

  private SequenceElement parseTestElement() throws ParseException {
    return Element.of(parseTest());
  }

  // expr | star_expr
  private SequenceElement parseExprOrStar() throws ParseException {
    return at(TokenKind.STAR) ? parseStarred() : Element.of(parseExpr());
  }

  private static SequenceElement withComma(SequenceElement element, Comma comma) {
    if (element instanceof StarredElement) {
      StarredElement starred = (StarredElement) element;
      return new StarredElement(starred.getWhitespaceBeforeValue(), starred.getValue(), comma);
    }
    return new Element(element.getValue(), comma);
  }

  /**
   * Parses the rest of a comma-separated sequence whose first element has already been parsed.
   * A comma not followed by the start of an expression is a trailing comma.
   */
  private List<SequenceElement> parseSequenceTail(SequenceElement first, ElementParser parser)
      throws ParseException {
    List<SequenceElement> elements = new ArrayList<>();
    SequenceElement current = first;
    while (at(TokenKind.COMMA)) {
      elements.add(withComma(current, parseComma()));
      if (!atExpressionStart()) {
        return elements;
      }
      current = parser.parse();
    }
    elements.add(current);
    return elements;
  }

  /** Parses an unbracketed sequence, which is a tuple if it contains a comma. */
  private Expression parseUnbracketed(ElementParser parser) throws ParseException {
    SequenceElement first = parser.parse();
    if (!at(TokenKind.COMMA)) {
      if (first instanceof StarredElement) {
        // A starred expression must be part of a tuple.
        throw unexpected(TokenKind.COMMA.toString());
      }
      return first.getValue();
    }
    return new TupleExpression(parseSequenceTail(first, parser));
  }

  // testlist_star_expr: (test|star_expr) (',' (test|star_expr))* [',']
  private Expression parseTestListStarExpr(boolean allowStar) throws ParseException {
    return parseUnbracketed(allowStar ? this::parseTestOrStar : this::parseTestElement);
  }

  // testlist: test (',' test)* [',']
  private Expression parseTestList() throws ParseException {
    return parseUnbracketed(this::parseTestElement);
  }

  // exprlist: (expr|star_expr) (',' (expr|star_expr))* [',']
  private Expression parseExprList(boolean allowStar) throws ParseException {
    return parseUnbracketed(
        allowStar ? this::parseExprOrStar : () -> Element.of(parseExpr()));
  }

  // namedexpr_test: test [':=' test]
  private Expression parseNamedExprTest() throws ParseException {
    Expression target = parseTest();
    if (!at(TokenKind.COLON_EQUALS) || !version.atLeast(PythonVersion.PY_3_8)) {
      return target;
    }
    if (!(target instanceof Name) || target.isParenthesized()) {
      throw unexpected(TokenKind.NEWLINE.toString());
    }
    Token walrus = next();
    ParenthesizableWhitespace before = pws(walrus.whitespaceBefore);
    ParenthesizableWhitespace after = pws(walrus.whitespaceAfter);
    return new NamedExpression(target, before, after, parseTest());
  }

  // test: or_test ['if' or_test 'else' test] | lambdef
  private Expression parseTest() throws ParseException {
    if (at(TokenKind.LAMBDA)) {
      return parseLambda(true);
    }
    Expression body = parseOrTest();
    if (!at(TokenKind.IF)) {
      return body;
    }
    Token ifToken = next();
    ParenthesizableWhitespace whitespaceBeforeIf = pws(ifToken.whitespaceBefore);
    ParenthesizableWhitespace whitespaceAfterIf = pws(ifToken.whitespaceAfter);
    Expression test = parseOrTest();
    Token elseToken = expect(TokenKind.ELSE);
    ParenthesizableWhitespace whitespaceBeforeElse = pws(elseToken.whitespaceBefore);
    ParenthesizableWhitespace whitespaceAfterElse = pws(elseToken.whitespaceAfter);
    return new ConditionalExpression(
        body,
        whitespaceBeforeIf,
        whitespaceAfterIf,
        test,
        whitespaceBeforeElse,
        whitespaceAfterElse,
        parseTest());
  }

  // test_nocond: or_test | lambdef_nocond
  private Expression parseTestNoCond() throws ParseException {
    return at(TokenKind.LAMBDA) ? parseLambda(false) : parseOrTest();
  }

  // lambdef: 'lambda' [varargslist] ':' test
  private Lambda parseLambda(boolean allowConditional) throws ParseException {
    Token keyword = next();
    ParenthesizableWhitespace whitespaceAfterLambda = null;
    Parameters params = Parameters.empty();
    if (!at(TokenKind.COLON)) {
      whitespaceAfterLambda = pws(keyword.whitespaceAfter);
      params = parseParameters(TokenKind.COLON, false);
    }
    Token colon = expect(TokenKind.COLON);
    Colon c = new Colon(pws(colon.whitespaceBefore), pws(colon.whitespaceAfter));
    Expression body = allowConditional ? parseTest() : parseTestNoCond();
    return new Lambda(whitespaceAfterLambda, params, c, body);
  }

  // or_test: and_test ('or' and_test)*
  private Expression parseOrTest() throws ParseException {
    Expression left = parseAndTest();
    while (at(TokenKind.OR)) {
      BooleanOperator op = parseBooleanOperator();
      left = new BooleanOperation(left, op, parseAndTest());
    }
    return left;
  }

  // and_test: not_test ('and' not_test)*
  private Expression parseAndTest() throws ParseException {
    Expression left = parseNotTest();
    while (at(TokenKind.AND)) {
      BooleanOperator op = parseBooleanOperator();
      left = new BooleanOperation(left, op, parseNotTest());
    }
    return left;
  }

  private BooleanOperator parseBooleanOperator() throws ParseException {
    Token op = next();
    return new BooleanOperator(
        pws(op.whitespaceBefore), op.getKind(), pws(op.whitespaceAfter));
  }

  // not_test: 'not' not_test | comparison
  private Expression parseNotTest() throws ParseException {
    if (!at(TokenKind.NOT)) {
      return parseComparison();
    }
    Token not = next();
    UnaryOperator op = new UnaryOperator(TokenKind.NOT, pws(not.whitespaceAfter));
    return new UnaryOperation(op, parseNotTest());
  }

  // comparison: expr (comp_op expr)*
  // comp_op: '<'|'>'|'=='|'>='|'<='|'!='|'in'|'not' 'in'|'is'|'is' 'not'
  private Expression parseComparison() throws ParseException {
    Expression left = parseExpr();
    List<ComparisonTarget> comparisons = new ArrayList<>();
    while (true) {
      ComparisonOperator op;
      if (COMPARISON_OPERATORS.contains(token.getKind())) {
        Token t = next();
        op =
            new ComparisonOperator(
                pws(t.whitespaceBefore), t.getKind(), null, pws(t.whitespaceAfter));
      } else if (at(TokenKind.NOT)) {
        Token not = next();
        ParenthesizableWhitespace before = pws(not.whitespaceBefore);
        ParenthesizableWhitespace between = pws(not.whitespaceAfter);
        Token in = expect(TokenKind.IN);
        op = new ComparisonOperator(before, TokenKind.NOT_IN, between, pws(in.whitespaceAfter));
      } else if (at(TokenKind.IS)) {
        Token is = next();
        ParenthesizableWhitespace before = pws(is.whitespaceBefore);
        if (at(TokenKind.NOT)) {
          ParenthesizableWhitespace between = pws(is.whitespaceAfter);
          Token not = next();
          op =
              new ComparisonOperator(
                  before, TokenKind.IS_NOT, between, pws(not.whitespaceAfter));
        } else {
          op = new ComparisonOperator(before, TokenKind.IS, null, pws(is.whitespaceAfter));
        }
      } else {
        break;
      }
      comparisons.add(new ComparisonTarget(op, parseExpr()));
    }
    return comparisons.isEmpty() ? left : new Comparison(left, comparisons);
  }

  // expr: xor_expr ('|' xor_expr)*, and so on down to term.
  private Expression parseExpr() throws ParseException {
    return parseBinaryOperation(0);
  }

  private Expression parseBinaryOperation(int prec) throws ParseException {
    if (prec >= BINARY_PRECEDENCE.size()) {
      return parseFactor();
    }
    Expression left = parseBinaryOperation(prec + 1);
    while (BINARY_PRECEDENCE.get(prec).contains(token.getKind())) {
      Token op = next();
      BinaryOperator operator =
          new BinaryOperator(pws(op.whitespaceBefore), op.getKind(), pws(op.whitespaceAfter));
      left = new BinaryOperation(left, operator, parseBinaryOperation(prec + 1));
    }
    return left;
  }

  // factor: ('+'|'-'|'~') factor | power
  private Expression parseFactor() throws ParseException {
    switch (token.getKind()) {
      case PLUS:
      case MINUS:
      case TILDE:
        {
          Token op = next();
          UnaryOperator operator = new UnaryOperator(op.getKind(), pws(op.whitespaceAfter));
          return new UnaryOperation(operator, parseFactor());
        }
      default:
        return parsePower();
    }
  }

  // power: atom_expr ['**' factor]
  private Expression parsePower() throws ParseException {
    Expression base = parseAtomExpr();
    if (!at(TokenKind.STAR_STAR)) {
      return base;
    }
    Token op = next();
    BinaryOperator operator =
        new BinaryOperator(pws(op.whitespaceBefore), op.getKind(), pws(op.whitespaceAfter));
    return new BinaryOperation(base, operator, parseFactor());
  }

  // atom_expr: ['await'] atom trailer*
  private Expression parseAtomExpr() throws ParseException {
    if (at(TokenKind.AWAIT)) {
      Token await = next();
      ParenthesizableWhitespace whitespace = pws(await.whitespaceAfter);
      return new Await(whitespace, parseAtomWithTrailers());
    }
    return parseAtomWithTrailers();
  }

  // trailer: '(' [arglist] ')' | '[' subscriptlist ']' | '.' NAME
  private Expression parseAtomWithTrailers() throws ParseException {
    Expression e = parseAtom();
    while (true) {
      switch (token.getKind()) {
        case LPAREN:
          e = parseCall(e);
          break;
        case LBRACKET:
          e = parseSubscript(e);
          break;
        case DOT:
          {
            Token dot = next();
            Dot d = new Dot(pws(dot.whitespaceBefore), pws(dot.whitespaceAfter));
            e = new Attribute(e, d, parseName());
            break;
          }
        default:
          return e;
      }
    }
  }

  private Call parseCall(Expression func) throws ParseException {
    Token lparen = expect(TokenKind.LPAREN);
    ParenthesizableWhitespace whitespaceAfterFunc = pws(lparen.whitespaceBefore);
    ParenthesizableWhitespace whitespaceBeforeArgs = pws(lparen.whitespaceAfter);
    Token start = token;
    ImmutableList<Argument> args = parseArguments();
    expect(TokenKind.RPAREN);
    if (args.size() > 1) {
      for (Argument arg : args) {
        if (arg.getValue() instanceof GeneratorExpression
            && !arg.getValue().isParenthesized()) {
          // A bare generator expression must be the sole argument.
          throw unexpectedAt(start, "parenthesized generator expression");
        }
      }
    }
    return new Call(func, whitespaceAfterFunc, whitespaceBeforeArgs, args);
  }

  // subscriptlist: subscript (',' subscript)* [',']
  private Subscript parseSubscript(Expression value) throws ParseException {
    Token lbracket = expect(TokenKind.LBRACKET);
    ParenthesizableWhitespace whitespaceAfterValue = pws(lbracket.whitespaceBefore);
    LeftBracket lb = new LeftBracket(TokenKind.LBRACKET, pws(lbracket.whitespaceAfter));
    List<SubscriptElement> slice = new ArrayList<>();
    while (true) {
      SubscriptSlice s = parseSubscriptSlice();
      if (!at(TokenKind.COMMA)) {
        slice.add(new SubscriptElement(s, null));
        break;
      }
      slice.add(new SubscriptElement(s, parseComma()));
      if (at(TokenKind.RBRACKET)) {
        break;
      }
    }
    return new Subscript(
        value, whitespaceAfterValue, lb, slice, parseRightBracket(TokenKind.RBRACKET));
  }

  // subscript: test | [test] ':' [test] [':' [test]]
  private SubscriptSlice parseSubscriptSlice() throws ParseException {
    Expression lower = at(TokenKind.COLON) ? null : parseNamedExprTest();
    if (!at(TokenKind.COLON)) {
      return new Index(lower);
    }
    Colon firstColon = parseColon();
    Expression upper = atSliceEnd() ? null : parseTest();
    Colon secondColon = null;
    Expression step = null;
    if (at(TokenKind.COLON)) {
      secondColon = parseColon();
      step = atSliceEnd() ? null : parseTest();
    }
    return new Slice(lower, firstColon, upper, secondColon, step);
  }

  private boolean atSliceEnd() {
    return at(TokenKind.COLON) || at(TokenKind.COMMA) || at(TokenKind.RBRACKET);
  }

  private Colon parseColon() throws ParseException {
    Token colon = expect(TokenKind.COLON);
    return new Colon(pws(colon.whitespaceBefore), pws(colon.whitespaceAfter));
  }

  private RightBracket parseRightBracket(TokenKind kind) throws ParseException {
    return new RightBracket(pws(expect(kind).whitespaceBefore), kind);
  }

  // atom: '(' [yield_expr|testlist_comp] ')' | '[' [testlist_comp] ']'
  //     | '{' [dictorsetmaker] '}' | NAME | NUMBER | STRING+ | '...'
  private Expression parseAtom() throws ParseException {
    switch (token.getKind()) {
      case NAME:
        return new Name(next().getText());
      case NUMBER:
        return parseNumber();
      case STRING:
        return parseStrings();
      case ELLIPSIS:
        next();
        return new Ellipsis();
      case LPAREN:
        return parseParenthesized();
      case LBRACKET:
        return parseListDisplay();
      case LBRACE:
        return parseBraceDisplay();
      default:
        throw unexpected("expression");
    }
  }

  private Expression parseNumber() throws ParseException {
    Token number = next();
    String text = number.getText();
    String lower = text.toLowerCase(Locale.ROOT);
    try {
      if (lower.endsWith("j")) {
        return new ImaginaryLiteral(text);
      }
      if (lower.startsWith("0x")
          || lower.startsWith("0o")
          || lower.startsWith("0b")
          || (lower.indexOf('.') < 0 && lower.indexOf('e') < 0)) {
        return new IntLiteral(text);
      }
      return new FloatLiteral(text);
    } catch (InvalidNodeException e) {
      throw unexpectedAt(number, "valid number literal");
    }
  }

  // STRING+, concatenated to the right.
  private StringExpression parseStrings() throws ParseException {
    Token string = next();
    StringExpression left = stringLeaf(string);
    if (!at(TokenKind.STRING)) {
      return left;
    }
    ParenthesizableWhitespace between = pws(string.whitespaceAfter);
    Token rightStart = token;
    StringExpression right = parseStrings();
    if (left.isBytes() != right.isBytes()) {
      throw unexpectedAt(rightStart, left.isBytes() ? "bytes literal" : "string literal");
    }
    return new ConcatenatedString(left, between, right);
  }

  private static StringExpression stringLeaf(Token string) {
    String text = string.getText();
    int prefix = StringExpression.prefixLength(text);
    if (prefix > 0 && text.substring(0, prefix).toLowerCase(Locale.ROOT).contains("f")) {
      return new FormattedString(text);
    }
    return new StringLiteral(text);
  }

  // '(' [yield_expr | testlist_comp] ')'
  private Expression parseParenthesized() throws ParseException {
    Token lparen = next();
    LeftParen lpar = new LeftParen(pws(lparen.whitespaceAfter));
    if (at(TokenKind.RPAREN)) {
      return new TupleExpression(
          ImmutableList.of(), ImmutableList.of(lpar), ImmutableList.of(parseRightParen()));
    }
    if (at(TokenKind.YIELD)) {
      Expression yield = parseYield();
      return parenthesize(yield, lpar, parseRightParen());
    }
    SequenceElement first = parseNamedOrStar();
    if (first instanceof Element && atCompFor()) {
      ComprehensionFor forIn = parseCompFor();
      return new GeneratorExpression(
          first.getValue(),
          forIn,
          ImmutableList.of(lpar),
          ImmutableList.of(parseRightParen()));
    }
    if (first instanceof Element && at(TokenKind.RPAREN)) {
      return parenthesize(first.getValue(), lpar, parseRightParen());
    }
    List<SequenceElement> elements = parseSequenceTail(first, this::parseNamedOrStar);
    if (elements.size() == 1 && elements.get(0).getComma() == null) {
      // A lone starred expression.
      throw unexpected(TokenKind.COMMA.toString());
    }
    return new TupleExpression(
        elements, ImmutableList.of(lpar), ImmutableList.of(parseRightParen()));
  }

  private RightParen parseRightParen() throws ParseException {
    return new RightParen(pws(expect(TokenKind.RPAREN).whitespaceBefore));
  }

  /** Wraps {@code e} in one more pair of parentheses, outside any it already has. */
  private static Expression parenthesize(Expression e, LeftParen lpar, RightParen rpar) {
    ImmutableList<LeftParen> lpars =
        ImmutableList.<LeftParen>builder().add(lpar).addAll(e.getLpar()).build();
    ImmutableList<RightParen> rpars =
        ImmutableList.<RightParen>builder().addAll(e.getRpar()).add(rpar).build();
    return (Expression) e.withChanges(ImmutableMap.of("lpar", lpars, "rpar", rpars));
  }

  // '[' [testlist_comp] ']'
  private Expression parseListDisplay() throws ParseException {
    Token lbracket = next();
    LeftBracket lb = new LeftBracket(TokenKind.LBRACKET, pws(lbracket.whitespaceAfter));
    if (at(TokenKind.RBRACKET)) {
      return new ListExpression(lb, ImmutableList.of(), parseRightBracket(TokenKind.RBRACKET));
    }
    SequenceElement first = parseNamedOrStar();
    if (first instanceof Element && atCompFor()) {
      ComprehensionFor forIn = parseCompFor();
      return new ListComprehension(
          lb, first.getValue(), forIn, parseRightBracket(TokenKind.RBRACKET));
    }
    List<SequenceElement> elements = parseSequenceTail(first, this::parseNamedOrStar);
    return new ListExpression(lb, elements, parseRightBracket(TokenKind.RBRACKET));
  }

  // '{' [dictorsetmaker] '}'
  private Expression parseBraceDisplay() throws ParseException {
    Token lbrace = next();
    LeftBracket lb = new LeftBracket(TokenKind.LBRACE, pws(lbrace.whitespaceAfter));
    if (at(TokenKind.RBRACE)) {
      return new DictExpression(lb, ImmutableList.of(), parseRightBracket(TokenKind.RBRACE));
    }
    if (at(TokenKind.STAR_STAR)) {
      List<DictItem> items = parseDictTail(parseStarredDictElement());
      return new DictExpression(lb, items, parseRightBracket(TokenKind.RBRACE));
    }
    if (at(TokenKind.STAR)) {
      List<SequenceElement> elements = parseSequenceTail(parseStarred(), this::parseTestOrStar);
      return new SetExpression(lb, elements, parseRightBracket(TokenKind.RBRACE));
    }
    Expression key = parseNamedExprTest();
    if (at(TokenKind.COLON)) {
      Token colon = next();
      ParenthesizableWhitespace before = pws(colon.whitespaceBefore);
      ParenthesizableWhitespace after = pws(colon.whitespaceAfter);
      Expression value = parseTest();
      if (atCompFor()) {
        ComprehensionFor forIn = parseCompFor();
        return new DictComprehension(
            lb, key, before, after, value, forIn, parseRightBracket(TokenKind.RBRACE));
      }
      List<DictItem> items = parseDictTail(new DictElement(key, before, after, value, null));
      return new DictExpression(lb, items, parseRightBracket(TokenKind.RBRACE));
    }
    if (atCompFor()) {
      ComprehensionFor forIn = parseCompFor();
      return new SetComprehension(lb, key, forIn, parseRightBracket(TokenKind.RBRACE));
    }
    List<SequenceElement> elements = parseSequenceTail(Element.of(key), this::parseTestOrStar);
    return new SetExpression(lb, elements, parseRightBracket(TokenKind.RBRACE));
  }

  private DictItem parseStarredDictElement() throws ParseException {
    Token starStar = expect(TokenKind.STAR_STAR);
    return new StarredDictElement(pws(starStar.whitespaceAfter), parseExpr(), null);
  }

  // (test ':' test | '**' expr)
  private DictItem parseDictItem() throws ParseException {
    if (at(TokenKind.STAR_STAR)) {
      return parseStarredDictElement();
    }
    Expression key = parseTest();
    Token colon = expect(TokenKind.COLON);
    ParenthesizableWhitespace before = pws(colon.whitespaceBefore);
    ParenthesizableWhitespace after = pws(colon.whitespaceAfter);
    return new DictElement(key, before, after, parseTest(), null);
  }

  private List<DictItem> parseDictTail(DictItem first) throws ParseException {
    List<DictItem> items = new ArrayList<>();
    DictItem current = first;
    while (at(TokenKind.COMMA)) {
      Comma comma = parseComma();
      if (current instanceof DictElement) {
        DictElement e = (DictElement) current;
        items.add(
            new DictElement(
                e.getKey(),
                e.getWhitespaceBeforeColon(),
                e.getWhitespaceAfterColon(),
                e.getValue(),
                comma));
      } else {
        StarredDictElement e = (StarredDictElement) current;
        items.add(new StarredDictElement(e.getWhitespaceBeforeValue(), e.getValue(), comma));
      }
      if (at(TokenKind.RBRACE)) {
        return items;
      }
      current = parseDictItem();
    }
    items.add(current);
    return items;
  }

  private boolean atCompFor() throws ParseException {
    return at(TokenKind.FOR)
        || (at(TokenKind.ASYNC) && peek(1).getKind() == TokenKind.FOR);
  }

  // comp_for: ['async'] 'for' exprlist 'in' or_test comp_if* [comp_for]
  // comp_if: 'if' test_nocond
  private ComprehensionFor parseCompFor() throws ParseException {
    ParenthesizableWhitespace whitespaceBefore;
    Asynchronous asynchronous = null;
    if (at(TokenKind.ASYNC)) {
      whitespaceBefore = pws(token.whitespaceBefore);
      asynchronous = parseAsynchronous();
    } else {
      whitespaceBefore = pws(token.whitespaceBefore);
    }
    Token keyword = expect(TokenKind.FOR);
    ParenthesizableWhitespace whitespaceAfterFor = pws(keyword.whitespaceAfter);
    Token targetStart = token;
    Expression target = parseExprList(true);
    checkTarget(target, targetStart);
    Token in = expect(TokenKind.IN);
    ParenthesizableWhitespace whitespaceBeforeIn = pws(in.whitespaceBefore);
    ParenthesizableWhitespace whitespaceAfterIn = pws(in.whitespaceAfter);
    Expression iter = parseOrTest();
    List<ComprehensionIf> ifs = new ArrayList<>();
    while (at(TokenKind.IF)) {
      Token ifToken = next();
      ParenthesizableWhitespace before = pws(ifToken.whitespaceBefore);
      ParenthesizableWhitespace after = pws(ifToken.whitespaceAfter);
      ifs.add(new ComprehensionIf(before, after, parseTestNoCond()));
    }
    ComprehensionFor innerForIn = atCompFor() ? parseCompFor() : null;
    return new ComprehensionFor(
        whitespaceBefore,
        asynchronous,
        whitespaceAfterFor,
        target,
        whitespaceBeforeIn,
        whitespaceAfterIn,
        iter,
        ifs,
        innerForIn);
  }

  // yield_expr: 'yield' ['from' test | testlist_star_expr]
  private Yield parseYield() throws ParseException {
    Token keyword = expect(TokenKind.YIELD);
    if (at(TokenKind.FROM)) {
      ParenthesizableWhitespace whitespace = pws(keyword.whitespaceAfter);
      Token from = next();
      FromClause clause = new FromClause(null, pws(from.whitespaceAfter), parseTest());
      return new Yield(whitespace, clause);
    }
    if (!atExpressionStart()) {
      return new Yield(null, null);
    }
    ParenthesizableWhitespace whitespace = pws(keyword.whitespaceAfter);
    return new Yield(whitespace, parseTestListStarExpr(version.atLeast(PythonVersion.PY_3_8)));
  }
}
