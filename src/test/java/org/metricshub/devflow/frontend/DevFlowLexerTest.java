package org.metricshub.devflow.frontend;

import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.devflow.frontend.ast.LexerException;
import org.metricshub.devflow.util.ScriptSource;

public class DevFlowLexerTest {

	private static DevFlowLexer lexer(String text) throws IOException {
		return new DevFlowLexer(new ScriptSource("lexer-test", new StringReader(text)));
	}

	private static List<Token> tokens(String text) throws IOException {
		DevFlowLexer lexer = lexer(text);
		List<Token> tokens = new ArrayList<Token>();
		Token token;
		do {
			token = lexer.nextToken();
			tokens.add(token);
		} while (token != Token.EOF);
		return tokens;
	}

	@Test
	public void testKeywords() throws Exception {
		assertEquals(
				Arrays
						.asList(
								Token.KW_PIPELINE,
								Token.KW_STAGE,
								Token.KW_JOB,
								Token.KW_STEP,
								Token.KW_ON,
								Token.KW_SERVICE,
								Token.KW_IMAGE,
								Token.KW_PORT,
								Token.KW_ENV,
								Token.KW_ARTIFACT,
								Token.KW_MATRIX,
								Token.EOF),
				tokens("pipeline stage job step on service image port env artifact matrix"));
		assertEquals(
				Arrays
						.asList(
								Token.KW_RUN,
								Token.KW_CHECKOUT,
								Token.KW_DEPLOY,
								Token.KW_NOTIFY,
								Token.KW_PUSH,
								Token.KW_PULL_REQUEST,
								Token.KW_SCHEDULE,
								Token.KW_MANUAL,
								Token.EOF),
				tokens("run checkout deploy notify push pull_request schedule manual"));
		assertEquals(
				"Reserved words are lexed as keywords",
				Arrays.asList(Token.KW_IF, Token.KW_ELSE, Token.KW_FOR, Token.KW_IN, Token.KW_CACHE, Token.EOF),
				tokens("if else for in cache"));
	}

	@Test
	public void testPunctuationAndOperators() throws Exception {
		assertEquals(
				Arrays
						.asList(
								Token.OPEN_BRACE,
								Token.CLOSE_BRACE,
								Token.OPEN_BRACKET,
								Token.CLOSE_BRACKET,
								Token.OPEN_PAREN,
								Token.CLOSE_PAREN,
								Token.COMMA,
								Token.SEMICOLON,
								Token.COLON,
								Token.EQUALS,
								Token.DOLLAR,
								Token.EOF),
				tokens("{ } [ ] ( ) , ; : = $"));
		assertEquals(
				Arrays
						.asList(
								Token.EQ,
								Token.NE,
								Token.LT,
								Token.LE,
								Token.GT,
								Token.GE,
								Token.AND,
								Token.OR,
								Token.NOT,
								Token.EOF),
				tokens("== != < <= > >= && || !"));
	}

	@Test
	public void testIdentifiersAndNumbers() throws Exception {
		DevFlowLexer lexer = lexer("build-linux_x64 v1.2 5432:80");
		assertEquals(Token.IDENTIFIER, lexer.nextToken());
		assertEquals("build-linux_x64", lexer.getText());
		assertEquals(Token.IDENTIFIER, lexer.nextToken());
		assertEquals("v1.2", lexer.getText());
		assertEquals(Token.NUMBER, lexer.nextToken());
		assertEquals("5432", lexer.getText());
		assertEquals(Token.COLON, lexer.nextToken());
		assertEquals(Token.COLON, lexer.getToken());
		assertEquals(Token.NUMBER, lexer.nextToken());
		assertEquals(Token.NUMBER, lexer.getToken());
		assertEquals("80", lexer.getText());
		assertEquals(Token.EOF, lexer.nextToken());
	}

	@Test
	public void testKeywordPrefixIsAnIdentifier() throws Exception {
		DevFlowLexer lexer = lexer("pipelines runner");
		assertEquals(Token.IDENTIFIER, lexer.nextToken());
		assertEquals(Token.IDENTIFIER, lexer.nextToken());
	}

	@Test
	public void testStringEscapes() throws Exception {
		DevFlowLexer lexer = lexer("\"say \\\"hi\\\"\\n\\tdone \\\\ \\q\"");
		assertEquals(Token.STRING, lexer.nextToken());
		assertEquals("say \"hi\"\n\tdone \\ q", lexer.getStringValue());
		assertEquals("Raw text keeps quotes", '"', lexer.getText().charAt(0));
	}

	@Test
	public void testCommentsAreSkipped() throws Exception {
		assertEquals(
				Arrays.asList(Token.KW_PIPELINE, Token.IDENTIFIER, Token.EOF),
				tokens("# heading\npipeline // trailing comment\n  name # other\n"));
		assertEquals(
				"Comment markers inside strings are kept",
				Arrays.asList(Token.STRING, Token.EOF),
				tokens("\"#channel // not a comment\""));
	}

	@Test
	public void testLineNumbers() throws Exception {
		DevFlowLexer lexer = lexer("pipeline\r\n\n  p {\n\n}");
		lexer.nextToken();
		assertEquals(1, lexer.getLineNumber());
		lexer.nextToken();
		assertEquals(3, lexer.getLineNumber());
		lexer.nextToken();
		assertEquals(3, lexer.getLineNumber());
		lexer.nextToken();
		assertEquals(5, lexer.getLineNumber());
	}

	@Test
	public void testEndOfFileReportsLineOfLastToken() throws Exception {
		DevFlowLexer lexer = lexer("pipeline p {\n\n\n\n");
		lexer.nextToken();
		lexer.nextToken();
		lexer.nextToken();
		assertEquals(Token.EOF, lexer.nextToken());
		assertEquals("EOF must be blamed on the last consumed token", 1, lexer.getLineNumber());
	}

	@Test
	public void testLexerErrors() throws Exception {
		LexerException unterminated = assertThrows(
				"Unfinished string by EOL must throw",
				LexerException.class,
				() -> tokens("image \"node:18\n\""));
		assertEquals(1, unterminated.getLineNumber());
		assertThrows("Unfinished string by EOF must throw", LexerException.class, () -> tokens("\"abc"));
		assertThrows("Backslash before EOF must throw", LexerException.class, () -> tokens("\"abc\\"));
		LexerException invalid = assertThrows(
				"Invalid character must throw",
				LexerException.class,
				() -> tokens("pipeline\n  @"));
		assertEquals(2, invalid.getLineNumber());
		assertEquals("@", invalid.getNearText());
		assertThrows("A single slash is not a comment", LexerException.class, () -> tokens("a / b"));
		assertThrows("A single & is not an operator", LexerException.class, () -> tokens("a & b"));
		assertThrows("A single | is not an operator", LexerException.class, () -> tokens("a | b"));
	}
}
