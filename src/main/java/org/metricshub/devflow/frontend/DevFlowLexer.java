package org.metricshub.devflow.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * DevFlow
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.io.Reader;
import java.util.HashMap;
import java.util.Map;
import org.metricshub.devflow.frontend.ast.LexerException;
import org.metricshub.devflow.util.ScriptSource;

/**
 * Groups the characters of a DevFlow source into tokens, on demand.
 * <p>
 * Whitespace, newlines, {@code #} comments and {@code //} comments separate
 * tokens and are otherwise ignored. Every token records the line it starts
 * on; the end-of-file token reports the line of the last real token so that
 * a document cut short is blamed on the last thing it contained.
 */
public class DevFlowLexer {

	/**
	 * Contains a mapping of DevFlow keywords to their token values.
	 * <p>
	 * {@code if}, {@code else}, {@code for}, {@code in} and {@code cache}
	 * are reserved: they are recognized here but never accepted by the
	 * parser other than as names.
	 */
	private static final Map<String, Token> KEYWORDS = new HashMap<String, Token>();

	static {
		// structure
		KEYWORDS.put("pipeline", Token.KW_PIPELINE);
		KEYWORDS.put("stage", Token.KW_STAGE);
		KEYWORDS.put("job", Token.KW_JOB);
		KEYWORDS.put("step", Token.KW_STEP);
		KEYWORDS.put("on", Token.KW_ON);
		KEYWORDS.put("service", Token.KW_SERVICE);
		KEYWORDS.put("image", Token.KW_IMAGE);
		KEYWORDS.put("port", Token.KW_PORT);
		KEYWORDS.put("env", Token.KW_ENV);
		KEYWORDS.put("artifact", Token.KW_ARTIFACT);
		KEYWORDS.put("matrix", Token.KW_MATRIX);

		// reserved
		KEYWORDS.put("if", Token.KW_IF);
		KEYWORDS.put("else", Token.KW_ELSE);
		KEYWORDS.put("for", Token.KW_FOR);
		KEYWORDS.put("in", Token.KW_IN);
		KEYWORDS.put("cache", Token.KW_CACHE);

		// step kinds
		KEYWORDS.put("run", Token.KW_RUN);
		KEYWORDS.put("checkout", Token.KW_CHECKOUT);
		KEYWORDS.put("deploy", Token.KW_DEPLOY);
		KEYWORDS.put("notify", Token.KW_NOTIFY);

		// trigger kinds
		KEYWORDS.put("push", Token.KW_PUSH);
		KEYWORDS.put("pull_request", Token.KW_PULL_REQUEST);
		KEYWORDS.put("schedule", Token.KW_SCHEDULE);
		KEYWORDS.put("manual", Token.KW_MANUAL);
	}

	private final String sourceDescription;
	private final Reader reader;
	private int c;
	private int line = 1;

	private Token token;
	private int tokenLine = 1;

	private final StringBuilder text = new StringBuilder();
	private final StringBuilder string = new StringBuilder();

	/**
	 * <p>
	 * Constructor for DevFlowLexer.
	 * </p>
	 *
	 * @param source the document to tokenize
	 * @throws IOException when the source cannot be opened or read
	 */
	public DevFlowLexer(ScriptSource source) throws IOException {
		this.sourceDescription = source.getDescription();
		this.reader = source.getReader();
		c = reader.read();
		// completely bypass \r's
		while (c == '\r') {
			c = reader.read();
		}
	}

	private void read() throws IOException {
		text.append((char) c);
		if (c == '\n') {
			line++;
		}
		c = reader.read();
		while (c == '\r') {
			c = reader.read();
		}
	}

	/**
	 * Skip all whitespaces, newlines and comments
	 *
	 * @throws IOException
	 */
	private void skipWhitespaces() throws IOException {
		while (c >= 0) {
			if (c == ' ' || c == '\t' || c == '\n' || c == '\f') {
				read();
			} else if (c == '#') {
				while (c >= 0 && c != '\n') {
					read();
				}
			} else if (c == '/') {
				text.setLength(0);
				read();
				if (c != '/') {
					throw lexerException("Invalid character: /");
				}
				while (c >= 0 && c != '\n') {
					read();
				}
			} else {
				break;
			}
		}
	}

	private LexerException lexerException(String msg) {
		return new LexerException(msg, sourceDescription, line, text.toString());
	}

	/**
	 * Reads the string and handle the escape codes.
	 *
	 * @throws IOException
	 */
	private void readString() throws IOException {
		string.setLength(0);

		while (c >= 0 && c != '"' && c != '\n') {
			if (c == '\\') {
				read();
				switch (c) {
				case 'n':
					string.append('\n');
					break;
				case 't':
					string.append('\t');
					break;
				case 'r':
					string.append('\r');
					break;
				case '\n':
				case -1:
					// handled by the unterminated check below
					continue;
				default:
					string.append((char) c);
					break; // Remove the backslash
				}
			} else {
				string.append((char) c);
			}
			read();
		}
		if (c != '"') {
			throw lexerException("Unterminated string: " + text);
		}
		read();
	}

	/**
	 * Reads the next token.
	 *
	 * @return the token just read, also available through {@link #getToken()}
	 * @throws IOException upon an IO error
	 */
	public Token nextToken() throws IOException {
		int previousTokenLine = tokenLine;
		skipWhitespaces();
		text.setLength(0);
		tokenLine = line;
		if (c < 0) {
			// a truncated document is reported on the line of its last token
			if (token != null) {
				tokenLine = previousTokenLine;
			}
			token = Token.EOF;
			return token;
		}
		token = readToken();
		return token;
	}

	private Token readToken() throws IOException {
		switch (c) {
		case '{':
			read();
			return Token.OPEN_BRACE;
		case '}':
			read();
			return Token.CLOSE_BRACE;
		case '[':
			read();
			return Token.OPEN_BRACKET;
		case ']':
			read();
			return Token.CLOSE_BRACKET;
		case '(':
			read();
			return Token.OPEN_PAREN;
		case ')':
			read();
			return Token.CLOSE_PAREN;
		case ',':
			read();
			return Token.COMMA;
		case ';':
			read();
			return Token.SEMICOLON;
		case ':':
			read();
			return Token.COLON;
		case '$':
			read();
			return Token.DOLLAR;
		case '=':
			read();
			if (c == '=') {
				read();
				return Token.EQ;
			}
			return Token.EQUALS;
		case '!':
			read();
			if (c == '=') {
				read();
				return Token.NE;
			}
			return Token.NOT;
		case '<':
			read();
			if (c == '=') {
				read();
				return Token.LE;
			}
			return Token.LT;
		case '>':
			read();
			if (c == '=') {
				read();
				return Token.GE;
			}
			return Token.GT;
		case '&':
			read();
			if (c == '&') {
				read();
				return Token.AND;
			}
			throw lexerException("use && for logical and");
		case '|':
			read();
			if (c == '|') {
				read();
				return Token.OR;
			}
			throw lexerException("use || for logical or");
		case '"':
			read();
			readString();
			return Token.STRING;
		default:
			break;
		}

		if (c >= '0' && c <= '9') {
			read();
			while (c >= '0' && c <= '9') {
				read();
			}
			return Token.NUMBER;
		}

		if (Character.isLetter(c) || c == '_') {
			read();
			while (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.') {
				read();
			}
			Token kwToken = KEYWORDS.get(text.toString());
			if (kwToken != null) {
				return kwToken;
			}
			return Token.IDENTIFIER;
		}

		read();
		throw lexerException("Invalid character (" + (int) text.charAt(0) + "): " + text);
	}

	/**
	 * @return the current token
	 */
	public Token getToken() {
		return token;
	}

	/**
	 * @return the raw text of the current token, quotes and escapes included
	 */
	public String getText() {
		return text.toString();
	}

	/**
	 * @return the decoded value of the current {@link Token#STRING} token
	 */
	public String getStringValue() {
		return string.toString();
	}

	/**
	 * @return the line of the current token
	 */
	public int getLineNumber() {
		return tokenLine;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}
}
