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

/** Lexer token values. */
public enum Token {
	EOF("end of file"),
	IDENTIFIER("identifier"),
	STRING("string"),
	NUMBER("number"),

	KW_PIPELINE("'pipeline'", true),
	KW_STAGE("'stage'", true),
	KW_JOB("'job'", true),
	KW_STEP("'step'", true),
	KW_ON("'on'", true),
	KW_SERVICE("'service'", true),
	KW_IMAGE("'image'", true),
	KW_PORT("'port'", true),
	KW_ENV("'env'", true),
	KW_ARTIFACT("'artifact'", true),
	KW_MATRIX("'matrix'", true),
	KW_IF("'if'", true),
	KW_ELSE("'else'", true),
	KW_FOR("'for'", true),
	KW_IN("'in'", true),
	KW_RUN("'run'", true),
	KW_CHECKOUT("'checkout'", true),
	KW_CACHE("'cache'", true),
	KW_DEPLOY("'deploy'", true),
	KW_NOTIFY("'notify'", true),
	KW_PUSH("'push'", true),
	KW_PULL_REQUEST("'pull_request'", true),
	KW_SCHEDULE("'schedule'", true),
	KW_MANUAL("'manual'", true),

	OPEN_BRACE("'{'"),
	CLOSE_BRACE("'}'"),
	OPEN_BRACKET("'['"),
	CLOSE_BRACKET("']'"),
	OPEN_PAREN("'('"),
	CLOSE_PAREN("')'"),
	COMMA("','"),
	SEMICOLON("';'"),
	COLON("':'"),
	EQUALS("'='"),
	DOLLAR("'$'"),

	// reserved, never accepted by the grammar
	EQ("'=='"),
	NE("'!='"),
	LT("'<'"),
	LE("'<='"),
	GT("'>'"),
	GE("'>='"),
	AND("'&&'"),
	OR("'||'"),
	NOT("'!'");

	private final String display;
	private final boolean keyword;

	Token(String display) {
		this(display, false);
	}

	Token(String display, boolean keyword) {
		this.display = display;
		this.keyword = keyword;
	}

	/**
	 * @return how the token is named in diagnostics
	 */
	public String getDisplay() {
		return display;
	}

	public boolean isKeyword() {
		return keyword;
	}
}
