package org.polyfront.parser;

import org.polyfront.lexer.LexerToken;

import java.util.List;

/**
 * A parsed unit: the (possibly empty) tree, the tokens it was parsed from and
 * the coverage numbers.
 */
public record ParseResult<T>(T ast, List<LexerToken> tokens, ParseStat stat) {
}
