package com.dcec.parsing;

import com.dcec.namespace.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one line of DCEC text into a {@link ParseToken} tree.
 *
 * <p>Pipeline: strip comments, peel a top-level negation, normalize
 * separators, check and consolidate parentheses, tuck function names, split
 * into nested groups, then rewrite synonyms, arithmetic and logical infix
 * inside every group, innermost first.
 */
public class TokenTreeBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenTreeBuilder.class);

    private static final Pattern LEADING_NEGATION = Pattern.compile("^(not|negate|¬|~|!)(.*)$", Pattern.DOTALL);
    private static final Pattern NAME = Pattern.compile("^[^\\s(),;]+");

    /**
     * @return the token tree, or empty when the text holds nothing but
     *         whitespace and comments
     * @throws DcecParseException on malformed text
     */
    public Optional<TokenTreeResult> build(String text) {
        Map<String, String> atomics = new LinkedHashMap<>();
        Optional<ParseToken> token = buildToken(text == null ? "" : text, atomics);
        token.ifPresent(t -> LOGGER.debug("Built token tree {} from '{}'", t, text));
        return token.map(t -> new TokenTreeResult(t, atomics));
    }

    private Optional<ParseToken> buildToken(String text, Map<String, String> atomics) {
        String stripped = LexicalNormalizer.stripComments(text).trim();
        if (stripped.isEmpty()) {
            return Optional.empty();
        }

        Optional<String> negated = negatedOperand(stripped);
        if (negated.isPresent()) {
            ParseToken operand = buildToken(negated.get(), atomics)
                    .orElseThrow(() -> new DcecParseException("Missing operand for 'not'", text));
            if (operand.isAtomic()) {
                atomics.putIfAbsent(operand.getName(), Namespace.BOOLEAN);
            }
            return Optional.of(ParseToken.of(NotationTransformer.NOT, Collections.singletonList(operand)));
        }

        String normalized = LexicalNormalizer.stripWhitespace(stripped);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        if (!LexicalNormalizer.checkParens(normalized)) {
            throw new DcecParseException("Unbalanced parentheses", text);
        }
        checkNesting(normalized, text);

        normalized = LexicalNormalizer.consolidateParens(normalized);
        normalized = NotationTransformer.tuckFunctions(normalized);
        normalized = LexicalNormalizer.consolidateParens(normalized);

        int[] cursor = {0};
        ParseToken token = parseGroup(normalized, cursor, atomics, text);
        if (cursor[0] != normalized.length()) {
            throw new DcecParseException("Unexpected text after expression", text);
        }
        return Optional.of(token);
    }

    /**
     * Operand of a leading negation when that operand is one unit: a name, a
     * call such as {@code P(x)}, or a parenthesized group. Anything longer is
     * left to the infix passes so that {@code not P and Q} reads as
     * {@code (not P) and Q}.
     */
    private Optional<String> negatedOperand(String text) {
        Matcher matcher = LEADING_NEGATION.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String keyword = matcher.group(1);
        String rest = matcher.group(2);
        boolean word = Character.isLetter(keyword.charAt(0));
        if (word && !rest.isEmpty() && !Character.isWhitespace(rest.charAt(0)) && rest.charAt(0) != '(') {
            return Optional.empty();
        }
        rest = rest.trim();
        if (rest.isEmpty()) {
            throw new DcecParseException("Missing operand for 'not'", text);
        }
        return isSingleUnit(rest) ? Optional.of(rest) : Optional.empty();
    }

    private boolean isSingleUnit(String text) {
        if (text.charAt(0) == '(') {
            return LexicalNormalizer.getMatchingCloseParen(text, 0) == text.length() - 1;
        }
        Matcher name = NAME.matcher(text);
        if (!name.find()) {
            return false;
        }
        int end = name.end();
        if (end == text.length()) {
            return true;
        }
        return text.charAt(end) == '(' && LexicalNormalizer.getMatchingCloseParen(text, end) == text.length() - 1;
    }

    private void checkNesting(String normalized, String original) {
        int depth = 0;
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new DcecParseException("Closing parenthesis without an opening one", original);
                }
            }
        }
    }

    private ParseToken parseGroup(String s, int[] cursor, Map<String, String> atomics, String original) {
        // s.charAt(cursor[0]) is '('
        cursor[0]++;
        List<ParseToken> elements = new ArrayList<>();
        while (cursor[0] < s.length() && s.charAt(cursor[0]) != ')') {
            char c = s.charAt(cursor[0]);
            if (c == LexicalNormalizer.SEPARATOR) {
                cursor[0]++;
            } else if (c == '(') {
                elements.add(parseGroup(s, cursor, atomics, original));
            } else {
                int start = cursor[0];
                while (cursor[0] < s.length() && "(),".indexOf(s.charAt(cursor[0])) < 0) {
                    cursor[0]++;
                }
                elements.add(ParseToken.leaf(s.substring(start, cursor[0])));
            }
        }
        if (cursor[0] >= s.length()) {
            throw new DcecParseException("Unbalanced parentheses", original);
        }
        cursor[0]++;
        if (elements.isEmpty()) {
            throw new DcecParseException("Empty parentheses", original);
        }

        elements = NotationTransformer.replaceSynonyms(elements);
        elements = NotationTransformer.prefixEmdas(elements, atomics);
        elements = NotationTransformer.prefixLogicalFunctions(elements, atomics);
        return NotationTransformer.assemble(elements, true);
    }
}
