package com.dcec.parsing;

import com.dcec.cache.CacheManager;
import com.dcec.formula.Formula;
import com.dcec.formula.FormulaBuilder;
import com.dcec.formula.FormulaValidator;
import com.dcec.formula.ValidationResult;
import com.dcec.formula.Variable;
import com.dcec.namespace.Namespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Text to formula: token tree, typed formula, operand-count validation and
 * interning, with results remembered in the parse cache.
 *
 * <p>Malformed text raises {@link DcecParseException}. Text that is well
 * formed but cannot be typed or fails validation gives an empty result and a
 * warning.
 */
public class DcecParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(DcecParser.class);

    public static final String DEFAULT_LANGUAGE = "dcec";

    private final Namespace namespace;
    private final CacheManager cacheManager;
    private final TokenTreeBuilder tokenTreeBuilder = new TokenTreeBuilder();
    private final FormulaBuilder formulaBuilder = new FormulaBuilder();
    private final FormulaValidator validator = new FormulaValidator();

    public DcecParser(Namespace namespace, CacheManager cacheManager) {
        this.namespace = namespace;
        this.cacheManager = cacheManager;
    }

    public Optional<ParsedFormula> parse(String text) {
        return parse(text, DEFAULT_LANGUAGE);
    }

    /**
     * @throws IllegalArgumentException for a language other than {@value #DEFAULT_LANGUAGE}
     * @throws DcecParseException        on malformed text
     */
    public Optional<ParsedFormula> parse(String text, String language) {
        if (!DEFAULT_LANGUAGE.equalsIgnoreCase(language)) {
            throw new IllegalArgumentException("Unsupported input language: " + language);
        }
        return cacheManager.getParseCache().getOrParse(text, DEFAULT_LANGUAGE, () -> parseUncached(text));
    }

    private ParsedFormula parseUncached(String text) {
        Optional<TokenTreeResult> tree = tokenTreeBuilder.build(text);
        if (tree.isEmpty()) {
            LOGGER.debug("Nothing to parse in '{}'", text);
            return null;
        }
        ParseToken token = tree.get().getToken();
        Map<String, Variable> bindings = new HashMap<>();
        Optional<Formula> built = formulaBuilder.tokenToFormula(token, namespace, bindings, tree.get().getAtomics());
        if (built.isEmpty()) {
            LOGGER.warn("Could not build a formula from '{}' (token tree {})", text, token);
            return null;
        }
        ValidationResult validation = validator.validate(built.get());
        if (!validation.isValid()) {
            LOGGER.warn("Formula from '{}' failed validation: {}", text, validation.getErrors());
            return null;
        }
        Formula formula = cacheManager.getInterner().intern(built.get());
        return new ParsedFormula(text, token, formula);
    }

    /**
     * Parse text that must yield a formula.
     *
     * @throws DcecParseException when the text is malformed, empty, untypeable or invalid
     */
    public Formula parseFormula(String text) {
        return parse(text)
                .map(ParsedFormula::getFormula)
                .orElseThrow(() -> new DcecParseException("No formula could be built", text));
    }

    public List<Formula> parseAll(List<String> texts) {
        List<Formula> formulas = new ArrayList<>(texts.size());
        for (String text : texts) {
            formulas.add(parseFormula(text));
        }
        return formulas;
    }

    public Namespace getNamespace() {
        return namespace;
    }
}
