package org.dxworks.mathframe.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable mapping from command name to the glyph it stands for.
 * <p>
 * Greek letters follow the capitalization of the command name
 * ({@code \Sigma} vs {@code \sigma}). Spacing commands map to blank or empty strings.
 */
public final class SymbolTable {

    private final Map<String, String> symbols;

    public SymbolTable(Map<String, String> symbols) {
        Objects.requireNonNull(symbols, "symbols");
        this.symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
    }

    /**
     * The built-in table, created on first use and shared afterwards.
     */
    public static SymbolTable standard() {
        return StandardHolder.INSTANCE;
    }

    public Optional<String> lookup(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    public int size() {
        return symbols.size();
    }

    private static final class StandardHolder {
        private static final SymbolTable INSTANCE = new SymbolTable(buildStandardSymbols());
    }

    private static Map<String, String> buildStandardSymbols() {
        Map<String, String> map = new LinkedHashMap<>();

        map.put("Alpha", "Α");
        map.put("Beta", "Β");
        map.put("Gamma", "Γ");
        map.put("Delta", "Δ");
        map.put("Epsilon", "Ε");
        map.put("Zeta", "Ζ");
        map.put("Eta", "Η");
        map.put("Theta", "Θ");
        map.put("Lambda", "Λ");
        map.put("Xi", "Ξ");
        map.put("Pi", "Π");
        map.put("Sigma", "Σ");
        map.put("Phi", "Φ");
        map.put("Psi", "Ψ");
        map.put("Omega", "Ω");

        map.put("alpha", "α");
        map.put("beta", "β");
        map.put("gamma", "γ");
        map.put("delta", "δ");
        map.put("epsilon", "ε");
        map.put("zeta", "ζ");
        map.put("eta", "η");
        map.put("theta", "θ");
        map.put("lambda", "λ");
        map.put("xi", "ξ");
        map.put("pi", "π");
        map.put("sigma", "σ");
        map.put("phi", "φ");
        map.put("psi", "ψ");
        map.put("omega", "ω");

        map.put("infty", "∞");
        map.put("approx", "≈");
        map.put("neq", "≠");
        map.put("le", "≤");
        map.put("ge", "≥");
        map.put("pm", "±");
        map.put("cdot", "∙");
        map.put("to", "→");

        map.put("thinspace", " ");
        map.put("quad", "  ");
        map.put("!", "");
        map.put(",", "");
        map.put("'", "'");
        return map;
    }
}
