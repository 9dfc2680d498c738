package com.dcec.parsing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A token tree plus the atomic names the notation passes saw, each with the
 * sort its position implies ({@code Boolean} or {@code Numeric}).
 */
public class TokenTreeResult {
    private final ParseToken token;
    private final Map<String, String> atomics;

    public TokenTreeResult(ParseToken token, Map<String, String> atomics) {
        this.token = token;
        this.atomics = Collections.unmodifiableMap(new LinkedHashMap<>(atomics));
    }

    public ParseToken getToken() { return token; }
    public Map<String, String> getAtomics() { return atomics; }

    @Override
    public String toString() {
        return "TokenTreeResult{token=" + token + ", atomics=" + atomics + '}';
    }
}
