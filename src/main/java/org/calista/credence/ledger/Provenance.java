package org.calista.credence.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Who produced an entry and how.
 *
 * @param source free-form origin (file, tool, pipeline stage)
 * @param method how it was obtained (ast_parse, llm_synthesis, user_input, ...)
 * @param agent  acting component or person; exported as a PROV agent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Provenance(String source, String method, String agent) {

    public static final Provenance NONE = new Provenance(null, null, null);

    public static Provenance of(String source, String method, String agent) {
        return new Provenance(blankToNull(source), blankToNull(method), blankToNull(agent));
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}
