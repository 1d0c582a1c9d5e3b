package com.example.pdfstamp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request body of {@code POST /generate-merged-pdf}.
 *
 * <pre>
 * {
 *   "template_names": ["contract", "annex"],
 *   "context": {
 *     "customer_name": "Acme",
 *     "customer_nipt": "K123",
 *     "items": [ { "name": "Widget", "qty": 1, "price": "10", "total": "10" } ],
 *     "total": "10"
 *   }
 * }
 * </pre>
 *
 * {@code templateNames} is deliberately untyped so a non-list value can be
 * rejected with a client error instead of a deserialization failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContractGenerationRequest {

    @JsonProperty("template_names")
    private Object templateNames;

    private Map<String, Object> context;

    /**
     * Template names in output order, or null when the field is missing or not a list of strings.
     */
    public List<String> templateNameList() {
        if (!(templateNames instanceof List)) {
            return null;
        }
        List<?> raw = (List<?>) templateNames;
        for (Object name : raw) {
            if (!(name instanceof String)) {
                return null;
            }
        }
        @SuppressWarnings("unchecked")
        List<String> names = (List<String>) raw;
        return names;
    }
}
