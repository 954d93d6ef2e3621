package org.iceforge.pgpulse.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Result of {@link SqlValidator#validate(String)}. Warnings never make a statement invalid. */
public record SqlValidation(
        @JsonProperty("isValid") boolean isValid,
        List<String> errors,
        List<String> warnings
) {
    public SqlValidation {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
