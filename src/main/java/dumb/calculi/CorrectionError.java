package dumb.calculi;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.calculi.util.Json;
import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * One problem found while verifying a proof. The locator lists child positions from the root
 * (the root itself being position 0); it is null when the error concerns the proof as a whole.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CorrectionError(
        @JsonProperty("code") ErrorCode code,
        @JsonProperty("category") ErrorCode.Category category,
        @JsonProperty("index") @Nullable List<Integer> index,
        @JsonProperty("description") String description) {

    public CorrectionError {
        requireNonNull(code);
        requireNonNull(category);
        requireNonNull(description);
        if (index != null) index = List.copyOf(index);
    }

    public CorrectionError(ErrorCode code, @Nullable List<Integer> index, String description) {
        this(code, code.category, index, description);
    }

    public String toJson() {
        return Json.str(this);
    }

    @Override
    public String toString() {
        return code + (index != null ? " at " + index : "") + ": " + description;
    }
}
