package dumb.calculi;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.calculi.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static dumb.calculi.util.Log.message;
import static dumb.calculi.util.Log.warning;

/**
 * Algorithm switches and search bounds, fixed when a system or solver is built.
 *
 * @param fastClosure           close a branch on a formula and its negation (or opposite index) instead of
 *                              checking every pair of nodes against the closure rules
 * @param fastAxiomCheck        recognize only identity axioms without context
 * @param tableauMaxDepth       deepest branch the tableau solver may grow
 * @param sequentMaxDepth       deepest reduction the sequent reducer may attempt
 * @param smartWeakening        let the sequent reducer reach premises and identities by weakening alone
 * @param maxApparitionsPerSide cap on repeated occurrences of a formula per side while reducing, null for none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Configuration(
        @JsonProperty("fastClosure") boolean fastClosure,
        @JsonProperty("fastAxiomCheck") boolean fastAxiomCheck,
        @JsonProperty("tableauMaxDepth") int tableauMaxDepth,
        @JsonProperty("sequentMaxDepth") int sequentMaxDepth,
        @JsonProperty("smartWeakening") boolean smartWeakening,
        @JsonProperty("maxApparitionsPerSide") @Nullable Integer maxApparitionsPerSide
) {
    public static final String RESOURCE = "/calculi.json";
    public static final boolean DEFAULT_FAST_CLOSURE = true;
    public static final boolean DEFAULT_FAST_AXIOM_CHECK = true;
    public static final int DEFAULT_TABLEAU_MAX_DEPTH = 100;
    public static final int DEFAULT_SEQUENT_MAX_DEPTH = 100;
    public static final boolean DEFAULT_SMART_WEAKENING = false;

    @JsonCreator
    public Configuration(
            @JsonProperty("fastClosure") Boolean fastClosure,
            @JsonProperty("fastAxiomCheck") Boolean fastAxiomCheck,
            @JsonProperty("tableauMaxDepth") Integer tableauMaxDepth,
            @JsonProperty("sequentMaxDepth") Integer sequentMaxDepth,
            @JsonProperty("smartWeakening") Boolean smartWeakening,
            @JsonProperty("maxApparitionsPerSide") @Nullable Integer maxApparitionsPerSide
    ) {
        this(
                fastClosure != null ? fastClosure : DEFAULT_FAST_CLOSURE,
                fastAxiomCheck != null ? fastAxiomCheck : DEFAULT_FAST_AXIOM_CHECK,
                tableauMaxDepth != null ? tableauMaxDepth : DEFAULT_TABLEAU_MAX_DEPTH,
                sequentMaxDepth != null ? sequentMaxDepth : DEFAULT_SEQUENT_MAX_DEPTH,
                smartWeakening != null ? smartWeakening : DEFAULT_SMART_WEAKENING,
                maxApparitionsPerSide
        );
    }

    public Configuration {
        if (tableauMaxDepth < 1)
            throw new IllegalArgumentException("tableauMaxDepth must be positive");
        if (sequentMaxDepth < 0)
            throw new IllegalArgumentException("sequentMaxDepth must not be negative");
        if (maxApparitionsPerSide != null && maxApparitionsPerSide < 1)
            throw new IllegalArgumentException("maxApparitionsPerSide must be positive");
    }

    public Configuration() {
        this(DEFAULT_FAST_CLOSURE, DEFAULT_FAST_AXIOM_CHECK, DEFAULT_TABLEAU_MAX_DEPTH, DEFAULT_SEQUENT_MAX_DEPTH,
                DEFAULT_SMART_WEAKENING, null);
    }

    public static Configuration defaults() {
        return new Configuration();
    }

    public static Configuration fromJson(String json) throws JsonProcessingException {
        return Json.obj(json, Configuration.class);
    }

    public static Configuration load(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    /** Reads {@value #RESOURCE} from the classpath, or returns the defaults when it is absent or broken. */
    public static Configuration load() {
        try (InputStream in = Configuration.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                message("No " + RESOURCE + " on the classpath, using default configuration");
                return defaults();
            }
            return fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            warning("Could not read " + RESOURCE + ", using default configuration: " + e.getMessage());
            return defaults();
        }
    }

    public Configuration withFastClosure(boolean fast) {
        return new Configuration(fast, fastAxiomCheck, tableauMaxDepth, sequentMaxDepth, smartWeakening, maxApparitionsPerSide);
    }

    public Configuration withFastAxiomCheck(boolean fast) {
        return new Configuration(fastClosure, fast, tableauMaxDepth, sequentMaxDepth, smartWeakening, maxApparitionsPerSide);
    }

    public Configuration withTableauMaxDepth(int depth) {
        return new Configuration(fastClosure, fastAxiomCheck, depth, sequentMaxDepth, smartWeakening, maxApparitionsPerSide);
    }

    public Configuration withSequentMaxDepth(int depth) {
        return new Configuration(fastClosure, fastAxiomCheck, tableauMaxDepth, depth, smartWeakening, maxApparitionsPerSide);
    }

    public Configuration withSmartWeakening(boolean smart) {
        return new Configuration(fastClosure, fastAxiomCheck, tableauMaxDepth, sequentMaxDepth, smart, maxApparitionsPerSide);
    }

    public Configuration withMaxApparitionsPerSide(@Nullable Integer max) {
        return new Configuration(fastClosure, fastAxiomCheck, tableauMaxDepth, sequentMaxDepth, smartWeakening, max);
    }

    public String toJson() {
        return Json.str(this);
    }
}
