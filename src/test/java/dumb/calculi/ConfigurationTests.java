package dumb.calculi;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigurationTests {

    @Test
    void missingFieldsTakeDefaults() throws JsonProcessingException {
        var c = Configuration.fromJson("{\"tableauMaxDepth\": 7}");
        assertEquals(7, c.tableauMaxDepth());
        assertEquals(Configuration.DEFAULT_SEQUENT_MAX_DEPTH, c.sequentMaxDepth());
        assertTrue(c.fastClosure());
        assertTrue(c.fastAxiomCheck());
        assertFalse(c.smartWeakening());
        assertNull(c.maxApparitionsPerSide());
    }

    @Test
    void jsonRoundTrip() throws JsonProcessingException {
        var c = Configuration.defaults().withFastClosure(false).withMaxApparitionsPerSide(3);
        assertEquals(c, Configuration.fromJson(c.toJson()));
    }

    @Test
    void bundledResourceLoads() {
        assertEquals(Configuration.defaults(), Configuration.load());
    }

    @Test
    void rejectsNonsense() {
        assertThrows(IllegalArgumentException.class, () -> Configuration.defaults().withTableauMaxDepth(0));
        assertThrows(IllegalArgumentException.class, () -> Configuration.defaults().withMaxApparitionsPerSide(0));
        var negative = assertThrows(IllegalArgumentException.class, () -> Configuration.defaults().withSequentMaxDepth(-1));
        assertEquals("sequentMaxDepth must not be negative", negative.getMessage());
    }

    @Test
    void sequentDepthZeroIsAllowed() {
        assertEquals(0, Configuration.defaults().withSequentMaxDepth(0).sequentMaxDepth());
    }
}
