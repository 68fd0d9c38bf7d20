package cache;

import kb.KnowledgeBase;
import kb.PatientRecord;
import model.Fact;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TheoryCacheTest {

    private final AtomicInteger builds = new AtomicInteger();
    private final PatientRecord record = new PatientRecord(-7305 + 72 * 365);
    private final KnowledgeBase counting = solver -> {
        builds.incrementAndGet();
        List<Fact> facts = record.generateFacts(solver);
        return facts;
    };

    @Test
    void rendersOnceUntilInvalidated() {
        TheoryCache cache = new TheoryCache(counting);
        List<String> sentences = cache.getFactSentences();
        assertSame(sentences, cache.getFactSentences());
        cache.getAxioms();
        assertEquals(1, builds.get());
        assertEquals(1, cache.getMissCount());
        assertEquals(2, cache.getHitCount());

        cache.invalidate();
        cache.getAxioms();
        assertEquals(2, builds.get());
        assertEquals(2, cache.getMissCount());
        assertTrue(cache.getCacheStats().startsWith("TheoryCache[cached=true"));
    }

    @Test
    void rendersFactsAndAxioms() {
        TheoryCache cache = new TheoryCache(counting);
        assertTrue(cache.getFactSentences().contains("The patient's name is Joe Bloggs"));
        assertTrue(cache.getAxioms().contains("(fp= age 72.0)"));
        assertTrue(cache.getAxioms().contains("(= name \"Joe Bloggs\")"));
    }
}
