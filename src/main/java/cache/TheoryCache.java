package cache;

import com.microsoft.z3.BoolExpr;
import kb.KnowledgeBase;
import model.Fact;
import solver.SolverContext;
import solver.TermPrinter;
import utils.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rendered form of a knowledge base: fact sentences and pretty-printed
 * axioms. Built once in a throwaway context and reused until invalidated.
 */
public class TheoryCache {

    private final KnowledgeBase knowledgeBase;
    private final Object lock = new Object();

    private volatile CachedTheory cached;

    // statistics
    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);

    public TheoryCache(KnowledgeBase knowledgeBase) {
        this.knowledgeBase = knowledgeBase;
    }

    public List<String> getFactSentences() {
        return theory().getFactSentences();
    }

    public List<String> getAxioms() {
        return theory().getAxioms();
    }

    private CachedTheory theory() {
        CachedTheory current = cached;
        if (current != null) {
            hitCount.incrementAndGet();
            return current;
        }
        synchronized (lock) {
            if (cached == null) {
                missCount.incrementAndGet();
                cached = build();
            } else {
                hitCount.incrementAndGet();
            }
            return cached;
        }
    }

    private CachedTheory build() {
        long start = System.currentTimeMillis();
        try (SolverContext solver = new SolverContext()) {
            List<Fact> facts = knowledgeBase.generateFacts(solver);
            List<String> sentences = solver.factsAsNaturalLanguage(facts);
            List<String> axioms = new ArrayList<>();
            for (BoolExpr axiom : solver.generateAllAxioms(facts)) {
                axioms.add(TermPrinter.print(solver, axiom));
            }
            Log.printTime("Rendered " + sentences.size() + " facts and " + axioms.size() + " axioms", start);
            return new CachedTheory(sentences, axioms);
        }
    }

    /**
     * Drops the rendered theory; the next request rebuilds it.
     */
    public void invalidate() {
        synchronized (lock) {
            cached = null;
        }
        Log.info("TheoryCache invalidated");
    }

    public long getHitCount() {
        return hitCount.get();
    }

    public long getMissCount() {
        return missCount.get();
    }

    public String getCacheStats() {
        long hits = hitCount.get();
        long misses = missCount.get();
        long total = hits + misses;
        double hitRate = total > 0 ? (double) hits / total * 100 : 0;
        return String.format("TheoryCache[cached=%b, hits=%d, misses=%d, hitRate=%.2f%%]",
                cached != null, hits, misses, hitRate);
    }

    private static class CachedTheory {
        private final List<String> factSentences;
        private final List<String> axioms;

        CachedTheory(List<String> factSentences, List<String> axioms) {
            this.factSentences = Collections.unmodifiableList(factSentences);
            this.axioms = Collections.unmodifiableList(axioms);
        }

        List<String> getFactSentences() {
            return factSentences;
        }

        List<String> getAxioms() {
            return axioms;
        }
    }
}
