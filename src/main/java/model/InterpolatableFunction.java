package model;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import solver.SolverContext;
import utils.EpochalDays;
import utils.Log;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * F(discriminator, time) -> TFU where the most recent recorded value persists
 * until a later fact supersedes it, and is unknown before the first one.
 */
public class InterpolatableFunction extends Function {

    private static final int DISCRIMINATOR = 0;
    private static final int TIME = 1;

    private final String phrase;

    /**
     * @param phrase verb phrase of the sentence, e.g. "diagnosed as"
     */
    public InterpolatableFunction(SolverContext solver, String name, String phrase, Argument discriminator) {
        super(solver, name, ValueSort.TFU, null,
                Arrays.asList(discriminator, new Argument(TimeSeriesFunction.TIME_ARG, ValueSort.INTEGER)));
        this.phrase = phrase;
    }

    @Override
    public FunctionKind getKind() {
        return FunctionKind.INTERPOLATABLE;
    }

    @Override
    public String asNaturalLanguage(Fact fact) {
        String negation = Tfu.of(fact.getResult()) == Tfu.FALSE ? "not " : "";
        return SUBJECT + " was " + phrase + " " + negation + "having " + fact.getArg(DISCRIMINATOR)
                + " on " + EpochalDays.toDateString(((Number) fact.getArg(TIME)).longValue());
    }

    /**
     * Values come from the range axioms only.
     */
    @Override
    public List<BoolExpr> generateCoreAxioms(List<Fact> facts) {
        return Collections.emptyList();
    }

    public Map<String, Timeline> timelines(List<Fact> facts) {
        Map<String, List<Fact>> byDiscriminator = new TreeMap<>();
        for (Fact fact : relevantFacts(facts)) {
            byDiscriminator.computeIfAbsent(String.valueOf(fact.getArg(DISCRIMINATOR)), k -> new ArrayList<>()).add(fact);
        }
        Map<String, Timeline> timelines = new TreeMap<>();
        for (Map.Entry<String, List<Fact>> entry : byDiscriminator.entrySet()) {
            Object discriminator = entry.getValue().get(0).getArg(DISCRIMINATOR);
            timelines.put(entry.getKey(), Timeline.build(discriminator, entry.getValue(), TIME));
        }
        return timelines;
    }

    /**
     * Per discriminator d0 and outcome X:
     * forall d, time . d = d0 => ((time in ranges of X) = (F(d, time) = X)),
     * plus unknown everywhere for discriminators with no facts.
     */
    @Override
    public List<BoolExpr> generateCwaAxioms(List<Fact> facts) {
        Argument discArg = getArgs().get(DISCRIMINATOR);
        Expr d = solver.mkVar(discArg.getName(), discArg.getSort());
        Expr time = solver.mkVar(TimeSeriesFunction.TIME_ARG, ValueSort.INTEGER);
        Expr[] bound = {d, time};
        Expr application = solver.apply(this, d, time);

        List<BoolExpr> axioms = new ArrayList<>();
        List<BoolExpr> observed = new ArrayList<>();
        for (Timeline timeline : timelines(facts).values()) {
            Log.debug(getName() + " " + timeline.getDiscriminator() + " ranges: " + timeline.getRanges());
            BoolExpr isThis = solver.eq(d, solver.convertLiteral(timeline.getDiscriminator(), discArg.getSort()));
            observed.add(isThis);
            for (Tfu outcome : new Tfu[]{Tfu.UNKNOWN, Tfu.TRUE, Tfu.FALSE}) {
                List<BoolExpr> disjuncts = new ArrayList<>();
                for (Timeline.Range range : timeline.rangesFor(outcome)) {
                    disjuncts.add(rangeTerm(time, range));
                }
                BoolExpr body = solver.implies(isThis,
                        solver.eq(solver.or(disjuncts), solver.eq(application, solver.tfu(outcome))));
                axioms.add(solver.forall(bound, body, application));
            }
        }
        BoolExpr unobserved = solver.implies(solver.not(solver.or(observed)),
                solver.eq(application, solver.tfu(Tfu.UNKNOWN)));
        axioms.add(solver.forall(bound, unobserved, application));
        return axioms;
    }

    private BoolExpr rangeTerm(Expr time, Timeline.Range range) {
        if (range.getStart() == null) {
            return solver.lt(time, solver.mkInt(range.getEnd()));
        }
        if (range.getEnd() == null) {
            return solver.geq(time, solver.mkInt(range.getStart()));
        }
        return solver.and(solver.geq(time, solver.mkInt(range.getStart())),
                solver.lt(time, solver.mkInt(range.getEnd())));
    }

    public String getPhrase() {
        return phrase;
    }
}
