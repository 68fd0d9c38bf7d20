package kb;

import model.Argument;
import model.Fact;
import model.InterpolatableFunction;
import model.ScalarFunction;
import model.Tfu;
import model.TimeSeriesFunction;
import model.Units;
import model.ValueSort;
import solver.SolverContext;
import utils.EpochalDays;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Synthetic record of a single patient: demographics, two vital-sign series
 * and a diagnosis history.
 */
public class PatientRecord implements KnowledgeBase {

    public static final String NAME = "Joe Bloggs";
    public static final String BIRTH_DATE = "1950-01-01";
    public static final String DIAGNOSIS = "D";
    public static final String TYPE_2_DIABETES = "E11";

    public static final Units EPOCHAL_DAYS = new Units("Unix epochal day", "Unix epochal days");

    private final int today;

    public PatientRecord() {
        this(EpochalDays.today());
    }

    /**
     * @param today epochal day the age is computed against
     */
    public PatientRecord(int today) {
        this.today = today;
    }

    @Override
    public List<Fact> generateFacts(SolverContext solver) {
        List<Fact> facts = new ArrayList<>();
        List<Argument> byTime = Collections.singletonList(new Argument(TimeSeriesFunction.TIME_ARG, ValueSort.INTEGER));

        ScalarFunction name = new ScalarFunction(solver, "name", ValueSort.STRING, null);
        facts.add(new Fact(name, NAME));

        int birth = EpochalDays.toEpochal(BIRTH_DATE);
        ScalarFunction birthDate = new ScalarFunction(solver, "birth-date", ValueSort.INTEGER, EPOCHAL_DAYS);
        facts.add(new Fact(birthDate, birth));

        ScalarFunction age = new ScalarFunction(solver, "age", ValueSort.FP64, new Units("year", "years"));
        facts.add(new Fact(age, (today - birth) / 365.0));

        int firstVisit = EpochalDays.toEpochal("2005-02-01");
        int secondVisit = EpochalDays.toEpochal("2006-02-01");

        TimeSeriesFunction heartRate = new TimeSeriesFunction(solver, "heart-rate", ValueSort.FP64,
                new Units("beat/sec", "beats/sec"), byTime);
        facts.add(new Fact(heartRate, 55.0, firstVisit));
        facts.add(new Fact(heartRate, 60.0, secondVisit));

        TimeSeriesFunction weight = new TimeSeriesFunction(solver, "weight", ValueSort.FP64,
                new Units("pound", "pounds"), byTime);
        facts.add(new Fact(weight, 150.0, firstVisit));
        facts.add(new Fact(weight, 155.0, secondVisit));

        InterpolatableFunction diagnosis = new InterpolatableFunction(solver, DIAGNOSIS, "diagnosed as",
                new Argument("icd", ValueSort.STRING));
        facts.add(new Fact(diagnosis, Tfu.TRUE, TYPE_2_DIABETES, secondVisit));
        facts.add(new Fact(diagnosis, Tfu.FALSE, TYPE_2_DIABETES, EpochalDays.toEpochal("2006-03-01")));
        facts.add(new Fact(diagnosis, Tfu.TRUE, TYPE_2_DIABETES, EpochalDays.toEpochal("2006-04-01")));
        return facts;
    }

    public int getToday() {
        return today;
    }
}
