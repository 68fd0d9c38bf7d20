package model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Piecewise-constant history of one discriminator (e.g. one diagnosis code).
 * Ranges are half-open [start, end), disjoint, and cover every time; a null
 * bound is unbounded.
 */
public class Timeline {

    private final Object discriminator;
    private final List<Range> ranges;

    private Timeline(Object discriminator, List<Range> ranges) {
        this.discriminator = discriminator;
        this.ranges = Collections.unmodifiableList(ranges);
    }

    /**
     * @param facts     facts of one discriminator, any order
     * @param timeIndex position of the time argument
     */
    public static Timeline build(Object discriminator, List<Fact> facts, int timeIndex) {
        if (facts.isEmpty()) {
            throw new IllegalArgumentException("No facts for " + discriminator);
        }
        TreeMap<Long, Tfu> byTime = new TreeMap<>();
        for (Fact fact : facts) {
            long time = ((Number) fact.getArg(timeIndex)).longValue();
            Tfu value = Tfu.of(fact.getResult());
            if (value == Tfu.UNKNOWN) {
                throw new UnsupportedSemanticsException("Explicit unknown result for " + discriminator
                        + " at time " + time + " is not supported");
            }
            Tfu previous = byTime.put(time, value);
            if (previous != null && previous != value) {
                throw new UnsupportedSemanticsException("Conflicting results for " + discriminator
                        + " at time " + time + ": " + previous + " and " + value);
            }
        }

        List<Range> ranges = new ArrayList<>();
        ranges.add(new Range(null, byTime.firstKey(), Tfu.UNKNOWN));
        Map.Entry<Long, Tfu> current = byTime.firstEntry();
        Map.Entry<Long, Tfu> next = byTime.higherEntry(current.getKey());
        while (next != null) {
            ranges.add(new Range(current.getKey(), next.getKey(), current.getValue()));
            current = next;
            next = byTime.higherEntry(current.getKey());
        }
        ranges.add(new Range(current.getKey(), null, current.getValue()));
        return new Timeline(discriminator, ranges);
    }

    public Object getDiscriminator() {
        return discriminator;
    }

    public List<Range> getRanges() {
        return ranges;
    }

    public List<Range> rangesFor(Tfu value) {
        List<Range> result = new ArrayList<>();
        for (Range range : ranges) {
            if (range.getValue() == value) {
                result.add(range);
            }
        }
        return result;
    }

    public Tfu valueAt(long time) {
        for (Range range : ranges) {
            if (range.contains(time)) {
                return range.getValue();
            }
        }
        throw new IllegalStateException("Ranges of " + discriminator + " do not cover " + time);
    }

    public static class Range {
        private final Long start;
        private final Long end;
        private final Tfu value;

        public Range(Long start, Long end, Tfu value) {
            this.start = start;
            this.end = end;
            this.value = value;
        }

        /** Inclusive, null when unbounded below. */
        public Long getStart() {
            return start;
        }

        /** Exclusive, null when unbounded above. */
        public Long getEnd() {
            return end;
        }

        public Tfu getValue() {
            return value;
        }

        public boolean contains(long time) {
            return (start == null || time >= start) && (end == null || time < end);
        }

        @Override
        public String toString() {
            return "[" + (start == null ? "-inf" : start) + ", " + (end == null ? "+inf" : end) + ") -> " + value;
        }
    }
}
