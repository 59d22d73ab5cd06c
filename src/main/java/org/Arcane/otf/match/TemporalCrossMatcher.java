package org.Arcane.otf.match;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Arcane.core.time.TimeSeries;
import org.Arcane.otf.OtfPipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Injective, threshold-bounded nearest-time matcher between reference-pointing and dataset times.
 *
 * <p>A reference time {@code r} is accepted when exactly one dataset time {@code d}
 * satisfies {@code |r - d| < threshold}. More than one candidate, or two reference
 * times sharing one dataset time, aborts the match with {@code NON_INJECTIVE_MATCH}.
 * Reference times without a candidate are dropped.</p>
 *
 * <p>Both inputs are sorted and deduplicated, then restricted to their overlapping
 * span widened by the threshold. Candidate counting uses a binary-searched window
 * over the sorted dataset times with an exact {@code |r - d| < threshold} check on
 * every element, so ties inside the threshold are always counted.</p>
 */
public final class TemporalCrossMatcher {
    public static final double DEFAULT_THRESHOLD = 0.001d;

    private final Logger log;

    public TemporalCrossMatcher() {
        this(LoggerFactory.getLogger(TemporalCrossMatcher.class));
    }

    public TemporalCrossMatcher(Logger log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Cross-matches {@code reference} against {@code dataset}.
     *
     * @param reference reference-pointing times.
     * @param dataset dataset integration times, same epoch as {@code reference}.
     * @param threshold strict matching threshold, finite and positive.
     * @return accepted reference times in ascending order with their matched dataset times;
     * empty when nothing matched.
     * @throws OtfPipelineException {@code INVALID_SELECTION} for a bad threshold or mixed epochs,
     *                              {@code NON_INJECTIVE_MATCH} for any ambiguous correspondence.
     */
    public CrossMatchResult match(TimeSeries reference, TimeSeries dataset, double threshold) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(dataset, "dataset");
        if (!Double.isFinite(threshold) || threshold <= 0.0d) {
            throw new OtfPipelineException(OtfPipelineException.INVALID_SELECTION,
                    "Cross-match threshold must be finite and > 0, got " + threshold);
        }
        if (reference.epoch() != dataset.epoch()) {
            throw new OtfPipelineException(OtfPipelineException.INVALID_SELECTION,
                    "Cross-match inputs must share one epoch, got " + reference.epoch() + " and " + dataset.epoch());
        }

        double[] refs = reference.unique().toArray();
        double[] data = dataset.unique().toArray();
        if (refs.length == 0 || data.length == 0) {
            log.warn("Cross-match input is empty (reference={}, dataset={})", refs.length, data.length);
            return empty(reference);
        }

        double low = Math.max(refs[0], data[0]) - threshold;
        double high = Math.min(refs[refs.length - 1], data[data.length - 1]) + threshold;
        refs = restrict(refs, low, high);
        data = restrict(data, low, high);
        log.debug("Cross-match prefilter [{}, {}] kept {} reference and {} dataset times",
                low, high, refs.length, data.length);

        DoubleArrayList matchedReference = new DoubleArrayList();
        DoubleArrayList matchedDataset = new DoubleArrayList();
        Int2DoubleOpenHashMap claimedBy = new Int2DoubleOpenHashMap();

        for (double r : refs) {
            IntArrayList candidates = candidates(r, data, threshold);
            if (candidates.size() > 1) {
                throw new OtfPipelineException(OtfPipelineException.NON_INJECTIVE_MATCH,
                        "Reference time " + r + " has " + candidates.size() + " dataset times within "
                                + threshold + ": " + describe(data, candidates)
                                + "; narrow the threshold or check the input alignment");
            }
            if (candidates.isEmpty()) {
                continue;
            }
            int index = candidates.getInt(0);
            if (claimedBy.containsKey(index)) {
                throw new OtfPipelineException(OtfPipelineException.NON_INJECTIVE_MATCH,
                        "Reference times " + claimedBy.get(index) + " and " + r
                                + " both match dataset time " + data[index] + " within " + threshold);
            }
            claimedBy.put(index, r);
            matchedReference.add(r);
            matchedDataset.add(data[index]);
        }

        log.info("Cross-matched {} of {} reference times against {} dataset times (threshold {})",
                matchedReference.size(), refs.length, data.length, threshold);
        return new CrossMatchResult(
                TimeSeries.of(reference.epoch(), matchedReference.toDoubleArray()),
                TimeSeries.of(reference.epoch(), matchedDataset.toDoubleArray()));
    }

    private static CrossMatchResult empty(TimeSeries reference) {
        return new CrossMatchResult(TimeSeries.empty(reference.epoch()), TimeSeries.empty(reference.epoch()));
    }

    /**
     * Indices of sorted {@code data} strictly within {@code threshold} of {@code r}.
     */
    static IntArrayList candidates(double r, double[] data, double threshold) {
        int start = lowerBound(data, r - threshold);
        while (start > 0 && Math.abs(r - data[start - 1]) < threshold) {
            start--;
        }
        IntArrayList found = new IntArrayList(2);
        for (int i = start; i < data.length && data[i] - r < threshold; i++) {
            if (Math.abs(r - data[i]) < threshold) {
                found.add(i);
            }
        }
        return found;
    }

    /**
     * First index whose value is {@code >= key}; {@code sorted.length} when none.
     */
    static int lowerBound(double[] sorted, double key) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < key) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private static double[] restrict(double[] sorted, double low, double high) {
        int from = lowerBound(sorted, low);
        int to = from;
        while (to < sorted.length && sorted[to] <= high) {
            to++;
        }
        return Arrays.copyOfRange(sorted, from, to);
    }

    private static String describe(double[] data, IntArrayList indices) {
        StringBuilder text = new StringBuilder("[");
        for (int i = 0; i < indices.size(); i++) {
            if (i > 0) {
                text.append(", ");
            }
            text.append(data[indices.getInt(i)]);
        }
        return text.append(']').toString();
    }
}
