package org.broadinstitute.signatures.tools.signatures;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import org.broadinstitute.signatures.utils.Utils;

import java.util.*;

/**
 * Sums classified mutations and their background windows per sample.
 */
public final class SampleAggregator {

    private SampleAggregator() {}

    /**
     * @return one aggregate per sample, sorted by sample id.
     */
    public static List<SampleAggregate> aggregate(final Collection<SubstitutionRecord> records) {
        Utils.nonNull(records);
        final Map<String, Builder> builders = new TreeMap<>();
        for (final SubstitutionRecord record : records) {
            builders.computeIfAbsent(record.getSampleId(), Builder::new).add(record);
        }
        final List<SampleAggregate> result = new ArrayList<>(builders.size());
        builders.values().forEach(b -> result.add(b.build()));
        return result;
    }

    private static final class Builder {
        private final String sampleId;
        private final Multiset<String> substitutions = HashMultiset.create();
        private final Multiset<String> motifs = HashMultiset.create();
        private final Multiset<String> typeMotifs = HashMultiset.create();
        private BackgroundComposition background = BackgroundComposition.EMPTY;

        Builder(final String sampleId) {
            this.sampleId = sampleId;
        }

        void add(final SubstitutionRecord record) {
            substitutions.add(record.getSubstitution());
            motifs.add(record.getSubstitutionMotif());
            typeMotifs.add(record.getSubstitutionTypeMotif());
            background = background.plus(record.getContext().getComposition());
        }

        SampleAggregate build() {
            return new SampleAggregate(sampleId, substitutions, motifs, typeMotifs, background);
        }
    }
}
