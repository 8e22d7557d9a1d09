package org.broadinstitute.signatures.utils;

import htsjdk.samtools.util.Locatable;

import java.io.Serializable;

/**
 * Minimal immutable class representing a 1-based closed ended genomic interval
 * SimpleInterval does not allow null contig names.  It cannot represent an unmapped Locatable.
 */
public final class SimpleInterval implements Locatable, Serializable {
    private static final long serialVersionUID = 1L;
    public static final char CONTIG_SEPARATOR = ':';
    public static final char START_END_SEPARATOR = '-';

    private final int start;
    private final int end;
    private final String contig;

    /**
     * Create a new immutable 1-based interval of the form [start, end]
     * @param contig the name of the contig, must not be null
     * @param start  1-based inclusive start position
     * @param end  1-based inclusive end position
     */
    public SimpleInterval(final String contig, final int start, final int end){
        validatePositions(contig, start, end);
        this.contig = contig;
        this.start = start;
        this.end = end;
    }

    /**
     * Create a new SimpleInterval from a {@link Locatable}
     * @param locatable any Locatable
     * @throws IllegalArgumentException if locatable violates any of the SimpleInterval constraints or is null
     */
    public SimpleInterval(final Locatable locatable){
        this(Utils.nonNull(locatable).getContig(),
                locatable.getStart(), locatable.getEnd());
    }

    static void validatePositions(final String contig, final int start, final int end) {
        Utils.validateArg(isValid(contig, start, end), () -> "Invalid interval. Contig:" + contig + " start:"+start + " end:" + end);
    }

    /**
     * Test that these are valid values for constructing a SimpleInterval:
     *    contig cannot be null
     *    start must be greater than 0
     *    end must be greater than or equal to start
     */
    public static boolean isValid(final String contig, final int start, final int end) {
        return contig != null && start > 0 && end >= start;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final SimpleInterval that = (SimpleInterval) o;

        if (end != that.end) return false;
        if (start != that.start) return false;
        return contig.equals(that.contig);
    }

    @Override
    public int hashCode() {
        int result = start;
        result = 31 * result + end;
        result = 31 * result + contig.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return contig + CONTIG_SEPARATOR + start + START_END_SEPARATOR + end;
    }

    @Override
    public String getContig(){
        return contig;
    }

    @Override
    public int getStart(){
        return start;
    }

    @Override
    public int getEnd(){
        return end;
    }

    /**
     * @return number of bases covered by this interval (will always be > 0)
     */
    public int size() {
        return end - start + 1;
    }

    /**
     * Determines whether this interval contains the entire region represented by other
     * (in other words, whether it covers it).
     */
    public boolean contains( final Locatable other ) {
        if ( other == null || other.getContig() == null ) {
            return false;
        }

        return this.contig.equals(other.getContig()) && this.start <= other.getStart() && this.end >= other.getEnd();
    }

    /**
     * Determines whether this interval comes within "margin" of overlapping the provided locatable.
     *
     * @param other interval to check
     * @param margin how many bases may be between the two interval for us to still consider them overlapping; must be non-negative
     * @throws IllegalArgumentException if margin is negative
     */
    public boolean overlapsWithMargin(final Locatable other, final int margin) {
        if ( margin < 0 ) {
            throw new IllegalArgumentException("given margin is negative: " + margin +
                    "\tfor this: " + toString() + "\tand that: " + (other == null ? "other is null" : other.toString()));
        }
        if ( other == null || other.getContig() == null ) {
            return false;
        }

        return this.contig.equals(other.getContig()) && this.start <= other.getEnd() + margin && other.getStart() - margin <= this.end;
    }

    /**
     * Returns a new SimpleInterval that represents the region between the endpoints of this and other.
     *
     * The two intervals do not need to be contiguous
     */
    public SimpleInterval spanWith( final Locatable other ) {
        Utils.nonNull(other);
        Utils.validateArg(this.getContig().equals(other.getContig()), "Cannot get span for intervals on different contigs");
        return new SimpleInterval(contig, Math.min(start, other.getStart()), Math.max(end, other.getEnd()));
    }

    /**
     * Returns a new SimpleInterval that represents this interval as expanded by the specified amount in both
     * directions, bounded by the contig start/stop if necessary.
     *
     * @param padding amount to expand this interval
     * @param contigLength length of this interval's contig
     * @return a new SimpleInterval that represents this interval as expanded by the specified amount in both
     *         directions, bounded by the contig start/stop if necessary.
     */
    public SimpleInterval expandWithinContig( final int padding, final int contigLength ) {
        Utils.validateArg(padding >= 0, "padding must be >= 0");
        Utils.validateArg(contigLength >= end, () -> "contig length " + contigLength + " is shorter than the interval " + this);
        return new SimpleInterval(contig, Math.max(1, start - padding), Math.min(contigLength, end + padding));
    }
}
