package org.broadinstitute.signatures.tools.signatures;

import htsjdk.samtools.util.Locatable;
import org.broadinstitute.signatures.utils.Utils;

import java.util.Objects;

/**
 * A single variant record from a Mutation Annotation Format (MAF) file.
 *
 * Coordinates are 1-based and inclusive. {@code hugoSymbol} is {@code null} when the source did not have it.
 */
public final class MafVariant implements Locatable {

    public static final String SNP_VARIANT_TYPE = "SNP";

    private final String sampleId;
    private final String contig;
    private final int start;
    private final int end;
    private final String referenceAllele;
    private final String alternateAllele;
    private final String variantType;
    private final String variantClassification;
    private final String hugoSymbol;

    public MafVariant(final String sampleId, final String contig, final int start, final int end,
                      final String referenceAllele, final String alternateAllele,
                      final String variantType, final String variantClassification, final String hugoSymbol) {
        this.sampleId = Utils.nonNull(sampleId, "sample id cannot be null");
        this.contig = Utils.nonNull(contig, "contig cannot be null");
        Utils.validateArg(start > 0 && end >= start, () -> "invalid variant coordinates " + contig + ":" + start + "-" + end);
        this.start = start;
        this.end = end;
        this.referenceAllele = Utils.nonNull(referenceAllele, "reference allele cannot be null");
        this.alternateAllele = Utils.nonNull(alternateAllele, "alternate allele cannot be null");
        this.variantType = Utils.nonNull(variantType, "variant type cannot be null");
        this.variantClassification = Utils.nonNull(variantClassification, "variant classification cannot be null");
        this.hugoSymbol = hugoSymbol;
    }

    /**
     * Single nucleotide variant on point coordinates, as used in tests and in-memory pipelines.
     */
    public static MafVariant snv(final String sampleId, final String contig, final int position,
                                 final char referenceAllele, final char alternateAllele, final String variantClassification) {
        return new MafVariant(sampleId, contig, position, position, String.valueOf(referenceAllele), String.valueOf(alternateAllele),
                SNP_VARIANT_TYPE, variantClassification, null);
    }

    /**
     * @return a copy of this variant on another contig.
     */
    public MafVariant withContig(final String newContig) {
        return new MafVariant(sampleId, newContig, start, end, referenceAllele, alternateAllele, variantType, variantClassification, hugoSymbol);
    }

    /**
     * @return true if this is a SNP whose reference and alternate alleles are single bases.
     */
    public boolean isSnv() {
        return SNP_VARIANT_TYPE.equals(variantType) && referenceAllele.length() == 1 && alternateAllele.length() == 1;
    }

    public String getSampleId() {
        return sampleId;
    }

    @Override
    public String getContig() {
        return contig;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return end;
    }

    public String getReferenceAllele() {
        return referenceAllele;
    }

    public String getAlternateAllele() {
        return alternateAllele;
    }

    public String getVariantType() {
        return variantType;
    }

    public String getVariantClassification() {
        return variantClassification;
    }

    public String getHugoSymbol() {
        return hugoSymbol;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final MafVariant that = (MafVariant) o;
        return start == that.start && end == that.end
                && sampleId.equals(that.sampleId)
                && contig.equals(that.contig)
                && referenceAllele.equals(that.referenceAllele)
                && alternateAllele.equals(that.alternateAllele)
                && variantType.equals(that.variantType)
                && variantClassification.equals(that.variantClassification)
                && Objects.equals(hugoSymbol, that.hugoSymbol);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sampleId, contig, start, end, referenceAllele, alternateAllele, variantType, variantClassification, hugoSymbol);
    }

    @Override
    public String toString() {
        return sampleId + " " + contig + ":" + start + (end != start ? "-" + end : "") + " " + referenceAllele + ">" + alternateAllele;
    }
}
