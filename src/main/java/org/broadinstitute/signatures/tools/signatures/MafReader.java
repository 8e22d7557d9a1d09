package org.broadinstitute.signatures.tools.signatures;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.signatures.exceptions.UserException;
import org.broadinstitute.signatures.utils.Utils;
import org.broadinstitute.signatures.utils.io.IOUtils;
import org.broadinstitute.signatures.utils.tsv.DataLine;
import org.broadinstitute.signatures.utils.tsv.TableColumnCollection;
import org.broadinstitute.signatures.utils.tsv.TableReader;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads Mutation Annotation Format (MAF) files into {@link MafVariant} records.
 *
 * <p>
 * Lines starting with {@code #} (e.g. "#version 2.4") are skipped. Only the columns in {@link #MANDATORY_COLUMNS}
 * and the optional {@link #HUGO_SYMBOL_COLUMN} are used; any other column is ignored. Files ending with
 * {@code .gz} are decompressed.
 * </p>
 */
public final class MafReader extends TableReader<MafVariant> {
    private static final Logger logger = LogManager.getLogger(MafReader.class);

    public static final String TUMOR_SAMPLE_BARCODE_COLUMN = "Tumor_Sample_Barcode";
    public static final String CHROMOSOME_COLUMN = "Chromosome";
    public static final String START_POSITION_COLUMN = "Start_Position";
    public static final String END_POSITION_COLUMN = "End_Position";
    public static final String REFERENCE_ALLELE_COLUMN = "Reference_Allele";
    public static final String TUMOR_SEQ_ALLELE2_COLUMN = "Tumor_Seq_Allele2";
    public static final String VARIANT_TYPE_COLUMN = "Variant_Type";
    public static final String VARIANT_CLASSIFICATION_COLUMN = "Variant_Classification";
    public static final String HUGO_SYMBOL_COLUMN = "Hugo_Symbol";

    public static final List<String> MANDATORY_COLUMNS = ImmutableList.of(
            TUMOR_SAMPLE_BARCODE_COLUMN, CHROMOSOME_COLUMN, START_POSITION_COLUMN, END_POSITION_COLUMN,
            REFERENCE_ALLELE_COLUMN, TUMOR_SEQ_ALLELE2_COLUMN, VARIANT_TYPE_COLUMN, VARIANT_CLASSIFICATION_COLUMN);

    private boolean hasHugoSymbol;

    public MafReader(final Path path) throws IOException {
        super(path);
    }

    public MafReader(final String sourceName, final Reader reader) throws IOException {
        super(sourceName, reader);
    }

    @Override
    protected void processColumns(final TableColumnCollection columns) {
        final List<String> missing = columns.missing(MANDATORY_COLUMNS);
        if (!missing.isEmpty()) {
            throw formatException("missing mandatory MAF columns: " + String.join(", ", missing));
        }
        hasHugoSymbol = columns.contains(HUGO_SYMBOL_COLUMN);
    }

    @Override
    protected MafVariant createRecord(final DataLine dataLine) {
        final String contig = dataLine.get(CHROMOSOME_COLUMN);
        final int start = dataLine.getInt(START_POSITION_COLUMN);
        final int end = dataLine.getInt(END_POSITION_COLUMN);
        if (start < 1 || end < start) {
            throw formatException(String.format("invalid variant coordinates %s:%d-%d", contig, start, end));
        }
        return new MafVariant(
                dataLine.get(TUMOR_SAMPLE_BARCODE_COLUMN),
                contig,
                start,
                end,
                dataLine.get(REFERENCE_ALLELE_COLUMN),
                dataLine.get(TUMOR_SEQ_ALLELE2_COLUMN),
                dataLine.get(VARIANT_TYPE_COLUMN),
                dataLine.get(VARIANT_CLASSIFICATION_COLUMN),
                hasHugoSymbol ? dataLine.get(HUGO_SYMBOL_COLUMN) : null);
    }

    /**
     * Reads all records of a MAF file.
     */
    public static List<MafVariant> read(final Path path) {
        Utils.nonNull(path);
        IOUtils.assertFileIsReadable(path);
        try (final MafReader reader = new MafReader(path)) {
            final List<MafVariant> variants = reader.toList();
            logger.info(String.format("Read %d variants from %s", variants.size(), path));
            return variants;
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    /**
     * Reads a MAF file and separates the records with a silent classification
     * (see {@link VariantPreparer#SILENT_VARIANT_CLASSIFICATIONS}) from the rest.
     */
    public static Partition readPartitioned(final Path path) {
        return Partition.of(read(path));
    }

    /**
     * The records of a MAF split into non-silent and silent variants, each in input order.
     */
    public static final class Partition {
        private final List<MafVariant> main;
        private final List<MafVariant> silent;

        public Partition(final List<MafVariant> main, final List<MafVariant> silent) {
            this.main = ImmutableList.copyOf(Utils.nonNull(main));
            this.silent = ImmutableList.copyOf(Utils.nonNull(silent));
        }

        public static Partition of(final List<MafVariant> variants) {
            final List<MafVariant> main = new ArrayList<>();
            final List<MafVariant> silent = new ArrayList<>();
            for (final MafVariant variant : variants) {
                if (VariantPreparer.isSilent(variant)) {
                    silent.add(variant);
                } else {
                    main.add(variant);
                }
            }
            return new Partition(main, silent);
        }

        public List<MafVariant> getMain() {
            return main;
        }

        public List<MafVariant> getSilent() {
            return silent;
        }
    }
}
