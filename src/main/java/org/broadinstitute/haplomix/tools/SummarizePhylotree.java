package org.broadinstitute.haplomix.tools;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.haplomix.cmdline.CommandLineProgram;
import org.broadinstitute.haplomix.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.haplomix.cmdline.programgroups.HaplogroupAnalysisProgramGroup;
import org.broadinstitute.haplomix.exceptions.UserException;
import org.broadinstitute.haplomix.phylotree.PhyloVariant;
import org.broadinstitute.haplomix.phylotree.Phylotree;
import org.broadinstitute.haplomix.phylotree.PhylotreeReader;
import org.broadinstitute.haplomix.utils.tsv.SimpleXSVWriter;
import org.broadinstitute.haplomix.utils.tsv.TableUtils;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads a phylogenetic lineage tree and writes, for each haplogroup, the variants that define it including the ones
 * inherited from its ancestors. A change at a position masks any change at the same position farther up the tree.
 *
 * <p>Unreliable sites can be removed everywhere in the tree: sites marked unstable (variant wrapped in parentheses)
 * with --remove-unstable-sites and sites with a back-mutation (variant followed by {@code !}) with
 * --remove-back-mutations. Indels are always ignored.</p>
 *
 * <h3>Usage example</h3>
 * <pre>
 *     haplomix SummarizePhylotree \
 *          -I phylotree.csv \
 *          -O haplogroups.tsv \
 *          --remove-unstable-sites \
 *          --variant-positions-output positions.tsv
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Reads a leveled comma-separated phylogenetic tree and writes the table of haplogroups with the " +
                "variants that define them, inherited variants included. Optionally writes the retained variant " +
                "positions, the per-position mutation counts and an indented dump of the tree.",
        oneLineSummary = "Writes the defining variants of each haplogroup in a phylogenetic tree",
        programGroup = HaplogroupAnalysisProgramGroup.class
)
public final class SummarizePhylotree extends CommandLineProgram {

    public static final String LEAVES_ONLY_LONG_NAME = "leaves-only";
    public static final String REMOVE_UNSTABLE_LONG_NAME = "remove-unstable-sites";
    public static final String REMOVE_BACK_MUTATIONS_LONG_NAME = "remove-back-mutations";
    public static final String VARIANT_POSITIONS_OUTPUT_LONG_NAME = "variant-positions-output";
    public static final String MUTATION_COUNTS_OUTPUT_LONG_NAME = "mutation-counts-output";
    public static final String TREE_DUMP_OUTPUT_LONG_NAME = "tree-dump-output";

    public static final String HAPLOGROUP_COLUMN = "HAPLOGROUP";
    public static final String VARIANTS_COLUMN = "VARIANTS";
    public static final String POSITION_COLUMN = "POSITION";
    public static final String ALLELE_COLUMN = "ALLELE";
    public static final String COUNT_COLUMN = "COUNT";

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "Phylogenetic tree as leveled comma-separated lines")
    public File inputFile;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Output table of haplogroups and their variants")
    public File outputFile;

    @Argument(fullName = LEAVES_ONLY_LONG_NAME,
            doc = "Only list haplogroups without descendants",
            optional = true)
    public boolean leavesOnly = false;

    @Argument(fullName = REMOVE_UNSTABLE_LONG_NAME,
            doc = "Remove every site that is marked unstable anywhere in the tree",
            optional = true)
    public boolean removeUnstable = false;

    @Argument(fullName = REMOVE_BACK_MUTATIONS_LONG_NAME,
            doc = "Remove every site that has a back-mutation anywhere in the tree",
            optional = true)
    public boolean removeBackMutations = false;

    @Argument(fullName = VARIANT_POSITIONS_OUTPUT_LONG_NAME,
            doc = "Output table of retained variant positions (1-based)",
            optional = true)
    public File variantPositionsFile = null;

    @Argument(fullName = MUTATION_COUNTS_OUTPUT_LONG_NAME,
            doc = "Output table of the number of changes to each derived allele at each position (1-based)",
            optional = true)
    public File mutationCountsFile = null;

    @Argument(fullName = TREE_DUMP_OUTPUT_LONG_NAME,
            doc = "Output file for an indented dump of the tree",
            optional = true)
    public File treeDumpFile = null;

    @Override
    protected Object doWork() {
        final Phylotree tree = PhylotreeReader.read(inputFile.toPath());
        logger.info(String.format("Read %d haplogroups rooted at %s.", tree.size(), tree.getRoot().getHapId()));

        tree.processVariants(removeUnstable, removeBackMutations);
        logger.info(String.format("Retained %d variant positions.", tree.getVariantPositions().size()));

        final Map<String, List<PhyloVariant>> table = tree.haplogroupVariants(leavesOnly);
        writeHaplogroupTable(table, outputFile.toPath());
        logger.info(String.format("Wrote %d haplogroups to %s.", table.size(), outputFile));

        if (variantPositionsFile != null) {
            writeVariantPositions(tree, variantPositionsFile.toPath());
        }
        if (mutationCountsFile != null) {
            writeMutationCounts(tree, mutationCountsFile.toPath());
        }
        if (treeDumpFile != null) {
            writeTreeDump(tree, treeDumpFile.toPath());
        }
        return null;
    }

    private static void writeHaplogroupTable(final Map<String, List<PhyloVariant>> table, final Path path) {
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(path, TableUtils.COLUMN_SEPARATOR)) {
            writer.setHeaderLine(Arrays.asList(HAPLOGROUP_COLUMN, VARIANTS_COLUMN));
            for (final Map.Entry<String, List<PhyloVariant>> entry : table.entrySet()) {
                writer.getNewLineBuilder()
                        .setColumn(HAPLOGROUP_COLUMN, entry.getKey())
                        .setColumn(VARIANTS_COLUMN, entry.getValue().stream().map(PhyloVariant::getToken).collect(Collectors.joining(",")))
                        .write();
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, e);
        }
    }

    private static void writeVariantPositions(final Phylotree tree, final Path path) {
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(path, TableUtils.COLUMN_SEPARATOR)) {
            writer.setHeaderLine(Collections.singletonList(POSITION_COLUMN));
            for (final int position : tree.getVariantPositions()) {
                writer.getNewLineBuilder().setColumn(POSITION_COLUMN, Integer.toString(position + 1)).write();
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, e);
        }
    }

    private static void writeMutationCounts(final Phylotree tree, final Path path) {
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(path, TableUtils.COLUMN_SEPARATOR)) {
            writer.setHeaderLine(Arrays.asList(POSITION_COLUMN, ALLELE_COLUMN, COUNT_COLUMN));
            for (final Map.Entry<Integer, Map<Character, Integer>> position : tree.getMutationCounts().entrySet()) {
                for (final Map.Entry<Character, Integer> allele : position.getValue().entrySet()) {
                    writer.getNewLineBuilder()
                            .setRow(Arrays.asList(Integer.toString(position.getKey() + 1), allele.getKey().toString(), allele.getValue().toString()))
                            .write();
                }
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, e);
        }
    }

    private static void writeTreeDump(final Phylotree tree, final Path path) {
        try (final Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            tree.getRoot().dump(writer);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(path, e);
        }
    }
}
