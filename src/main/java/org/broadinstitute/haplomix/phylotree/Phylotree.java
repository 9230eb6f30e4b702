package org.broadinstitute.haplomix.phylotree;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.haplomix.exceptions.UserException;
import org.broadinstitute.haplomix.utils.Utils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Haplogroups and the variants that define them, held as an explicit tree.
 *
 * <p>The tree is read from a leveled, comma-separated description (the layout of the Phylotree mtDNA tree exported
 * as CSV). Each line is one node: its indentation level is the number of leading empty fields, followed by the
 * node's id (empty for an unnamed node) and a field of space-separated variant tokens, for example</p>
 * <pre>
 * H2a2a1,A263G
 * ,H2a2a,C8860T C15326T
 * ,,H2a,A4769G
 * ,,,A1438G T16519C
 * </pre>
 *
 * <p>The usual workflow is to read the tree, call {@link #processVariants(boolean, boolean)} to apply any site
 * filters and collect the retained variant positions, and then ask for {@link #haplogroupVariants(boolean)}.</p>
 */
public final class Phylotree {
    private static final Logger logger = LogManager.getLogger(Phylotree.class);

    private final PhyloNode root;
    private final List<PhyloNode> nodes;
    private final Map<String, PhyloNode> nodesById;

    private List<Integer> variantPositions = Collections.emptyList();
    private SortedMap<Integer, Map<Character, Integer>> mutationCounts = Collections.emptySortedMap();

    private Phylotree(final PhyloNode root, final List<PhyloNode> nodes) {
        this.root = root;
        this.nodes = Collections.unmodifiableList(nodes);
        this.nodesById = new HashMap<>();
        for (final PhyloNode node : nodes) {
            nodesById.putIfAbsent(node.getHapId(), node);
        }
    }

    /**
     * Builds a tree from the lines of a tree description in one pass.
     *
     * @param lines the lines of the description, without line terminators
     * @param source a name for the description used in error messages
     * @throws UserException.MalformedFile if the description is empty or a line cannot be placed in the tree
     */
    public static Phylotree fromLines(final Iterable<String> lines, final String source) {
        Utils.nonNull(lines);
        Utils.nonNull(source);

        final List<PhyloNode> nodes = new ArrayList<>();
        final Map<PhyloNode, Integer> anonymousChildCounts = new HashMap<>();
        // the chain of open ancestors; the depth of the top node is its size - 1
        final Deque<PhyloNode> stack = new ArrayDeque<>();
        PhyloNode root = null;

        int lineNumber = 0;
        for (final String line : lines) {
            lineNumber++;
            final TreeLine parsed = parseLine(line, source, lineNumber);

            while (!stack.isEmpty() && stack.size() - 1 >= parsed.level) {
                stack.pop();
            }
            final PhyloNode parent = stack.peek();
            if (parent == null && root != null) {
                throw new UserException.MalformedFile(source, lineNumber,
                        "a second root node '" + parsed.hapId + "' was found; the tree already has root '" + root.getHapId() + "'");
            }

            final boolean anonymous = parsed.hapId.isEmpty();
            final String hapId = anonymous && parent != null ? anonymousName(parent, anonymousChildCounts) : parsed.hapId;
            final PhyloNode node = new PhyloNode(hapId, parent, anonymous, parsed.variants);
            if (root == null) {
                root = node;
            }
            nodes.add(node);
            stack.push(node);
        }

        if (root == null) {
            throw new UserException.MalformedFile(source, "the tree description is empty");
        }
        logger.debug("Read " + nodes.size() + " haplogroups from " + source);
        return new Phylotree(root, nodes);
    }

    private static String anonymousName(final PhyloNode parent, final Map<PhyloNode, Integer> anonymousChildCounts) {
        final int k = anonymousChildCounts.merge(parent, 1, Integer::sum);
        return parent.getHapId() + "[" + k + "]";
    }

    private static final class TreeLine {
        final int level;
        final String hapId;
        final List<PhyloVariant> variants;

        TreeLine(final int level, final String hapId, final List<PhyloVariant> variants) {
            this.level = level;
            this.hapId = hapId;
            this.variants = variants;
        }
    }

    /**
     * Splits one line of the description into indentation level, id and variants.
     *
     * An unnamed node's variant list lands where the id would be, so an id containing a space means the level was
     * over-counted and the id is one field to the left.
     */
    private static TreeLine parseLine(final String line, final String source, final int lineNumber) {
        final String trimmed = Utils.nonNull(line).stripTrailing();
        if (trimmed.isEmpty()) {
            throw new UserException.MalformedFile(source, lineNumber, "empty line");
        }
        final String[] fields = trimmed.split(",", -1);

        int level = 0;
        while (level < fields.length && fields[level].isEmpty()) {
            level++;
        }
        if (level == fields.length) {
            throw new UserException.MalformedFile(source, lineNumber, "line has no haplogroup id or variants");
        }
        String hapId = fields[level];
        while (hapId.indexOf(' ') >= 0) {
            level--;
            if (level < 0) {
                throw new UserException.MalformedFile(source, lineNumber, "cannot find the haplogroup id in '" + trimmed + "'");
            }
            hapId = fields[level];
        }

        final List<PhyloVariant> variants = new ArrayList<>();
        if (level + 1 < fields.length) {
            for (final String token : fields[level + 1].trim().split("\\s+")) {
                if (token.isEmpty() || !PhyloVariant.isSnp(token)) {
                    continue;
                }
                try {
                    variants.add(PhyloVariant.parse(token));
                } catch (final IllegalArgumentException e) {
                    throw new UserException.MalformedFile(source, lineNumber, e.getMessage());
                }
            }
        }
        return new TreeLine(level, hapId, variants);
    }

    /**
     * Collects the variant positions used by the model, optionally dropping unreliable sites everywhere in the tree.
     *
     * <p>A position is dropped if any of its occurrences matches an enabled filter: unstable sites (annotated with
     * parentheses) and/or sites with a back-mutation (annotated with {@code !}). Variants at dropped positions are
     * removed from every node. Mutation counts are tallied over every variant present before the removal.</p>
     *
     * <p>Positions and counts are recomputed from scratch on each call, over the node variant lists as they are
     * at that time.</p>
     */
    public void processVariants(final boolean removeUnstable, final boolean removeBackMutations) {
        final Set<Integer> retained = new HashSet<>();
        final Set<Integer> excluded = new HashSet<>();
        final SortedMap<Integer, Map<Character, Integer>> counts = new TreeMap<>();

        for (final PhyloNode node : nodes) {
            for (final PhyloVariant variant : node.getVariants()) {
                final int pos = variant.getPosition();
                if (removeUnstable && variant.isUnstable()) {
                    excluded.add(pos);
                } else if (removeBackMutations && variant.isBackMutation()) {
                    excluded.add(pos);
                } else {
                    retained.add(pos);
                }
                counts.computeIfAbsent(pos, p -> new TreeMap<>()).merge(variant.getDerivedAllele(), 1, Integer::sum);
            }
        }

        if (removeUnstable || removeBackMutations) {
            retained.removeAll(excluded);
            for (final PhyloNode node : nodes) {
                node.setVariants(node.getVariants().stream()
                        .filter(v -> !excluded.contains(v.getPosition()))
                        .collect(Collectors.toList()));
            }
            logger.info("Excluded " + excluded.size() + " variant positions; " + retained.size() + " remain");
        }

        variantPositions = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(retained)));
        final SortedMap<Integer, Map<Character, Integer>> readOnly = new TreeMap<>();
        counts.forEach((pos, alleleCounts) -> readOnly.put(pos, Collections.unmodifiableMap(alleleCounts)));
        mutationCounts = Collections.unmodifiableSortedMap(readOnly);
    }

    /**
     * @return the sorted, distinct variant positions retained by the last {@link #processVariants(boolean, boolean)},
     * empty if it has not been called
     */
    public List<Integer> getVariantPositions() {
        return variantPositions;
    }

    /**
     * @return position -> (derived allele -> number of times a change to that allele occurs in the tree), as tallied
     * by the last {@link #processVariants(boolean, boolean)}
     */
    public SortedMap<Integer, Map<Character, Integer>> getMutationCounts() {
        return mutationCounts;
    }

    /**
     * The table of haplogroups and the variants that define them, inherited variants included.
     *
     * @param leavesOnly if true only haplogroups without children are listed
     * @return hapId -> {@link PhyloNode#allVariants()}, in the order the nodes were read
     */
    public Map<String, List<PhyloVariant>> haplogroupVariants(final boolean leavesOnly) {
        final Map<String, List<PhyloVariant>> table = new LinkedHashMap<>();
        for (final PhyloNode node : nodes) {
            if (!leavesOnly || node.isLeaf()) {
                table.put(node.getHapId(), node.allVariants());
            }
        }
        return table;
    }

    public PhyloNode getRoot() {
        return root;
    }

    /**
     * @return every node in the order it was read
     */
    public List<PhyloNode> getNodes() {
        return nodes;
    }

    /**
     * @return the first node read with this id, or null if there is none
     */
    public PhyloNode getNode(final String hapId) {
        return nodesById.get(hapId);
    }

    public int size() {
        return nodes.size();
    }
}
