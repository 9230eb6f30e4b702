package org.broadinstitute.haplomix.phylotree;

import org.broadinstitute.haplomix.utils.Utils;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * A haplogroup in a {@link Phylotree}: an id, the variants that define it relative to its parent, and its children.
 *
 * Nodes are created and linked by {@link Phylotree} while it reads a tree description.
 */
public final class PhyloNode {

    private final String hapId;
    private final PhyloNode parent;
    private final boolean anonymous;
    private final List<PhyloNode> children = new ArrayList<>();
    private List<PhyloVariant> variants;

    PhyloNode(final String hapId, final PhyloNode parent, final boolean anonymous, final List<PhyloVariant> variants) {
        this.hapId = Utils.nonNull(hapId);
        this.parent = parent;
        this.anonymous = anonymous;
        this.variants = new ArrayList<>(Utils.nonNull(variants));
        if (parent != null) {
            parent.children.add(this);
        }
    }

    public String getHapId() {
        return hapId;
    }

    /**
     * @return the parent node, or null for the root
     */
    public PhyloNode getParent() {
        return parent;
    }

    public List<PhyloNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * @return the variants that define this node relative to its parent, in the order they were listed
     */
    public List<PhyloVariant> getVariants() {
        return Collections.unmodifiableList(variants);
    }

    /**
     * @return true if the tree description gave this node no id and its id was generated
     */
    public boolean isAnonymous() {
        return anonymous;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    void setVariants(final List<PhyloVariant> variants) {
        this.variants = new ArrayList<>(variants);
    }

    /**
     * Produces the variants that define this haplogroup, including those inherited from its ancestors.
     * A change at a position masks every change at the same position farther up the tree, so a back-mutation
     * {@code T152C!} below {@code C152T} leaves only the former.
     *
     * @return the surviving variants sorted by position, at most one per position
     */
    public List<PhyloVariant> allVariants() {
        final Map<Integer, PhyloVariant> byPosition = new TreeMap<>();
        for (PhyloNode node = this; node != null; node = node.parent) {
            for (final PhyloVariant variant : node.variants) {
                byPosition.putIfAbsent(variant.getPosition(), variant);
            }
        }
        return new ArrayList<>(byPosition.values());
    }

    /**
     * Writes this node and its descendants, depth first, each level indented two more spaces than its parent.
     */
    public void dump(final Appendable out) throws IOException {
        Utils.nonNull(out);
        final Deque<PhyloNode> pending = new ArrayDeque<>();
        final Deque<Integer> indents = new ArrayDeque<>();
        pending.push(this);
        indents.push(0);
        while (!pending.isEmpty()) {
            final PhyloNode node = pending.pop();
            final String prefix = Utils.dupChar(' ', indents.pop());
            out.append(prefix).append("Node: ").append(node.hapId).append('\n');
            out.append(prefix).append("Variants: ")
                    .append(node.variants.stream().map(PhyloVariant::getToken).collect(Collectors.joining(",")))
                    .append('\n');
            out.append(prefix).append("Children: ").append(String.valueOf(node.children.size())).append('\n');
            for (int i = node.children.size() - 1; i >= 0; i--) {
                pending.push(node.children.get(i));
                indents.push(prefix.length() + 2);
            }
        }
    }

    @Override
    public String toString() {
        return hapId;
    }
}
