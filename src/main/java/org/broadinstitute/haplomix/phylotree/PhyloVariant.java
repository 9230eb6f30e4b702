package org.broadinstitute.haplomix.phylotree;

import org.broadinstitute.haplomix.utils.Utils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single-nucleotide change that defines a branch of the phylogenetic tree, as written in the tree description.
 *
 * <p>The token grammar is {@code <ancestral><1-based position><derived>}, optionally wrapped in parentheses when the
 * site is unstable (recurrent) and optionally followed by {@code !} when the change is a back-mutation to an
 * ancestral state, for example {@code T152C}, {@code (T16519C)} or {@code A10G!}. Tokens containing {@code .} or
 * {@code d} describe insertions and deletions and are not variants in this model; see {@link #isSnp(String)}.</p>
 *
 * <p>Positions are stored 0-based.</p>
 */
public final class PhyloVariant {

    private static final Pattern CORE_PATTERN = Pattern.compile("([A-Za-z])(\\d+)([A-Za-z])");

    private final String token;
    private final int position;
    private final char ancestralAllele;
    private final char derivedAllele;
    private final boolean unstable;
    private final boolean backMutation;

    private PhyloVariant(final String token, final int position, final char ancestralAllele, final char derivedAllele) {
        this.token = token;
        this.position = position;
        this.ancestralAllele = ancestralAllele;
        this.derivedAllele = derivedAllele;
        this.unstable = token.startsWith("(");
        this.backMutation = token.indexOf('!') >= 0;
    }

    /**
     * Parses a variant token.
     *
     * @param token a single whitespace-free token from the tree description
     * @throws IllegalArgumentException if the token is an indel or its core is not {@code <allele><integer><allele>}
     */
    public static PhyloVariant parse(final String token) {
        Utils.nonEmpty(token, "variant token");
        Utils.validateArg(isSnp(token), () -> "not a single-nucleotide variant: " + token);

        final Matcher matcher = CORE_PATTERN.matcher(coreOf(token));
        Utils.validateArg(matcher.matches(), () -> "variant token is not of the form <allele><position><allele>: " + token);

        final int oneBasedPosition;
        try {
            oneBasedPosition = Integer.parseInt(matcher.group(2));
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("variant position out of range in token: " + token, e);
        }
        Utils.validateArg(oneBasedPosition >= 1, () -> "variant positions are 1-based but got " + oneBasedPosition + " in " + token);

        return new PhyloVariant(token, oneBasedPosition - 1,
                Character.toUpperCase(matcher.group(1).charAt(0)),
                Character.toUpperCase(matcher.group(3).charAt(0)));
    }

    /**
     * @return false if the token describes an insertion or deletion (contains {@code .} or {@code d})
     */
    public static boolean isSnp(final String token) {
        Utils.nonNull(token);
        return token.indexOf('.') < 0 && token.indexOf('d') < 0;
    }

    // strips a leading '(' and any trailing run of ')' and '!'
    private static String coreOf(final String token) {
        final int start = token.startsWith("(") ? 1 : 0;
        int end = token.length();
        while (end > start && (token.charAt(end - 1) == ')' || token.charAt(end - 1) == '!')) {
            end--;
        }
        return token.substring(start, end);
    }

    /**
     * @return the 0-based position of the change
     */
    public int getPosition() {
        return position;
    }

    public char getAncestralAllele() {
        return ancestralAllele;
    }

    public char getDerivedAllele() {
        return derivedAllele;
    }

    public boolean isUnstable() {
        return unstable;
    }

    public boolean isBackMutation() {
        return backMutation;
    }

    /**
     * @return the token exactly as it appeared in the tree description
     */
    public String getToken() {
        return token;
    }

    /**
     * @return the token with its stability and back-mutation annotations removed, upper-cased
     */
    public String strippedToken() {
        return coreOf(token).toUpperCase();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return token.equals(((PhyloVariant) o).token);
    }

    @Override
    public int hashCode() {
        return token.hashCode();
    }

    @Override
    public String toString() {
        return token;
    }
}
