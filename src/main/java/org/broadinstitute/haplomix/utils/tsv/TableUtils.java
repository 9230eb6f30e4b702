package org.broadinstitute.haplomix.utils.tsv;

/**
 * Common constants for the tab-separated tables read and written by Haplomix tools.
 */
public final class TableUtils {

    private TableUtils() {}

    /**
     * Column separator: a tab.
     */
    public static final char COLUMN_SEPARATOR = '\t';

    /**
     * Lines starting with this prefix are comments.
     */
    public static final String COMMENT_PREFIX = "#";

    public static final char QUOTE_CHARACTER = '\"';

    public static final char ESCAPE_CHARACTER = '\\';
}
