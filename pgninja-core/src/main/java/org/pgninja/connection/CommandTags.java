package org.pgninja.connection;

import java.util.Locale;

/**
 * Derives the command tag (leading SQL keyword) of a statement, since JDBC does not expose the one the
 * server reported.
 */
final class CommandTags {
    private CommandTags() {
    }

    /**
     * @param producedRows whether the statement returned a result set; {@code WITH}, {@code VALUES} and
     *                     {@code TABLE} queries that did are reported as {@code SELECT}
     * @return upper-cased keyword, or {@code null} when the text holds no keyword
     */
    static String of(String sql, boolean producedRows) {
        String keyword = leadingKeyword(sql);
        if (keyword == null) return null;
        if (producedRows && (keyword.equals("WITH") || keyword.equals("VALUES") || keyword.equals("TABLE"))) {
            return "SELECT";
        }
        return keyword;
    }

    static String leadingKeyword(String sql) {
        return keyword(sql, 0);
    }

    /**
     * @return the {@code n}-th keyword (zero-based), upper-cased, or {@code null} when the text runs out first
     */
    static String keyword(String sql, int n) {
        if (sql == null) return null;
        int i = 0;
        for (int k = 0; ; k++) {
            i = skipNoise(sql, i);
            int start = i;
            while (i < sql.length() && Character.isLetter(sql.charAt(i))) {
                i++;
            }
            if (i == start) return null;
            if (k == n) return sql.substring(start, i).toUpperCase(Locale.ROOT);
        }
    }

    /** {@code ROLLBACK [WORK | TRANSACTION] TO [SAVEPOINT] name}. */
    static boolean isRollbackToSavepoint(String sql) {
        String second = keyword(sql, 1);
        if ("WORK".equals(second) || "TRANSACTION".equals(second)) {
            second = keyword(sql, 2);
        }
        return "TO".equals(second);
    }

    // Whitespace, opening parentheses, -- line comments and /* block */ comments.
    private static int skipNoise(String sql, int from) {
        int i = from;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            char n = (i + 1) < sql.length() ? sql.charAt(i + 1) : '\0';
            if (Character.isWhitespace(c) || c == '(') {
                i++;
            } else if (c == '-' && n == '-') {
                int eol = sql.indexOf('\n', i);
                i = eol < 0 ? sql.length() : eol + 1;
            } else if (c == '/' && n == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? sql.length() : end + 2;
            } else {
                break;
            }
        }
        return i;
    }
}
