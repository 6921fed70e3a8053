package org.pgninja.connection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CommandTagsTest {

    @Test
    void leadingKeyword_isUpperCased() {
        assertThat(CommandTags.leadingKeyword("select 1")).isEqualTo("SELECT");
        assertThat(CommandTags.leadingKeyword("  Insert into t values (1)")).isEqualTo("INSERT");
    }

    @Test
    void leadingKeyword_skipsCommentsAndParentheses() {
        assertThat(CommandTags.leadingKeyword("-- note\n/* block */ (select 1) union (select 2)")).isEqualTo("SELECT");
        assertThat(CommandTags.leadingKeyword("/* only a comment */")).isNull();
    }

    @Test
    void leadingKeyword_isNullForBlankOrPunctuation() {
        assertThat(CommandTags.leadingKeyword("")).isNull();
        assertThat(CommandTags.leadingKeyword("   ")).isNull();
        assertThat(CommandTags.leadingKeyword(";")).isNull();
        assertThat(CommandTags.leadingKeyword(null)).isNull();
    }

    @Test
    void withQueriesThatReturnRows_areReportedAsSelect() {
        assertThat(CommandTags.of("WITH x AS (SELECT 1) SELECT * FROM x", true)).isEqualTo("SELECT");
        assertThat(CommandTags.of("VALUES (1), (2)", true)).isEqualTo("SELECT");
        assertThat(CommandTags.of("WITH x AS (SELECT 1) DELETE FROM t", false)).isEqualTo("WITH");
        assertThat(CommandTags.of("UPDATE t SET a = 1 RETURNING a", true)).isEqualTo("UPDATE");
    }

    @Test
    void rollbackToSavepoint_isRecognisedAcrossWhitespaceAndNoiseWords() {
        assertThat(CommandTags.isRollbackToSavepoint("ROLLBACK TO SAVEPOINT s")).isTrue();
        assertThat(CommandTags.isRollbackToSavepoint("rollback\nto s")).isTrue();
        assertThat(CommandTags.isRollbackToSavepoint("ROLLBACK WORK TO SAVEPOINT s")).isTrue();
        assertThat(CommandTags.isRollbackToSavepoint("ROLLBACK /* undo */ TRANSACTION\tTO s")).isTrue();
        assertThat(CommandTags.isRollbackToSavepoint("ROLLBACK")).isFalse();
        assertThat(CommandTags.isRollbackToSavepoint("ROLLBACK WORK")).isFalse();
    }

    @Test
    void keyword_readsLaterTokens() {
        assertThat(CommandTags.keyword("insert into t values (1)", 1)).isEqualTo("INTO");
        assertThat(CommandTags.keyword("COMMIT", 1)).isNull();
    }
}
