package io.github.yok.drupaldblink.content;

import io.github.yok.drupaldblink.core.QueryExecutor;
import io.github.yok.drupaldblink.core.QueryResult;
import io.github.yok.drupaldblink.core.TableNameTemplater;
import io.github.yok.drupaldblink.db.DbDialectHandler;
import io.github.yok.drupaldblink.util.IdentifierValidator;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only lookups of Drupal 8+ entities stored in the standard entity tables.
 *
 * <p>
 * Every query references tables in their logical form ({@code {node_field_data}}); the executor
 * adds the site prefix. Results are returned as {@link QueryResult} so that callers can tell "not
 * found" (no row) from a failed query.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class DrupalContentRepository {

    private static final String NODE_BY_ID_SQL = "SELECT nfd.nid, nfd.vid, nfd.type, "
            + "nfd.langcode, nfd.status, nfd.uid, nfd.title, nfd.created, nfd.changed, "
            + "ufd.name AS author_name, "
            + "COALESCE(nb.body_value, nrb.body_value) AS body_value, "
            + "COALESCE(nb.body_summary, nrb.body_summary) AS body_summary, "
            + "COALESCE(nb.body_format, nrb.body_format) AS body_format "
            + "FROM {node_field_data} nfd "
            + "LEFT JOIN {users_field_data} ufd ON nfd.uid = ufd.uid "
            + "LEFT JOIN {node__body} nb ON nfd.nid = nb.entity_id AND nfd.vid = nb.revision_id "
            + "AND nb.deleted = 0 AND nb.langcode = nfd.langcode "
            + "LEFT JOIN {node_revision__body} nrb ON nfd.vid = nrb.revision_id "
            + "AND nrb.deleted = 0 AND nrb.langcode = nfd.langcode "
            + "WHERE nfd.nid = ?";

    private static final String CONTENT_TYPES_SQL =
            "SELECT type, name, description FROM {node_type}";

    private static final String TERM_BY_ID_SQL = "SELECT tfd.tid, tfd.vid, tfd.name, "
            + "tfd.description, tfd.langcode, tv.name AS vocabulary_name "
            + "FROM {taxonomy_term_field_data} tfd "
            + "LEFT JOIN {taxonomy_vocabulary} tv ON tfd.vid = tv.vid "
            + "WHERE tfd.tid = ?";

    private static final String VOCABULARIES_SQL =
            "SELECT vid, name, description FROM {taxonomy_vocabulary}";

    private static final String USER_FIELDS =
            "ufd.uid, ufd.name, ufd.mail, ufd.status, ufd.created, ufd.changed, ufd.langcode";

    private final QueryExecutor executor;

    private final DbDialectHandler dialect;

    /**
     * Fetches a node with its author name and body.
     *
     * @param nid node ID
     * @return at most one row
     */
    public QueryResult getNodeById(long nid) {
        return executor.execute(NODE_BY_ID_SQL, List.of(nid), true);
    }

    /**
     * Lists all content types.
     *
     * @return one row per node type
     */
    public QueryResult listContentTypes() {
        return executor.execute(CONTENT_TYPES_SQL, Collections.emptyList());
    }

    /**
     * Fetches a taxonomy term with the name of its vocabulary.
     *
     * @param tid term ID
     * @return at most one row
     */
    public QueryResult getTaxonomyTermById(long tid) {
        return executor.execute(TERM_BY_ID_SQL, List.of(tid), true);
    }

    /**
     * Lists all vocabularies.
     *
     * @return one row per vocabulary
     */
    public QueryResult listVocabularies() {
        return executor.execute(VOCABULARIES_SQL, Collections.emptyList());
    }

    /**
     * Fetches a user with the comma-separated list of role IDs in column {@code roles}.
     *
     * @param uid user ID
     * @return at most one row
     */
    public QueryResult getUserById(long uid) {
        String sql = "SELECT " + USER_FIELDS + ", "
                + dialect.buildStringAggregate("ur.roles_target_id", "roles")
                + " FROM {users_field_data} ufd "
                + "LEFT JOIN {user__roles} ur ON ufd.uid = ur.entity_id "
                + "WHERE ufd.uid = ? GROUP BY " + USER_FIELDS;
        return executor.execute(sql, List.of(uid), true);
    }

    /**
     * Lists the paragraphs referenced by a node through a paragraph field, in delta order.
     *
     * @param nid node ID
     * @param fieldName machine name of the paragraph field, e.g. {@code field_paragraphs}
     * @return one row per referenced paragraph
     * @throws io.github.yok.drupaldblink.util.UnsafeIdentifierException if {@code fieldName}
     *         contains characters other than letters, digits and underscores
     */
    public QueryResult listParagraphsByNodeId(long nid, String fieldName) {
        String field = IdentifierValidator.requireSafe(fieldName);
        String sql = "SELECT p_ref." + field + "_target_id AS paragraph_id, "
                + "p_ref." + field + "_target_revision_id AS paragraph_revision_id, "
                + "pfd.id AS paragraph_item_id, pfd.type AS paragraph_type, "
                + "pfd.langcode AS paragraph_langcode, pfd.status AS paragraph_status "
                + "FROM " + TableNameTemplater.placeholder("node__" + field) + " p_ref "
                + "JOIN {paragraphs_item_field_data} pfd ON p_ref." + field
                + "_target_id = pfd.id AND p_ref." + field
                + "_target_revision_id = pfd.revision_id "
                + "WHERE p_ref.entity_id = ? AND p_ref.deleted = 0 ORDER BY p_ref.delta ASC";
        QueryResult result = executor.execute(sql, List.of(nid));
        if (result.isFailed()) {
            log.warn("Paragraph query failed for node {} and field {}", nid, field);
        }
        return result;
    }
}
