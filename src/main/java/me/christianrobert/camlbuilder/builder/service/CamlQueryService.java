package me.christianrobert.camlbuilder.builder.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.camlbuilder.caml.CamlStatement;
import me.christianrobert.camlbuilder.caml.context.CamlBuildException;
import me.christianrobert.camlbuilder.caml.context.CamlContext;
import me.christianrobert.camlbuilder.caml.context.CamlResult;
import me.christianrobert.camlbuilder.caml.logical.ConnectiveFolder;
import me.christianrobert.camlbuilder.caml.logical.FoldStrategy;
import me.christianrobert.camlbuilder.caml.logical.LogicalJoinType;
import me.christianrobert.camlbuilder.caml.query.CamlQuery;
import me.christianrobert.camlbuilder.caml.query.CamlView;
import me.christianrobert.camlbuilder.caml.util.CamlTreeFormatter;
import me.christianrobert.camlbuilder.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * High-level service for building CAML from predicate statements.
 * This is the main entry point for callers that want a result object instead of exceptions.
 *
 * <p>Architecture:
 * <pre>
 * statements → ConnectiveFolder → CamlQuery / CamlView → toCaml(context) → String
 *                    ↑                                        ↑
 *             fold strategy                           escape option
 *                    └──────────── ConfigService ─────────────┘
 * </pre>
 *
 * <p>Usage:
 * <pre>
 * CamlResult result = service.buildWhere(LogicalJoinType.AND, statements);
 * if (result.isSuccess()) {
 *     String where = result.getCaml();
 * } else {
 *     // Handle error: result.getErrorMessage()
 * }
 * </pre>
 */
@ApplicationScoped
public class CamlQueryService {

    private static final Logger log = LoggerFactory.getLogger(CamlQueryService.class);

    @Inject
    ConfigService configService;

    /**
     * Folds the statements and renders them as a {@code <Where>} element.
     * Whether the tree outline is attached follows {@code caml.include-tree}.
     *
     * @param joinType And / Or used to combine the statements
     * @param statements At least one statement, in evaluation order
     * @return CamlResult containing either the Where markup or error details
     */
    public CamlResult buildWhere(LogicalJoinType joinType, List<? extends CamlStatement> statements) {
        return buildWhere(joinType, statements,
            configService.getConfigValueAsBoolean(ConfigService.INCLUDE_TREE, false));
    }

    /**
     * Folds the statements and renders them as a {@code <Where>} element, optionally
     * attaching an outline of the folded tree.
     *
     * @param joinType And / Or used to combine the statements
     * @param statements At least one statement, in evaluation order
     * @param includeTree Whether to include the tree outline in the result (for debugging)
     * @return CamlResult containing the Where markup and optionally the tree outline
     */
    public CamlResult buildWhere(LogicalJoinType joinType, List<? extends CamlStatement> statements,
                                 boolean includeTree) {
        if (joinType == null) {
            return CamlResult.failure("Join type cannot be null");
        }

        if (statements == null || statements.isEmpty()) {
            return CamlResult.failure("At least one statement is required");
        }

        FoldStrategy strategy = resolveFoldStrategy();
        log.debug("Folding {} statement(s) with {} using {}", statements.size(), joinType, strategy);

        try {
            CamlStatement root = ConnectiveFolder.fold(joinType, statements, strategy);
            String caml = CamlQuery.where(root).toWhereCaml(createContext());
            log.trace("Where CAML: {}", caml);

            if (includeTree) {
                String tree = CamlTreeFormatter.format(root);
                log.debug("Folded tree:\n{}", tree);
                return CamlResult.successWithTree(caml, tree);
            }
            return CamlResult.success(caml);

        } catch (CamlBuildException e) {
            log.warn("Failed to build Where clause: {}", e.getDetailedMessage());
            return CamlResult.failure(e);
        }
    }

    /**
     * Renders a complete {@code <Query>} element.
     */
    public CamlResult buildQuery(CamlQuery query) {
        if (query == null) {
            return CamlResult.failure("Query cannot be null");
        }
        String caml = query.toCaml(createContext());
        log.trace("Query CAML: {}", caml);
        return CamlResult.success(caml);
    }

    /**
     * Renders a complete {@code <View>} element.
     */
    public CamlResult buildView(CamlView view) {
        if (view == null) {
            return CamlResult.failure("View cannot be null");
        }
        String caml = view.toCaml(createContext());
        log.trace("View CAML: {}", caml);
        return CamlResult.success(caml);
    }

    /**
     * Creates the render context from the current configuration.
     */
    public CamlContext createContext() {
        return new CamlContext(configService.getConfigValueAsBoolean(ConfigService.ESCAPE_VALUES, true));
    }

    /**
     * Reads {@code caml.fold-strategy}; unset or unknown values fall back to LEFT_DEEP.
     */
    FoldStrategy resolveFoldStrategy() {
        String configured = configService.getConfigValueAsString(ConfigService.FOLD_STRATEGY);
        if (configured == null || configured.trim().isEmpty()) {
            return FoldStrategy.LEFT_DEEP;
        }
        try {
            return FoldStrategy.fromConfigValue(configured);
        } catch (CamlBuildException e) {
            log.warn("Ignoring invalid {} '{}', using LEFT_DEEP", ConfigService.FOLD_STRATEGY, configured);
            return FoldStrategy.LEFT_DEEP;
        }
    }
}
