package com.warehouse.repository;

import com.warehouse.model.ContainedArticle;
import com.warehouse.model.ProductStock;
import com.warehouse.model.Stock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Issues the named statements of {@code sql/queries.sql} against the article
 * and product composition tables.
 *
 * This class never opens or ends transactions. Every method joins whatever
 * transaction is bound to the calling thread, so the engine decides where
 * transaction boundaries lie. Failures surface as Spring's
 * {@link org.springframework.dao.DataAccessException} hierarchy.
 */
@Repository
@Slf4j
public class InventoryRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final SqlTemplateLoader sqlLoader;

    public InventoryRepository(NamedParameterJdbcTemplate jdbcTemplate, SqlTemplateLoader sqlLoader) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlLoader = sqlLoader;
    }

    public void ping() {
        jdbcTemplate.getJdbcTemplate().queryForObject(sqlLoader.load("ping"), Integer.class);
    }

    public List<Stock> listStock() {
        String sql = sqlLoader.load("listStock");

        return jdbcTemplate.query(sql, new MapSqlParameterSource(), (rs, rowNum) -> new Stock(
                rs.getString("art_id"),
                rs.getString("name"),
                rs.getString("stock")
        ));
    }

    /**
     * One row per registered product. The availability value is returned as
     * the store renders it; interpreting it is up to the caller.
     */
    public List<ProductStock> listProductAvailability() {
        String sql = sqlLoader.load("listProductAvailability");

        return jdbcTemplate.query(sql, new MapSqlParameterSource(), (rs, rowNum) -> new ProductStock(
                rs.getString("product_name"),
                rs.getString("available")
        ));
    }

    /**
     * Number of composition rows registered for the product; zero means the
     * product is unknown.
     */
    public long countProduct(String productName) {
        return count("countProduct", productName);
    }

    /**
     * Takes row locks on every article the product is built from, held until
     * the surrounding transaction ends.
     *
     * @return ids of the locked articles
     */
    public List<String> lockProductArticles(String productName) {
        String sql = sqlLoader.load("lockProductArticles");

        MapSqlParameterSource params = new MapSqlParameterSource("productName", productName);

        return jdbcTemplate.queryForList(sql, params, String.class);
    }

    /**
     * Number of composition entries whose article is missing or holds less
     * than the required amount. Any non-zero result means the product cannot
     * be sold.
     */
    public long countUnavailableArticles(String productName) {
        return count("countUnavailableArticles", productName);
    }

    /**
     * Subtracts the required amount from every article of the product. Rows
     * that would go negative are left untouched.
     *
     * @return number of article rows decremented
     */
    public int decrementStockForProduct(String productName) {
        String sql = sqlLoader.load("decrementStockForProduct");

        MapSqlParameterSource params = new MapSqlParameterSource("productName", productName);

        return jdbcTemplate.update(sql, params);
    }

    public void insertProductArticle(String productName, ContainedArticle article) {
        String sql = sqlLoader.load("insertProductArticle");

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("productName", productName)
                .addValue("artId", article.artId())
                .addValue("amountOf", article.amountOf());

        jdbcTemplate.update(sql, params);
    }

    /**
     * Creates the article, or adds {@code stock} to the existing quantity and
     * refreshes its name.
     */
    public void upsertStock(String artId, String name, long stock) {
        String sql = sqlLoader.load("upsertStock");

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("artId", artId)
                .addValue("name", name)
                .addValue("stock", stock);

        jdbcTemplate.update(sql, params);
    }

    private long count(String queryName, String productName) {
        String sql = sqlLoader.load(queryName);

        MapSqlParameterSource params = new MapSqlParameterSource("productName", productName);

        Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
        log.debug("{} for product '{}' returned {}", queryName, productName, count);
        return count != null ? count : 0L;
    }
}
