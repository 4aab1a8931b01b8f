package com.warehouse.repository;

import com.warehouse.model.ContainedArticle;
import com.warehouse.model.ProductStock;
import com.warehouse.model.Stock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InventoryRepositoryIntegrationTest {

    private NamedParameterJdbcTemplate jdbcTemplate;
    private InventoryRepository repo;

    @BeforeEach
    void setup() {
        DataSource ds = TestDatabase.create("repository-test");
        this.jdbcTemplate = new NamedParameterJdbcTemplate(ds);

        SqlTemplateLoader loader = new SqlTemplateLoader(new DefaultResourceLoader());
        this.repo = new InventoryRepository(jdbcTemplate, loader);
    }

    @Test
    void ping_shouldSucceedOnLiveDatabase() {
        repo.ping();
    }

    @Test
    void listStock_emptyStore_shouldReturnEmptyList() {
        assertThat(repo.listStock()).isEmpty();
    }

    @Test
    void upsertStock_newArticle_shouldInsertRow() {
        repo.upsertStock("2", "screw", 17);
        repo.upsertStock("1", "leg", 12);

        assertThat(repo.listStock()).containsExactly(
                new Stock("1", "leg", "12"),
                new Stock("2", "screw", "17"));
    }

    @Test
    void upsertStock_existingArticle_shouldAddStockAndRefreshName() {
        repo.upsertStock("1", "leg", 12);
        repo.upsertStock("1", "table leg", 3);

        assertThat(repo.listStock()).containsExactly(new Stock("1", "table leg", "15"));
    }

    @Test
    void upsertStock_negativeNewArticle_shouldViolateCheckConstraint() {
        assertThatThrownBy(() -> repo.upsertStock("1", "leg", -1))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void insertProductArticle_duplicatePair_shouldFail() {
        repo.insertProductArticle("chair", new ContainedArticle("1", 4));

        assertThatThrownBy(() -> repo.insertProductArticle("chair", new ContainedArticle("1", 2)))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void insertProductArticle_zeroAmount_shouldViolateCheckConstraint() {
        assertThatThrownBy(() -> repo.insertProductArticle("chair", new ContainedArticle("1", 0)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void listProductAvailability_shouldReturnWholeUnitsBuildable() {
        repo.upsertStock("1", "leg", 12);
        repo.upsertStock("2", "screw", 17);
        repo.upsertStock("3", "seat", 2);
        repo.insertProductArticle("chair", new ContainedArticle("1", 4));
        repo.insertProductArticle("chair", new ContainedArticle("2", 8));
        repo.insertProductArticle("chair", new ContainedArticle("3", 1));
        repo.insertProductArticle("table", new ContainedArticle("1", 4));
        repo.insertProductArticle("table", new ContainedArticle("4", 1));

        List<ProductStock> availability = repo.listProductAvailability();

        // chair: min(12/4, 17/8, 2/1) = 2; table: article 4 is unknown
        assertThat(availability).containsExactly(
                new ProductStock("chair", "2"),
                new ProductStock("table", "0"));
    }

    @Test
    void countProduct_shouldCountCompositionRows() {
        repo.insertProductArticle("chair", new ContainedArticle("1", 4));
        repo.insertProductArticle("chair", new ContainedArticle("2", 8));

        assertThat(repo.countProduct("chair")).isEqualTo(2);
        assertThat(repo.countProduct("sofa")).isZero();
    }

    @Test
    void countUnavailableArticles_shouldCountMissingAndShortArticles() {
        repo.upsertStock("1", "leg", 4);
        repo.upsertStock("2", "screw", 7);
        repo.insertProductArticle("chair", new ContainedArticle("1", 4));
        repo.insertProductArticle("chair", new ContainedArticle("2", 8));
        repo.insertProductArticle("chair", new ContainedArticle("3", 1));

        // article 2 is short by one, article 3 does not exist
        assertThat(repo.countUnavailableArticles("chair")).isEqualTo(2);
    }

    @Test
    void countUnavailableArticles_fullyStocked_shouldBeZero() {
        repo.upsertStock("1", "leg", 4);
        repo.insertProductArticle("chair", new ContainedArticle("1", 4));

        assertThat(repo.countUnavailableArticles("chair")).isZero();
    }

    @Test
    void lockProductArticles_shouldReturnArticleIdsInOrder() {
        repo.upsertStock("b", "screw", 1);
        repo.upsertStock("a", "leg", 1);
        repo.upsertStock("c", "seat", 1);
        repo.insertProductArticle("chair", new ContainedArticle("b", 1));
        repo.insertProductArticle("chair", new ContainedArticle("a", 1));

        assertThat(repo.lockProductArticles("chair")).containsExactly("a", "b");
    }

    @Test
    void decrementStockForProduct_shouldSubtractRequiredAmounts() {
        repo.upsertStock("1", "leg", 5);
        repo.upsertStock("2", "screw", 3);
        repo.upsertStock("3", "seat", 9);
        repo.insertProductArticle("stool", new ContainedArticle("1", 2));
        repo.insertProductArticle("stool", new ContainedArticle("2", 1));

        int updated = repo.decrementStockForProduct("stool");

        assertThat(updated).isEqualTo(2);
        assertThat(repo.listStock()).containsExactly(
                new Stock("1", "leg", "3"),
                new Stock("2", "screw", "2"),
                new Stock("3", "seat", "9"));
    }

    @Test
    void decrementStockForProduct_shortArticle_shouldLeaveThatRowUntouched() {
        repo.upsertStock("1", "leg", 1);
        repo.upsertStock("2", "screw", 3);
        repo.insertProductArticle("stool", new ContainedArticle("1", 2));
        repo.insertProductArticle("stool", new ContainedArticle("2", 1));

        int updated = repo.decrementStockForProduct("stool");

        assertThat(updated).isEqualTo(1);
        assertThat(repo.listStock()).contains(new Stock("1", "leg", "1"));
    }
}
