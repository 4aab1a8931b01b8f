package com.warehouse.service;

import com.warehouse.config.InventoryMetrics;
import com.warehouse.exception.ConnectivityException;
import com.warehouse.exception.ErrorCode;
import com.warehouse.exception.InventoryException;
import com.warehouse.exception.OutOfStockException;
import com.warehouse.exception.ProductNotFoundException;
import com.warehouse.exception.QueryException;
import com.warehouse.exception.WriteException;
import com.warehouse.model.ContainedArticle;
import com.warehouse.model.Deadline;
import com.warehouse.model.Inventory;
import com.warehouse.model.Product;
import com.warehouse.model.ProductStock;
import com.warehouse.model.Products;
import com.warehouse.model.Stock;
import com.warehouse.repository.InventoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Transactional operations over articles, product compositions and stock.
 *
 * TRANSACTIONS:
 * - Every call runs in its own new transaction; nothing is shared between calls
 * - The caller's {@link Deadline} becomes the transaction timeout, which Spring
 *   also applies to each JDBC statement, so an expired deadline aborts the
 *   in-flight statement and rolls the transaction back
 * - Reads always roll back; writes commit only when every statement succeeded
 * - Nothing is retried
 *
 * SELLING:
 * - Isolation is READ_COMMITTED; the articles of the product are locked with
 *   SELECT ... FOR UPDATE before the stock check, so concurrent sales of
 *   products sharing an article are serialised on those rows
 * - The decrement itself refuses to take a row below zero and the schema
 *   carries a CHECK (stock >= 0) constraint behind that
 *
 * The service holds no mutable state and is shared by all request threads.
 */
@Service
@Slf4j
public class InventoryService {

    enum SaleState {
        STARTED, EXISTENCE_CHECKED, STOCK_CHECKED, DECREMENTED, COMMITTED, ROLLED_BACK
    }

    private final InventoryRepository inventoryRepository;
    private final PlatformTransactionManager transactionManager;
    private final InventoryMetrics metrics;

    public InventoryService(InventoryRepository inventoryRepository,
                            PlatformTransactionManager transactionManager,
                            InventoryMetrics metrics) {
        this.inventoryRepository = inventoryRepository;
        this.transactionManager = transactionManager;
        this.metrics = metrics;
    }

    /**
     * Liveness probe against the store. No transaction, no side effect.
     *
     * @throws ConnectivityException if the store does not answer
     */
    public void ping() {
        log.debug("ping");
        try {
            inventoryRepository.ping();
        } catch (DataAccessException e) {
            log.error("Store ping failed: {}", e.getMessage());
            throw new ConnectivityException("store is not reachable", e);
        }
    }

    /**
     * All article stock rows, ordered by article id. An empty store yields an
     * empty list.
     *
     * @throws QueryException if the transaction cannot start or the read fails
     */
    public List<Stock> getInventory(Deadline deadline) {
        log.debug("getInventory");
        List<Stock> stocks = read("getInventory", deadline, inventoryRepository::listStock);
        log.debug("getInventory returns {} inventory records", stocks.size());
        return stocks;
    }

    /**
     * Products that can currently be built at least once. A product whose
     * availability is zero, or cannot be parsed as a number, is left out.
     *
     * @throws QueryException if the transaction cannot start or the read fails
     */
    public List<ProductStock> getProductStock(Deadline deadline) {
        log.debug("getProductStock");
        List<ProductStock> rows = read("getProductStock", deadline, inventoryRepository::listProductAvailability);

        List<ProductStock> available = new ArrayList<>(rows.size());
        for (ProductStock row : rows) {
            if (parseAvailability(row) != 0) {
                available.add(row);
            }
        }
        log.debug("getProductStock returns {} of {} products", available.size(), rows.size());
        return available;
    }

    /**
     * Registers every product's composition in a single transaction. Either all
     * composition rows are stored or none are.
     *
     * @return number of products uploaded
     * @throws WriteException if any insert or the commit fails
     * @throws QueryException if the transaction cannot start
     */
    public int uploadProducts(Deadline deadline, Products products) {
        log.debug("uploadProducts: {} products", products.products().size());

        int inserted = write("uploadProducts", deadline, () -> {
            for (Product product : products.products()) {
                for (ContainedArticle article : product.containArticles()) {
                    try {
                        inventoryRepository.insertProductArticle(product.name(), article);
                    } catch (DataAccessException | TransactionException e) {
                        log.warn("uploadProducts: insert of article {} for product '{}' failed: {}",
                                article.artId(), product.name(), e.getMessage());
                        throw new WriteException("failed to insert product " + product.name(), e);
                    }
                }
            }
            return products.products().size();
        });

        metrics.incrementProductsUploaded(inserted);
        log.info("Uploaded {} products", inserted);
        return inserted;
    }

    /**
     * Writes every stock entry in a single transaction. An entry for a known
     * article adds to its stock; an unknown article is created. Either all
     * entries are stored or none are.
     *
     * @return number of stock entries written
     * @throws WriteException if a quantity is not a non-negative integer, or any
     *                        write or the commit fails
     * @throws QueryException if the transaction cannot start
     */
    public int uploadInventory(Deadline deadline, Inventory inventory) {
        log.debug("uploadInventory: {} records", inventory.inventory().size());

        int inserted = write("uploadInventory", deadline, () -> {
            for (Stock stock : inventory.inventory()) {
                long quantity = parseQuantity(stock);
                try {
                    inventoryRepository.upsertStock(stock.artId(), stock.name(), quantity);
                } catch (DataAccessException | TransactionException e) {
                    log.warn("uploadInventory: write of article {} failed: {}", stock.artId(), e.getMessage());
                    throw new WriteException("failed to insert article " + stock.artId(), e);
                }
            }
            return inventory.inventory().size();
        });

        metrics.incrementArticlesUploaded(inserted);
        log.info("Uploaded {} inventory records", inserted);
        return inserted;
    }

    /**
     * Sells one unit of the product: checks it exists and every article is in
     * stock, then decrements all of them, atomically.
     *
     * @throws ProductNotFoundException if no composition is registered under the name
     * @throws OutOfStockException      if any article is missing or short
     * @throws QueryException           if a check fails or the transaction cannot start
     * @throws WriteException           if the decrement or the commit fails
     */
    public void sellProduct(Deadline deadline, String productName) {
        log.debug("sellProduct: '{}'", productName);
        long start = System.currentTimeMillis();
        SaleProgress sale = new SaleProgress(productName);

        try {
            transaction(deadline, false).executeWithoutResult(status -> {
                long registered = check(() -> inventoryRepository.countProduct(productName), productName);
                if (registered == 0) {
                    throw new ProductNotFoundException(productName);
                }
                sale.advance(SaleState.EXISTENCE_CHECKED);

                List<String> locked = check(() -> inventoryRepository.lockProductArticles(productName), productName);
                long unavailable = check(() -> inventoryRepository.countUnavailableArticles(productName), productName);
                if (unavailable != 0) {
                    log.info("Product '{}' has {} unavailable articles", productName, unavailable);
                    throw new OutOfStockException(productName);
                }
                sale.advance(SaleState.STOCK_CHECKED);

                int decremented;
                try {
                    decremented = inventoryRepository.decrementStockForProduct(productName);
                } catch (DataAccessException | TransactionException e) {
                    throw new WriteException("failed to update inventory for product " + productName, e);
                }
                if (decremented != registered) {
                    log.warn("Product '{}': decremented {} of {} articles ({} locked)",
                            productName, decremented, registered, locked.size());
                    throw new OutOfStockException(productName);
                }
                sale.advance(SaleState.DECREMENTED);
            });
            sale.advance(SaleState.COMMITTED);
        } catch (InventoryException e) {
            sale.rolledBack(e);
            metrics.incrementSalesRejected(rejectionReason(e));
            throw e;
        } catch (RuntimeException e) {
            InventoryException translated = translate("sellProduct", e, true);
            sale.rolledBack(translated);
            metrics.incrementSalesRejected(rejectionReason(translated));
            throw translated;
        } finally {
            metrics.recordSaleTime(System.currentTimeMillis() - start);
        }

        metrics.incrementSalesSucceeded();
        log.info("Product '{}' is sold and inventory is updated", productName);
    }

    private <T> T read(String operation, Deadline deadline, Supplier<T> query) {
        try {
            return transaction(deadline, true).execute(status -> {
                status.setRollbackOnly();
                return query.get();
            });
        } catch (InventoryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(operation, e, false);
        }
    }

    private int write(String operation, Deadline deadline, Supplier<Integer> work) {
        try {
            Integer count = transaction(deadline, false).execute(status -> work.get());
            return count != null ? count : 0;
        } catch (InventoryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw translate(operation, e, true);
        }
    }

    private TransactionTemplate transaction(Deadline deadline, boolean readOnly) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        template.setReadOnly(readOnly);
        template.setTimeout(deadline.remainingSeconds());
        return template;
    }

    /**
     * Maps a failure that escaped the transaction template onto the engine's
     * error kinds. Start failures are query errors; anything at commit time is
     * a write error for writing operations.
     */
    private InventoryException translate(String operation, RuntimeException e, boolean writing) {
        if (e instanceof TransactionSystemException tse
                && tse.getApplicationException() instanceof InventoryException original) {
            log.error("{}: rollback failed after {}", operation, original.getMessage(), e);
            return original;
        }
        if (e instanceof CannotCreateTransactionException) {
            log.error("{}: transaction begin failed: {}", operation, e.getMessage());
            return new QueryException("could not begin transaction", e);
        }
        if (e instanceof DataAccessException || e instanceof TransactionException) {
            if (writing) {
                log.error("{}: transaction failed: {}", operation, e.getMessage());
                return new WriteException("transaction failed, nothing was stored", e);
            }
            log.error("{}: query failed: {}", operation, e.getMessage());
            return new QueryException("could not read inventory", e);
        }
        throw e;
    }

    private static String rejectionReason(InventoryException e) {
        if (e instanceof ProductNotFoundException) {
            return InventoryMetrics.REASON_NOT_FOUND;
        }
        if (e instanceof OutOfStockException) {
            return InventoryMetrics.REASON_OUT_OF_STOCK;
        }
        return InventoryMetrics.REASON_ERROR;
    }

    private static <T> T check(Supplier<T> query, String productName) {
        try {
            return query.get();
        } catch (DataAccessException | TransactionException e) {
            throw new QueryException("could not check stock of product " + productName, e);
        }
    }

    private static long parseQuantity(Stock stock) {
        if (stock.stock() == null) {
            throw new WriteException(ErrorCode.WRITE_REJECTED, "missing stock for article " + stock.artId());
        }
        long quantity;
        try {
            quantity = Long.parseLong(stock.stock().trim());
        } catch (NumberFormatException e) {
            throw new WriteException("invalid stock '" + stock.stock() + "' for article " + stock.artId(), e);
        }
        if (quantity < 0) {
            throw new WriteException(ErrorCode.WRITE_REJECTED, "negative stock for article " + stock.artId());
        }
        return quantity;
    }

    /**
     * Unparseable values count as zero.
     */
    private static long parseAvailability(ProductStock row) {
        String value = row.availableProductNo();
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Availability '{}' of product '{}' is not a number, treated as zero", value, row.name());
            return 0;
        }
    }

    /**
     * Tracks one sale through its states for logging.
     */
    private static final class SaleProgress {

        private final String productName;
        private SaleState state = SaleState.STARTED;

        SaleProgress(String productName) {
            this.productName = productName;
        }

        void advance(SaleState next) {
            log.debug("sellProduct '{}': {} -> {}", productName, state, next);
            state = next;
        }

        void rolledBack(InventoryException cause) {
            log.debug("sellProduct '{}': {} -> {} ({})", productName, state, SaleState.ROLLED_BACK,
                    cause.getErrorCode());
            state = SaleState.ROLLED_BACK;
        }
    }
}
