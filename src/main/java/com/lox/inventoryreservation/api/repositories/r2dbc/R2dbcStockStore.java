package com.lox.inventoryreservation.api.repositories.r2dbc;

import com.lox.inventoryreservation.api.models.StockRecord;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
@Slf4j
public class R2dbcStockStore implements StockStore {

    private static final String SELECT_QUANTITY =
            "SELECT quantity FROM inventories WHERE product_id = :productId";

    private static final String SELECT_RECORD =
            "SELECT product_id, quantity, updated_at FROM inventories WHERE product_id = :productId";

    // Single round-trip: the WHERE clause is the stock check
    private static final String CONDITIONAL_DECREMENT =
            "UPDATE inventories SET quantity = quantity - :amount, updated_at = :updatedAt "
                    + "WHERE product_id = :productId AND quantity >= :required";

    private static final String INSERT =
            "INSERT INTO inventories (product_id, quantity, updated_at) "
                    + "VALUES (:productId, :quantity, :updatedAt)";

    private static final String UPDATE_QUANTITY =
            "UPDATE inventories SET quantity = :quantity, updated_at = :updatedAt "
                    + "WHERE product_id = :productId";

    private final DatabaseClient databaseClient;

    public R2dbcStockStore(R2dbcEntityTemplate template) {
        this.databaseClient = template.getDatabaseClient();
    }

    @Override
    public Mono<Integer> getQuantity(Long productId) {
        return databaseClient.sql(SELECT_QUANTITY)
                .bind("productId", productId)
                .map((row, metadata) -> row.get("quantity", Integer.class))
                .one();
    }

    @Override
    public Mono<ReserveResult> tryReserve(Long productId, int amount) {
        return databaseClient.sql(CONDITIONAL_DECREMENT)
                .bind("amount", amount)
                .bind("required", amount)
                .bind("updatedAt", now())
                .bind("productId", productId)
                .fetch()
                .rowsUpdated()
                .flatMap(rows -> {
                    if (rows > 0) {
                        log.debug("Decremented {} unit(s) for Product ID: {}", amount, productId);
                        return Mono.just(ReserveResult.RESERVED);
                    }
                    return getQuantity(productId)
                            .map(quantity -> {
                                log.debug("Product ID: {} has {} unit(s), {} requested",
                                        productId, quantity, amount);
                                return ReserveResult.INSUFFICIENT_STOCK;
                            })
                            .defaultIfEmpty(ReserveResult.NOT_FOUND);
                });
    }

    @Override
    public Mono<StockRecord> findRecord(Long productId) {
        return databaseClient.sql(SELECT_RECORD)
                .bind("productId", productId)
                .map((row, metadata) -> StockRecord.builder()
                        .productId(row.get("product_id", Long.class))
                        .quantity(row.get("quantity", Integer.class))
                        .updatedAt(row.get("updated_at", OffsetDateTime.class).toInstant())
                        .build())
                .one();
    }

    @Override
    public Mono<StockRecord> insert(Long productId, int quantity) {
        OffsetDateTime updatedAt = now();
        return databaseClient.sql(INSERT)
                .bind("productId", productId)
                .bind("quantity", quantity)
                .bind("updatedAt", updatedAt)
                .fetch()
                .rowsUpdated()
                .thenReturn(StockRecord.builder()
                        .productId(productId)
                        .quantity(quantity)
                        .updatedAt(updatedAt.toInstant())
                        .build());
    }

    @Override
    public Mono<Long> updateQuantity(Long productId, int quantity) {
        return databaseClient.sql(UPDATE_QUANTITY)
                .bind("quantity", quantity)
                .bind("updatedAt", now())
                .bind("productId", productId)
                .fetch()
                .rowsUpdated();
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }
}
