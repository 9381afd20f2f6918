package com.lox.inventoryreservation.api.repositories.r2dbc;

import com.lox.inventoryreservation.api.kafka.events.OutcomeStatus;
import com.lox.inventoryreservation.api.models.InventoryReservation;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public class R2dbcReservationLedger implements ReservationLedger {

    private static final String SELECT_BY_ORDER =
            "SELECT order_id, product_id, quantity, status, message, created_at "
                    + "FROM inventory_reservations WHERE order_id = :orderId";

    private static final String INSERT =
            "INSERT INTO inventory_reservations "
                    + "(order_id, product_id, quantity, status, message, created_at) "
                    + "VALUES (:orderId, :productId, :quantity, :status, :message, :createdAt)";

    private final DatabaseClient databaseClient;

    public R2dbcReservationLedger(R2dbcEntityTemplate template) {
        this.databaseClient = template.getDatabaseClient();
    }

    @Override
    public Mono<InventoryReservation> findByOrderId(Long orderId) {
        return databaseClient.sql(SELECT_BY_ORDER)
                .bind("orderId", orderId)
                .map((row, metadata) -> InventoryReservation.builder()
                        .orderId(row.get("order_id", Long.class))
                        .productId(row.get("product_id", Long.class))
                        .quantity(row.get("quantity", Integer.class))
                        .status(OutcomeStatus.valueOf(row.get("status", String.class)))
                        .message(row.get("message", String.class))
                        .createdAt(row.get("created_at", OffsetDateTime.class).toInstant())
                        .build())
                .one();
    }

    @Override
    public Mono<Void> record(InventoryReservation reservation) {
        return databaseClient.sql(INSERT)
                .bind("orderId", reservation.getOrderId())
                .bind("productId", reservation.getProductId())
                .bind("quantity", reservation.getQuantity())
                .bind("status", reservation.getStatus().name())
                .bind("message", reservation.getMessage())
                .bind("createdAt", OffsetDateTime.ofInstant(reservation.getCreatedAt(), ZoneOffset.UTC))
                .fetch()
                .rowsUpdated()
                .then();
    }
}
