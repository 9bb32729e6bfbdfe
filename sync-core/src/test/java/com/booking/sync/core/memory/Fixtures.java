package com.booking.sync.core.memory;

import com.booking.sync.model.schema.SyncColumn;
import com.booking.sync.model.schema.SyncRelation;
import com.booking.sync.model.schema.SyncTable;

/**
 * Three tables: address and customer are parents of sales_order.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static SyncTable customer() {
        return new SyncTable("customer")
                .withColumn(SyncColumn.primaryKey("customer_id", "int"))
                .withColumn(new SyncColumn("name", "varchar"));
    }

    public static SyncTable address() {
        return new SyncTable("address")
                .withColumn(SyncColumn.primaryKey("address_id", "int"))
                .withColumn(new SyncColumn("city", "varchar"));
    }

    public static SyncTable salesOrder() {
        return new SyncTable("sales_order")
                .withColumn(SyncColumn.primaryKey("order_id", "int"))
                .withColumn(new SyncColumn("customer_id", "int"))
                .withColumn(new SyncColumn("address_id", "int"))
                .withRelation(new SyncRelation("fk_order_customer", "customer").withColumns("customer_id", "customer_id"))
                .withRelation(new SyncRelation("fk_order_address", "address").withColumns("address_id", "address_id"));
    }

    public static InMemoryDatabase database(String name) {
        return new InMemoryDatabase(name)
                .withBaseTable(Fixtures.salesOrder())
                .withBaseTable(Fixtures.customer())
                .withBaseTable(Fixtures.address());
    }
}
