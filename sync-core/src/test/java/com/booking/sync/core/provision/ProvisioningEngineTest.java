package com.booking.sync.core.provision;

import com.booking.sync.core.args.DatabaseProvisionedArgs;
import com.booking.sync.core.args.DatabaseProvisioningArgs;
import com.booking.sync.core.args.ProgressArgs;
import com.booking.sync.core.args.TableDeprovisioningArgs;
import com.booking.sync.core.args.TableProvisioningArgs;
import com.booking.sync.core.exception.MissingTablesException;
import com.booking.sync.core.interceptor.Interceptors;
import com.booking.sync.core.memory.Fixtures;
import com.booking.sync.core.memory.InMemoryDatabase;
import com.booking.sync.core.memory.InMemoryScopeInfoBuilder;
import com.booking.sync.core.memory.InMemorySyncProvider;
import com.booking.sync.model.SyncContext;
import com.booking.sync.model.SyncSide;
import com.booking.sync.model.provision.ProvisionFlags;
import com.booking.sync.model.provision.SyncProvision;
import com.booking.sync.model.schema.SyncSet;
import com.booking.sync.model.scope.ScopeInfoTableType;

import org.junit.Before;
import org.junit.Test;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ProvisioningEngineTest {
    private InMemoryDatabase database;
    private Interceptors interceptors;
    private ProvisioningEngine engine;
    private SyncContext context;

    @Before
    public void before() {
        this.database = Fixtures.database("engine");
        this.interceptors = new Interceptors();
        this.engine = new ProvisioningEngine(new InMemorySyncProvider(this.database), this.interceptors);
        this.context = new SyncContext(UUID.randomUUID(), "engine");
    }

    private static SyncSet schema() {
        return new SyncSet()
                .withTable(Fixtures.salesOrder())
                .withTable(Fixtures.customer())
                .withTable(Fixtures.address());
    }

    @Test
    public void testProvisionCreatesParentsFirst() throws Exception {
        List<String> tables = new ArrayList<>();

        this.interceptors.on(TableProvisioningArgs.class, args -> tables.add(args.getTable().getTableName()));

        try (Connection connection = this.database.connect()) {
            this.engine.provision(this.context, ProvisioningEngineTest.schema(), ProvisionFlags.all(), "scope_info", SyncSide.SERVER, connection, null);
        }

        assertEquals(Arrays.asList("customer", "address", "sales_order"), tables);
        assertTrue(this.database.hasArtifact("tracking:sales_order"));
        assertTrue(this.database.hasArtifact("triggers:customer"));
        assertTrue(this.database.hasArtifact("procedures:address"));
    }

    @Test
    public void testDeprovisionDropsChildrenFirst() throws Exception {
        List<String> tables = new ArrayList<>();

        this.interceptors.on(TableDeprovisioningArgs.class, args -> tables.add(args.getTable().getTableName()));

        try (Connection connection = this.database.connect()) {
            this.engine.provision(this.context, ProvisioningEngineTest.schema(), ProvisionFlags.all(), "scope_info", SyncSide.CLIENT, connection, null);
            this.engine.deprovision(this.context, ProvisioningEngineTest.schema(), ProvisionFlags.all(), "scope_info", SyncSide.CLIENT, connection, null);
        }

        assertEquals(Arrays.asList("sales_order", "address", "customer"), tables);
        assertFalse(this.database.hasArtifact("tracking:customer"));
        assertFalse(this.database.hasArtifact("procedures:sales_order"));
    }

    @Test
    public void testAllNeverTouchesBaseTables() throws Exception {
        try (Connection connection = this.database.connect()) {
            this.engine.deprovision(this.context, ProvisioningEngineTest.schema(), ProvisionFlags.all(), "scope_info", SyncSide.CLIENT, connection, null);
        }

        assertTrue(this.database.hasArtifact("table:customer"));
        assertTrue(this.database.hasArtifact("table:sales_order"));

        try (Connection connection = this.database.connect()) {
            this.engine.deprovision(this.context, ProvisioningEngineTest.schema(), ProvisionFlags.of(SyncProvision.TABLE), "scope_info", SyncSide.CLIENT, connection, null);
        }

        assertFalse(this.database.hasArtifact("table:customer"));
        assertFalse(this.database.hasArtifact("table:sales_order"));
    }

    @Test
    public void testScopeTablesFollowSide() throws Exception {
        try (Connection connection = this.database.connect()) {
            this.engine.provision(this.context, ProvisioningEngineTest.schema(), ProvisionFlags.of(SyncProvision.SCOPE), "scope_info", SyncSide.SERVER, connection, null);
        }

        List<String> log = this.database.getLog();

        assertTrue(log.contains(String.format("createScopeInfoTable:%s", ScopeInfoTableType.SERVER)));
        assertTrue(log.contains(String.format("createScopeInfoTable:%s", ScopeInfoTableType.SERVER_HISTORY)));
        assertFalse(log.contains(String.format("createScopeInfoTable:%s", ScopeInfoTableType.CLIENT)));
        assertEquals(0, this.database.countScopes(InMemoryScopeInfoBuilder.tableName("scope_info", ScopeInfoTableType.SERVER)));
        assertFalse(this.database.hasArtifact("tracking:customer"));
    }

    @Test
    public void testProvisionTwiceLeavesSameArtifacts() throws Exception {
        Set<String> once;

        try (Connection connection = this.database.connect()) {
            this.engine.provision(this.context, ProvisioningEngineTest.schema(), ProvisionFlags.all(), "scope_info", SyncSide.CLIENT, connection, null);
            once = this.database.getArtifacts();
            this.engine.provision(this.context, ProvisioningEngineTest.schema(), ProvisionFlags.all(), "scope_info", SyncSide.CLIENT, connection, null);
        }

        assertEquals(once, this.database.getArtifacts());
    }

    @Test
    public void testProgressIsReported() throws Exception {
        List<ProgressArgs> progress = new ArrayList<>();

        try (Connection connection = this.database.connect()) {
            this.engine.provision(this.context, ProvisioningEngineTest.schema(), ProvisionFlags.all(), "scope_info", SyncSide.CLIENT, connection, progress::add);
        }

        assertEquals(4, progress.size());
        assertTrue(progress.get(3) instanceof DatabaseProvisionedArgs);
    }

    @Test(expected = MissingTablesException.class)
    public void testEmptySchemaIsRejected() throws Exception {
        try (Connection connection = this.database.connect()) {
            this.engine.provision(this.context, new SyncSet(), ProvisionFlags.all(), "scope_info", SyncSide.CLIENT, connection, null);
        }
    }

    @Test
    public void testEnsureDatabaseCreatesTablesAndForeignKeys() throws Exception {
        InMemoryDatabase empty = new InMemoryDatabase("client");
        ProvisioningEngine engine = new ProvisioningEngine(new InMemorySyncProvider(empty), this.interceptors);

        try (Connection connection = empty.connect()) {
            engine.ensureDatabase(this.context, ProvisioningEngineTest.schema(), connection, null);
        }

        assertTrue(empty.hasArtifact("table:customer"));
        assertTrue(empty.hasArtifact("table:sales_order"));
        assertTrue(empty.hasArtifact("fk:fk_order_customer"));
        assertTrue(empty.hasArtifact("tracking:address"));
        assertTrue(empty.getLog().indexOf("createTable:customer") < empty.getLog().indexOf("createTable:sales_order"));
    }

    @Test
    public void testEnsureDatabaseRaisesDatabaseEvents() throws Exception {
        InMemoryDatabase empty = new InMemoryDatabase("client");
        ProvisioningEngine engine = new ProvisioningEngine(new InMemorySyncProvider(empty), this.interceptors);
        List<String> events = new ArrayList<>();
        List<ProgressArgs> progress = new ArrayList<>();

        this.interceptors.on(DatabaseProvisioningArgs.class, args -> {
            assertTrue(args.getProvision().has(SyncProvision.TABLE));
            assertFalse(empty.hasArtifact("table:customer"));
            events.add("provisioning");
        });
        this.interceptors.on(TableProvisioningArgs.class, args -> events.add(args.getTable().getTableName()));
        this.interceptors.on(DatabaseProvisionedArgs.class, args -> {
            assertTrue(empty.hasArtifact("table:sales_order"));
            events.add("provisioned");
        });

        try (Connection connection = empty.connect()) {
            engine.ensureDatabase(this.context, ProvisioningEngineTest.schema(), connection, progress::add);
        }

        assertEquals(Arrays.asList("provisioning", "customer", "address", "sales_order", "provisioned"), events);
        assertTrue(progress.get(progress.size() - 1) instanceof DatabaseProvisionedArgs);
    }

    @Test
    public void testDeleteMetadataCountsRows() throws Exception {
        try (Connection connection = this.database.connect()) {
            this.engine.provision(this.context, ProvisioningEngineTest.schema(), ProvisionFlags.all(), "scope_info", SyncSide.CLIENT, connection, null);
        }

        this.database.addTrackingRow("customer", 10L);
        this.database.addTrackingRow("customer", 20L);
        this.database.addTrackingRow("address", 30L);

        try (Connection connection = this.database.connect()) {
            assertEquals(2, this.engine.deleteMetadata(this.context, ProvisioningEngineTest.schema(), 25L, connection, null));
            assertEquals(1, this.engine.deleteMetadata(this.context, ProvisioningEngineTest.schema(), 35L, connection, null));
        }
    }
}
