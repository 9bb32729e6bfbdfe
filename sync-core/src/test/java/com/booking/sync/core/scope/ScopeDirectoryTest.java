package com.booking.sync.core.scope;

import com.booking.sync.core.args.ScopeLoadedArgs;
import com.booking.sync.core.args.ScopeSavedArgs;
import com.booking.sync.core.interceptor.Interceptors;
import com.booking.sync.core.memory.InMemoryDatabase;
import com.booking.sync.core.memory.InMemoryScopeInfoBuilder;
import com.booking.sync.core.memory.InMemorySyncProvider;
import com.booking.sync.model.SyncContext;
import com.booking.sync.model.scope.AbstractScopeInfo;
import com.booking.sync.model.scope.ScopeInfo;
import com.booking.sync.model.scope.ScopeInfoTableType;
import com.booking.sync.model.scope.ServerHistoryScopeInfo;
import com.booking.sync.model.scope.ServerScopeInfo;

import org.junit.Before;
import org.junit.Test;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class ScopeDirectoryTest {
    private static final String TABLE = "scope_info";

    private InMemoryDatabase database;
    private Interceptors interceptors;
    private ScopeDirectory directory;
    private SyncContext context;

    @Before
    public void before() {
        this.database = new InMemoryDatabase("scopes");
        this.interceptors = new Interceptors();
        this.directory = new ScopeDirectory(new InMemorySyncProvider(this.database), this.interceptors);
        this.context = new SyncContext(UUID.randomUUID(), "default");
    }

    @Test
    public void testMissingScopeIsSynthesizedAndStored() throws Exception {
        List<AbstractScopeInfo> loaded = new ArrayList<>();

        this.interceptors.on(ScopeLoadedArgs.class, args -> loaded.add(args.getScope()));

        ServerScopeInfo first;
        ServerScopeInfo second;

        try (Connection connection = this.database.connect()) {
            this.directory.ensureScope(ScopeInfoTableType.SERVER, ScopeDirectoryTest.TABLE, connection);

            first = this.directory.getServerScope(this.context, ScopeDirectoryTest.TABLE, "default", connection, null);
            second = this.directory.getServerScope(this.context, ScopeDirectoryTest.TABLE, "default", connection, null);
        }

        assertNotNull(first.getId());
        assertTrue(first.isNewScope());
        assertEquals("default", first.getName());
        assertEquals(first.getId(), second.getId());
        assertTrue(second.isNewScope());
        assertEquals(2, loaded.size());
        assertEquals(1, this.database.countScopes(InMemoryScopeInfoBuilder.tableName(ScopeDirectoryTest.TABLE, ScopeInfoTableType.SERVER)));
    }

    @Test
    public void testWrittenScopeIsReadBack() throws Exception {
        List<AbstractScopeInfo> saved = new ArrayList<>();

        this.interceptors.on(ScopeSavedArgs.class, args -> saved.add(args.getScope()));

        try (Connection connection = this.database.connect()) {
            this.directory.ensureScope(ScopeInfoTableType.CLIENT, ScopeDirectoryTest.TABLE, connection);

            ScopeInfo scope = this.directory.getClientScope(this.context, ScopeDirectoryTest.TABLE, "default", connection, null);

            scope.setLastSync(1000L);
            scope.setLastServerSyncTimestamp(42L);

            this.directory.writeClientScope(this.context, ScopeDirectoryTest.TABLE, scope, connection, null);

            ScopeInfo reloaded = this.directory.getClientScope(this.context, ScopeDirectoryTest.TABLE, "default", connection, null);

            assertEquals(scope.getId(), reloaded.getId());
            assertFalse(reloaded.isNewScope());
            assertEquals(42L, reloaded.getLastServerSyncTimestamp());
        }

        assertEquals(1, saved.size());
    }

    @Test
    public void testHistoryKeepsEveryRecord() throws Exception {
        try (Connection connection = this.database.connect()) {
            this.directory.ensureScope(ScopeInfoTableType.SERVER_HISTORY, ScopeDirectoryTest.TABLE, connection);

            for (int index = 0; index < 3; index++) {
                ServerHistoryScopeInfo scope = new ServerHistoryScopeInfo(UUID.randomUUID(), "default");

                scope.setLastSync(System.currentTimeMillis());

                this.directory.writeServerHistoryScope(this.context, ScopeDirectoryTest.TABLE, scope, connection, null);
            }

            this.directory.writeServerHistoryScope(this.context, ScopeDirectoryTest.TABLE, new ServerHistoryScopeInfo(UUID.randomUUID(), "other"), connection, null);

            assertEquals(3, this.directory.getServerHistoryScopes(this.context, ScopeDirectoryTest.TABLE, "default", connection, null).size());
        }
    }

    @Test
    public void testEmptyHistoryGetsOneStoredRecord() throws Exception {
        List<AbstractScopeInfo> saved = new ArrayList<>();

        this.interceptors.on(ScopeSavedArgs.class, args -> saved.add(args.getScope()));

        try (Connection connection = this.database.connect()) {
            this.directory.ensureScope(ScopeInfoTableType.SERVER_HISTORY, ScopeDirectoryTest.TABLE, connection);

            List<ServerHistoryScopeInfo> history = this.directory.getServerHistoryScopes(this.context, ScopeDirectoryTest.TABLE, "default", connection, null);

            assertEquals(1, history.size());
            assertTrue(history.get(0).isNewScope());
            assertEquals(1, this.directory.getServerHistoryScopes(this.context, ScopeDirectoryTest.TABLE, "default", connection, null).size());
        }

        assertTrue(saved.isEmpty());
        assertEquals(1, this.database.countScopes(InMemoryScopeInfoBuilder.tableName(ScopeDirectoryTest.TABLE, ScopeInfoTableType.SERVER_HISTORY)));
    }

    @Test
    public void testEnsureScopeIsIdempotent() throws Exception {
        try (Connection connection = this.database.connect()) {
            this.directory.ensureScope(ScopeInfoTableType.CLIENT, ScopeDirectoryTest.TABLE, connection);

            ScopeInfo scope = new ScopeInfo(UUID.randomUUID(), "default");

            this.directory.writeClientScope(this.context, ScopeDirectoryTest.TABLE, scope, connection, null);
            this.directory.ensureScope(ScopeInfoTableType.CLIENT, ScopeDirectoryTest.TABLE, connection);
        }

        assertEquals(1, this.database.countScopes(InMemoryScopeInfoBuilder.tableName(ScopeDirectoryTest.TABLE, ScopeInfoTableType.CLIENT)));
    }
}
