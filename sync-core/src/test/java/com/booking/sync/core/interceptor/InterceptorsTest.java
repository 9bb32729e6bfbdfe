package com.booking.sync.core.interceptor;

import com.booking.sync.core.args.ConnectionOpenedArgs;
import com.booking.sync.core.args.ProgressArgs;
import com.booking.sync.core.args.TransactionOpenedArgs;
import com.booking.sync.model.SyncContext;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class InterceptorsTest {
    private final SyncContext context = new SyncContext(UUID.randomUUID(), "test");

    @Test
    public void testLastRegistrationWins() throws Exception {
        Interceptors interceptors = new Interceptors();
        List<String> calls = new ArrayList<>();

        interceptors.on(ConnectionOpenedArgs.class, args -> calls.add("first"));
        interceptors.on(ConnectionOpenedArgs.class, args -> calls.add("second"));

        interceptors.intercept(new ConnectionOpenedArgs(this.context, null));

        assertEquals(1, calls.size());
        assertEquals("second", calls.get(0));
    }

    @Test
    public void testDispatchIsByConcreteType() throws Exception {
        Interceptors interceptors = new Interceptors();
        List<ProgressArgs> received = new ArrayList<>();

        interceptors.on(TransactionOpenedArgs.class, received::add);

        interceptors.intercept(new ConnectionOpenedArgs(this.context, null));
        assertTrue(received.isEmpty());

        TransactionOpenedArgs args = new TransactionOpenedArgs(this.context, null);

        interceptors.intercept(args);
        assertEquals(1, received.size());
        assertSame(args, received.get(0));
    }

    @Test
    public void testRemove() throws Exception {
        Interceptors interceptors = new Interceptors();

        interceptors.on(ConnectionOpenedArgs.class, args -> fail("removed handler called"));
        interceptors.remove(ConnectionOpenedArgs.class);

        assertFalse(interceptors.has(ConnectionOpenedArgs.class));

        interceptors.intercept(new ConnectionOpenedArgs(this.context, null));
    }

    @Test
    public void testHandlerFailurePropagates() {
        Interceptors interceptors = new Interceptors();

        interceptors.on(ConnectionOpenedArgs.class, args -> {
            throw new IllegalStateException("abort");
        });

        try {
            interceptors.intercept(new ConnectionOpenedArgs(this.context, null));
            fail("handler failure swallowed");
        } catch (Exception exception) {
            assertEquals("abort", exception.getMessage());
        }
    }

    @Test
    public void testInterruptCancelsDispatch() {
        Interceptors interceptors = new Interceptors();

        Thread.currentThread().interrupt();

        try {
            interceptors.intercept(new ConnectionOpenedArgs(this.context, null));
            fail("interrupt ignored");
        } catch (Exception exception) {
            assertTrue(exception instanceof InterruptedException);
        } finally {
            Thread.interrupted();
        }
    }
}
