package com.booking.sync.web.server;

import com.booking.sync.model.SyncContext;
import com.booking.sync.web.client.message.HttpMessageGetMoreChangesRequest;
import com.booking.sync.web.client.message.HttpMessageSendChangesRequest;
import com.booking.sync.web.client.message.HttpMessageSendChangesResponse;
import com.booking.sync.web.client.serialization.Converter;

import java.sql.Connection;

/**
 * Row level change exchange. Applies the client batch and selects the server changes inside the relay transaction.
 */
public interface ChangesHandler {

    HttpMessageSendChangesResponse applyThenGetChanges(SyncContext context, HttpMessageSendChangesRequest request, int batchSize, Converter converter, Connection connection) throws Exception;

    HttpMessageSendChangesResponse getMoreChanges(SyncContext context, HttpMessageGetMoreChangesRequest request, Converter converter) throws Exception;
}
