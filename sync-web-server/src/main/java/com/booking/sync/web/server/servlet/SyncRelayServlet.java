package com.booking.sync.web.server.servlet;

import com.booking.sync.web.server.WebProxyServerOrchestrator;

import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

public class SyncRelayServlet extends HttpServlet {
    private final WebProxyServerOrchestrator relay;

    public SyncRelayServlet(WebProxyServerOrchestrator relay) {
        this.relay = relay;
    }

    @Override
    protected void doPost(HttpServletRequest request, HttpServletResponse response) {
        this.relay.handleRequest(request, response);
    }
}
