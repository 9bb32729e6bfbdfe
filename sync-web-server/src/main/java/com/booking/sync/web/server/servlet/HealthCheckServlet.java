package com.booking.sync.web.server.servlet;

import com.booking.sync.web.server.WebServerSessionCache;

import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;

public class HealthCheckServlet extends HttpServlet {
    private final WebServerSessionCache cache;

    public HealthCheckServlet(WebServerSessionCache cache) {
        this.cache = cache;
    }

    @Override
    protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
        response.setContentType("application/json");
        response.setStatus(HttpServletResponse.SC_OK);
        response.getWriter().println(String.format("{\"status\":\"ok\",\"sessions\":%d}", this.cache.size()));
    }
}
