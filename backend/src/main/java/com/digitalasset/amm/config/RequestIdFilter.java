// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.config;

import com.digitalasset.amm.constants.SwapConstants;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Request ID filter - generates/extracts X-Request-ID for correlation.
 *
 * - Extracts X-Request-ID from request header (if present)
 * - Generates UUID if missing
 * - Adds request id and calling party to MDC for correlated logging
 * - Returns in response header
 */
@Component
@Order(1)
public class RequestIdFilter implements Filter {

    public static final String MDC_KEY = "requestId";
    private static final String MDC_PARTY_KEY = "party";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest req = (HttpServletRequest) request;
        HttpServletResponse res = (HttpServletResponse) response;

        String requestId = req.getHeader(SwapConstants.REQUEST_ID_HEADER);
        if (requestId == null || requestId.trim().isEmpty()) {
            requestId = UUID.randomUUID().toString();
        }

        MDC.put(MDC_KEY, requestId);
        String party = req.getHeader(SwapConstants.PARTY_HEADER);
        if (party != null && !party.isBlank()) {
            MDC.put(MDC_PARTY_KEY, party);
        }

        try {
            res.setHeader(SwapConstants.REQUEST_ID_HEADER, requestId);
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
            MDC.remove(MDC_PARTY_KEY);
        }
    }
}
