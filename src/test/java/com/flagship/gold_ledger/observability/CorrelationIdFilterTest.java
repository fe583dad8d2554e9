package com.flagship.gold_ledger.observability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    @DisplayName("Correlation id and caller are in MDC during the request and gone after")
    void testMdcDuringRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/orders/TX-1/execute");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "corr-42");
        request.addHeader(CorrelationContext.CALLER_HEADER, "0xplatform");
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();

        filter.doFilter(request, response, (req, res) -> {
            seen.put("correlationId", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
            seen.put("caller", MDC.get(CorrelationContext.CALLER_MDC_KEY));
            MDC.put(CorrelationContext.TX_REF_MDC_KEY, "TX-1");
        });

        assertEquals("corr-42", seen.get("correlationId"));
        assertEquals("0xplatform", seen.get("caller"));
        assertEquals("corr-42", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        for (String key : CorrelationContext.REQUEST_MDC_KEYS) {
            assertNull(MDC.get(key), key);
        }
    }

    @Test
    @DisplayName("Missing headers get a generated correlation id and no caller")
    void testGeneratedCorrelationId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/assets/1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();

        filter.doFilter(request, response, (req, res) ->
            seen.put("caller", MDC.get(CorrelationContext.CALLER_MDC_KEY)));

        assertNull(seen.get("caller"));
        assertEquals(8, response.getHeader(CorrelationContext.CORRELATION_ID_HEADER).length());
    }
}
