package com.flagship.finance_ledger.observability;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    void propagatesIncomingCorrelationIdAndOrganization() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/period-locks/lock");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "abc12345");
        request.addHeader("X-Organization-Id", "org-1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> correlationSeen = new AtomicReference<>();
        AtomicReference<String> organizationSeen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> {
            correlationSeen.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
            organizationSeen.set(MDC.get(CorrelationContext.ORGANIZATION_ID_MDC_KEY));
        });

        assertEquals("abc12345", correlationSeen.get());
        assertEquals("org-1", organizationSeen.get());
        assertEquals("abc12345", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.ORGANIZATION_ID_MDC_KEY));
    }

    @Test
    void generatesCorrelationIdWhenMissing() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/journal-entries");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        String generated = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertEquals(8, generated.length());
    }

    @Test
    void skipsActuatorEndpoints() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        assertNull(response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
    }
}
