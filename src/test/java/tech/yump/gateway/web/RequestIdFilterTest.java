package tech.yump.gateway.web;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    @DisplayName("Generates an id, exposes it to the chain and clears the MDC afterwards")
    void generatesRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/health");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> mdcDuringChain = new AtomicReference<>();
        FilterChain chain = (req, res) -> mdcDuringChain.set(MDC.get(RequestIdFilter.MDC_REQUEST_ID_KEY));

        filter.doFilter(request, response, chain);

        String requestId = (String) request.getAttribute(RequestIdFilter.REQUEST_ID_ATTR);
        assertThat(requestId).isNotBlank();
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo(requestId);
        assertThat(mdcDuringChain.get()).isEqualTo(requestId);
        assertThat(MDC.get(RequestIdFilter.MDC_REQUEST_ID_KEY)).isNull();
    }

    @Test
    @DisplayName("Keeps a well-formed caller id and replaces an unsafe one")
    void incomingRequestId() throws Exception {
        MockHttpServletRequest plain = new MockHttpServletRequest("GET", "/");
        plain.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "frontend-42.a_b");
        MockHttpServletResponse plainResponse = new MockHttpServletResponse();
        filter.doFilter(plain, plainResponse, (req, res) -> { });

        assertThat(plainResponse.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("frontend-42.a_b");

        MockHttpServletRequest unsafe = new MockHttpServletRequest("GET", "/");
        unsafe.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "abc\nFAKE LOG LINE");
        MockHttpServletResponse unsafeResponse = new MockHttpServletResponse();
        filter.doFilter(unsafe, unsafeResponse, (req, res) -> { });

        assertThat(unsafeResponse.getHeader(RequestIdFilter.REQUEST_ID_HEADER))
                .isNotEqualTo("abc\nFAKE LOG LINE")
                .matches("[0-9a-f-]{36}");
    }
}
