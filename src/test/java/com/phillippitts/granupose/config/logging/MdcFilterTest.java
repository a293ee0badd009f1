package com.phillippitts.granupose.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.matches;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private static final String UUID_PATTERN = "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}";

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        filter = new MdcFilter();
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void propagatesRequestIdFromHeaderAndEchoesIt() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/channels");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isEqualTo("req-123");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(response).setHeader(MdcFilter.REQUEST_ID_HEADER, "req-123");
        verify(chain).doFilter(request, response);
    }

    @Test
    void generatesUuidWhenHeaderMissingOrBlank() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("   ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/health");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).matches(UUID_PATTERN);
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(response).setHeader(eq(MdcFilter.REQUEST_ID_HEADER), matches(UUID_PATTERN));
    }

    @Test
    void setsClientIdOnlyWhenPresent() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-1");
        when(request.getHeader(MdcFilter.CLIENT_ID_HEADER)).thenReturn("pose-controller-a");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/osc");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("clientId")).isEqualTo("pose-controller-a");
            assertThat(ThreadContext.get("method")).isEqualTo("POST");
            assertThat(ThreadContext.get("uri")).isEqualTo("/api/osc");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void blankClientIdIsIgnored() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-1");
        when(request.getHeader(MdcFilter.CLIENT_ID_HEADER)).thenReturn("  ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/config");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("clientId")).isNull();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);
    }

    @Test
    void clearsContextEvenWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader(MdcFilter.REQUEST_ID_HEADER)).thenReturn("req-123");
        when(request.getMethod()).thenReturn("POST");
        when(request.getRequestURI()).thenReturn("/api/engine/start");

        doThrow(new ServletException("Test exception")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(ServletException.class)
                .hasMessage("Test exception");

        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("method")).isNull();
        assertThat(ThreadContext.get("uri")).isNull();
    }

    @Test
    void passesNonHttpRequestsThrough() throws ServletException, IOException {
        ServletRequest plain = mock(ServletRequest.class);
        HttpServletResponse plainResponse = mock(HttpServletResponse.class);

        filter.doFilter(plain, plainResponse, chain);

        verify(chain).doFilter(plain, plainResponse);
        assertThat(ThreadContext.get("requestId")).isNull();
    }
}
