package com.example.pdfstamp.security;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

public class ApiKeyFilterTest {

    private static MockHttpServletRequest request(String path) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", path);
        request.setServletPath(path);
        request.setRemoteAddr("10.0.0.7");
        return request;
    }

    @Test
    public void testHeaderKeyAccepted() throws Exception {
        MockHttpServletRequest request = request("/generate-merged-pdf");
        request.addHeader("X-API-KEY", "secret");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        new ApiKeyFilter("secret").doFilter(request, response, chain);

        assertNotNull(chain.getRequest());
        assertEquals(200, response.getStatus());
    }

    @Test
    public void testBearerTokenAccepted() throws Exception {
        MockHttpServletRequest request = request("/generate-merged-pdf");
        request.addHeader("Authorization", "Bearer secret");
        MockFilterChain chain = new MockFilterChain();

        new ApiKeyFilter("secret").doFilter(request, new MockHttpServletResponse(), chain);

        assertNotNull(chain.getRequest());
    }

    @Test
    public void testWrongKeyRejected() throws Exception {
        MockHttpServletRequest request = request("/generate-merged-pdf");
        request.addHeader("X-API-KEY", "guess");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        new ApiKeyFilter("secret").doFilter(request, response, chain);

        assertNull(chain.getRequest());
        assertEquals(401, response.getStatus());
        assertEquals("{\"error\":\"Unauthorized\"}", response.getContentAsString());
    }

    @Test
    public void testMissingKeyRejected() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        new ApiKeyFilter("secret").doFilter(request("/contracts/K1/latest"), response, new MockFilterChain());

        assertEquals(401, response.getStatus());
    }

    @Test
    public void testUnconfiguredKeyIsServerError() throws Exception {
        MockHttpServletRequest request = request("/generate-merged-pdf");
        request.addHeader("X-API-KEY", "anything");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        new ApiKeyFilter("").doFilter(request, response, chain);

        assertNull(chain.getRequest());
        assertEquals(500, response.getStatus());
        assertEquals("{\"error\":\"Server configuration error\"}", response.getContentAsString());
    }

    @Test
    public void testHealthIsOpen() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        new ApiKeyFilter("secret").doFilter(request("/health"), new MockHttpServletResponse(), chain);

        assertNotNull(chain.getRequest());
    }
}
