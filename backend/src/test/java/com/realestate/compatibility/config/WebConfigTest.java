package com.realestate.compatibility.config;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.filter.CorsFilter;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WebConfigTest {

    private static CorsFilter filter(String origins) {
        WebConfig config = new WebConfig();
        ReflectionTestUtils.setField(config, "allowedOrigins", origins);
        return config.corsFilter();
    }

    private static MockHttpServletResponse preflight(CorsFilter filter, String path, String method) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("OPTIONS", path);
        request.addHeader(HttpHeaders.ORIGIN, "https://planning.example.org");
        request.addHeader(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, method);
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }

    @Test
    void auditEndpointsAcceptPost() throws Exception {
        MockHttpServletResponse response = preflight(filter("*"), "/api/compatibility/audit", "POST");

        assertEquals(200, response.getStatus());
        assertEquals("https://planning.example.org", response.getHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN));
    }

    @Test
    void runLogRejectsPost() throws Exception {
        MockHttpServletResponse response = preflight(filter("*"), "/api/runs", "POST");

        assertEquals(403, response.getStatus());
    }

    @Test
    void explicitOriginsAreTrimmed() {
        WebConfig config = new WebConfig();
        ReflectionTestUtils.setField(config, "allowedOrigins", "https://a.example.org, https://b.example.org,");

        CorsConfiguration cors = config.baseConfiguration(List.of("GET"));

        assertEquals(List.of("https://a.example.org", "https://b.example.org"), cors.getAllowedOrigins());
        assertEquals(List.of("GET"), cors.getAllowedMethods());
    }
}
