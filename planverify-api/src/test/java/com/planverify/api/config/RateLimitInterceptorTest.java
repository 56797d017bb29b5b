package com.planverify.api.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Rate limiting per client address and endpoint class.
 */
class RateLimitInterceptorTest {

    private final RateLimitConfig config = new RateLimitConfig(2, 3, 5);
    private final RateLimitInterceptor interceptor = new RateLimitInterceptor(config);

    @Test
    void verificationSubmissionsAreLimitedPerAddress() throws Exception {
        assertThat(handle("POST", "/api/v1/verify", "10.0.0.1").getStatus()).isEqualTo(200);
        assertThat(handle("POST", "/api/v1/verify", "10.0.0.1").getStatus()).isEqualTo(200);

        MockHttpServletResponse rejected = handle("POST", "/api/v1/verify", "10.0.0.1");
        assertThat(rejected.getStatus()).isEqualTo(429);
        assertThat(rejected.getHeader("X-Rate-Limit-Retry-After-Seconds")).isNotNull();
        assertThat(rejected.getContentAsString()).contains("RATE_001");

        assertThat(handle("POST", "/api/v1/verify", "10.0.0.2").getStatus()).isEqualTo(200);
    }

    @Test
    void votesAndReadsUseSeparateBuckets() throws Exception {
        for (int i = 0; i < 2; i++) {
            handle("POST", "/api/v1/verify", "10.0.1.1");
        }
        assertThat(handle("POST", "/api/v1/verify", "10.0.1.1").getStatus()).isEqualTo(429);

        for (int i = 0; i < 3; i++) {
            assertThat(handle("POST", "/api/v1/verify/4f1c2b7e-0000-0000-0000-000000000001/vote", "10.0.1.1").getStatus())
                    .isEqualTo(200);
        }
        assertThat(handle("POST", "/api/v1/verify/4f1c2b7e-0000-0000-0000-000000000001/vote", "10.0.1.1").getStatus())
                .isEqualTo(429);

        MockHttpServletResponse read = handle("GET", "/api/v1/verify/stats", "10.0.1.1");
        assertThat(read.getStatus()).isEqualTo(200);
        assertThat(read.getHeader("X-Rate-Limit-Remaining")).isEqualTo("4");
    }

    @Test
    void clearingBucketsRestoresCapacity() throws Exception {
        handle("POST", "/api/v1/verify", "10.0.2.1");
        handle("POST", "/api/v1/verify", "10.0.2.1");
        assertThat(handle("POST", "/api/v1/verify", "10.0.2.1").getStatus()).isEqualTo(429);

        config.clearBucket("10.0.2.1");

        assertThat(handle("POST", "/api/v1/verify", "10.0.2.1").getStatus()).isEqualTo(200);
    }

    @Test
    void forwardedHeaderDoesNotSplitBuckets() throws Exception {
        MockHttpServletResponse last = null;
        for (int i = 0; i < 3; i++) {
            MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/verify");
            request.setRemoteAddr("10.9.9.9");
            request.addHeader("X-Forwarded-For", "198.51.100." + i);
            last = new MockHttpServletResponse();
            interceptor.preHandle(request, last, new Object());
        }
        assertThat(last.getStatus()).isEqualTo(429);
    }

    private MockHttpServletResponse handle(String method, String uri, String remoteAddr) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest(method, uri);
        request.setRemoteAddr(remoteAddr);
        MockHttpServletResponse response = new MockHttpServletResponse();
        boolean allowed = interceptor.preHandle(request, response, new Object());
        assertThat(allowed).isEqualTo(response.getStatus() != 429);
        return response;
    }
}
