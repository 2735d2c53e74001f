package com.complaintportal.it;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.ActiveProfiles;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Sends real chunked bodies to a running server; MockMvc always knows the body length.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class RequestBodyLimitServerTest {

    private static final int TEN_MB = 10 * 1024 * 1024;

    @LocalServerPort int port;

    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .build();

    // Whitespace inside the object, so the whole body must be read to parse it
    private static byte[] complaintPaddedTo(int paddingBytes) {
        String json = "{\"issueType\":\"Road\",\"title\":\"Pothole on Main St\","
                + "\"description\":\"Large pothole causing traffic issues\","
                + " ".repeat(paddingBytes)
                + "\"location\":\"Main St & 5th\"}";
        return json.getBytes(StandardCharsets.UTF_8);
    }

    private HttpResponse<String> postChunked(byte[] body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + port + "/api/complaints"))
                .header("Content-Type", "application/json")
                // ofInputStream has no known length, so the client sends chunked
                .POST(HttpRequest.BodyPublishers.ofInputStream(() -> new ByteArrayInputStream(body)))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void chunkedBodyOverTenMegabytes_isRejected() throws Exception {
        HttpResponse<String> response = postChunked(complaintPaddedTo(TEN_MB + 64 * 1024));

        assertThat(response.statusCode()).isEqualTo(413);
        assertThat(response.body()).contains("Request body too large");
    }

    @Test
    void smallChunkedBody_isAccepted() throws Exception {
        HttpResponse<String> response = postChunked(complaintPaddedTo(16));

        assertThat(response.statusCode()).isEqualTo(201);
        assertThat(response.body()).contains("\"status\":\"Pending\"");
    }
}
