package org.csits.butler.server.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class GeneratedImageFetcherTest {

    private final RestTemplate restTemplate = new RestTemplate();
    private final MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
    private final GeneratedImageFetcher fetcher = new GeneratedImageFetcher(restTemplate);

    @Test
    void fetch_returnsBody() throws IOException {
        server.expect(requestTo("https://cdn.example.com/a.jpg"))
            .andRespond(withSuccess(new byte[] {1, 2}, MediaType.IMAGE_JPEG));

        assertThat(fetcher.fetch("https://cdn.example.com/a.jpg")).containsExactly(1, 2);
    }

    @Test
    void fetch_httpErrorBecomesIOException() {
        server.expect(requestTo("https://cdn.example.com/missing.jpg"))
            .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> fetcher.fetch("https://cdn.example.com/missing.jpg"))
            .isInstanceOf(IOException.class);
    }
}
