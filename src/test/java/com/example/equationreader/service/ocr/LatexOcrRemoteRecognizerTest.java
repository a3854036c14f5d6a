package com.example.equationreader.service.ocr;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LatexOcrRemoteRecognizerTest {

    private MockRestServiceServer server;
    private LatexOcrRemoteRecognizer recognizer;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri("http://ocr.test").build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        recognizer = new LatexOcrRemoteRecognizer(restTemplate, new ObjectMapper());
    }

    @Test
    void shouldCheckServerOnLoad() {
        server.expect(requestTo("http://ocr.test/"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("\"welcome\"", MediaType.APPLICATION_JSON));

        recognizer.load();

        server.verify();
    }

    @Test
    void shouldFailLoadWhenServerIsDown() {
        server.expect(requestTo("http://ocr.test/")).andRespond(withServerError());

        assertThatThrownBy(recognizer::load).isInstanceOf(RestClientException.class);
    }

    @Test
    void shouldPostImageAsMultipartAndDecodeJsonString() {
        server.expect(requestTo("http://ocr.test/predict/"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.CONTENT_TYPE, startsWith("multipart/form-data")))
                .andRespond(withSuccess("\"\\\\frac{1}{2}x\"", MediaType.APPLICATION_JSON));

        String markup = recognizer.recognize(new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB));

        assertThat(markup).isEqualTo("\\frac{1}{2}x");
        server.verify();
    }

    @Test
    void shouldDecodeResponses() {
        assertThat(recognizer.decode(null)).isEmpty();
        assertThat(recognizer.decode(" x^2 ")).isEqualTo("x^2");
        assertThat(recognizer.decode("\"a\\\\,b\"")).isEqualTo("a\\,b");
        assertThatThrownBy(() -> recognizer.decode("\"unterminated"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldReportEngineName() {
        assertThat(recognizer.engineName()).isEqualTo("latex-ocr");
    }
}
