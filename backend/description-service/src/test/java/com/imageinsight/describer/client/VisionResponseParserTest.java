package com.imageinsight.describer.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VisionResponseParserTest {

    private final VisionResponseParser parser = new VisionResponseParser(new ObjectMapper());

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("Assets mean the job is complete")
        void completed() {
            VisionApiResponse response = parser.parse("""
                    {"all": {"assets": [
                        {"name": "/tmp/files/1_2504",
                         "descriptions": [{"description": "A red barn", "source": "gemini"}]}
                    ]}, "credits": 42}
                    """);

            assertThat(response.kind()).isEqualTo(VisionApiResponse.Kind.COMPLETED);
            assertThat(response.assets()).hasSize(1);
            assertThat(response.assets().get(0).returnedName()).isEqualTo("/tmp/files/1_2504");
            assertThat(response.assets().get(0).descriptions().get(0).text()).isEqualTo("A red barn");
            assertThat(response.assets().get(0).descriptions().get(0).sourceBackend()).isEqualTo("gemini");
            assertThat(response.credits()).isEqualTo(42);
        }

        @Test
        @DisplayName("Assets win over backend errors in the same body")
        void completedWithErrors() {
            VisionApiResponse response = parser.parse("""
                    {"all": {"assets": [{"name": "a", "descriptions": []}], "errors": ["claude: overloaded"]}}
                    """);

            assertThat(response.kind()).isEqualTo(VisionApiResponse.Kind.COMPLETED);
            assertThat(response.errors()).containsExactly("claude: overloaded");
        }

        @Test
        @DisplayName("response_uri means the job must be polled")
        void pendingWithUri() {
            VisionApiResponse response = parser.parse("{\"response_uri\": \"https://api.example/api/response/abc\"}");

            assertThat(response.kind()).isEqualTo(VisionApiResponse.Kind.PENDING);
            assertThat(response.hasJobHandle()).isTrue();
            assertThat(response.jobHandle()).isEqualTo("https://api.example/api/response/abc");
        }

        @Test
        @DisplayName("Queued and processing statuses are pending")
        void pendingStatus() {
            assertThat(parser.parse("{\"status\": \"queued\"}").kind()).isEqualTo(VisionApiResponse.Kind.PENDING);
            assertThat(parser.parse("{\"status\": \"processing\"}").kind()).isEqualTo(VisionApiResponse.Kind.PENDING);
            assertThat(parser.parse("{\"status\": \"processing\"}").hasJobHandle()).isFalse();
        }

        @Test
        @DisplayName("error or message field is a remote error")
        void remoteError() {
            VisionApiResponse response = parser.parse("{\"error\": \"Invalid API key\"}");

            assertThat(response.kind()).isEqualTo(VisionApiResponse.Kind.REMOTE_ERROR);
            assertThat(response.message()).isEqualTo("Invalid API key");
            assertThat(parser.parse("{\"message\": \"Out of credits\"}").message()).isEqualTo("Out of credits");
        }

        @Test
        @DisplayName("Errors without assets are backend errors")
        void backendErrors() {
            VisionApiResponse response = parser.parse("{\"all\": {\"errors\": [\"gemini: timeout\", \"quota\"]}}");

            assertThat(response.kind()).isEqualTo(VisionApiResponse.Kind.BACKEND_ERRORS);
            assertThat(response.errors()).containsExactly("gemini: timeout", "quota");
        }

        @Test
        @DisplayName("Empty asset array is EMPTY, missing shape is UNKNOWN")
        void emptyAndUnknown() {
            assertThat(parser.parse("{\"all\": {\"assets\": []}}").kind()).isEqualTo(VisionApiResponse.Kind.EMPTY);
            assertThat(parser.parse("{\"foo\": 1}").kind()).isEqualTo(VisionApiResponse.Kind.UNKNOWN);
            assertThat(parser.parse("[1, 2]").kind()).isEqualTo(VisionApiResponse.Kind.UNKNOWN);
        }

        @Test
        @DisplayName("Non-JSON body is UNKNOWN with a bounded snippet")
        void notJson() {
            String html = "<html>" + "x".repeat(500) + "</html>";

            VisionApiResponse response = parser.parse(html);

            assertThat(response.kind()).isEqualTo(VisionApiResponse.Kind.UNKNOWN);
            assertThat(response.rawSnippet()).hasSize(VisionResponseParser.SNIPPET_LENGTH).startsWith("<html>");
        }

        @Test
        @DisplayName("Alternative asset keys are accepted")
        void alternativeKeys() {
            VisionApiResponse response = parser.parse("""
                    {"all": {"assets": [{"file_name": "img-1", "descriptions": [{"text": "hello", "backend": "openai"}]}]}}
                    """);

            assertThat(response.assets().get(0).returnedName()).isEqualTo("img-1");
            assertThat(response.assets().get(0).descriptions().get(0).text()).isEqualTo("hello");
            assertThat(response.assets().get(0).descriptions().get(0).sourceBackend()).isEqualTo("openai");
        }
    }

    @Nested
    @DisplayName("extractErrorMessage")
    class ExtractErrorMessage {

        @Test
        void usesJsonErrorField() {
            assertThat(parser.extractErrorMessage(401, "{\"error\": \"Unauthorized key\"}"))
                    .isEqualTo("Unauthorized key");
        }

        @Test
        void fallsBackToStatusForJsonWithoutDetail() {
            assertThat(parser.extractErrorMessage(500, "{}")).isEqualTo("API error (500)");
        }

        @Test
        void includesSnippetForNonJson() {
            assertThat(parser.extractErrorMessage(502, "Bad Gateway")).isEqualTo("API error (502): Bad Gateway");
        }
    }
}
