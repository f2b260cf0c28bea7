package me.internalizable.platesight.recognizer;

import me.internalizable.platesight.dto.DashScopeRequest;
import me.internalizable.platesight.dto.DashScopeResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.UnknownContentTypeException;

import java.time.Clock;
import java.util.Base64;

/**
 * Recognizer backed by the Qwen-VL multimodal model on DashScope.
 *
 * Failure tagging:
 * - network errors and 5xx answers are retryable connection failures
 * - other HTTP errors are terminal connection failures
 * - an unreadable body is a terminal invalid response, an empty answer a retryable one
 * - an answer without a JSON object is a terminal parse error
 */
public class DashScopeRecognizer implements Recognizer {

    private static final Logger logger = LoggerFactory.getLogger(DashScopeRecognizer.class);

    static final String RECOGNITION_PROMPT = """
            Read the Japanese license plate in this image.
            Answer with JSON in exactly this shape:

            {
              "detected": true/false,
              "region": "region name (e.g. 品川)",
              "classificationNumber": "classification number (e.g. 330)",
              "hiragana": "hiragana character (e.g. あ)",
              "serialNumber": "serial number (e.g. 12-34)",
              "plateType": "REGULAR/LIGHT/COMMERCIAL/RENTAL/DIPLOMATIC",
              "confidence": number from 0 to 100
            }

            If no license plate can be found, answer {"detected": false}.
            Answer with the JSON only and no other text.
            """;

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G'};

    private final RestClient dashScopeRestClient;
    private final PlateResponseParser parser;
    private final String model;
    private final boolean configured;
    private final Clock clock;

    public DashScopeRecognizer(RestClient dashScopeRestClient,
                               PlateResponseParser parser,
                               String model,
                               boolean configured,
                               Clock clock) {
        this.dashScopeRestClient = dashScopeRestClient;
        this.parser = parser;
        this.model = model;
        this.configured = configured;
        this.clock = clock;
        if (!configured) {
            logger.warn("DashScope API key is not set, every recognition will fail until it is configured");
        }
    }

    @Override
    public RecognizerResponse recognize(byte[] imageBytes) {
        if (!configured) {
            throw RecognitionException.terminal(RecognitionErrorKind.API_CONNECTION_FAILED,
                    "Recognition service is not configured");
        }

        DashScopeRequest request = DashScopeRequest.forPlateImage(model, toDataUrl(imageBytes), RECOGNITION_PROMPT);
        DashScopeResponse response = callDashScopeApi(request);

        String rawText = response != null ? response.getText() : null;
        if (rawText == null || rawText.isBlank()) {
            throw RecognitionException.retryable(RecognitionErrorKind.INVALID_RESPONSE, "Recognizer returned an empty answer");
        }

        RecognizerResponse result = parser.parse(rawText, clock.instant());
        logger.debug("DashScope answered (plate detected: {}, confidence: {})", result.hasPlate(), result.confidence());
        return result;
    }

    private DashScopeResponse callDashScopeApi(DashScopeRequest request) {
        try {
            return dashScopeRestClient.post()
                    .body(request)
                    .retrieve()
                    .body(DashScopeResponse.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            throw new RecognitionException(RecognitionErrorKind.API_CONNECTION_FAILED,
                    "Recognition service answered " + status, status >= 500, e);
        } catch (ResourceAccessException e) {
            throw new RecognitionException(RecognitionErrorKind.API_CONNECTION_FAILED,
                    "Could not reach recognition service: " + e.getMessage(), true, e);
        } catch (RestClientException e) {
            if (e.getCause() instanceof HttpMessageNotReadableException || e instanceof UnknownContentTypeException) {
                throw new RecognitionException(RecognitionErrorKind.INVALID_RESPONSE,
                        "Recognition service returned an unreadable body", false, e);
            }
            throw new RecognitionException(RecognitionErrorKind.API_CONNECTION_FAILED,
                    "Recognition call failed: " + e.getMessage(), true, e);
        }
    }

    static String toDataUrl(byte[] imageBytes) {
        String mediaType = startsWith(imageBytes, PNG_SIGNATURE) ? "image/png" : "image/jpeg";
        return "data:" + mediaType + ";base64," + Base64.getEncoder().encodeToString(imageBytes);
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) return false;
        }
        return true;
    }
}
